package org.stereodsm.tiling;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.Assert;
import org.junit.Test;

public class TilingOperationsTest
{
	private static final double EPSILON = 1e-10;

	@Test
	public void testGrid()
	{
		final TilingGrid grid = TilingOperations.grid( 0, 0, 10, 7, 4, 4 );
		Assert.assertEquals( 3, grid.numVertexRows() );
		Assert.assertEquals( 4, grid.numVertexCols() );
		Assert.assertEquals( 2, grid.numRows() );
		Assert.assertEquals( 3, grid.numCols() );

		// last column and row are shrunk to the region
		Assert.assertEquals( 8, grid.getX( 0, 2 ), EPSILON );
		Assert.assertEquals( 10, grid.getX( 0, 3 ), EPSILON );
		Assert.assertEquals( 7, grid.getY( 2, 0 ), EPSILON );
		Assert.assertEquals( new Box( 8, 4, 10, 7 ), grid.getCell( 1, 2 ) );
		Assert.assertEquals( new Box( 0, 0, 10, 7 ), grid.getBounds() );
	}

	@Test
	public void testSplitEnumerationOrder()
	{
		final List< Box > regions = TilingOperations.split( 0, 0, 4, 6, 2, 3 );
		Assert.assertEquals( Arrays.asList(
				new Box( 0, 0, 2, 3 ),
				new Box( 0, 3, 2, 6 ),
				new Box( 2, 0, 4, 3 ),
				new Box( 2, 3, 4, 6 ) ),
			regions );
	}

	@Test
	public void testSplitCoversRegion()
	{
		final Random rnd = new Random( 42 );
		for ( int t = 0; t < 20; ++t )
		{
			final double xmin = rnd.nextDouble() * 100, ymin = rnd.nextDouble() * 100;
			final double xmax = xmin + 1 + rnd.nextDouble() * 50, ymax = ymin + 1 + rnd.nextDouble() * 50;
			final double s = 1 + rnd.nextDouble() * 10;
			final List< Box > regions = TilingOperations.split( xmin, ymin, xmax, ymax, s, s );

			double area = 0;
			for ( final Box region : regions )
			{
				Assert.assertFalse( region.isEmpty() );
				area += region.getWidth() * region.getHeight();
			}
			Assert.assertEquals( ( xmax - xmin ) * ( ymax - ymin ), area, 1e-6 );

			// interior points belong to exactly one region
			for ( int p = 0; p < 50; ++p )
			{
				final double x = xmin + rnd.nextDouble() * ( xmax - xmin ), y = ymin + rnd.nextDouble() * ( ymax - ymin );
				int count = 0;
				for ( final Box region : regions )
					if ( x > region.getXMin() && x < region.getXMax() && y > region.getYMin() && y < region.getYMax() )
						++count;
				Assert.assertTrue( count <= 1 );
			}
			Assert.assertEquals( TilingOperations.union( regions ), new Box( xmin, ymin, xmax, ymax ) );
		}
	}

	@Test( expected = IllegalArgumentException.class )
	public void testSplitNonPositive()
	{
		TilingOperations.split( 0, 0, 10, 10, 0, 1 );
	}

	@Test
	public void testCrop()
	{
		final Box bounding = new Box( 0, 0, 10, 10 );
		Assert.assertEquals( new Box( 2, 0, 10, 5 ), TilingOperations.crop( new Box( 2, -3, 15, 5 ), bounding ) );
		Assert.assertEquals( new Box( 2, 3, 4, 5 ), TilingOperations.crop( new Box( 2, 3, 4, 5 ), bounding ) );

		final Random rnd = new Random( 7 );
		for ( int t = 0; t < 100; ++t )
		{
			final double xmin = 11 + rnd.nextDouble() * 100, ymin = rnd.nextDouble() * 100 - 50;
			Assert.assertTrue( TilingOperations.isEmpty( TilingOperations.crop( new Box( xmin, ymin, xmin + rnd.nextDouble() * 10, ymin + 20 ), bounding ) ) );
			Assert.assertTrue( TilingOperations.isEmpty( TilingOperations.crop( new Box( -xmin - 10, ymin, -xmin, ymin + 20 ), bounding ) ) );
		}
	}

	@Test
	public void testPad()
	{
		final Box box = new Box( 1, 2, 3, 4 );
		Assert.assertEquals( box, TilingOperations.pad( box, new double[] { 0, 0, 0, 0 } ) );
		Assert.assertEquals( new Box( 0, 0, 6, 8 ), TilingOperations.pad( box, new double[] { 1, 2, 3, 4 } ) );
	}

	@Test
	public void testEmpty()
	{
		Assert.assertTrue( TilingOperations.isEmpty( new Box( 0, 0, 0, 5 ) ) );
		Assert.assertTrue( TilingOperations.isEmpty( new Box( 0, 5, 3, 5 ) ) );
		Assert.assertTrue( TilingOperations.isEmpty( new Box( 4, 0, 3, 5 ) ) );
		Assert.assertFalse( TilingOperations.isEmpty( new Box( 0, 0, 1, 1 ) ) );
	}

	@Test
	public void testUnion()
	{
		Assert.assertEquals(
				new Box( -1, 0, 5, 7 ),
				TilingOperations.union( Arrays.asList( new Box( 0, 0, 5, 2 ), new Box( -1, 3, 1, 7 ) ) ) );
	}

	@Test( expected = EmptyInputException.class )
	public void testUnionOfNothing()
	{
		TilingOperations.union( Collections.< Box >emptyList() );
	}

	@Test
	public void testListTilesWithoutMargin()
	{
		final Box largest = new Box( 0, 0, 10, 10 );
		final List< IndexedTile > tiles = TilingOperations.listTiles( new Box( 3, 1, 6, 4 ), largest, 5, 0 );
		Assert.assertEquals( Arrays.asList(
				new IndexedTile( 0, 0, new Box( 0, 0, 5, 5 ) ),
				new IndexedTile( 1, 0, new Box( 5, 0, 10, 5 ) ) ),
			tiles );
	}

	@Test
	public void testListTilesCroppedAndDiscarded()
	{
		final Box largest = new Box( 0, 0, 7, 7 );
		final List< IndexedTile > tiles = TilingOperations.listTiles( new Box( 0, 0, 7, 7 ), largest, 5 );

		// margin 1 adds tiles -1 and 2 which are outside of the largest region
		final Set< String > indices = new HashSet<>();
		for ( final IndexedTile tile : tiles )
		{
			indices.add( tile.getIdx() + "," + tile.getIdy() );
			Assert.assertFalse( tile.getTile().isEmpty() );
		}
		Assert.assertEquals( new HashSet<>( Arrays.asList( "0,0", "0,1", "1,0", "1,1" ) ), indices );
		Assert.assertTrue( tiles.contains( new IndexedTile( 1, 1, new Box( 5, 5, 7, 7 ) ) ) );
	}

	@Test
	public void testListTilesMarginGrows()
	{
		final Box largest = new Box( 0, 0, 100, 100 );
		final Random rnd = new Random( 3 );
		for ( int t = 0; t < 50; ++t )
		{
			final double xmin = rnd.nextDouble() * 90, ymin = rnd.nextDouble() * 90;
			final Box region = new Box( xmin, ymin, xmin + 1 + rnd.nextDouble() * 9, ymin + 1 + rnd.nextDouble() * 9 );

			final List< IndexedTile > noMargin = TilingOperations.listTiles( region, largest, 8, 0 );
			for ( final IndexedTile tile : noMargin )
				Assert.assertFalse( TilingOperations.crop( region, tile.getTile() ).isEmpty() );

			List< IndexedTile > previous = noMargin;
			for ( int margin = 1; margin <= 3; ++margin )
			{
				final List< IndexedTile > current = TilingOperations.listTiles( region, largest, 8, margin );
				Assert.assertTrue( current.containsAll( previous ) );
				Assert.assertTrue( current.size() >= previous.size() );
				previous = current;
			}
		}
	}

	@Test
	public void testListTilesFloorTieBreak()
	{
		final Box largest = new Box( 0, 0, 4, 4 );
		for ( int run = 0; run < 5; ++run )
		{
			final List< IndexedTile > tiles = TilingOperations.listTiles( new Box( 1, 1, 2, 2 ), largest, 2, 0 );
			Assert.assertEquals( Collections.singletonList( new IndexedTile( 0, 0, new Box( 0, 0, 2, 2 ) ) ), tiles );
		}
	}

	@Test
	public void testRoiToStartAndSize()
	{
		final RasterWindow window = TilingOperations.roiToStartAndSize( new Box( 10, 20, 15, 32 ), 0.5 );
		Assert.assertEquals( 10, window.getXStart(), EPSILON );
		Assert.assertEquals( 32, window.getYStart(), EPSILON );
		Assert.assertEquals( 10, window.getXSize() );
		Assert.assertEquals( 24, window.getYSize() );

		// half to even
		Assert.assertEquals( 2, TilingOperations.roiToStartAndSize( new Box( 0, 0, 2.5, 3.5 ), 1 ).getXSize() );
		Assert.assertEquals( 4, TilingOperations.roiToStartAndSize( new Box( 0, 0, 2.5, 3.5 ), 1 ).getYSize() );
	}

	@Test
	public void testSnapToGrid()
	{
		Assert.assertEquals( new Box( 0.5, -1, 3, 2.5 ), TilingOperations.snapToGrid( 0.7, -0.9, 2.6, 2.1, 0.5 ) );
		Assert.assertEquals( new Box( 1, 2, 3, 4 ), TilingOperations.snapToGrid( 1, 2, 3, 4, 1 ) );
	}

	@Test
	public void testRegionHashString()
	{
		Assert.assertEquals( "0.0_1.5_10.0_20.25", TilingOperations.regionHashString( new Box( 0, 1.5, 10, 20.25 ) ) );

		final List< String > keys = new ArrayList<>();
		for ( final Box region : TilingOperations.split( 0, 0, 10, 10, 5, 5 ) )
			keys.add( TilingOperations.regionHashString( region ) );
		Assert.assertEquals( keys.size(), new HashSet<>( keys ).size() );
	}
}
