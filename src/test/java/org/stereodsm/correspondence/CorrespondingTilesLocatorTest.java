package org.stereodsm.correspondence;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Test;
import org.stereodsm.data.TiledDataset;
import org.stereodsm.tiling.Box;
import org.stereodsm.tiling.TilingGrid;
import org.stereodsm.tiling.TilingOperations;

public class CorrespondingTilesLocatorTest
{
	/**
	 * 4x4 epipolar image split into 2x2 tiles, tile values named after their address.
	 */
	private static TiledDataset epipolarDataset( final String prefix, final Box largestRegion )
	{
		final TiledDataset dataset = new TiledDataset( TiledDataset.DatasetType.POINTS );
		dataset.setTilingGrid( TilingOperations.grid( 0, 0, 4, 4, 2, 2 ) );
		for ( int row = 0; row < 2; ++row )
			for ( int col = 0; col < 2; ++col )
				dataset.set( row, col, prefix + row + col );
		dataset.setAttribute( TiledDataset.LARGEST_EPIPOLAR_REGION, largestRegion );
		dataset.setAttribute( TiledDataset.OPT_EPIPOLAR_TILE_SIZE, 2 );
		return dataset;
	}

	/**
	 * Epipolar bounds mapping every vertex of a terrain grid to the same [min, max] epipolar box.
	 */
	private static EpipolarBounds constantBounds( final TilingGrid terrainGrid, final double[] min, final double[] max )
	{
		final double[][][] mins = new double[ terrainGrid.numVertexRows() ][ terrainGrid.numVertexCols() ][];
		final double[][][] maxs = new double[ terrainGrid.numVertexRows() ][ terrainGrid.numVertexCols() ][];
		for ( int j = 0; j < mins.length; ++j )
		{
			for ( int i = 0; i < mins[ j ].length; ++i )
			{
				mins[ j ][ i ] = min.clone();
				maxs[ j ][ i ] = max.clone();
			}
		}
		return new EpipolarBounds( mins, maxs );
	}

	private static StereoPairTiles pair( final int pairIndex, final TilingGrid terrainGrid, final Box largestRegion, final double[] min, final double[] max )
	{
		return new StereoPairTiles(
				pairIndex,
				epipolarDataset( "L" + pairIndex + "_", largestRegion ),
				epipolarDataset( "R" + pairIndex + "_", largestRegion ),
				constantBounds( terrainGrid, min, max ) );
	}

	@Test
	public void testSharedCornerResolvesToLowerTile()
	{
		final TilingGrid terrainGrid = TilingOperations.grid( 0, 0, 10, 10, 10, 10 );
		final StereoPairTiles pair = pair( 0, terrainGrid, new Box( 0, 0, 4, 4 ), new double[] { 1, 1 }, new double[] { 2, 2 } );

		for ( int run = 0; run < 5; ++run )
		{
			final CandidateTileSet candidates = new CorrespondingTilesLocator( terrainGrid, Collections.singletonList( pair ) ).getCorrespondingTiles( 0, 0 );
			Assert.assertEquals(
					Collections.singletonList( new EpipolarTileReference( 0, new TileAddress( 0, 0 ), new Box( 0, 0, 2, 2 ) ) ),
					candidates.getEpipolarTiles() );
			Assert.assertEquals( Collections.singletonList( "L0_00" ), candidates.getRequiredLeft() );
			Assert.assertEquals( Collections.singletonList( "R0_00" ), candidates.getRequiredRight() );
			Assert.assertEquals( new Box( 0, 0, 10, 10 ), candidates.getTerrainRegion() );
		}
	}

	@Test
	public void testTileAddressIsRowColumn()
	{
		final TilingGrid terrainGrid = TilingOperations.grid( 0, 0, 10, 10, 10, 10 );
		// x in the second tile column, y in the first tile row
		final StereoPairTiles pair = pair( 0, terrainGrid, new Box( 0, 0, 4, 4 ), new double[] { 2.5, 0.5 }, new double[] { 3.5, 1.5 } );

		final CandidateTileSet candidates = new CorrespondingTilesLocator( terrainGrid, Collections.singletonList( pair ) ).getCorrespondingTiles( 0, 0 );
		Assert.assertEquals( 1, candidates.getEpipolarTiles().size() );
		Assert.assertEquals( new TileAddress( 0, 1 ), candidates.getEpipolarTiles().get( 0 ).getAddress() );
		Assert.assertEquals( Collections.singletonList( "L0_01" ), candidates.getRequiredLeft() );
	}

	@Test
	public void testOutsideLargestRegionIsEmpty()
	{
		final TilingGrid terrainGrid = TilingOperations.grid( 0, 0, 10, 10, 10, 10 );
		final StereoPairTiles pair = pair( 0, terrainGrid, new Box( 0, 0, 4, 4 ), new double[] { 10, 10 }, new double[] { 12, 12 } );

		final CandidateTileSet candidates = new CorrespondingTilesLocator( terrainGrid, Collections.singletonList( pair ) ).getCorrespondingTiles( 0, 0 );
		Assert.assertTrue( candidates.isEmpty() );
		Assert.assertTrue( candidates.getRequiredLeft().isEmpty() );
		Assert.assertTrue( candidates.getRequiredRight().isEmpty() );
		Assert.assertEquals( 0, candidates.getRank() );
	}

	@Test
	public void testSeveralPairs()
	{
		final TilingGrid terrainGrid = TilingOperations.grid( 0, 0, 10, 10, 10, 10 );
		final List< StereoPairTiles > pairs = Arrays.asList(
				pair( 0, terrainGrid, new Box( 0, 0, 4, 4 ), new double[] { 1, 1 }, new double[] { 3, 3 } ),
				pair( 1, terrainGrid, new Box( 0, 0, 4, 4 ), new double[] { 20, 20 }, new double[] { 30, 30 } ),
				pair( 2, terrainGrid, new Box( 0, 0, 4, 4 ), new double[] { 0, 3 }, new double[] { 1, 4 } ) );

		final CandidateTileSet candidates = new CorrespondingTilesLocator( terrainGrid, pairs ).getCorrespondingTiles( 0, 0 );
		Assert.assertEquals( Arrays.asList( "L0_00", "L0_10", "L0_01", "L0_11", "L2_10" ), candidates.getRequiredLeft() );
		for ( final EpipolarTileReference reference : candidates.getEpipolarTiles() )
			Assert.assertNotEquals( 1, reference.getPairIndex() );
	}

	@Test
	public void testTilesOutsideOfDatasetAreSkipped()
	{
		final TilingGrid terrainGrid = TilingOperations.grid( 0, 0, 10, 10, 10, 10 );
		// the largest region goes beyond the 2x2 tiles of the dataset
		final StereoPairTiles pair = pair( 0, terrainGrid, new Box( 0, 0, 8, 8 ), new double[] { 3, 3 }, new double[] { 5, 5 } );

		final CandidateTileSet candidates = new CorrespondingTilesLocator( terrainGrid, Collections.singletonList( pair ) ).getCorrespondingTiles( 0, 0 );
		Assert.assertEquals( Collections.singletonList( "L0_11" ), candidates.getRequiredLeft() );
	}

	@Test
	public void testTileMargin()
	{
		final TilingGrid terrainGrid = TilingOperations.grid( 0, 0, 10, 10, 10, 10 );
		final StereoPairTiles pair = pair( 0, terrainGrid, new Box( 0, 0, 4, 4 ), new double[] { 1, 1 }, new double[] { 2, 2 } );

		final CandidateTileSet candidates = new CorrespondingTilesLocator( terrainGrid, Collections.singletonList( pair ), 1 ).getCorrespondingTiles( 0, 0 );
		Assert.assertEquals( 4, candidates.getEpipolarTiles().size() );
	}

	@Test
	public void testLocateAllRankOrder()
	{
		final TilingGrid terrainGrid = TilingOperations.grid( 0, 0, 30, 30, 10, 10 );
		final StereoPairTiles pair = pair( 0, terrainGrid, new Box( 0, 0, 4, 4 ), new double[] { 1, 1 }, new double[] { 2, 2 } );

		final List< CandidateTileSet > candidates = new CorrespondingTilesLocator( terrainGrid, Collections.singletonList( pair ) ).locateAll();
		final List< TileAddress > order = new ArrayList<>();
		for ( final CandidateTileSet candidate : candidates )
		{
			order.add( candidate.getTerrainAddress() );
			Assert.assertEquals( candidate.getCol() * candidate.getCol() + candidate.getRow() * candidate.getRow(), candidate.getRank() );
		}

		Assert.assertEquals( Arrays.asList(
				new TileAddress( 0, 0 ),
				new TileAddress( 0, 1 ),
				new TileAddress( 1, 0 ),
				new TileAddress( 1, 1 ),
				new TileAddress( 0, 2 ),
				new TileAddress( 2, 0 ),
				new TileAddress( 1, 2 ),
				new TileAddress( 2, 1 ),
				new TileAddress( 2, 2 ) ),
			order );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testBoundsShapeMismatch()
	{
		final TilingGrid terrainGrid = TilingOperations.grid( 0, 0, 30, 30, 10, 10 );
		final StereoPairTiles pair = pair( 0, TilingOperations.grid( 0, 0, 10, 10, 10, 10 ), new Box( 0, 0, 4, 4 ), new double[] { 1, 1 }, new double[] { 2, 2 } );
		new CorrespondingTilesLocator( terrainGrid, Collections.singletonList( pair ) );
	}
}
