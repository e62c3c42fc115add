package org.stereodsm.fusion;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.stereodsm.correspondence.EpipolarBounds;
import org.stereodsm.correspondence.StereoPairTiles;
import org.stereodsm.data.SparseTile;
import org.stereodsm.data.TiledDataset;
import org.stereodsm.orchestration.Cluster;
import org.stereodsm.orchestration.MultithreadedCluster;
import org.stereodsm.orchestration.SequentialCluster;
import org.stereodsm.orchestration.Task;
import org.stereodsm.orchestration.wrapper.DiskWrapper;
import org.stereodsm.tiling.Box;
import org.stereodsm.tiling.TilingGrid;
import org.stereodsm.tiling.TilingOperations;

public class TerrainPointCloudFusionTest
{
	@Rule
	public TemporaryFolder tmpFolder = new TemporaryFolder();

	private final TilingGrid terrainGrid = TilingOperations.grid( 0, 0, 20, 20, 10, 10 );

	/**
	 * Points of epipolar tile (row, col), in terrain coordinates. The last one lies on the terrain grid's upper x bound.
	 */
	private static SparseTile epipolarPoints( final Object... args )
	{
		final int row = ( Integer ) args[ 0 ], col = ( Integer ) args[ 1 ];
		final double[] x = new double[] { 1, 11, 10, 19.5, 20 };
		final double[] y = new double[] { 1, 1, 15, 19.5, 5 };
		final double[] z = new double[ x.length ];
		for ( int i = 0; i < x.length; ++i )
		{
			x[ i ] += row * 0.1;
			y[ i ] += col * 0.1;
			z[ i ] = 100 * row + 10 * col + i;
		}
		return new SparseTile( x.length )
				.addColumn( SparseTile.X, x )
				.addColumn( SparseTile.Y, y )
				.addColumn( SparseTile.Z, z );
	}

	/**
	 * Every terrain vertex may be seen from anywhere in the 4x4 epipolar image.
	 */
	private EpipolarBounds fullBounds()
	{
		final double[][][] min = new double[ terrainGrid.numVertexRows() ][ terrainGrid.numVertexCols() ][];
		final double[][][] max = new double[ terrainGrid.numVertexRows() ][ terrainGrid.numVertexCols() ][];
		for ( int j = 0; j < min.length; ++j )
		{
			for ( int i = 0; i < min[ j ].length; ++i )
			{
				min[ j ][ i ] = new double[] { 0, 0 };
				max[ j ][ i ] = new double[] { 4, 4 };
			}
		}
		return new EpipolarBounds( min, max );
	}

	private StereoPairTiles pair( final TiledDataset left )
	{
		left.setAttribute( TiledDataset.LARGEST_EPIPOLAR_REGION, new Box( 0, 0, 4, 4 ) );
		left.setAttribute( TiledDataset.OPT_EPIPOLAR_TILE_SIZE, 2.0 );
		return new StereoPairTiles( 0, left, null, fullBounds() );
	}

	private StereoPairTiles inMemoryPair()
	{
		final TiledDataset left = new TiledDataset( TiledDataset.DatasetType.POINTS );
		left.setTilingGrid( TilingOperations.grid( 0, 0, 4, 4, 2, 2 ) );
		for ( int row = 0; row < 2; ++row )
			for ( int col = 0; col < 2; ++col )
				left.set( row, col, epipolarPoints( row, col ) );
		return pair( left );
	}

	@Test
	public void testMergeTile()
	{
		final SparseTile merged = ( SparseTile ) TerrainPointCloudFusion.mergeTile(
				new Box( 10, 0, 20, 10 ),
				Arrays.asList( epipolarPoints( 0, 0 ), null, epipolarPoints( 1, 0 ) ),
				Collections.emptyList() );

		Assert.assertArrayEquals( new double[] { 11, 11.1 }, merged.getColumn( SparseTile.X ), 1e-12 );
		Assert.assertArrayEquals( new double[] { 1, 101 }, merged.getColumn( SparseTile.Z ), 0 );
		Assert.assertEquals( 2.0, merged.getAttributes().get( TerrainPointCloudFusion.NUMBER_OF_POINT_CLOUDS ), 0 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testMergeNotPoints()
	{
		TerrainPointCloudFusion.mergeTile( new Box( 0, 0, 1, 1 ), Arrays.asList( "not points" ), Collections.emptyList() );
	}

	@Test
	public void testSequential() throws Exception
	{
		try ( final Cluster cluster = new SequentialCluster() )
		{
			final TiledDataset terrainPoints = TerrainPointCloudFusion.run( cluster, terrainGrid, Arrays.asList( inMemoryPair() ) );
			Assert.assertEquals( TiledDataset.DatasetType.POINTS, terrainPoints.getDatasetType() );

			Assert.assertEquals( 4, ( ( SparseTile ) terrainPoints.get( 0, 0 ) ).getNumPoints() );
			Assert.assertEquals( 4, ( ( SparseTile ) terrainPoints.get( 0, 1 ) ).getNumPoints() );
			Assert.assertEquals( 0, ( ( SparseTile ) terrainPoints.get( 1, 0 ) ).getNumPoints() );
			Assert.assertEquals( 8, ( ( SparseTile ) terrainPoints.get( 1, 1 ) ).getNumPoints() );

			// epipolar tiles are listed column by column: (0,0), (1,0), (0,1), (1,1)
			Assert.assertArrayEquals( new double[] { 0, 100, 10, 110 }, ( ( SparseTile ) terrainPoints.get( 0, 0 ) ).getColumn( SparseTile.Z ), 0 );
		}
	}

	@Test
	public void testMultithreadedOnDiskMatchesSequential() throws Exception
	{
		final TiledDataset expected;
		try ( final Cluster cluster = new SequentialCluster() )
		{
			expected = TerrainPointCloudFusion.run( cluster, terrainGrid, Arrays.asList( inMemoryPair() ) );
		}

		final DiskWrapper wrapper = new DiskWrapper( tmpFolder.getRoot().getAbsolutePath() );
		wrapper.init();
		try ( final Cluster cluster = new MultithreadedCluster( wrapper, 2 ) )
		{
			// epipolar point clouds are themselves produced by tasks and dumped to disk
			final Task produce = cluster.createTask( TerrainPointCloudFusionTest::epipolarPoints );
			final TiledDataset left = new TiledDataset( TiledDataset.DatasetType.POINTS );
			left.setTilingGrid( TilingOperations.grid( 0, 0, 4, 4, 2, 2 ) );
			for ( int row = 0; row < 2; ++row )
				for ( int col = 0; col < 2; ++col )
					left.set( row, col, produce.call( row, col ) );

			final TiledDataset terrainPoints = TerrainPointCloudFusion.run( cluster, terrainGrid, Arrays.asList( pair( left ) ) );

			final List< Object > actual = new ArrayList<>();
			final List< Object > reference = new ArrayList<>();
			for ( int row = 0; row < 2; ++row )
			{
				for ( int col = 0; col < 2; ++col )
				{
					actual.add( cluster.getObject( terrainPoints.get( row, col ) ) );
					reference.add( expected.get( row, col ) );
				}
			}
			Assert.assertEquals( reference, actual );
		}
	}

	@Test
	public void testTilesWithoutContribution() throws Exception
	{
		final TiledDataset left = new TiledDataset( TiledDataset.DatasetType.POINTS );
		left.setTilingGrid( TilingOperations.grid( 0, 0, 4, 4, 2, 2 ) );
		left.setAttribute( TiledDataset.LARGEST_EPIPOLAR_REGION, new Box( 0, 0, 4, 4 ) );
		left.setAttribute( TiledDataset.OPT_EPIPOLAR_TILE_SIZE, 2.0 );

		final double[][][] min = new double[ 3 ][ 3 ][];
		final double[][][] max = new double[ 3 ][ 3 ][];
		for ( int j = 0; j < 3; ++j )
		{
			for ( int i = 0; i < 3; ++i )
			{
				min[ j ][ i ] = new double[] { 50, 50 };
				max[ j ][ i ] = new double[] { 60, 60 };
			}
		}

		try ( final Cluster cluster = new SequentialCluster() )
		{
			final TiledDataset terrainPoints = TerrainPointCloudFusion.run(
					cluster, terrainGrid, Arrays.asList( new StereoPairTiles( 0, left, null, new EpipolarBounds( min, max ) ) ) );
			for ( int row = 0; row < 2; ++row )
				for ( int col = 0; col < 2; ++col )
					Assert.assertNull( terrainPoints.get( row, col ) );
		}
	}
}
