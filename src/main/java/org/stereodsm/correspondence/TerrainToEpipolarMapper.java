package org.stereodsm.correspondence;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stereodsm.data.TiledDataset;
import org.stereodsm.tiling.TilingGrid;

/**
 * Maps terrain positions to the epipolar positions of a stereo pair that may project onto them.
 *
 * The epipolar regions grid is projected to the terrain at the min and at the max disparity,
 * and each projection gets its own {@link SpatialIndex}. A terrain position is bounded by the epipolar
 * positions of the enclosing simplex in both triangulations, or by the nearest sample point
 * when it falls outside of a triangulation (or in a simplex along the grid sides).
 *
 * Built once per stereo pair, then queried for any terrain grid.
 */
public class TerrainToEpipolarMapper
{
	private static final Logger LOG = LoggerFactory.getLogger( TerrainToEpipolarMapper.class );

	private final double[][] epipolarPoints;
	private final SpatialIndex indexMin, indexMax;
	private final SimplexEdgeFilter edgeFilter;

	/**
	 * @param epipolarRegionsGrid
	 * 			regular epipolar grid the samples were computed from
	 * @param sampleMin
	 * 			terrain positions of the grid vertices at the min disparity
	 * @param sampleMax
	 * 			terrain positions of the grid vertices at the max disparity
	 * @param precisionFactor
	 * 			coordinates scaling applied to the triangulations and the queries, see {@link CrsUtils#getPrecisionFactor(int)}
	 */
	public TerrainToEpipolarMapper(
			final TilingGrid epipolarRegionsGrid,
			final DisparityBoundSample sampleMin,
			final DisparityBoundSample sampleMax,
			final double precisionFactor ) throws GeometryException
	{
		if ( sampleMin.size() != epipolarRegionsGrid.numVertices() || sampleMax.size() != epipolarRegionsGrid.numVertices() )
			throw new IllegalArgumentException( String.format(
					"Samples (%d and %d points) should match the epipolar regions grid (%d vertices)",
					sampleMin.size(), sampleMax.size(), epipolarRegionsGrid.numVertices() ) );

		epipolarPoints = epipolarRegionsGrid.flatten();
		indexMin = new SpatialIndex( sampleMin, precisionFactor );
		indexMax = new SpatialIndex( sampleMax, precisionFactor );
		edgeFilter = new SimplexEdgeFilter( epipolarRegionsGrid.numVertexRows(), epipolarRegionsGrid.numVertexCols() );

		LOG.debug( "Built triangulations with {} and {} simplices over {} epipolar grid points",
				indexMin.numSimplices(), indexMax.numSimplices(), epipolarPoints.length );
	}

	/**
	 * Builds the mapper of a stereo pair from the epipolar regions grid stored in its tiled dataset.
	 */
	public static TerrainToEpipolarMapper forDataset(
			final TiledDataset epipolarDataset,
			final DisparityBoundSample sampleMin,
			final DisparityBoundSample sampleMax,
			final double precisionFactor ) throws GeometryException
	{
		return new TerrainToEpipolarMapper(
				epipolarDataset.getAttribute( TiledDataset.EPIPOLAR_REGIONS_GRID, TilingGrid.class ),
				sampleMin,
				sampleMax,
				precisionFactor );
	}

	/**
	 * Convenience for a one-off mapping of a terrain grid.
	 */
	public static EpipolarBounds terrainGridToEpipolar(
			final TilingGrid terrainGrid,
			final TilingGrid epipolarRegionsGrid,
			final DisparityBoundSample sampleMin,
			final DisparityBoundSample sampleMax,
			final double precisionFactor ) throws GeometryException
	{
		return new TerrainToEpipolarMapper( epipolarRegionsGrid, sampleMin, sampleMax, precisionFactor ).map( terrainGrid );
	}

	/**
	 * @return min/max epipolar positions for every vertex of {@code terrainGrid}
	 */
	public EpipolarBounds map( final TilingGrid terrainGrid )
	{
		final double[][] queries = terrainGrid.flatten();
		final double[][] pointsMin = new double[ queries.length ][];
		final double[][] pointsMax = new double[ queries.length ][];
		bound( queries, pointsMin, pointsMax );

		final int rows = terrainGrid.numVertexRows(), cols = terrainGrid.numVertexCols();
		final double[][][] min = new double[ rows ][ cols ][], max = new double[ rows ][ cols ][];
		for ( int j = 0; j < rows; ++j )
		{
			for ( int i = 0; i < cols; ++i )
			{
				min[ j ][ i ] = pointsMin[ j * cols + i ];
				max[ j ][ i ] = pointsMax[ j * cols + i ];
			}
		}
		return new EpipolarBounds( min, max );
	}

	/**
	 * @return [min x, min y, max x, max y] epipolar bounds of a single terrain position
	 */
	public double[] map( final double terrainX, final double terrainY )
	{
		final double[][] pointsMin = new double[ 1 ][], pointsMax = new double[ 1 ][];
		bound( new double[][] { { terrainX, terrainY } }, pointsMin, pointsMax );
		return new double[] { pointsMin[ 0 ][ 0 ], pointsMin[ 0 ][ 1 ], pointsMax[ 0 ][ 0 ], pointsMax[ 0 ][ 1 ] };
	}

	private void bound( final double[][] queries, final double[][] pointsMin, final double[][] pointsMax )
	{
		final int[] simplicesMin = indexMin.findSimplices( queries );
		final int[] simplicesMax = indexMax.findSimplices( queries );
		edgeFilter.filterSimplicesOnTheEdges( indexMin, simplicesMin );
		edgeFilter.filterSimplicesOnTheEdges( indexMax, simplicesMax );

		final int[] nearestMin = indexMin.findNearest( queries );
		final int[] nearestMax = indexMax.findNearest( queries );

		for ( int q = 0; q < queries.length; ++q )
		{
			final double[] bounds = new double[] {
					Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY,
					Double.NEGATIVE_INFINITY, Double.NEGATIVE_INFINITY };

			expand( bounds, indexMin, simplicesMin[ q ], nearestMin[ q ] );
			expand( bounds, indexMax, simplicesMax[ q ], nearestMax[ q ] );

			pointsMin[ q ] = new double[] { bounds[ 0 ], bounds[ 1 ] };
			pointsMax[ q ] = new double[] { bounds[ 2 ], bounds[ 3 ] };
		}
	}

	private void expand( final double[] bounds, final SpatialIndex index, final int simplex, final int nearest )
	{
		if ( simplex != -1 )
		{
			for ( final int vertex : index.getSimplex( simplex ) )
				expand( bounds, epipolarPoints[ vertex ] );
		}
		else
		{
			expand( bounds, epipolarPoints[ nearest ] );
		}
	}

	private static void expand( final double[] bounds, final double[] point )
	{
		bounds[ 0 ] = Math.min( bounds[ 0 ], point[ 0 ] );
		bounds[ 1 ] = Math.min( bounds[ 1 ], point[ 1 ] );
		bounds[ 2 ] = Math.max( bounds[ 2 ], point[ 0 ] );
		bounds[ 3 ] = Math.max( bounds[ 3 ], point[ 1 ] );
	}
}
