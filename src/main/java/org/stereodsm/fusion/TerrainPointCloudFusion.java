package org.stereodsm.fusion;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stereodsm.correspondence.CandidateTileSet;
import org.stereodsm.correspondence.CorrespondingTilesLocator;
import org.stereodsm.correspondence.StereoPairTiles;
import org.stereodsm.data.SparseTile;
import org.stereodsm.data.TiledDataset;
import org.stereodsm.orchestration.Cluster;
import org.stereodsm.orchestration.Delayed;
import org.stereodsm.orchestration.Task;
import org.stereodsm.orchestration.TaskExecutionException;
import org.stereodsm.tiling.Box;
import org.stereodsm.tiling.TilingGrid;

/**
 * Gathers the epipolar point clouds of every stereo pair into terrain tiles.
 *
 * The epipolar tiled datasets of the pairs hold {@link SparseTile}s of terrain points (x, y, z, ...),
 * in memory or dumped by the cluster's wrapper. For every terrain tile with a contribution,
 * one task merges the points of the candidate epipolar tiles that fall inside the terrain region.
 */
public class TerrainPointCloudFusion
{
	private static final Logger LOG = LoggerFactory.getLogger( TerrainPointCloudFusion.class );

	public static final String NUMBER_OF_POINT_CLOUDS = "number_of_pc";

	/**
	 * @return a points dataset over {@code terrainGrid} holding the task results (tile values as returned by
	 * 			the cluster, see {@link Cluster#getObject(Object)}); terrain tiles without contribution are {@code null}
	 */
	public static TiledDataset run(
			final Cluster cluster,
			final TilingGrid terrainGrid,
			final List< StereoPairTiles > pairs ) throws TaskExecutionException
	{
		final List< CandidateTileSet > candidates = new CorrespondingTilesLocator( terrainGrid, pairs ).locateAll();

		final Task mergeTask = cluster.createTask( TerrainPointCloudFusion::mergeTile );
		final List< CandidateTileSet > submitted = new ArrayList<>();
		final List< Delayed > delayedTiles = new ArrayList<>();
		for ( final CandidateTileSet candidate : candidates )
		{
			if ( candidate.isEmpty() )
			{
				LOG.debug( "Terrain tile {} has no corresponding epipolar tile", candidate.getTerrainAddress() );
				continue;
			}

			submitted.add( candidate );
			delayedTiles.add( mergeTask.call(
					candidate.getTerrainRegion(),
					new ArrayList<>( candidate.getRequiredLeft() ),
					new ArrayList<>( candidate.getRequiredRight() ) ) );
		}
		LOG.info( "Submitted {} terrain tiles out of {}", submitted.size(), candidates.size() );

		final List< Object > results = cluster.startTasks( delayedTiles );

		final TiledDataset terrainPoints = new TiledDataset( TiledDataset.DatasetType.POINTS );
		terrainPoints.setTilingGrid( terrainGrid );
		for ( int i = 0; i < submitted.size(); ++i )
			terrainPoints.set( submitted.get( i ).getRow(), submitted.get( i ).getCol(), results.get( i ) );

		return terrainPoints;
	}

	/**
	 * Task body: args are the terrain region, the left point clouds and the right point clouds.
	 * Points are kept if x is in [xmin, xmax) and y in [ymin, ymax).
	 */
	static Object mergeTile( final Object... args )
	{
		final Box terrainRegion = ( Box ) args[ 0 ];

		final List< SparseTile > inside = new ArrayList<>();
		for ( int i = 1; i < args.length; ++i )
		{
			for ( final Object value : ( List< ? > ) args[ i ] )
			{
				if ( value == null )
					continue;
				if ( !( value instanceof SparseTile ) )
					throw new IllegalArgumentException( "Expected point clouds, got " + value.getClass().getSimpleName() );

				final SparseTile pointCloud = ( SparseTile ) value;
				final double[] x = pointCloud.getColumn( SparseTile.X ), y = pointCloud.getColumn( SparseTile.Y );
				inside.add( pointCloud.filter( p ->
						x[ p ] >= terrainRegion.getXMin() && x[ p ] < terrainRegion.getXMax() &&
						y[ p ] >= terrainRegion.getYMin() && y[ p ] < terrainRegion.getYMax() ) );
			}
		}

		final SparseTile merged = SparseTile.concatenate( inside );
		merged.setAttribute( NUMBER_OF_POINT_CLOUDS, inside.size() );
		return merged;
	}
}
