package org.stereodsm;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

import org.stereodsm.correspondence.DisparityBoundSample;
import org.stereodsm.data.TiledDataset;
import org.stereodsm.dataaccess.BoxJsonAdapter;
import org.stereodsm.tiling.Box;
import org.stereodsm.tiling.TilingGrid;
import org.stereodsm.tiling.TilingOperations;

import com.google.gson.FieldNamingPolicy;
import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Planning input of {@link TerrainTilingPlanner}:
 * <pre>
 * {
 *   "epsg": 32631,
 *   "roi": [xmin, ymin, xmax, ymax],
 *   "resolution": 0.5,
 *   "terrain_tile_size": 500,
 *   "pairs": [ {
 *     "epipolar_size": [width, height],
 *     "epipolar_step": 30,
 *     "epipolar_grid_min": [[x, y], ...],
 *     "epipolar_grid_max": [[x, y], ...],
 *     "disp_min": -20, "disp_max": 15,
 *     "largest_epipolar_region": [xmin, ymin, xmax, ymax],
 *     "opt_epipolar_tile_size": 400
 *   } ]
 * }
 * </pre>
 * The grid samples hold the terrain positions of the epipolar regions grid vertices, row by row.
 */
public class TerrainTilingInput
{
	public static class PairInput
	{
		private int[] epipolarSize;
		private double epipolarStep;
		private double[][] epipolarGridMin;
		private double[][] epipolarGridMax;
		private double dispMin;
		private double dispMax;
		private Box largestEpipolarRegion;
		private double optEpipolarTileSize;

		public int[] getEpipolarSize() { return epipolarSize; }
		public double getEpipolarStep() { return epipolarStep; }
		public Box getLargestEpipolarRegion() { return largestEpipolarRegion; }
		public double getOptEpipolarTileSize() { return optEpipolarTileSize; }

		public TilingGrid getEpipolarRegionsGrid()
		{
			return TilingOperations.grid( 0, 0, epipolarSize[ 0 ], epipolarSize[ 1 ], epipolarStep, epipolarStep );
		}

		public DisparityBoundSample getSampleMin()
		{
			return new DisparityBoundSample( dispMin, epipolarGridMin );
		}

		public DisparityBoundSample getSampleMax()
		{
			return new DisparityBoundSample( dispMax, epipolarGridMax );
		}

		/**
		 * @return an epipolar dataset tiled at the optimal tile size over the largest epipolar region,
		 * 			carrying the attributes read by the tile locator, without tile values
		 */
		public TiledDataset createEpipolarDataset()
		{
			final TiledDataset dataset = new TiledDataset( TiledDataset.DatasetType.ARRAYS );
			dataset.setTilingGrid( TilingOperations.grid(
					0, 0, largestEpipolarRegion.getXMax(), largestEpipolarRegion.getYMax(),
					optEpipolarTileSize, optEpipolarTileSize ) );
			dataset.setAttribute( TiledDataset.LARGEST_EPIPOLAR_REGION, largestEpipolarRegion );
			dataset.setAttribute( TiledDataset.OPT_EPIPOLAR_TILE_SIZE, optEpipolarTileSize );
			dataset.setAttribute( TiledDataset.EPIPOLAR_REGIONS_GRID, getEpipolarRegionsGrid() );
			return dataset;
		}

		void validate( final int index )
		{
			if ( epipolarSize == null || epipolarSize.length != 2 )
				throw new IllegalArgumentException( "pairs[" + index + "].epipolar_size: expected [width, height]" );
			if ( epipolarStep <= 0 )
				throw new IllegalArgumentException( "pairs[" + index + "].epipolar_step: should be positive" );
			if ( epipolarGridMin == null || epipolarGridMax == null )
				throw new IllegalArgumentException( "pairs[" + index + "]: epipolar_grid_min and epipolar_grid_max are required" );
			if ( largestEpipolarRegion == null )
				throw new IllegalArgumentException( "pairs[" + index + "].largest_epipolar_region: required" );
			if ( optEpipolarTileSize <= 0 )
				throw new IllegalArgumentException( "pairs[" + index + "].opt_epipolar_tile_size: should be positive" );
		}
	}

	private int epsg;
	private Box roi;
	private double resolution;
	private double terrainTileSize;
	private List< PairInput > pairs = new ArrayList<>();

	public int getEpsg() { return epsg; }
	public Box getRoi() { return roi; }
	public double getResolution() { return resolution; }
	public double getTerrainTileSize() { return terrainTileSize; }
	public List< PairInput > getPairs() { return pairs; }

	/**
	 * @return the terrain grid over the region of interest snapped to the resolution
	 */
	public TilingGrid getTerrainGrid()
	{
		final Box snapped = TilingOperations.snapToGrid( roi.getXMin(), roi.getYMin(), roi.getXMax(), roi.getYMax(), resolution );
		return TilingOperations.grid(
				snapped.getXMin(), snapped.getYMin(), snapped.getXMax(), snapped.getYMax(),
				terrainTileSize, terrainTileSize );
	}

	public static TerrainTilingInput load( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			final TerrainTilingInput input = createGson().fromJson( closeableReader, TerrainTilingInput.class );
			if ( input == null )
				throw new IllegalArgumentException( "Empty planning input" );
			input.validate();
			return input;
		}
	}

	private void validate()
	{
		if ( roi == null )
			throw new IllegalArgumentException( "roi: required" );
		if ( resolution <= 0 )
			throw new IllegalArgumentException( "resolution: should be positive" );
		if ( terrainTileSize <= 0 )
			throw new IllegalArgumentException( "terrain_tile_size: should be positive" );
		if ( pairs == null || pairs.isEmpty() )
			throw new IllegalArgumentException( "pairs: at least one stereo pair is required" );
		for ( int i = 0; i < pairs.size(); ++i )
			pairs.get( i ).validate( i );
	}

	private static Gson createGson()
	{
		return new GsonBuilder()
				.registerTypeAdapter( Box.class, new BoxJsonAdapter() )
				.setFieldNamingPolicy( FieldNamingPolicy.LOWER_CASE_WITH_UNDERSCORES )
				.create();
	}
}
