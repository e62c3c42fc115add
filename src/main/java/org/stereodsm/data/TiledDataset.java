package org.stereodsm.data;

import java.util.LinkedHashMap;
import java.util.Map;

import org.stereodsm.tiling.TilingGrid;

/**
 * A tiling of an image (arrays) or of a point cloud (points) with one value per tile.
 *
 * Tile values are whatever a pipeline stage produced for the tile: an in-memory tile,
 * a deferred task result, or a handle to a tile dumped on disk. Tiles without a value are {@code null}.
 */
public class TiledDataset
{
	public static enum DatasetType
	{
		ARRAYS,
		POINTS
	}

	public static final String LARGEST_EPIPOLAR_REGION = "largest_epipolar_region";
	public static final String OPT_EPIPOLAR_TILE_SIZE = "opt_epipolar_tile_size";
	public static final String EPIPOLAR_REGIONS_GRID = "epipolar_regions_grid";

	private final DatasetType datasetType;
	private final Map< String, Object > attributes = new LinkedHashMap<>();

	private TilingGrid tilingGrid;
	private double[][][] overlaps;
	private Object[][] tiles;

	public TiledDataset( final DatasetType datasetType )
	{
		this.datasetType = datasetType;
	}

	public DatasetType getDatasetType()
	{
		return datasetType;
	}

	public TilingGrid getTilingGrid()
	{
		return tilingGrid;
	}

	/**
	 * Sets the tiling and resets every tile value and overlap.
	 */
	public void setTilingGrid( final TilingGrid tilingGrid )
	{
		this.tilingGrid = tilingGrid;
		generateNoneTiles();
		overlaps = new double[ tilingGrid.numRows() ][ tilingGrid.numCols() ][ 4 ];
	}

	public void generateNoneTiles()
	{
		requireTilingGrid();
		tiles = new Object[ tilingGrid.numRows() ][ tilingGrid.numCols() ];
	}

	/**
	 * @return [rows, cols]
	 */
	public int[] getShape()
	{
		requireTilingGrid();
		return new int[] { tilingGrid.numRows(), tilingGrid.numCols() };
	}

	public Object get( final int row, final int col )
	{
		requireTilingGrid();
		return tiles[ row ][ col ];
	}

	public void set( final int row, final int col, final Object value )
	{
		requireTilingGrid();
		tiles[ row ][ col ] = value;
	}

	/**
	 * @return margins of the tile as [left, bottom, right, top]
	 */
	public double[] getOverlaps( final int row, final int col )
	{
		requireTilingGrid();
		return overlaps[ row ][ col ].clone();
	}

	public void setOverlaps( final int row, final int col, final double[] margins )
	{
		requireTilingGrid();
		if ( margins.length != 4 )
			throw new IllegalArgumentException( "Expected 4 margins (left, bottom, right, top), got " + margins.length );
		overlaps[ row ][ col ] = margins.clone();
	}

	public Map< String, Object > getAttributes()
	{
		return attributes;
	}

	public void setAttribute( final String key, final Object value )
	{
		attributes.put( key, value );
	}

	public < A > A getAttribute( final String key, final Class< A > clazz )
	{
		final Object value = attributes.get( key );
		if ( value == null )
			throw new IllegalArgumentException( "Missing dataset attribute '" + key + "'" );
		if ( !clazz.isInstance( value ) )
			throw new IllegalArgumentException( "Dataset attribute '" + key + "' is a " + value.getClass().getSimpleName() + ", expected " + clazz.getSimpleName() );
		return clazz.cast( value );
	}

	private void requireTilingGrid()
	{
		if ( tilingGrid == null )
			throw new IllegalStateException( "Tiling grid is not set" );
	}
}
