package org.stereodsm.tiling;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Region and tiling algebra shared by the terrain and the epipolar tilings.
 * All operations are pure.
 */
public class TilingOperations
{
	/**
	 * Generates the grid of positions obtained by splitting [xmin, xmax]x[ymin, ymax] in cells of xsplit x ysplit size.
	 * The last row and column of cells are shrunk to stay inside the region.
	 *
	 * @return grid with ceil((ymax-ymin)/ysplit)+1 vertex rows and ceil((xmax-xmin)/xsplit)+1 vertex columns
	 */
	public static TilingGrid grid(
			final double xmin,
			final double ymin,
			final double xmax,
			final double ymax,
			final double xsplit,
			final double ysplit )
	{
		final int nbXSplits = numSplits( xmin, xmax, xsplit );
		final int nbYSplits = numSplits( ymin, ymax, ysplit );

		final double[][][] corners = new double[ nbYSplits + 1 ][ nbXSplits + 1 ][ 2 ];
		for ( int i = 0; i <= nbXSplits; ++i )
		{
			for ( int j = 0; j <= nbYSplits; ++j )
			{
				corners[ j ][ i ][ 0 ] = Math.min( xmax, xmin + i * xsplit );
				corners[ j ][ i ][ 1 ] = Math.min( ymax, ymin + j * ysplit );
			}
		}
		return new TilingGrid( corners );
	}

	/**
	 * Splits [xmin, xmax]x[ymin, ymax] in regions of xsplit x ysplit size, cropped to the split region.
	 * The regions are enumerated column by column: the outer loop goes over the x index, the inner one over the y index.
	 */
	public static List< Box > split(
			final double xmin,
			final double ymin,
			final double xmax,
			final double ymax,
			final double xsplit,
			final double ysplit )
	{
		final int nbXSplits = numSplits( xmin, xmax, xsplit );
		final int nbYSplits = numSplits( ymin, ymax, ysplit );
		final Box largestRegion = new Box( xmin, ymin, xmax, ymax );

		final List< Box > regions = new ArrayList<>();
		for ( int i = 0; i < nbXSplits; ++i )
		{
			for ( int j = 0; j < nbYSplits; ++j )
			{
				final Box region = new Box(
						xmin + i * xsplit,
						ymin + j * ysplit,
						xmin + ( i + 1 ) * xsplit,
						ymin + ( j + 1 ) * ysplit );
				regions.add( crop( region, largestRegion ) );
			}
		}
		return regions;
	}

	/**
	 * Clamps every edge of {@code region} into {@code bounding}.
	 * If {@code region} lies outside of {@code bounding}, the result is empty (possibly inconsistent).
	 */
	public static Box crop( final Box region, final Box bounding )
	{
		return new Box(
				Math.min( bounding.getXMax(), Math.max( bounding.getXMin(), region.getXMin() ) ),
				Math.min( bounding.getYMax(), Math.max( bounding.getYMin(), region.getYMin() ) ),
				Math.min( bounding.getXMax(), Math.max( bounding.getXMin(), region.getXMax() ) ),
				Math.min( bounding.getYMax(), Math.max( bounding.getYMin(), region.getYMax() ) ) );
	}

	/**
	 * @param margins
	 * 			left, bottom, right, top
	 */
	public static Box pad( final Box region, final double[] margins )
	{
		if ( margins.length != 4 )
			throw new IllegalArgumentException( "Expected 4 margins (left, bottom, right, top), got " + margins.length );

		return new Box(
				region.getXMin() - margins[ 0 ],
				region.getYMin() - margins[ 1 ],
				region.getXMax() + margins[ 2 ],
				region.getYMax() + margins[ 3 ] );
	}

	public static boolean isEmpty( final Box region )
	{
		return region.isEmpty();
	}

	/**
	 * @return component-wise min/max over all the regions
	 * @throws EmptyInputException if there are no regions
	 */
	public static Box union( final Collection< Box > regions )
	{
		if ( regions.isEmpty() )
			throw new EmptyInputException( "Cannot compute the union of an empty list of regions" );

		double xmin = Double.POSITIVE_INFINITY, ymin = Double.POSITIVE_INFINITY;
		double xmax = Double.NEGATIVE_INFINITY, ymax = Double.NEGATIVE_INFINITY;
		for ( final Box region : regions )
		{
			xmin = Math.min( xmin, region.getXMin() );
			ymin = Math.min( ymin, region.getYMin() );
			xmax = Math.max( xmax, region.getXMax() );
			ymax = Math.max( ymax, region.getYMax() );
		}
		return new Box( xmin, ymin, xmax, ymax );
	}

	public static List< IndexedTile > listTiles( final Box region, final Box largestRegion, final double tileSize )
	{
		return listTiles( region, largestRegion, tileSize, 1 );
	}

	/**
	 * Cuts {@code largestRegion} into square tiles of {@code tileSize} and returns the tiles intersecting {@code region},
	 * extended by {@code margin} neighboring tiles on every side.
	 * Tiles are cropped to {@code largestRegion}, empty ones are discarded.
	 * A region edge lying exactly on a tile boundary is attributed to the lower index tile.
	 */
	public static List< IndexedTile > listTiles( final Box region, final Box largestRegion, final double tileSize, final int margin )
	{
		final int minTileIdx = ( int ) Math.floor( region.getXMin() / tileSize ) - margin;
		final int maxTileIdx = ( int ) Math.ceil( region.getXMax() / tileSize ) + margin;
		final int minTileIdy = ( int ) Math.floor( region.getYMin() / tileSize ) - margin;
		final int maxTileIdy = ( int ) Math.ceil( region.getYMax() / tileSize ) + margin;

		final List< IndexedTile > tiles = new ArrayList<>();
		for ( int idx = minTileIdx; idx < maxTileIdx; ++idx )
		{
			for ( int idy = minTileIdy; idy < maxTileIdy; ++idy )
			{
				final Box tile = crop(
						new Box( idx * tileSize, idy * tileSize, ( idx + 1 ) * tileSize, ( idy + 1 ) * tileSize ),
						largestRegion );

				if ( !tile.isEmpty() )
					tiles.add( new IndexedTile( idx, idy, tile ) );
			}
		}
		return tiles;
	}

	/**
	 * Converts a region to a raster origin and size.
	 * The y resolution is considered negative, so the returned ystart is the region's ymax.
	 * Sizes are rounded half to even.
	 */
	public static RasterWindow roiToStartAndSize( final Box region, final double resolution )
	{
		return new RasterWindow(
				region.getXMin(),
				region.getYMax(),
				( long ) Math.rint( ( region.getXMax() - region.getXMin() ) / resolution ),
				( long ) Math.rint( ( region.getYMax() - region.getYMin() ) / resolution ) );
	}

	/**
	 * Snaps the mins down and the maxs up to the closest multiple of {@code resolution}.
	 */
	public static Box snapToGrid(
			final double xmin,
			final double ymin,
			final double xmax,
			final double ymax,
			final double resolution )
	{
		return new Box(
				Math.floor( xmin / resolution ) * resolution,
				Math.floor( ymin / resolution ) * resolution,
				Math.ceil( xmax / resolution ) * resolution,
				Math.ceil( ymax / resolution ) * resolution );
	}

	/**
	 * @return key identifying a region, "xmin_ymin_xmax_ymax"
	 */
	public static String regionHashString( final Box region )
	{
		return region.getXMin() + "_" + region.getYMin() + "_" + region.getXMax() + "_" + region.getYMax();
	}

	private static int numSplits( final double min, final double max, final double split )
	{
		if ( split <= 0 )
			throw new IllegalArgumentException( "Split size should be positive, got " + split );
		return ( int ) Math.ceil( ( max - min ) / split );
	}
}
