package org.stereodsm.correspondence;

import java.io.Serializable;

import org.stereodsm.tiling.TilingGrid;

/**
 * Terrain positions of the vertices of an epipolar grid at a fixed disparity.
 * Point k corresponds to the k-th vertex of the flattened (row-major) epipolar grid.
 */
public class DisparityBoundSample implements Serializable
{
	private static final long serialVersionUID = 1826416573419779525L;

	private final double disparity;
	private final double[][] points;

	public DisparityBoundSample( final double disparity, final double[][] points )
	{
		this.disparity = disparity;
		this.points = new double[ points.length ][];
		for ( int k = 0; k < points.length; ++k )
		{
			if ( points[ k ].length != 2 )
				throw new IllegalArgumentException( "Sample points should have 2 coordinates" );
			this.points[ k ] = points[ k ].clone();
		}
	}

	/**
	 * Projects every vertex of {@code epipolarGrid} to the terrain at the given disparity.
	 */
	public static DisparityBoundSample compute(
			final TilingGrid epipolarGrid,
			final EpipolarToTerrainProjector projector,
			final double disparity )
	{
		final double[][] epipolarPoints = epipolarGrid.flatten();
		final double[][] terrainPoints = new double[ epipolarPoints.length ][];
		for ( int k = 0; k < epipolarPoints.length; ++k )
			terrainPoints[ k ] = projector.project( epipolarPoints[ k ][ 0 ], epipolarPoints[ k ][ 1 ], disparity );
		return new DisparityBoundSample( disparity, terrainPoints );
	}

	/**
	 * Computes the samples at both ends of the disparity range.
	 * The range is widened to integer disparities (floor of the min, ceil of the max).
	 *
	 * @return [sample at min disparity, sample at max disparity]
	 */
	public static DisparityBoundSample[] computeMinMax(
			final TilingGrid epipolarGrid,
			final EpipolarToTerrainProjector projector,
			final double dispMin,
			final double dispMax )
	{
		if ( dispMin > dispMax )
			throw new IllegalArgumentException( "Min disparity " + dispMin + " is greater than max disparity " + dispMax );

		return new DisparityBoundSample[] {
				compute( epipolarGrid, projector, Math.floor( dispMin ) ),
				compute( epipolarGrid, projector, Math.ceil( dispMax ) )
			};
	}

	public double getDisparity()
	{
		return disparity;
	}

	public int size()
	{
		return points.length;
	}

	public double getX( final int k )
	{
		return points[ k ][ 0 ];
	}

	public double getY( final int k )
	{
		return points[ k ][ 1 ];
	}
}
