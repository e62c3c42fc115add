package org.stereodsm.correspondence;

import java.io.Serializable;

import org.stereodsm.tiling.Box;

/**
 * Epipolar positions bounding every vertex of a terrain grid: for vertex [j][i], the min and the max
 * epipolar x/y that may project onto it across the disparity range.
 */
public class EpipolarBounds implements Serializable
{
	private static final long serialVersionUID = -3340651216233862394L;

	private final double[][][] min, max;

	/**
	 * @param min
	 * 			per vertex min epipolar position, indexed as [j][i][0:x, 1:y], copied
	 * @param max
	 * 			per vertex max epipolar position, same shape as {@code min}, copied
	 */
	public EpipolarBounds( final double[][][] min, final double[][][] max )
	{
		if ( min.length != max.length || min[ 0 ].length != max[ 0 ].length )
			throw new IllegalArgumentException( "Min and max bounds should have the same shape" );
		this.min = copy( min );
		this.max = copy( max );
	}

	private static double[][][] copy( final double[][][] bounds )
	{
		final double[][][] copy = new double[ bounds.length ][ bounds[ 0 ].length ][];
		for ( int j = 0; j < bounds.length; ++j )
		{
			if ( bounds[ j ].length != bounds[ 0 ].length )
				throw new IllegalArgumentException( "Bound rows should have the same number of vertices" );
			for ( int i = 0; i < bounds[ j ].length; ++i )
				copy[ j ][ i ] = bounds[ j ][ i ].clone();
		}
		return copy;
	}

	public int numVertexRows()
	{
		return min.length;
	}

	public int numVertexCols()
	{
		return min[ 0 ].length;
	}

	public double[] getMin( final int j, final int i )
	{
		return min[ j ][ i ].clone();
	}

	public double[] getMax( final int j, final int i )
	{
		return max[ j ][ i ].clone();
	}

	/**
	 * @return epipolar region bounding the 4 corners of the terrain cell at (row, col),
	 * 			not cropped to the epipolar image extent
	 */
	public Box getCellRegion( final int row, final int col )
	{
		double xmin = Double.POSITIVE_INFINITY, ymin = Double.POSITIVE_INFINITY;
		double xmax = Double.NEGATIVE_INFINITY, ymax = Double.NEGATIVE_INFINITY;
		for ( int j = row; j <= row + 1; ++j )
		{
			for ( int i = col; i <= col + 1; ++i )
			{
				for ( final double[] corner : new double[][] { min[ j ][ i ], max[ j ][ i ] } )
				{
					xmin = Math.min( xmin, corner[ 0 ] );
					ymin = Math.min( ymin, corner[ 1 ] );
					xmax = Math.max( xmax, corner[ 0 ] );
					ymax = Math.max( ymax, corner[ 1 ] );
				}
			}
		}
		return new Box( xmin, ymin, xmax, ymax );
	}
}
