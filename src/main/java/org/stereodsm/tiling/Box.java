package org.stereodsm.tiling;

import java.io.Serializable;
import java.util.Arrays;

import net.imglib2.RealInterval;
import net.imglib2.RealPositionable;

/**
 * Axis-aligned 2D region stored as [xmin, ymin, xmax, ymax].
 * Used both for terrain regions (output CRS units) and epipolar regions (pixels).
 *
 * The box can be inconsistent (min greater than max) when it results from cropping a region
 * by another one that does not overlap it, see {@link #isEmpty()}.
 */
public final class Box implements RealInterval, Serializable
{
	private static final long serialVersionUID = 3306617528195062641L;

	private final double xmin, ymin, xmax, ymax;

	public Box( final double xmin, final double ymin, final double xmax, final double ymax )
	{
		this.xmin = xmin;
		this.ymin = ymin;
		this.xmax = xmax;
		this.ymax = ymax;
	}

	public static Box fromArray( final double[] region )
	{
		if ( region == null || region.length != 4 )
			throw new IllegalArgumentException( "Region is expected as [xmin, ymin, xmax, ymax], got " + Arrays.toString( region ) );
		return new Box( region[ 0 ], region[ 1 ], region[ 2 ], region[ 3 ] );
	}

	public double getXMin() { return xmin; }
	public double getYMin() { return ymin; }
	public double getXMax() { return xmax; }
	public double getYMax() { return ymax; }

	public double getWidth() { return xmax - xmin; }
	public double getHeight() { return ymax - ymin; }

	/**
	 * @return true if the box does not contain any pixel (or is inconsistent)
	 */
	public boolean isEmpty()
	{
		return xmin >= xmax || ymin >= ymax;
	}

	public double[] toArray()
	{
		return new double[] { xmin, ymin, xmax, ymax };
	}

	@Override
	public int numDimensions()
	{
		return 2;
	}

	@Override
	public double realMin( final int d )
	{
		return d == 0 ? xmin : ymin;
	}

	@Override
	public void realMin( final double[] min )
	{
		min[ 0 ] = xmin;
		min[ 1 ] = ymin;
	}

	@Override
	public void realMin( final RealPositionable min )
	{
		min.setPosition( xmin, 0 );
		min.setPosition( ymin, 1 );
	}

	@Override
	public double realMax( final int d )
	{
		return d == 0 ? xmax : ymax;
	}

	@Override
	public void realMax( final double[] max )
	{
		max[ 0 ] = xmax;
		max[ 1 ] = ymax;
	}

	@Override
	public void realMax( final RealPositionable max )
	{
		max.setPosition( xmax, 0 );
		max.setPosition( ymax, 1 );
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( this == obj )
			return true;
		if ( !( obj instanceof Box ) )
			return false;
		final Box other = ( Box ) obj;
		return Double.compare( xmin, other.xmin ) == 0
				&& Double.compare( ymin, other.ymin ) == 0
				&& Double.compare( xmax, other.xmax ) == 0
				&& Double.compare( ymax, other.ymax ) == 0;
	}

	@Override
	public int hashCode()
	{
		return Arrays.hashCode( toArray() );
	}

	@Override
	public String toString()
	{
		return Arrays.toString( toArray() );
	}
}
