package org.stereodsm.data;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;

import org.stereodsm.tiling.Box;

import net.imglib2.img.array.ArrayImg;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.img.basictypeaccess.array.DoubleArray;
import net.imglib2.type.numeric.real.DoubleType;

/**
 * Array-like tile: named bands of width x height values over a pixel window,
 * plus scalar attributes. Band values are stored row by row (x varies fastest).
 */
public class DenseTile implements Serializable
{
	private static final long serialVersionUID = 6620081466187622349L;

	private final Box window;
	private final int width, height;
	private final LinkedHashMap< String, double[] > bands = new LinkedHashMap<>();
	private final LinkedHashMap< String, Double > attributes = new LinkedHashMap<>();

	public DenseTile( final Box window, final int width, final int height )
	{
		this.window = window;
		this.width = width;
		this.height = height;
	}

	public Box getWindow()
	{
		return window;
	}

	public int getWidth()
	{
		return width;
	}

	public int getHeight()
	{
		return height;
	}

	public DenseTile addBand( final String name, final double[] values )
	{
		if ( values.length != ( long ) width * height )
			throw new IllegalArgumentException( String.format( "Band '%s' has %d values, expected %dx%d", name, values.length, width, height ) );
		bands.put( name, values );
		return this;
	}

	public List< String > getBandNames()
	{
		return new ArrayList<>( bands.keySet() );
	}

	public double[] getBand( final String name )
	{
		final double[] band = bands.get( name );
		if ( band == null )
			throw new IllegalArgumentException( "Unknown band '" + name + "'" );
		return band;
	}

	/**
	 * @return an image view of the band sharing its values
	 */
	public ArrayImg< DoubleType, DoubleArray > getBandImg( final String name )
	{
		return ArrayImgs.doubles( getBand( name ), width, height );
	}

	public DenseTile setAttribute( final String key, final double value )
	{
		attributes.put( key, value );
		return this;
	}

	public Map< String, Double > getAttributes()
	{
		return Collections.unmodifiableMap( attributes );
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( !( obj instanceof DenseTile ) )
			return false;
		final DenseTile other = ( DenseTile ) obj;
		if ( width != other.width || height != other.height || !attributes.equals( other.attributes ) )
			return false;
		if ( window == null ? other.window != null : !window.equals( other.window ) )
			return false;
		if ( !getBandNames().equals( other.getBandNames() ) )
			return false;
		for ( final Entry< String, double[] > band : bands.entrySet() )
			if ( !Arrays.equals( band.getValue(), other.bands.get( band.getKey() ) ) )
				return false;
		return true;
	}

	@Override
	public int hashCode()
	{
		return 31 * ( 31 * width + height ) + bands.keySet().hashCode();
	}
}
