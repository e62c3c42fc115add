package org.stereodsm.data;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.function.IntPredicate;

/**
 * Point-like tile: a table of named columns holding one value per point, plus scalar attributes.
 * Point positions are stored in the {@link #X} and {@link #Y} columns.
 */
public class SparseTile implements Serializable
{
	private static final long serialVersionUID = -2381946287437612170L;

	public static final String X = "x";
	public static final String Y = "y";
	public static final String Z = "z";

	private final int numPoints;
	private final LinkedHashMap< String, double[] > columns = new LinkedHashMap<>();
	private final LinkedHashMap< String, Double > attributes = new LinkedHashMap<>();

	public SparseTile( final int numPoints )
	{
		this.numPoints = numPoints;
	}

	public int getNumPoints()
	{
		return numPoints;
	}

	public SparseTile addColumn( final String name, final double[] values )
	{
		if ( values.length != numPoints )
			throw new IllegalArgumentException( String.format( "Column '%s' has %d values, expected %d", name, values.length, numPoints ) );
		columns.put( name, values );
		return this;
	}

	public List< String > getColumnNames()
	{
		return new ArrayList<>( columns.keySet() );
	}

	public boolean hasColumn( final String name )
	{
		return columns.containsKey( name );
	}

	public double[] getColumn( final String name )
	{
		final double[] column = columns.get( name );
		if ( column == null )
			throw new IllegalArgumentException( "Unknown column '" + name + "'" );
		return column;
	}

	public SparseTile setAttribute( final String key, final double value )
	{
		attributes.put( key, value );
		return this;
	}

	public Map< String, Double > getAttributes()
	{
		return Collections.unmodifiableMap( attributes );
	}

	/**
	 * @return a new tile with the points accepted by {@code keep}, same columns and attributes
	 */
	public SparseTile filter( final IntPredicate keep )
	{
		final int[] kept = new int[ numPoints ];
		int count = 0;
		for ( int p = 0; p < numPoints; ++p )
			if ( keep.test( p ) )
				kept[ count++ ] = p;

		final SparseTile filtered = new SparseTile( count );
		for ( final Entry< String, double[] > column : columns.entrySet() )
		{
			final double[] values = new double[ count ];
			for ( int p = 0; p < count; ++p )
				values[ p ] = column.getValue()[ kept[ p ] ];
			filtered.addColumn( column.getKey(), values );
		}
		filtered.attributes.putAll( attributes );
		return filtered;
	}

	/**
	 * Stacks the points of several tiles. Only the columns present in every tile are kept,
	 * attributes are taken from the first tile.
	 */
	public static SparseTile concatenate( final List< SparseTile > tiles )
	{
		if ( tiles.isEmpty() )
			return new SparseTile( 0 );

		final List< String > commonColumns = tiles.get( 0 ).getColumnNames();
		int total = 0;
		for ( final SparseTile tile : tiles )
		{
			commonColumns.retainAll( tile.columns.keySet() );
			total += tile.numPoints;
		}

		final SparseTile stacked = new SparseTile( total );
		for ( final String name : commonColumns )
		{
			final double[] values = new double[ total ];
			int offset = 0;
			for ( final SparseTile tile : tiles )
			{
				System.arraycopy( tile.columns.get( name ), 0, values, offset, tile.numPoints );
				offset += tile.numPoints;
			}
			stacked.addColumn( name, values );
		}
		stacked.attributes.putAll( tiles.get( 0 ).attributes );
		return stacked;
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( !( obj instanceof SparseTile ) )
			return false;
		final SparseTile other = ( SparseTile ) obj;
		if ( numPoints != other.numPoints || !attributes.equals( other.attributes ) || !getColumnNames().equals( other.getColumnNames() ) )
			return false;
		for ( final Entry< String, double[] > column : columns.entrySet() )
			if ( !Arrays.equals( column.getValue(), other.columns.get( column.getKey() ) ) )
				return false;
		return true;
	}

	@Override
	public int hashCode()
	{
		return 31 * numPoints + columns.keySet().hashCode();
	}
}
