package org.stereodsm.orchestration.wrapper;

import org.stereodsm.data.DenseTile;
import org.stereodsm.data.SparseTile;

/**
 * Kind of a dumped tile, with the marker used in its path.
 */
public enum HandleKind
{
	DENSE( "DenseDO" ),
	SPARSE( "SparseDO" );

	private final String marker;

	private HandleKind( final String marker )
	{
		this.marker = marker;
	}

	public String getMarker()
	{
		return marker;
	}

	/**
	 * @throws SchemaMismatchException if {@code value} is neither a {@link DenseTile} nor a {@link SparseTile}
	 */
	public static HandleKind of( final Object value )
	{
		if ( value instanceof DenseTile )
			return DENSE;
		if ( value instanceof SparseTile )
			return SPARSE;
		throw new SchemaMismatchException( "Not an arrays or points tile: " + ( value == null ? "null" : value.getClass().getName() ) );
	}
}
