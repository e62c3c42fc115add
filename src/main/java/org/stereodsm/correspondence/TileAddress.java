package org.stereodsm.correspondence;

import java.io.Serializable;

public class TileAddress implements Serializable, Comparable< TileAddress >
{
	private static final long serialVersionUID = -7750455929806331146L;

	private final int row, col;

	public TileAddress( final int row, final int col )
	{
		this.row = row;
		this.col = col;
	}

	public int getRow() { return row; }
	public int getCol() { return col; }

	@Override
	public int compareTo( final TileAddress other )
	{
		return row != other.row ? Integer.compare( row, other.row ) : Integer.compare( col, other.col );
	}

	@Override
	public boolean equals( final Object obj )
	{
		if ( !( obj instanceof TileAddress ) )
			return false;
		final TileAddress other = ( TileAddress ) obj;
		return row == other.row && col == other.col;
	}

	@Override
	public int hashCode()
	{
		return 31 * row + col;
	}

	@Override
	public String toString()
	{
		return "(" + row + "," + col + ")";
	}
}
