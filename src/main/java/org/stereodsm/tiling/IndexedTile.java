package org.stereodsm.tiling;

import java.io.Serializable;

/**
 * A tile of a regular tiling identified by its x/y tile indices, with its region
 * cropped to the tiled area.
 */
public class IndexedTile implements Serializable
{
	private static final long serialVersionUID = 7409581617713208335L;

	private final int idx, idy;
	private final Box tile;

	public IndexedTile( final int idx, final int idy, final Box tile )
	{
		this.idx = idx;
		this.idy = idy;
		this.tile = tile;
	}

	public int getIdx() { return idx; }
	public int getIdy() { return idy; }
	public Box getTile() { return tile; }

	@Override
	public boolean equals( final Object obj )
	{
		if ( !( obj instanceof IndexedTile ) )
			return false;
		final IndexedTile other = ( IndexedTile ) obj;
		return idx == other.idx && idy == other.idy && tile.equals( other.tile );
	}

	@Override
	public int hashCode()
	{
		return 31 * ( 31 * idx + idy ) + tile.hashCode();
	}

	@Override
	public String toString()
	{
		return "{idx=" + idx + ", idy=" + idy + ", tile=" + tile + "}";
	}
}
