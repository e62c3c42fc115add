package org.stereodsm.correspondence;

import java.io.Serializable;

import org.stereodsm.tiling.Box;

/**
 * An epipolar tile of a given stereo pair, with its epipolar region.
 */
public class EpipolarTileReference implements Serializable
{
	private static final long serialVersionUID = 4930478154370153338L;

	private final int pairIndex;
	private final TileAddress address;
	private final Box region;

	public EpipolarTileReference( final int pairIndex, final TileAddress address, final Box region )
	{
		this.pairIndex = pairIndex;
		this.address = address;
		this.region = region;
	}

	public int getPairIndex() { return pairIndex; }
	public TileAddress getAddress() { return address; }
	public Box getRegion() { return region; }

	@Override
	public boolean equals( final Object obj )
	{
		if ( !( obj instanceof EpipolarTileReference ) )
			return false;
		final EpipolarTileReference other = ( EpipolarTileReference ) obj;
		return pairIndex == other.pairIndex && address.equals( other.address ) && region.equals( other.region );
	}

	@Override
	public int hashCode()
	{
		return 31 * ( 31 * pairIndex + address.hashCode() ) + region.hashCode();
	}

	@Override
	public String toString()
	{
		return "pair " + pairIndex + " tile " + address + " " + region;
	}
}
