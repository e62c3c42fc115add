package org.stereodsm.correspondence;

import org.stereodsm.data.TiledDataset;
import org.stereodsm.tiling.Box;

/**
 * Everything the tile locator needs from a stereo pair: its left and right epipolar
 * tiled datasets and the epipolar bounds of the terrain grid vertices.
 */
public class StereoPairTiles
{
	private final int pairIndex;
	private final TiledDataset left, right;
	private final EpipolarBounds epipolarBounds;

	/**
	 * @param right
	 * 			may be {@code null} when the stage only consumes left tiles
	 */
	public StereoPairTiles( final int pairIndex, final TiledDataset left, final TiledDataset right, final EpipolarBounds epipolarBounds )
	{
		this.pairIndex = pairIndex;
		this.left = left;
		this.right = right;
		this.epipolarBounds = epipolarBounds;
	}

	public int getPairIndex() { return pairIndex; }
	public TiledDataset getLeft() { return left; }
	public TiledDataset getRight() { return right; }
	public EpipolarBounds getEpipolarBounds() { return epipolarBounds; }

	public Box getLargestEpipolarRegion()
	{
		return left.getAttribute( TiledDataset.LARGEST_EPIPOLAR_REGION, Box.class );
	}

	public double getOptEpipolarTileSize()
	{
		return left.getAttribute( TiledDataset.OPT_EPIPOLAR_TILE_SIZE, Number.class ).doubleValue();
	}
}
