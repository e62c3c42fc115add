package org.stereodsm.correspondence;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.stereodsm.tiling.Box;

/**
 * Epipolar tiles, across all stereo pairs, that may project onto a terrain tile.
 *
 * The required left/right values are the tile values of the pairs' tiled datasets
 * (in memory, deferred or dumped) in the order of {@link #getEpipolarTiles()}.
 * They are not part of the persisted plan.
 */
public class CandidateTileSet
{
	private final int row, col;
	private final Box terrainRegion;
	private final List< EpipolarTileReference > epipolarTiles;
	private final int rank;

	private transient List< Object > requiredLeft;
	private transient List< Object > requiredRight;

	public CandidateTileSet(
			final int row,
			final int col,
			final Box terrainRegion,
			final List< EpipolarTileReference > epipolarTiles,
			final List< Object > requiredLeft,
			final List< Object > requiredRight,
			final int rank )
	{
		this.row = row;
		this.col = col;
		this.terrainRegion = terrainRegion;
		this.epipolarTiles = new ArrayList<>( epipolarTiles );
		this.requiredLeft = new ArrayList<>( requiredLeft );
		this.requiredRight = new ArrayList<>( requiredRight );
		this.rank = rank;
	}

	public int getRow() { return row; }
	public int getCol() { return col; }
	public TileAddress getTerrainAddress() { return new TileAddress( row, col ); }
	public Box getTerrainRegion() { return terrainRegion; }
	public int getRank() { return rank; }

	public List< EpipolarTileReference > getEpipolarTiles()
	{
		return Collections.unmodifiableList( epipolarTiles );
	}

	public List< Object > getRequiredLeft()
	{
		return requiredLeft == null ? Collections.emptyList() : Collections.unmodifiableList( requiredLeft );
	}

	public List< Object > getRequiredRight()
	{
		return requiredRight == null ? Collections.emptyList() : Collections.unmodifiableList( requiredRight );
	}

	/**
	 * @return true if no epipolar tile of any pair contributes to the terrain tile
	 */
	public boolean isEmpty()
	{
		return epipolarTiles.isEmpty();
	}

	/**
	 * Scheduling key: tiles are submitted by increasing distance to the grid origin.
	 */
	public static int rank( final int row, final int col )
	{
		return col * col + row * row;
	}
}
