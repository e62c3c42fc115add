package org.stereodsm.correspondence;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stereodsm.data.TiledDataset;
import org.stereodsm.tiling.Box;
import org.stereodsm.tiling.IndexedTile;
import org.stereodsm.tiling.TilingGrid;
import org.stereodsm.tiling.TilingOperations;

/**
 * Finds, for every terrain tile, the epipolar tiles of every stereo pair that may project onto it.
 */
public class CorrespondingTilesLocator
{
	private static final Logger LOG = LoggerFactory.getLogger( CorrespondingTilesLocator.class );

	private final TilingGrid terrainGrid;
	private final List< StereoPairTiles > pairs;
	private final int tileMargin;

	public CorrespondingTilesLocator( final TilingGrid terrainGrid, final List< StereoPairTiles > pairs )
	{
		this( terrainGrid, pairs, 0 );
	}

	/**
	 * @param tileMargin
	 * 			number of extra epipolar tiles taken around the bounding epipolar region
	 */
	public CorrespondingTilesLocator( final TilingGrid terrainGrid, final List< StereoPairTiles > pairs, final int tileMargin )
	{
		if ( tileMargin < 0 )
			throw new IllegalArgumentException( "Tile margin should be non-negative, got " + tileMargin );

		for ( final StereoPairTiles pair : pairs )
		{
			final EpipolarBounds bounds = pair.getEpipolarBounds();
			if ( bounds.numVertexRows() != terrainGrid.numVertexRows() || bounds.numVertexCols() != terrainGrid.numVertexCols() )
				throw new IllegalArgumentException( String.format(
						"Epipolar bounds of pair %d (%dx%d) do not match the terrain grid (%dx%d)",
						pair.getPairIndex(), bounds.numVertexRows(), bounds.numVertexCols(),
						terrainGrid.numVertexRows(), terrainGrid.numVertexCols() ) );
		}

		this.terrainGrid = terrainGrid;
		this.pairs = new ArrayList<>( pairs );
		this.tileMargin = tileMargin;
	}

	public TilingGrid getTerrainGrid()
	{
		return terrainGrid;
	}

	public CandidateTileSet getCorrespondingTiles( final int row, final int col )
	{
		LOG.debug( "Processing tile located at {},{} in tile grid", col, row );

		final Box terrainRegion = terrainGrid.getCell( row, col );
		LOG.debug( "Corresponding terrain region: {}", terrainRegion );

		final List< EpipolarTileReference > references = new ArrayList<>();
		final List< Object > requiredLeft = new ArrayList<>();
		final List< Object > requiredRight = new ArrayList<>();

		for ( final StereoPairTiles pair : pairs )
		{
			final Box largestEpipolarRegion = pair.getLargestEpipolarRegion();
			final Box epipolarRegion = TilingOperations.crop(
					pair.getEpipolarBounds().getCellRegion( row, col ),
					largestEpipolarRegion );

			LOG.debug( "Corresponding epipolar region in pair {}: {}", pair.getPairIndex(), epipolarRegion );

			if ( epipolarRegion.isEmpty() )
			{
				LOG.debug( "Skipping pair {} for terrain tile {},{} because corresponding epipolar region is empty",
						pair.getPairIndex(), row, col );
				continue;
			}

			final int[] epipolarShape = pair.getLeft().getShape();
			for ( final IndexedTile epipolarTile : TilingOperations.listTiles(
					epipolarRegion,
					largestEpipolarRegion,
					pair.getOptEpipolarTileSize(),
					tileMargin ) )
			{
				final int idx = epipolarTile.getIdx(), idy = epipolarTile.getIdy();
				if ( idx < 0 || idx >= epipolarShape[ 1 ] || idy < 0 || idy >= epipolarShape[ 0 ] )
					continue;

				references.add( new EpipolarTileReference( pair.getPairIndex(), new TileAddress( idy, idx ), epipolarTile.getTile() ) );
				requiredLeft.add( pair.getLeft().get( idy, idx ) );
				requiredRight.add( pair.getRight() == null ? null : pair.getRight().get( idy, idx ) );
			}
		}

		return new CandidateTileSet( row, col, terrainRegion, references, requiredLeft, requiredRight, CandidateTileSet.rank( row, col ) );
	}

	/**
	 * @return the candidate tiles of every terrain tile, by increasing rank, then row, then column
	 */
	public List< CandidateTileSet > locateAll()
	{
		final List< CandidateTileSet > candidates = new ArrayList<>();
		for ( int row = 0; row < terrainGrid.numRows(); ++row )
			for ( int col = 0; col < terrainGrid.numCols(); ++col )
				candidates.add( getCorrespondingTiles( row, col ) );

		candidates.sort( Comparator
				.comparingInt( CandidateTileSet::getRank )
				.thenComparingInt( CandidateTileSet::getRow )
				.thenComparingInt( CandidateTileSet::getCol ) );

		int empty = 0;
		for ( final CandidateTileSet candidate : candidates )
			if ( candidate.isEmpty() )
				++empty;
		LOG.debug( "Located epipolar tiles for {} terrain tiles ({} without contribution)", candidates.size(), empty );

		return candidates;
	}

	/**
	 * Wraps the epipolar tiled datasets of a pair with the epipolar bounds of {@code terrainGrid}.
	 */
	public static StereoPairTiles pairTiles(
			final int pairIndex,
			final TiledDataset left,
			final TiledDataset right,
			final TerrainToEpipolarMapper mapper,
			final TilingGrid terrainGrid )
	{
		return new StereoPairTiles( pairIndex, left, right, mapper.map( terrainGrid ) );
	}
}
