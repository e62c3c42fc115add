package org.stereodsm;

import java.io.FileReader;
import java.io.FileWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import org.stereodsm.TerrainTilingInput.PairInput;
import org.stereodsm.correspondence.CandidateTileSet;
import org.stereodsm.correspondence.CorrespondingTilesLocator;
import org.stereodsm.correspondence.CrsUtils;
import org.stereodsm.correspondence.GeometryException;
import org.stereodsm.correspondence.StereoPairTiles;
import org.stereodsm.correspondence.TerrainToEpipolarMapper;
import org.stereodsm.data.TiledDataset;
import org.stereodsm.dataaccess.CandidateTilesJSONProvider;
import org.stereodsm.dataaccess.PairedRegionsGeoJSONProvider;
import org.stereodsm.tiling.TilingGrid;

import com.google.gson.JsonObject;

/**
 * Plans the terrain tiling of a set of stereo pairs: finds the epipolar tiles that each terrain tile
 * depends on, and exports the plan along with the paired terrain/epipolar regions for inspection.
 */
public class TerrainTilingPlanner
{
	public static final String CANDIDATE_TILES_FILENAME = "candidate_tiles.json";
	public static final String TERRAIN_TILES_FILENAME = "terrain_tiles.geojson";
	public static final String EPIPOLAR_TILES_FILENAME = "epipolar_tiles.geojson";

	public static void main( final String... args ) throws IOException
	{
		final TerrainTilingArguments parsedArgs = new TerrainTilingArguments( args );
		if ( !parsedArgs.parsedSuccessfully() )
			throw new IllegalArgumentException( "argument format mismatch" );

		final TerrainTilingInput input = TerrainTilingInput.load( new FileReader( parsedArgs.inputPath() ) );
		final List< CandidateTileSet > candidates = plan( input );

		System.out.println( "Saving the plan to " + parsedArgs.outputPath() );
		save( candidates, parsedArgs.outputPath() );
		System.out.println( "Done" );
	}

	/**
	 * Stereo pairs whose triangulation cannot be built are skipped.
	 *
	 * @return candidate tiles of every terrain tile, in submission order
	 */
	public static List< CandidateTileSet > plan( final TerrainTilingInput input )
	{
		final TilingGrid terrainGrid = input.getTerrainGrid();
		final double precisionFactor = CrsUtils.getPrecisionFactor( input.getEpsg() );
		System.out.println( String.format( "Terrain grid: %d x %d tiles, precision factor %s", terrainGrid.numRows(), terrainGrid.numCols(), precisionFactor ) );

		System.out.println( "Computing terrain/epipolar correspondences..." );
		final List< StereoPairTiles > pairs = new ArrayList<>();
		for ( int pairIndex = 0; pairIndex < input.getPairs().size(); ++pairIndex )
		{
			final PairInput pairInput = input.getPairs().get( pairIndex );
			final TiledDataset epipolarDataset = pairInput.createEpipolarDataset();
			try
			{
				final TerrainToEpipolarMapper mapper = TerrainToEpipolarMapper.forDataset(
						epipolarDataset,
						pairInput.getSampleMin(),
						pairInput.getSampleMax(),
						precisionFactor );
				pairs.add( CorrespondingTilesLocator.pairTiles( pairIndex, epipolarDataset, null, mapper, terrainGrid ) );
			}
			catch ( final GeometryException e )
			{
				System.out.println( "Skipping stereo pair " + pairIndex + ": " + e.getMessage() );
			}
		}

		final List< CandidateTileSet > candidates = new CorrespondingTilesLocator( terrainGrid, pairs ).locateAll();

		int nonEmpty = 0;
		for ( final CandidateTileSet candidate : candidates )
			if ( !candidate.isEmpty() )
				++nonEmpty;
		System.out.println( String.format( "%d out of %d terrain tiles have corresponding epipolar tiles", nonEmpty, candidates.size() ) );

		return candidates;
	}

	public static void save( final List< CandidateTileSet > candidates, final String outputPath ) throws IOException
	{
		Files.createDirectories( Paths.get( outputPath ) );

		CandidateTilesJSONProvider.saveCandidateTiles(
				candidates,
				new FileWriter( Paths.get( outputPath, CANDIDATE_TILES_FILENAME ).toFile() ) );

		final JsonObject[] geoDicts = PairedRegionsGeoJSONProvider.getPairedRegionsAsGeoDict( candidates );
		PairedRegionsGeoJSONProvider.saveGeoDict( geoDicts[ 0 ], new FileWriter( Paths.get( outputPath, TERRAIN_TILES_FILENAME ).toFile() ) );
		PairedRegionsGeoJSONProvider.saveGeoDict( geoDicts[ 1 ], new FileWriter( Paths.get( outputPath, EPIPOLAR_TILES_FILENAME ).toFile() ) );
	}
}
