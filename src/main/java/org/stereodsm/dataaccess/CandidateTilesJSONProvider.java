package org.stereodsm.dataaccess;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.stereodsm.correspondence.CandidateTileSet;
import org.stereodsm.tiling.Box;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

/**
 * Loads and stores the planned candidate tiles of a terrain grid in JSON format.
 * Only the plan is stored: the tile values required by each terrain tile are not.
 */
public class CandidateTilesJSONProvider
{
	public static ArrayList< CandidateTileSet > loadCandidateTiles( final Reader reader ) throws IOException
	{
		try ( final Reader closeableReader = reader )
		{
			final CandidateTileSet[] candidates = createGson().fromJson( closeableReader, CandidateTileSet[].class );
			return candidates != null ? new ArrayList<>( Arrays.asList( candidates ) ) : new ArrayList<>();
		}
	}

	public static void saveCandidateTiles( final List< CandidateTileSet > candidates, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( createGson().toJson( candidates.toArray( new CandidateTileSet[ 0 ] ) ) );
		}
	}

	private static Gson createGson()
	{
		return new GsonBuilder()
				.registerTypeAdapter( Box.class, new BoxJsonAdapter() )
				.setPrettyPrinting()
				.create();
	}
}
