package org.stereodsm.dataaccess;

import java.lang.reflect.Type;

import org.stereodsm.tiling.Box;

import com.google.gson.JsonArray;
import com.google.gson.JsonDeserializationContext;
import com.google.gson.JsonDeserializer;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.google.gson.JsonSerializationContext;
import com.google.gson.JsonSerializer;

/**
 * (De)serializes a {@link Box} as {@code [xmin, ymin, xmax, ymax]}.
 */
public class BoxJsonAdapter implements JsonSerializer< Box >, JsonDeserializer< Box >
{
	@Override
	public JsonElement serialize( final Box src, final Type typeOfSrc, final JsonSerializationContext context )
	{
		final JsonArray array = new JsonArray();
		for ( final double value : src.toArray() )
			array.add( value );
		return array;
	}

	@Override
	public Box deserialize( final JsonElement json, final Type typeOfT, final JsonDeserializationContext context ) throws JsonParseException
	{
		if ( !json.isJsonArray() || json.getAsJsonArray().size() != 4 )
			throw new JsonParseException( "Expected a region as [xmin, ymin, xmax, ymax], got " + json );

		final JsonArray array = json.getAsJsonArray();
		final double[] region = new double[ 4 ];
		for ( int i = 0; i < 4; ++i )
			region[ i ] = array.get( i ).getAsDouble();
		return Box.fromArray( region );
	}
}
