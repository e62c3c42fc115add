package org.stereodsm.dataaccess;

import java.io.IOException;
import java.io.Writer;
import java.util.ArrayList;
import java.util.List;

import org.stereodsm.correspondence.CandidateTileSet;
import org.stereodsm.correspondence.EpipolarTileReference;
import org.stereodsm.tiling.Box;

import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

/**
 * Exports terrain tiles and their corresponding epipolar tiles as two GeoJSON feature collections,
 * to be overlaid in a GIS. Feature {@code i} of both collections describes the same terrain tile:
 * its terrain region in the terrain collection (Polygon), its epipolar tile regions in the epipolar
 * collection (MultiPolygon, in epipolar pixel coordinates).
 */
public class PairedRegionsGeoJSONProvider
{
	/**
	 * @return [terrain feature collection, epipolar feature collection]
	 */
	public static JsonObject[] getPairedRegionsAsGeoDict( final List< Box > terrainRegions, final List< List< Box > > epipolarRegions )
	{
		if ( terrainRegions.size() != epipolarRegions.size() )
			throw new IllegalArgumentException( String.format(
					"Got %d terrain regions but %d epipolar region lists", terrainRegions.size(), epipolarRegions.size() ) );

		final JsonArray terrainFeatures = new JsonArray(), epipolarFeatures = new JsonArray();
		for ( int id = 0; id < terrainRegions.size(); ++id )
		{
			final List< Box > epipolarList = epipolarRegions.get( id );

			final JsonObject terrainGeometry = new JsonObject();
			terrainGeometry.addProperty( "type", "Polygon" );
			terrainGeometry.add( "coordinates", polygonCoordinates( terrainRegions.get( id ) ) );
			terrainFeatures.add( feature( id, epipolarList.size(), terrainGeometry ) );

			final JsonArray multiPolygon = new JsonArray();
			for ( final Box epipolarRegion : epipolarList )
				multiPolygon.add( polygonCoordinates( epipolarRegion ) );
			final JsonObject epipolarGeometry = new JsonObject();
			epipolarGeometry.addProperty( "type", "MultiPolygon" );
			epipolarGeometry.add( "coordinates", multiPolygon );
			epipolarFeatures.add( feature( id, epipolarList.size(), epipolarGeometry ) );
		}

		return new JsonObject[] { featureCollection( terrainFeatures ), featureCollection( epipolarFeatures ) };
	}

	public static JsonObject[] getPairedRegionsAsGeoDict( final List< CandidateTileSet > candidates )
	{
		final List< Box > terrainRegions = new ArrayList<>();
		final List< List< Box > > epipolarRegions = new ArrayList<>();
		for ( final CandidateTileSet candidate : candidates )
		{
			terrainRegions.add( candidate.getTerrainRegion() );
			final List< Box > epipolarList = new ArrayList<>();
			for ( final EpipolarTileReference reference : candidate.getEpipolarTiles() )
				epipolarList.add( reference.getRegion() );
			epipolarRegions.add( epipolarList );
		}
		return getPairedRegionsAsGeoDict( terrainRegions, epipolarRegions );
	}

	public static void saveGeoDict( final JsonObject geoDict, final Writer writer ) throws IOException
	{
		try ( final Writer closeableWriter = writer )
		{
			closeableWriter.write( new GsonBuilder().setPrettyPrinting().create().toJson( geoDict ) );
		}
	}

	/**
	 * Counter-clockwise exterior ring starting at (xmax, ymin), closed.
	 */
	private static JsonArray polygonCoordinates( final Box region )
	{
		final JsonArray ring = new JsonArray();
		ring.add( position( region.getXMax(), region.getYMin() ) );
		ring.add( position( region.getXMax(), region.getYMax() ) );
		ring.add( position( region.getXMin(), region.getYMax() ) );
		ring.add( position( region.getXMin(), region.getYMin() ) );
		ring.add( position( region.getXMax(), region.getYMin() ) );

		final JsonArray rings = new JsonArray();
		rings.add( ring );
		return rings;
	}

	private static JsonArray position( final double x, final double y )
	{
		final JsonArray position = new JsonArray();
		position.add( x );
		position.add( y );
		return position;
	}

	private static JsonObject feature( final int id, final int numEpipolarTiles, final JsonObject geometry )
	{
		final JsonObject properties = new JsonObject();
		properties.addProperty( "id", id );
		properties.addProperty( "nb_epi", numEpipolarTiles );

		final JsonObject feature = new JsonObject();
		feature.addProperty( "type", "Feature" );
		feature.add( "properties", properties );
		feature.add( "geometry", geometry );
		return feature;
	}

	private static JsonObject featureCollection( final JsonArray features )
	{
		final JsonObject collection = new JsonObject();
		collection.addProperty( "type", "FeatureCollection" );
		collection.add( "features", features );
		return collection;
	}
}
