package org.stereodsm.correspondence;

import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.proj.LongLatProjection;

public class CrsUtils
{
	/**
	 * Scaling applied to geographic coordinates before triangulating them,
	 * as degrees are too small for a well-conditioned triangulation.
	 */
	public static final double GEOGRAPHIC_PRECISION_FACTOR = 1000.0;

	private static final CRSFactory CRS_FACTORY = new CRSFactory();

	/**
	 * @return true if the CRS identified by {@code epsg} has angular (longitude/latitude) coordinates
	 */
	public static boolean isGeographic( final int epsg )
	{
		final CoordinateReferenceSystem crs = CRS_FACTORY.createFromName( "EPSG:" + epsg );
		return crs.getProjection() instanceof LongLatProjection;
	}

	public static double getPrecisionFactor( final int epsg )
	{
		return isGeographic( epsg ) ? GEOGRAPHIC_PRECISION_FACTOR : 1.0;
	}
}
