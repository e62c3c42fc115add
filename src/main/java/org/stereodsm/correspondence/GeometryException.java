package org.stereodsm.correspondence;

/**
 * The terrain/epipolar correspondence of a stereo pair cannot be computed,
 * typically because its sample does not allow to build a triangulation.
 */
public class GeometryException extends Exception
{
	private static final long serialVersionUID = -4117426640592387212L;

	public GeometryException( final String message )
	{
		super( message );
	}

	public GeometryException( final String message, final Throwable cause )
	{
		super( message, cause );
	}
}
