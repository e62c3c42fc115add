package org.stereodsm.tiling;

/**
 * Thrown when an operation that reduces a collection of regions gets an empty collection.
 */
public class EmptyInputException extends IllegalArgumentException
{
	private static final long serialVersionUID = 5381452806651377401L;

	public EmptyInputException( final String message )
	{
		super( message );
	}
}
