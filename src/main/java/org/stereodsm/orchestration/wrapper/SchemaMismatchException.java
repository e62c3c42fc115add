package org.stereodsm.orchestration.wrapper;

/**
 * A value handed to the disk wrapper is neither a dense nor a sparse tile.
 */
public class SchemaMismatchException extends IllegalArgumentException
{
	private static final long serialVersionUID = -6217364658232706188L;

	public SchemaMismatchException( final String message )
	{
		super( message );
	}
}
