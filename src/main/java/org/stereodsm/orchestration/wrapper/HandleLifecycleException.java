package org.stereodsm.orchestration.wrapper;

/**
 * A dumped tile is used outside of the lifetime of the wrapper that produced it.
 */
public class HandleLifecycleException extends IllegalStateException
{
	private static final long serialVersionUID = 4463279541097624707L;

	public HandleLifecycleException( final String message )
	{
		super( message );
	}

	public HandleLifecycleException( final String message, final Throwable cause )
	{
		super( message, cause );
	}
}
