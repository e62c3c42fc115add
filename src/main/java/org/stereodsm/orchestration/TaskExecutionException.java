package org.stereodsm.orchestration;

public class TaskExecutionException extends Exception
{
	private static final long serialVersionUID = -4378613190465307286L;

	public TaskExecutionException()
	{
		super();
	}

	public TaskExecutionException( final String message )
	{
		super( message );
	}

	public TaskExecutionException( final String message, final Throwable cause )
	{
		super( message, cause );
	}

	public TaskExecutionException( final Throwable cause )
	{
		super( cause );
	}
}
