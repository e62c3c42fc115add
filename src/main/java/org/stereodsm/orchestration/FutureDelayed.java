package org.stereodsm.orchestration;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

/**
 * Result of a task submitted to a thread pool. Only meaningful within the process that submitted it.
 */
public class FutureDelayed extends Delayed
{
	private static final long serialVersionUID = 7015566400164838290L;

	private final transient CompletableFuture< Object > future;

	public FutureDelayed( final CompletableFuture< Object > future )
	{
		this.future = future;
	}

	public CompletableFuture< Object > getFuture()
	{
		if ( future == null )
			throw new IllegalStateException( "Thread pool results cannot be used outside of the process that submitted them" );
		return future;
	}

	@Override
	public Object get() throws TaskExecutionException
	{
		try
		{
			return getFuture().join();
		}
		catch ( final CompletionException e )
		{
			throw unwrap( e );
		}
	}

	static TaskExecutionException unwrap( final Throwable t )
	{
		Throwable cause = t;
		while ( cause instanceof CompletionException && cause.getCause() != null )
			cause = cause.getCause();
		return cause instanceof TaskExecutionException ? ( TaskExecutionException ) cause : new TaskExecutionException( cause );
	}
}
