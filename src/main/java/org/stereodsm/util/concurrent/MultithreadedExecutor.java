package org.stereodsm.util.concurrent;

import java.util.Collection;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

public class MultithreadedExecutor implements AutoCloseable
{
	/**
	 * Work item that may fail with a checked exception.
	 */
	@FunctionalInterface
	public static interface Job< T >
	{
		public T call() throws Exception;
	}

	private final ExecutorService threadPool;
	private final int numThreads;

	public MultithreadedExecutor()
	{
		// reserve one thread for the OS
		this( Math.max( 1, Runtime.getRuntime().availableProcessors() - 1 ) );
	}

	public MultithreadedExecutor( final int numThreads )
	{
		this( Executors.newFixedThreadPool( numThreads ), numThreads );
	}

	public MultithreadedExecutor( final ExecutorService threadPool, final int numThreads )
	{
		if ( numThreads < 1 )
			throw new IllegalArgumentException( "Number of threads should be positive, got " + numThreads );
		this.threadPool = threadPool;
		this.numThreads = numThreads;
	}

	/**
	 * Stops accepting jobs and waits for the running ones to finish.
	 * Jobs whose dependencies complete after this call are rejected.
	 */
	@Override
	public void close()
	{
		threadPool.shutdown();
		try
		{
			threadPool.awaitTermination( Long.MAX_VALUE, TimeUnit.NANOSECONDS );
		}
		catch ( final InterruptedException e )
		{
			threadPool.shutdownNow();
			Thread.currentThread().interrupt();
		}
	}

	public ExecutorService getThreadPool()
	{
		return threadPool;
	}

	public int getNumThreads()
	{
		return numThreads;
	}

	/**
	 * Schedules {@code job} on the thread pool once every dependency has completed.
	 * If a dependency fails, the job is not run and the returned future fails with the same cause.
	 */
	public < T > CompletableFuture< T > submitAfter( final Collection< ? extends CompletableFuture< ? > > dependencies, final Job< T > job )
	{
		return CompletableFuture
				.allOf( dependencies.toArray( new CompletableFuture< ? >[ 0 ] ) )
				.thenApplyAsync( ignored ->
					{
						try
						{
							return job.call();
						}
						catch ( final RuntimeException e )
						{
							throw e;
						}
						catch ( final Exception e )
						{
							throw new CompletionException( e );
						}
					},
					threadPool );
	}
}
