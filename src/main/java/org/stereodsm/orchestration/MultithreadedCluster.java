package org.stereodsm.orchestration;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.LinkedBlockingQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stereodsm.orchestration.wrapper.TileWrapper;
import org.stereodsm.util.concurrent.MultithreadedExecutor;

/**
 * Runs tasks on a fixed thread pool. A task is scheduled as soon as the deferred results
 * it receives as arguments are available, so calling a task never blocks.
 */
public class MultithreadedCluster extends AbstractCluster
{
	private static final Logger LOG = LoggerFactory.getLogger( MultithreadedCluster.class );

	private final MultithreadedExecutor executor;

	public MultithreadedCluster( final TileWrapper wrapper, final int numWorkers )
	{
		super( wrapper );
		executor = new MultithreadedExecutor( numWorkers );
		LOG.info( "Started thread pool with {} workers", numWorkers );
	}

	public int getNumWorkers()
	{
		return executor.getNumThreads();
	}

	@Override
	protected Delayed[] submit( final TaskFunction func, final Object[] args, final int nout )
	{
		final List< CompletableFuture< ? > > dependencies = new ArrayList<>();
		for ( final Delayed dependency : Delayed.dependencies( args ) )
			if ( dependency instanceof FutureDelayed )
				dependencies.add( ( ( FutureDelayed ) dependency ).getFuture() );

		final CompletableFuture< Object[] > outputs = executor.submitAfter(
				dependencies,
				() -> Task.splitOutputs( func.apply( Delayed.resolveAll( args ) ), nout ) );

		final Delayed[] delayed = new Delayed[ nout ];
		for ( int i = 0; i < nout; ++i )
		{
			final int outputIndex = i;
			delayed[ i ] = new FutureDelayed( outputs.thenApply( values -> values[ outputIndex ] ) );
		}
		return delayed;
	}

	@Override
	public List< Object > startTasks( final List< ? > tasks ) throws TaskExecutionException
	{
		final List< Object > results = new ArrayList<>( tasks.size() );
		for ( final Object task : tasks )
			results.add( Delayed.resolve( task ) );
		return results;
	}

	/**
	 * Yields results in completion order rather than in the order of {@code futures}.
	 */
	@Override
	public Iterator< Object > futureIterator( final List< ? > futures )
	{
		final BlockingQueue< CompletableFuture< Object > > completed = new LinkedBlockingQueue<>();
		for ( final Object future : futures )
		{
			final CompletableFuture< Object > cf;
			if ( future instanceof FutureDelayed )
			{
				cf = ( ( FutureDelayed ) future ).getFuture();
			}
			else
			{
				cf = new CompletableFuture<>();
				try
				{
					cf.complete( Delayed.resolve( future ) );
				}
				catch ( final TaskExecutionException e )
				{
					cf.completeExceptionally( e );
				}
			}
			cf.whenComplete( ( value, failure ) -> completed.add( cf ) );
		}

		final int total = futures.size();
		return new Iterator< Object >()
		{
			private int consumed = 0;

			@Override
			public boolean hasNext()
			{
				return consumed < total;
			}

			@Override
			public Object next()
			{
				if ( !hasNext() )
					throw new NoSuchElementException();

				final CompletableFuture< Object > next;
				try
				{
					next = completed.take();
				}
				catch ( final InterruptedException e )
				{
					Thread.currentThread().interrupt();
					throw new CompletionException( new TaskExecutionException( "Interrupted while waiting for task results", e ) );
				}
				++consumed;

				try
				{
					return next.join();
				}
				catch ( final CompletionException e )
				{
					throw new CompletionException( FutureDelayed.unwrap( e ) );
				}
			}
		};
	}

	/**
	 * Waits for the running tasks before cleaning up the wrapper, so no task writes to a cleaned directory.
	 */
	@Override
	public void close()
	{
		try
		{
			executor.close();
			LOG.info( "Stopped thread pool" );
		}
		finally
		{
			super.close();
		}
	}
}
