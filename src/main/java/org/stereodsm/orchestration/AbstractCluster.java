package org.stereodsm.orchestration;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stereodsm.orchestration.wrapper.TileWrapper;

public abstract class AbstractCluster implements Cluster
{
	private static final Logger LOG = LoggerFactory.getLogger( AbstractCluster.class );

	private final TileWrapper wrapper;
	private boolean cleaned;

	protected AbstractCluster( final TileWrapper wrapper )
	{
		this.wrapper = wrapper;
	}

	public TileWrapper getWrapper()
	{
		return wrapper;
	}

	@Override
	public Task createTask( final TaskFunction func )
	{
		return createTask( func, 1 );
	}

	@Override
	public Task createTask( final TaskFunction func, final int nout )
	{
		return new Task( this, func, nout );
	}

	/**
	 * Submits an already wrapped function. Must not block on the function's evaluation
	 * unless the backend is synchronous.
	 */
	protected abstract Delayed[] submit( final TaskFunction func, final Object[] args, final int nout );

	@Override
	public Object scatter( final Object data, final boolean broadcast )
	{
		return data;
	}

	@Override
	public Iterator< Object > futureIterator( final List< ? > futures )
	{
		final Iterator< ? > it = futures.iterator();
		return new Iterator< Object >()
		{
			@Override
			public boolean hasNext()
			{
				return it.hasNext();
			}

			@Override
			public Object next()
			{
				if ( !it.hasNext() )
					throw new NoSuchElementException();
				try
				{
					return Delayed.resolve( it.next() );
				}
				catch ( final TaskExecutionException e )
				{
					throw new CompletionException( e );
				}
			}
		};
	}

	@Override
	public Object getObject( final Object obj )
	{
		return wrapper.getObject( obj );
	}

	@Override
	public void cleanup()
	{
		if ( !cleaned )
		{
			LOG.info( "Cleaning up {}", getClass().getSimpleName() );
			wrapper.cleanup();
			cleaned = true;
		}
	}

	@Override
	public void close()
	{
		cleanup();
	}
}
