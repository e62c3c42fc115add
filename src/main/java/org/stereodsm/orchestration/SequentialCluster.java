package org.stereodsm.orchestration;

import java.util.ArrayList;
import java.util.List;

import org.stereodsm.orchestration.wrapper.HandleLifecycleException;
import org.stereodsm.orchestration.wrapper.NoneWrapper;
import org.stereodsm.orchestration.wrapper.SchemaMismatchException;
import org.stereodsm.orchestration.wrapper.TileWrapper;

/**
 * Runs every task inline, in the calling thread, as soon as it is called.
 * Deferred results are already computed when the call returns. A failing task body is reported
 * when its result is resolved, but misuse of dumped tiles aborts the call itself.
 */
public class SequentialCluster extends AbstractCluster
{
	public SequentialCluster()
	{
		this( new NoneWrapper() );
	}

	public SequentialCluster( final TileWrapper wrapper )
	{
		super( wrapper );
	}

	@Override
	protected Delayed[] submit( final TaskFunction func, final Object[] args, final int nout )
	{
		final Delayed[] outputs = new Delayed[ nout ];
		try
		{
			final Object[] values = Task.splitOutputs( func.apply( Delayed.resolveAll( args ) ), nout );
			for ( int i = 0; i < nout; ++i )
				outputs[ i ] = CompletedDelayed.of( values[ i ] );
		}
		catch ( final HandleLifecycleException | SchemaMismatchException e )
		{
			throw e;
		}
		catch ( final Exception e )
		{
			for ( int i = 0; i < nout; ++i )
				outputs[ i ] = CompletedDelayed.failed( e );
		}
		return outputs;
	}

	@Override
	public List< Object > startTasks( final List< ? > tasks ) throws TaskExecutionException
	{
		final List< Object > results = new ArrayList<>( tasks.size() );
		for ( final Object task : tasks )
			results.add( Delayed.resolve( task ) );
		return results;
	}
}
