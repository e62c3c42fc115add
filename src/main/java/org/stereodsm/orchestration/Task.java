package org.stereodsm.orchestration;

import java.util.List;

/**
 * A task function registered on a cluster. Calling it submits the function with the given
 * arguments and returns deferred results without waiting for them.
 */
public class Task
{
	private final AbstractCluster cluster;
	private final TaskFunction func;
	private final int nout;

	Task( final AbstractCluster cluster, final TaskFunction func, final int nout )
	{
		if ( nout < 1 )
			throw new IllegalArgumentException( "Number of outputs should be at least 1, got " + nout );
		this.cluster = cluster;
		this.func = func;
		this.nout = nout;
	}

	public int getNumOutputs()
	{
		return nout;
	}

	/**
	 * Submits a single-output task.
	 */
	public Delayed call( final Object... args )
	{
		if ( nout != 1 )
			throw new IllegalStateException( "Task has " + nout + " outputs, use callMulti()" );
		return callMulti( args )[ 0 ];
	}

	/**
	 * @return one deferred result per output
	 */
	public Delayed[] callMulti( final Object... args )
	{
		return cluster.submit( cluster.getWrapper().wrapFunction( func, nout ), args.clone(), nout );
	}

	/**
	 * Splits the result of a task function into its {@code nout} outputs.
	 * A {@code null} result stands for {@code nout} {@code null} outputs.
	 */
	public static Object[] splitOutputs( final Object result, final int nout ) throws TaskExecutionException
	{
		if ( nout == 1 )
			return new Object[] { result };

		if ( result == null )
			return new Object[ nout ];

		final Object[] outputs;
		if ( result instanceof Object[] )
			outputs = ( ( Object[] ) result ).clone();
		else if ( result instanceof List )
			outputs = ( ( List< ? > ) result ).toArray();
		else
			throw new TaskExecutionException( "Task declared " + nout + " outputs but returned a single " + result.getClass().getSimpleName() );

		if ( outputs.length != nout )
			throw new TaskExecutionException( "Task declared " + nout + " outputs but returned " + outputs.length );

		return outputs;
	}
}
