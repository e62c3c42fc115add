package org.stereodsm.orchestration;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Result of a task that is computed on first evaluation, in whichever JVM evaluates it.
 * Outputs of the same task call share one {@link Node}. Once the outputs of a node are known
 * on the driver, they are reused instead of running the task again.
 */
public class LazyDelayed extends Delayed
{
	private static final long serialVersionUID = -8839105244810577734L;

	static class Node implements Serializable
	{
		private static final long serialVersionUID = -1987398431734016722L;

		private final TaskFunction func;
		private final Object[] args;
		private final int nout;

		private transient Object[] outputs;

		Node( final TaskFunction func, final Object[] args, final int nout )
		{
			this.func = func;
			this.args = args;
			this.nout = nout;
		}

		synchronized Object[] compute() throws TaskExecutionException
		{
			if ( outputs == null )
			{
				final Object result;
				try
				{
					result = func.apply( resolveAll( args ) );
				}
				catch ( final TaskExecutionException e )
				{
					throw e;
				}
				catch ( final Exception e )
				{
					throw new TaskExecutionException( e );
				}
				outputs = Task.splitOutputs( result, nout );
			}
			return outputs;
		}

		synchronized boolean isComputed()
		{
			return outputs != null;
		}

		synchronized void setOutputs( final Object[] computedOutputs )
		{
			outputs = computedOutputs;
		}

		synchronized Object getOutput( final int outputIndex )
		{
			if ( outputs == null )
				throw new IllegalStateException( "Upstream task was not computed" );
			return outputs[ outputIndex ];
		}

		/**
		 * @return tasks whose outputs this task receives as arguments
		 */
		List< Node > upstream()
		{
			final List< Node > upstream = new ArrayList<>();
			for ( final Delayed dependency : dependencies( args ) )
				if ( dependency instanceof LazyDelayed )
					upstream.add( ( ( LazyDelayed ) dependency ).node );
			return upstream;
		}

		/**
		 * Copy of this task where the outputs of computed upstream tasks are passed as values,
		 * so evaluating it does not run them again.
		 */
		Node detached()
		{
			final Object[] detachedArgs = new Object[ args.length ];
			for ( int i = 0; i < args.length; ++i )
				detachedArgs[ i ] = detach( args[ i ] );
			return new Node( func, detachedArgs, nout );
		}

		private static Object detach( final Object arg )
		{
			if ( arg instanceof LazyDelayed )
			{
				final LazyDelayed delayed = ( LazyDelayed ) arg;
				return CompletedDelayed.of( delayed.node.getOutput( delayed.outputIndex ) );
			}

			if ( arg instanceof List )
			{
				final List< ? > list = ( List< ? > ) arg;
				final List< Object > detachedList = new ArrayList<>( list.size() );
				for ( final Object element : list )
					detachedList.add( detach( element ) );
				return detachedList;
			}

			return arg;
		}
	}

	private final Node node;
	private final int outputIndex;

	LazyDelayed( final Node node, final int outputIndex )
	{
		this.node = node;
		this.outputIndex = outputIndex;
	}

	Node getNode()
	{
		return node;
	}

	@Override
	public Object get() throws TaskExecutionException
	{
		return node.compute()[ outputIndex ];
	}
}
