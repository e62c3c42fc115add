package org.stereodsm.orchestration;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.concurrent.CompletionException;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaSparkContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stereodsm.orchestration.wrapper.TileWrapper;

/**
 * Runs tasks on Spark executors. Calling a task only records it: the task graph is
 * evaluated by {@link #startTasks(List)}, one Spark job per dependency level. The outputs
 * of a level are collected on the driver and passed as values to the next level, so every
 * task runs once.
 *
 * Task functions, their arguments and their outputs must be serializable. Since Spark may retry
 * a failed Spark task, task functions should not have side effects other than writing their own outputs.
 */
public class SparkCluster extends AbstractCluster
{
	private static final Logger LOG = LoggerFactory.getLogger( SparkCluster.class );

	private final JavaSparkContext sparkContext;
	private final boolean ownsContext;

	public SparkCluster( final TileWrapper wrapper, final JavaSparkContext sparkContext )
	{
		this( wrapper, sparkContext, false );
	}

	public SparkCluster( final TileWrapper wrapper, final String master, final String appName )
	{
		this( wrapper, new JavaSparkContext( new SparkConf()
				.setMaster( master )
				.setAppName( appName )
				.set( "spark.serializer", "org.apache.spark.serializer.KryoSerializer" ) ),
			true );
	}

	private SparkCluster( final TileWrapper wrapper, final JavaSparkContext sparkContext, final boolean ownsContext )
	{
		super( wrapper );
		this.sparkContext = sparkContext;
		this.ownsContext = ownsContext;
		LOG.info( "Using Spark context {} on {}", sparkContext.appName(), sparkContext.master() );
	}

	public JavaSparkContext getSparkContext()
	{
		return sparkContext;
	}

	@Override
	protected Delayed[] submit( final TaskFunction func, final Object[] args, final int nout )
	{
		final LazyDelayed.Node node = new LazyDelayed.Node( func, args, nout );
		final Delayed[] delayed = new Delayed[ nout ];
		for ( int i = 0; i < nout; ++i )
			delayed[ i ] = new LazyDelayed( node, i );
		return delayed;
	}

	@Override
	public List< Object > startTasks( final List< ? > tasks ) throws TaskExecutionException
	{
		final List< List< LazyDelayed.Node > > levels = pendingLevels( tasks );
		for ( int level = 0; level < levels.size(); ++level )
		{
			final List< LazyDelayed.Node > nodes = levels.get( level );
			if ( nodes.isEmpty() )
				continue;

			final List< LazyDelayed.Node > detached = new ArrayList<>( nodes.size() );
			final List< Integer > indices = new ArrayList<>( nodes.size() );
			for ( int i = 0; i < nodes.size(); ++i )
			{
				detached.add( nodes.get( i ).detached() );
				indices.add( i );
			}

			LOG.info( "Evaluating {} tasks of dependency level {} on Spark", nodes.size(), level );
			final List< Object[] > outputs;
			try
			{
				outputs = sparkContext
						.parallelize( indices, indices.size() )
						.map( i -> detached.get( i ).compute() )
						.collect();
			}
			catch ( final Exception e )
			{
				throw new TaskExecutionException( "Spark tasks failed", e );
			}

			for ( int i = 0; i < nodes.size(); ++i )
				nodes.get( i ).setOutputs( outputs.get( i ) );
		}

		final List< Object > results = new ArrayList<>( tasks.size() );
		for ( final Object task : tasks )
			results.add( Delayed.resolve( task ) );
		return results;
	}

	@Override
	public Object scatter( final Object data, final boolean broadcast )
	{
		return broadcast ? new BroadcastDelayed( sparkContext.broadcast( data ) ) : data;
	}

	/**
	 * Evaluates every result in one Spark job, then yields them in order.
	 */
	@Override
	public Iterator< Object > futureIterator( final List< ? > futures )
	{
		try
		{
			return startTasks( futures ).iterator();
		}
		catch ( final TaskExecutionException e )
		{
			return failingIterator( e );
		}
	}

	@Override
	public void close()
	{
		super.close();
		if ( ownsContext )
		{
			sparkContext.stop();
			LOG.info( "Stopped Spark context" );
		}
	}

	/**
	 * Groups the tasks that still have to run by dependency level: level 0 only depends on known values,
	 * level n on at least one task of level n-1.
	 */
	static List< List< LazyDelayed.Node > > pendingLevels( final List< ? > tasks )
	{
		final Map< LazyDelayed.Node, Integer > levels = new LinkedHashMap<>();
		for ( final Delayed delayed : Delayed.dependencies( tasks.toArray() ) )
			if ( delayed instanceof LazyDelayed )
				level( ( ( LazyDelayed ) delayed ).getNode(), levels );

		final List< List< LazyDelayed.Node > > grouped = new ArrayList<>();
		for ( final Entry< LazyDelayed.Node, Integer > entry : levels.entrySet() )
		{
			if ( entry.getValue() < 0 )
				continue;
			while ( grouped.size() <= entry.getValue() )
				grouped.add( new ArrayList<>() );
			grouped.get( entry.getValue() ).add( entry.getKey() );
		}
		return grouped;
	}

	/**
	 * @return dependency level of {@code node}, or -1 if its outputs are already known
	 */
	private static int level( final LazyDelayed.Node node, final Map< LazyDelayed.Node, Integer > levels )
	{
		final Integer known = levels.get( node );
		if ( known != null )
			return known;

		int level = -1;
		if ( !node.isComputed() )
		{
			for ( final LazyDelayed.Node upstream : node.upstream() )
				level = Math.max( level, level( upstream, levels ) );
			++level;
		}
		levels.put( node, level );
		return level;
	}

	private static Iterator< Object > failingIterator( final TaskExecutionException e )
	{
		final Iterator< Object > empty = Collections.emptyIterator();
		return new Iterator< Object >()
		{
			private boolean thrown = false;

			@Override
			public boolean hasNext()
			{
				return !thrown;
			}

			@Override
			public Object next()
			{
				if ( thrown )
					return empty.next();
				thrown = true;
				throw new CompletionException( e );
			}
		};
	}
}
