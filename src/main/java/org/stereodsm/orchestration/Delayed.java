package org.stereodsm.orchestration;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Deferred result of a cluster task. Depending on the backend it is already computed,
 * being computed in a thread pool, or computed lazily wherever it gets evaluated.
 */
public abstract class Delayed implements Serializable
{
	private static final long serialVersionUID = 2693637564103526437L;

	/**
	 * Waits for (or computes) the value. Calling it several times does not recompute the value.
	 */
	public abstract Object get() throws TaskExecutionException;

	/**
	 * Replaces deferred values by their actual values, recursively through lists.
	 */
	public static Object resolve( final Object arg ) throws TaskExecutionException
	{
		if ( arg instanceof Delayed )
			return ( ( Delayed ) arg ).get();

		if ( arg instanceof List )
		{
			final List< ? > list = ( List< ? > ) arg;
			final List< Object > resolved = new ArrayList<>( list.size() );
			for ( final Object element : list )
				resolved.add( resolve( element ) );
			return resolved;
		}

		return arg;
	}

	public static Object[] resolveAll( final Object[] args ) throws TaskExecutionException
	{
		final Object[] resolved = new Object[ args.length ];
		for ( int i = 0; i < args.length; ++i )
			resolved[ i ] = resolve( args[ i ] );
		return resolved;
	}

	/**
	 * Collects every deferred value found in {@code args}, recursively through lists.
	 */
	public static List< Delayed > dependencies( final Object[] args )
	{
		final List< Delayed > dependencies = new ArrayList<>();
		for ( final Object arg : args )
			collectDependencies( arg, dependencies );
		return dependencies;
	}

	private static void collectDependencies( final Object arg, final List< Delayed > dependencies )
	{
		if ( arg instanceof Delayed )
			dependencies.add( ( Delayed ) arg );
		else if ( arg instanceof List )
			for ( final Object element : ( List< ? > ) arg )
				collectDependencies( element, dependencies );
	}
}
