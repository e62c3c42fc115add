package org.stereodsm.orchestration;

import java.io.Closeable;
import java.util.Iterator;
import java.util.List;

/**
 * Runs per-tile computations as tasks. Backends differ only in where and when the tasks run:
 * implementations are selected once when a pipeline starts and never mixed within a run.
 */
public interface Cluster extends Closeable
{
	public Task createTask( final TaskFunction func );

	public Task createTask( final TaskFunction func, final int nout );

	/**
	 * Evaluates a batch of deferred results. Results come back in the order of {@code tasks};
	 * elements that are not deferred are returned as is.
	 */
	public List< Object > startTasks( final List< ? > tasks ) throws TaskExecutionException;

	/**
	 * Makes {@code data} available to the task functions, to be passed as a task argument.
	 */
	public Object scatter( final Object data, final boolean broadcast );

	/**
	 * Yields the results of {@code futures} as they become available.
	 * A failed task surfaces as a {@link java.util.concurrent.CompletionException} caused by a {@link TaskExecutionException}.
	 * The iterator is single-pass.
	 */
	public Iterator< Object > futureIterator( final List< ? > futures );

	/**
	 * Converts a task result (possibly a dumped tile) back to an in-memory value.
	 */
	public Object getObject( final Object obj );

	/**
	 * Removes every temporary resource of the run. Dumped results cannot be loaded afterwards.
	 */
	public void cleanup();

	/**
	 * Cleans up and releases the backend resources.
	 */
	@Override
	public void close();
}
