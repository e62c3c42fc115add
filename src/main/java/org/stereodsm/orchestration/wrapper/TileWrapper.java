package org.stereodsm.orchestration.wrapper;

import org.stereodsm.orchestration.TaskFunction;

/**
 * Decorates task functions to control how tile values enter and leave the tasks.
 * Wrappers are interchangeable: wrapping never changes the arguments or the number of outputs of a task.
 */
public interface TileWrapper
{
	/**
	 * Called once per task call, before the call is submitted.
	 */
	public TaskFunction wrapFunction( final TaskFunction func, final int nout );

	/**
	 * @return the in-memory value of a task result
	 */
	public Object getObject( final Object obj );

	public void cleanup();
}
