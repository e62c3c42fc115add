package org.stereodsm.orchestration.wrapper;

import org.stereodsm.orchestration.TaskFunction;

/**
 * Keeps tile values in memory.
 */
public class NoneWrapper implements TileWrapper
{
	@Override
	public TaskFunction wrapFunction( final TaskFunction func, final int nout )
	{
		return func;
	}

	@Override
	public Object getObject( final Object obj )
	{
		return obj;
	}

	@Override
	public void cleanup() {}
}
