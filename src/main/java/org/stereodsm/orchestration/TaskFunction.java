package org.stereodsm.orchestration;

import java.io.Serializable;

/**
 * Body of a cluster task. Arguments are passed positionally, already resolved.
 * A task declared with several outputs returns them as an {@code Object[]} (or a {@code List}) of that length.
 */
@FunctionalInterface
public interface TaskFunction extends Serializable
{
	public Object apply( final Object... args ) throws Exception;
}
