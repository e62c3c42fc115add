package org.stereodsm.orchestration;

import org.apache.spark.broadcast.Broadcast;

/**
 * Data scattered to the Spark executors once and shared by every task that receives it.
 */
public class BroadcastDelayed extends Delayed
{
	private static final long serialVersionUID = 3322514651049213036L;

	private final Broadcast< Object > broadcast;

	public BroadcastDelayed( final Broadcast< Object > broadcast )
	{
		this.broadcast = broadcast;
	}

	@Override
	public Object get()
	{
		return broadcast.value();
	}
}
