package org.stereodsm.orchestration;

/**
 * Result of a task that already ran: either its value or its failure.
 */
public class CompletedDelayed extends Delayed
{
	private static final long serialVersionUID = -1040929513312946035L;

	private final Object value;
	private final Throwable failure;

	private CompletedDelayed( final Object value, final Throwable failure )
	{
		this.value = value;
		this.failure = failure;
	}

	public static CompletedDelayed of( final Object value )
	{
		return new CompletedDelayed( value, null );
	}

	public static CompletedDelayed failed( final Throwable failure )
	{
		return new CompletedDelayed( null, failure );
	}

	public boolean isFailed()
	{
		return failure != null;
	}

	@Override
	public Object get() throws TaskExecutionException
	{
		if ( failure != null )
			throw failure instanceof TaskExecutionException ? ( TaskExecutionException ) failure : new TaskExecutionException( failure );
		return value;
	}
}
