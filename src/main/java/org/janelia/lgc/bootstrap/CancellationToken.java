package org.janelia.lgc.bootstrap;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Best effort cancellation for long running bootstraps. Implementations check
 * the token between iterations or batches.
 */
public class CancellationToken
{

	private final AtomicBoolean cancelled = new AtomicBoolean( false );

	public void cancel()
	{
		cancelled.set( true );
	}

	public boolean isCancelled()
	{
		return cancelled.get();
	}

	/**
	 * @throws CancellationException
	 *             if this token was cancelled or the current thread was
	 *             interrupted
	 */
	public void throwIfCancelled()
	{
		if ( isCancelled() )
			throw new CancellationException( "Bootstrap cancelled." );
		if ( Thread.currentThread().isInterrupted() )
			throw new CancellationException( "Bootstrap thread interrupted." );
	}

	/**
	 * A token that is never cancelled by anyone else.
	 */
	public static CancellationToken none()
	{
		return new CancellationToken();
	}

}
