package org.janelia.lgc.cache;

import java.lang.invoke.MethodHandles;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.janelia.lgc.LocalCorrelationResult;
import org.janelia.lgc.bootstrap.BootstrapResult;

/**
 * Memoizes correlation results and their lazily computed bootstrap per
 * {@link Fingerprint}. Holds at most {@code capacity} entries and evicts the
 * least recently used one, together with its bootstrap. All access goes
 * through a single lock: an entry written on a miss is fully in place before
 * any later lookup returns.
 */
public class ResultCache
{

	public static final Logger LOG = LogManager.getLogger( MethodHandles.lookup().lookupClass() );
	static
	{
		LOG.setLevel( Level.INFO );
	}

	private static class Entry
	{
		private final LocalCorrelationResult correlation;

		private BootstrapResult bootstrap;

		private Entry( final LocalCorrelationResult correlation )
		{
			this.correlation = correlation;
		}
	}

	private final ReentrantLock lock = new ReentrantLock();

	private final LinkedHashMap< Fingerprint, Entry > entries;

	public ResultCache( final int capacity )
	{
		super();
		if ( capacity < 1 )
			throw new IllegalArgumentException( "Cache capacity must be positive, got " + capacity );
		this.entries = new LinkedHashMap< Fingerprint, Entry >( 16, 0.75f, true )
		{
			private static final long serialVersionUID = -8317346209497853640L;

			@Override
			protected boolean removeEldestEntry( final Map.Entry< Fingerprint, Entry > eldest )
			{
				final boolean evict = size() > capacity;
				if ( evict )
					LOG.debug( "Evicting " + eldest.getKey() + ( eldest.getValue().bootstrap == null ? "" : " and its bootstrap" ) );
				return evict;
			}
		};
	}

	/**
	 * Cached correlation result for {@code key}, or the result of
	 * {@code compute}, which is then stored under {@code key} without a
	 * bootstrap.
	 */
	public LocalCorrelationResult getOrCompute( final Fingerprint key, final Supplier< LocalCorrelationResult > compute )
	{
		lock.lock();
		try
		{
			final Entry cached = entries.get( key );
			if ( cached != null )
			{
				LOG.debug( "Cache hit for " + key );
				return cached.correlation;
			}
			LOG.info( "Cache miss for " + key + ", computing local correlation." );
			final LocalCorrelationResult result = compute.get();
			entries.put( key, new Entry( result ) );
			return result;
		}
		finally
		{
			lock.unlock();
		}
	}

	/**
	 * @return cached correlation result for {@code key} or {@code null}
	 */
	public LocalCorrelationResult getCorrelation( final Fingerprint key )
	{
		lock.lock();
		try
		{
			final Entry entry = entries.get( key );
			return entry == null ? null : entry.correlation;
		}
		finally
		{
			lock.unlock();
		}
	}

	/**
	 * @return cached bootstrap for {@code key} or {@code null}
	 */
	public BootstrapResult getBootstrap( final Fingerprint key )
	{
		lock.lock();
		try
		{
			final Entry entry = entries.get( key );
			return entry == null ? null : entry.bootstrap;
		}
		finally
		{
			lock.unlock();
		}
	}

	/**
	 * Attach {@code bootstrap} to the entry for {@code key}, provided that
	 * entry still holds {@code source}, the correlation result the bootstrap
	 * was computed from. A bootstrap for an evicted or replaced entry is
	 * stale and dropped.
	 *
	 * @return whether the bootstrap was stored
	 */
	public boolean putBootstrap( final Fingerprint key, final LocalCorrelationResult source, final BootstrapResult bootstrap )
	{
		lock.lock();
		try
		{
			final Entry entry = entries.get( key );
			if ( entry == null || entry.correlation != source )
			{
				LOG.info( "Dropping stale bootstrap for " + key );
				return false;
			}
			entry.bootstrap = bootstrap;
			return true;
		}
		finally
		{
			lock.unlock();
		}
	}

	public void invalidate()
	{
		lock.lock();
		try
		{
			entries.clear();
		}
		finally
		{
			lock.unlock();
		}
	}

	public int size()
	{
		lock.lock();
		try
		{
			return entries.size();
		}
		finally
		{
			lock.unlock();
		}
	}

}
