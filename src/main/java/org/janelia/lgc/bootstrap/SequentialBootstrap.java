package org.janelia.lgc.bootstrap;

import java.lang.invoke.MethodHandles;

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.janelia.lgc.data.Bandwidth;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Grid;
import org.janelia.lgc.data.GridValues;
import org.janelia.lgc.kernel.LocalCorrelationEstimator;

/**
 * Runs all replicates in the calling thread, in batches of
 * {@code progressInterval} iterations. Progress is reported and the thread
 * yields after every batch; cancellation is checked before every iteration.
 */
public class SequentialBootstrap implements BootstrapEngine
{

	public static final Logger LOG = LogManager.getLogger( MethodHandles.lookup().lookupClass() );
	static
	{
		LOG.setLevel( Level.INFO );
	}

	public static class Factory implements BootstrapEngine.Factory
	{

		@Override
		public BootstrapEngine create( final LocalCorrelationEstimator estimator, final long seed, final int progressInterval )
		{
			return new SequentialBootstrap( estimator, seed, progressInterval );
		}

	}

	private final LocalCorrelationEstimator estimator;

	private final long seed;

	private final int progressInterval;

	public SequentialBootstrap( final LocalCorrelationEstimator estimator, final long seed )
	{
		this( estimator, seed, DEFAULT_PROGRESS_INTERVAL );
	}

	public SequentialBootstrap( final LocalCorrelationEstimator estimator, final long seed, final int progressInterval )
	{
		super();
		if ( progressInterval < 1 )
			throw new IllegalArgumentException( "progressInterval must be positive, got " + progressInterval );
		this.estimator = estimator;
		this.seed = seed;
		this.progressInterval = progressInterval;
	}

	@Override
	public BootstrapResult run(
			final Dataset data,
			final Grid grid,
			final Bandwidth bandwidth,
			final GridValues original,
			final int iterations,
			final ProgressListener progress,
			final CancellationToken cancellation )
	{
		if ( iterations < 1 )
			throw new IllegalArgumentException( "Need at least one bootstrap iteration, got " + iterations );
		if ( original.size() != grid.size() )
			throw new IllegalArgumentException( "Original grid size " + original.size() + " does not match grid size " + grid.size() );

		final long tStart = System.currentTimeMillis();
		final ReplicateStatistics statistics = new ReplicateStatistics( grid.size() );

		for ( int b = 0; b < iterations; ++b )
		{
			if ( b % progressInterval == 0 )
			{
				progress.progress( ( double ) b / iterations );
				if ( b > 0 )
				{
					LOG.debug( "Bootstrap iteration " + b + "/" + iterations );
					Thread.yield();
				}
			}
			cancellation.throwIfCancelled();

			final Dataset replicate = data.resample( ReplicateSampler.indices( data.size(), seed, b ) );
			statistics.add( estimator.correlations( replicate, grid, bandwidth ) );
		}

		progress.progress( 1.0 );
		LOG.info( String.format( "Bootstrap with %d iterations on %d samples done in %dms", iterations, data.size(), System.currentTimeMillis() - tStart ) );

		return statistics.toResult( original, iterations );
	}

}
