package org.janelia.lgc;

import java.lang.invoke.MethodHandles;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.janelia.lgc.bootstrap.BootstrapEngine;
import org.janelia.lgc.bootstrap.BootstrapResult;
import org.janelia.lgc.bootstrap.CancellationToken;
import org.janelia.lgc.bootstrap.ProgressListener;
import org.janelia.lgc.bootstrap.SequentialBootstrap;
import org.janelia.lgc.cache.Fingerprint;
import org.janelia.lgc.cache.ResultCache;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Marginals;
import org.janelia.lgc.kernel.LocalCorrelationEstimator;

/**
 * Stateful engine owned by one view of the data. Correlation grids are
 * computed eagerly and cached per input; the bootstrap is computed only on
 * request and cached next to the grid it belongs to, so it is discarded as
 * soon as the grid is replaced.
 */
public class LocalCorrelationEngine
{

	public static final Logger LOG = LogManager.getLogger( MethodHandles.lookup().lookupClass() );
	static
	{
		LOG.setLevel( Level.INFO );
	}

	private final EngineOptions options;

	private final LocalCorrelationEstimator estimator;

	private final BootstrapEngine.Factory bootstrapFactory;

	private final ResultCache cache;

	public LocalCorrelationEngine( final EngineOptions options )
	{
		this( options, new SequentialBootstrap.Factory() );
	}

	public LocalCorrelationEngine( final EngineOptions options, final BootstrapEngine.Factory bootstrapFactory )
	{
		super();
		this.options = options.validate();
		this.estimator = new LocalCorrelationEstimator( options.minWeight );
		this.bootstrapFactory = bootstrapFactory;
		this.cache = new ResultCache( options.cacheCapacity );
	}

	public EngineOptions getOptions()
	{
		return options;
	}

	/**
	 * Correlation grid with the configured bandwidth.
	 */
	public LocalCorrelationResult correlation( final Dataset data )
	{
		return correlation( data, options.bandwidth );
	}

	public LocalCorrelationResult correlation( final Dataset data, final Double bandwidthOverride )
	{
		return cache.getOrCompute(
				fingerprint( data, bandwidthOverride ),
				() -> LocalCorrelation.compute( data, options.gridSize, bandwidthOverride, estimator ) );
	}

	public BootstrapResult bootstrap( final Dataset data, final ProgressListener progress, final CancellationToken cancellation )
	{
		return bootstrap( data, options.bandwidth, progress, cancellation );
	}

	/**
	 * Bootstrap t-statistics of the correlation grid for {@code data}. A cached
	 * bootstrap is returned immediately, reporting progress 1.0.
	 */
	public BootstrapResult bootstrap(
			final Dataset data,
			final Double bandwidthOverride,
			final ProgressListener progress,
			final CancellationToken cancellation )
	{
		final Fingerprint key = fingerprint( data, bandwidthOverride );
		final LocalCorrelationResult result = cache.getOrCompute(
				key,
				() -> LocalCorrelation.compute( data, options.gridSize, bandwidthOverride, estimator ) );

		final BootstrapResult cached = cache.getBootstrap( key );
		if ( cached != null )
		{
			LOG.debug( "Using cached bootstrap for " + key );
			progress.progress( 1.0 );
			return cached;
		}

		final long seed = options.seed == null ? new Random().nextLong() : options.seed;
		LOG.info( "Bootstrapping " + key + " with " + options.bootstrapIterations + " iterations, seed=" + seed );
		final BootstrapResult bootstrap = bootstrapFactory
				.create( estimator, seed, options.progressInterval )
				.run( result.data, result.grid, result.bandwidth, result.zGrid, options.bootstrapIterations, progress, cancellation );
		cache.putBootstrap( key, result, bootstrap );
		return bootstrap;
	}

	/**
	 * Run {@link #bootstrap(Dataset, Double, ProgressListener, CancellationToken)}
	 * on {@code executor}. Cancelling the returned future with interruption
	 * stops the bootstrap at the next iteration.
	 */
	public Future< BootstrapResult > bootstrapAsync(
			final Dataset data,
			final Double bandwidthOverride,
			final ProgressListener progress,
			final CancellationToken cancellation,
			final ExecutorService executor )
	{
		return executor.submit( () -> bootstrap( data, bandwidthOverride, progress, cancellation ) );
	}

	/**
	 * Density weighted marginals of the t-statistic grid.
	 */
	public Marginals tStatMarginals( final LocalCorrelationResult correlation, final BootstrapResult bootstrap )
	{
		return LocalCorrelation.computeTStatMarginals( bootstrap.tGrid, correlation.densityGrid, correlation.grid.size() );
	}

	/**
	 * Drop all cached grids and bootstraps.
	 */
	public void invalidate()
	{
		cache.invalidate();
	}

	private Fingerprint fingerprint( final Dataset data, final Double bandwidthOverride )
	{
		return Fingerprint.of( data, bandwidthOverride, options.gridSize, options.minWeight );
	}

}
