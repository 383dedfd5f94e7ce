package org.janelia.lgc.bootstrap;

import java.lang.invoke.MethodHandles;
import java.util.ArrayList;

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.apache.spark.api.java.JavaSparkContext;
import org.apache.spark.api.java.function.Function;
import org.apache.spark.api.java.function.Function2;
import org.apache.spark.broadcast.Broadcast;
import org.janelia.lgc.data.Bandwidth;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Grid;
import org.janelia.lgc.data.GridValues;
import org.janelia.lgc.kernel.LocalCorrelationEstimator;

/**
 * Distributes bootstrap replicates over a Spark cluster. Iterations are
 * submitted in batches of {@code progressInterval}; progress and cancellation
 * are handled on the driver between batches. Replicate b draws the same
 * indices as in {@link SequentialBootstrap}, so both agree for equal seeds up
 * to floating point summation order.
 */
public class SparkBootstrap implements BootstrapEngine
{

	public static final Logger LOG = LogManager.getLogger( MethodHandles.lookup().lookupClass() );
	static
	{
		LOG.setLevel( Level.INFO );
	}

	public static class Factory implements BootstrapEngine.Factory
	{

		private final JavaSparkContext sc;

		public Factory( final JavaSparkContext sc )
		{
			super();
			this.sc = sc;
		}

		@Override
		public BootstrapEngine create( final LocalCorrelationEstimator estimator, final long seed, final int progressInterval )
		{
			return new SparkBootstrap( sc, estimator, seed, progressInterval );
		}

	}

	private final JavaSparkContext sc;

	private final LocalCorrelationEstimator estimator;

	private final long seed;

	private final int progressInterval;

	public SparkBootstrap( final JavaSparkContext sc, final LocalCorrelationEstimator estimator, final long seed, final int progressInterval )
	{
		super();
		if ( progressInterval < 1 )
			throw new IllegalArgumentException( "progressInterval must be positive, got " + progressInterval );
		this.sc = sc;
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
		final int size = grid.size();
		final ReplicateStatistics statistics = new ReplicateStatistics( size );
		final Broadcast< Dataset > broadcastData = sc.broadcast( data );

		try
		{
			for ( int start = 0; start < iterations; start += progressInterval )
			{
				progress.progress( ( double ) start / iterations );
				cancellation.throwIfCancelled();

				final int stop = Math.min( start + progressInterval, iterations );
				final ArrayList< Integer > replicates = new ArrayList<>();
				for ( int b = start; b < stop; ++b )
					replicates.add( b );

				final ReplicateStatistics batch = sc
						.parallelize( replicates )
						.map( new ReplicateCorrelations( broadcastData, grid, bandwidth, estimator.getMinWeight(), seed ) )
						.aggregate( new ReplicateStatistics( size ), new AddReplicate(), new MergeStatistics() );
				statistics.merge( batch );

				LOG.debug( "Bootstrap iterations " + start + " to " + stop + " of " + iterations + " done." );
			}
		}
		finally
		{
			broadcastData.unpersist();
		}

		progress.progress( 1.0 );
		LOG.info( String.format( "Spark bootstrap with %d iterations on %d samples done in %dms", iterations, data.size(), System.currentTimeMillis() - tStart ) );

		return statistics.toResult( original, iterations );
	}

	public static class ReplicateCorrelations implements Function< Integer, GridValues >
	{

		private static final long serialVersionUID = -6187457102648214466L;

		private final Broadcast< Dataset > data;

		private final Grid grid;

		private final Bandwidth bandwidth;

		private final double minWeight;

		private final long seed;

		public ReplicateCorrelations( final Broadcast< Dataset > data, final Grid grid, final Bandwidth bandwidth, final double minWeight, final long seed )
		{
			super();
			this.data = data;
			this.grid = grid;
			this.bandwidth = bandwidth;
			this.minWeight = minWeight;
			this.seed = seed;
		}

		@Override
		public GridValues call( final Integer replicate ) throws Exception
		{
			final Dataset dataset = data.getValue();
			final Dataset resampled = dataset.resample( ReplicateSampler.indices( dataset.size(), seed, replicate.intValue() ) );
			return new LocalCorrelationEstimator( minWeight ).correlations( resampled, grid, bandwidth );
		}
	}

	public static class AddReplicate implements Function2< ReplicateStatistics, GridValues, ReplicateStatistics >
	{

		private static final long serialVersionUID = 1766349950238017893L;

		@Override
		public ReplicateStatistics call( final ReplicateStatistics statistics, final GridValues replicate ) throws Exception
		{
			return statistics.add( replicate );
		}
	}

	public static class MergeStatistics implements Function2< ReplicateStatistics, ReplicateStatistics, ReplicateStatistics >
	{

		private static final long serialVersionUID = -2795001853046811522L;

		@Override
		public ReplicateStatistics call( final ReplicateStatistics s1, final ReplicateStatistics s2 ) throws Exception
		{
			return s1.merge( s2 );
		}
	}

}
