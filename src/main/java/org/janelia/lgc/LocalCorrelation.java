package org.janelia.lgc;

import java.util.Random;

import org.janelia.lgc.bootstrap.BootstrapResult;
import org.janelia.lgc.bootstrap.CancellationToken;
import org.janelia.lgc.bootstrap.ProgressListener;
import org.janelia.lgc.bootstrap.SequentialBootstrap;
import org.janelia.lgc.data.Bandwidth;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Grid;
import org.janelia.lgc.data.GridValues;
import org.janelia.lgc.data.Marginals;
import org.janelia.lgc.kernel.BandwidthSelector;
import org.janelia.lgc.kernel.CorrelationAndDensity;
import org.janelia.lgc.kernel.GridBuilder;
import org.janelia.lgc.kernel.KernelDensity;
import org.janelia.lgc.kernel.LocalCorrelationEstimator;
import org.janelia.lgc.kernel.MarginalIntegrator;

/**
 * Stateless entry points. Inputs are finite, already transformed values; use
 * {@link Dataset#filterFinite(double[], double[])} to drop invalid pairs first.
 * For cached, incremental use see {@link LocalCorrelationEngine}.
 */
public class LocalCorrelation
{

	/**
	 * @param bandwidthOverride
	 *            kernel bandwidth for both axes, {@code null} for Silverman's
	 *            rule per axis
	 * @throws InsufficientDataException
	 *             for fewer than {@link Dataset#MIN_SAMPLES} pairs
	 * @throws DegenerateBandwidthException
	 *             for a non-positive override or a zero variance axis
	 * @throws DegenerateAxisException
	 *             for a constant axis with an explicit bandwidth
	 */
	public static LocalCorrelationResult computeLocalCorrelation(
			final double[] xData,
			final double[] yData,
			final int gridSize,
			final Double bandwidthOverride )
	{
		return computeLocalCorrelation( xData, yData, gridSize, bandwidthOverride, LocalCorrelationEstimator.DEFAULT_MIN_WEIGHT );
	}

	public static LocalCorrelationResult computeLocalCorrelation(
			final double[] xData,
			final double[] yData,
			final int gridSize,
			final Double bandwidthOverride,
			final double minWeight )
	{
		return compute( Dataset.of( xData, yData ), gridSize, bandwidthOverride, new LocalCorrelationEstimator( minWeight ) );
	}

	public static LocalCorrelationResult compute(
			final Dataset data,
			final int gridSize,
			final Double bandwidthOverride,
			final LocalCorrelationEstimator estimator )
	{
		final Bandwidth bandwidth = BandwidthSelector.select( data, bandwidthOverride );
		final Grid grid = GridBuilder.build( data, gridSize );
		final CorrelationAndDensity grids = estimator.estimate( data, grid, bandwidth );
		final Marginals marginals = MarginalIntegrator.integrate( grids.correlation, grids.density );
		return new LocalCorrelationResult(
				data,
				grid,
				bandwidth,
				grids.correlation,
				grids.density,
				marginals.marginalX,
				marginals.marginalY,
				KernelDensity.estimate( grid.xCoordinates(), data.xValues(), bandwidth.x ),
				KernelDensity.estimate( grid.yCoordinates(), data.yValues(), bandwidth.y ) );
	}

	/**
	 * Bootstrap t-statistics with a fresh random seed.
	 *
	 * @param progressCallback
	 *            may be {@code null}
	 */
	public static BootstrapResult computeBootstrapTStats(
			final double[] xData,
			final double[] yData,
			final double[] xGrid,
			final double[] yGrid,
			final double hx,
			final double hy,
			final GridValues originalZGrid,
			final int nBootstrap,
			final ProgressListener progressCallback )
	{
		return computeBootstrapTStats( xData, yData, xGrid, yGrid, hx, hy, originalZGrid, nBootstrap, progressCallback, new Random().nextLong() );
	}

	public static BootstrapResult computeBootstrapTStats(
			final double[] xData,
			final double[] yData,
			final double[] xGrid,
			final double[] yGrid,
			final double hx,
			final double hy,
			final GridValues originalZGrid,
			final int nBootstrap,
			final ProgressListener progressCallback,
			final long seed )
	{
		return computeBootstrapTStats( xData, yData, xGrid, yGrid, hx, hy, originalZGrid, nBootstrap, progressCallback, seed, LocalCorrelationEstimator.DEFAULT_MIN_WEIGHT );
	}

	/**
	 * @param minWeight
	 *            must match the minimum weight {@code originalZGrid} was
	 *            computed with, or replicates miss cells the original has
	 */
	public static BootstrapResult computeBootstrapTStats(
			final double[] xData,
			final double[] yData,
			final double[] xGrid,
			final double[] yGrid,
			final double hx,
			final double hy,
			final GridValues originalZGrid,
			final int nBootstrap,
			final ProgressListener progressCallback,
			final long seed,
			final double minWeight )
	{
		return new SequentialBootstrap( new LocalCorrelationEstimator( minWeight ), seed ).run(
				Dataset.of( xData, yData ),
				new Grid( xGrid, yGrid ),
				new Bandwidth( hx, hy ),
				originalZGrid,
				nBootstrap,
				progressCallback == null ? ProgressListener.NONE : progressCallback,
				CancellationToken.none() );
	}

	public static Marginals computeTStatMarginals( final GridValues tGrid, final GridValues densityGrid, final int gridSize )
	{
		if ( tGrid.size() != gridSize || densityGrid.size() != gridSize )
			throw new IllegalArgumentException( "Expected grids of size " + gridSize + ", got " + tGrid.size() + " and " + densityGrid.size() );
		return MarginalIntegrator.integrate( tGrid, densityGrid );
	}

}
