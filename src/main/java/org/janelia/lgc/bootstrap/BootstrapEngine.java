package org.janelia.lgc.bootstrap;

import java.util.concurrent.CancellationException;

import org.janelia.lgc.data.Bandwidth;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Grid;
import org.janelia.lgc.data.GridValues;
import org.janelia.lgc.kernel.LocalCorrelationEstimator;

public interface BootstrapEngine
{

	public static final int DEFAULT_ITERATIONS = 200;

	public static final int DEFAULT_PROGRESS_INTERVAL = 20;

	public static interface Factory
	{
		public BootstrapEngine create( LocalCorrelationEstimator estimator, long seed, int progressInterval );
	}

	/**
	 * Resample {@code data} {@code iterations} times, recompute the local
	 * correlation grid for each replicate and compare the replicate spread
	 * against {@code original}.
	 *
	 * @throws CancellationException
	 *             if {@code cancellation} fires before all iterations are done
	 */
	public BootstrapResult run(
			Dataset data,
			Grid grid,
			Bandwidth bandwidth,
			GridValues original,
			int iterations,
			ProgressListener progress,
			CancellationToken cancellation );

}
