package org.janelia.lgc.kernel;

import org.janelia.lgc.data.Bandwidth;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Grid;
import org.janelia.lgc.data.GridValues;

import net.imglib2.util.RealSum;

/**
 * Gaussian kernel weighted Pearson correlation at every cell of a {@link Grid}.
 *
 * For cell (i, j) sample k has weight
 * w_k = exp(-0.5 ((x_k - xGrid_i) / hx)^2 - 0.5 ((y_k - yGrid_j) / hy)^2).
 * With W = sum w_k, the cell is absent if W is below the minimum weight or if
 * either weighted variance is not positive. Otherwise the correlation is
 * cov / sqrt(varX varY), clamped to [-1, 1], and the density is W / n.
 *
 * Evaluation is O(gridSize^2 n) in time, O(gridSize^2 + gridSize BLOCK_SIZE)
 * in memory, and deterministic.
 */
public class LocalCorrelationEstimator
{

	public static final double DEFAULT_MIN_WEIGHT = 0.1;

	/**
	 * Samples per block of precomputed kernel factors, bounds memory to
	 * 2 gridSize BLOCK_SIZE doubles independent of n.
	 */
	public static final int BLOCK_SIZE = 4096;

	private final double minWeight;

	public LocalCorrelationEstimator()
	{
		this( DEFAULT_MIN_WEIGHT );
	}

	public LocalCorrelationEstimator( final double minWeight )
	{
		super();
		if ( !( minWeight >= 0.0 ) || Double.isInfinite( minWeight ) )
			throw new IllegalArgumentException( "minWeight must be finite and non-negative, got " + minWeight );
		this.minWeight = minWeight;
	}

	public double getMinWeight()
	{
		return minWeight;
	}

	public CorrelationAndDensity estimate( final Dataset data, final Grid grid, final Bandwidth bandwidth )
	{
		final GridValues.Builder correlation = new GridValues.Builder( grid.size() );
		final GridValues.Builder density = new GridValues.Builder( grid.size() );
		evaluate( data, grid, bandwidth, correlation, density );
		return new CorrelationAndDensity( correlation.build(), density.build() );
	}

	/**
	 * Correlation grid only, for bootstrap replicates.
	 */
	public GridValues correlations( final Dataset data, final Grid grid, final Bandwidth bandwidth )
	{
		final GridValues.Builder correlation = new GridValues.Builder( grid.size() );
		evaluate( data, grid, bandwidth, correlation, null );
		return correlation.build();
	}

	private void evaluate(
			final Dataset data,
			final Grid grid,
			final Bandwidth bandwidth,
			final GridValues.Builder correlation,
			final GridValues.Builder density )
	{
		final int n = data.size();
		final int size = grid.size();
		final int cells = size * size;

		final RealSum[] sumW = sums( cells );
		final RealSum[] sumWX = sums( cells );
		final RealSum[] sumWY = sums( cells );
		final KernelBlock block = new KernelBlock( data, grid, bandwidth );

		for ( int start = 0; start < n; start += BLOCK_SIZE )
		{
			final int stop = block.fill( start );
			for ( int yIndex = 0, c = 0; yIndex < size; ++yIndex )
				for ( int xIndex = 0; xIndex < size; ++xIndex, ++c )
				{
					final double[] kx = block.kernelX[ xIndex ];
					final double[] ky = block.kernelY[ yIndex ];
					for ( int k = start; k < stop; ++k )
					{
						final double w = kx[ k - start ] * ky[ k - start ];
						sumW[ c ].add( w );
						sumWX[ c ].add( w * data.x( k ) );
						sumWY[ c ].add( w * data.y( k ) );
					}
				}
		}

		final boolean[] supported = new boolean[ cells ];
		final double[] meanX = new double[ cells ];
		final double[] meanY = new double[ cells ];
		for ( int c = 0; c < cells; ++c )
		{
			final double totalWeight = sumW[ c ].getSum();
			supported[ c ] = totalWeight > 0.0 && totalWeight >= minWeight;
			if ( supported[ c ] )
			{
				meanX[ c ] = sumWX[ c ].getSum() / totalWeight;
				meanY[ c ] = sumWY[ c ].getSum() / totalWeight;
			}
		}

		final RealSum[] sumWXX = sums( cells );
		final RealSum[] sumWYY = sums( cells );
		final RealSum[] sumWXY = sums( cells );
		for ( int start = 0; start < n; start += BLOCK_SIZE )
		{
			final int stop = block.fill( start );
			for ( int yIndex = 0, c = 0; yIndex < size; ++yIndex )
				for ( int xIndex = 0; xIndex < size; ++xIndex, ++c )
				{
					if ( !supported[ c ] )
						continue;
					final double[] kx = block.kernelX[ xIndex ];
					final double[] ky = block.kernelY[ yIndex ];
					for ( int k = start; k < stop; ++k )
					{
						final double w = kx[ k - start ] * ky[ k - start ];
						final double dx = data.x( k ) - meanX[ c ];
						final double dy = data.y( k ) - meanY[ c ];
						sumWXX[ c ].add( w * dx * dx );
						sumWYY[ c ].add( w * dy * dy );
						sumWXY[ c ].add( w * dx * dy );
					}
				}
		}

		for ( int yIndex = 0, c = 0; yIndex < size; ++yIndex )
			for ( int xIndex = 0; xIndex < size; ++xIndex, ++c )
			{
				if ( !supported[ c ] )
					continue;

				final double totalWeight = sumW[ c ].getSum();
				final double varX = sumWXX[ c ].getSum() / totalWeight;
				final double varY = sumWYY[ c ].getSum() / totalWeight;
				if ( !( varX > 0.0 ) || !( varY > 0.0 ) )
					continue;

				// separate roots, the product of two tiny variances underflows
				final double rho = ( sumWXY[ c ].getSum() / totalWeight ) / ( Math.sqrt( varX ) * Math.sqrt( varY ) );
				if ( Double.isNaN( rho ) )
					continue;

				correlation.set( xIndex, yIndex, Math.max( -1.0, Math.min( 1.0, rho ) ) );
				if ( density != null )
					density.set( xIndex, yIndex, totalWeight / n );
			}
	}

	private static RealSum[] sums( final int count )
	{
		final RealSum[] sums = new RealSum[ count ];
		for ( int i = 0; i < count; ++i )
			sums[ i ] = new RealSum();
		return sums;
	}

	/**
	 * Per-axis kernel factors for one block of samples:
	 * exp(a + b) = exp(a) * exp(b), so one exponential per sample and grid
	 * coordinate instead of one per sample and cell.
	 */
	private static class KernelBlock
	{

		private final Dataset data;

		private final Grid grid;

		private final Bandwidth bandwidth;

		private final double[][] kernelX;

		private final double[][] kernelY;

		private KernelBlock( final Dataset data, final Grid grid, final Bandwidth bandwidth )
		{
			this.data = data;
			this.grid = grid;
			this.bandwidth = bandwidth;
			final int length = Math.min( BLOCK_SIZE, data.size() );
			this.kernelX = new double[ grid.size() ][ length ];
			this.kernelY = new double[ grid.size() ][ length ];
		}

		/**
		 * @return end (exclusive) of the block starting at {@code start}
		 */
		private int fill( final int start )
		{
			final int stop = Math.min( start + BLOCK_SIZE, data.size() );
			for ( int i = 0; i < grid.size(); ++i )
				for ( int k = start; k < stop; ++k )
				{
					final double dx = ( data.x( k ) - grid.x( i ) ) / bandwidth.x;
					final double dy = ( data.y( k ) - grid.y( i ) ) / bandwidth.y;
					kernelX[ i ][ k - start ] = Math.exp( -0.5 * dx * dx );
					kernelY[ i ][ k - start ] = Math.exp( -0.5 * dy * dy );
				}
			return stop;
		}
	}

}
