package org.janelia.lgc.bootstrap;

import java.io.Serializable;

import org.janelia.lgc.data.GridValues;

/**
 * Running per cell count, mean and sum of squared deviations (Welford) of the
 * replicate correlations. Two instances over disjoint replicate sets can be
 * merged, which lets replicates be folded in any order or on any worker.
 */
public class ReplicateStatistics implements Serializable
{

	private static final long serialVersionUID = 3504620659364860101L;

	public static final int MIN_REPLICATES = 10;

	/**
	 * Standard errors at or below this produce a saturated t-statistic.
	 */
	public static final double MIN_STANDARD_ERROR = 0.001;

	public static final double SATURATED_T = 10.0;

	private final int size;

	private final int[] count;

	private final double[] mean;

	private final double[] m2;

	public ReplicateStatistics( final int size )
	{
		this( size, new int[ size * size ], new double[ size * size ], new double[ size * size ] );
	}

	public ReplicateStatistics( final int size, final int[] count, final double[] mean, final double[] m2 )
	{
		super();
		this.size = size;
		this.count = count;
		this.mean = mean;
		this.m2 = m2;
	}

	/**
	 * Fold every defined cell of a replicate correlation grid into the
	 * statistics.
	 *
	 * @return this
	 */
	public ReplicateStatistics add( final GridValues replicate )
	{
		checkSize( replicate.size() );
		final double[] values = replicate.values();
		final boolean[] defined = replicate.definedMask();
		for ( int c = 0; c < count.length; ++c )
		{
			if ( !defined[ c ] )
				continue;
			final int k = ++count[ c ];
			final double delta = values[ c ] - mean[ c ];
			mean[ c ] += delta / k;
			m2[ c ] += delta * ( values[ c ] - mean[ c ] );
		}
		return this;
	}

	/**
	 * Combine with statistics over a disjoint set of replicates (Chan et al.).
	 *
	 * @return this
	 */
	public ReplicateStatistics merge( final ReplicateStatistics other )
	{
		checkSize( other.size );
		for ( int c = 0; c < count.length; ++c )
		{
			final int nb = other.count[ c ];
			if ( nb == 0 )
				continue;
			final int na = count[ c ];
			if ( na == 0 )
			{
				count[ c ] = nb;
				mean[ c ] = other.mean[ c ];
				m2[ c ] = other.m2[ c ];
				continue;
			}
			final int n = na + nb;
			final double delta = other.mean[ c ] - mean[ c ];
			mean[ c ] += delta * nb / n;
			m2[ c ] += other.m2[ c ] + delta * delta * ( ( double ) na * nb / n );
			count[ c ] = n;
		}
		return this;
	}

	/**
	 * Standard errors and t-statistics against the original correlation grid.
	 * A cell is absent if the original is absent there or fewer than
	 * {@link #MIN_REPLICATES} replicates were collected.
	 */
	public BootstrapResult toResult( final GridValues original, final int iterations )
	{
		checkSize( original.size() );
		final GridValues.Builder tGrid = new GridValues.Builder( size );
		final GridValues.Builder seGrid = new GridValues.Builder( size );
		for ( int yIndex = 0; yIndex < size; ++yIndex )
			for ( int xIndex = 0; xIndex < size; ++xIndex )
			{
				final int c = yIndex * size + xIndex;
				if ( count[ c ] < MIN_REPLICATES || !original.isDefined( xIndex, yIndex ) )
					continue;

				final double se = Math.sqrt( Math.max( m2[ c ], 0.0 ) / ( count[ c ] - 1 ) );
				final double rho = original.getDefined( xIndex, yIndex );
				seGrid.set( xIndex, yIndex, se );
				tGrid.set( xIndex, yIndex, se > MIN_STANDARD_ERROR ? rho / se : Math.signum( rho ) * SATURATED_T );
			}
		return new BootstrapResult( tGrid.build(), seGrid.build(), count.clone(), iterations );
	}

	public int size()
	{
		return size;
	}

	public int count( final int xIndex, final int yIndex )
	{
		return count[ yIndex * size + xIndex ];
	}

	// raw storage for serializers
	public int[] counts()
	{
		return count;
	}

	public double[] means()
	{
		return mean;
	}

	public double[] squaredDeviations()
	{
		return m2;
	}

	private void checkSize( final int otherSize )
	{
		if ( otherSize != size )
			throw new IllegalArgumentException( "Grid size " + otherSize + " does not match statistics of size " + size );
	}

}
