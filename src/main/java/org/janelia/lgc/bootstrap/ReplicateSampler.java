package org.janelia.lgc.bootstrap;

import java.util.Random;

/**
 * Draws bootstrap indices. Every replicate gets its own generator derived from
 * the run seed and the replicate number, so a replicate's sample does not
 * depend on which thread or Spark task computes it, or in which order.
 */
public class ReplicateSampler
{

	private static final long GOLDEN_GAMMA = 0x9E3779B97F4A7C15L;

	public static int[] indices( final int n, final long seed, final int replicate )
	{
		final Random rng = new Random( mix( seed + GOLDEN_GAMMA * ( replicate + 1L ) ) );
		final int[] indices = new int[ n ];
		for ( int k = 0; k < n; ++k )
			indices[ k ] = rng.nextInt( n );
		return indices;
	}

	// splitmix64 finalizer
	private static long mix( long z )
	{
		z = ( z ^ ( z >>> 30 ) ) * 0xBF58476D1CE4E5B9L;
		z = ( z ^ ( z >>> 27 ) ) * 0x94D049BB133111EBL;
		return z ^ ( z >>> 31 );
	}

}
