package org.janelia.lgc.kernel;

import net.imglib2.util.RealSum;

/**
 * Normalized one dimensional Gaussian kernel density estimate.
 */
public class KernelDensity
{

	private static final double NORMALIZATION = 1.0 / Math.sqrt( 2.0 * Math.PI );

	public static double gaussian( final double distance, final double bandwidth )
	{
		final double u = distance / bandwidth;
		return Math.exp( -0.5 * u * u ) * NORMALIZATION / bandwidth;
	}

	public static double estimate( final double at, final double[] data, final double bandwidth )
	{
		final RealSum sum = new RealSum();
		for ( final double v : data )
			sum.add( gaussian( at - v, bandwidth ) );
		return sum.getSum() / data.length;
	}

	public static double[] estimate( final double[] at, final double[] data, final double bandwidth )
	{
		final double[] density = new double[ at.length ];
		for ( int i = 0; i < at.length; ++i )
			density[ i ] = estimate( at[ i ], data, bandwidth );
		return density;
	}

}
