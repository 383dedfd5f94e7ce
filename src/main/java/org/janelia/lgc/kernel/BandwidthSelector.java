package org.janelia.lgc.kernel;

import org.janelia.lgc.DegenerateBandwidthException;
import org.janelia.lgc.data.Bandwidth;
import org.janelia.lgc.data.Dataset;

import net.imglib2.util.RealSum;

/**
 * Kernel bandwidth per axis, either from Silverman's rule of thumb or from a
 * caller supplied override that is used for both axes.
 */
public class BandwidthSelector
{

	public static final double SILVERMAN_FACTOR = 1.06;

	/**
	 * h = 1.06 * sigma * n^(-1/5), with sigma the population standard
	 * deviation of {@code values}.
	 *
	 * @throws DegenerateBandwidthException
	 *             if fewer than two values are given or their variance is
	 *             zero
	 */
	public static double silverman( final double[] values )
	{
		final int n = values.length;
		if ( n < 2 )
			throw new DegenerateBandwidthException( "Silverman's rule needs at least 2 values, got " + n );

		final RealSum sum = new RealSum();
		for ( final double v : values )
			sum.add( v );
		final double mean = sum.getSum() / n;

		final RealSum squares = new RealSum();
		for ( final double v : values )
		{
			final double d = v - mean;
			squares.add( d * d );
		}
		final double sigma = Math.sqrt( squares.getSum() / n );

		final double h = SILVERMAN_FACTOR * sigma * Math.pow( n, -0.2 );
		if ( !( h > 0.0 ) || Double.isInfinite( h ) )
			throw new DegenerateBandwidthException( "Zero variance axis, Silverman bandwidth is " + h );
		return h;
	}

	/**
	 * @param override
	 *            bandwidth for both axes, {@code null} selects each axis
	 *            independently via {@link #silverman(double[])}
	 */
	public static Bandwidth select( final Dataset data, final Double override )
	{
		if ( override != null )
			return new Bandwidth( override, override );
		return new Bandwidth( silverman( data.xValues() ), silverman( data.yValues() ) );
	}

}
