package org.janelia.lgc.data;

import java.io.Serializable;

import org.janelia.lgc.InsufficientDataException;

/**
 * Immutable, ordered set of finite (x, y) sample pairs.
 */
public class Dataset implements Serializable
{

	private static final long serialVersionUID = -5237167914480744516L;

	public static final int MIN_SAMPLES = 10;

	private final double[] x;

	private final double[] y;

	private Dataset( final double[] x, final double[] y )
	{
		super();
		this.x = x;
		this.y = y;
	}

	/**
	 * @throws IllegalArgumentException
	 *             if lengths differ or any value is not finite
	 * @throws InsufficientDataException
	 *             if fewer than {@link #MIN_SAMPLES} pairs are given
	 */
	public static Dataset of( final double[] x, final double[] y )
	{
		checkLengths( x, y );
		for ( int k = 0; k < x.length; ++k )
			if ( !isFinitePair( x[ k ], y[ k ] ) )
				throw new IllegalArgumentException( "Non-finite sample at index " + k + ": (" + x[ k ] + ", " + y[ k ] + ")" );
		if ( x.length < MIN_SAMPLES )
			throw new InsufficientDataException( x.length, MIN_SAMPLES );
		return new Dataset( x.clone(), y.clone() );
	}

	/**
	 * Drop every pair in which either value is NaN or infinite and create a
	 * {@link Dataset} from the remaining pairs.
	 */
	public static Dataset filterFinite( final double[] x, final double[] y )
	{
		checkLengths( x, y );
		int count = 0;
		for ( int k = 0; k < x.length; ++k )
			if ( isFinitePair( x[ k ], y[ k ] ) )
				++count;

		if ( count < MIN_SAMPLES )
			throw new InsufficientDataException( count, MIN_SAMPLES );

		final double[] fx = new double[ count ];
		final double[] fy = new double[ count ];
		for ( int k = 0, m = 0; k < x.length; ++k )
			if ( isFinitePair( x[ k ], y[ k ] ) )
			{
				fx[ m ] = x[ k ];
				fy[ m ] = y[ k ];
				++m;
			}
		return new Dataset( fx, fy );
	}

	/**
	 * Bootstrap replicate: pair {@code k} of the result is pair
	 * {@code indices[k]} of this dataset.
	 */
	public Dataset resample( final int[] indices )
	{
		final double[] rx = new double[ indices.length ];
		final double[] ry = new double[ indices.length ];
		for ( int k = 0; k < indices.length; ++k )
		{
			rx[ k ] = x[ indices[ k ] ];
			ry[ k ] = y[ indices[ k ] ];
		}
		return new Dataset( rx, ry );
	}

	public int size()
	{
		return x.length;
	}

	public double x( final int k )
	{
		return x[ k ];
	}

	public double y( final int k )
	{
		return y[ k ];
	}

	public double[] xValues()
	{
		return x.clone();
	}

	public double[] yValues()
	{
		return y.clone();
	}

	private static boolean isFinitePair( final double vx, final double vy )
	{
		return Double.isFinite( vx ) && Double.isFinite( vy );
	}

	private static void checkLengths( final double[] x, final double[] y )
	{
		if ( x.length != y.length )
			throw new IllegalArgumentException( "x and y differ in length: " + x.length + " != " + y.length );
	}

}
