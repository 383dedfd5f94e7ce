package org.janelia.lgc.kernel;

import org.janelia.lgc.DegenerateAxisException;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Grid;

/**
 * Evenly spaced evaluation coordinates over the data range, padded by 5% of
 * the span on either side.
 */
public class GridBuilder
{

	public static final double PADDING = 0.05;

	public static double[] axis( final double[] values, final int gridSize )
	{
		return axis( "values", values, gridSize );
	}

	public static Grid build( final Dataset data, final int gridSize )
	{
		return new Grid( axis( "x", data.xValues(), gridSize ), axis( "y", data.yValues(), gridSize ) );
	}

	private static double[] axis( final String name, final double[] values, final int gridSize )
	{
		if ( gridSize < 2 )
			throw new IllegalArgumentException( "gridSize must be at least 2, got " + gridSize );
		if ( values.length == 0 )
			throw new IllegalArgumentException( "Cannot build grid for empty axis " + name );

		double min = Double.POSITIVE_INFINITY;
		double max = Double.NEGATIVE_INFINITY;
		for ( final double v : values )
		{
			min = Math.min( min, v );
			max = Math.max( max, v );
		}

		final double span = max - min;
		if ( !( span > 0.0 ) )
			throw new DegenerateAxisException( name, min );

		final double lower = min - PADDING * span;
		final double upper = max + PADDING * span;
		final double step = ( upper - lower ) / ( gridSize - 1 );

		final double[] coordinates = new double[ gridSize ];
		for ( int i = 0; i < gridSize - 1; ++i )
			coordinates[ i ] = lower + i * step;
		coordinates[ gridSize - 1 ] = upper;
		return coordinates;
	}

}
