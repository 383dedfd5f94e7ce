package org.janelia.lgc.kernel;

import org.janelia.lgc.data.GridValues;
import org.janelia.lgc.data.MarginalCurve;
import org.janelia.lgc.data.Marginals;

/**
 * Reduces a grid (local correlation or t-statistic) to two curves by density
 * weighted averaging along one axis. Absent cells are skipped; a coordinate
 * whose remaining density weight is zero has no marginal value.
 */
public class MarginalIntegrator
{

	public static Marginals integrate( final GridValues values, final GridValues density )
	{
		final int size = values.size();
		if ( density.size() != size )
			throw new IllegalArgumentException( "Value grid size " + size + " does not match density grid size " + density.size() );

		final Double[] marginalX = new Double[ size ];
		for ( int xIndex = 0; xIndex < size; ++xIndex )
		{
			double weighted = 0.0;
			double weights = 0.0;
			for ( int yIndex = 0; yIndex < size; ++yIndex )
				if ( values.isDefined( xIndex, yIndex ) && density.isDefined( xIndex, yIndex ) )
				{
					final double d = density.getDefined( xIndex, yIndex );
					weighted += values.getDefined( xIndex, yIndex ) * d;
					weights += d;
				}
			marginalX[ xIndex ] = weights > 0.0 ? weighted / weights : null;
		}

		final Double[] marginalY = new Double[ size ];
		for ( int yIndex = 0; yIndex < size; ++yIndex )
		{
			double weighted = 0.0;
			double weights = 0.0;
			for ( int xIndex = 0; xIndex < size; ++xIndex )
				if ( values.isDefined( xIndex, yIndex ) && density.isDefined( xIndex, yIndex ) )
				{
					final double d = density.getDefined( xIndex, yIndex );
					weighted += values.getDefined( xIndex, yIndex ) * d;
					weights += d;
				}
			marginalY[ yIndex ] = weights > 0.0 ? weighted / weights : null;
		}

		return new Marginals( new MarginalCurve( marginalX ), new MarginalCurve( marginalY ) );
	}

}
