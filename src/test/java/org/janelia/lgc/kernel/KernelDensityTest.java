package org.janelia.lgc.kernel;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

public class KernelDensityTest
{

	@Test
	public void testSinglePointIsNormalDensity()
	{
		assertEquals( 1.0 / Math.sqrt( 2 * Math.PI ), KernelDensity.estimate( 0.0, new double[] { 0.0 }, 1.0 ), 1e-12 );
		assertEquals( Math.exp( -0.5 ) / ( 2.0 * Math.sqrt( 2 * Math.PI ) ), KernelDensity.estimate( 3.0, new double[] { 1.0 }, 2.0 ), 1e-12 );
	}

	@Test
	public void testIntegratesToOne()
	{
		final double[] data = { -1.0, 0.2, 0.3, 2.5 };
		final double h = 0.4;
		final double step = 1e-3;
		double integral = 0.0;
		for ( double t = -6.0; t < 8.0; t += step )
			integral += KernelDensity.estimate( t, data, h ) * step;
		assertEquals( 1.0, integral, 1e-6 );
	}

}
