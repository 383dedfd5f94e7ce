package org.janelia.lgc.kernel;

import static org.junit.Assert.assertEquals;

import org.janelia.lgc.DegenerateBandwidthException;
import org.janelia.lgc.data.Bandwidth;
import org.janelia.lgc.data.Dataset;
import org.junit.Test;

public class BandwidthSelectorTest
{

	@Test
	public void testSilverman()
	{
		final double[] values = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };
		// population variance of 1..10 is (10^2 - 1) / 12
		final double expected = 1.06 * Math.sqrt( 99.0 / 12.0 ) * Math.pow( 10, -0.2 );
		assertEquals( expected, BandwidthSelector.silverman( values ), 1e-12 );
	}

	@Test
	public void testSilvermanScalesWithSpread()
	{
		final double[] values = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };
		final double[] scaled = new double[ values.length ];
		for ( int k = 0; k < values.length; ++k )
			scaled[ k ] = 3.0 * values[ k ] - 7.0;
		assertEquals( 3.0 * BandwidthSelector.silverman( values ), BandwidthSelector.silverman( scaled ), 1e-12 );
	}

	@Test( expected = DegenerateBandwidthException.class )
	public void testZeroVariance()
	{
		BandwidthSelector.silverman( new double[] { 2, 2, 2, 2 } );
	}

	@Test( expected = DegenerateBandwidthException.class )
	public void testSingleValue()
	{
		BandwidthSelector.silverman( new double[] { 2 } );
	}

	@Test
	public void testSelectPerAxis()
	{
		final double[] x = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };
		final double[] y = new double[ x.length ];
		for ( int k = 0; k < x.length; ++k )
			y[ k ] = 10 * x[ k ];
		final Bandwidth bandwidth = BandwidthSelector.select( Dataset.of( x, y ), null );
		assertEquals( BandwidthSelector.silverman( x ), bandwidth.x, 0.0 );
		assertEquals( BandwidthSelector.silverman( y ), bandwidth.y, 0.0 );
	}

	@Test
	public void testOverrideUsedForBothAxes()
	{
		final double[] x = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };
		final Bandwidth bandwidth = BandwidthSelector.select( Dataset.of( x, x ), 0.25 );
		assertEquals( 0.25, bandwidth.x, 0.0 );
		assertEquals( 0.25, bandwidth.y, 0.0 );
	}

	@Test( expected = DegenerateBandwidthException.class )
	public void testNonPositiveOverride()
	{
		final double[] x = { 1, 2, 3, 4, 5, 6, 7, 8, 9, 10 };
		BandwidthSelector.select( Dataset.of( x, x ), 0.0 );
	}

}
