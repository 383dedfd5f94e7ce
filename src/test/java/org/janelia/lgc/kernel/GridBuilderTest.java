package org.janelia.lgc.kernel;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.janelia.lgc.DegenerateAxisException;
import org.junit.Test;

public class GridBuilderTest
{

	@Test
	public void testPaddedRange()
	{
		assertArrayEquals( new double[] { -0.5, 5.0, 10.5 }, GridBuilder.axis( new double[] { 10, 0, 3 }, 3 ), 1e-12 );
	}

	@Test
	public void testEndpointsAndSpacing()
	{
		final double[] values = { -2.3, 7.1, 0.4, 3.3 };
		final int gridSize = 30;
		final double[] axis = GridBuilder.axis( values, gridSize );
		final double span = 7.1 + 2.3;
		assertEquals( gridSize, axis.length );
		assertEquals( -2.3 - 0.05 * span, axis[ 0 ], 1e-12 );
		assertEquals( 7.1 + 0.05 * span, axis[ gridSize - 1 ], 1e-12 );
		final double step = 1.1 * span / ( gridSize - 1 );
		for ( int i = 1; i < gridSize; ++i )
		{
			assertTrue( axis[ i ] > axis[ i - 1 ] );
			assertEquals( step, axis[ i ] - axis[ i - 1 ], 1e-9 );
		}
	}

	@Test( expected = DegenerateAxisException.class )
	public void testConstantAxis()
	{
		GridBuilder.axis( new double[] { 4, 4, 4 }, 5 );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testGridSizeTooSmall()
	{
		GridBuilder.axis( new double[] { 1, 2 }, 1 );
	}

}
