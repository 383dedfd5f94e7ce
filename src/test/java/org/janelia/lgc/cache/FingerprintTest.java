package org.janelia.lgc.cache;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotEquals;

import org.janelia.lgc.data.Dataset;
import org.junit.Test;

public class FingerprintTest
{

	private static double[] arange( final int n )
	{
		final double[] values = new double[ n ];
		for ( int k = 0; k < n; ++k )
			values[ k ] = k;
		return values;
	}

	@Test
	public void testEqualInputs()
	{
		final Fingerprint a = Fingerprint.of( Dataset.of( arange( 30 ), arange( 30 ) ), null, 30, 0.1 );
		final Fingerprint b = Fingerprint.of( Dataset.of( arange( 30 ), arange( 30 ) ), null, 30, 0.1 );
		assertEquals( a, b );
		assertEquals( a.hashCode(), b.hashCode() );
	}

	@Test
	public void testSameLengthAndPrefixDiffer()
	{
		final double[] y = arange( 30 );
		y[ 25 ] = 25.5;
		assertNotEquals(
				Fingerprint.of( Dataset.of( arange( 30 ), arange( 30 ) ), null, 30, 0.1 ),
				Fingerprint.of( Dataset.of( arange( 30 ), y ), null, 30, 0.1 ) );
	}

	@Test
	public void testParametersDiffer()
	{
		final Dataset data = Dataset.of( arange( 20 ), arange( 20 ) );
		final Fingerprint reference = Fingerprint.of( data, null, 30, 0.1 );
		assertNotEquals( reference, Fingerprint.of( data, 0.5, 30, 0.1 ) );
		assertNotEquals( reference, Fingerprint.of( data, null, 31, 0.1 ) );
		assertNotEquals( reference, Fingerprint.of( data, null, 30, 0.2 ) );
		assertNotEquals( Fingerprint.of( data, 0.5, 30, 0.1 ), Fingerprint.of( data, 0.6, 30, 0.1 ) );
	}

	@Test
	public void testSwappedAxesDiffer()
	{
		final double[] x = arange( 20 );
		final double[] y = new double[ 20 ];
		for ( int k = 0; k < 20; ++k )
			y[ k ] = 2 * k;
		assertNotEquals( Fingerprint.of( Dataset.of( x, y ), null, 30, 0.1 ), Fingerprint.of( Dataset.of( y, x ), null, 30, 0.1 ) );
	}

}
