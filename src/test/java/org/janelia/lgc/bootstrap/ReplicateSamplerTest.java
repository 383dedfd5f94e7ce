package org.janelia.lgc.bootstrap;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class ReplicateSamplerTest
{

	@Test
	public void testIndicesInRangeAndReproducible()
	{
		final int[] indices = ReplicateSampler.indices( 50, 17L, 3 );
		assertEquals( 50, indices.length );
		for ( final int index : indices )
			assertTrue( index >= 0 && index < 50 );
		assertArrayEquals( indices, ReplicateSampler.indices( 50, 17L, 3 ) );
	}

	@Test
	public void testReplicatesDiffer()
	{
		assertFalse( Arrays.equals( ReplicateSampler.indices( 50, 17L, 3 ), ReplicateSampler.indices( 50, 17L, 4 ) ) );
		assertFalse( Arrays.equals( ReplicateSampler.indices( 50, 17L, 3 ), ReplicateSampler.indices( 50, 18L, 3 ) ) );
	}

}
