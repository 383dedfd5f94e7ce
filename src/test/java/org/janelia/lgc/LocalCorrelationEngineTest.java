package org.janelia.lgc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.lgc.bootstrap.BootstrapResult;
import org.janelia.lgc.bootstrap.CancellationToken;
import org.janelia.lgc.bootstrap.ProgressListener;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.GridValues;
import org.janelia.lgc.data.Marginals;
import org.junit.Test;

public class LocalCorrelationEngineTest
{

	private static Dataset noisy( final long seed )
	{
		final Random rng = new Random( seed );
		final double[] x = new double[ 60 ];
		final double[] y = new double[ 60 ];
		for ( int k = 0; k < x.length; ++k )
		{
			x[ k ] = rng.nextGaussian();
			y[ k ] = x[ k ] + 0.5 * rng.nextGaussian();
		}
		return Dataset.of( x, y );
	}

	private static EngineOptions options()
	{
		final EngineOptions options = EngineOptions.generateDefaultOptions();
		options.gridSize = 8;
		options.bootstrapIterations = 30;
		options.progressInterval = 10;
		options.seed = 21L;
		return options;
	}

	@Test
	public void testCorrelationCached()
	{
		final LocalCorrelationEngine engine = new LocalCorrelationEngine( options() );
		final LocalCorrelationResult first = engine.correlation( noisy( 1 ) );
		assertSame( first, engine.correlation( noisy( 1 ) ) );

		engine.invalidate();
		assertNotSame( first, engine.correlation( noisy( 1 ) ) );
	}

	@Test
	public void testCachedResultCannotBeModified()
	{
		final LocalCorrelationEngine engine = new LocalCorrelationEngine( options() );
		final LocalCorrelationResult first = engine.correlation( noisy( 1 ) );
		final GridValues zGrid = first.zGrid;
		final GridValues densityGrid = first.densityGrid;
		final double[] xDensity = first.marginalXDensity();

		first.zGrid.values()[ 36 ] = 0.5;
		first.zGrid.definedMask()[ 36 ] = !first.zGrid.isDefined( 4, 4 );
		first.densityGrid.values()[ 35 ] = -5.0;
		first.marginalXDensity()[ 0 ] = -1.0;

		final LocalCorrelationResult second = engine.correlation( noisy( 1 ) );
		assertSame( first, second );
		assertEquals( zGrid, second.zGrid );
		assertEquals( densityGrid, second.densityGrid );
		assertEquals( xDensity[ 0 ], second.marginalXDensity()[ 0 ], 0.0 );
		for ( int j = 0; j < 8; ++j )
			for ( int i = 0; i < 8; ++i )
			{
				assertEquals( second.zGrid.isDefined( i, j ), second.densityGrid.isDefined( i, j ) );
				if ( second.densityGrid.isDefined( i, j ) )
					assertTrue( second.densityGrid.getDefined( i, j ) >= 0 );
			}
	}

	@Test
	public void testBandwidthChangeRecomputes()
	{
		final LocalCorrelationEngine engine = new LocalCorrelationEngine( options() );
		final LocalCorrelationResult narrow = engine.correlation( noisy( 1 ), 0.5 );
		final LocalCorrelationResult wide = engine.correlation( noisy( 1 ), 1.0 );
		assertNotSame( narrow, wide );
		assertEquals( 1.0, wide.bandwidth.x, 0.0 );
		assertNotSame( narrow, engine.correlation( noisy( 1 ), 0.5 ) );
	}

	@Test
	public void testCachedBootstrapReportsCompletion()
	{
		final LocalCorrelationEngine engine = new LocalCorrelationEngine( options() );
		final List< Double > fresh = new ArrayList<>();
		final BootstrapResult first = engine.bootstrap( noisy( 2 ), fresh::add, CancellationToken.none() );
		assertEquals( 4, fresh.size() );
		assertEquals( 30, first.getIterations() );

		final List< Double > cached = new ArrayList<>();
		assertSame( first, engine.bootstrap( noisy( 2 ), cached::add, CancellationToken.none() ) );
		assertEquals( Collections.singletonList( 1.0 ), cached );

		// a new grid drops the old bootstrap
		engine.correlation( noisy( 3 ) );
		assertNotSame( first, engine.bootstrap( noisy( 2 ), ProgressListener.NONE, CancellationToken.none() ) );
	}

	@Test
	public void testBootstrapAsync() throws Exception
	{
		final LocalCorrelationEngine engine = new LocalCorrelationEngine( options() );
		final ExecutorService executor = Executors.newSingleThreadExecutor();
		try
		{
			final Future< BootstrapResult > future = engine.bootstrapAsync( noisy( 4 ), null, ProgressListener.NONE, CancellationToken.none(), executor );
			final BootstrapResult result = future.get();
			assertSame( result, engine.bootstrap( noisy( 4 ), null, ProgressListener.NONE, CancellationToken.none() ) );
		}
		finally
		{
			executor.shutdownNow();
		}
	}

	@Test
	public void testSeededBootstrapIsReproducible()
	{
		final BootstrapResult a = new LocalCorrelationEngine( options() ).bootstrap( noisy( 5 ), ProgressListener.NONE, CancellationToken.none() );
		final BootstrapResult b = new LocalCorrelationEngine( options() ).bootstrap( noisy( 5 ), ProgressListener.NONE, CancellationToken.none() );
		assertEquals( a.tGrid, b.tGrid );
		assertEquals( a.seGrid, b.seGrid );
	}

	@Test
	public void testTStatMarginals()
	{
		final LocalCorrelationEngine engine = new LocalCorrelationEngine( options() );
		final LocalCorrelationResult result = engine.correlation( noisy( 6 ) );
		final BootstrapResult bootstrap = engine.bootstrap( noisy( 6 ), ProgressListener.NONE, CancellationToken.none() );
		final Marginals marginals = engine.tStatMarginals( result, bootstrap );
		assertEquals( 8, marginals.marginalX.size() );
		assertEquals( 8, marginals.marginalY.size() );
		// strong positive relation near the center
		assertTrue( marginals.marginalX.get( 4 ) > 0 );
	}

}
