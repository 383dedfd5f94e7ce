package org.janelia.lgc.bootstrap;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaSparkContext;
import org.janelia.lgc.data.Bandwidth;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Grid;
import org.janelia.lgc.data.GridValues;
import org.janelia.lgc.kernel.BandwidthSelector;
import org.janelia.lgc.kernel.GridBuilder;
import org.janelia.lgc.kernel.LocalCorrelationEstimator;
import org.janelia.lgc.kryo.KryoSerialization;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

public class SparkBootstrapTest
{

	private static JavaSparkContext sc;

	@BeforeClass
	public static void setUp()
	{
		final SparkConf conf = new SparkConf()
				.setAppName( "SparkBootstrapTest" )
				// Only use one CPU.
				.setMaster( "local[1]" )
				.set( "spark.ui.enabled", "false" )
				.set( "spark.driver.host", "localhost" )
				.set( "spark.driver.bindAddress", "127.0.0.1" )
				.set( "spark.serializer", "org.apache.spark.serializer.KryoSerializer" )
				.set( "spark.kryo.registrator", KryoSerialization.Registrator.class.getName() );
		sc = new JavaSparkContext( conf );
	}

	@AfterClass
	public static void tearDown()
	{
		sc.close();
	}

	@Test
	public void testAgreesWithSequential()
	{
		final Random rng = new Random( 42 );
		final int n = 30;
		final double[] x = new double[ n ];
		final double[] y = new double[ n ];
		for ( int k = 0; k < n; ++k )
		{
			x[ k ] = rng.nextGaussian();
			y[ k ] = 0.6 * x[ k ] + 0.8 * rng.nextGaussian();
		}
		final Dataset data = Dataset.of( x, y );
		final LocalCorrelationEstimator estimator = new LocalCorrelationEstimator();
		final Grid grid = GridBuilder.build( data, 6 );
		final Bandwidth bandwidth = BandwidthSelector.select( data, null );
		final GridValues original = estimator.correlations( data, grid, bandwidth );

		final List< Double > reported = new ArrayList<>();
		final BootstrapResult distributed = new SparkBootstrap.Factory( sc )
				.create( estimator, 8L, 15 )
				.run( data, grid, bandwidth, original, 40, reported::add, CancellationToken.none() );
		final BootstrapResult sequential = new SequentialBootstrap( estimator, 8L, 15 )
				.run( data, grid, bandwidth, original, 40, ProgressListener.NONE, CancellationToken.none() );

		assertArrayEquals( sequential.tGrid.definedMask(), distributed.tGrid.definedMask() );
		for ( int j = 0; j < grid.size(); ++j )
			for ( int i = 0; i < grid.size(); ++i )
			{
				assertEquals( sequential.replicates( i, j ), distributed.replicates( i, j ) );
				if ( sequential.tGrid.isDefined( i, j ) )
				{
					assertEquals( sequential.seGrid.getDefined( i, j ), distributed.seGrid.getDefined( i, j ), 1e-12 );
					assertEquals( sequential.tGrid.getDefined( i, j ), distributed.tGrid.getDefined( i, j ), 1e-9 );
				}
			}

		assertEquals( 4, reported.size() );
		assertEquals( 0.0, reported.get( 0 ), 0.0 );
		assertEquals( 15.0 / 40, reported.get( 1 ), 1e-12 );
		assertEquals( 30.0 / 40, reported.get( 2 ), 1e-12 );
		assertEquals( 1.0, reported.get( 3 ), 0.0 );
	}

}
