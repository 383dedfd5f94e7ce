package org.janelia.lgc;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.apache.spark.SparkConf;
import org.apache.spark.api.java.JavaSparkContext;
import org.janelia.lgc.bootstrap.BootstrapEngine;
import org.janelia.lgc.bootstrap.BootstrapResult;
import org.janelia.lgc.bootstrap.CancellationToken;
import org.janelia.lgc.bootstrap.SequentialBootstrap;
import org.janelia.lgc.bootstrap.SparkBootstrap;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Marginals;
import org.janelia.lgc.kryo.KryoSerialization;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;

import com.google.gson.GsonBuilder;

/**
 * Computes the local correlation grid of a two column text file and prints it
 * as JSON. Columns are separated by commas, semicolons or whitespace; lines
 * that do not start with two numbers (headers, comments) are skipped.
 */
public class LocalCorrelationMain
{

	public static final Logger LOG = LogManager.getLogger( MethodHandles.lookup().lookupClass() );
	static
	{
		LOG.setLevel( Level.INFO );
	}

	private static class Parameters
	{

		@Argument( metaVar = "DATA_PATH", required = true )
		private String dataPath;

		@Option( name = "--config", aliases = { "-c" }, required = false, usage = "JSON file with engine options." )
		private String configPath;

		@Option( name = "--bootstrap", aliases = { "-b" }, required = false, usage = "Also compute bootstrap t-statistics." )
		private Boolean bootstrap;

		@Option( name = "--spark-master", aliases = { "-s" }, required = false, usage = "Run the bootstrap on Spark with this master, e.g. local[*]." )
		private String sparkMaster;

		private boolean parsedSuccessfully;
	}

	public static void main( final String[] args ) throws IOException
	{
		final Parameters p = new Parameters();
		final CmdLineParser parser = new CmdLineParser( p );
		try
		{
			parser.parseArgument( args );
			p.parsedSuccessfully = true;
			p.bootstrap = p.bootstrap == null ? false : p.bootstrap;
		}
		catch ( final CmdLineException e )
		{
			System.err.println( e.getMessage() );
			parser.printUsage( System.err );
			p.parsedSuccessfully = false;
		}

		if ( p.parsedSuccessfully )
		{
			final EngineOptions options = p.configPath == null ? EngineOptions.generateDefaultOptions() : EngineOptions.createFromFile( p.configPath );
			LOG.info( "Options: " + options );
			final Dataset data = readPairs( p.dataPath );

			if ( p.bootstrap && p.sparkMaster != null )
			{
				final SparkConf conf = new SparkConf()
						.setAppName( "LocalCorrelation" )
						.setMaster( p.sparkMaster )
						.set( "spark.serializer", "org.apache.spark.serializer.KryoSerializer" )
						.set( "spark.kryo.registrator", KryoSerialization.Registrator.class.getName() );
				final JavaSparkContext sc = new JavaSparkContext( conf );
				try
				{
					System.out.println( run( data, options, p.bootstrap, new SparkBootstrap.Factory( sc ) ) );
				}
				finally
				{
					sc.stop();
				}
			}
			else
				System.out.println( run( data, options, p.bootstrap, new SequentialBootstrap.Factory() ) );
		}
	}

	public static String run( final Dataset data, final EngineOptions options, final boolean bootstrap, final BootstrapEngine.Factory bootstrapFactory )
	{
		final LocalCorrelationEngine engine = new LocalCorrelationEngine( options, bootstrapFactory );
		final LocalCorrelationResult result = engine.correlation( data );

		final Map< String, Object > json = new LinkedHashMap<>();
		json.put( "n", data.size() );
		json.put( "bandwidth", result.bandwidth );
		json.put( "xGrid", result.xGrid() );
		json.put( "yGrid", result.yGrid() );
		json.put( "zGrid", result.zGrid.toArray() );
		json.put( "densityGrid", result.densityGrid.toArray() );
		json.put( "marginalX", result.marginalX.toArray() );
		json.put( "marginalY", result.marginalY.toArray() );
		json.put( "marginalXDensity", result.marginalXDensity() );
		json.put( "marginalYDensity", result.marginalYDensity() );

		if ( bootstrap )
		{
			final BootstrapResult tStats = engine.bootstrap(
					data,
					fraction -> LOG.info( String.format( "Bootstrap progress: %.0f%%", 100 * fraction ) ),
					CancellationToken.none() );
			final Marginals tMarginals = engine.tStatMarginals( result, tStats );
			json.put( "tGrid", tStats.tGrid.toArray() );
			json.put( "seGrid", tStats.seGrid.toArray() );
			json.put( "tMarginalX", tMarginals.marginalX.toArray() );
			json.put( "tMarginalY", tMarginals.marginalY.toArray() );
		}

		return new GsonBuilder().serializeNulls().setPrettyPrinting().create().toJson( json );
	}

	/**
	 * Read (x, y) pairs from the first two numeric columns of a text file.
	 * Pairs with a non-finite value are dropped.
	 */
	public static Dataset readPairs( final String path ) throws IOException
	{
		final List< String > lines = Files.readAllLines( Paths.get( path ), StandardCharsets.UTF_8 );
		final ArrayList< double[] > pairs = new ArrayList<>();
		int lineNumber = 0;
		for ( final String line : lines )
		{
			++lineNumber;
			final String trimmed = line.trim();
			if ( trimmed.isEmpty() || trimmed.startsWith( "#" ) )
				continue;
			final String[] columns = trimmed.split( "[,;\\s]+" );
			if ( columns.length < 2 )
			{
				LOG.warn( "Skipping line " + lineNumber + ": fewer than two columns" );
				continue;
			}
			try
			{
				pairs.add( new double[] { Double.parseDouble( columns[ 0 ] ), Double.parseDouble( columns[ 1 ] ) } );
			}
			catch ( final NumberFormatException e )
			{
				LOG.warn( "Skipping line " + lineNumber + ": " + e.getMessage() );
			}
		}

		final double[] x = new double[ pairs.size() ];
		final double[] y = new double[ pairs.size() ];
		for ( int k = 0; k < pairs.size(); ++k )
		{
			x[ k ] = pairs.get( k )[ 0 ];
			y[ k ] = pairs.get( k )[ 1 ];
		}
		return Dataset.filterFinite( x, y );
	}

}
