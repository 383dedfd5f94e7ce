package org.janelia.lgc;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileReader;
import java.io.IOException;
import java.io.Reader;
import java.lang.invoke.MethodHandles;
import java.util.Map.Entry;

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.janelia.lgc.bootstrap.BootstrapEngine;
import org.janelia.lgc.kernel.LocalCorrelationEstimator;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonElement;
import com.google.gson.JsonIOException;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonSyntaxException;

/**
 * Settings of a {@link LocalCorrelationEngine}. Read from JSON; keys missing
 * from the JSON keep their defaults, e.g.
 *
 * <pre>
 * { "gridSize" : 40, "bandwidth" : 0.5, "seed" : 42 }
 * </pre>
 */
public class EngineOptions
{

	public static final Logger LOG = LogManager.getLogger( MethodHandles.lookup().lookupClass() );
	static
	{
		LOG.setLevel( Level.INFO );
	}

	public static final String GRID_SIZE = "gridSize";

	public static final String MIN_WEIGHT = "minWeight";

	public static final String BANDWIDTH = "bandwidth";

	public static final String BOOTSTRAP_ITERATIONS = "bootstrapIterations";

	public static final String PROGRESS_INTERVAL = "progressInterval";

	public static final String SEED = "seed";

	public static final String CACHE_CAPACITY = "cacheCapacity";

	public int gridSize;

	public double minWeight;

	/**
	 * Kernel bandwidth for both axes, {@code null} for Silverman's rule per
	 * axis.
	 */
	public Double bandwidth;

	public int bootstrapIterations;

	public int progressInterval;

	/**
	 * Bootstrap seed, {@code null} to draw a fresh one for every bootstrap.
	 */
	public Long seed;

	public int cacheCapacity;

	public static EngineOptions generateDefaultOptions()
	{
		final EngineOptions options = new EngineOptions();
		options.gridSize = 30;
		options.minWeight = LocalCorrelationEstimator.DEFAULT_MIN_WEIGHT;
		options.bandwidth = null;
		options.bootstrapIterations = BootstrapEngine.DEFAULT_ITERATIONS;
		options.progressInterval = BootstrapEngine.DEFAULT_PROGRESS_INTERVAL;
		options.seed = null;
		options.cacheCapacity = 1;
		return options;
	}

	public static EngineOptions createFromJson( final String json ) throws JsonSyntaxException
	{
		return overlay( JsonParser.parseString( json ).getAsJsonObject() );
	}

	public static EngineOptions createFromFile( final String path ) throws JsonIOException, JsonSyntaxException, FileNotFoundException
	{
		try (final Reader reader = new FileReader( new File( path ) ))
		{
			return overlay( JsonParser.parseReader( reader ).getAsJsonObject() );
		}
		catch ( final FileNotFoundException e )
		{
			throw e;
		}
		catch ( final IOException e )
		{
			throw new JsonIOException( e );
		}
	}

	private static EngineOptions overlay( final JsonObject user )
	{
		final Gson gson = new Gson();
		final JsonObject options = gson.toJsonTree( generateDefaultOptions() ).getAsJsonObject();
		for ( final Entry< String, JsonElement > entry : user.entrySet() )
		{
			if ( !isKnownKey( entry.getKey() ) )
				LOG.warn( "Ignoring unknown option: " + entry.getKey() );
			options.add( entry.getKey(), entry.getValue() );
		}
		return gson.fromJson( options, EngineOptions.class ).validate();
	}

	private static boolean isKnownKey( final String key )
	{
		return GRID_SIZE.equals( key )
				|| MIN_WEIGHT.equals( key )
				|| BANDWIDTH.equals( key )
				|| BOOTSTRAP_ITERATIONS.equals( key )
				|| PROGRESS_INTERVAL.equals( key )
				|| SEED.equals( key )
				|| CACHE_CAPACITY.equals( key );
	}

	/**
	 * @return this
	 * @throws IllegalArgumentException
	 *             for out of range settings
	 * @throws DegenerateBandwidthException
	 *             for a bandwidth that is not positive
	 */
	public EngineOptions validate()
	{
		if ( gridSize < 2 )
			throw new IllegalArgumentException( GRID_SIZE + " must be at least 2, got " + gridSize );
		if ( !( minWeight >= 0.0 ) || Double.isInfinite( minWeight ) )
			throw new IllegalArgumentException( MIN_WEIGHT + " must be finite and non-negative, got " + minWeight );
		if ( bandwidth != null && ( !( bandwidth > 0.0 ) || bandwidth.isInfinite() ) )
			throw new DegenerateBandwidthException( BANDWIDTH + " must be finite and positive, got " + bandwidth );
		if ( bootstrapIterations < 1 )
			throw new IllegalArgumentException( BOOTSTRAP_ITERATIONS + " must be positive, got " + bootstrapIterations );
		if ( progressInterval < 1 )
			throw new IllegalArgumentException( PROGRESS_INTERVAL + " must be positive, got " + progressInterval );
		if ( cacheCapacity < 1 )
			throw new IllegalArgumentException( CACHE_CAPACITY + " must be positive, got " + cacheCapacity );
		return this;
	}

	@Override
	public String toString()
	{
		return new GsonBuilder().serializeNulls().create().toJson( this );
	}

}
