package org.janelia.lgc;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

import java.io.File;
import java.io.FileNotFoundException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class EngineOptionsTest
{

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testDefaults()
	{
		final EngineOptions options = EngineOptions.generateDefaultOptions();
		assertEquals( 30, options.gridSize );
		assertEquals( 0.1, options.minWeight, 0.0 );
		assertNull( options.bandwidth );
		assertEquals( 200, options.bootstrapIterations );
		assertEquals( 20, options.progressInterval );
		assertNull( options.seed );
		assertEquals( 1, options.cacheCapacity );
	}

	@Test
	public void testJsonOverlaysDefaults()
	{
		final EngineOptions options = EngineOptions.createFromJson( "{ \"gridSize\": 12, \"bandwidth\": 0.75, \"seed\": 5, \"unknown\": true }" );
		assertEquals( 12, options.gridSize );
		assertEquals( 0.75, options.bandwidth, 0.0 );
		assertEquals( Long.valueOf( 5 ), options.seed );
		assertEquals( 0.1, options.minWeight, 0.0 );
		assertEquals( 200, options.bootstrapIterations );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testGridTooSmall()
	{
		EngineOptions.createFromJson( "{ \"gridSize\": 1 }" );
	}

	@Test( expected = IllegalArgumentException.class )
	public void testNoIterations()
	{
		EngineOptions.createFromJson( "{ \"bootstrapIterations\": 0 }" );
	}

	@Test( expected = DegenerateBandwidthException.class )
	public void testZeroBandwidth()
	{
		EngineOptions.createFromJson( "{ \"bandwidth\": 0.0 }" );
	}

	@Test
	public void testFromFile() throws Exception
	{
		final File file = folder.newFile( "options.json" );
		Files.write( file.toPath(), "{ \"minWeight\": 0.5, \"progressInterval\": 7 }".getBytes( StandardCharsets.UTF_8 ) );
		final EngineOptions options = EngineOptions.createFromFile( file.getAbsolutePath() );
		assertEquals( 0.5, options.minWeight, 0.0 );
		assertEquals( 7, options.progressInterval );
		assertEquals( 30, options.gridSize );
	}

	@Test( expected = FileNotFoundException.class )
	public void testMissingFile() throws Exception
	{
		EngineOptions.createFromFile( new File( folder.getRoot(), "missing.json" ).getAbsolutePath() );
	}

}
