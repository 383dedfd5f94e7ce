package org.janelia.lgc.kryo;

import java.lang.invoke.MethodHandles;

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.janelia.lgc.bootstrap.ReplicateStatistics;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

public class ReplicateStatisticsSerializer extends Serializer< ReplicateStatistics >
{

	public static final Logger LOG = LogManager.getLogger( MethodHandles.lookup().lookupClass() );
	static
	{
		LOG.setLevel( Level.INFO );
	}

	// write size, counts, means, squared deviations
	// read in same order
	public static final boolean optimizePositive = true;

	@Override
	public ReplicateStatistics read( final Kryo kryo, final Input input, final Class< ReplicateStatistics > type )
	{
		final int size = input.readInt( optimizePositive );
		LOG.debug( "Reading ReplicateStatistics: size=" + size );
		final int[] counts = input.readInts( size * size, optimizePositive );
		final double[] means = input.readDoubles( size * size );
		final double[] squaredDeviations = input.readDoubles( size * size );
		return new ReplicateStatistics( size, counts, means, squaredDeviations );
	}

	@Override
	public void write( final Kryo kryo, final Output output, final ReplicateStatistics object )
	{
		LOG.debug( "Writing ReplicateStatistics: size=" + object.size() );
		output.writeInt( object.size(), optimizePositive );
		output.writeInts( object.counts(), optimizePositive );
		output.writeDoubles( object.means() );
		output.writeDoubles( object.squaredDeviations() );
	}

}
