package org.janelia.lgc.kryo;

import java.lang.invoke.MethodHandles;

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.apache.spark.serializer.KryoRegistrator;
import org.janelia.lgc.bootstrap.ReplicateStatistics;
import org.janelia.lgc.data.Bandwidth;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Grid;
import org.janelia.lgc.data.GridValues;

import com.esotericsoftware.kryo.Kryo;

public class KryoSerialization
{

	// Register all used classes so integer is used for identification rather
	// than fully qualified class name
	// https://github.com/EsotericSoftware/kryo#registration

	public static class Registrator implements KryoRegistrator
	{

		public static final Logger LOG = LogManager.getLogger( MethodHandles.lookup().lookupClass() );
		static
		{
			LOG.setLevel( Level.INFO );
		}

		@Override
		public void registerClasses( final Kryo kryo )
		{
			LOG.debug( "Registering local correlation classes with kryo." );
			kryo.register( GridValues.class, new GridValuesSerializer() );
			kryo.register( ReplicateStatistics.class, new ReplicateStatisticsSerializer() );
			kryo.register( Dataset.class );
			kryo.register( Grid.class );
			kryo.register( Bandwidth.class );
			kryo.register( double[].class );
			kryo.register( boolean[].class );
			kryo.register( int[].class );
		}
	}

}
