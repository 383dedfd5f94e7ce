package org.janelia.lgc.kryo;

import java.lang.invoke.MethodHandles;

import org.apache.log4j.Level;
import org.apache.log4j.LogManager;
import org.apache.log4j.Logger;
import org.janelia.lgc.data.GridValues;

import com.esotericsoftware.kryo.Kryo;
import com.esotericsoftware.kryo.Serializer;
import com.esotericsoftware.kryo.io.Input;
import com.esotericsoftware.kryo.io.Output;

public class GridValuesSerializer extends Serializer< GridValues >
{

	public static final Logger LOG = LogManager.getLogger( MethodHandles.lookup().lookupClass() );
	static
	{
		LOG.setLevel( Level.INFO );
	}

	// write size, defined mask (one byte per cell), values
	// read in same order
	public static final boolean optimizePositive = true;

	@Override
	public GridValues read( final Kryo kryo, final Input input, final Class< GridValues > type )
	{
		final int size = input.readInt( optimizePositive );
		LOG.debug( "Reading GridValues: size=" + size );
		final byte[] mask = input.readBytes( size * size );
		final double[] values = input.readDoubles( size * size );
		final boolean[] defined = new boolean[ mask.length ];
		for ( int i = 0; i < mask.length; ++i )
			defined[ i ] = mask[ i ] != 0;
		return new GridValues( size, values, defined );
	}

	@Override
	public void write( final Kryo kryo, final Output output, final GridValues object )
	{
		LOG.debug( "Writing GridValues: size=" + object.size() );
		final boolean[] defined = object.definedMask();
		final byte[] mask = new byte[ defined.length ];
		for ( int i = 0; i < defined.length; ++i )
			mask[ i ] = defined[ i ] ? ( byte ) 1 : ( byte ) 0;
		output.writeInt( object.size(), optimizePositive );
		output.writeBytes( mask );
		output.writeDoubles( object.values() );
	}

}
