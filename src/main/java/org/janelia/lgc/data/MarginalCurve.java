package org.janelia.lgc.data;

import java.io.Serializable;
import java.util.Arrays;

/**
 * One value per grid coordinate of an axis, {@code null} where undefined.
 */
public class MarginalCurve implements Serializable
{

	private static final long serialVersionUID = 7302694126416924453L;

	private final Double[] values;

	public MarginalCurve( final Double[] values )
	{
		super();
		this.values = values.clone();
	}

	public int size()
	{
		return values.length;
	}

	public Double get( final int index )
	{
		return values[ index ];
	}

	public boolean isDefined( final int index )
	{
		return values[ index ] != null;
	}

	public Double[] toArray()
	{
		return values.clone();
	}

	@Override
	public String toString()
	{
		return Arrays.toString( values );
	}

}
