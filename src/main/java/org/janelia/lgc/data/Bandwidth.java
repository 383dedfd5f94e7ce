package org.janelia.lgc.data;

import java.io.Serializable;

import org.janelia.lgc.DegenerateBandwidthException;

public class Bandwidth implements Serializable
{

	private static final long serialVersionUID = 8036446427203315294L;

	public final double x;

	public final double y;

	public Bandwidth( final double x, final double y )
	{
		super();
		check( "x", x );
		check( "y", y );
		this.x = x;
		this.y = y;
	}

	private static void check( final String axis, final double h )
	{
		if ( !( h > 0.0 ) || Double.isInfinite( h ) )
			throw new DegenerateBandwidthException( "Bandwidth for " + axis + " must be finite and positive, got " + h );
	}

	@Override
	public boolean equals( final Object other )
	{
		if ( !( other instanceof Bandwidth ) )
			return false;
		final Bandwidth that = ( Bandwidth ) other;
		return Double.compare( x, that.x ) == 0 && Double.compare( y, that.y ) == 0;
	}

	@Override
	public int hashCode()
	{
		return 31 * Double.hashCode( x ) + Double.hashCode( y );
	}

	@Override
	public String toString()
	{
		return "(" + x + ", " + y + ")";
	}

}
