package org.janelia.lgc.data;

import java.io.Serializable;

/**
 * Evaluation coordinates for both axes. Both axes have the same number of
 * strictly increasing coordinates.
 */
public class Grid implements Serializable
{

	private static final long serialVersionUID = 2884389150460282224L;

	private final double[] xGrid;

	private final double[] yGrid;

	public Grid( final double[] xGrid, final double[] yGrid )
	{
		super();
		if ( xGrid.length != yGrid.length )
			throw new IllegalArgumentException( "Grid axes differ in length: " + xGrid.length + " != " + yGrid.length );
		if ( xGrid.length < 2 )
			throw new IllegalArgumentException( "Grid needs at least 2 coordinates per axis, got " + xGrid.length );
		checkIncreasing( "x", xGrid );
		checkIncreasing( "y", yGrid );
		this.xGrid = xGrid.clone();
		this.yGrid = yGrid.clone();
	}

	private static void checkIncreasing( final String axis, final double[] coordinates )
	{
		for ( int i = 1; i < coordinates.length; ++i )
			if ( !( coordinates[ i ] > coordinates[ i - 1 ] ) )
				throw new IllegalArgumentException( "Grid axis " + axis + " not strictly increasing at index " + i );
	}

	public int size()
	{
		return xGrid.length;
	}

	public double x( final int i )
	{
		return xGrid[ i ];
	}

	public double y( final int j )
	{
		return yGrid[ j ];
	}

	public double[] xCoordinates()
	{
		return xGrid.clone();
	}

	public double[] yCoordinates()
	{
		return yGrid.clone();
	}

}
