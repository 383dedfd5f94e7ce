package org.janelia.lgc.data;

import java.io.Serializable;
import java.util.Arrays;

/**
 * Square grid of optional values, addressed as {@code (xIndex, yIndex)} and
 * stored row-major by y. A cell is either defined, holding a finite double, or
 * absent. Absent cells are reported as {@code null} by {@link #get(int, int)},
 * never as 0 or NaN. Instances are immutable; use {@link Builder} to fill a
 * grid.
 */
public class GridValues implements Serializable
{

	private static final long serialVersionUID = -2011718463364306185L;

	private final int size;

	private final double[] values;

	private final boolean[] defined;

	/**
	 * Create a grid of {@code size x size} absent cells.
	 */
	public GridValues( final int size )
	{
		this( size, new double[ size * size ], new boolean[ size * size ] );
	}

	/**
	 * Copy existing storage. Both arrays have {@code size * size} entries and
	 * every defined entry is finite; values of absent entries are ignored.
	 */
	public GridValues( final int size, final double[] values, final boolean[] defined )
	{
		super();
		if ( values.length != size * size || defined.length != size * size )
			throw new IllegalArgumentException( "Storage does not match grid size " + size );
		this.size = size;
		this.values = new double[ values.length ];
		this.defined = defined.clone();
		for ( int i = 0; i < values.length; ++i )
			if ( defined[ i ] )
			{
				checkFinite( values[ i ] );
				this.values[ i ] = values[ i ];
			}
	}

	/**
	 * Collects cell values; {@link #build()} takes a snapshot, so a builder
	 * can be reused and never aliases a built grid.
	 */
	public static class Builder
	{

		private final int size;

		private final double[] values;

		private final boolean[] defined;

		public Builder( final int size )
		{
			super();
			if ( size < 0 )
				throw new IllegalArgumentException( "Grid size must not be negative, got " + size );
			this.size = size;
			this.values = new double[ size * size ];
			this.defined = new boolean[ size * size ];
		}

		public int size()
		{
			return size;
		}

		public Builder set( final int xIndex, final int yIndex, final double value )
		{
			checkFinite( value );
			final int index = checkedIndex( size, xIndex, yIndex );
			values[ index ] = value;
			defined[ index ] = true;
			return this;
		}

		public Builder clear( final int xIndex, final int yIndex )
		{
			final int index = checkedIndex( size, xIndex, yIndex );
			values[ index ] = 0.0;
			defined[ index ] = false;
			return this;
		}

		public GridValues build()
		{
			return new GridValues( size, values, defined );
		}
	}

	public int size()
	{
		return size;
	}

	public boolean isDefined( final int xIndex, final int yIndex )
	{
		return defined[ index( xIndex, yIndex ) ];
	}

	public Double get( final int xIndex, final int yIndex )
	{
		final int index = index( xIndex, yIndex );
		return defined[ index ] ? values[ index ] : null;
	}

	/**
	 * Value of a cell that is known to be defined.
	 *
	 * @throws IllegalStateException
	 *             if the cell is absent
	 */
	public double getDefined( final int xIndex, final int yIndex )
	{
		final int index = index( xIndex, yIndex );
		if ( !defined[ index ] )
			throw new IllegalStateException( "Cell (" + xIndex + ", " + yIndex + ") is absent." );
		return values[ index ];
	}

	public int countDefined()
	{
		int count = 0;
		for ( final boolean d : defined )
			if ( d )
				++count;
		return count;
	}

	/**
	 * Rows indexed by y, columns by x, {@code null} for absent cells.
	 */
	public Double[][] toArray()
	{
		final Double[][] rows = new Double[ size ][ size ];
		for ( int yIndex = 0; yIndex < size; ++yIndex )
			for ( int xIndex = 0; xIndex < size; ++xIndex )
				rows[ yIndex ][ xIndex ] = get( xIndex, yIndex );
		return rows;
	}

	/**
	 * Inverse of {@link #toArray()}: rows indexed by y, {@code null} for
	 * absent cells.
	 */
	public static GridValues fromArray( final Double[][] rows )
	{
		final Builder grid = new Builder( rows.length );
		for ( int yIndex = 0; yIndex < rows.length; ++yIndex )
		{
			if ( rows[ yIndex ].length != rows.length )
				throw new IllegalArgumentException( "Grid rows must have " + rows.length + " entries, row " + yIndex + " has " + rows[ yIndex ].length );
			for ( int xIndex = 0; xIndex < rows.length; ++xIndex )
				if ( rows[ yIndex ][ xIndex ] != null )
					grid.set( xIndex, yIndex, rows[ yIndex ][ xIndex ] );
		}
		return grid.build();
	}

	/**
	 * Copy of the row-major storage. Absent cells hold 0.
	 */
	public double[] values()
	{
		return values.clone();
	}

	public boolean[] definedMask()
	{
		return defined.clone();
	}

	private int index( final int xIndex, final int yIndex )
	{
		return checkedIndex( size, xIndex, yIndex );
	}

	private static void checkFinite( final double value )
	{
		if ( !Double.isFinite( value ) )
			throw new IllegalArgumentException( "Cell values must be finite, got " + value );
	}

	private static int checkedIndex( final int size, final int xIndex, final int yIndex )
	{
		if ( xIndex < 0 || xIndex >= size || yIndex < 0 || yIndex >= size )
			throw new IndexOutOfBoundsException( "(" + xIndex + ", " + yIndex + ") outside grid of size " + size );
		return yIndex * size + xIndex;
	}

	@Override
	public boolean equals( final Object other )
	{
		if ( !( other instanceof GridValues ) )
			return false;
		final GridValues that = ( GridValues ) other;
		if ( size != that.size || !Arrays.equals( defined, that.defined ) )
			return false;
		for ( int i = 0; i < values.length; ++i )
			if ( defined[ i ] && Double.compare( values[ i ], that.values[ i ] ) != 0 )
				return false;
		return true;
	}

	@Override
	public int hashCode()
	{
		int hash = 31 * size + Arrays.hashCode( defined );
		for ( int i = 0; i < values.length; ++i )
			if ( defined[ i ] )
				hash = 31 * hash + Double.hashCode( values[ i ] );
		return hash;
	}

	@Override
	public String toString()
	{
		return Arrays.deepToString( toArray() );
	}

}
