package org.janelia.lgc.cache;

import org.janelia.lgc.data.Dataset;

/**
 * Identifies the inputs of a local correlation grid: every sample value, the
 * bandwidth override, the grid size and the minimum kernel weight. Sample
 * values enter through a 64 bit hash over their bit patterns, so distinct
 * datasets collide only with negligible probability.
 */
public final class Fingerprint
{

	private static final long C1 = 0x87C37B91114253D5L;

	private static final long C2 = 0x4CF5AD432745937FL;

	private final int n;

	private final long contentHash;

	private final Double bandwidthOverride;

	private final int gridSize;

	private final double minWeight;

	private Fingerprint( final int n, final long contentHash, final Double bandwidthOverride, final int gridSize, final double minWeight )
	{
		this.n = n;
		this.contentHash = contentHash;
		this.bandwidthOverride = bandwidthOverride;
		this.gridSize = gridSize;
		this.minWeight = minWeight;
	}

	public static Fingerprint of( final Dataset data, final Double bandwidthOverride, final int gridSize, final double minWeight )
	{
		long h = data.size();
		for ( int k = 0; k < data.size(); ++k )
		{
			h = combine( h, Double.doubleToLongBits( data.x( k ) ) );
			h = combine( h, Double.doubleToLongBits( data.y( k ) ) );
		}
		return new Fingerprint( data.size(), finish( h ), bandwidthOverride, gridSize, minWeight );
	}

	private static long combine( final long h, final long bits )
	{
		final long k = Long.rotateLeft( bits * C1, 31 ) * C2;
		return Long.rotateLeft( h ^ k, 27 ) * 5 + 0x52DCE729L;
	}

	private static long finish( long h )
	{
		h ^= h >>> 33;
		h *= 0xFF51AFD7ED558CCDL;
		h ^= h >>> 33;
		h *= 0xC4CEB9FE1A85EC53L;
		return h ^ ( h >>> 33 );
	}

	@Override
	public boolean equals( final Object other )
	{
		if ( this == other )
			return true;
		if ( !( other instanceof Fingerprint ) )
			return false;
		final Fingerprint that = ( Fingerprint ) other;
		return n == that.n
				&& contentHash == that.contentHash
				&& gridSize == that.gridSize
				&& Double.compare( minWeight, that.minWeight ) == 0
				&& ( bandwidthOverride == null ? that.bandwidthOverride == null : bandwidthOverride.equals( that.bandwidthOverride ) );
	}

	@Override
	public int hashCode()
	{
		int hash = Long.hashCode( contentHash );
		hash = 31 * hash + n;
		hash = 31 * hash + gridSize;
		hash = 31 * hash + Double.hashCode( minWeight );
		hash = 31 * hash + ( bandwidthOverride == null ? 0 : bandwidthOverride.hashCode() );
		return hash;
	}

	@Override
	public String toString()
	{
		return String.format( "%016x:%d:%s:%d:%s", contentHash, n, bandwidthOverride == null ? "auto" : bandwidthOverride.toString(), gridSize, minWeight );
	}

}
