package org.janelia.lgc.bootstrap;

import java.io.Serializable;

import org.janelia.lgc.data.GridValues;

/**
 * Per cell bootstrap standard error and t-statistic, on the geometry of the
 * correlation grid they were computed from.
 */
public class BootstrapResult implements Serializable
{

	private static final long serialVersionUID = -1938126870516722860L;

	public final GridValues tGrid;

	public final GridValues seGrid;

	private final int[] replicateCounts;

	private final int iterations;

	public BootstrapResult( final GridValues tGrid, final GridValues seGrid, final int[] replicateCounts, final int iterations )
	{
		super();
		this.tGrid = tGrid;
		this.seGrid = seGrid;
		this.replicateCounts = replicateCounts;
		this.iterations = iterations;
	}

	/**
	 * Number of replicates with a defined correlation at cell
	 * {@code (xIndex, yIndex)}.
	 */
	public int replicates( final int xIndex, final int yIndex )
	{
		return replicateCounts[ yIndex * tGrid.size() + xIndex ];
	}

	public int getIterations()
	{
		return iterations;
	}

}
