package org.janelia.lgc;

import org.janelia.lgc.data.Bandwidth;
import org.janelia.lgc.data.Dataset;
import org.janelia.lgc.data.Grid;
import org.janelia.lgc.data.GridValues;
import org.janelia.lgc.data.MarginalCurve;

/**
 * Local correlation grid of a dataset with everything needed to display it
 * and to bootstrap it later. Immutable, so a cached instance can be shared.
 */
public class LocalCorrelationResult
{

	public final Dataset data;

	public final Grid grid;

	public final Bandwidth bandwidth;

	public final GridValues zGrid;

	public final GridValues densityGrid;

	public final MarginalCurve marginalX;

	public final MarginalCurve marginalY;

	/**
	 * One dimensional kernel density of x at each x grid coordinate.
	 */
	private final double[] marginalXDensity;

	/**
	 * One dimensional kernel density of y at each y grid coordinate.
	 */
	private final double[] marginalYDensity;

	public LocalCorrelationResult(
			final Dataset data,
			final Grid grid,
			final Bandwidth bandwidth,
			final GridValues zGrid,
			final GridValues densityGrid,
			final MarginalCurve marginalX,
			final MarginalCurve marginalY,
			final double[] marginalXDensity,
			final double[] marginalYDensity )
	{
		super();
		this.data = data;
		this.grid = grid;
		this.bandwidth = bandwidth;
		this.zGrid = zGrid;
		this.densityGrid = densityGrid;
		this.marginalX = marginalX;
		this.marginalY = marginalY;
		this.marginalXDensity = marginalXDensity == null ? null : marginalXDensity.clone();
		this.marginalYDensity = marginalYDensity == null ? null : marginalYDensity.clone();
	}

	public double[] marginalXDensity()
	{
		return marginalXDensity.clone();
	}

	public double[] marginalYDensity()
	{
		return marginalYDensity.clone();
	}

	public double[] xGrid()
	{
		return grid.xCoordinates();
	}

	public double[] yGrid()
	{
		return grid.yCoordinates();
	}

}
