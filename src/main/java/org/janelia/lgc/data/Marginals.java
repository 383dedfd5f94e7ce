package org.janelia.lgc.data;

import java.io.Serializable;

/**
 * Density weighted averages of a grid: {@link #marginalX} is indexed by x and
 * averages over y, {@link #marginalY} is indexed by y and averages over x.
 */
public class Marginals implements Serializable
{

	private static final long serialVersionUID = -4679468306167117226L;

	public final MarginalCurve marginalX;

	public final MarginalCurve marginalY;

	public Marginals( final MarginalCurve marginalX, final MarginalCurve marginalY )
	{
		super();
		this.marginalX = marginalX;
		this.marginalY = marginalY;
	}

}
