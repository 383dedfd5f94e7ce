package org.janelia.lgc.kernel;

import org.janelia.lgc.data.GridValues;

/**
 * Local correlation grid and the relative density grid computed alongside it.
 * A cell is absent in both or in neither.
 */
public class CorrelationAndDensity
{
	public final GridValues correlation;

	public final GridValues density;

	public CorrelationAndDensity( final GridValues correlation, final GridValues density )
	{
		super();
		this.correlation = correlation;
		this.density = density;
	}

}
