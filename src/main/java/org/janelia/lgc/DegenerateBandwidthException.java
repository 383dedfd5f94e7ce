package org.janelia.lgc;

/**
 * Thrown when no strictly positive kernel bandwidth can be used: a supplied
 * bandwidth is not positive, or an axis has fewer than two values or zero
 * variance.
 */
public class DegenerateBandwidthException extends LocalCorrelationException
{

	private static final long serialVersionUID = 6969062290411372436L;

	public DegenerateBandwidthException( final String message )
	{
		super( message );
	}

}
