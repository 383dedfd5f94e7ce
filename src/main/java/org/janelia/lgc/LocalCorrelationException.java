package org.janelia.lgc;

/**
 * Base class for inputs the local correlation engine refuses to work on.
 */
public class LocalCorrelationException extends RuntimeException
{

	private static final long serialVersionUID = -3317826457721904417L;

	public LocalCorrelationException( final String message )
	{
		super( message );
	}

}
