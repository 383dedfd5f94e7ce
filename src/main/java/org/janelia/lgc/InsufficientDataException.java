package org.janelia.lgc;

/**
 * Thrown when fewer valid sample pairs are available than a local correlation
 * grid needs.
 */
public class InsufficientDataException extends LocalCorrelationException
{

	private static final long serialVersionUID = 2052412930311508781L;

	private final int available;

	private final int required;

	public InsufficientDataException( final int available, final int required )
	{
		super( String.format( "Need at least %d valid data points for local correlation analysis, got %d.", required, available ) );
		this.available = available;
		this.required = required;
	}

	public int getAvailable()
	{
		return available;
	}

	public int getRequired()
	{
		return required;
	}

}
