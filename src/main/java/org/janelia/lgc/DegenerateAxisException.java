package org.janelia.lgc;

/**
 * Thrown when an axis has zero span, i.e. all its values are equal, and no
 * evaluation grid can be laid out over it.
 */
public class DegenerateAxisException extends LocalCorrelationException
{

	private static final long serialVersionUID = -1424787410850624105L;

	public DegenerateAxisException( final String axis, final double value )
	{
		super( "Axis " + axis + " is constant (all values equal " + value + "), cannot build a grid." );
	}

}
