package org.janelia.lgc.bootstrap;

/**
 * Receives bootstrap progress as a fraction in [0, 1]. Reported fractions never
 * decrease and the last one is exactly 1.0.
 */
@FunctionalInterface
public interface ProgressListener
{

	public static final ProgressListener NONE = fraction -> {};

	public void progress( double fraction );

}
