package io.github.mandar2812.cdfio;

/**
 * Thrown when a named or numbered variable, attribute or attribute entry
 * is not present in a CDF.
 * The reader that threw it remains usable.
 */
public class CdfNotFoundException extends CdfException {

    /**
     * Constructor.
     *
     * @param  msg  message
     */
    public CdfNotFoundException( String msg ) {
        super( msg );
    }
}
