package io.github.mandar2812.cdfio;

/**
 * Thrown when a reader, writer or epoch codec method is invoked with
 * arguments or in a state that it cannot honour,
 * for instance an ambiguous variable index or a write to a closed writer.
 */
public class CdfUsageException extends CdfException {

    /**
     * Constructor.
     *
     * @param  msg  message
     */
    public CdfUsageException( String msg ) {
        super( msg );
    }

    /**
     * Constructor with cause.
     *
     * @param  msg  message
     * @param  cause  upstream exception
     */
    public CdfUsageException( String msg, Throwable cause ) {
        super( msg, cause );
    }
}
