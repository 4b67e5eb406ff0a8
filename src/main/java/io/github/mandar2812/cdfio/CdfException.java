package io.github.mandar2812.cdfio;

/**
 * Unchecked exception for failures that are the caller's business
 * rather than the file's.
 *
 * @see  CdfNotFoundException
 * @see  CdfUsageException
 */
public class CdfException extends RuntimeException {

    /**
     * Constructor.
     *
     * @param  msg  message
     */
    public CdfException( String msg ) {
        super( msg );
    }

    /**
     * Constructor with cause.
     *
     * @param  msg  message
     * @param  cause  upstream exception
     */
    public CdfException( String msg, Throwable cause ) {
        super( msg, cause );
    }
}
