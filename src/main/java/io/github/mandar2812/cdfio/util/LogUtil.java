package io.github.mandar2812.cdfio.util;

import java.util.logging.ConsoleHandler;
import java.util.logging.Formatter;
import java.util.logging.Handler;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;

/**
 * Utilities for controlling logging level.
 *
 * @since    21 Jun 2013
 */
public class LogUtil {

    /**
     * Private constructor prevents instantiation.
     */
    private LogUtil() {
    }

    /**
     * Sets the logging verbosity of the root logger and makes sure
     * that messages at that level reach the console.
     *
     * @param   verbose  0 for normal, positive for more, negative for less
     *          (0=INFO, +1=CONFIG, +2=FINE, -1=WARNING)
     * @return  level set
     */
    public static Level setVerbosity( int verbose ) {
        int ilevel = Level.INFO.intValue() - ( verbose * 100 );
        Level level = ilevel <= Level.ALL.intValue()
                    ? Level.ALL
                    : ilevel >= Level.OFF.intValue()
                    ? Level.OFF
                    : Level.parse( Integer.toString( ilevel ) );
        Logger rootLogger = Logger.getLogger( "" );
        rootLogger.setLevel( level );

        // The default console handler squashes anything below INFO.
        Handler[] rootHandlers = rootLogger.getHandlers();
        for ( Handler handler : rootHandlers ) {
            handler.setLevel( level );
            if ( handler instanceof ConsoleHandler ) {
                handler.setFormatter( new LineFormatter( verbose > 1 ) );
            }
        }
        return level;
    }

    /**
     * Compact log record formatter.  Unlike the default
     * {@link java.util.logging.SimpleFormatter} this generally uses only
     * a single line for each record.
     */
    public static class LineFormatter extends Formatter {

        private final boolean debug_;

        /**
         * Constructor.
         *
         * @param   debug  iff true, provides more information per log message
         */
        public LineFormatter( boolean debug ) {
            debug_ = debug;
        }

        public String format( LogRecord record ) {
            StringBuffer sbuf = new StringBuffer();
            sbuf.append( record.getLevel().toString() )
                .append( ": " )
                .append( formatMessage( record ) );
            if ( debug_ ) {
                sbuf.append( " (" )
                    .append( record.getSourceClassName() )
                    .append( '.' )
                    .append( record.getSourceMethodName() )
                    .append( ')' );
            }
            if ( record.getThrown() != null ) {
                sbuf.append( " [" )
                    .append( record.getThrown() )
                    .append( ']' );
            }
            sbuf.append( '\n' );
            return sbuf.toString();
        }
    }
}
