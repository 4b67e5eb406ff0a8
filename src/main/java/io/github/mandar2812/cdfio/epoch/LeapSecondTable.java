package io.github.mandar2812.cdfio.epoch;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Table of TAI-UTC offsets used for TT2000 conversions.
 *
 * <p>Each row holds year, month (1=Jan), day of month,
 * leap seconds, drift base MJD and drift rate, so that from the row's
 * date TAI-UTC = leap seconds + (MJD - drift base) * drift rate.
 * The drift terms are zero from 1972 on.
 *
 * <p>The table is read from a file in the format of the NASA CDF
 * library's CDFLeapSeconds.txt: lines starting with ";" are comments,
 * other lines have six whitespace-separated fields.
 * The bundled copy is used unless the environment variable
 * {@link #LEAP_FILE_ENV} names another file.
 *
 * @since    8 Aug 2013
 */
public class LeapSecondTable {

    /**
     * Name of the environment variable that may point to an external
     * leap seconds file.
     * The environment variable name and file format are just the same
     * as for the NASA CDF library.
     */
    public static final String LEAP_FILE_ENV = "CDF_LEAPSECONDSTABLE";

    /** Classpath resource holding the bundled table. */
    public static final String RESOURCE_NAME = "CDFLeapSeconds.txt";

    private final double[][] rows_;
    private static final Logger logger_ =
        Logger.getLogger( LeapSecondTable.class.getName() );

    /**
     * Constructor.
     *
     * @param  rows  six-element rows in date order
     */
    public LeapSecondTable( double[][] rows ) {
        if ( rows.length == 0 ) {
            throw new IllegalArgumentException( "Empty leap second table" );
        }
        rows_ = rows;
    }

    /**
     * Returns the number of rows.
     *
     * @return  row count
     */
    public int getRowCount() {
        return rows_.length;
    }

    /**
     * Returns one row.
     *
     * @param  irow  row index
     * @return  six-element array: year, month, day, leap seconds,
     *          drift base, drift rate
     */
    public double[] getRow( int irow ) {
        return rows_[ irow ];
    }

    /**
     * Returns the index of the first row from which TAI-UTC is
     * a whole number of seconds, that is the 1972-01-01 row.
     *
     * @return  first row without drift terms
     */
    public int getFirstFixedRow() {
        for ( int i = 0; i < rows_.length; i++ ) {
            if ( rows_[ i ][ 4 ] == 0 && rows_[ i ][ 5 ] == 0 ) {
                return i;
            }
        }
        return rows_.length;
    }

    /**
     * Loads the table that applies in this environment:
     * the file named by {@link #LEAP_FILE_ENV} if set and readable,
     * otherwise the bundled resource.
     *
     * @return  leap second table
     */
    public static LeapSecondTable load() throws IOException {
        String ltLoc;
        try {
            ltLoc = System.getenv( LEAP_FILE_ENV );
        }
        catch ( SecurityException e ) {
            logger_.config( "Can't access external leap seconds file: " + e );
            ltLoc = null;
        }
        if ( ltLoc != null && ltLoc.trim().length() > 0 ) {
            File file = new File( ltLoc );
            if ( file.canRead() ) {
                return readFile( file );
            }
            logger_.warning( "Leap seconds file " + ltLoc
                           + " not readable; using bundled table" );
        }
        return readResource();
    }

    /**
     * Reads the bundled leap seconds table.
     *
     * @return  leap second table
     */
    public static LeapSecondTable readResource() throws IOException {
        InputStream in =
            LeapSecondTable.class.getResourceAsStream( RESOURCE_NAME );
        if ( in == null ) {
            throw new IOException( "No resource " + RESOURCE_NAME );
        }
        logger_.config( "Reading internal leap seconds table" );
        try {
            return read( in );
        }
        finally {
            in.close();
        }
    }

    /**
     * Reads a leap seconds table from a file.
     *
     * @param  file  file in CDFLeapSeconds.txt format
     * @return  leap second table
     */
    public static LeapSecondTable readFile( File file ) throws IOException {
        logger_.config( "Reading leap seconds from file " + file );
        InputStream in = new FileInputStream( file );
        try {
            return read( in );
        }
        finally {
            in.close();
        }
    }

    /**
     * Reads a leap seconds table from a stream.
     *
     * @param  in  input stream in CDFLeapSeconds.txt format
     * @return  leap second table
     */
    public static LeapSecondTable read( InputStream in ) throws IOException {
        BufferedReader rdr =
            new BufferedReader( new InputStreamReader( in,
                                    StandardCharsets.US_ASCII ) );
        List<double[]> list = new ArrayList<double[]>();
        for ( String line; ( line = rdr.readLine() ) != null; ) {
            String txt = line.trim();
            if ( txt.length() > 0 && ! txt.startsWith( ";" ) ) {
                String[] fields = txt.split( "\\s+" );
                if ( fields.length != 6 ) {
                    throw new IOException( "Bad leap second file format - got "
                                         + fields.length + " fields not 6"
                                         + " at line \"" + line + "\"" );
                }
                double[] row = new double[ 6 ];
                try {
                    for ( int i = 0; i < 6; i++ ) {
                        row[ i ] = Double.parseDouble( fields[ i ] );
                    }
                }
                catch ( NumberFormatException e ) {
                    throw (IOException)
                          new IOException( "Bad entry in leap seconds file" )
                         .initCause( e );
                }
                list.add( row );
            }
        }
        if ( list.isEmpty() ) {
            throw new IOException( "No entries in leap seconds file" );
        }
        return new LeapSecondTable( list.toArray( new double[ 0 ][] ) );
    }
}
