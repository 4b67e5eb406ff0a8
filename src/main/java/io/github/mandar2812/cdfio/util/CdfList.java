package io.github.mandar2812.cdfio.util;

import io.github.mandar2812.cdfio.AttributeEntry;
import io.github.mandar2812.cdfio.CdfException;
import io.github.mandar2812.cdfio.CdfInfo;
import io.github.mandar2812.cdfio.CdfReader;
import io.github.mandar2812.cdfio.DataType;
import io.github.mandar2812.cdfio.VariableData;
import io.github.mandar2812.cdfio.VariableInfo;
import io.github.mandar2812.cdfio.epoch.Epoch16;
import io.github.mandar2812.cdfio.epoch.EpochCodec;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Utility to describe a CDF file, optionally with record data.
 * Intended to be used from the commandline via the <code>main</code> method.
 * The output format is somewhat reminiscent of the <code>cdfdump</code>
 * command in the CDF distribution.
 *
 * @since    21 Jun 2013
 */
public class CdfList {

    private final CdfReader cdf_;
    private final PrintStream out_;
    private final boolean writeData_;
    private static final String[] NOVARY_MARKS = { "{ ", " }" };
    private static final String[] VIRTUAL_MARKS = { "[ ", " ]" };
    private static final String[] REAL_MARKS = { "  ", "" };

    /**
     * Constructor.
     *
     * @param   cdf   open CDF reader
     * @param   out   output stream for listing
     * @param   writeData  true if data values as well as metadata are to
     *                     be written
     */
    public CdfList( CdfReader cdf, PrintStream out, boolean writeData ) {
        cdf_ = cdf;
        out_ = out;
        writeData_ = writeData;
    }

    /**
     * Does the work, writing output.
     */
    public void run() throws IOException {
        CdfInfo info = cdf_.getInfo();
        out_.println( info );
        out_.println();

        header( "Global Attributes" );
        for ( Map.Entry<String,List<AttributeEntry>> att :
              cdf_.globalattsget().entrySet() ) {
            out_.println( "    " + att.getKey() );
            for ( AttributeEntry entry : att.getValue() ) {
                out_.println( "        " + entry );
            }
        }

        List<String> varNames = new ArrayList<String>();
        varNames.addAll( info.getRVariables() );
        varNames.addAll( info.getZVariables() );
        for ( String varName : varNames ) {
            out_.println();
            VariableInfo var = cdf_.varinq( varName );
            header( "Variable " + var.getNum() + ": " + var.getName()
                  + "  ---  " + var );
            for ( Map.Entry<String,AttributeEntry> att :
                  cdf_.varattsget( varName ).entrySet() ) {
                out_.println( "    " + att.getKey() + ":\t" + att.getValue() );
            }
            if ( writeData_ && var.getLastRec() >= 0 ) {
                writeData( var );
            }
        }
    }

    /**
     * Lists the records of a variable.
     *
     * @param  var  variable metadata
     */
    private void writeData( VariableInfo var ) throws IOException {
        VariableData data = cdf_.varget( var.getName() );
        DataType dataType = data.getDataType();
        Set<Integer> real = new HashSet<Integer>();
        for ( int irec : data.getRealRecords() ) {
            real.add( Integer.valueOf( irec ) );
        }
        boolean isVar = var.getRecVary();
        int nrec = data.getRecordCount();
        int nrdigit = Integer.toString( data.getStartRecord() + nrec )
                             .length();
        for ( int ir = 0; ir < nrec; ir++ ) {
            int irec = data.getStartRecord() + ir;
            final String[] marks;
            if ( ! isVar ) {
                marks = NOVARY_MARKS;
            }
            else if ( ! real.contains( Integer.valueOf( irec ) ) ) {
                marks = VIRTUAL_MARKS;
            }
            else {
                marks = REAL_MARKS;
            }
            String sir = Integer.toString( irec );
            StringBuffer sbuf = new StringBuffer()
                .append( marks[ 0 ] )
                .append( spaces( nrdigit - sir.length() ) )
                .append( sir )
                .append( ':' )
                .append( '\t' )
                .append( formatValues( data.getRecord( ir ), dataType ) )
                .append( marks[ 1 ] );
            out_.println( sbuf.toString() );
        }
    }

    /**
     * Applies string formatting to the values of one record.
     * Epoch values are shown as date strings.
     *
     * @param  abuf   value array for a record
     * @param  dataType  data type for data
     * @return  string representation of values
     */
    private String formatValues( Object abuf, DataType dataType )
            throws IOException {
        EpochCodec codec = dataType.isEpoch() ? cdf_.getEpochCodec() : null;
        StringBuffer sbuf = new StringBuffer();
        int groupSize = dataType.getGroupSize();
        int len = Array.getLength( abuf );
        for ( int i = 0; i < len; i += groupSize ) {
            if ( i > 0 ) {
                sbuf.append( ", " );
            }
            if ( dataType == DataType.EPOCH16 ) {
                double[] pairs = (double[]) abuf;
                sbuf.append( codec.encodeEpoch16( new Epoch16( pairs[ i ],
                                                               pairs[ i + 1 ] ),
                                                  false ) );
            }
            else if ( codec != null ) {
                sbuf.append( codec.encode( Array.get( abuf, i ), false ) );
            }
            else if ( dataType.isCharacter() ) {
                sbuf.append( '"' )
                    .append( Array.get( abuf, i ) )
                    .append( '"' );
            }
            else {
                sbuf.append( Array.get( abuf, i ) );
            }
        }
        return sbuf.toString();
    }

    /**
     * Writes a header to the output listing.
     *
     * @param  txt  header text
     */
    private void header( String txt ) {
        out_.println( txt );
        out_.println( repeat( '-', txt.length() ) );
    }

    private static String spaces( int count ) {
        return repeat( ' ', count );
    }

    private static String repeat( char c, int count ) {
        StringBuffer sbuf = new StringBuffer( Math.max( 0, count ) );
        for ( int i = 0; i < count; i++ ) {
            sbuf.append( c );
        }
        return sbuf.toString();
    }

    /**
     * Does the work for the command line tool, handling arguments.
     * Success is indicated by the return value.
     *
     * @param  args   command-line arguments
     * @param  out   destination for the listing
     * @param  err   destination for usage and error messages
     * @return   0 for success, non-zero for failure
     */
    public static int runMain( String[] args, PrintStream out,
                               PrintStream err ) throws IOException {

        String usage = new StringBuffer()
           .append( "\n   Usage: " )
           .append( CdfList.class.getName() )
           .append( " [-help]" )
           .append( " [-verbose]" )
           .append( " [-data]" )
           .append( " [-validate]" )
           .append( " <cdf-file>" )
           .append( "\n" )
           .toString();

        List<String> argList = new ArrayList<String>( Arrays.asList( args ) );
        File file = null;
        boolean writeData = false;
        boolean validate = false;
        int verb = 0;
        for ( Iterator<String> it = argList.iterator(); it.hasNext(); ) {
            String arg = it.next();
            if ( arg.startsWith( "-h" ) ) {
                it.remove();
                out.println( usage );
                return 0;
            }
            else if ( arg.equals( "-verbose" ) || arg.equals( "-v" ) ) {
                it.remove();
                verb++;
            }
            else if ( arg.equals( "+verbose" ) || arg.equals( "+v" ) ) {
                it.remove();
                verb--;
            }
            else if ( arg.equals( "-data" ) ) {
                it.remove();
                writeData = true;
            }
            else if ( arg.equals( "-validate" ) ) {
                it.remove();
                validate = true;
            }
            else if ( file == null && ! arg.startsWith( "-" ) ) {
                it.remove();
                file = new File( arg );
            }
        }

        if ( ! argList.isEmpty() ) {
            err.println( "Unused args: " + argList );
            err.println( usage );
            return 1;
        }
        if ( file == null ) {
            err.println( usage );
            return 1;
        }

        LogUtil.setVerbosity( verb );
        try ( CdfReader cdf = new CdfReader( file, validate,
                                             CdfReader.DEFAULT_CHARSET ) ) {
            new CdfList( cdf, out, writeData ).run();
        }
        catch ( CdfException e ) {
            err.println( e.getMessage() );
            return 1;
        }
        return 0;
    }

    /**
     * Main method.  Use -help for arguments.
     */
    public static void main( String[] args ) throws IOException {
        int status = runMain( args, System.out, System.err );
        if ( status != 0 ) {
            System.exit( status );
        }
    }
}
