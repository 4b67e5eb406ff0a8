package io.github.mandar2812.cdfio.record;

import io.github.mandar2812.cdfio.Buf;
import java.io.IOException;
import java.util.logging.Logger;

/**
 * Abstract superclass for a CDF Record object.
 * A Record represents one of the typed records
 * of which a CDF file is composed.
 * Records are decoded on demand from their file offset and hold
 * offsets, not references, to the records they link to.
 *
 * @since    18 Jun 2013
 */
public abstract class Record {

    private final RecordPlan plan_;
    private final String abbrev_;
    private static final Logger logger_ =
        Logger.getLogger( Record.class.getName() );

    /**
     * Constructor.
     *
     * @param  plan   basic record information
     * @param  abbrev   abreviated name for record type
     */
    protected Record( RecordPlan plan, String abbrev ) {
        plan_ = plan;
        abbrev_ = abbrev;
    }

    /**
     * Returns the file offset at which this record starts.
     *
     * @return  record offset
     */
    public long getRecordOffset() {
        return plan_.getStart();
    }

    /**
     * Returns the size of the record in bytes.
     *
     * @return  record size
     */
    public long getRecordSize() {
        return plan_.getRecordSize();
    }

    /**
     * Returns the type code identifying what kind of CDF record it is.
     *
     * @return   record type
     */
    public int getRecordType() {
        return plan_.getRecordType();
    }

    /**
     * Returns the abbreviated form of the record type for this record.
     *
     * @return  record type abbreviation
     */
    public String getRecordTypeAbbreviation() {
        return abbrev_;
    }

    @Override
    public String toString() {
        return abbrev_ + "@0x" + Long.toHexString( getRecordOffset() );
    }

    /**
     * Checks that an integer has a known fixed value.
     * If not, a warning is logged.
     * The actual value is returned as a convenience.
     *
     * @param  actualValue  value to test
     * @param  fixedValue  value to compare against
     * @return   <code>actualValue</code>
     */
    protected int checkIntValue( int actualValue, int fixedValue ) {
        if ( actualValue != fixedValue ) {
            logger_.warning( abbrev_ + ": unexpected fixed value "
                           + actualValue + " != " + fixedValue );
        }
        return actualValue;
    }

    /**
     * Reads a moderately-sized array of 4-byte big-endian integers.
     * Pointer position is moved on appropriately.
     *
     * @param   buf  buffer
     * @param   ptr  pointer
     * @param   count  number of values to read
     * @return  <code>count</code>-element array of values
     */
    public static int[] readIntArray( Buf buf, Pointer ptr, int count )
            throws IOException {
        int[] array = new int[ count ];
        for ( int i = 0; i < count; i++ ) {
            array[ i ] = buf.readInt( ptr );
        }
        return array;
    }

    /**
     * Reads a moderately-sized array of 8-byte big-endian integers.
     * Pointer position is moved on appropriately.
     *
     * @param   buf  buffer
     * @param   ptr  pointer
     * @param   count  number of values to read
     * @return  <code>count</code>-element array of values
     */
    public static long[] readLongArray( Buf buf, Pointer ptr, int count )
            throws IOException {
        long[] array = new long[ count ];
        for ( int i = 0; i < count; i++ ) {
            array[ i ] = buf.readLong( ptr );
        }
        return array;
    }

    /**
     * Indicates whether a given bit of a flags mask is set.
     *
     * @param  flags  flags mask
     * @param  ibit   bit index; 0 is the least significant
     * @return  true iff bit is set
     */
    public static boolean hasBit( int flags, int ibit ) {
        return ( ( flags >> ibit ) & 1 ) == 1;
    }
}
