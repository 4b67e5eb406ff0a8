package io.github.mandar2812.cdfio.epoch;

import io.github.mandar2812.cdfio.CdfUsageException;
import io.github.mandar2812.cdfio.DataType;
import java.io.File;
import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between the three CDF time representations and calendar
 * components or strings.
 *
 * <ul>
 * <li>CDF_EPOCH: double, milliseconds since 0000-01-01T00:00:00;
 *     7 components (year, month, day, hour, minute, second, msec)</li>
 * <li>CDF_EPOCH16: {@link Epoch16}, seconds plus picoseconds;
 *     10 components (... msec, usec, nsec, psec)</li>
 * <li>CDF_TIME_TT2000: long, TT nanoseconds since J2000;
 *     9 components (... msec, usec, nsec)</li>
 * </ul>
 *
 * <p>TT2000 conversions need a leap second table, which is read when
 * the codec is constructed.
 * Instances keep a single-day lookup cache, so they are not thread-safe;
 * give each thread its own codec.
 *
 * @since    8 Aug 2013
 */
public class EpochCodec {

    private final LeapSecondTable table_;
    private final int firstFixedRow_;
    private final long[] leapNanos_;
    private int currentDay_;
    private double currentLeapSeconds_;
    private long currentJday_;

    /** CDF_EPOCH fill value. */
    public static final double EPOCH_FILL = -1.0e31;

    /** CDF_TIME_TT2000 fill value. */
    public static final long TT2000_FILL = Long.MIN_VALUE;

    /** CDF_TIME_TT2000 default pad value. */
    public static final long TT2000_PAD = Long.MIN_VALUE + 1;

    private static final long JD_J2000 = 2451545;
    private static final long JD_0AD = 1721060;
    private static final long J2000_SINCE_0AD_SEC = 63113904000L;
    private static final double MJD_BASE = 2400000.5;
    private static final long SEC_NANOS = 1000000000L;
    private static final long MINUTE_NANOS = 60 * SEC_NANOS;
    private static final long HOUR_NANOS = 60 * MINUTE_NANOS;
    private static final long DAY_NANOS = 24 * HOUR_NANOS;
    private static final long T12H_NANOS = 12 * HOUR_NANOS;
    private static final long DT_NANOS = 32184000000L;
    private static final double PICOS_PER_SEC = 1e12;

    /** Number of lower units per unit of the previous component. */
    private static final double[] UNIT_FACTORS = {
        0, 0, 0, 24, 60, 60, 1000, 1000, 1000, 1000,
    };
    private static final String[] MONTH_TOKENS = {
        "Jan", "Feb", "Mar", "Apr", "May", "Jun",
        "Jul", "Aug", "Sep", "Oct", "Nov", "Dec",
    };
    private static final int[] EPOCH_FILL_FIELDS =
        { 9999, 12, 31, 23, 59, 59, 999 };
    private static final int[] EPOCH16_FILL_FIELDS =
        { 9999, 12, 31, 23, 59, 59, 999, 999, 999, 999 };
    private static final int[] TT2000_FILL_FIELDS =
        { 9999, 12, 31, 23, 59, 59, 999, 999, 999 };
    private static final int[] TT2000_PAD_FIELDS =
        { 0, 1, 1, 0, 0, 0, 0, 0, 0 };

    private static final Pattern ISO_REGEX =
        Pattern.compile( "(\\d+)-(\\d+)-(\\d+)[Tt](\\d+):(\\d+):(\\d+)"
                       + "\\.(\\d+)" );
    private static final Pattern LEGACY_REGEX =
        Pattern.compile( "(\\d+)-([A-Za-z]+)-(\\d+) (\\d+):(\\d+):(\\d+)"
                       + "\\.(\\d+)((?:\\.\\d+)*)" );

    private static final Logger logger_ =
        Logger.getLogger( EpochCodec.class.getName() );

    /**
     * Constructs a codec using the leap second table from the
     * environment or the bundled resource.
     *
     * @see  LeapSecondTable#load
     */
    public EpochCodec() throws IOException {
        this( LeapSecondTable.load() );
    }

    /**
     * Constructs a codec using a leap seconds file.
     *
     * @param  leapFile  file in CDFLeapSeconds.txt format
     */
    public EpochCodec( File leapFile ) throws IOException {
        this( LeapSecondTable.readFile( leapFile ) );
    }

    /**
     * Constructs a codec using a given leap second table.
     *
     * @param  table  leap second table
     */
    public EpochCodec( LeapSecondTable table ) {
        table_ = table;
        firstFixedRow_ = table.getFirstFixedRow();
        currentDay_ = -1;
        int nrow = table.getRowCount();
        leapNanos_ = new long[ nrow ];
        for ( int i = 0; i < nrow; i++ ) {
            double[] row = table.getRow( i );
            leapNanos_[ i ] = i < firstFixedRow_
                            ? TT2000_FILL
                            : computeTt2000Fields( (int) row[ 0 ],
                                                   (int) row[ 1 ],
                                                   (int) row[ 2 ],
                                                   0, 0, 0, 0, 0, 0 );
        }
    }

    /**
     * Returns the leap second table used by this codec.
     *
     * @return  table
     */
    public LeapSecondTable getLeapSecondTable() {
        return table_;
    }

    /**
     * Logs a warning if a data file claims to know about leap seconds
     * later than the last one in this codec's table.
     *
     * @param  leapSecondLastUpdated  GDR value as YYYYMMDD, or -1/0
     *                                if unknown
     * @return  true iff the table is at least as recent as the data
     */
    public boolean checkLeapSecondLastUpdated( int leapSecondLastUpdated ) {
        if ( leapSecondLastUpdated <= 0 ) {
            return true;
        }
        double[] last = table_.getRow( table_.getRowCount() - 1 );
        int tableLast = (int) last[ 0 ] * 10000 + (int) last[ 1 ] * 100
                      + (int) last[ 2 ];
        if ( leapSecondLastUpdated > tableLast ) {
            logger_.warning( "Data knows more leap seconds than library ("
                           + leapSecondLastUpdated + " > " + tableLast
                           + "); update " + LeapSecondTable.LEAP_FILE_ENV
                           + " to point at a current CDFLeapSeconds.txt" );
            return false;
        }
        return true;
    }

    /* ---------------------------------------------------------------- */
    /* CDF_TIME_TT2000                                                    */
    /* ---------------------------------------------------------------- */

    /**
     * Computes a TT2000 value from between 3 and 9 components
     * (year, month, day, hour, minute, second, msec, usec, nsec).
     * If fewer than 9 are given, the fractional part of the last one
     * spreads into the smaller units.
     * A month of 0 is treated as January.
     *
     * @param  components  date/time components
     * @return  nanoseconds since J2000
     */
    public long computeTt2000( double... components ) {
        long[] f = spreadComponents( components, 9, "tt2000" );
        return computeTt2000Fields( (int) f[ 0 ], (int) f[ 1 ], (int) f[ 2 ],
                                    f[ 3 ], f[ 4 ], f[ 5 ],
                                    f[ 6 ], f[ 7 ], f[ 8 ] );
    }

    /**
     * Computes TT2000 values for several component arrays.
     *
     * @param  components  array of component arrays
     * @return  TT2000 values
     */
    public long[] computeTt2000( double[][] components ) {
        long[] out = new long[ components.length ];
        for ( int i = 0; i < out.length; i++ ) {
            out[ i ] = computeTt2000( components[ i ] );
        }
        return out;
    }

    /**
     * Breaks a TT2000 value into 9 UTC components.
     * A value within a leap second reports second 60.
     *
     * @param  tt2000  nanoseconds since J2000
     * @return  year, month, day, hour, minute, second, msec, usec, nsec
     */
    public int[] breakdownTt2000( long tt2000 ) {
        if ( tt2000 == TT2000_FILL ) {
            return TT2000_FILL_FIELDS.clone();
        }
        if ( tt2000 == TT2000_PAD ) {
            return TT2000_PAD_FIELDS.clone();
        }

        /* Shift to UTC-plus-leap-seconds since 2000-01-01T00:00. */
        long secs = Math.floorDiv( tt2000, SEC_NANOS );
        long nansec = Math.floorMod( tt2000, SEC_NANOS );
        secs += 43200 - 32;
        nansec -= 184000000;
        if ( nansec < 0 ) {
            nansec += SEC_NANOS;
            secs--;
        }
        long t2 = secs * SEC_NANOS + nansec;

        int j = leapIndex( tt2000 );
        int[] date;
        if ( j >= 0 ) {
            secs -= (long) table_.getRow( j )[ 3 ];
            long epochSec = J2000_SINCE_0AD_SEC + secs;
            boolean inLeap = j < leapNanos_.length - 1
                          && tt2000 >= leapNanos_[ j + 1 ] - SEC_NANOS;
            if ( inLeap ) {
                epochSec--;
            }
            date = breakdownSeconds( epochSec );
            if ( inLeap ) {
                date[ 5 ]++;
            }
        }

        /* Before 1972 TAI-UTC drifts, so converge on the offset. */
        else {
            date = breakdownSeconds( J2000_SINCE_0AD_SEC + secs );
            for ( int iter = 0;
                  iter < 3 && computeTt2000Fields( date[ 0 ], date[ 1 ],
                                                   date[ 2 ], date[ 3 ],
                                                   date[ 4 ], date[ 5 ],
                                                   0, 0, nansec ) != tt2000;
                  iter++ ) {
                double dat0 = leapSecondsFromYmd( date[ 0 ], date[ 1 ],
                                                  date[ 2 ] );
                long tmpx = t2 - (long) ( dat0 * SEC_NANOS );
                long tmpy = tmpx / SEC_NANOS;
                nansec = tmpx - tmpy * SEC_NANOS;
                if ( nansec < 0 ) {
                    nansec += SEC_NANOS;
                    tmpy--;
                }
                date = breakdownSeconds( tmpy + J2000_SINCE_0AD_SEC );
            }
        }
        int[] out = new int[ 9 ];
        System.arraycopy( date, 0, out, 0, 6 );
        out[ 6 ] = (int) ( nansec / 1000000 );
        out[ 7 ] = (int) ( ( nansec / 1000 ) % 1000 );
        out[ 8 ] = (int) ( nansec % 1000 );
        return out;
    }

    /**
     * Breaks down an array of TT2000 values.
     *
     * @param  tt2000s  values
     * @return  array of 9-element component arrays
     */
    public int[][] breakdownTt2000( long[] tt2000s ) {
        int[][] out = new int[ tt2000s.length ][];
        for ( int i = 0; i < out.length; i++ ) {
            out[ i ] = breakdownTt2000( tt2000s[ i ] );
        }
        return out;
    }

    /**
     * Encodes a TT2000 value as a string, either ISO-8601
     * <code>yyyy-mm-ddThh:mm:ss.mmmuuunnn</code>
     * or <code>dd-Mmm-yyyy hh:mm:ss.mmm.uuu.nnn</code>.
     *
     * @param  tt2000  nanoseconds since J2000
     * @param  iso8601  true for ISO-8601 form
     * @return  formatted string
     */
    public String encodeTt2000( long tt2000, boolean iso8601 ) {
        return formatFields( breakdownTt2000( tt2000 ), iso8601 );
    }

    /* ---------------------------------------------------------------- */
    /* CDF_EPOCH                                                          */
    /* ---------------------------------------------------------------- */

    /**
     * Computes an EPOCH value from between 3 and 7 components
     * (year, month, day, hour, minute, second, msec).
     * Out-of-range components are folded into an absolute day count
     * rather than rejected; a month of 0 makes the day a day of year.
     *
     * @param  components  date/time components
     * @return  milliseconds since 0000-01-01
     */
    public double computeEpoch( double... components ) {
        long[] f = spreadComponents( components, 7, "epoch" );
        long year = f[ 0 ];
        long month = f[ 1 ];
        long day = f[ 2 ];
        if ( year < 0 ) {
            throw new CdfUsageException( "Illegal epoch field: year "
                                       + year );
        }
        if ( year == 9999 && month == 12 && day == 31 && f[ 3 ] == 23
             && f[ 4 ] == 59 && f[ 5 ] == 59 && f[ 6 ] == 999 ) {
            return EPOCH_FILL;
        }
        long days = daysSince0Ad( year, month, day );
        double msec = 86400000.0 * days
                    + ( 3600000.0 * f[ 3 ] + 60000.0 * f[ 4 ]
                        + 1000.0 * f[ 5 ] ) + f[ 6 ];
        if ( days < 0 || msec < 0 ) {
            throw new CdfUsageException( "Illegal epoch: "
                                       + formatComponents( components ) );
        }
        return msec;
    }

    /**
     * Computes EPOCH values for several component arrays.
     *
     * @param  components  array of component arrays
     * @return  EPOCH values
     */
    public double[] computeEpoch( double[][] components ) {
        double[] out = new double[ components.length ];
        for ( int i = 0; i < out.length; i++ ) {
            out[ i ] = computeEpoch( components[ i ] );
        }
        return out;
    }

    /**
     * Breaks an EPOCH value into 7 components.
     *
     * @param  epoch  milliseconds since 0000-01-01
     * @return  year, month, day, hour, minute, second, msec
     */
    public int[] breakdownEpoch( double epoch ) {
        if ( epoch == EPOCH_FILL ) {
            return EPOCH_FILL_FIELDS.clone();
        }
        double aepoch = Math.abs( epoch );
        long msec = (long) Math.floor( aepoch );
        int[] date = breakdownSeconds( msec / 1000 );
        int[] out = new int[ 7 ];
        System.arraycopy( date, 0, out, 0, 6 );
        out[ 6 ] = (int) ( msec % 1000 );
        return out;
    }

    /**
     * Breaks down an array of EPOCH values.
     *
     * @param  epochs  values
     * @return  array of 7-element component arrays
     */
    public int[][] breakdownEpoch( double[] epochs ) {
        int[][] out = new int[ epochs.length ][];
        for ( int i = 0; i < out.length; i++ ) {
            out[ i ] = breakdownEpoch( epochs[ i ] );
        }
        return out;
    }

    /**
     * Encodes an EPOCH value as <code>yyyy-mm-ddThh:mm:ss.mmm</code>
     * or <code>dd-Mmm-yyyy hh:mm:ss.mmm</code>.
     *
     * @param  epoch  milliseconds since 0000-01-01
     * @param  iso8601  true for ISO-8601 form
     * @return  formatted string
     */
    public String encodeEpoch( double epoch, boolean iso8601 ) {
        return formatFields( breakdownEpoch( epoch ), iso8601 );
    }

    /* ---------------------------------------------------------------- */
    /* CDF_EPOCH16                                                        */
    /* ---------------------------------------------------------------- */

    /**
     * Computes an EPOCH16 value from between 3 and 10 components
     * (year, month, day, hour, minute, second, msec, usec, nsec, psec).
     * Out-of-range components are folded into an absolute day count
     * rather than rejected, and the picosecond part is normalised
     * into [0, 1e12).
     *
     * @param  components  date/time components
     * @return  epoch16 value
     */
    public Epoch16 computeEpoch16( double... components ) {
        long[] f = spreadComponents( components, 10, "epoch16" );
        long year = f[ 0 ];
        if ( year < 0 ) {
            throw new CdfUsageException( "Illegal epoch field: year "
                                       + year );
        }
        boolean isFill = true;
        for ( int i = 0; i < 10; i++ ) {
            isFill = isFill && f[ i ] == EPOCH16_FILL_FIELDS[ i ];
        }
        if ( isFill ) {
            return Epoch16.FILL;
        }
        long days = daysSince0Ad( year, f[ 1 ], f[ 2 ] );
        if ( days < 0 ) {
            throw new CdfUsageException( "Illegal epoch: "
                                       + formatComponents( components ) );
        }
        double sec = 86400.0 * days + 3600.0 * f[ 3 ] + 60.0 * f[ 4 ]
                   + f[ 5 ];
        double psec = f[ 9 ] + 1000.0 * f[ 8 ] + 1000000.0 * f[ 7 ]
                    + 1e9 * f[ 6 ];
        if ( psec < 0 || psec >= PICOS_PER_SEC ) {
            double whole = Math.floor( psec / PICOS_PER_SEC );
            sec += whole;
            psec -= whole * PICOS_PER_SEC;
        }
        if ( sec < 0 ) {
            throw new CdfUsageException( "Illegal epoch: "
                                       + formatComponents( components ) );
        }
        return new Epoch16( sec, psec );
    }

    /**
     * Computes EPOCH16 values for several component arrays.
     *
     * @param  components  array of component arrays
     * @return  EPOCH16 values
     */
    public Epoch16[] computeEpoch16( double[][] components ) {
        Epoch16[] out = new Epoch16[ components.length ];
        for ( int i = 0; i < out.length; i++ ) {
            out[ i ] = computeEpoch16( components[ i ] );
        }
        return out;
    }

    /**
     * Breaks an EPOCH16 value into 10 components.
     *
     * @param  epoch16  value
     * @return  year, month, day, hour, minute, second,
     *          msec, usec, nsec, psec
     */
    public int[] breakdownEpoch16( Epoch16 epoch16 ) {
        if ( epoch16.isFill() ) {
            return EPOCH16_FILL_FIELDS.clone();
        }
        long sec = (long) Math.abs( epoch16.getReal() );
        long psec = (long) Math.abs( epoch16.getImag() );
        int[] date = breakdownSeconds( sec );
        int[] out = new int[ 10 ];
        System.arraycopy( date, 0, out, 0, 6 );
        out[ 6 ] = (int) ( psec / 1000000000L );
        out[ 7 ] = (int) ( ( psec / 1000000 ) % 1000 );
        out[ 8 ] = (int) ( ( psec / 1000 ) % 1000 );
        out[ 9 ] = (int) ( psec % 1000 );
        return out;
    }

    /**
     * Breaks down an array of EPOCH16 values.
     *
     * @param  epochs  values
     * @return  array of 10-element component arrays
     */
    public int[][] breakdownEpoch16( Epoch16[] epochs ) {
        int[][] out = new int[ epochs.length ][];
        for ( int i = 0; i < out.length; i++ ) {
            out[ i ] = breakdownEpoch16( epochs[ i ] );
        }
        return out;
    }

    /**
     * Encodes an EPOCH16 value as
     * <code>yyyy-mm-ddThh:mm:ss.mmmuuunnnppp</code>
     * or <code>dd-Mmm-yyyy hh:mm:ss.mmm.uuu.nnn.ppp</code>.
     *
     * @param  epoch16  value
     * @param  iso8601  true for ISO-8601 form
     * @return  formatted string
     */
    public String encodeEpoch16( Epoch16 epoch16, boolean iso8601 ) {
        return formatFields( breakdownEpoch16( epoch16 ), iso8601 );
    }

    /* ---------------------------------------------------------------- */
    /* Dispatching forms                                                  */
    /* ---------------------------------------------------------------- */

    /**
     * Computes an epoch whose kind is determined by the number of
     * components: 7 for EPOCH, 10 for EPOCH16 and 9 for TT2000.
     *
     * @param  components  date/time components
     * @return  Double, Epoch16 or Long
     */
    public Object compute( double... components ) {
        switch ( components.length ) {
            case 7:
                return Double.valueOf( computeEpoch( components ) );
            case 9:
                return Long.valueOf( computeTt2000( components ) );
            case 10:
                return computeEpoch16( components );
            default:
                throw new CdfUsageException( "Unknown input: "
                                           + components.length
                                           + " components" );
        }
    }

    /**
     * Encodes one value or an array of values.
     * A Long or long[] is TT2000, a Double or double[] is EPOCH,
     * an Epoch16 or Epoch16[] is EPOCH16.
     *
     * @param  value  epoch value or array
     * @param  iso8601  true for ISO-8601 form
     * @return  String for a scalar, String[] for an array
     */
    public Object encode( Object value, boolean iso8601 ) {
        if ( value instanceof Long || value instanceof Integer ) {
            return encodeTt2000( ((Number) value).longValue(), iso8601 );
        }
        else if ( value instanceof Double || value instanceof Float ) {
            return encodeEpoch( ((Number) value).doubleValue(), iso8601 );
        }
        else if ( value instanceof Epoch16 ) {
            return encodeEpoch16( (Epoch16) value, iso8601 );
        }
        else if ( value instanceof long[] ) {
            long[] vals = (long[]) value;
            String[] out = new String[ vals.length ];
            for ( int i = 0; i < vals.length; i++ ) {
                out[ i ] = encodeTt2000( vals[ i ], iso8601 );
            }
            return out;
        }
        else if ( value instanceof double[] ) {
            double[] vals = (double[]) value;
            String[] out = new String[ vals.length ];
            for ( int i = 0; i < vals.length; i++ ) {
                out[ i ] = encodeEpoch( vals[ i ], iso8601 );
            }
            return out;
        }
        else if ( value instanceof Epoch16[] ) {
            Epoch16[] vals = (Epoch16[]) value;
            String[] out = new String[ vals.length ];
            for ( int i = 0; i < vals.length; i++ ) {
                out[ i ] = encodeEpoch16( vals[ i ], iso8601 );
            }
            return out;
        }
        else {
            throw new CdfUsageException( "Not sure how to handle type "
                                       + ( value == null
                                               ? "null"
                                               : value.getClass()
                                                      .getName() ) );
        }
    }

    /**
     * Breaks down one value; the kind follows the Java type as for
     * {@link #encode}.
     *
     * @param  value  Long, Double or Epoch16
     * @return  component array
     */
    public int[] breakdown( Object value ) {
        if ( value instanceof Long || value instanceof Integer ) {
            return breakdownTt2000( ((Number) value).longValue() );
        }
        else if ( value instanceof Double || value instanceof Float ) {
            return breakdownEpoch( ((Number) value).doubleValue() );
        }
        else if ( value instanceof Epoch16 ) {
            return breakdownEpoch16( (Epoch16) value );
        }
        else {
            throw new CdfUsageException( "Not sure how to handle type "
                                       + ( value == null
                                               ? "null"
                                               : value.getClass()
                                                      .getName() ) );
        }
    }

    /**
     * Parses a string produced by one of the encode methods.
     * The kind and sub-format follow from the string length and
     * separator: 23/24 characters for EPOCH, 32 with 'T' at index 10
     * or 36 for EPOCH16, 29 or 32 with ' ' at index 11 for TT2000.
     *
     * @param  txt  encoded epoch
     * @return  Double, Epoch16 or Long
     * @throws  CdfUsageException  if the string is not recognised
     */
    public Object parse( String txt ) {
        String value = txt.trim();
        int leng = value.length();
        if ( leng == 23 || leng == 24 ) {
            long[] f = parseFields( value, 7, leng == 23 );
            return Double.valueOf( computeEpoch( toDoubles( f ) ) );
        }
        else if ( leng == 36
                  || ( leng == 32
                       && Character.toUpperCase( value.charAt( 10 ) )
                          == 'T' ) ) {
            long[] f = parseFields( value, 10, leng == 32 );
            return computeEpoch16( toDoubles( f ) );
        }
        else if ( leng == 29
                  || ( leng == 32 && value.charAt( 11 ) == ' ' ) ) {
            long[] f = parseFields( value, 9, leng == 29 );
            return Long.valueOf( computeTt2000( toDoubles( f ) ) );
        }
        else {
            throw new CdfUsageException( "Invalid cdf epoch string \""
                                       + txt + "\"" );
        }
    }

    /**
     * Parses several strings.
     *
     * @param  txts  encoded epochs
     * @return  parsed values, each Double, Epoch16 or Long
     */
    public Object[] parse( String[] txts ) {
        Object[] out = new Object[ txts.length ];
        for ( int i = 0; i < txts.length; i++ ) {
            out[ i ] = parse( txts[ i ] );
        }
        return out;
    }

    /* ---------------------------------------------------------------- */
    /* Calendar conversions                                               */
    /* ---------------------------------------------------------------- */

    /**
     * Converts an EPOCH value to a UTC date-time.
     *
     * @param  epoch  milliseconds since 0000-01-01
     * @return  date-time
     */
    public LocalDateTime toDatetime( double epoch ) {
        return toDatetime( breakdownEpoch( epoch ) );
    }

    /**
     * Converts an EPOCH16 value to a UTC date-time truncated to the
     * microsecond.
     *
     * @param  epoch16  value
     * @return  date-time
     */
    public LocalDateTime toDatetime( Epoch16 epoch16 ) {
        return toDatetime( breakdownEpoch16( epoch16 ) );
    }

    /**
     * Converts a TT2000 value to a UTC date-time truncated to the
     * microsecond.  A leap second rolls over into the next minute.
     *
     * @param  tt2000  nanoseconds since J2000
     * @return  date-time
     */
    public LocalDateTime toDatetime( long tt2000 ) {
        return toDatetime( breakdownTt2000( tt2000 ) );
    }

    /**
     * Returns seconds since 1970-01-01T00:00:00 UTC for an EPOCH value.
     *
     * @param  epoch  milliseconds since 0000-01-01
     * @return  unix seconds
     */
    public double unixtime( double epoch ) {
        return toUnixSeconds( toDatetime( epoch ) );
    }

    /**
     * Returns seconds since 1970-01-01T00:00:00 UTC for an EPOCH16 value.
     *
     * @param  epoch16  value
     * @return  unix seconds, microsecond precision
     */
    public double unixtime( Epoch16 epoch16 ) {
        return toUnixSeconds( toDatetime( epoch16 ) );
    }

    /**
     * Returns seconds since 1970-01-01T00:00:00 UTC for a TT2000 value.
     *
     * @param  tt2000  nanoseconds since J2000
     * @return  unix seconds, microsecond precision
     */
    public double unixtime( long tt2000 ) {
        return toUnixSeconds( toDatetime( tt2000 ) );
    }

    /* ---------------------------------------------------------------- */
    /* Range finding                                                      */
    /* ---------------------------------------------------------------- */

    /**
     * Returns the indices of EPOCH values within an inclusive range.
     *
     * @param  epochs  values in non-decreasing order
     * @param  start  lower bound, or null for none
     * @param  end  upper bound, or null for none
     * @return  matching indices in ascending order
     */
    public int[] findEpochRange( double[] epochs, Double start, Double end ) {
        double lo = start == null ? 0.0 : start.doubleValue();
        double hi = end == null ? 1.0e31 : end.doubleValue();
        if ( lo > hi ) {
            throw new CdfUsageException( "Invalid start/end time" );
        }
        List<Integer> list = new ArrayList<Integer>();
        for ( int i = 0; i < epochs.length; i++ ) {
            if ( epochs[ i ] >= lo && epochs[ i ] <= hi ) {
                list.add( Integer.valueOf( i ) );
            }
        }
        return toIntArray( list );
    }

    /**
     * Returns the indices of TT2000 values within an inclusive range.
     *
     * @param  epochs  values in non-decreasing order
     * @param  start  lower bound, or null for none
     * @param  end  upper bound, or null for none
     * @return  matching indices in ascending order
     */
    public int[] findEpochRange( long[] epochs, Long start, Long end ) {
        long lo = start == null ? TT2000_PAD : start.longValue();
        long hi = end == null ? Long.MAX_VALUE : end.longValue();
        if ( lo > hi ) {
            throw new CdfUsageException( "Invalid start/end time" );
        }
        List<Integer> list = new ArrayList<Integer>();
        for ( int i = 0; i < epochs.length; i++ ) {
            if ( epochs[ i ] >= lo && epochs[ i ] <= hi ) {
                list.add( Integer.valueOf( i ) );
            }
        }
        return toIntArray( list );
    }

    /**
     * Returns the indices of EPOCH16 values within an inclusive range.
     *
     * @param  epochs  values in non-decreasing order
     * @param  start  lower bound, or null for none
     * @param  end  upper bound, or null for none
     * @return  matching indices in ascending order
     */
    public int[] findEpochRange( Epoch16[] epochs, Epoch16 start,
                                 Epoch16 end ) {
        Epoch16 lo = start == null ? new Epoch16( -1.0e31, -1.0e31 ) : start;
        Epoch16 hi = end == null ? new Epoch16( 1.0e31, 1.0e31 ) : end;
        if ( lo.compareTo( hi ) > 0 ) {
            throw new CdfUsageException( "Invalid start/end time" );
        }
        List<Integer> list = new ArrayList<Integer>();
        for ( int i = 0; i < epochs.length; i++ ) {
            if ( epochs[ i ].compareTo( lo ) >= 0
                 && epochs[ i ].compareTo( hi ) <= 0 ) {
                list.add( Integer.valueOf( i ) );
            }
        }
        return toIntArray( list );
    }

    /**
     * Returns the indices of epoch values within an inclusive range,
     * for values as returned by the reader.
     * Bounds may be given as epoch values (Number, Epoch16) or as
     * component arrays (double[] or int[]) to be computed first.
     *
     * @param  type  epoch data type
     * @param  epochs  double[] for EPOCH, double[] (real, imag) pairs
     *                 or Epoch16[] for EPOCH16, long[] for TT2000
     * @param  start  lower bound, or null for none
     * @param  end  upper bound, or null for none
     * @return  matching indices in ascending order
     */
    public int[] findEpochRange( DataType type, Object epochs, Object start,
                                 Object end ) {
        if ( type == DataType.EPOCH ) {
            return findEpochRange( (double[]) epochs,
                                   toEpochBound( start ),
                                   toEpochBound( end ) );
        }
        else if ( type == DataType.TIME_TT2000 ) {
            return findEpochRange( (long[]) epochs,
                                   toTt2000Bound( start ),
                                   toTt2000Bound( end ) );
        }
        else if ( type == DataType.EPOCH16 ) {
            Epoch16[] e16s;
            if ( epochs instanceof Epoch16[] ) {
                e16s = (Epoch16[]) epochs;
            }
            else {
                double[] pairs = (double[]) epochs;
                e16s = new Epoch16[ pairs.length / 2 ];
                for ( int i = 0; i < e16s.length; i++ ) {
                    e16s[ i ] = new Epoch16( pairs[ 2 * i ],
                                             pairs[ 2 * i + 1 ] );
                }
            }
            return findEpochRange( e16s, toEpoch16Bound( start ),
                                   toEpoch16Bound( end ) );
        }
        else {
            throw new CdfUsageException( "Not an epoch type: " + type );
        }
    }

    /* ---------------------------------------------------------------- */
    /* Internals                                                          */
    /* ---------------------------------------------------------------- */

    /**
     * Computes TT2000 from whole components.
     */
    private long computeTt2000Fields( int year, int month, int day,
                                      long hour, long minute, long second,
                                      long msec, long usec, long nsec ) {
        if ( month == 0 ) {
            month = 1;
        }
        if ( year == 9999 && month == 12 && day == 31 && hour == 23
             && minute == 59 && second == 59 && msec == 999 && usec == 999
             && nsec == 999 ) {
            return TT2000_FILL;
        }
        if ( year == 0 && month == 1 && day == 1 && hour == 0
             && minute == 0 && second == 0 && msec == 0 && usec == 0
             && nsec == 0 ) {
            return TT2000_PAD;
        }
        int iy = 10000000 * month + 10000 * day + year;
        if ( iy != currentDay_ ) {
            currentDay_ = iy;
            currentLeapSeconds_ = leapSecondsFromYmd( year, month, day );
            currentJday_ = julianDay( year, month, day );
        }
        long jd = currentJday_ - JD_J2000;
        long subDay = hour * HOUR_NANOS + minute * MINUTE_NANOS
                    + second * SEC_NANOS + msec * 1000000 + usec * 1000
                    + nsec;
        long nanos = jd * DAY_NANOS + subDay;
        long t2 = (long) ( currentLeapSeconds_ * SEC_NANOS );
        return nanos - T12H_NANOS + t2 + DT_NANOS;
    }

    /**
     * Returns TAI-UTC in seconds for a date.
     */
    private double leapSecondsFromYmd( long year, long month, long day ) {
        long m = 12 * year + month;
        int j = -1;
        for ( int i = table_.getRowCount() - 1; i >= 0; i-- ) {
            double[] row = table_.getRow( i );
            if ( m >= 12 * (long) row[ 0 ] + (long) row[ 1 ] ) {
                j = i;
                break;
            }
        }
        if ( j < 0 ) {
            return 0.0;
        }
        double[] row = table_.getRow( j );
        double da = row[ 3 ];
        if ( j < firstFixedRow_ ) {
            double mjd = julianDay( year, month, day ) - MJD_BASE;
            da += ( mjd - row[ 4 ] ) * row[ 5 ];
        }
        return da;
    }

    /**
     * Returns the index of the whole-second leap table row in force at
     * a TT2000 instant, or -1 before 1972.
     */
    private int leapIndex( long tt2000 ) {
        for ( int i = leapNanos_.length - 1; i >= firstFixedRow_; i-- ) {
            if ( tt2000 >= leapNanos_[ i ] ) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Julian day number at noon of a date.
     * Months outside 1..12 are handled arithmetically.
     */
    private static long julianDay( long y, long m, long d ) {
        long a1 = 7 * ( y + ( m + 9 ) / 12 ) / 4;
        long a2 = 3 * ( ( y + ( m - 9 ) / 7 ) / 100 + 1 ) / 4;
        long a3 = 275 * m / 9;
        return 367 * y - a1 - a2 + a3 + d + 1721029;
    }

    /**
     * Days since 0000-01-01 for date components;
     * month 0 means day is a day of the year.
     */
    private static long daysSince0Ad( long year, long month, long day ) {
        if ( month == 0 ) {
            return julianDay( year, 1, 1 ) + ( day - 1 ) - JD_0AD;
        }
        if ( month < 0 ) {
            year--;
            month += 13;
        }
        return julianDay( year, month, day ) - JD_0AD;
    }

    /**
     * Breaks whole seconds since 0000-01-01 into
     * year, month, day, hour, minute, second.
     */
    private static int[] breakdownSeconds( long epochSec ) {
        long dayAd = Math.floorDiv( epochSec, 86400L );
        long secOfDay = Math.floorMod( epochSec, 86400L );
        long l = JD_0AD + 68569 + dayAd;
        long n = 4 * l / 146097;
        l = l - ( 146097 * n + 3 ) / 4;
        long i = 4000 * ( l + 1 ) / 1461001;
        l = l - 1461 * i / 4 + 31;
        long j = 80 * l / 2447;
        long k = l - 2447 * j / 80;
        l = j / 11;
        j = j + 2 - 12 * l;
        i = 100 * ( n - 49 ) + i + l;
        return new int[] {
            (int) i, (int) j, (int) k,
            (int) ( secOfDay / 3600 ), (int) ( ( secOfDay / 60 ) % 60 ),
            (int) ( secOfDay % 60 ),
        };
    }

    /**
     * Turns 3 or more components into exactly nfield whole fields,
     * spreading the fraction of the last supplied one downwards.
     */
    private static long[] spreadComponents( double[] comps, int nfield,
                                            String kind ) {
        if ( comps.length < 3 ) {
            throw new CdfUsageException( "Invalid " + kind + " components: "
                                       + formatComponents( comps ) );
        }
        long[] fields = new long[ nfield ];
        int n = Math.min( comps.length, nfield );
        for ( int i = 0; i < n; i++ ) {
            fields[ i ] = (long) comps[ i ];
        }
        double frac = comps[ n - 1 ] - fields[ n - 1 ];
        for ( int i = n; i < nfield; i++ ) {
            double x = frac * UNIT_FACTORS[ i ];
            fields[ i ] = (long) x;
            frac = x - fields[ i ];
        }
        return fields;
    }

    /**
     * Parses an encoded epoch into its whole components.
     */
    private static long[] parseFields( String value, int nfield,
                                       boolean isIso ) {
        long[] f = new long[ nfield ];
        if ( isIso ) {
            Matcher matcher = ISO_REGEX.matcher( value );
            if ( ! matcher.matches() ) {
                throw new CdfUsageException( "Invalid cdf epoch string \""
                                           + value + "\"" );
            }
            for ( int i = 0; i < 6; i++ ) {
                f[ i ] = Long.parseLong( matcher.group( i + 1 ) );
            }
            String subs = matcher.group( 7 );
            for ( int i = 6; i < nfield; i++ ) {
                int ic = ( i - 6 ) * 3;
                f[ i ] = ic + 3 <= subs.length()
                       ? Long.parseLong( subs.substring( ic, ic + 3 ) )
                       : 0;
            }
        }
        else {
            Matcher matcher = LEGACY_REGEX.matcher( value );
            if ( ! matcher.matches() ) {
                throw new CdfUsageException( "Invalid cdf epoch string \""
                                           + value + "\"" );
            }
            f[ 0 ] = Long.parseLong( matcher.group( 3 ) );
            f[ 1 ] = monthIndex( matcher.group( 2 ) );
            f[ 2 ] = Long.parseLong( matcher.group( 1 ) );
            for ( int i = 3; i < 6; i++ ) {
                f[ i ] = Long.parseLong( matcher.group( i + 1 ) );
            }
            f[ 6 ] = Long.parseLong( matcher.group( 7 ) );
            String[] rest = matcher.group( 8 ).split( "\\." );
            for ( int i = 7; i < nfield && i - 6 < rest.length; i++ ) {
                f[ i ] = Long.parseLong( rest[ i - 6 ] );
            }
        }
        return f;
    }

    private static int monthIndex( String token ) {
        for ( int i = 0; i < MONTH_TOKENS.length; i++ ) {
            if ( MONTH_TOKENS[ i ].equalsIgnoreCase( token ) ) {
                return i + 1;
            }
        }
        throw new CdfUsageException( "Unknown month \"" + token + "\"" );
    }

    /**
     * Formats 7, 9 or 10 components in ISO-8601 or legacy form.
     */
    private static String formatFields( int[] f, boolean iso8601 ) {
        StringBuffer sbuf = new StringBuffer( 40 );
        if ( iso8601 ) {
            sbuf.append( prePadWithZeros( f[ 0 ], 4 ) )
                .append( '-' )
                .append( prePadWithZeros( f[ 1 ], 2 ) )
                .append( '-' )
                .append( prePadWithZeros( f[ 2 ], 2 ) )
                .append( 'T' );
        }
        else {
            sbuf.append( prePadWithZeros( f[ 2 ], 2 ) )
                .append( '-' )
                .append( MONTH_TOKENS[ f[ 1 ] - 1 ] )
                .append( '-' )
                .append( prePadWithZeros( f[ 0 ], 4 ) )
                .append( ' ' );
        }
        sbuf.append( prePadWithZeros( f[ 3 ], 2 ) )
            .append( ':' )
            .append( prePadWithZeros( f[ 4 ], 2 ) )
            .append( ':' )
            .append( prePadWithZeros( f[ 5 ], 2 ) )
            .append( '.' );
        for ( int i = 6; i < f.length; i++ ) {
            if ( i > 6 && ! iso8601 ) {
                sbuf.append( '.' );
            }
            sbuf.append( prePadWithZeros( f[ i ], 3 ) );
        }
        return sbuf.toString();
    }

    private static LocalDateTime toDatetime( int[] f ) {
        long micros = f.length > 7 ? f[ 6 ] * 1000L + f[ 7 ]
                                   : f[ 6 ] * 1000L;
        return LocalDateTime.of( f[ 0 ], f[ 1 ], f[ 2 ], f[ 3 ], f[ 4 ] )
                            .plusSeconds( f[ 5 ] )
                            .plusNanos( micros * 1000 );
    }

    private static double toUnixSeconds( LocalDateTime dt ) {
        return dt.toEpochSecond( ZoneOffset.UTC ) + dt.getNano() * 1e-9;
    }

    private Double toEpochBound( Object bound ) {
        if ( bound == null ) {
            return null;
        }
        else if ( bound instanceof Number ) {
            return Double.valueOf( ((Number) bound).doubleValue() );
        }
        else {
            return Double.valueOf( computeEpoch( toComponents( bound ) ) );
        }
    }

    private Long toTt2000Bound( Object bound ) {
        if ( bound == null ) {
            return null;
        }
        else if ( bound instanceof Number ) {
            return Long.valueOf( ((Number) bound).longValue() );
        }
        else {
            return Long.valueOf( computeTt2000( toComponents( bound ) ) );
        }
    }

    private Epoch16 toEpoch16Bound( Object bound ) {
        if ( bound == null ) {
            return null;
        }
        else if ( bound instanceof Epoch16 ) {
            return (Epoch16) bound;
        }
        else {
            return computeEpoch16( toComponents( bound ) );
        }
    }

    private static double[] toComponents( Object bound ) {
        if ( bound instanceof double[] ) {
            return (double[]) bound;
        }
        else if ( bound instanceof int[] ) {
            return toDoubles( (int[]) bound );
        }
        else if ( bound instanceof long[] ) {
            return toDoubles( (long[]) bound );
        }
        else {
            throw new CdfUsageException( "Bad time bound " + bound );
        }
    }

    private static double[] toDoubles( long[] a ) {
        double[] d = new double[ a.length ];
        for ( int i = 0; i < a.length; i++ ) {
            d[ i ] = a[ i ];
        }
        return d;
    }

    private static double[] toDoubles( int[] a ) {
        double[] d = new double[ a.length ];
        for ( int i = 0; i < a.length; i++ ) {
            d[ i ] = a[ i ];
        }
        return d;
    }

    private static int[] toIntArray( List<Integer> list ) {
        int[] out = new int[ list.size() ];
        for ( int i = 0; i < out.length; i++ ) {
            out[ i ] = list.get( i ).intValue();
        }
        return out;
    }

    private static String formatComponents( double[] comps ) {
        StringBuffer sbuf = new StringBuffer( "[" );
        for ( int i = 0; i < comps.length; i++ ) {
            if ( i > 0 ) {
                sbuf.append( ", " );
            }
            sbuf.append( comps[ i ] );
        }
        return sbuf.append( ']' ).toString();
    }

    /**
     * Turns a non-negative integer into a string padded with
     * leading zeros to a given length.
     */
    private static String prePadWithZeros( long value, int leng ) {
        String txt = Long.toString( value );
        int nz = leng - txt.length();
        if ( nz <= 0 ) {
            return txt;
        }
        StringBuffer sbuf = new StringBuffer( leng );
        for ( int i = 0; i < nz; i++ ) {
            sbuf.append( '0' );
        }
        return sbuf.append( txt ).toString();
    }
}
