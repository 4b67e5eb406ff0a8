package io.github.mandar2812.cdfio;

import java.lang.reflect.Array;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Enumerates the data types supported by the CDF format.
 *
 * <p>Each type knows how to turn the bytes of a variable or attribute
 * entry into a flat value array and back again.
 * The value array is a primitive array, or a String array for the
 * character types.  Unsigned integer types are widened to the next
 * larger signed java type, and EPOCH16 uses two doubles
 * (seconds, picoseconds) per item.
 *
 * @since    20 Jun 2013
 */
public abstract class DataType {

    private final String name_;
    private final int code_;
    private final int byteCount_;
    private final int groupSize_;
    private final Class<?> arrayElementClass_;
    private final Object dfltPadValueArray_;

    public static final DataType INT1 = new Int1DataType( "INT1", 1 );
    public static final DataType INT2 = new Int2DataType( "INT2", 2 );
    public static final DataType INT4 = new Int4DataType( "INT4", 4 );
    public static final DataType INT8 = new Int8DataType( "INT8", 8 );
    public static final DataType UINT1 = new UInt1DataType( "UINT1", 11 );
    public static final DataType UINT2 = new UInt2DataType( "UINT2", 12 );
    public static final DataType UINT4 = new UInt4DataType( "UINT4", 14 );
    public static final DataType REAL4 = new Real4DataType( "REAL4", 21 );
    public static final DataType REAL8 =
        new Real8DataType( "REAL8", 22, -1.0e30 );
    public static final DataType EPOCH =
        new Real8DataType( "EPOCH", 31, -1.0e30 );
    public static final DataType EPOCH16 = new Epoch16DataType( "EPOCH16" );
    public static final DataType TIME_TT2000 =
        new Int8DataType( "TIME_TT2000", 33 );
    public static final DataType BYTE = new Int1DataType( "BYTE", 41 );
    public static final DataType FLOAT = new Real4DataType( "FLOAT", 44 );
    public static final DataType DOUBLE =
        new Real8DataType( "DOUBLE", 45, -1.0e30 );
    public static final DataType CHAR = new CharDataType( "CHAR", 51 );
    public static final DataType UCHAR = new CharDataType( "UCHAR", 52 );

    private static final DataType[] ALL_TYPES = {
        INT1, INT2, INT4, INT8, UINT1, UINT2, UINT4, REAL4, REAL8,
        EPOCH, EPOCH16, TIME_TT2000, BYTE, FLOAT, DOUBLE, CHAR, UCHAR,
    };

    /**
     * Constructor.
     *
     * @param  name  type name
     * @param  code  numeric type code used in VDR and AEDR records
     * @param  byteCount  number of bytes to store one element
     * @param  groupSize  number of array elements per item
     * @param  arrayElementClass  component class of the value array
     * @param  dfltPadValueArray  one-item value array holding the
     *                            default pad value
     */
    private DataType( String name, int code, int byteCount, int groupSize,
                      Class<?> arrayElementClass, Object dfltPadValueArray ) {
        name_ = name;
        code_ = code;
        byteCount_ = byteCount;
        groupSize_ = groupSize;
        arrayElementClass_ = arrayElementClass;
        dfltPadValueArray_ = dfltPadValueArray;
    }

    /**
     * Returns the name for this data type.
     *
     * @return  data type name, for instance "REAL8"
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the token by which this type is conventionally labelled,
     * which is the name prefixed by "CDF_".
     *
     * @return  token, for instance "CDF_REAL8"
     */
    public String getToken() {
        return "CDF_" + name_;
    }

    /**
     * Returns the numeric code for this type used in the CDF format.
     *
     * @return  type code
     */
    public int getCode() {
        return code_;
    }

    /**
     * Returns the number of bytes used in a CDF to store a single item
     * of this type, or a single character for character types.
     *
     * @return  size in bytes
     */
    public int getByteCount() {
        return byteCount_;
    }

    /**
     * Returns the number of bytes occupied by one value of this type
     * given the element count declared for the variable or entry.
     *
     * @param  numElems  declared number of elements
     * @return  bytes per value
     */
    public int getValueSize( int numElems ) {
        return isCharacter() ? numElems : byteCount_;
    }

    /**
     * Returns the element class of value arrays for this type.
     *
     * @return   array raw value element class
     */
    public Class<?> getArrayElementClass() {
        return arrayElementClass_;
    }

    /**
     * Number of value array elements per item.
     * This is 1 except for EPOCH16.
     *
     * @return   number of array elements per item
     */
    public int getGroupSize() {
        return groupSize_;
    }

    /**
     * Indicates whether this is one of the character types,
     * for which one value is a fixed-length string.
     *
     * @return  true for CHAR and UCHAR
     */
    public boolean isCharacter() {
        return arrayElementClass_ == String.class;
    }

    /**
     * Indicates whether this is one of the three epoch types.
     *
     * @return  true for EPOCH, EPOCH16 and TIME_TT2000
     */
    public boolean isEpoch() {
        return this == EPOCH || this == EPOCH16 || this == TIME_TT2000;
    }

    /**
     * Returns a one-item value array containing the default pad value
     * for this type.  For character types the single string is empty,
     * and gets padded with spaces to the element count on encoding.
     *
     * @return  default raw pad value array
     */
    public Object getDefaultPadValueArray() {
        return copyArray( dfltPadValueArray_ );
    }

    /**
     * Returns the encoded bytes of the default pad value.
     *
     * @param  numElems  element count
     * @param  order   byte order of the data
     * @return  encoded pad
     */
    public byte[] getDefaultPadBytes( int numElems, ByteOrder order ) {
        if ( isCharacter() ) {
            byte[] pad = new byte[ numElems ];
            Arrays.fill( pad, (byte) ' ' );
            return pad;
        }
        return encode( dfltPadValueArray_, numElems, order,
                       Charset.forName( "US-ASCII" ) );
    }

    /**
     * Decodes a run of values from a byte array.
     *
     * @param  data  byte array
     * @param  offset  offset into data of the first value
     * @param  count  number of values to read
     * @param  numElems  declared element count (string length for
     *                   character types)
     * @param  order  byte order of the encoded data
     * @param  charset  text encoding for character types
     * @return  new value array of length <code>count*groupSize</code>
     */
    public Object decode( byte[] data, int offset, int count, int numElems,
                          ByteOrder order, Charset charset ) {
        ByteBuffer bbuf = ByteBuffer.wrap( data ).order( order );
        bbuf.position( offset );
        Object array = Array.newInstance( arrayElementClass_,
                                          count * groupSize_ );
        readValues( bbuf, numElems, array, count, charset );
        return array;
    }

    /**
     * Encodes a value array into bytes.
     *
     * @param  array  value array with element class
     *                {@link #getArrayElementClass}
     * @param  numElems  declared element count
     * @param  order   byte order for output
     * @param  charset  text encoding for character types
     * @return  encoded bytes
     */
    public byte[] encode( Object array, int numElems, ByteOrder order,
                          Charset charset ) {
        int count = Array.getLength( array ) / groupSize_;
        ByteBuffer bbuf = ByteBuffer.allocate( count * getValueSize( numElems ) )
                                    .order( order );
        writeValues( bbuf, numElems, array, count, charset );
        return bbuf.array();
    }

    /**
     * Converts a user-supplied data object into a flat value array
     * of the class required by this type.
     * Accepted inputs are value arrays of the right class,
     * other primitive or boxed arrays of numbers, nested arrays
     * (flattened in row-major order), and single numbers or strings.
     *
     * @param  data  input data
     * @return  flat value array
     * @throws  CdfUsageException  if the data cannot be represented
     */
    public Object toValueArray( Object data ) {
        if ( data == null ) {
            throw new CdfUsageException( "No data supplied for " + name_ );
        }
        if ( data.getClass().isArray()
             && data.getClass().getComponentType() == arrayElementClass_ ) {
            return data;
        }
        List<Object> items = new ArrayList<Object>();
        flatten( data, items );
        Object array = Array.newInstance( arrayElementClass_, items.size() );
        for ( int i = 0; i < items.size(); i++ ) {
            Object item = items.get( i );
            if ( isCharacter() ) {
                if ( ! ( item instanceof String ) ) {
                    throw new CdfUsageException( "Non-string value " + item
                                               + " for " + name_ );
                }
                Array.set( array, i, item );
            }
            else if ( item instanceof Number ) {
                setNumber( array, i, (Number) item );
            }
            else {
                throw new CdfUsageException( "Non-numeric value " + item
                                           + " for " + name_ );
            }
        }
        return array;
    }

    /**
     * Reads values from a byte buffer into a value array.
     *
     * @param  bbuf  buffer positioned at the first value
     * @param  numElems  declared element count
     * @param  array   value array to fill
     * @param  count   number of items to read
     * @param  charset  text encoding for character types
     */
    protected abstract void readValues( ByteBuffer bbuf, int numElems,
                                        Object array, int count,
                                        Charset charset );

    /**
     * Writes values from a value array into a byte buffer.
     *
     * @param  bbuf  buffer to receive encoded values
     * @param  numElems  declared element count
     * @param  array   value array
     * @param  count   number of items to write
     * @param  charset  text encoding for character types
     */
    protected abstract void writeValues( ByteBuffer bbuf, int numElems,
                                         Object array, int count,
                                         Charset charset );

    /**
     * Stores a number into a value array of this type.
     *
     * @param  array  value array
     * @param  index  array index
     * @param  value  number
     */
    protected abstract void setNumber( Object array, int index, Number value );

    @Override
    public String toString() {
        return name_;
    }

    /**
     * Returns the DataType object corresponding to a CDF data type code.
     *
     * @param  code  dataType field of AEDR or VDR
     * @return   data type object
     * @throws  CdfFormatException  if the code is unknown
     */
    public static DataType getDataType( int code ) throws CdfFormatException {
        for ( DataType type : ALL_TYPES ) {
            if ( type.code_ == code ) {
                return type;
            }
        }
        throw new CdfFormatException( "Unknown data type " + code );
    }

    /**
     * Returns the DataType with a given name or token,
     * case-insensitively; for instance "REAL8" or "CDF_REAL8".
     *
     * @param  name  type name or token
     * @return  data type
     * @throws  CdfUsageException  if there is no such type
     */
    public static DataType forName( String name ) {
        String txt = name.trim().toUpperCase();
        if ( txt.startsWith( "CDF_" ) ) {
            txt = txt.substring( 4 );
        }
        for ( DataType type : ALL_TYPES ) {
            if ( type.name_.equals( txt ) ) {
                return type;
            }
        }
        throw new CdfUsageException( "Unknown data type " + name );
    }

    /**
     * Decodes a fixed-width character field.
     * If a NUL byte appears before the final byte of the field,
     * the field is cut at the first NUL;
     * any remaining NULs are then removed.
     *
     * @param  bytes  buffer
     * @param  off   field offset
     * @param  leng  field width in bytes
     * @param  charset  text encoding
     * @return  decoded string
     */
    public static String decodeString( byte[] bytes, int off, int leng,
                                       Charset charset ) {
        int end = off + leng;
        for ( int i = off; i < end - 1; i++ ) {
            if ( bytes[ i ] == 0 ) {
                end = i;
                break;
            }
        }
        String txt = new String( bytes, off, end - off, charset );
        return txt.indexOf( '\0' ) >= 0 ? txt.replace( "\0", "" ) : txt;
    }

    private static void flatten( Object data, List<Object> items ) {
        if ( data.getClass().isArray() ) {
            int n = Array.getLength( data );
            for ( int i = 0; i < n; i++ ) {
                Object item = Array.get( data, i );
                if ( item == null ) {
                    throw new CdfUsageException( "Null element in data" );
                }
                flatten( item, items );
            }
        }
        else if ( data instanceof Iterable ) {
            for ( Object item : (Iterable<?>) data ) {
                flatten( item, items );
            }
        }
        else if ( data instanceof Boolean ) {
            items.add( Integer.valueOf( ((Boolean) data).booleanValue()
                                        ? 1 : 0 ) );
        }
        else {
            items.add( data );
        }
    }

    private static Object copyArray( Object array ) {
        int n = Array.getLength( array );
        Object copy = Array.newInstance( array.getClass().getComponentType(),
                                         n );
        System.arraycopy( array, 0, copy, 0, n );
        return copy;
    }

    /**
     * DataType for signed 1-byte integer.
     */
    private static final class Int1DataType extends DataType {
        Int1DataType( String name, int code ) {
            super( name, code, 1, 1, byte.class, new byte[] { -127 } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            bbuf.get( (byte[]) array, 0, n );
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            bbuf.put( (byte[]) array, 0, n );
        }
        protected void setNumber( Object array, int i, Number value ) {
            ((byte[]) array)[ i ] = value.byteValue();
        }
    }

    /**
     * DataType for signed 2-byte integer.
     */
    private static final class Int2DataType extends DataType {
        Int2DataType( String name, int code ) {
            super( name, code, 2, 1, short.class, new short[] { -32767 } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            bbuf.asShortBuffer().get( (short[]) array, 0, n );
            bbuf.position( bbuf.position() + 2 * n );
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            bbuf.asShortBuffer().put( (short[]) array, 0, n );
            bbuf.position( bbuf.position() + 2 * n );
        }
        protected void setNumber( Object array, int i, Number value ) {
            ((short[]) array)[ i ] = value.shortValue();
        }
    }

    /**
     * DataType for signed 4-byte integer.
     */
    private static final class Int4DataType extends DataType {
        Int4DataType( String name, int code ) {
            super( name, code, 4, 1, int.class, new int[] { -2147483647 } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            bbuf.asIntBuffer().get( (int[]) array, 0, n );
            bbuf.position( bbuf.position() + 4 * n );
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            bbuf.asIntBuffer().put( (int[]) array, 0, n );
            bbuf.position( bbuf.position() + 4 * n );
        }
        protected void setNumber( Object array, int i, Number value ) {
            ((int[]) array)[ i ] = value.intValue();
        }
    }

    /**
     * DataType for signed 8-byte integer, also used for TIME_TT2000.
     */
    private static final class Int8DataType extends DataType {
        Int8DataType( String name, int code ) {
            super( name, code, 8, 1, long.class,
                   new long[] { Long.MIN_VALUE + 1 } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            bbuf.asLongBuffer().get( (long[]) array, 0, n );
            bbuf.position( bbuf.position() + 8 * n );
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            bbuf.asLongBuffer().put( (long[]) array, 0, n );
            bbuf.position( bbuf.position() + 8 * n );
        }
        protected void setNumber( Object array, int i, Number value ) {
            ((long[]) array)[ i ] = value.longValue();
        }
    }

    /**
     * DataType for unsigned 1-byte integer.
     * Values are held as 2-byte signed integers.
     */
    private static final class UInt1DataType extends DataType {
        UInt1DataType( String name, int code ) {
            super( name, code, 1, 1, short.class, new short[] { 254 } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            short[] sarray = (short[]) array;
            for ( int i = 0; i < n; i++ ) {
                sarray[ i ] = (short) ( bbuf.get() & 0xff );
            }
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            short[] sarray = (short[]) array;
            for ( int i = 0; i < n; i++ ) {
                bbuf.put( (byte) sarray[ i ] );
            }
        }
        protected void setNumber( Object array, int i, Number value ) {
            ((short[]) array)[ i ] = (short) ( value.intValue() & 0xff );
        }
    }

    /**
     * DataType for unsigned 2-byte integer.
     * Values are held as 4-byte signed integers.
     */
    private static final class UInt2DataType extends DataType {
        UInt2DataType( String name, int code ) {
            super( name, code, 2, 1, int.class, new int[] { 65534 } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            int[] iarray = (int[]) array;
            for ( int i = 0; i < n; i++ ) {
                iarray[ i ] = bbuf.getShort() & 0xffff;
            }
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            int[] iarray = (int[]) array;
            for ( int i = 0; i < n; i++ ) {
                bbuf.putShort( (short) iarray[ i ] );
            }
        }
        protected void setNumber( Object array, int i, Number value ) {
            ((int[]) array)[ i ] = value.intValue() & 0xffff;
        }
    }

    /**
     * DataType for unsigned 4-byte integer.
     * Values are held as 8-byte signed integers.
     */
    private static final class UInt4DataType extends DataType {
        UInt4DataType( String name, int code ) {
            super( name, code, 4, 1, long.class, new long[] { 4294967294L } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            long[] larray = (long[]) array;
            for ( int i = 0; i < n; i++ ) {
                larray[ i ] = bbuf.getInt() & 0xffffffffL;
            }
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            long[] larray = (long[]) array;
            for ( int i = 0; i < n; i++ ) {
                bbuf.putInt( (int) larray[ i ] );
            }
        }
        protected void setNumber( Object array, int i, Number value ) {
            ((long[]) array)[ i ] = value.longValue() & 0xffffffffL;
        }
    }

    /**
     * DataType for 4-byte floating point.
     */
    private static final class Real4DataType extends DataType {
        Real4DataType( String name, int code ) {
            super( name, code, 4, 1, float.class, new float[] { -1.0e30f } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            bbuf.asFloatBuffer().get( (float[]) array, 0, n );
            bbuf.position( bbuf.position() + 4 * n );
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            bbuf.asFloatBuffer().put( (float[]) array, 0, n );
            bbuf.position( bbuf.position() + 4 * n );
        }
        protected void setNumber( Object array, int i, Number value ) {
            ((float[]) array)[ i ] = value.floatValue();
        }
    }

    /**
     * DataType for 8-byte floating point, also used for EPOCH.
     */
    private static final class Real8DataType extends DataType {
        Real8DataType( String name, int code, double pad ) {
            super( name, code, 8, 1, double.class, new double[] { pad } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            bbuf.asDoubleBuffer().get( (double[]) array, 0, n );
            bbuf.position( bbuf.position() + 8 * n );
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            bbuf.asDoubleBuffer().put( (double[]) array, 0, n );
            bbuf.position( bbuf.position() + 8 * n );
        }
        protected void setNumber( Object array, int i, Number value ) {
            ((double[]) array)[ i ] = value.doubleValue();
        }
    }

    /**
     * DataType for EPOCH16, two doubles per item.
     */
    private static final class Epoch16DataType extends DataType {
        Epoch16DataType( String name ) {
            super( name, 32, 16, 2, double.class,
                   new double[] { -1.0e30, -1.0e30 } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            bbuf.asDoubleBuffer().get( (double[]) array, 0, 2 * n );
            bbuf.position( bbuf.position() + 16 * n );
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            bbuf.asDoubleBuffer().put( (double[]) array, 0, 2 * n );
            bbuf.position( bbuf.position() + 16 * n );
        }
        protected void setNumber( Object array, int i, Number value ) {
            ((double[]) array)[ i ] = value.doubleValue();
        }
    }

    /**
     * DataType for character strings.
     * Each value is a string of <code>numElems</code> bytes.
     */
    private static final class CharDataType extends DataType {
        CharDataType( String name, int code ) {
            super( name, code, 1, 1, String.class, new String[] { "" } );
        }
        protected void readValues( ByteBuffer bbuf, int nel, Object array,
                                   int n, Charset cs ) {
            String[] sarray = (String[]) array;
            byte[] bytes = bbuf.array();
            int off = bbuf.arrayOffset() + bbuf.position();
            for ( int i = 0; i < n; i++ ) {
                sarray[ i ] = decodeString( bytes, off + i * nel, nel, cs );
            }
            bbuf.position( bbuf.position() + n * nel );
        }
        protected void writeValues( ByteBuffer bbuf, int nel, Object array,
                                    int n, Charset cs ) {
            String[] sarray = (String[]) array;
            for ( int i = 0; i < n; i++ ) {
                byte[] sbytes = sarray[ i ] == null
                              ? new byte[ 0 ]
                              : sarray[ i ].getBytes( cs );
                int nb = Math.min( sbytes.length, nel );
                bbuf.put( sbytes, 0, nb );
                for ( int j = nb; j < nel; j++ ) {
                    bbuf.put( (byte) 0 );
                }
            }
        }
        protected void setNumber( Object array, int i, Number value ) {
            throw new CdfUsageException( "Numeric value for character type" );
        }
    }
}
