package io.github.mandar2812.cdfio;

import io.github.mandar2812.cdfio.epoch.Epoch16;
import java.lang.reflect.Array;

/**
 * Represents an entry in a global or variable attribute.
 *
 * <p>Entries read from a file carry their data type and a value which
 * is a flat value array for numeric types (EPOCH16 as (real, imag)
 * pairs), a String for a character entry, or a String array for a
 * character entry holding several strings.
 *
 * <p>Entries supplied to the writer may leave the data type null,
 * in which case it is inferred from the value.
 *
 * @since    28 Jun 2013
 */
public class AttributeEntry {

    private final DataType dataType_;
    private final Object value_;

    /**
     * Constructor.
     *
     * @param  dataType  data type, or null to infer on writing
     * @param  value  entry value
     */
    public AttributeEntry( DataType dataType, Object value ) {
        dataType_ = dataType;
        value_ = value;
    }

    /**
     * Constructs an entry whose data type is inferred when written.
     *
     * @param  value  entry value
     */
    public AttributeEntry( Object value ) {
        this( null, value );
    }

    /**
     * Returns the data type of this entry.
     *
     * @return  data type, may be null for entries not yet written
     */
    public DataType getDataType() {
        return dataType_;
    }

    /**
     * Returns the value object.
     *
     * @return  entry value
     */
    public Object getValue() {
        return value_;
    }

    /**
     * Returns the number of items in this entry.
     *
     * @return  item count
     */
    public int getItemCount() {
        if ( value_ == null ) {
            return 0;
        }
        else if ( value_.getClass().isArray() ) {
            int n = Array.getLength( value_ );
            return value_ instanceof double[] && dataType_ == DataType.EPOCH16
                 ? n / 2
                 : n;
        }
        else {
            return 1;
        }
    }

    /**
     * Returns the value of this entry as a convenient object.
     * A single-item numeric array is returned as a wrapper object
     * (or an Epoch16), otherwise this is the same as the raw value.
     *
     * @return  shaped entry value
     */
    public Object getShapedValue() {
        if ( value_ == null || ! value_.getClass().isArray()
             || getItemCount() != 1 ) {
            return value_;
        }
        else if ( dataType_ == DataType.EPOCH16
                  && value_ instanceof double[] ) {
            double[] pair = (double[]) value_;
            return new Epoch16( pair[ 0 ], pair[ 1 ] );
        }
        else {
            return Array.get( value_, 0 );
        }
    }

    /**
     * Formats the value of this entry as a string.
     */
    @Override
    public String toString() {
        if ( value_ == null ) {
            return "";
        }
        else if ( ! value_.getClass().isArray() ) {
            return value_.toString();
        }
        else {
            StringBuffer sbuf = new StringBuffer();
            int n = Array.getLength( value_ );
            int step = getItemCount() == n ? 1 : 2;
            for ( int i = 0; i < n; i += step ) {
                if ( i > 0 ) {
                    sbuf.append( ", " );
                }
                if ( step == 2 ) {
                    sbuf.append( new Epoch16( Array.getDouble( value_, i ),
                                              Array.getDouble( value_,
                                                               i + 1 ) ) );
                }
                else {
                    sbuf.append( Array.get( value_, i ) );
                }
            }
            return sbuf.toString();
        }
    }
}
