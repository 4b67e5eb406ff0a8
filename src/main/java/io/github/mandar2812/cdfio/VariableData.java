package io.github.mandar2812.cdfio;

import java.lang.reflect.Array;

/**
 * Record values read from a variable.
 *
 * <p>The data is a flat value array holding the records one after
 * another, each record in row-major order over the record dimensions.
 * See {@link DataType} for the array class used for each type.
 *
 * @since    20 Jun 2013
 */
public class VariableData {

    private final String name_;
    private final DataType dataType_;
    private final int numElems_;
    private final int startRec_;
    private final int nrec_;
    private final int[] recordDims_;
    private final Object data_;
    private final int[] realRecords_;

    /**
     * Constructor.
     *
     * @param  name  variable name
     * @param  dataType  data type
     * @param  numElems  element count (string length for character types)
     * @param  startRec  record number of the first record returned
     * @param  nrec  number of records returned
     * @param  recordDims  sizes of the varying record dimensions
     * @param  data  flat value array
     * @param  realRecords  numbers of the records in range that are
     *                      physically present in the file
     */
    public VariableData( String name, DataType dataType, int numElems,
                         int startRec, int nrec, int[] recordDims,
                         Object data, int[] realRecords ) {
        name_ = name;
        dataType_ = dataType;
        numElems_ = numElems;
        startRec_ = startRec;
        nrec_ = nrec;
        recordDims_ = recordDims;
        data_ = data;
        realRecords_ = realRecords;
    }

    public String getName() {
        return name_;
    }

    public DataType getDataType() {
        return dataType_;
    }

    public int getNumElems() {
        return numElems_;
    }

    /**
     * Returns the number of the first record in this result.
     *
     * @return  start record
     */
    public int getStartRecord() {
        return startRec_;
    }

    /**
     * Returns the number of records in this result.
     *
     * @return  record count, possibly zero
     */
    public int getRecordCount() {
        return nrec_;
    }

    /**
     * Returns the shape of one record, non-varying dimensions excluded.
     *
     * @return  record dimension sizes
     */
    public int[] getRecordDims() {
        return recordDims_;
    }

    /**
     * Returns the shape of the whole result, record count first.
     *
     * @return  record count followed by record dimensions
     */
    public int[] getShape() {
        int[] shape = new int[ recordDims_.length + 1 ];
        shape[ 0 ] = nrec_;
        System.arraycopy( recordDims_, 0, shape, 1, recordDims_.length );
        return shape;
    }

    /**
     * Returns the flat value array.
     *
     * @return  value array
     */
    public Object getData() {
        return data_;
    }

    /**
     * Returns the record numbers that have physical data.
     *
     * @return  real record numbers in ascending order
     */
    public int[] getRealRecords() {
        return realRecords_;
    }

    /**
     * Returns the number of array elements per record.
     *
     * @return  values per record times group size
     */
    public int getRecordLength() {
        int n = dataType_.getGroupSize();
        for ( int dim : recordDims_ ) {
            n *= dim;
        }
        return n;
    }

    /**
     * Returns a copy of the values of one record.
     *
     * @param  irec  index within this result, not a file record number
     * @return  value array for one record
     */
    public Object getRecord( int irec ) {
        if ( irec < 0 || irec >= nrec_ ) {
            throw new IndexOutOfBoundsException( "Record " + irec
                                               + " not in 0.." + nrec_ );
        }
        int leng = getRecordLength();
        Object out = Array.newInstance( dataType_.getArrayElementClass(),
                                        leng );
        System.arraycopy( data_, irec * leng, out, 0, leng );
        return out;
    }

    @Override
    public String toString() {
        StringBuffer sbuf = new StringBuffer()
            .append( name_ )
            .append( ": " )
            .append( dataType_.getToken() )
            .append( " [" )
            .append( nrec_ );
        for ( int dim : recordDims_ ) {
            sbuf.append( "," ).append( dim );
        }
        return sbuf.append( "] from record " )
                   .append( startRec_ )
                   .toString();
    }
}
