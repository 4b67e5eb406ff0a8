package io.github.mandar2812.cdfio;

import java.lang.reflect.Array;
import java.util.Arrays;

/**
 * Converts the values of a run of records between the majority used
 * in a CDF file and row-major (C) order.
 * Only varying dimensions take part; non-varying dimensions are not
 * stored in the file and do not appear in the values.
 *
 * @since    20 Jun 2013
 */
public abstract class Shaper {

    private final int[] dimSizes_;
    private final int itemsPerRecord_;

    /**
     * Constructor.
     *
     * @param   dimSizes  sizes of the varying record dimensions
     */
    protected Shaper( int[] dimSizes ) {
        dimSizes_ = dimSizes;
        int n = 1;
        for ( int i = 0; i < dimSizes.length; i++ ) {
            n *= dimSizes[ i ];
        }
        itemsPerRecord_ = n;
    }

    /**
     * Returns the dimensions of one record.
     *
     * @return   dimension sizes array
     */
    public int[] getDimSizes() {
        return dimSizes_;
    }

    /**
     * Returns the number of items in one record.
     *
     * @return  product of dimension sizes
     */
    public int getItemsPerRecord() {
        return itemsPerRecord_;
    }

    /**
     * Takes a value array as stored in the file and returns one
     * in row-major order.  The result may be the input array.
     *
     * @param   rawValues  value array for <code>nrec</code> records
     * @param   nrec  number of records
     * @return  row-major value array
     */
    public abstract Object toRowMajor( Object rawValues, int nrec );

    /**
     * Takes a row-major value array and returns one in the majority
     * used by the file.  The result may be the input array.
     *
     * @param   values  row-major value array for <code>nrec</code> records
     * @param   nrec  number of records
     * @return  value array in file order
     */
    public abstract Object fromRowMajor( Object values, int nrec );

    /**
     * Returns an appropriate shaper instance.
     *
     * @param   dataType  data type
     * @param   dimSizes  sizes of the varying record dimensions
     * @param   rowMajor  majority of the file;
     *                    true for row major, false for column major
     * @return  shaper
     */
    public static Shaper createShaper( DataType dataType, int[] dimSizes,
                                       boolean rowMajor ) {
        if ( rowMajor || dimSizes.length < 2 ) {
            return new IdentityShaper( dimSizes );
        }
        else {
            return new TransposeShaper( dataType, dimSizes );
        }
    }

    /**
     * Shaper for cases in which file order is row-major order:
     * row-major files, and scalar or vector records.
     */
    private static class IdentityShaper extends Shaper {
        IdentityShaper( int[] dimSizes ) {
            super( dimSizes );
        }
        public Object toRowMajor( Object rawValues, int nrec ) {
            return rawValues;
        }
        public Object fromRowMajor( Object values, int nrec ) {
            return values;
        }
    }

    /**
     * Shaper for multidimensional records in a column-major file.
     * Groups of array elements (EPOCH16 pairs) are kept together.
     */
    private static class TransposeShaper extends Shaper {

        private final DataType dataType_;
        private final int ndim_;
        private final int itemSize_;
        private final int[] colStrides_;

        /**
         * Constructor.
         *
         * @param   dataType  data type
         * @param   dimSizes  sizes of the varying record dimensions
         */
        TransposeShaper( DataType dataType, int[] dimSizes ) {
            super( dimSizes );
            dataType_ = dataType;
            ndim_ = dimSizes.length;
            itemSize_ = dataType.getGroupSize();
            colStrides_ = new int[ ndim_ ];
            int stride = 1;
            for ( int idim = 0; idim < ndim_; idim++ ) {
                colStrides_[ idim ] = stride;
                stride *= dimSizes[ idim ];
            }
        }

        public Object toRowMajor( Object rawValues, int nrec ) {
            return transpose( rawValues, nrec, true );
        }

        public Object fromRowMajor( Object values, int nrec ) {
            return transpose( values, nrec, false );
        }

        /**
         * Reorders the items of each record.
         *
         * @param  in  input value array
         * @param  nrec  record count
         * @param  toRow  true for column-to-row, false for row-to-column
         * @return  new value array
         */
        private Object transpose( Object in, int nrec, boolean toRow ) {
            int[] dimSizes = getDimSizes();
            int nitem = getItemsPerRecord();
            int recLeng = nitem * itemSize_;
            Object out = Array.newInstance( dataType_.getArrayElementClass(),
                                            Array.getLength( in ) );
            int[] coords = new int[ ndim_ ];
            for ( int irec = 0; irec < nrec; irec++ ) {
                int base = irec * recLeng;
                Arrays.fill( coords, 0 );
                for ( int ix = 0; ix < nitem; ix++ ) {
                    int colIndex = 0;
                    for ( int idim = 0; idim < ndim_; idim++ ) {
                        colIndex += coords[ idim ] * colStrides_[ idim ];
                    }
                    int rowPos = base + ix * itemSize_;
                    int colPos = base + colIndex * itemSize_;
                    if ( toRow ) {
                        System.arraycopy( in, colPos, out, rowPos, itemSize_ );
                    }
                    else {
                        System.arraycopy( in, rowPos, out, colPos, itemSize_ );
                    }

                    // Advance row-major coordinates, last index fastest.
                    for ( int idim = ndim_ - 1; idim >= 0; idim-- ) {
                        if ( ++coords[ idim ] < dimSizes[ idim ] ) {
                            break;
                        }
                        coords[ idim ] = 0;
                    }
                }
            }
            return out;
        }
    }
}
