package io.github.mandar2812.cdfio;

/**
 * Describes a variable as declared in its Variable Descriptor Record.
 *
 * @since    20 Jun 2013
 */
public class VariableInfo {

    /** Token for rVariables. */
    public static final String R_VARIABLE = "rVariable";

    /** Token for zVariables. */
    public static final String Z_VARIABLE = "zVariable";

    private final String name_;
    private final int num_;
    private final boolean isZ_;
    private final DataType dataType_;
    private final int numElems_;
    private final int[] dimSizes_;
    private final boolean[] dimVarys_;
    private final SparseMode sparse_;
    private final int lastRec_;
    private final boolean recVary_;
    private final Object pad_;
    private final int compressionLevel_;
    private final int blockingFactor_;

    /**
     * Constructor.
     *
     * @param  name  variable name
     * @param  num   variable number within its kind
     * @param  isZ   true for a zVariable, false for an rVariable
     * @param  dataType  data type
     * @param  numElems  element count (string length for character types)
     * @param  dimSizes  declared dimension sizes
     * @param  dimVarys  declared dimension variances
     * @param  sparse   sparse record policy
     * @param  lastRec  highest record written, -1 if none
     * @param  recVary  record variance
     * @param  pad  one-value array holding the declared pad value,
     *              or null if none is declared
     * @param  compressionLevel  gzip level, 0 if uncompressed
     * @param  blockingFactor  records per allocation block
     */
    public VariableInfo( String name, int num, boolean isZ, DataType dataType,
                         int numElems, int[] dimSizes, boolean[] dimVarys,
                         SparseMode sparse, int lastRec, boolean recVary,
                         Object pad, int compressionLevel,
                         int blockingFactor ) {
        name_ = name;
        num_ = num;
        isZ_ = isZ;
        dataType_ = dataType;
        numElems_ = numElems;
        dimSizes_ = dimSizes;
        dimVarys_ = dimVarys;
        sparse_ = sparse;
        lastRec_ = lastRec;
        recVary_ = recVary;
        pad_ = pad;
        compressionLevel_ = compressionLevel;
        blockingFactor_ = blockingFactor;
    }

    public String getName() {
        return name_;
    }

    public int getNum() {
        return num_;
    }

    public boolean isZVariable() {
        return isZ_;
    }

    /**
     * Returns the variable kind token.
     *
     * @return  {@link #R_VARIABLE} or {@link #Z_VARIABLE}
     */
    public String getVarType() {
        return isZ_ ? Z_VARIABLE : R_VARIABLE;
    }

    public DataType getDataType() {
        return dataType_;
    }

    public int getDataTypeCode() {
        return dataType_.getCode();
    }

    /**
     * Returns the data type token.
     *
     * @return  for instance "CDF_REAL8"
     */
    public String getDataTypeDescription() {
        return dataType_.getToken();
    }

    public int getNumElems() {
        return numElems_;
    }

    public int getNumDims() {
        return dimSizes_.length;
    }

    /**
     * Returns the declared dimension sizes, including any
     * non-varying dimensions.
     *
     * @return  dimension sizes
     */
    public int[] getDimSizes() {
        return dimSizes_;
    }

    public boolean[] getDimVarys() {
        return dimVarys_;
    }

    /**
     * Returns the sizes of the dimensions that are stored for each
     * record, that is the varying ones.
     *
     * @return  record dimension sizes
     */
    public int[] getRecordDims() {
        int n = 0;
        for ( boolean vary : dimVarys_ ) {
            n += vary ? 1 : 0;
        }
        int[] dims = new int[ n ];
        int j = 0;
        for ( int i = 0; i < dimSizes_.length; i++ ) {
            if ( dimVarys_[ i ] ) {
                dims[ j++ ] = dimSizes_[ i ];
            }
        }
        return dims;
    }

    /**
     * Returns the number of values stored for each record.
     *
     * @return  product of varying dimension sizes
     */
    public int getValuesPerRecord() {
        int n = 1;
        for ( int dim : getRecordDims() ) {
            n *= dim;
        }
        return n;
    }

    public SparseMode getSparse() {
        return sparse_;
    }

    public int getLastRec() {
        return lastRec_;
    }

    public boolean getRecVary() {
        return recVary_;
    }

    /**
     * Returns the declared pad value.
     *
     * @return  one-value array, or null if no pad is declared
     */
    public Object getPad() {
        return pad_;
    }

    public int getCompressionLevel() {
        return compressionLevel_;
    }

    public int getBlockingFactor() {
        return blockingFactor_;
    }

    @Override
    public String toString() {
        StringBuffer sbuf = new StringBuffer()
            .append( name_ )
            .append( " (" )
            .append( getVarType() )
            .append( " " )
            .append( num_ )
            .append( "): " )
            .append( dataType_.getToken() )
            .append( "/" )
            .append( numElems_ )
            .append( " " )
            .append( recVary_ ? "T" : "F" )
            .append( "/" );
        for ( int i = 0; i < dimSizes_.length; i++ ) {
            sbuf.append( dimVarys_[ i ] ? "T" : "F" );
        }
        sbuf.append( " [" );
        for ( int i = 0; i < dimSizes_.length; i++ ) {
            if ( i > 0 ) {
                sbuf.append( "," );
            }
            sbuf.append( dimSizes_[ i ] );
        }
        return sbuf.append( "] " )
                   .append( sparse_.getToken() )
                   .append( ", last record " )
                   .append( lastRec_ )
                   .toString();
    }
}
