package io.github.mandar2812.cdfio.write;

import io.github.mandar2812.cdfio.CdfUsageException;
import io.github.mandar2812.cdfio.DataType;
import io.github.mandar2812.cdfio.SparseMode;

/**
 * Declaration of a variable to be written.
 *
 * <p>By default a variable is a record-varying, non-sparse zVariable
 * with one element per value, no dimensions, the default pad value
 * for its type and block compression at GZIP level 6.
 * Block compression only takes effect for blocks that it makes smaller,
 * and does not apply to sparse variables.
 *
 * <p>rVariables take their dimension sizes from the file,
 * so for them only the dimension variances are given here.
 *
 * @since    3 Jul 2013
 */
public class VariableSpec {

    /** Default GZIP level for variable data blocks. */
    public static final int DEFAULT_COMPRESSION = 6;

    private final String name_;
    private final DataType dataType_;
    private int numElems_ = 1;
    private boolean recVary_ = true;
    private boolean zVariable_ = true;
    private int[] dimSizes_ = new int[ 0 ];
    private boolean[] dimVarys_;
    private SparseMode sparse_ = SparseMode.NO_SPARSE;
    private int compressionLevel_ = DEFAULT_COMPRESSION;
    private int blockingFactor_ = 1;
    private Object pad_;

    /**
     * Constructor.
     *
     * @param  name  variable name
     * @param  dataType  data type
     */
    public VariableSpec( String name, DataType dataType ) {
        if ( name == null || name.trim().length() == 0 ) {
            throw new CdfUsageException( "Variable name required" );
        }
        if ( dataType == null ) {
            throw new CdfUsageException( "Data type required for " + name );
        }
        name_ = name;
        dataType_ = dataType;
    }

    /**
     * Sets the element count, which is the string length for
     * character types and must be 1 otherwise.
     *
     * @param  numElems  element count
     * @return  this spec
     */
    public VariableSpec numElems( int numElems ) {
        numElems_ = numElems;
        return this;
    }

    public VariableSpec recVary( boolean recVary ) {
        recVary_ = recVary;
        return this;
    }

    /**
     * Makes this a zVariable with the given dimension sizes.
     * All dimensions vary.
     *
     * @param  dimSizes  dimension sizes
     * @return  this spec
     */
    public VariableSpec zVariable( int... dimSizes ) {
        zVariable_ = true;
        dimSizes_ = dimSizes.clone();
        dimVarys_ = null;
        return this;
    }

    /**
     * Makes this an rVariable.  There must be one variance flag
     * for each rVariable dimension of the file.
     *
     * @param  dimVarys  dimension variances
     * @return  this spec
     */
    public VariableSpec rVariable( boolean... dimVarys ) {
        zVariable_ = false;
        dimSizes_ = new int[ 0 ];
        dimVarys_ = dimVarys.clone();
        return this;
    }

    public VariableSpec sparse( SparseMode sparse ) {
        sparse_ = sparse;
        return this;
    }

    /**
     * Sets the GZIP level used for data blocks, 0 for none.
     * Ignored for sparse variables, which are stored uncompressed.
     *
     * @param  level  level 0-9
     * @return  this spec
     */
    public VariableSpec compressionLevel( int level ) {
        if ( level < 0 || level > 9 ) {
            throw new CdfUsageException( "Compression level " + level
                                       + " not in range 0-9" );
        }
        compressionLevel_ = level;
        return this;
    }

    /**
     * Sets the number of records per compressed block.
     * Values smaller than the number of records that fit in 64kB
     * are raised to that.
     *
     * @param  blockingFactor  records per block
     * @return  this spec
     */
    public VariableSpec blockingFactor( int blockingFactor ) {
        blockingFactor_ = blockingFactor;
        return this;
    }

    /**
     * Sets the pad value.
     *
     * @param  pad  single value, String for character types
     * @return  this spec
     */
    public VariableSpec pad( Object pad ) {
        pad_ = pad;
        return this;
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

    public boolean isRecVary() {
        return recVary_;
    }

    public boolean isZVariable() {
        return zVariable_;
    }

    /**
     * Returns the zVariable dimension sizes.
     *
     * @return  dimension sizes, empty for rVariables
     */
    public int[] getDimSizes() {
        return dimSizes_.clone();
    }

    /**
     * Returns the declared dimension variances.
     *
     * @return  variances, or null if all dimensions vary
     */
    public boolean[] getDimVarys() {
        return dimVarys_ == null ? null : dimVarys_.clone();
    }

    public SparseMode getSparse() {
        return sparse_;
    }

    public int getCompressionLevel() {
        return compressionLevel_;
    }

    public int getBlockingFactor() {
        return blockingFactor_;
    }

    public Object getPad() {
        return pad_;
    }
}
