package io.github.mandar2812.cdfio.record;

/**
 * Field data for CDF record of type rVariable or zVariable
 * Variable Descriptor Record.
 *
 * @since    19 Jun 2013
 */
public class VariableDescriptorRecord extends Record {

    public final long vdrNext;
    public final int dataType;
    public final int maxRec;
    public final long vxrHead;
    public final long vxrTail;
    public final int flags;
    public final int sRecords;
    public final int numElems;
    public final int num;
    public final long cprOrSprOffset;
    public final int blockingFactor;
    public final String name;
    public final int[] dimSizes;
    public final boolean[] dimVarys;
    public final long padOffset;

    /**
     * Constructor.
     *
     * @param  plan   basic record information
     * @param  vdrNext  offset of next VDR of same kind, or 0
     * @param  dataType  data type code
     * @param  maxRec   highest record number written, or -1
     * @param  vxrHead   offset of first VXR
     * @param  vxrTail   offset of last VXR
     * @param  flags   flags mask
     * @param  sRecords  sparse records code
     * @param  numElems  element count
     * @param  num   variable number
     * @param  cprOrSprOffset  offset of compression parameters record
     * @param  blockingFactor  blocking factor
     * @param  name   variable name
     * @param  dimSizes  declared dimension sizes
     * @param  dimVarys  declared dimension variances
     * @param  padOffset  offset of pad value, or -1 if none
     */
    public VariableDescriptorRecord( RecordPlan plan, long vdrNext,
                                     int dataType, int maxRec, long vxrHead,
                                     long vxrTail, int flags, int sRecords,
                                     int numElems, int num,
                                     long cprOrSprOffset, int blockingFactor,
                                     String name, int[] dimSizes,
                                     boolean[] dimVarys, long padOffset ) {
        super( plan, plan.getRecordType() == 8 ? "zVDR" : "rVDR" );
        this.vdrNext = vdrNext;
        this.dataType = dataType;
        this.maxRec = maxRec;
        this.vxrHead = vxrHead;
        this.vxrTail = vxrTail;
        this.flags = flags;
        this.sRecords = sRecords;
        this.numElems = numElems;
        this.num = num;
        this.cprOrSprOffset = cprOrSprOffset;
        this.blockingFactor = blockingFactor;
        this.name = name;
        this.dimSizes = dimSizes;
        this.dimVarys = dimVarys;
        this.padOffset = padOffset;
    }

    /**
     * Indicates zVariable.
     *
     * @return  true for zVariable, false for rVariable
     */
    public boolean isZVariable() {
        return getRecordType() == 8;
    }

    /**
     * Indicates record variance.
     *
     * @return  true iff values vary between records
     */
    public boolean isRecordVarying() {
        return hasBit( flags, 0 );
    }

    /**
     * Indicates presence of a pad value.
     *
     * @return  true iff a pad value follows the dimension fields
     */
    public boolean hasPad() {
        return hasBit( flags, 1 );
    }

    /**
     * Indicates that variable values may be compressed.
     *
     * @return  true iff compression is in use
     */
    public boolean isCompressed() {
        return hasBit( flags, 2 );
    }

    /**
     * Returns the number of values in one physical record,
     * the product of the varying dimension sizes.
     *
     * @return  values per record
     */
    public int getValuesPerRecord() {
        int n = 1;
        for ( int i = 0; i < dimSizes.length; i++ ) {
            if ( dimVarys[ i ] ) {
                n *= dimSizes[ i ];
            }
        }
        return n;
    }
}
