package io.github.mandar2812.cdfio.record;

/**
 * Field data for CDF record of type Global Descriptor Record.
 *
 * @since    19 Jun 2013
 */
public class GlobalDescriptorRecord extends Record {

    public final long rVdrHead;
    public final long zVdrHead;
    public final long adrHead;
    public final long eof;
    public final int nrVars;
    public final int numAttr;
    public final int rMaxRec;
    public final int rNumDims;
    public final int nzVars;
    public final int leapSecondLastUpdated;
    public final int[] rDimSizes;

    /**
     * Constructor.
     *
     * @param  plan   basic record information
     * @param  rVdrHead  offset of first rVariable VDR
     * @param  zVdrHead  offset of first zVariable VDR
     * @param  adrHead  offset of first ADR
     * @param  eof   end of file offset
     * @param  nrVars  rVariable count
     * @param  numAttr  attribute count
     * @param  rMaxRec  maximum rVariable record
     * @param  rNumDims  rVariable dimensionality
     * @param  nzVars  zVariable count
     * @param  leapSecondLastUpdated  leap second table date as YYYYMMDD,
     *                                or -1 if not recorded
     * @param  rDimSizes  rVariable dimension sizes
     */
    public GlobalDescriptorRecord( RecordPlan plan, long rVdrHead,
                                   long zVdrHead, long adrHead, long eof,
                                   int nrVars, int numAttr, int rMaxRec,
                                   int rNumDims, int nzVars,
                                   int leapSecondLastUpdated,
                                   int[] rDimSizes ) {
        super( plan, "GDR" );
        this.rVdrHead = rVdrHead;
        this.zVdrHead = zVdrHead;
        this.adrHead = adrHead;
        this.eof = eof;
        this.nrVars = nrVars;
        this.numAttr = numAttr;
        this.rMaxRec = rMaxRec;
        this.rNumDims = rNumDims;
        this.nzVars = nzVars;
        this.leapSecondLastUpdated = leapSecondLastUpdated;
        this.rDimSizes = rDimSizes;
    }
}
