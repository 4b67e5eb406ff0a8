package io.github.mandar2812.cdfio.record;

/**
 * Field data for CDF record of type Variable Index Record.
 *
 * @since    19 Jun 2013
 */
public class VariableIndexRecord extends Record {

    public final long vxrNext;
    public final int nEntries;
    public final int nUsedEntries;
    public final int[] first;
    public final int[] last;
    public final long[] offset;

    /**
     * Constructor.
     *
     * @param  plan   basic record information
     * @param  vxrNext  offset of next VXR, or 0
     * @param  nEntries  entry capacity
     * @param  nUsedEntries  number of used entries
     * @param  first   first record of each used entry
     * @param  last   last record of each used entry
     * @param  offset  offset of VVR, CVVR or child VXR of each used entry
     */
    public VariableIndexRecord( RecordPlan plan, long vxrNext, int nEntries,
                                int nUsedEntries, int[] first, int[] last,
                                long[] offset ) {
        super( plan, "VXR" );
        this.vxrNext = vxrNext;
        this.nEntries = nEntries;
        this.nUsedEntries = nUsedEntries;
        this.first = first;
        this.last = last;
        this.offset = offset;
    }
}
