package io.github.mandar2812.cdfio.record;

/**
 * Field data for CDF record of type Attribute Entry Descriptor Record.
 * The same layout serves for global/rVariable entries (AgrEDR)
 * and zVariable entries (AzEDR).
 *
 * @since    19 Jun 2013
 */
public class AttributeEntryDescriptorRecord extends Record {

    public final long aedrNext;
    public final int attrNum;
    public final int dataType;
    public final int num;
    public final int numElems;
    public final int numStrings;
    public final long valueOffset;

    /**
     * Constructor.
     *
     * @param  plan   basic record information
     * @param  aedrNext  offset of next entry, or 0
     * @param  attrNum  number of owning attribute
     * @param  dataType  data type code
     * @param  num   entry number
     * @param  numElems  number of elements
     * @param  numStrings  number of strings for character entries
     * @param  valueOffset  file offset of the entry's value bytes
     */
    public AttributeEntryDescriptorRecord( RecordPlan plan, long aedrNext,
                                           int attrNum, int dataType, int num,
                                           int numElems, int numStrings,
                                           long valueOffset ) {
        super( plan, plan.getRecordType() == 9 ? "AzEDR" : "AgrEDR" );
        this.aedrNext = aedrNext;
        this.attrNum = attrNum;
        this.dataType = dataType;
        this.num = num;
        this.numElems = numElems;
        this.numStrings = numStrings;
        this.valueOffset = valueOffset;
    }
}
