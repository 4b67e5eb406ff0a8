package io.github.mandar2812.cdfio.record;

/**
 * Field data for CDF record of type Attribute Descriptor Record.
 *
 * @since    19 Jun 2013
 */
public class AttributeDescriptorRecord extends Record {

    public final long adrNext;
    public final long agrEdrHead;
    public final int scope;
    public final int num;
    public final int ngrEntries;
    public final int maxGrEntry;
    public final long azEdrHead;
    public final int nzEntries;
    public final int maxZEntry;
    public final String name;

    /**
     * Constructor.
     *
     * @param  plan   basic record information
     * @param  adrNext  offset of next ADR, or 0
     * @param  agrEdrHead  offset of first global/rVariable entry, or 0
     * @param  scope   1 for global, 2 for variable
     * @param  num   attribute number
     * @param  ngrEntries  number of global/rVariable entries
     * @param  maxGrEntry  highest global/rVariable entry number
     * @param  azEdrHead  offset of first zVariable entry, or 0
     * @param  nzEntries  number of zVariable entries
     * @param  maxZEntry  highest zVariable entry number
     * @param  name   attribute name
     */
    public AttributeDescriptorRecord( RecordPlan plan, long adrNext,
                                      long agrEdrHead, int scope, int num,
                                      int ngrEntries, int maxGrEntry,
                                      long azEdrHead, int nzEntries,
                                      int maxZEntry, String name ) {
        super( plan, "ADR" );
        this.adrNext = adrNext;
        this.agrEdrHead = agrEdrHead;
        this.scope = scope;
        this.num = num;
        this.ngrEntries = ngrEntries;
        this.maxGrEntry = maxGrEntry;
        this.azEdrHead = azEdrHead;
        this.nzEntries = nzEntries;
        this.maxZEntry = maxZEntry;
        this.name = name;
    }

    /**
     * Indicates global scope.
     *
     * @return  true for a global attribute, false for a variable attribute
     */
    public boolean isGlobal() {
        return scope == 1 || scope == 3;
    }
}
