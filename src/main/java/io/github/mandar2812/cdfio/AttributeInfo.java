package io.github.mandar2812.cdfio;

/**
 * Describes an attribute as declared in its Attribute Descriptor Record.
 *
 * @since    28 Jun 2013
 */
public class AttributeInfo {

    /** Scope token for global attributes. */
    public static final String GLOBAL_SCOPE = "Global";

    /** Scope token for variable attributes. */
    public static final String VARIABLE_SCOPE = "Variable";

    private final String name_;
    private final int num_;
    private final boolean global_;
    private final int maxGrEntry_;
    private final int numGrEntries_;
    private final int maxZEntry_;
    private final int numZEntries_;

    /**
     * Constructor.
     *
     * @param  name  attribute name
     * @param  num  attribute number
     * @param  global  true for global scope
     * @param  maxGrEntry  highest g/rEntry number, -1 if none
     * @param  numGrEntries  number of g/rEntries
     * @param  maxZEntry  highest zEntry number, -1 if none
     * @param  numZEntries  number of zEntries
     */
    public AttributeInfo( String name, int num, boolean global,
                          int maxGrEntry, int numGrEntries, int maxZEntry,
                          int numZEntries ) {
        name_ = name;
        num_ = num;
        global_ = global;
        maxGrEntry_ = maxGrEntry;
        numGrEntries_ = numGrEntries;
        maxZEntry_ = maxZEntry;
        numZEntries_ = numZEntries;
    }

    public String getName() {
        return name_;
    }

    public int getNum() {
        return num_;
    }

    public boolean isGlobal() {
        return global_;
    }

    /**
     * Returns the scope token.
     *
     * @return  {@link #GLOBAL_SCOPE} or {@link #VARIABLE_SCOPE}
     */
    public String getScope() {
        return global_ ? GLOBAL_SCOPE : VARIABLE_SCOPE;
    }

    public int getMaxGrEntry() {
        return maxGrEntry_;
    }

    public int getNumGrEntries() {
        return numGrEntries_;
    }

    public int getMaxZEntry() {
        return maxZEntry_;
    }

    public int getNumZEntries() {
        return numZEntries_;
    }

    @Override
    public String toString() {
        return name_ + " (" + getScope() + " " + num_ + "): "
             + numGrEntries_ + " g/rEntries, " + numZEntries_ + " zEntries";
    }
}
