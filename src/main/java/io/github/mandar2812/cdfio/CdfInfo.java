package io.github.mandar2812.cdfio;

import java.io.File;
import java.util.List;
import java.util.Map;

/**
 * Encapsulates some global information about a CDF file.
 *
 * @since    20 Jun 2013
 */
public class CdfInfo {

    private final File file_;
    private final String version_;
    private final NumericEncoding encoding_;
    private final boolean rowMajor_;
    private final List<String> rVariables_;
    private final List<String> zVariables_;
    private final Map<String,String> attributes_;
    private final String copyright_;
    private final boolean checksum_;
    private final int[] rDimSizes_;
    private final boolean compressed_;
    private final int leapSecondLastUpdated_;

    /**
     * Constructor.
     *
     * @param  file  file read
     * @param  version  library version that wrote the file, "v.r.i"
     * @param  encoding  numeric encoding of data values
     * @param  rowMajor  true for row majority, false for column majority
     * @param  rVariables  rVariable names in order
     * @param  zVariables  zVariable names in order
     * @param  attributes  attribute name to scope token, in order
     * @param  copyright  copyright text from the CDR
     * @param  checksum  whether the file carries an MD5 checksum
     * @param  rDimSizes   array of dimension sizes for rVariables
     * @param  compressed  whether whole-file compression is used
     * @param  leapSecondLastUpdated  value of the GDR LeapSecondLastUpdated
     *         field, or -1 for version 2 files
     */
    public CdfInfo( File file, String version, NumericEncoding encoding,
                    boolean rowMajor, List<String> rVariables,
                    List<String> zVariables, Map<String,String> attributes,
                    String copyright, boolean checksum, int[] rDimSizes,
                    boolean compressed, int leapSecondLastUpdated ) {
        file_ = file;
        version_ = version;
        encoding_ = encoding;
        rowMajor_ = rowMajor;
        rVariables_ = rVariables;
        zVariables_ = zVariables;
        attributes_ = attributes;
        copyright_ = copyright;
        checksum_ = checksum;
        rDimSizes_ = rDimSizes;
        compressed_ = compressed;
        leapSecondLastUpdated_ = leapSecondLastUpdated;
    }

    public File getFile() {
        return file_;
    }

    public String getVersion() {
        return version_;
    }

    public NumericEncoding getEncoding() {
        return encoding_;
    }

    /**
     * Indicates majority of CDF arrays.
     *
     * @return  true for row majority, false for column majority
     */
    public boolean getRowMajor() {
        return rowMajor_;
    }

    /**
     * Returns the majority token.
     *
     * @return  "Row_major" or "Column_major"
     */
    public String getMajority() {
        return rowMajor_ ? "Row_major" : "Column_major";
    }

    public List<String> getRVariables() {
        return rVariables_;
    }

    public List<String> getZVariables() {
        return zVariables_;
    }

    /**
     * Returns the attributes in file order, each mapped to its scope
     * token ({@link AttributeInfo#GLOBAL_SCOPE} or
     * {@link AttributeInfo#VARIABLE_SCOPE}).
     *
     * @return  ordered name to scope map
     */
    public Map<String,String> getAttributes() {
        return attributes_;
    }

    public String getCopyright() {
        return copyright_;
    }

    public boolean hasChecksum() {
        return checksum_;
    }

    public int getRNumDims() {
        return rDimSizes_.length;
    }

    /**
     * Returns array dimensions for rVariables.
     *
     * @return  array of dimension sizes for rVariables
     */
    public int[] getRDimSizes() {
        return rDimSizes_;
    }

    public boolean isCompressed() {
        return compressed_;
    }

    /**
     * Returns the date of the last leap second the CDF file knows about.
     * This is the value of the LeapSecondLastUpdated field from the GDR
     * (introduced at CDF v3.6).  The value is an integer whose
     * decimal representation is of the form YYYYMMDD.
     * Values 0 and -1 have special meaning (no last leap second).
     *
     * @return   last known leap second indicator
     */
    public int getLeapSecondLastUpdated() {
        return leapSecondLastUpdated_;
    }

    @Override
    public String toString() {
        return file_ + ": CDF " + version_ + ", " + encoding_ + ", "
             + getMajority() + ", " + rVariables_.size() + " rVariables, "
             + zVariables_.size() + " zVariables, "
             + attributes_.size() + " attributes"
             + ( compressed_ ? ", compressed" : "" )
             + ( checksum_ ? ", checksum" : "" );
    }
}
