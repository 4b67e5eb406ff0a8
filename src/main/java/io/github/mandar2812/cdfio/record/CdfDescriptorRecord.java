package io.github.mandar2812.cdfio.record;

/**
 * Field data for CDF record of type CDF Descriptor Record.
 *
 * @since    19 Jun 2013
 */
public class CdfDescriptorRecord extends Record {

    public final long gdrOffset;
    public final int version;
    public final int release;
    public final int encoding;
    public final int flags;
    public final int increment;
    public final String copyright;

    /**
     * Constructor.
     *
     * @param  plan   basic record information
     * @param  gdrOffset  offset of the GDR
     * @param  version   format version
     * @param  release   format release
     * @param  encoding  numeric encoding code
     * @param  flags     flags mask
     * @param  increment  format increment
     * @param  copyright  copyright text
     */
    public CdfDescriptorRecord( RecordPlan plan, long gdrOffset, int version,
                                int release, int encoding, int flags,
                                int increment, String copyright ) {
        super( plan, "CDR" );
        this.gdrOffset = gdrOffset;
        this.version = version;
        this.release = release;
        this.encoding = encoding;
        this.flags = flags;
        this.increment = increment;
        this.copyright = copyright;
    }

    /**
     * Indicates row majority of array storage.
     *
     * @return  true for row major, false for column major
     */
    public boolean isRowMajor() {
        return hasBit( flags, 0 );
    }

    /**
     * Indicates single-file format.  Multi-file CDFs are not supported.
     *
     * @return  true for single-file
     */
    public boolean isSingleFile() {
        return hasBit( flags, 1 );
    }

    /**
     * Indicates whether an MD5 checksum trails the file.
     *
     * @return  true iff checksummed
     */
    public boolean hasChecksum() {
        return hasBit( flags, 2 );
    }

    /**
     * Returns the version as a dotted string.
     *
     * @return  "version.release.increment"
     */
    public String getVersionString() {
        return version + "." + release + "." + increment;
    }
}
