package io.github.mandar2812.cdfio.write;

import io.github.mandar2812.cdfio.CdfUsageException;
import io.github.mandar2812.cdfio.NumericEncoding;

/**
 * File-level options for a new CDF.
 * Defaults are column-major storage, the host byte order,
 * no checksum, no whole-file compression and no rVariable dimensions.
 *
 * @since    3 Jul 2013
 */
public class WriterSpec {

    private boolean rowMajor_;
    private NumericEncoding encoding_ = NumericEncoding.HOST;
    private boolean checksum_;
    private int compressionLevel_;
    private int[] rDimSizes_ = new int[ 0 ];

    /**
     * Sets the majority.
     *
     * @param  rowMajor  true for row-major, false for column-major
     * @return  this spec
     */
    public WriterSpec rowMajor( boolean rowMajor ) {
        rowMajor_ = rowMajor;
        return this;
    }

    /**
     * Sets the numeric encoding.  Only encodings with a plain IEEE
     * byte order are accepted.
     *
     * @param  encoding  encoding
     * @return  this spec
     */
    public WriterSpec encoding( NumericEncoding encoding ) {
        if ( encoding != NumericEncoding.HOST
             && encoding.isBigendian() == null ) {
            throw new CdfUsageException( "Can't write encoding "
                                       + encoding );
        }
        encoding_ = encoding;
        return this;
    }

    /**
     * Sets whether an MD5 checksum is appended on close.
     *
     * @param  checksum  checksum flag
     * @return  this spec
     */
    public WriterSpec checksum( boolean checksum ) {
        checksum_ = checksum;
        return this;
    }

    /**
     * Sets the GZIP level for whole-file compression, 0 for none.
     *
     * @param  level  compression level 0-9
     * @return  this spec
     */
    public WriterSpec compressionLevel( int level ) {
        if ( level < 0 || level > 9 ) {
            throw new CdfUsageException( "Compression level " + level
                                       + " not in range 0-9" );
        }
        compressionLevel_ = level;
        return this;
    }

    /**
     * Sets the dimension sizes shared by all rVariables.
     *
     * @param  rDimSizes  dimension sizes
     * @return  this spec
     */
    public WriterSpec rDimSizes( int... rDimSizes ) {
        for ( int size : rDimSizes ) {
            if ( size < 1 ) {
                throw new CdfUsageException( "Bad rVariable dimension size "
                                           + size );
            }
        }
        rDimSizes_ = rDimSizes.clone();
        return this;
    }

    public boolean isRowMajor() {
        return rowMajor_;
    }

    public NumericEncoding getEncoding() {
        return encoding_;
    }

    public boolean hasChecksum() {
        return checksum_;
    }

    public int getCompressionLevel() {
        return compressionLevel_;
    }

    public int[] getRDimSizes() {
        return rDimSizes_.clone();
    }
}
