package io.github.mandar2812.cdfio.record;

import io.github.mandar2812.cdfio.CdfFormatException;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

/**
 * Defines a data compression type supported for compressing CDF data.
 * Reading supports run-length encoding and gzip;
 * writing supports gzip only.
 *
 * @since    19 Jun 2013
 */
public abstract class Compression {

    /** No compression. */
    public static final Compression NONE = new Compression( "NONE", 0 ) {
        public InputStream uncompressStream( InputStream in ) {
            return in;
        }
    };

    /** Run length encoding. */
    public static final Compression RLE = new Compression( "RLE", 1 ) {
        public InputStream uncompressStream( InputStream in ) {
            return new RunLengthInputStream( in, (byte) 0 );
        }
    };

    /** Gzip compression. */
    public static final Compression GZIP = new Compression( "GZIP", 5 ) {
        public InputStream uncompressStream( InputStream in )
                throws IOException {
            return new GZIPInputStream( in );
        }
        @Override
        public OutputStream compressStream( OutputStream out,
                                            final int level )
                throws IOException {
            return new GZIPOutputStream( out ) {
                {
                    def.setLevel( level );
                }
            };
        }
    };

    private final String name_;
    private final int cType_;

    /**
     * Constructor.
     *
     * @param   name   compression format name
     * @param   cType  code used in the CPR cType field
     */
    protected Compression( String name, int cType ) {
        name_ = name;
        cType_ = cType;
    }

    /**
     * Turns a stream containing compressed data into a stream containing
     * uncompressed data.
     *
     * @param  in  compressed input stream
     * @return  uncompressed input stream
     */
    public abstract InputStream uncompressStream( InputStream in )
            throws IOException;

    /**
     * Wraps an output stream so that data written to it is compressed.
     *
     * @param  out  destination stream
     * @param  level  compression level 0-9
     * @return  compressing stream; closing it finishes the compressed data
     * @throws  CdfFormatException  if this format cannot be written
     */
    public OutputStream compressStream( OutputStream out, int level )
            throws IOException {
        throw new CdfFormatException( "Can't write " + name_
                                    + " compressed data" );
    }

    /**
     * Compresses a byte array.
     *
     * @param  data  uncompressed bytes
     * @param  level  compression level 0-9
     * @return  compressed bytes
     */
    public byte[] compress( byte[] data, int level ) throws IOException {
        ByteArrayOutputStream bout = new ByteArrayOutputStream();
        try ( OutputStream out = compressStream( bout, level ) ) {
            out.write( data );
        }
        return bout.toByteArray();
    }

    /**
     * Uncompresses a byte array whose uncompressed size is not known.
     *
     * @param  data  compressed bytes
     * @return  uncompressed bytes
     */
    public byte[] uncompress( byte[] data ) throws IOException {
        try ( InputStream in =
                  uncompressStream( new ByteArrayInputStream( data ) ) ) {
            return in.readAllBytes();
        }
    }

    /**
     * Returns this compression format's name.
     *
     * @return  name
     */
    public String getName() {
        return name_;
    }

    /**
     * Returns the CPR code for this format.
     *
     * @return  cType value
     */
    public int getCType() {
        return cType_;
    }

    @Override
    public String toString() {
        return name_;
    }

    /**
     * Returns a Compression object corresponding to a given compression code.
     *
     * @param  cType  compression code, as taken from the CPR cType field
     * @return  compression object
     * @throws CdfFormatException if the compression type is unknown
     *                            or unsupported
     */
    public static Compression getCompression( int cType )
            throws CdfFormatException {

        // cdf.h has:
        //    #define NO_COMPRESSION                  0L
        //    #define RLE_COMPRESSION                 1L
        //    #define HUFF_COMPRESSION                2L
        //    #define AHUFF_COMPRESSION               3L
        //    #define GZIP_COMPRESSION                5L
        switch ( cType ) {
            case 0: return NONE;
            case 1: return RLE;
            case 5: return GZIP;
            case 2:
            case 3:
                throw new CdfFormatException( "Huffman compression "
                                            + "(cType=" + cType
                                            + ") not supported" );
            default:
                throw new CdfFormatException( "Unknown compression format "
                                            + "cType=" + cType );
        }
    }
}
