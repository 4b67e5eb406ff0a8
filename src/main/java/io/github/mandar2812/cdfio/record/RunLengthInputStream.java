package io.github.mandar2812.cdfio.record;

import io.github.mandar2812.cdfio.CdfFormatException;
import java.io.IOException;
import java.io.InputStream;

/**
 * Decompression stream for CDF's version of Run Length Encoding.
 *
 * <p>The compressed stream is just like the uncompressed one,
 * except that a byte with the special value V is followed by
 * a byte giving the number of additional bytes V to consider present
 * in the stream.
 * Thus the compressed stream:
 * <blockquote>
 *    1 2 3 0 0 4 5 6 0 2
 * </blockquote>
 * is decompressed as
 * <blockquote>
 *    1 2 3 0 4 5 6 0 0 0
 * </blockquote>
 * (assuming a special value V=0).
 *
 * @since    17 May 2013
 */
public class RunLengthInputStream extends InputStream {

    private final InputStream base_;
    private final int rleVal_;
    private int vCount_;

    /**
     * Constructor.
     *
     * @param  base   input stream containing RLE-compressed data
     * @param  rleVal  the byte value whose run lengths are compressed;
     *                 zero for CDF
     */
    public RunLengthInputStream( InputStream base, byte rleVal ) {
        base_ = base;
        rleVal_ = rleVal & 0xff;
    }

    @Override
    public int read() throws IOException {
        if ( vCount_ > 0 ) {
            vCount_--;
            return rleVal_;
        }
        int b = base_.read();
        if ( b == rleVal_ ) {
            int c = base_.read();
            if ( c < 0 ) {
                throw new CdfFormatException( "Bad RLE data: "
                                            + "run count missing at end" );
            }
            vCount_ = c;
            return rleVal_;
        }
        return b;
    }

    @Override
    public int read( byte[] b, int off, int len ) throws IOException {
        int n = 0;
        while ( n < len ) {
            int c = read();
            if ( c < 0 ) {
                return n == 0 ? -1 : n;
            }
            b[ off + n++ ] = (byte) c;
        }
        return n;
    }

    @Override
    public int available() throws IOException {
        return vCount_;
    }

    @Override
    public void close() throws IOException {
        base_.close();
    }

    @Override
    public boolean markSupported() {
        return false;
    }
}
