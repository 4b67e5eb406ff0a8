package io.github.mandar2812.cdfio.record;

import io.github.mandar2812.cdfio.Buf;
import io.github.mandar2812.cdfio.CdfFormatException;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.FileChannel;
import java.nio.charset.Charset;

/**
 * Buf implementation based on a single NIO ByteBuffer.
 * This works fine as long as it doesn't need to be more than 2^31 bytes (2Gb),
 * which is the maximum length of a ByteBuffer.
 *
 * @since    18 Jun 2013
 * @see      java.nio.ByteBuffer
 */
public class SimpleNioBuf implements Buf {

    private final ByteBuffer byteBuf_;

    /**
     * Constructor.
     *
     * @param  byteBuf  NIO byte buffer containing the byte data
     */
    public SimpleNioBuf( ByteBuffer byteBuf ) {
        byteBuf_ = byteBuf.duplicate().order( ByteOrder.BIG_ENDIAN );
    }

    /**
     * Constructs a buf wrapping a byte array.
     *
     * @param  bytes  data
     */
    public SimpleNioBuf( byte[] bytes ) {
        this( ByteBuffer.wrap( bytes ) );
    }

    /**
     * Creates a buf by mapping a file read-only.
     * The mapping stays valid after the channel is closed.
     *
     * @param  file  file containing data
     * @return  new buf
     */
    public static SimpleNioBuf mapFile( File file ) throws IOException {
        long leng = file.length();
        if ( leng > Integer.MAX_VALUE ) {
            throw new CdfFormatException( "File " + file + " too large ("
                                        + leng + " bytes)" );
        }
        try ( FileInputStream in = new FileInputStream( file );
              FileChannel channel = in.getChannel() ) {
            ByteBuffer bbuf =
                channel.map( FileChannel.MapMode.READ_ONLY, 0, leng );
            return new SimpleNioBuf( bbuf );
        }
    }

    public long getLength() {
        return byteBuf_.capacity();
    }

    public int readUnsignedByte( Pointer ptr ) throws IOException {
        return byteBuf_.get( toIndex( ptr.getAndIncrement( 1 ), 1 ) ) & 0xff;
    }

    public int readInt( Pointer ptr ) throws IOException {
        return byteBuf_.getInt( toIndex( ptr.getAndIncrement( 4 ), 4 ) );
    }

    public long readLong( Pointer ptr ) throws IOException {
        return byteBuf_.getLong( toIndex( ptr.getAndIncrement( 8 ), 8 ) );
    }

    public String readString( Pointer ptr, int nbyte, Charset charset )
            throws IOException {
        byte[] bytes = new byte[ nbyte ];
        readBytes( ptr.getAndIncrement( nbyte ), nbyte, bytes );
        int leng = 0;
        while ( leng < nbyte && bytes[ leng ] != 0 ) {
            leng++;
        }
        return new String( bytes, 0, leng, charset );
    }

    public void readBytes( long offset, int count, byte[] array )
            throws IOException {
        ByteBuffer bbuf = byteBuf_.duplicate();
        bbuf.position( toIndex( offset, count ) );
        bbuf.get( array, 0, count );
    }

    public InputStream createInputStream( long offset, long length ) {
        final ByteBuffer strmBuf = byteBuf_.duplicate();
        int start = (int) Math.min( offset, byteBuf_.capacity() );
        strmBuf.position( start );
        strmBuf.limit( (int) Math.min( byteBuf_.capacity(),
                                       start + length ) );
        return new InputStream() {
            @Override
            public int read() {
                return strmBuf.hasRemaining() ? strmBuf.get() & 0xff : -1;
            }
            @Override
            public int read( byte[] b, int off, int len ) {
                if ( len == 0 ) {
                    return 0;
                }
                int n = Math.min( len, strmBuf.remaining() );
                if ( n == 0 ) {
                    return -1;
                }
                strmBuf.get( b, off, n );
                return n;
            }
            @Override
            public int available() {
                return strmBuf.remaining();
            }
        };
    }

    /**
     * Checks that a run of bytes lies within this buffer and
     * downcasts its start offset to an int.
     *
     * @param  offset  start offset
     * @param  count   number of bytes required
     * @return   integer with the same value as <code>offset</code>
     * @throws  IOException  if the bytes run off the end of the buffer
     */
    private int toIndex( long offset, int count ) throws IOException {
        if ( offset < 0 || offset + count > byteBuf_.capacity() ) {
            throw new IOException( "Read of " + count + " bytes at offset "
                                 + offset + " outside file of length "
                                 + byteBuf_.capacity(),
                                   new BufferUnderflowException() );
        }
        return (int) offset;
    }
}
