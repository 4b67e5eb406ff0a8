package io.github.mandar2812.cdfio;

import io.github.mandar2812.cdfio.record.Pointer;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;

/**
 * Represents a sequence of bytes along with operations to read
 * the fixed-width big-endian control fields of CDF records from it.
 * Record fields are always big-endian whatever the data encoding
 * of the file; variable values are read as raw bytes and decoded
 * by {@link DataType}.
 *
 * @since    18 Jun 2013
 */
public interface Buf {

    /**
     * Returns the extent of this buf in bytes.
     *
     * @return  buffer length
     */
    long getLength();

    /**
     * Reads a single byte from the pointer position,
     * returning a value in the range 0..255.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr   pointer
     * @return   byte value
     */
    int readUnsignedByte( Pointer ptr ) throws IOException;

    /**
     * Reads a signed big-endian 4-byte integer from the pointer position.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr  pointer
     * @return  integer value
     */
    int readInt( Pointer ptr ) throws IOException;

    /**
     * Reads a signed big-endian 8-byte integer from the pointer position.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr  pointer
     * @return  long value
     */
    long readLong( Pointer ptr ) throws IOException;

    /**
     * Reads a fixed number of bytes interpreting them as characters
     * in a given encoding and returns the result as a string.
     * If a character 0x00 appears before <code>nbyte</code> bytes have
     * been read, it is taken as the end of the string.
     * Pointer position is moved on appropriately.
     *
     * @param  ptr    pointer
     * @param  nbyte   maximum number of bytes in string
     * @param  charset  character encoding
     * @return  string
     */
    String readString( Pointer ptr, int nbyte, Charset charset )
            throws IOException;

    /**
     * Reads a sequence of bytes from this buf into an array.
     *
     * @param  offset  position of sequence start in this buffer in bytes
     * @param  count   number of bytes to read
     * @param  array   array to receive values, starting at array element 0
     */
    void readBytes( long offset, int count, byte[] array ) throws IOException;

    /**
     * Returns an input stream consisting of a run of bytes in this buf.
     *
     * @param  offset  position of first byte in buf that will appear in
     *                 the returned stream
     * @param  length  number of bytes in the stream
     * @return  input stream
     */
    InputStream createInputStream( long offset, long length );
}
