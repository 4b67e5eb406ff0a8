package io.github.mandar2812.cdfio;

import java.nio.ByteOrder;

/**
 * Enumeration of numeric encoding values supported by CDF.
 *
 * @since    20 Jun 2013
 */
public enum NumericEncoding {

    NETWORK( 1, Boolean.TRUE ),
    SUN( 2, Boolean.TRUE ),
    VAX( 3, null ),
    DECSTATION( 4, Boolean.FALSE ),
    SGi( 5, Boolean.TRUE ),
    IBMPC( 6, Boolean.FALSE ),
    IBMRS( 7, Boolean.TRUE ),
    HOST( 8, null ),
    PPC( 9, Boolean.TRUE ),
    HP( 11, Boolean.TRUE ),
    NeXT( 12, Boolean.TRUE ),
    ALPHAOSF1( 13, Boolean.FALSE ),
    ALPHAVMSd( 14, null ),
    ALPHAVMSg( 15, null ),
    ALPHAVMSi( 16, Boolean.FALSE ),
    ARM_LITTLE( 17, Boolean.FALSE ),
    ARM_BIG( 18, Boolean.TRUE );

    private final int code_;
    private final Boolean isBigendian_;

    /**
     * Constructor.
     *
     * @param  code   value of the CDR encoding field
     * @param  isBigendian  TRUE for simple big-endian,
     *                      FALSE for simple little-endian,
     *                      null for something else
     */
    NumericEncoding( int code, Boolean isBigendian ) {
        code_ = code;
        isBigendian_ = isBigendian;
    }

    /**
     * Returns the value stored in the CDR encoding field.
     *
     * @return  encoding code
     */
    public int getCode() {
        return code_;
    }

    /**
     * Gives the big/little-endianness of this encoding, if that's all
     * the work that has to be done.
     * A null value means either a non-IEEE floating point representation
     * (the VAX family) or, for HOST, that the platform decides.
     *
     * @return  TRUE for simple big-endian, FALSE for simple little-endian,
     *          null for something weird
     */
    public Boolean isBigendian() {
        return isBigendian_;
    }

    /**
     * Returns the byte order used for data values in this encoding.
     *
     * @return  byte order
     * @throws  CdfFormatException  for the VAX floating point encodings
     */
    public ByteOrder getByteOrder() throws CdfFormatException {
        if ( this == HOST ) {
            return ByteOrder.nativeOrder();
        }
        else if ( isBigendian_ == null ) {
            throw new CdfFormatException( "Unsupported encoding " + this );
        }
        else {
            return isBigendian_.booleanValue() ? ByteOrder.BIG_ENDIAN
                                               : ByteOrder.LITTLE_ENDIAN;
        }
    }

    /**
     * Returns the concrete encoding that this one stands for when
     * writing a file.  HOST resolves to the runtime platform's order.
     *
     * @return  concrete encoding
     */
    public NumericEncoding resolve() {
        if ( this == HOST ) {
            return ByteOrder.nativeOrder() == ByteOrder.BIG_ENDIAN ? NETWORK
                                                                   : IBMPC;
        }
        return this;
    }

    /**
     * Returns the encoding corresponding to the value of the
     * <code>encoding</code> field of the CDF Descriptor Record.
     *
     * @param  code  encoding code
     * @return  encoding object
     * @throws  CdfFormatException  if code is unknown
     */
    public static NumericEncoding getEncoding( int code )
            throws CdfFormatException {
        for ( NumericEncoding enc : values() ) {
            if ( enc.code_ == code ) {
                return enc;
            }
        }
        throw new CdfFormatException( "Unknown numeric encoding " + code );
    }

    /**
     * Returns the encoding with a given name, case-insensitively,
     * with or without an "_ENCODING" suffix.
     *
     * @param  name  encoding name, for instance "IBMPC" or "ibmpc_encoding"
     * @return  encoding
     * @throws  CdfUsageException  if there is no such encoding
     */
    public static NumericEncoding forName( String name ) {
        String txt = name.trim();
        if ( txt.toUpperCase().endsWith( "_ENCODING" ) ) {
            txt = txt.substring( 0, txt.length() - "_ENCODING".length() );
        }
        for ( NumericEncoding enc : values() ) {
            if ( enc.name().equalsIgnoreCase( txt ) ) {
                return enc;
            }
        }
        throw new CdfUsageException( "Unknown encoding " + name );
    }
}
