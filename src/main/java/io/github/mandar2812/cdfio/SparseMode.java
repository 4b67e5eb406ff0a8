package io.github.mandar2812.cdfio;

/**
 * Sparse record policies, saying what value a record takes
 * when no data has been written for it.
 *
 * @since    1 Jul 2013
 */
public enum SparseMode {

    /** Records are not sparse. */
    NO_SPARSE( 0, "No_sparse" ),

    /** Missing records take the variable's pad value. */
    PAD_SPARSE( 1, "Pad_sparse" ),

    /** Missing records repeat the nearest preceding written record. */
    PREV_SPARSE( 2, "Prev_sparse" );

    private final int code_;
    private final String token_;

    SparseMode( int code, String token ) {
        code_ = code;
        token_ = token;
    }

    /**
     * Returns the value of the VDR sRecords field for this mode.
     *
     * @return  sRecords code
     */
    public int getCode() {
        return code_;
    }

    /**
     * Returns the conventional label.
     *
     * @return  token, for instance "Pad_sparse"
     */
    public String getToken() {
        return token_;
    }

    /**
     * Returns the mode for a VDR sRecords value.
     *
     * @param  code  sRecords field value
     * @return  sparse mode
     * @throws  CdfFormatException  for unknown codes
     */
    public static SparseMode getSparseMode( int code )
            throws CdfFormatException {
        for ( SparseMode mode : values() ) {
            if ( mode.code_ == code ) {
                return mode;
            }
        }
        throw new CdfFormatException( "Unknown sparse records code "
                                    + code );
    }

    /**
     * Returns the mode with a given name or token, case-insensitively.
     *
     * @param  name  for instance "pad_sparse" or "PAD_SPARSE"
     * @return  sparse mode
     * @throws  CdfUsageException  if there is no such mode
     */
    public static SparseMode forName( String name ) {
        for ( SparseMode mode : values() ) {
            if ( mode.token_.equalsIgnoreCase( name.trim() ) ) {
                return mode;
            }
        }
        throw new CdfUsageException( "Unknown sparse mode " + name );
    }
}
