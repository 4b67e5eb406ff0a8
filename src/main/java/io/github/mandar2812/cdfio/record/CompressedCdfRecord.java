package io.github.mandar2812.cdfio.record;

/**
 * Field data for CDF record of type Compressed CDF Record,
 * which wraps the whole body of a compressed file.
 *
 * @since    19 Jun 2013
 */
public class CompressedCdfRecord extends Record {

    public final long cprOffset;
    public final long uSize;
    public final long dataOffset;
    public final long dataLength;

    /**
     * Constructor.
     *
     * @param  plan   basic record information
     * @param  cprOffset  offset of the compression parameters record
     * @param  uSize   uncompressed size of the file body
     * @param  dataOffset  offset of the compressed bytes
     * @param  dataLength  number of compressed bytes
     */
    public CompressedCdfRecord( RecordPlan plan, long cprOffset, long uSize,
                                long dataOffset, long dataLength ) {
        super( plan, "CCR" );
        this.cprOffset = cprOffset;
        this.uSize = uSize;
        this.dataOffset = dataOffset;
        this.dataLength = dataLength;
    }
}
