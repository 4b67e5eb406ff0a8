package io.github.mandar2812.cdfio.record;

import io.github.mandar2812.cdfio.Buf;

/**
 * Records basic information about the position, extent and type of
 * a CDF record.
 *
 * @since    18 Jun 2013
 */
public class RecordPlan {

    private final long start_;
    private final long recSize_;
    private final int recType_;
    private final int headerSize_;
    private final Buf buf_;

    /**
     * Constructor.
     *
     * @param   start   offset into buffer of record start
     * @param   recSize  number of bytes comprising record
     * @param   recType  integer record type field
     * @param   headerSize  number of bytes taken by the RecordSize
     *                      and RecordType fields
     * @param   buf     buffer containing record bytes
     */
    public RecordPlan( long start, long recSize, int recType, int headerSize,
                       Buf buf ) {
        start_ = start;
        recSize_ = recSize;
        recType_ = recType;
        headerSize_ = headerSize;
        buf_ = buf;
    }

    /**
     * Returns the file offset of the start of the record.
     *
     * @return  record offset
     */
    public long getStart() {
        return start_;
    }

    /**
     * Returns the size of the record in bytes.
     *
     * @return  record size
     */
    public long getRecordSize() {
        return recSize_;
    }

    /**
     * Returns the type code identifying what kind of CDF record it is.
     *
     * @return   record type
     */
    public int getRecordType() {
        return recType_;
    }

    /**
     * Returns the buffer containing the record data.
     *
     * @return  buffer
     */
    public Buf getBuf() {
        return buf_;
    }

    /**
     * Returns a pointer initially pointing at the first content byte of
     * the record represented by this plan.
     * This is the first item after the RecordSize and RecordType items
     * that always appear first in a CDF record.
     *
     * @return  pointer pointing at the start of the record-type-specific
     *          content
     */
    public Pointer createContentPointer() {
        return new Pointer( start_ + headerSize_ );
    }

    /**
     * Returns a pointer at a fixed position relative to the record start.
     *
     * @param  offset  offset from the start of the record
     * @return  new pointer
     */
    public Pointer createPointer( int offset ) {
        return new Pointer( start_ + offset );
    }
}
