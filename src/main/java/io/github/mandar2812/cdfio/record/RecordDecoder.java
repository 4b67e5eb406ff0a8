package io.github.mandar2812.cdfio.record;

import io.github.mandar2812.cdfio.Buf;
import java.io.IOException;

/**
 * Decodes the internal records of a CDF file from their byte offsets.
 * The v2 and v3 formats differ in field widths and positions,
 * so each has its own implementation; the reader picks one when it
 * reads the magic number and uses it for the file's lifetime.
 *
 * <p>The <code>read*Next</code>, <code>read*Name</code> and
 * <code>readAedrEntryNum</code> methods pick single fields out of a
 * record without decoding the rest, for walking linked lists.
 *
 * @since    19 Jun 2013
 */
public interface RecordDecoder {

    /** Record type code for CDF Descriptor Record. */
    int CDR = 1;
    /** Record type code for Global Descriptor Record. */
    int GDR = 2;
    /** Record type code for rVariable Descriptor Record. */
    int RVDR = 3;
    /** Record type code for Attribute Descriptor Record. */
    int ADR = 4;
    /** Record type code for global/rVariable Attribute Entry. */
    int AGREDR = 5;
    /** Record type code for Variable Index Record. */
    int VXR = 6;
    /** Record type code for Variable Values Record. */
    int VVR = 7;
    /** Record type code for zVariable Descriptor Record. */
    int ZVDR = 8;
    /** Record type code for zVariable Attribute Entry. */
    int AZEDR = 9;
    /** Record type code for Compressed CDF Record. */
    int CCR = 10;
    /** Record type code for Compressed Parameters Record. */
    int CPR = 11;
    /** Record type code for Sparseness Parameters Record. */
    int SPR = 12;
    /** Record type code for Compressed Variable Values Record. */
    int CVVR = 13;

    /**
     * Returns the major format version this decoder handles.
     *
     * @return  2 or 3
     */
    int getVersion();

    /**
     * Reads the size and type fields of the record at a given offset.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @return  record plan
     */
    RecordPlan readPlan( Buf buf, long offset ) throws IOException;

    /**
     * Reads a CDF Descriptor Record.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @return  CDR
     */
    CdfDescriptorRecord readCdr( Buf buf, long offset ) throws IOException;

    /**
     * Reads a Global Descriptor Record.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @return  GDR
     */
    GlobalDescriptorRecord readGdr( Buf buf, long offset ) throws IOException;

    /**
     * Reads an Attribute Descriptor Record.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @return  ADR
     */
    AttributeDescriptorRecord readAdr( Buf buf, long offset )
            throws IOException;

    /**
     * Reads an Attribute Entry Descriptor Record of either kind.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @return  AEDR
     */
    AttributeEntryDescriptorRecord readAedr( Buf buf, long offset )
            throws IOException;

    /**
     * Reads a Variable Descriptor Record of either kind.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @param  cdr   the file's CDR
     * @param  gdr   the file's GDR, supplying rVariable dimensions
     * @return  VDR
     */
    VariableDescriptorRecord readVdr( Buf buf, long offset,
                                      CdfDescriptorRecord cdr,
                                      GlobalDescriptorRecord gdr )
            throws IOException;

    /**
     * Reads a Variable Index Record.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @return  VXR
     */
    VariableIndexRecord readVxr( Buf buf, long offset ) throws IOException;

    /**
     * Reads a Compressed CDF Record.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @return  CCR
     */
    CompressedCdfRecord readCcr( Buf buf, long offset ) throws IOException;

    /**
     * Reads a Compressed Parameters Record.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @return  CPR
     */
    CompressedParametersRecord readCpr( Buf buf, long offset )
            throws IOException;

    /**
     * Reads the uncompressed value bytes from a VVR or CVVR.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @param  compression  compression used for CVVRs
     * @return  raw record data for the block
     */
    byte[] readValuesBlock( Buf buf, long offset, Compression compression )
            throws IOException;

    /**
     * Reads the next-ADR field of an ADR.
     *
     * @param  buf  buffer
     * @param  offset  ADR start
     * @return  offset of next ADR, or 0
     */
    long readAdrNext( Buf buf, long offset ) throws IOException;

    /**
     * Reads the name field of an ADR.
     *
     * @param  buf  buffer
     * @param  offset  ADR start
     * @return  attribute name
     */
    String readAdrName( Buf buf, long offset ) throws IOException;

    /**
     * Reads the next-AEDR field of an AEDR.
     *
     * @param  buf  buffer
     * @param  offset  AEDR start
     * @return  offset of next AEDR, or 0
     */
    long readAedrNext( Buf buf, long offset ) throws IOException;

    /**
     * Reads the entry number field of an AEDR.
     *
     * @param  buf  buffer
     * @param  offset  AEDR start
     * @return  entry number
     */
    int readAedrEntryNum( Buf buf, long offset ) throws IOException;

    /**
     * Reads the next-VDR field of a VDR.
     *
     * @param  buf  buffer
     * @param  offset  VDR start
     * @return  offset of next VDR, or 0
     */
    long readVdrNext( Buf buf, long offset ) throws IOException;

    /**
     * Reads the name field of a VDR.
     *
     * @param  buf  buffer
     * @param  offset  VDR start
     * @param  cdr   the file's CDR
     * @return  variable name
     */
    String readVdrName( Buf buf, long offset, CdfDescriptorRecord cdr )
            throws IOException;
}
