package io.github.mandar2812.cdfio.record;

import io.github.mandar2812.cdfio.Buf;
import io.github.mandar2812.cdfio.CdfFormatException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Record decoder for CDF version 2 files.
 * Offsets and sizes are 4-byte fields and names are 64 bytes.
 * VDRs written by libraries older than 2.5 carry 128 reserved bytes
 * before the element count, and their CDR copyright is 1945 bytes.
 *
 * @since    19 Jun 2013
 */
public class V2RecordDecoder implements RecordDecoder {

    private static final int HEADER_SIZE = 8;
    private static final int NAME_LENG = 64;
    private final Charset charset_;
    private static final Logger logger_ =
        Logger.getLogger( V2RecordDecoder.class.getName() );

    /**
     * Constructor.
     *
     * @param  charset  text encoding for names
     */
    public V2RecordDecoder( Charset charset ) {
        charset_ = charset;
    }

    public int getVersion() {
        return 2;
    }

    public RecordPlan readPlan( Buf buf, long offset ) throws IOException {
        Pointer ptr = new Pointer( offset );
        long recSize = buf.readInt( ptr ) & 0xffffffffL;
        int recType = buf.readInt( ptr );
        if ( recSize < HEADER_SIZE || offset + recSize > buf.getLength() ) {
            throw new CdfFormatException( "Bad record size " + recSize
                                        + " at 0x"
                                        + Long.toHexString( offset ) );
        }
        if ( logger_.isLoggable( Level.FINE ) ) {
            logger_.fine( "CDF Record:\t0x" + Long.toHexString( offset )
                        + "\t+" + recSize + "\ttype " + recType );
        }
        return new RecordPlan( offset, recSize, recType, HEADER_SIZE, buf );
    }

    public CdfDescriptorRecord readCdr( Buf buf, long offset )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, CDR, CDR );
        Pointer ptr = plan.createContentPointer();
        long gdrOffset = readOffset( buf, ptr );
        int version = buf.readInt( ptr );
        int release = buf.readInt( ptr );
        int encoding = buf.readInt( ptr );
        int flags = buf.readInt( ptr );
        ptr.skip( 8 );
        int increment = buf.readInt( ptr );
        ptr.skip( 8 );
        int crLeng = isPost25( version, release ) ? 256 : 1945;
        String copyright = buf.readString( ptr, crLeng, charset_ );
        return new CdfDescriptorRecord( plan, gdrOffset, version, release,
                                        encoding, flags, increment,
                                        copyright );
    }

    public GlobalDescriptorRecord readGdr( Buf buf, long offset )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, GDR, GDR );
        Pointer ptr = plan.createContentPointer();
        long rVdrHead = readOffset( buf, ptr );
        long zVdrHead = readOffset( buf, ptr );
        long adrHead = readOffset( buf, ptr );
        long eof = readOffset( buf, ptr );
        int nrVars = buf.readInt( ptr );
        int numAttr = buf.readInt( ptr );
        int rMaxRec = buf.readInt( ptr );
        int rNumDims = buf.readInt( ptr );
        int nzVars = buf.readInt( ptr );
        ptr.skip( 4 + 4 + 4 + 4 );
        int[] rDimSizes = Record.readIntArray( buf, ptr, rNumDims );
        return new GlobalDescriptorRecord( plan, rVdrHead, zVdrHead, adrHead,
                                           eof, nrVars, numAttr, rMaxRec,
                                           rNumDims, nzVars, -1, rDimSizes );
    }

    public AttributeDescriptorRecord readAdr( Buf buf, long offset )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, ADR, ADR );
        Pointer ptr = plan.createContentPointer();
        long adrNext = readOffset( buf, ptr );
        long agrEdrHead = readOffset( buf, ptr );
        int scope = buf.readInt( ptr );
        int num = buf.readInt( ptr );
        int ngrEntries = buf.readInt( ptr );
        int maxGrEntry = buf.readInt( ptr );
        ptr.skip( 4 );
        long azEdrHead = readOffset( buf, ptr );
        int nzEntries = buf.readInt( ptr );
        int maxZEntry = buf.readInt( ptr );
        ptr.skip( 4 );
        String name = buf.readString( ptr, NAME_LENG, charset_ );
        return new AttributeDescriptorRecord( plan, adrNext, agrEdrHead,
                                              scope, num, ngrEntries,
                                              maxGrEntry, azEdrHead,
                                              nzEntries, maxZEntry, name );
    }

    public AttributeEntryDescriptorRecord readAedr( Buf buf, long offset )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, AGREDR, AZEDR );
        Pointer ptr = plan.createContentPointer();
        long aedrNext = readOffset( buf, ptr );
        int attrNum = buf.readInt( ptr );
        int dataType = buf.readInt( ptr );
        int num = buf.readInt( ptr );
        int numElems = buf.readInt( ptr );
        ptr.skip( 20 );
        return new AttributeEntryDescriptorRecord( plan, aedrNext, attrNum,
                                                   dataType, num, numElems, 1,
                                                   ptr.get() );
    }

    public VariableDescriptorRecord readVdr( Buf buf, long offset,
                                             CdfDescriptorRecord cdr,
                                             GlobalDescriptorRecord gdr )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, RVDR, ZVDR );
        Pointer ptr = plan.createContentPointer();
        long vdrNext = readOffset( buf, ptr );
        int dataType = buf.readInt( ptr );
        int maxRec = buf.readInt( ptr );
        long vxrHead = readOffset( buf, ptr );
        long vxrTail = readOffset( buf, ptr );
        int flags = buf.readInt( ptr );
        int sRecords = buf.readInt( ptr );
        ptr.skip( 12 );
        ptr.skip( reservedVdrBytes( cdr ) );
        int numElems = buf.readInt( ptr );
        int num = buf.readInt( ptr );
        long cprOrSprOffset = readOffset( buf, ptr );
        int blockingFactor = buf.readInt( ptr );
        String name = buf.readString( ptr, NAME_LENG, charset_ );
        int[] dimSizes;
        if ( plan.getRecordType() == ZVDR ) {
            int numDims = buf.readInt( ptr );
            dimSizes = Record.readIntArray( buf, ptr, numDims );
        }
        else {
            dimSizes = gdr.rDimSizes.clone();
        }
        int[] varyFlags = Record.readIntArray( buf, ptr, dimSizes.length );
        boolean[] dimVarys = new boolean[ dimSizes.length ];
        for ( int i = 0; i < dimSizes.length; i++ ) {
            dimVarys[ i ] = varyFlags[ i ] != 0;
        }
        long padOffset = Record.hasBit( flags, 1 ) ? ptr.get() : -1;
        return new VariableDescriptorRecord( plan, vdrNext, dataType, maxRec,
                                             vxrHead, vxrTail, flags,
                                             sRecords, numElems, num,
                                             cprOrSprOffset, blockingFactor,
                                             name, dimSizes, dimVarys,
                                             padOffset );
    }

    public VariableIndexRecord readVxr( Buf buf, long offset )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, VXR, VXR );
        Pointer ptr = plan.createContentPointer();
        long vxrNext = readOffset( buf, ptr );
        int nEntries = buf.readInt( ptr );
        int nUsedEntries = buf.readInt( ptr );
        int[] first = Record.readIntArray( buf, ptr, nEntries );
        int[] last = Record.readIntArray( buf, ptr, nEntries );
        long[] offsets = new long[ nEntries ];
        for ( int i = 0; i < nEntries; i++ ) {
            offsets[ i ] = readOffset( buf, ptr );
        }
        return new VariableIndexRecord( plan, vxrNext, nEntries, nUsedEntries,
                                        first, last, offsets );
    }

    public CompressedCdfRecord readCcr( Buf buf, long offset )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, CCR, CCR );
        Pointer ptr = plan.createContentPointer();
        long cprOffset = readOffset( buf, ptr );
        long uSize = readOffset( buf, ptr );
        ptr.skip( 4 );
        long dataOffset = ptr.get();
        return new CompressedCdfRecord( plan, cprOffset, uSize, dataOffset,
                                        offset + plan.getRecordSize()
                                               - dataOffset );
    }

    public CompressedParametersRecord readCpr( Buf buf, long offset )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, CPR, CPR );
        Pointer ptr = plan.createContentPointer();
        int cType = buf.readInt( ptr );
        ptr.skip( 4 );
        int pCount = buf.readInt( ptr );
        int[] cParms = Record.readIntArray( buf, ptr, pCount );
        return new CompressedParametersRecord( plan, cType, cParms );
    }

    public byte[] readValuesBlock( Buf buf, long offset,
                                   Compression compression )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, VVR, CVVR );
        Pointer ptr = plan.createContentPointer();
        if ( plan.getRecordType() == VVR ) {
            int leng = (int) ( plan.getRecordSize() - HEADER_SIZE );
            byte[] data = new byte[ leng ];
            buf.readBytes( ptr.get(), leng, data );
            return data;
        }
        else {
            ptr.skip( 4 );
            long cSize = readOffset( buf, ptr );
            try ( InputStream in =
                      compression.uncompressStream(
                          buf.createInputStream( ptr.get(), cSize ) ) ) {
                return in.readAllBytes();
            }
        }
    }

    public long readAdrNext( Buf buf, long offset ) throws IOException {
        return readOffset( buf, new Pointer( offset + 8 ) );
    }

    public String readAdrName( Buf buf, long offset ) throws IOException {
        return buf.readString( new Pointer( offset + 52 ), NAME_LENG,
                               charset_ );
    }

    public long readAedrNext( Buf buf, long offset ) throws IOException {
        return readOffset( buf, new Pointer( offset + 8 ) );
    }

    public int readAedrEntryNum( Buf buf, long offset ) throws IOException {
        return buf.readInt( new Pointer( offset + 20 ) );
    }

    public long readVdrNext( Buf buf, long offset ) throws IOException {
        return readOffset( buf, new Pointer( offset + 8 ) );
    }

    public String readVdrName( Buf buf, long offset,
                               CdfDescriptorRecord cdr ) throws IOException {
        return buf.readString( new Pointer( offset + 64
                                            + reservedVdrBytes( cdr ) ),
                               NAME_LENG, charset_ );
    }

    /**
     * Reads a 4-byte file offset.
     *
     * @param  buf  buffer
     * @param  ptr  pointer
     * @return  offset value
     */
    private static long readOffset( Buf buf, Pointer ptr )
            throws IOException {
        return buf.readInt( ptr );
    }

    /**
     * Returns the number of reserved bytes that pre-2.5 VDRs carry.
     *
     * @param  cdr  CDR
     * @return  0 or 128
     */
    private static int reservedVdrBytes( CdfDescriptorRecord cdr ) {
        return isPost25( cdr.version, cdr.release ) ? 0 : 128;
    }

    /**
     * Indicates whether a version/release is 2.5 or later.
     *
     * @param  version  version
     * @param  release  release
     * @return  true iff at least 2.5
     */
    private static boolean isPost25( int version, int release ) {
        return version > 2 || version == 2 && release >= 5;
    }

    private RecordPlan readTypedPlan( Buf buf, long offset, int type1,
                                      int type2 ) throws IOException {
        RecordPlan plan = readPlan( buf, offset );
        int type = plan.getRecordType();
        if ( type != type1 && type != type2 ) {
            throw new CdfFormatException( "Unexpected record type " + type
                                        + " at 0x"
                                        + Long.toHexString( offset )
                                        + " (expected " + type1 + ")" );
        }
        return plan;
    }
}
