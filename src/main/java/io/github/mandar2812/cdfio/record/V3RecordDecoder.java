package io.github.mandar2812.cdfio.record;

import io.github.mandar2812.cdfio.Buf;
import io.github.mandar2812.cdfio.CdfFormatException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Record decoder for CDF version 3 files.
 * Offsets and sizes are 8-byte fields; name fields are 256 bytes.
 *
 * @since    19 Jun 2013
 */
public class V3RecordDecoder implements RecordDecoder {

    private static final int HEADER_SIZE = 12;
    private static final int NAME_LENG = 256;
    private static final int COPYRIGHT_LENG = 256;
    private final Charset charset_;
    private static final Logger logger_ =
        Logger.getLogger( V3RecordDecoder.class.getName() );

    /**
     * Constructor.
     *
     * @param  charset  text encoding for names
     */
    public V3RecordDecoder( Charset charset ) {
        charset_ = charset;
    }

    public int getVersion() {
        return 3;
    }

    public RecordPlan readPlan( Buf buf, long offset ) throws IOException {
        Pointer ptr = new Pointer( offset );
        long recSize = buf.readLong( ptr );
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
        long gdrOffset = buf.readLong( ptr );
        int version = buf.readInt( ptr );
        int release = buf.readInt( ptr );
        int encoding = buf.readInt( ptr );
        int flags = buf.readInt( ptr );
        ptr.skip( 8 );
        int increment = buf.readInt( ptr );
        ptr.skip( 8 );
        String copyright = buf.readString( ptr, COPYRIGHT_LENG, charset_ );
        return new CdfDescriptorRecord( plan, gdrOffset, version, release,
                                        encoding, flags, increment,
                                        copyright );
    }

    public GlobalDescriptorRecord readGdr( Buf buf, long offset )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, GDR, GDR );
        Pointer ptr = plan.createContentPointer();
        long rVdrHead = buf.readLong( ptr );
        long zVdrHead = buf.readLong( ptr );
        long adrHead = buf.readLong( ptr );
        long eof = buf.readLong( ptr );
        int nrVars = buf.readInt( ptr );
        int numAttr = buf.readInt( ptr );
        int rMaxRec = buf.readInt( ptr );
        int rNumDims = buf.readInt( ptr );
        int nzVars = buf.readInt( ptr );
        ptr.skip( 8 + 4 );
        int leapSecondLastUpdated = buf.readInt( ptr );
        ptr.skip( 4 );
        int[] rDimSizes = Record.readIntArray( buf, ptr, rNumDims );
        return new GlobalDescriptorRecord( plan, rVdrHead, zVdrHead, adrHead,
                                           eof, nrVars, numAttr, rMaxRec,
                                           rNumDims, nzVars,
                                           leapSecondLastUpdated,
                                           rDimSizes );
    }

    public AttributeDescriptorRecord readAdr( Buf buf, long offset )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, ADR, ADR );
        Pointer ptr = plan.createContentPointer();
        long adrNext = buf.readLong( ptr );
        long agrEdrHead = buf.readLong( ptr );
        int scope = buf.readInt( ptr );
        int num = buf.readInt( ptr );
        int ngrEntries = buf.readInt( ptr );
        int maxGrEntry = buf.readInt( ptr );
        ptr.skip( 4 );
        long azEdrHead = buf.readLong( ptr );
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
        long aedrNext = buf.readLong( ptr );
        int attrNum = buf.readInt( ptr );
        int dataType = buf.readInt( ptr );
        int num = buf.readInt( ptr );
        int numElems = buf.readInt( ptr );
        int numStrings = Math.max( 1, buf.readInt( ptr ) );
        ptr.skip( 16 );
        return new AttributeEntryDescriptorRecord( plan, aedrNext, attrNum,
                                                   dataType, num, numElems,
                                                   numStrings, ptr.get() );
    }

    public VariableDescriptorRecord readVdr( Buf buf, long offset,
                                             CdfDescriptorRecord cdr,
                                             GlobalDescriptorRecord gdr )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, RVDR, ZVDR );
        Pointer ptr = plan.createContentPointer();
        long vdrNext = buf.readLong( ptr );
        int dataType = buf.readInt( ptr );
        int maxRec = buf.readInt( ptr );
        long vxrHead = buf.readLong( ptr );
        long vxrTail = buf.readLong( ptr );
        int flags = buf.readInt( ptr );
        int sRecords = buf.readInt( ptr );
        ptr.skip( 12 );
        int numElems = buf.readInt( ptr );
        int num = buf.readInt( ptr );
        long cprOrSprOffset = buf.readLong( ptr );
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
        long vxrNext = buf.readLong( ptr );
        int nEntries = buf.readInt( ptr );
        int nUsedEntries = buf.readInt( ptr );
        int[] first = Record.readIntArray( buf, ptr, nEntries );
        int[] last = Record.readIntArray( buf, ptr, nEntries );
        long[] offsets = Record.readLongArray( buf, ptr, nEntries );
        return new VariableIndexRecord( plan, vxrNext, nEntries, nUsedEntries,
                                        first, last, offsets );
    }

    public CompressedCdfRecord readCcr( Buf buf, long offset )
            throws IOException {
        RecordPlan plan = readTypedPlan( buf, offset, CCR, CCR );
        Pointer ptr = plan.createContentPointer();
        long cprOffset = buf.readLong( ptr );
        long uSize = buf.readLong( ptr );
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
            long cSize = buf.readLong( ptr );
            try ( InputStream in =
                      compression.uncompressStream(
                          buf.createInputStream( ptr.get(), cSize ) ) ) {
                return in.readAllBytes();
            }
        }
    }

    public long readAdrNext( Buf buf, long offset ) throws IOException {
        return buf.readLong( new Pointer( offset + 12 ) );
    }

    public String readAdrName( Buf buf, long offset ) throws IOException {
        return buf.readString( new Pointer( offset + 68 ), NAME_LENG,
                               charset_ );
    }

    public long readAedrNext( Buf buf, long offset ) throws IOException {
        return buf.readLong( new Pointer( offset + 12 ) );
    }

    public int readAedrEntryNum( Buf buf, long offset ) throws IOException {
        return buf.readInt( new Pointer( offset + 28 ) );
    }

    public long readVdrNext( Buf buf, long offset ) throws IOException {
        return buf.readLong( new Pointer( offset + 12 ) );
    }

    public String readVdrName( Buf buf, long offset,
                               CdfDescriptorRecord cdr ) throws IOException {
        return buf.readString( new Pointer( offset + 84 ), NAME_LENG,
                               charset_ );
    }

    /**
     * Reads a record plan and checks its type.
     *
     * @param  buf  buffer
     * @param  offset  record start
     * @param  type1  acceptable type
     * @param  type2  other acceptable type
     * @return  plan
     */
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
