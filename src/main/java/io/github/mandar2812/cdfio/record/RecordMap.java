package io.github.mandar2812.cdfio.record;

import io.github.mandar2812.cdfio.Buf;
import io.github.mandar2812.cdfio.CdfFormatException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Keeps track of where a variable's record data blocks are.
 * Each entry is a VVR or CVVR covering a contiguous run of records;
 * records not covered by any entry are virtual (sparse).
 *
 * <p>The most recently decoded block is cached, since consecutive
 * record lookups usually fall in the same block.
 *
 * @since    21 Jun 2013
 */
public class RecordMap {

    private final Buf buf_;
    private final RecordDecoder decoder_;
    private final Compression compression_;
    private final int nent_;
    private final int[] firsts_;
    private final int[] lasts_;
    private final long[] offsets_;
    private int cachedEntry_;
    private byte[] cachedData_;

    private static final Logger logger_ =
        Logger.getLogger( RecordMap.class.getName() );

    /**
     * Constructor.
     *
     * @param  buf  file buffer
     * @param  decoder  record decoder
     * @param  compression  compression for CVVR blocks
     * @param  entries   block entries, in any order
     */
    private RecordMap( Buf buf, RecordDecoder decoder,
                       Compression compression, Entry[] entries ) {
        buf_ = buf;
        decoder_ = decoder;
        compression_ = compression;

        // Sort entries into order of record data.
        Arrays.sort( entries );
        nent_ = entries.length;
        firsts_ = new int[ nent_ ];
        lasts_ = new int[ nent_ ];
        offsets_ = new long[ nent_ ];
        for ( int ie = 0; ie < nent_; ie++ ) {
            Entry entry = entries[ ie ];
            firsts_[ ie ] = entry.first_;
            lasts_[ ie ] = entry.last_;
            offsets_[ ie ] = entry.offset_;
        }
        cachedEntry_ = -1;
    }

    /**
     * Returns the number of physical blocks.
     *
     * @return  entry count
     */
    public int getEntryCount() {
        return nent_;
    }

    /**
     * Returns the first record of an entry.
     *
     * @param  ient  entry index
     * @return  first record number
     */
    public int getFirst( int ient ) {
        return firsts_[ ient ];
    }

    /**
     * Returns the last record of an entry.
     *
     * @param  ient  entry index
     * @return  last record number
     */
    public int getLast( int ient ) {
        return lasts_[ ient ];
    }

    /**
     * Returns the file offset of an entry's VVR or CVVR.
     *
     * @param  ient  entry index
     * @return  record offset
     */
    public long getOffset( int ient ) {
        return offsets_[ ient ];
    }

    /**
     * Returns the index of the entry containing a given record.
     *
     * @param  irec  record number
     * @return  entry index, or -1 if the record is virtual
     */
    public int findEntry( int irec ) {
        if ( cachedEntry_ >= 0 && irec >= firsts_[ cachedEntry_ ]
                               && irec <= lasts_[ cachedEntry_ ] ) {
            return cachedEntry_;
        }
        int ient = findPrecedingOrContaining( irec );
        return ient >= 0 && lasts_[ ient ] >= irec ? ient : -1;
    }

    /**
     * Returns the index of the last entry that ends before a given record.
     *
     * @param  irec  record number
     * @return  entry index, or -1 if there is none
     */
    public int findPrecedingEntry( int irec ) {
        int ient = findPrecedingOrContaining( irec );
        if ( ient >= 0 && lasts_[ ient ] >= irec ) {
            ient--;
        }
        return ient;
    }

    /**
     * Returns the first record of the first entry that starts after
     * a given record.
     *
     * @param  irec  record number
     * @return  first record of next entry, or Integer.MAX_VALUE if none
     */
    public int getNextFirst( int irec ) {
        int ient = findPrecedingOrContaining( irec ) + 1;
        return ient < nent_ ? firsts_[ ient ] : Integer.MAX_VALUE;
    }

    /**
     * Returns the uncompressed bytes of an entry's block.
     *
     * @param  ient  entry index
     * @param  recSize  bytes per record
     * @return  block data, at least as long as the records it covers
     */
    public byte[] getBlockData( int ient, int recSize ) throws IOException {
        if ( ient != cachedEntry_ ) {
            byte[] data = decoder_.readValuesBlock( buf_, offsets_[ ient ],
                                                    compression_ );
            long need = (long) ( lasts_[ ient ] - firsts_[ ient ] + 1 )
                      * recSize;
            if ( data.length < need ) {
                throw new CdfFormatException( "Values block at 0x"
                                            + Long.toHexString( offsets_
                                                                [ ient ] )
                                            + " has " + data.length
                                            + " bytes, need " + need );
            }
            cachedData_ = data;
            cachedEntry_ = ient;
        }
        return cachedData_;
    }

    /**
     * Binary search for the last entry whose first record is not after
     * the given record.
     *
     * @param  irec  record number
     * @return  entry index, or -1 if irec precedes all entries
     */
    private int findPrecedingOrContaining( int irec ) {
        int pos = Arrays.binarySearch( firsts_, irec );
        return pos >= 0 ? pos : -pos - 2;
    }

    /**
     * Returns a record map for a given variable.
     *
     * @param  buf  file buffer
     * @param  decoder  record decoder
     * @param  vdr  variable descriptor record
     * @return  record map
     */
    public static RecordMap createRecordMap( Buf buf, RecordDecoder decoder,
                                             VariableDescriptorRecord vdr )
            throws IOException {
        Compression compression = getCompression( buf, decoder, vdr );
        List<Entry> entryList = new ArrayList<Entry>();
        for ( long vxrOffset = vdr.vxrHead; vxrOffset != 0; ) {
            VariableIndexRecord vxr = decoder.readVxr( buf, vxrOffset );
            readEntries( buf, decoder, vxr, entryList );
            vxrOffset = vxr.vxrNext;
        }
        if ( logger_.isLoggable( Level.FINE ) ) {
            logger_.fine( "Variable " + vdr.name + ": " + entryList.size()
                        + " value blocks, compression " + compression );
        }
        return new RecordMap( buf, decoder, compression,
                              entryList.toArray( new Entry[ 0 ] ) );
    }

    /**
     * Returns the compression type for a given variable.
     *
     * @param  buf  file buffer
     * @param  decoder  record decoder
     * @param  vdr  variable descriptor record
     * @return  compression type, not null but may be NONE
     */
    public static Compression getCompression( Buf buf, RecordDecoder decoder,
                                              VariableDescriptorRecord vdr )
            throws IOException {
        if ( vdr.isCompressed() && vdr.cprOrSprOffset > 0 ) {
            CompressedParametersRecord cpr =
                decoder.readCpr( buf, vdr.cprOrSprOffset );
            return Compression.getCompression( cpr.cType );
        }
        else {
            return Compression.NONE;
        }
    }

    /**
     * Reads the entries of a VXR into a list, descending into
     * any entries that point at subordinate VXRs.
     *
     * @param  buf  file buffer
     * @param  decoder  record decoder
     * @param  vxr  index record
     * @param  list  list to which entries are added
     */
    private static void readEntries( Buf buf, RecordDecoder decoder,
                                     VariableIndexRecord vxr,
                                     List<Entry> list ) throws IOException {
        for ( int ie = 0; ie < vxr.nUsedEntries; ie++ ) {
            long offset = vxr.offset[ ie ];
            int type = decoder.readPlan( buf, offset ).getRecordType();
            if ( type == RecordDecoder.VXR ) {

                // A subordinate VXR may itself head a chain of siblings.
                for ( long subOff = offset; subOff != 0; ) {
                    VariableIndexRecord subVxr =
                        decoder.readVxr( buf, subOff );
                    readEntries( buf, decoder, subVxr, list );
                    subOff = subVxr.vxrNext;
                }
            }
            else if ( type == RecordDecoder.VVR
                   || type == RecordDecoder.CVVR ) {
                list.add( new Entry( vxr.first[ ie ], vxr.last[ ie ],
                                     offset ) );
            }
            else {
                throw new CdfFormatException( "Unexpected record type "
                                            + type + " in VXR entry at 0x"
                                            + Long.toHexString( offset ) );
            }
        }
    }

    /**
     * Field storage for one block entry.
     */
    private static class Entry implements Comparable<Entry> {
        final int first_;
        final int last_;
        final long offset_;

        /**
         * Constructor.
         *
         * @param  first  index of first record in this entry
         * @param  last  index of last record (inclusive) in this entry
         * @param  offset  file offset of the VVR or CVVR
         */
        Entry( int first, int last, long offset ) {
            first_ = first;
            last_ = last;
            offset_ = offset;
        }

        public int compareTo( Entry other ) {
            return Integer.compare( this.first_, other.first_ );
        }
    }
}
