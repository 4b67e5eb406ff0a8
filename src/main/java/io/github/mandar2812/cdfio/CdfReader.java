package io.github.mandar2812.cdfio;

import io.github.mandar2812.cdfio.epoch.Epoch16;
import io.github.mandar2812.cdfio.epoch.EpochCodec;
import io.github.mandar2812.cdfio.record.AttributeDescriptorRecord;
import io.github.mandar2812.cdfio.record.AttributeEntryDescriptorRecord;
import io.github.mandar2812.cdfio.record.CdfDescriptorRecord;
import io.github.mandar2812.cdfio.record.CompressedCdfRecord;
import io.github.mandar2812.cdfio.record.CompressedParametersRecord;
import io.github.mandar2812.cdfio.record.Compression;
import io.github.mandar2812.cdfio.record.GlobalDescriptorRecord;
import io.github.mandar2812.cdfio.record.Pointer;
import io.github.mandar2812.cdfio.record.RecordDecoder;
import io.github.mandar2812.cdfio.record.RecordMap;
import io.github.mandar2812.cdfio.record.SimpleNioBuf;
import io.github.mandar2812.cdfio.record.V2RecordDecoder;
import io.github.mandar2812.cdfio.record.V3RecordDecoder;
import io.github.mandar2812.cdfio.record.VariableDescriptorRecord;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.lang.ref.Cleaner;
import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Reads the metadata and data of a CDF file.
 *
 * <p>Constructing an instance reads enough of a file to identify it
 * as a CDF and work out how to access its records: the magic numbers,
 * the CDR and the GDR.  Everything else is read from the mapped file
 * as required; each query walks the relevant linked list of records
 * from its head.
 * In the case of a file-compressed CDF the whole thing is uncompressed
 * to a temporary file at construction time,
 * so that could still be an expensive operation.
 *
 * <p>Temporary files are deleted by {@link #close}, or when the reader
 * becomes unreachable if it is never closed.
 * Instances are not thread-safe.
 *
 * @since    19 Jun 2013
 */
public class CdfReader implements AutoCloseable {

    /** Default text encoding for character data and names. */
    public static final Charset DEFAULT_CHARSET = StandardCharsets.US_ASCII;

    /** First magic number word for version 3 files. */
    public static final int V3_MAGIC = 0xcdf30001;

    /** First magic number word for version 2.6/2.7 files. */
    public static final int V26_MAGIC = 0xcdf26002;

    /** First magic number word for pre-2.6 files. */
    public static final int V2_MAGIC = 0x0000ffff;

    /** Second magic number word for uncompressed files. */
    public static final int UNCOMPRESSED_MAGIC = 0x0000ffff;

    /** Second magic number word for file-compressed files. */
    public static final int COMPRESSED_MAGIC = 0xcccc0001;

    private static final Pattern MULTI_STRING_SEP =
        Pattern.compile( Pattern.quote( "\\N " ) );
    private static final String DEPEND_0 = "DEPEND_0";
    private static final Cleaner CLEANER = Cleaner.create();
    private static final Logger logger_ =
        Logger.getLogger( CdfReader.class.getName() );

    private final File file_;
    private final Charset charset_;
    private final TempFiles tempFiles_;
    private final Cleaner.Cleanable cleanable_;
    private final Buf buf_;
    private final RecordDecoder decoder_;
    private final CdfDescriptorRecord cdr_;
    private final GlobalDescriptorRecord gdr_;
    private final NumericEncoding encoding_;
    private final ByteOrder order_;
    private final boolean compressed_;
    private EpochCodec codec_;
    private boolean closed_;

    /**
     * Opens a CDF file without checksum validation, reading text
     * as ASCII.
     *
     * @param  file  CDF file; a ".cdf" suffix is added if the file
     *               does not exist without it
     */
    public CdfReader( File file ) throws IOException {
        this( file, false, DEFAULT_CHARSET );
    }

    /**
     * Opens a CDF file.
     *
     * @param  file  CDF file; a ".cdf" suffix is added if the file
     *               does not exist without it
     * @param  validate  if true, and the file carries an MD5 checksum,
     *                   the checksum is verified
     * @param  charset  text encoding for character data and names
     */
    public CdfReader( File file, boolean validate, Charset charset )
            throws IOException {
        this( resolveFile( file ), validate, charset, new TempFiles(),
              false );
    }

    /**
     * Constructor.
     *
     * @param  file  existing CDF file
     * @param  validate  whether to verify any checksum
     * @param  charset  text encoding
     * @param  tempFiles  temporary files owned by this reader
     * @param  isTemp  true if <code>file</code> is itself a temporary
     *                 copy owned by this reader
     */
    private CdfReader( File file, boolean validate, Charset charset,
                       TempFiles tempFiles, boolean isTemp )
            throws IOException {
        file_ = file;
        charset_ = charset;
        tempFiles_ = tempFiles;
        cleanable_ = CLEANER.register( this, tempFiles );
        try {
            Buf rawBuf = SimpleNioBuf.mapFile( file );
            if ( rawBuf.getLength() < 8 ) {
                throw new CdfFormatException( "File " + file
                                            + " too short for a CDF" );
            }

            // Read the CDF magic number bytes, and work out from them
            // what variant (if any) of the CDF format this file implements.
            Pointer ptr = new Pointer( 0 );
            int magic1 = rawBuf.readInt( ptr );
            int magic2 = rawBuf.readInt( ptr );
            int version = getMagicVersion( magic1 );
            if ( version < 0 ||
                 ( magic2 != UNCOMPRESSED_MAGIC &&
                   magic2 != COMPRESSED_MAGIC ) ) {
                throw new CdfFormatException( "Unrecognised magic numbers: "
                                            + "0x"
                                            + Integer.toHexString( magic1 )
                                            + ", 0x"
                                            + Integer.toHexString( magic2 ) );
            }
            compressed_ = magic2 == COMPRESSED_MAGIC;
            decoder_ = version == 3 ? new V3RecordDecoder( charset )
                                    : new V2RecordDecoder( charset );
            logger_.config( "CDF magic number for V" + version
                          + ( magic1 == V2_MAGIC ? " (pre-2.6)" : "" ) );
            logger_.config( "Whole file compression: " + compressed_ );

            // Uncompress the whole file if required.  The uncompressed
            // records refer to offsets in a file with magic numbers,
            // so the working copy gets those prepended.
            Buf buf = rawBuf;
            if ( compressed_ ) {
                File ufile = uncompressFile( rawBuf, decoder_, magic1 );
                buf = SimpleNioBuf.mapFile( ufile );
            }
            buf_ = buf;

            // Interrogate CDR for required information.
            cdr_ = decoder_.readCdr( buf_, 8 );
            if ( ! cdr_.isSingleFile() ) {
                throw new CdfFormatException( "Multi-file CDFs "
                                            + "not supported" );
            }
            encoding_ = NumericEncoding.getEncoding( cdr_.encoding );
            order_ = encoding_.getByteOrder();
            if ( validate && cdr_.hasChecksum() ) {
                validateChecksum( rawBuf );
            }
            if ( compressed_ && isTemp ) {
                tempFiles_.release( file );
            }
            gdr_ = decoder_.readGdr( buf_, cdr_.gdrOffset );
            logger_.config( "Opened " + file + ": CDF "
                          + cdr_.getVersionString() + ", " + encoding_ );
            if ( gdr_.leapSecondLastUpdated > 0 ) {
                getEpochCodec()
               .checkLeapSecondLastUpdated( gdr_.leapSecondLastUpdated );
            }
        }
        catch ( IOException | RuntimeException e ) {
            cleanable_.clean();
            throw e;
        }
    }

    /**
     * Opens a CDF from a stream, for transports that are not seekable.
     * The stream is copied to a temporary file owned by the reader.
     * The stream is not closed.
     *
     * @param  in  stream containing a CDF file
     * @param  validate  whether to verify any checksum
     * @param  charset  text encoding
     * @return  new reader
     */
    public static CdfReader open( InputStream in, boolean validate,
                                  Charset charset ) throws IOException {
        TempFiles tempFiles = new TempFiles();
        File tmp = tempFiles.create();
        try ( OutputStream out =
                  new BufferedOutputStream( new FileOutputStream( tmp ) ) ) {
            long n = in.transferTo( out );
            logger_.config( "Buffered " + n + " bytes of CDF stream to "
                          + tmp );
        }
        catch ( IOException e ) {
            tempFiles.run();
            throw e;
        }
        return new CdfReader( tmp, validate, charset, tempFiles, true );
    }

    /**
     * Returns global information about the file.
     *
     * @return  info
     */
    public CdfInfo getInfo() throws IOException {
        checkOpen();
        List<String> rNames = readVariableNames( gdr_.rVdrHead, gdr_.nrVars );
        List<String> zNames = readVariableNames( gdr_.zVdrHead, gdr_.nzVars );
        Map<String,String> atts = new LinkedHashMap<String,String>();
        for ( AttributeDescriptorRecord adr : readAdrs() ) {
            atts.put( adr.name, adr.isGlobal() ? AttributeInfo.GLOBAL_SCOPE
                                               : AttributeInfo.VARIABLE_SCOPE );
        }
        return new CdfInfo( file_, cdr_.getVersionString(), encoding_,
                            cdr_.isRowMajor(), rNames, zNames, atts,
                            cdr_.copyright, cdr_.hasChecksum(),
                            gdr_.rDimSizes.clone(), compressed_,
                            gdr_.leapSecondLastUpdated );
    }

    /**
     * Returns the declaration of a named variable.
     * zVariables are searched before rVariables.
     *
     * @param  name  variable name, matched case-insensitively
     * @return  variable info
     * @throws  CdfNotFoundException  if there is no such variable
     */
    public VariableInfo varinq( String name ) throws IOException {
        checkOpen();
        return toVariableInfo( findVdr( name ) );
    }

    /**
     * Returns the declaration of a numbered variable.
     *
     * @param  num  variable number
     * @return  variable info
     * @throws  CdfUsageException  if the file has both r and zVariables
     * @throws  CdfNotFoundException  if there is no such variable
     */
    public VariableInfo varinq( int num ) throws IOException {
        checkOpen();
        return toVariableInfo( findVdr( num ) );
    }

    /**
     * Returns the declaration of a named attribute.
     *
     * @param  name  attribute name, matched case-insensitively
     * @return  attribute info
     * @throws  CdfNotFoundException  if there is no such attribute
     */
    public AttributeInfo attinq( String name ) throws IOException {
        checkOpen();
        return toAttributeInfo( findAdr( name ) );
    }

    /**
     * Returns the declaration of a numbered attribute.
     *
     * @param  num  attribute number
     * @return  attribute info
     * @throws  CdfNotFoundException  if there is no such attribute
     */
    public AttributeInfo attinq( int num ) throws IOException {
        checkOpen();
        return toAttributeInfo( findAdr( num ) );
    }

    /**
     * Returns a numbered entry of a named attribute.
     * For variable attributes the entry number is a variable number,
     * which is ambiguous if the file has both r and zVariables.
     *
     * @param  attName  attribute name
     * @param  entry  entry number
     * @return  entry data
     * @throws  CdfNotFoundException  if the attribute or entry is absent
     * @throws  CdfUsageException  for an ambiguous variable number
     */
    public AttributeData attget( String attName, int entry )
            throws IOException {
        checkOpen();
        return getEntryData( findAdr( attName ), entry );
    }

    /**
     * Returns a numbered entry of a numbered attribute.
     *
     * @param  attNum  attribute number
     * @param  entry  entry number
     * @return  entry data
     */
    public AttributeData attget( int attNum, int entry ) throws IOException {
        checkOpen();
        return getEntryData( findAdr( attNum ), entry );
    }

    /**
     * Returns the entry of a variable attribute for a named variable.
     *
     * @param  attName  attribute name
     * @param  varName  variable name
     * @return  entry data
     * @throws  CdfUsageException  if the attribute has global scope
     * @throws  CdfNotFoundException  if the attribute, variable or entry
     *          is absent
     */
    public AttributeData attget( String attName, String varName )
            throws IOException {
        checkOpen();
        AttributeDescriptorRecord adr = findAdr( attName );
        if ( adr.isGlobal() ) {
            throw new CdfUsageException( "Attribute " + adr.name
                                       + " has global scope;"
                                       + " use an entry number" );
        }
        VariableDescriptorRecord vdr = findVdr( varName );
        AttributeEntryDescriptorRecord aedr = findVariableEntry( adr, vdr );
        if ( aedr == null ) {
            throw new CdfNotFoundException( "No entry for variable "
                                          + vdr.name + " in attribute "
                                          + adr.name );
        }
        return toAttributeData( aedr );
    }

    /**
     * Returns all global attribute entries, in file order.
     *
     * @return  map from attribute name to its entries in chain order
     */
    public Map<String,List<AttributeEntry>> globalattsget()
            throws IOException {
        checkOpen();
        Map<String,List<AttributeEntry>> map =
            new LinkedHashMap<String,List<AttributeEntry>>();
        for ( AttributeDescriptorRecord adr : readAdrs() ) {
            if ( adr.isGlobal() ) {
                List<AttributeEntry> list = new ArrayList<AttributeEntry>();
                for ( AttributeEntryDescriptorRecord aedr :
                      readAedrs( adr.agrEdrHead, adr.ngrEntries ) ) {
                    list.add( toAttributeData( aedr ).toEntry() );
                }
                map.put( adr.name, list );
            }
        }
        return map;
    }

    /**
     * Returns all global attribute entries keyed by entry number.
     * Epoch values are given as formatted strings.
     *
     * @return  map from attribute name to entry number to entry
     */
    public Map<String,Map<Integer,AttributeEntry>> globalattsgetExpanded()
            throws IOException {
        checkOpen();
        Map<String,Map<Integer,AttributeEntry>> map =
            new LinkedHashMap<String,Map<Integer,AttributeEntry>>();
        for ( AttributeDescriptorRecord adr : readAdrs() ) {
            if ( adr.isGlobal() ) {
                Map<Integer,AttributeEntry> entries =
                    new LinkedHashMap<Integer,AttributeEntry>();
                for ( AttributeEntryDescriptorRecord aedr :
                      readAedrs( adr.agrEdrHead, adr.ngrEntries ) ) {
                    entries.put( Integer.valueOf( aedr.num ),
                                 formatEpochs( toAttributeData( aedr )
                                              .toEntry() ) );
                }
                map.put( adr.name, entries );
            }
        }
        return map;
    }

    /**
     * Returns the variable attribute entries of a named variable.
     *
     * @param  varName  variable name
     * @return  map from attribute name to entry, for attributes
     *          with an entry for the variable
     */
    public Map<String,AttributeEntry> varattsget( String varName )
            throws IOException {
        checkOpen();
        return readVariableAttributes( findVdr( varName ), false );
    }

    /**
     * Returns the variable attribute entries of a numbered variable.
     *
     * @param  num  variable number
     * @return  map from attribute name to entry
     * @throws  CdfUsageException  if the file has both r and zVariables
     */
    public Map<String,AttributeEntry> varattsget( int num )
            throws IOException {
        checkOpen();
        return readVariableAttributes( findVdr( num ), false );
    }

    /**
     * Returns all variable attributes for a named variable,
     * mapping those without an entry for it to null.
     * Epoch values are given as formatted strings.
     *
     * @param  varName  variable name
     * @return  map from attribute name to entry or null
     */
    public Map<String,AttributeEntry> varattsgetExpanded( String varName )
            throws IOException {
        checkOpen();
        return readVariableAttributes( findVdr( varName ), true );
    }

    /**
     * Reads all records of a named variable.
     *
     * @param  name  variable name
     * @return  data
     */
    public VariableData varget( String name ) throws IOException {
        return varget( new VarQuery( name ) );
    }

    /**
     * Reads a range of records of a named variable.
     *
     * @param  name  variable name
     * @param  startRec  first record
     * @param  endRec  last record, inclusive
     * @return  data
     */
    public VariableData varget( String name, int startRec, int endRec )
            throws IOException {
        return varget( new VarQuery( name ).startRecord( startRec )
                                           .endRecord( endRec ) );
    }

    /**
     * Reads all records of a numbered variable.
     *
     * @param  num  variable number
     * @return  data
     */
    public VariableData varget( int num ) throws IOException {
        return varget( new VarQuery( num ) );
    }

    /**
     * Reads variable data.
     * Records that have no physical data are filled according to
     * the variable's sparse record policy.
     *
     * @param  query  query
     * @return  data, with no records if a time range matches none
     * @throws  CdfUsageException  for inconsistent ranges
     * @throws  CdfNotFoundException  if the variable or its epoch variable
     *          is absent, or the variable has no records
     */
    public VariableData varget( VarQuery query ) throws IOException {
        checkOpen();
        if ( query.hasTimeRange() && query.hasRecordRange() ) {
            throw new CdfUsageException( "Can't specify both time range "
                                       + "and record range" );
        }
        VariableDescriptorRecord vdr = query.getName() != null
                                     ? findVdr( query.getName() )
                                     : findVdr( query.getNumber()
                                               .intValue() );
        DataType dataType = DataType.getDataType( vdr.dataType );
        if ( vdr.maxRec < 0 ) {
            throw new CdfNotFoundException( "No records found for variable "
                                          + vdr.name );
        }
        final int startRec;
        final int endRec;
        if ( ! vdr.isRecordVarying() ) {
            startRec = 0;
            endRec = 0;
        }
        else if ( query.hasTimeRange() ) {
            int[] irecs = findTimeRange( vdr, dataType, query );

            // The epoch variable may have more records than this one.
            if ( irecs.length == 0 || irecs[ 0 ] > vdr.maxRec ) {
                return createEmptyData( vdr, dataType );
            }
            startRec = irecs[ 0 ];
            endRec = Math.min( irecs[ irecs.length - 1 ], vdr.maxRec );
        }
        else {
            Integer start = query.getStartRecord();
            Integer end = query.getEndRecord();
            startRec = start == null ? 0 : start.intValue();
            endRec = end == null ? vdr.maxRec : end.intValue();
            if ( startRec < 0 ) {
                throw new CdfUsageException( "Invalid start record "
                                           + startRec );
            }
            if ( endRec < 0 || endRec > vdr.maxRec || endRec < startRec ) {
                throw new CdfUsageException( "Invalid end record " + endRec
                                           + " (records " + startRec
                                           + ".." + vdr.maxRec + ")" );
            }
        }
        return readRecords( vdr, dataType, startRec, endRec );
    }

    /**
     * Returns data with no records for a variable.
     *
     * @param  vdr  variable descriptor
     * @param  dataType  data type
     * @return  empty data
     */
    private VariableData createEmptyData( VariableDescriptorRecord vdr,
                                          DataType dataType ) {
        return new VariableData( vdr.name, dataType, vdr.numElems, 0, 0,
                                 getRecordDims( vdr ),
                                 dataType.decode( new byte[ 0 ], 0, 0,
                                                  vdr.numElems, order_,
                                                  charset_ ),
                                 new int[ 0 ] );
    }

    /**
     * Returns the epoch codec used by this reader, creating it if needed.
     *
     * @return  epoch codec
     */
    public EpochCodec getEpochCodec() throws IOException {
        if ( codec_ == null ) {
            codec_ = new EpochCodec();
        }
        return codec_;
    }

    /**
     * Returns the file being read.  For whole-file compressed CDFs this
     * is the compressed file, not the working copy.
     *
     * @return  file
     */
    public File getFile() {
        return file_;
    }

    /**
     * Releases resources and deletes any temporary files.
     * Calling this more than once has no further effect.
     */
    public void close() {
        if ( ! closed_ ) {
            closed_ = true;
            cleanable_.clean();
            logger_.config( "Closed " + file_ );
        }
    }

    /**
     * Examines a byte array to see if it looks like the start of a CDF file.
     *
     * @param   intro  byte array, at least 8 bytes if available
     * @return  true iff the first 8 bytes of <code>intro</code> are
     *          a CDF magic number
     */
    public static boolean isMagic( byte[] intro ) {
        if ( intro.length < 8 ) {
            return false;
        }
        int magic2 = readInt( intro, 4 );
        return getMagicVersion( readInt( intro, 0 ) ) > 0
            && ( magic2 == UNCOMPRESSED_MAGIC || magic2 == COMPRESSED_MAGIC );
    }

    /**
     * Reads records of a variable and decodes them.
     *
     * @param  vdr  variable descriptor
     * @param  dataType  data type
     * @param  startRec  first record
     * @param  endRec  last record, inclusive
     * @return  data
     */
    private VariableData readRecords( VariableDescriptorRecord vdr,
                                      DataType dataType, int startRec,
                                      int endRec ) throws IOException {
        int nrec = endRec - startRec + 1;
        int nval = vdr.getValuesPerRecord();
        int recSize = nval * dataType.getValueSize( vdr.numElems );
        long nbyte = (long) nrec * recSize;
        if ( nbyte > Integer.MAX_VALUE - 8 ) {
            throw new CdfUsageException( "Too much data requested ("
                                       + nrec + " records of " + recSize
                                       + " bytes)" );
        }
        byte[] bytes = new byte[ (int) nbyte ];
        int[] realRecs = new int[ nrec ];
        int nreal = 0;
        SparseMode sparse = SparseMode.getSparseMode( vdr.sRecords );
        RecordMap recMap = RecordMap.createRecordMap( buf_, decoder_, vdr );
        for ( int irec = startRec; irec <= endRec; ) {
            int ient = recMap.findEntry( irec );

            // Copy physical records straight from the block.
            if ( ient >= 0 ) {
                int last = Math.min( recMap.getLast( ient ), endRec );
                byte[] block = recMap.getBlockData( ient, recSize );
                System.arraycopy( block,
                                  ( irec - recMap.getFirst( ient ) ) * recSize,
                                  bytes, ( irec - startRec ) * recSize,
                                  ( last - irec + 1 ) * recSize );
                while ( irec <= last ) {
                    realRecs[ nreal++ ] = irec++;
                }
            }

            // Fill a run of virtual records.
            else {
                int gapEnd =
                    (int) Math.min( (long) recMap.getNextFirst( irec ) - 1,
                                    endRec );
                byte[] fill = getFillRecord( vdr, dataType, sparse, recMap,
                                             irec, recSize, nval );
                for ( ; irec <= gapEnd; irec++ ) {
                    System.arraycopy( fill, 0, bytes,
                                      ( irec - startRec ) * recSize,
                                      recSize );
                }
            }
        }
        Object raw = dataType.decode( bytes, 0, nrec * nval, vdr.numElems,
                                      order_, charset_ );
        int[] recDims = getRecordDims( vdr );
        Object data = Shaper.createShaper( dataType, recDims,
                                           cdr_.isRowMajor() )
                            .toRowMajor( raw, nrec );
        return new VariableData( vdr.name, dataType, vdr.numElems, startRec,
                                 nrec, recDims, data,
                                 Arrays.copyOf( realRecs, nreal ) );
    }

    /**
     * Returns the bytes of a record that has no physical data.
     *
     * @param  vdr  variable descriptor
     * @param  dataType  data type
     * @param  sparse  sparse record policy
     * @param  recMap  record map
     * @param  irec  virtual record number
     * @param  recSize  bytes per record
     * @param  nval  values per record
     * @return  record bytes
     */
    private byte[] getFillRecord( VariableDescriptorRecord vdr,
                                  DataType dataType, SparseMode sparse,
                                  RecordMap recMap, int irec, int recSize,
                                  int nval ) throws IOException {
        byte[] fill = new byte[ recSize ];
        if ( sparse == SparseMode.PREV_SPARSE ) {
            int iprev = recMap.findPrecedingEntry( irec );
            if ( iprev >= 0 ) {
                byte[] block = recMap.getBlockData( iprev, recSize );
                int off = ( recMap.getLast( iprev ) - recMap.getFirst( iprev ) )
                        * recSize;
                System.arraycopy( block, off, fill, 0, recSize );
                return fill;
            }
        }
        byte[] pad = getPadBytes( vdr, dataType );
        for ( int i = 0; i < nval; i++ ) {
            System.arraycopy( pad, 0, fill, i * pad.length, pad.length );
        }
        return fill;
    }

    /**
     * Returns the encoded pad value of a variable, the declared one
     * if present, else the default for its type.
     *
     * @param  vdr  variable descriptor
     * @param  dataType  data type
     * @return  bytes of one value
     */
    private byte[] getPadBytes( VariableDescriptorRecord vdr,
                                DataType dataType ) throws IOException {
        if ( vdr.hasPad() && vdr.padOffset > 0 ) {
            byte[] pad = new byte[ dataType.getValueSize( vdr.numElems ) ];
            buf_.readBytes( vdr.padOffset, pad.length, pad );
            return pad;
        }
        else {
            return dataType.getDefaultPadBytes( vdr.numElems, order_ );
        }
    }

    /**
     * Works out which records of a variable fall in a query's time range.
     *
     * @param  vdr  variable descriptor
     * @param  dataType  variable data type
     * @param  query  query with time range
     * @return  record indices in range
     */
    private int[] findTimeRange( VariableDescriptorRecord vdr,
                                 DataType dataType, VarQuery query )
            throws IOException {
        VariableDescriptorRecord evdr;
        if ( query.getEpochVariable() != null ) {
            evdr = findVdr( query.getEpochVariable() );
        }
        else if ( dataType.isEpoch() ) {
            evdr = vdr;
        }
        else {
            AttributeEntryDescriptorRecord aedr = null;
            AttributeDescriptorRecord adr = findAdrOrNull( DEPEND_0 );
            if ( adr != null && ! adr.isGlobal() ) {
                aedr = findVariableEntry( adr, vdr );
            }
            Object dep = aedr == null ? null
                                      : toAttributeData( aedr ).getData();
            if ( ! ( dep instanceof String ) ) {
                throw new CdfNotFoundException( "No epoch variable found "
                                              + "for " + vdr.name );
            }
            evdr = findVdr( (String) dep );
        }
        DataType etype = DataType.getDataType( evdr.dataType );
        if ( ! etype.isEpoch() ) {
            throw new CdfUsageException( "Variable " + evdr.name
                                       + " is not an epoch type ("
                                       + etype.getToken() + ")" );
        }
        if ( evdr.maxRec < 0 ) {
            throw new CdfNotFoundException( "No records found for variable "
                                          + evdr.name );
        }
        VariableData edata = readRecords( evdr, etype, 0, evdr.maxRec );
        return getEpochCodec().findEpochRange( etype, edata.getData(),
                                               query.getStartTime(),
                                               query.getEndTime() );
    }

    /**
     * Returns the varying dimension sizes of a variable.
     *
     * @param  vdr  variable descriptor
     * @return  record dimensions
     */
    private static int[] getRecordDims( VariableDescriptorRecord vdr ) {
        int n = 0;
        for ( boolean vary : vdr.dimVarys ) {
            n += vary ? 1 : 0;
        }
        int[] dims = new int[ n ];
        int j = 0;
        for ( int i = 0; i < vdr.dimSizes.length; i++ ) {
            if ( vdr.dimVarys[ i ] ) {
                dims[ j++ ] = vdr.dimSizes[ i ];
            }
        }
        return dims;
    }

    private VariableInfo toVariableInfo( VariableDescriptorRecord vdr )
            throws IOException {
        DataType dataType = DataType.getDataType( vdr.dataType );
        Object pad = vdr.hasPad() && vdr.padOffset > 0
                   ? dataType.decode( getPadBytes( vdr, dataType ), 0, 1,
                                      vdr.numElems, order_, charset_ )
                   : null;
        int level = 0;
        if ( vdr.isCompressed() && vdr.cprOrSprOffset > 0 ) {
            CompressedParametersRecord cpr =
                decoder_.readCpr( buf_, vdr.cprOrSprOffset );
            level = cpr.getLevel();
        }
        return new VariableInfo( vdr.name, vdr.num, vdr.isZVariable(),
                                 dataType, vdr.numElems, vdr.dimSizes,
                                 vdr.dimVarys,
                                 SparseMode.getSparseMode( vdr.sRecords ),
                                 vdr.maxRec, vdr.isRecordVarying(), pad,
                                 level, vdr.blockingFactor );
    }

    private static AttributeInfo
            toAttributeInfo( AttributeDescriptorRecord adr ) {
        return new AttributeInfo( adr.name, adr.num, adr.isGlobal(),
                                  adr.maxGrEntry, adr.ngrEntries,
                                  adr.maxZEntry, adr.nzEntries );
    }

    /**
     * Reads a numbered entry of an attribute.
     *
     * @param  adr  attribute descriptor
     * @param  entry  entry number
     * @return  entry data
     */
    private AttributeData getEntryData( AttributeDescriptorRecord adr,
                                        int entry ) throws IOException {
        final long head;
        final int count;
        final int max;
        if ( adr.isGlobal() ) {
            head = adr.agrEdrHead;
            count = adr.ngrEntries;
            max = adr.maxGrEntry;
        }
        else if ( gdr_.nzVars > 0 && gdr_.nrVars > 0 ) {
            throw new CdfUsageException( "File has both r and zVariables; "
                                       + "use a variable name for entries of "
                                       + adr.name );
        }
        else if ( gdr_.nzVars > 0 ) {
            head = adr.azEdrHead;
            count = adr.nzEntries;
            max = adr.maxZEntry;
        }
        else {
            head = adr.agrEdrHead;
            count = adr.ngrEntries;
            max = adr.maxGrEntry;
        }
        if ( entry < 0 || entry > max ) {
            throw new CdfNotFoundException( "The entry does not exist: "
                                          + adr.name + " entry " + entry );
        }
        AttributeEntryDescriptorRecord aedr = findEntry( head, count, entry );
        if ( aedr == null ) {
            throw new CdfNotFoundException( "No entry " + entry
                                          + " for attribute " + adr.name );
        }
        return toAttributeData( aedr );
    }

    /**
     * Returns the variable attribute entries for a variable.
     *
     * @param  vdr  variable descriptor
     * @param  expand  if true, include attributes without an entry
     *                 mapped to null, and format epoch values
     * @return  ordered map of attribute name to entry
     */
    private Map<String,AttributeEntry>
            readVariableAttributes( VariableDescriptorRecord vdr,
                                    boolean expand ) throws IOException {
        Map<String,AttributeEntry> map =
            new LinkedHashMap<String,AttributeEntry>();
        for ( AttributeDescriptorRecord adr : readAdrs() ) {
            if ( ! adr.isGlobal() ) {
                AttributeEntryDescriptorRecord aedr =
                    findVariableEntry( adr, vdr );
                if ( aedr != null ) {
                    AttributeEntry entry = toAttributeData( aedr ).toEntry();
                    map.put( adr.name, expand ? formatEpochs( entry )
                                              : entry );
                }
                else if ( expand ) {
                    map.put( adr.name, null );
                }
            }
        }
        return map;
    }

    /**
     * Replaces epoch values in an entry by formatted strings.
     * TT2000 values are written in ISO 8601 form, EPOCH and EPOCH16
     * in the legacy form.
     *
     * @param  entry  entry
     * @return  entry with String[] value if epoch typed, else the input
     */
    private AttributeEntry formatEpochs( AttributeEntry entry )
            throws IOException {
        DataType type = entry.getDataType();
        EpochCodec codec = getEpochCodec();
        if ( type == DataType.TIME_TT2000 ) {
            long[] vals = (long[]) entry.getValue();
            String[] txts = new String[ vals.length ];
            for ( int i = 0; i < vals.length; i++ ) {
                txts[ i ] = codec.encodeTt2000( vals[ i ], true );
            }
            return new AttributeEntry( type, txts );
        }
        else if ( type == DataType.EPOCH ) {
            double[] vals = (double[]) entry.getValue();
            String[] txts = new String[ vals.length ];
            for ( int i = 0; i < vals.length; i++ ) {
                txts[ i ] = codec.encodeEpoch( vals[ i ], false );
            }
            return new AttributeEntry( type, txts );
        }
        else if ( type == DataType.EPOCH16 ) {
            double[] vals = (double[]) entry.getValue();
            String[] txts = new String[ vals.length / 2 ];
            for ( int i = 0; i < txts.length; i++ ) {
                txts[ i ] = codec.encodeEpoch16(
                                new Epoch16( vals[ 2 * i ],
                                             vals[ 2 * i + 1 ] ), false );
            }
            return new AttributeEntry( type, txts );
        }
        else {
            return entry;
        }
    }

    /**
     * Decodes the value of an attribute entry.
     *
     * @param  aedr  entry descriptor
     * @return  entry data
     */
    private AttributeData toAttributeData( AttributeEntryDescriptorRecord
                                           aedr ) throws IOException {
        DataType dataType = DataType.getDataType( aedr.dataType );
        int itemSize = dataType.getValueSize( aedr.numElems );
        if ( dataType.isCharacter() ) {
            byte[] bytes = new byte[ aedr.numElems ];
            buf_.readBytes( aedr.valueOffset, bytes.length, bytes );
            String txt = DataType.decodeString( bytes, 0, bytes.length,
                                                charset_ );
            Object data = aedr.numStrings > 1
                        ? MULTI_STRING_SEP.split( txt, -1 )
                        : txt;
            return new AttributeData( dataType, itemSize, aedr.numStrings,
                                      data );
        }
        else {
            byte[] bytes = new byte[ aedr.numElems * itemSize ];
            buf_.readBytes( aedr.valueOffset, bytes.length, bytes );
            Object data = dataType.decode( bytes, 0, aedr.numElems,
                                           aedr.numElems, order_, charset_ );
            return new AttributeData( dataType, itemSize, aedr.numElems,
                                      data );
        }
    }

    /**
     * Locates the entry of a variable attribute for a given variable.
     *
     * @param  adr  attribute descriptor
     * @param  vdr  variable descriptor
     * @return  entry descriptor, or null if there is none
     */
    private AttributeEntryDescriptorRecord
            findVariableEntry( AttributeDescriptorRecord adr,
                               VariableDescriptorRecord vdr )
            throws IOException {
        return vdr.isZVariable()
             ? findEntry( adr.azEdrHead, adr.nzEntries, vdr.num )
             : findEntry( adr.agrEdrHead, adr.ngrEntries, vdr.num );
    }

    /**
     * Walks an AEDR list looking for a given entry number.
     *
     * @param  head  offset of first AEDR
     * @param  count  number of AEDRs in list
     * @param  entry  entry number
     * @return  entry descriptor, or null if there is none
     */
    private AttributeEntryDescriptorRecord findEntry( long head, int count,
                                                      int entry )
            throws IOException {
        long off = head;
        for ( int ie = 0; ie < count && off != 0; ie++ ) {
            if ( decoder_.readAedrEntryNum( buf_, off ) == entry ) {
                return decoder_.readAedr( buf_, off );
            }
            off = decoder_.readAedrNext( buf_, off );
        }
        return null;
    }

    /**
     * Follows a linked list of Attribute Entry Descriptor Records.
     *
     * @param  head  offset of first AEDR
     * @param  count  number of AEDRs
     * @return  entry descriptors in chain order
     */
    private List<AttributeEntryDescriptorRecord> readAedrs( long head,
                                                            int count )
            throws IOException {
        List<AttributeEntryDescriptorRecord> list =
            new ArrayList<AttributeEntryDescriptorRecord>( count );
        long off = head;
        for ( int ie = 0; ie < count && off != 0; ie++ ) {
            AttributeEntryDescriptorRecord aedr =
                decoder_.readAedr( buf_, off );
            list.add( aedr );
            off = aedr.aedrNext;
        }
        return list;
    }

    /**
     * Follows the linked list of Attribute Descriptor Records.
     *
     * @return  list of ADRs
     */
    private List<AttributeDescriptorRecord> readAdrs() throws IOException {
        List<AttributeDescriptorRecord> list =
            new ArrayList<AttributeDescriptorRecord>( gdr_.numAttr );
        long off = gdr_.adrHead;
        for ( int ia = 0; ia < gdr_.numAttr && off != 0; ia++ ) {
            AttributeDescriptorRecord adr = decoder_.readAdr( buf_, off );
            list.add( adr );
            off = adr.adrNext;
        }
        return list;
    }

    private AttributeDescriptorRecord findAdr( String name )
            throws IOException {
        AttributeDescriptorRecord adr = findAdrOrNull( name );
        if ( adr == null ) {
            throw new CdfNotFoundException( "No attribute by name: "
                                          + name );
        }
        return adr;
    }

    private AttributeDescriptorRecord findAdrOrNull( String name )
            throws IOException {
        String target = name.trim();
        long off = gdr_.adrHead;
        for ( int ia = 0; ia < gdr_.numAttr && off != 0; ia++ ) {
            if ( decoder_.readAdrName( buf_, off ).trim()
                         .equalsIgnoreCase( target ) ) {
                return decoder_.readAdr( buf_, off );
            }
            off = decoder_.readAdrNext( buf_, off );
        }
        return null;
    }

    private AttributeDescriptorRecord findAdr( int num ) throws IOException {
        if ( num < 0 || num >= gdr_.numAttr ) {
            throw new CdfNotFoundException( "No attribute number " + num
                                          + " (" + gdr_.numAttr
                                          + " attributes)" );
        }
        long off = gdr_.adrHead;
        for ( int ia = 0; ia < num; ia++ ) {
            off = decoder_.readAdrNext( buf_, off );
        }
        return decoder_.readAdr( buf_, off );
    }

    /**
     * Locates a variable by name, zVariables first.
     *
     * @param  name  variable name
     * @return  variable descriptor
     */
    private VariableDescriptorRecord findVdr( String name )
            throws IOException {
        String target = name.trim();
        long[] heads = { gdr_.zVdrHead, gdr_.rVdrHead };
        int[] counts = { gdr_.nzVars, gdr_.nrVars };
        for ( int il = 0; il < 2; il++ ) {
            long off = heads[ il ];
            for ( int iv = 0; iv < counts[ il ] && off != 0; iv++ ) {
                if ( decoder_.readVdrName( buf_, off, cdr_ ).trim()
                             .equalsIgnoreCase( target ) ) {
                    return decoder_.readVdr( buf_, off, cdr_, gdr_ );
                }
                off = decoder_.readVdrNext( buf_, off );
            }
        }
        throw new CdfNotFoundException( "No variable by name: " + name );
    }

    /**
     * Locates a variable by number.
     *
     * @param  num  variable number
     * @return  variable descriptor
     */
    private VariableDescriptorRecord findVdr( int num ) throws IOException {
        if ( gdr_.nzVars > 0 && gdr_.nrVars > 0 ) {
            throw new CdfUsageException( "File has both r and zVariables; "
                                       + "use a variable name" );
        }
        boolean isZ = gdr_.nzVars > 0;
        int count = isZ ? gdr_.nzVars : gdr_.nrVars;
        if ( num < 0 || num >= count ) {
            throw new CdfNotFoundException( "No variable number " + num
                                          + " (" + count + " variables)" );
        }
        long off = isZ ? gdr_.zVdrHead : gdr_.rVdrHead;
        for ( int iv = 0; iv < num; iv++ ) {
            off = decoder_.readVdrNext( buf_, off );
        }
        return decoder_.readVdr( buf_, off, cdr_, gdr_ );
    }

    private List<String> readVariableNames( long head, int count )
            throws IOException {
        List<String> names = new ArrayList<String>( count );
        long off = head;
        for ( int iv = 0; iv < count && off != 0; iv++ ) {
            names.add( decoder_.readVdrName( buf_, off, cdr_ ) );
            off = decoder_.readVdrNext( buf_, off );
        }
        return names;
    }

    /**
     * Checks the MD5 digest at the end of the file.
     *
     * @param  rawBuf  buffer holding the file as stored
     * @throws  CdfFormatException  on mismatch
     */
    private void validateChecksum( Buf rawBuf ) throws IOException {
        long leng = rawBuf.getLength() - 16;
        if ( leng < 8 ) {
            throw new CdfFormatException( "No room for checksum" );
        }
        MessageDigest md5;
        try {
            md5 = MessageDigest.getInstance( "MD5" );
        }
        catch ( NoSuchAlgorithmException e ) {
            throw new IOException( "MD5 not available", e );
        }
        byte[] chunk = new byte[ 64 * 1024 ];
        try ( InputStream in = rawBuf.createInputStream( 0, leng ) ) {
            for ( int n; ( n = in.read( chunk ) ) > 0; ) {
                md5.update( chunk, 0, n );
            }
        }
        byte[] stored = new byte[ 16 ];
        rawBuf.readBytes( leng, 16, stored );
        if ( ! MessageDigest.isEqual( md5.digest(), stored ) ) {
            throw new CdfFormatException( "Checksum mismatch for " + file_ );
        }
        logger_.config( "Checksum validated for " + file_ );
    }

    /**
     * Uncompresses a whole-file compressed CDF to a temporary file
     * with uncompressed magic numbers.
     *
     * @param  rawBuf  compressed file
     * @param  decoder  record decoder
     * @param  magic1  first magic number word
     * @return  uncompressed temporary file
     */
    private File uncompressFile( Buf rawBuf, RecordDecoder decoder,
                                 int magic1 ) throws IOException {
        CompressedCdfRecord ccr = decoder.readCcr( rawBuf, 8 );
        CompressedParametersRecord cpr =
            decoder.readCpr( rawBuf, ccr.cprOffset );
        Compression compression = Compression.getCompression( cpr.cType );
        File ufile = tempFiles_.create();
        logger_.config( "Uncompressing " + compression + " CDF data ("
                      + ccr.uSize + " bytes) to " + ufile );
        try ( InputStream in =
                  compression.uncompressStream(
                      new BufferedInputStream(
                          rawBuf.createInputStream( ccr.dataOffset,
                                                    ccr.dataLength ) ) );
              DataOutputStream out =
                  new DataOutputStream(
                      new BufferedOutputStream(
                          new FileOutputStream( ufile ) ) ) ) {
            out.writeInt( magic1 );
            out.writeInt( UNCOMPRESSED_MAGIC );
            in.transferTo( out );
        }
        return ufile;
    }

    private void checkOpen() {
        if ( closed_ ) {
            throw new CdfUsageException( "Reader is closed" );
        }
    }

    /**
     * Returns the format version for a first magic number word.
     *
     * @param  magic1  big-endian int at file offset 0
     * @return  2 or 3, or -1 if not a CDF
     */
    private static int getMagicVersion( int magic1 ) {
        if ( magic1 == V3_MAGIC ) {
            return 3;
        }
        else if ( magic1 == V26_MAGIC || magic1 == V2_MAGIC ) {
            return 2;
        }
        else {
            return -1;
        }
    }

    /**
     * Reads an 4-byte big-endian integer from a byte array.
     *
     * @param  b  byte array
     * @param  ioff   index into <code>b</code> of integer start
     * @return   int value
     */
    private static int readInt( byte[] b, int ioff ) {
        return ( b[ ioff++ ] & 0xff ) << 24
             | ( b[ ioff++ ] & 0xff ) << 16
             | ( b[ ioff++ ] & 0xff ) <<  8
             | ( b[ ioff++ ] & 0xff ) <<  0;
    }

    /**
     * Works out the file to read, adding a ".cdf" suffix if required.
     *
     * @param  file  file as given
     * @return  existing file
     * @throws  CdfNotFoundException  if neither file exists
     */
    private static File resolveFile( File file ) {
        if ( file.isFile() ) {
            return file;
        }
        File suffixed = new File( file.getPath() + ".cdf" );
        if ( suffixed.isFile() ) {
            return suffixed;
        }
        throw new CdfNotFoundException( "CDF file not found: " + file );
    }

    /**
     * Temporary files owned by a reader.
     * Runs as the cleanup action, so must not refer to the reader.
     */
    private static class TempFiles implements Runnable {
        private final List<File> files_ = new ArrayList<File>();

        /**
         * Creates a new temporary file and takes ownership of it.
         *
         * @return  new empty file
         */
        synchronized File create() throws IOException {
            File file = File.createTempFile( "cdfio", ".cdf" );
            files_.add( file );
            return file;
        }

        /**
         * Deletes one owned file early if possible.
         *
         * @param  file  owned file
         */
        synchronized void release( File file ) {
            if ( files_.contains( file ) && file.delete() ) {
                files_.remove( file );
            }
        }

        public synchronized void run() {
            for ( File file : files_ ) {
                if ( ! file.delete() && file.exists() ) {
                    logger_.warning( "Failed to delete temporary file "
                                   + file );
                }
            }
            files_.clear();
        }
    }
}
