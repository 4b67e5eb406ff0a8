package io.github.mandar2812.cdfio.write;

import io.github.mandar2812.cdfio.AttributeEntry;
import io.github.mandar2812.cdfio.CdfNotFoundException;
import io.github.mandar2812.cdfio.CdfReader;
import io.github.mandar2812.cdfio.CdfUsageException;
import io.github.mandar2812.cdfio.DataType;
import io.github.mandar2812.cdfio.NumericEncoding;
import io.github.mandar2812.cdfio.Shaper;
import io.github.mandar2812.cdfio.SparseMode;
import io.github.mandar2812.cdfio.epoch.Epoch16;
import io.github.mandar2812.cdfio.epoch.EpochCodec;
import io.github.mandar2812.cdfio.record.Compression;
import io.github.mandar2812.cdfio.record.RecordDecoder;
import java.io.BufferedOutputStream;
import java.io.File;
import java.io.FilterOutputStream;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.io.RandomAccessFile;
import java.lang.ref.Cleaner;
import java.lang.reflect.Array;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.Channels;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.StandardCopyOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Writes a new version 3 CDF file.
 *
 * <p>The magic numbers, CDR and GDR are written on construction.
 * Each subsequent call appends records to the end of the file and
 * patches pointer and count fields of records already written,
 * so that between calls the file is consistent, though it is only
 * a complete CDF once {@link #close} has recorded its length and
 * applied any checksum or whole-file compression.
 *
 * <p>Instances are not thread-safe.  If a writer becomes unreachable
 * without being closed its file handle is released,
 * but the file is left incomplete.
 *
 * @since    3 Jul 2013
 */
public class CdfWriter implements AutoCloseable {

    /** Format version written. */
    public static final int VERSION = 3;

    /** Format release written. */
    public static final int RELEASE = 7;

    /** Format increment written. */
    public static final int INCREMENT = 0;

    /** Leap second table date recorded in the GDR. */
    public static final int LEAP_SECOND_LAST_UPDATED = 20170101;

    /** Entries in a leaf VXR. */
    public static final int NUM_VXR_ENTRIES = 7;

    /** Entries in an upper level VXR, and the leaf VXR count above
     *  which a new level is added. */
    public static final int NUM_VXRLVL_ENTRIES = 3;

    /** Target uncompressed size of a compressed data block. */
    public static final int BLOCKING_BYTES = 65536;

    private static final int NAME_LENG = 256;
    private static final int CDR_SIZE = 312;
    private static final int GDR_BASE_SIZE = 84;
    private static final int ADR_SIZE = 324;
    private static final int AEDR_BASE_SIZE = 56;
    private static final int VDR_BASE_SIZE = 340;
    private static final int VXR_BASE_SIZE = 28;
    private static final int VVR_BASE_SIZE = 12;
    private static final int CVVR_BASE_SIZE = 24;
    private static final int CPR_SIZE = 28;
    private static final int CCR_BASE_SIZE = 32;
    private static final int VARY = -1;
    private static final int NOVARY = 0;
    private static final String STRING_SEP = "\\N ";
    private static final String COPYRIGHT =
          "\nCommon Data Format (CDF)\n"
        + "https://cdf.gsfc.nasa.gov\n"
        + "Space Physics Data Facility\n"
        + "NASA/Goddard Space Flight Center\n"
        + "Greenbelt, Maryland 20771 USA\n"
        + "(User support: gsfc-cdf-support@lists.nasa.gov)\n";
    private static final Cleaner CLEANER = Cleaner.create();
    private static final Logger logger_ =
        Logger.getLogger( CdfWriter.class.getName() );

    private final File file_;
    private final WriterSpec spec_;
    private final NumericEncoding encoding_;
    private final ByteOrder order_;
    private final Charset charset_;
    private final WriterState state_;
    private final Cleaner.Cleanable cleanable_;
    private final RandomAccessFile raf_;
    private final long cdrOffset_;
    private final long gdrOffset_;
    private final List<VarRef> zVars_;
    private final List<VarRef> rVars_;
    private final List<AttRef> atts_;
    private EpochCodec codec_;
    private boolean closed_;

    /**
     * Creates a writer with default file options.
     *
     * @param  file  destination; ".cdf" is appended if missing
     */
    public CdfWriter( File file ) throws IOException {
        this( file, new WriterSpec(), false );
    }

    /**
     * Creates a writer.
     *
     * @param  file  destination; ".cdf" is appended if missing
     * @param  spec  file options
     * @param  delete  if true an existing file at the destination is
     *                 replaced, otherwise its presence is an error
     * @throws  CdfUsageException  if the file exists and
     *          <code>delete</code> is false
     */
    public CdfWriter( File file, WriterSpec spec, boolean delete )
            throws IOException {
        this( file, spec, delete, StandardCharsets.US_ASCII );
    }

    /**
     * Creates a writer with a given text encoding for names and
     * character data.
     *
     * @param  file  destination; ".cdf" is appended if missing
     * @param  spec  file options
     * @param  delete  whether to replace an existing file
     * @param  charset  text encoding
     */
    public CdfWriter( File file, WriterSpec spec, boolean delete,
                      Charset charset ) throws IOException {
        file_ = file.getName().toLowerCase().endsWith( ".cdf" )
              ? file
              : new File( file.getPath() + ".cdf" );
        if ( file_.exists() ) {
            if ( ! delete ) {
                throw new CdfUsageException( "File " + file_
                                           + " already exists" );
            }
            else if ( ! file_.delete() ) {
                throw new IOException( "Failed to delete " + file_ );
            }
        }
        spec_ = spec;
        charset_ = charset;
        encoding_ = spec.getEncoding().resolve();
        order_ = encoding_.getByteOrder();
        zVars_ = new ArrayList<VarRef>();
        rVars_ = new ArrayList<VarRef>();
        atts_ = new ArrayList<AttRef>();
        raf_ = new RandomAccessFile( file_, "rw" );
        state_ = new WriterState( raf_ );
        cleanable_ = CLEANER.register( this, state_ );
        try {
            raf_.writeInt( CdfReader.V3_MAGIC );
            raf_.writeInt( CdfReader.UNCOMPRESSED_MAGIC );
            cdrOffset_ = writeCdr();
            gdrOffset_ = writeGdr();
        }
        catch ( IOException | RuntimeException e ) {
            cleanable_.clean();
            throw e;
        }
        logger_.config( "Creating " + file_ + " (" + encoding_ + ", "
                      + ( spec.isRowMajor() ? "row" : "column" )
                      + " major)" );
    }

    /**
     * Returns the file being written.
     *
     * @return  file
     */
    public File getFile() {
        return file_;
    }

    /**
     * Writes global attributes.
     * Entries of each attribute are linked in entry number order.
     * All names are checked before anything is written.
     *
     * @param  attrs  map from attribute name to entry number to entry;
     *                a null entry map defines the attribute without
     *                entries
     * @throws  CdfUsageException  if an attribute of the same name,
     *          of either scope, has already been written
     */
    public void writeGlobalAttrs( Map<String,Map<Integer,AttributeEntry>>
                                  attrs ) throws IOException {
        checkOpen();
        for ( String name : attrs.keySet() ) {
            AttRef existing = findAtt( name );
            if ( existing != null ) {
                throw new CdfUsageException( existing.global_
                                           ? "Global attribute " + name
                                             + " already exists"
                                           : "Attribute " + name
                                             + " already defined as a"
                                             + " variable attribute" );
            }
        }
        for ( Map.Entry<String,Map<Integer,AttributeEntry>> attEntry :
              attrs.entrySet() ) {
            String name = attEntry.getKey();
            AttRef att = writeAdr( name, true );
            Map<Integer,AttributeEntry> entries = attEntry.getValue();
            if ( entries != null ) {
                for ( Map.Entry<Integer,AttributeEntry> entry :
                      new TreeMap<Integer,AttributeEntry>( entries )
                     .entrySet() ) {
                    int entryNum = entry.getKey().intValue();
                    if ( entryNum < 0 ) {
                        throw new CdfUsageException( "Bad entry number "
                                                   + entryNum + " for "
                                                   + name );
                    }
                    writeEntry( att, false, entryNum, entry.getValue() );
                }
            }
        }
    }

    /**
     * Writes variable attribute entries addressed by variable name.
     * Attributes not yet defined are created.
     *
     * @param  attrs  map from attribute name to variable name to entry
     * @throws  CdfUsageException  if a name is already used by a global
     *          attribute
     * @throws  CdfNotFoundException  if a named variable has not been
     *          written
     */
    public void writeVariableAttrs( Map<String,Map<String,AttributeEntry>>
                                    attrs ) throws IOException {
        checkOpen();
        checkVariableAttNames( attrs.keySet() );
        for ( Map.Entry<String,Map<String,AttributeEntry>> attEntry :
              attrs.entrySet() ) {
            AttRef att = getVariableAtt( attEntry.getKey() );
            if ( attEntry.getValue() != null ) {
                for ( Map.Entry<String,AttributeEntry> entry :
                      attEntry.getValue().entrySet() ) {
                    VarRef var = findVar( entry.getKey() );
                    if ( var == null ) {
                        throw new CdfNotFoundException( "Variable "
                                                      + entry.getKey()
                                                      + " not found" );
                    }
                    writeEntry( att, var.z_, var.num_, entry.getValue() );
                }
            }
        }
    }

    /**
     * Writes variable attribute entries addressed by variable number.
     *
     * @param  attrs  map from attribute name to variable number to entry
     * @throws  CdfUsageException  if the file has both r and zVariables,
     *          or a name is already used by a global attribute
     * @throws  CdfNotFoundException  if a variable number is out of range
     */
    public void writeVariableAttrsByNumber(
            Map<String,Map<Integer,AttributeEntry>> attrs )
            throws IOException {
        checkOpen();
        checkVariableAttNames( attrs.keySet() );
        for ( Map.Entry<String,Map<Integer,AttributeEntry>> attEntry :
              attrs.entrySet() ) {
            AttRef att = getVariableAtt( attEntry.getKey() );
            if ( attEntry.getValue() != null ) {
                for ( Map.Entry<Integer,AttributeEntry> entry :
                      attEntry.getValue().entrySet() ) {
                    VarRef var = getVar( entry.getKey().intValue() );
                    writeEntry( att, var.z_, var.num_, entry.getValue() );
                }
            }
        }
    }

    /**
     * Writes a variable, with optional attribute entries and data.
     *
     * <p>For a non-sparse variable the data is a value array, nested
     * array or scalar covering whole records, each record in row-major
     * order.  For a sparse variable it is a {@link SparseRecords}.
     *
     * @param  vspec  variable declaration
     * @param  attrs  variable attribute entries for this variable,
     *                or null
     * @param  data  variable data, or null
     * @throws  CdfUsageException  if the variable exists,
     *          an attribute name is used by a global attribute,
     *          the declaration is invalid or the data is malformed
     */
    public void writeVar( VariableSpec vspec, Map<String,AttributeEntry> attrs,
                          Object data ) throws IOException {
        checkOpen();
        String name = vspec.getName();
        if ( findVar( name ) != null ) {
            throw new CdfUsageException( "Variable " + name
                                       + " already exists" );
        }
        DataType dataType = vspec.getDataType();
        int numElems = vspec.getNumElems();
        if ( dataType.isCharacter() ? numElems < 1 : numElems != 1 ) {
            throw new CdfUsageException( "Invalid element count " + numElems
                                       + " for " + dataType.getToken()
                                       + " variable " + name );
        }
        boolean sparse = vspec.getSparse() != SparseMode.NO_SPARSE;
        if ( data != null && sparse != ( data instanceof SparseRecords ) ) {
            throw new CdfUsageException( sparse
                                       ? "Sparse variable " + name
                                         + " needs SparseRecords data"
                                       : "SparseRecords data given for "
                                         + "non-sparse variable " + name );
        }
        if ( attrs != null ) {
            checkVariableAttNames( attrs.keySet() );
        }
        VarRef var = writeVdr( vspec );
        if ( attrs != null ) {
            for ( Map.Entry<String,AttributeEntry> entry : attrs.entrySet() ) {
                writeEntry( getVariableAtt( entry.getKey() ), var.z_,
                            var.num_, entry.getValue() );
            }
        }
        if ( data != null ) {
            int maxRec = sparse
                       ? writeSparseData( var, (SparseRecords) data )
                       : writeData( var, vspec, data );
            if ( ! var.z_ ) {
                long rMaxRecOff = gdrOffset_ + 52;
                if ( readInt( rMaxRecOff ) < maxRec ) {
                    patchInt( rMaxRecOff, maxRec );
                }
            }
        }
    }

    /**
     * Finishes the file.  The GDR end of file field is filled in,
     * then whole-file compression and the checksum are applied
     * if requested.  Calling this more than once has no further effect.
     */
    public void close() throws IOException {
        if ( closed_ ) {
            return;
        }
        closed_ = true;
        try {
            long eof = raf_.length();
            patchLong( gdrOffset_ + 36, eof );
            if ( spec_.getCompressionLevel() > 0 ) {
                File staging = writeCompressedCopy( eof );
                if ( spec_.hasChecksum() ) {
                    try ( RandomAccessFile sraf =
                              new RandomAccessFile( staging, "rw" ) ) {
                        appendDigest( sraf );
                    }
                }
                raf_.close();
                Files.move( staging.toPath(), file_.toPath(),
                            StandardCopyOption.REPLACE_EXISTING );
            }
            else {
                if ( spec_.hasChecksum() ) {
                    appendDigest( raf_ );
                }
                raf_.close();
            }
            logger_.config( "Closed " + file_ + " (" + file_.length()
                          + " bytes)" );
        }
        finally {
            cleanable_.clean();
        }
    }

    private void checkOpen() {
        if ( closed_ ) {
            throw new CdfUsageException( "Writer for " + file_
                                       + " is closed" );
        }
    }

    /* Data writing. */

    /**
     * Writes the data of a non-sparse variable.
     *
     * @param  var  variable
     * @param  vspec  declaration
     * @param  data  user data
     * @return  last record written
     */
    private int writeData( VarRef var, VariableSpec vspec, Object data )
            throws IOException {
        Object values = toValueArray( var.dataType_, data );
        int nrec = countRecords( var, values );
        if ( ! vspec.isRecVary() && nrec > 1 ) {
            throw new CdfUsageException( "Non-varying variable " + var.name_
                                       + " takes one record, not " + nrec );
        }
        if ( nrec == 0 ) {
            return -1;
        }
        byte[] bytes = encodeRecords( var, values, nrec );
        int recSize = var.getRecordSize();
        List<IndexEntry> blocks = new ArrayList<IndexEntry>();
        int level = vspec.getCompressionLevel();
        if ( level > 0 ) {
            int bf = Math.max( vspec.getBlockingFactor(),
                               ( BLOCKING_BYTES + recSize - 1 ) / recSize );
            bf = Math.max( 1, Math.min( bf, nrec ) );
            patchInt( var.offset_ + 80, bf );
            int ncomp = 0;
            for ( int irec = 0; irec < nrec; irec += bf ) {
                int last = Math.min( irec + bf, nrec ) - 1;
                byte[] raw = new byte[ ( last - irec + 1 ) * recSize ];
                System.arraycopy( bytes, irec * recSize, raw, 0, raw.length );
                byte[] cdata = Compression.GZIP.compress( raw, level );
                final long off;
                if ( cdata.length < raw.length ) {
                    off = writeCvvr( cdata );
                    ncomp++;
                }
                else {
                    off = writeVvr( raw );
                }
                blocks.add( new IndexEntry( irec, last, off ) );
            }
            logger_.fine( var.name_ + ": " + blocks.size() + " blocks of "
                        + bf + " records, " + ncomp + " compressed" );
        }
        else {
            blocks.add( new IndexEntry( 0, nrec - 1, writeVvr( bytes ) ) );
        }
        writeIndex( var, blocks );
        patchInt( var.offset_ + 24, nrec - 1 );
        return nrec - 1;
    }

    /**
     * Writes the data of a sparse variable, one VVR for each run of
     * consecutive physical records.
     *
     * @param  var  variable
     * @param  sparse  sparse data
     * @return  last record written
     */
    private int writeSparseData( VarRef var, SparseRecords sparse )
            throws IOException {
        int[] recs = sparse.getRecords();
        Object values = toValueArray( var.dataType_, sparse.getData() );
        int nval = countRecords( var, values );
        int maxRec = recs[ recs.length - 1 ];
        final boolean withVirtual;
        if ( nval == recs.length ) {
            withVirtual = false;
        }
        else if ( nval > maxRec ) {
            withVirtual = true;
        }
        else {
            throw new CdfUsageException( "Sparse data for " + var.name_
                                       + " has " + nval + " records for "
                                       + recs.length + " physical records"
                                       + " up to " + maxRec );
        }
        byte[] bytes = encodeRecords( var, values, nval );
        int recSize = var.getRecordSize();
        int iphys = 0;
        for ( int[] run : sparse.getRuns() ) {
            int nr = run[ 1 ] - run[ 0 ] + 1;
            int istart = withVirtual ? run[ 0 ] : iphys;
            byte[] raw = new byte[ nr * recSize ];
            System.arraycopy( bytes, istart * recSize, raw, 0, raw.length );
            long vvrOff = writeVvr( raw );
            addSparseEntry( var, run[ 0 ], run[ 1 ], vvrOff );
            iphys += nr;
            if ( readInt( var.offset_ + 24 ) < run[ 1 ] ) {
                patchInt( var.offset_ + 24, run[ 1 ] );
            }
        }
        return maxRec;
    }

    /**
     * Works out how many whole records a value array holds.
     *
     * @param  var  variable
     * @param  values  flat value array
     * @return  record count
     */
    private int countRecords( VarRef var, Object values ) {
        int nitem = Array.getLength( values );
        int perRec = var.getItemsPerRecord();
        if ( nitem % perRec != 0 ) {
            throw new CdfUsageException( "Data for " + var.name_ + " has "
                                       + nitem + " values, not a multiple"
                                       + " of the record size " + perRec );
        }
        return nitem / perRec;
    }

    /**
     * Encodes records, rearranging into column-major order if required.
     *
     * @param  var  variable
     * @param  values  row-major value array
     * @param  nrec  record count
     * @return  encoded bytes
     */
    private byte[] encodeRecords( VarRef var, Object values, int nrec ) {
        Object stored = Shaper.createShaper( var.dataType_, var.recordDims_,
                                             spec_.isRowMajor() )
                              .fromRowMajor( values, nrec );
        return var.dataType_.encode( stored, var.numElems_, order_, charset_ );
    }

    /**
     * Indexes the blocks of a non-sparse variable with a chain of
     * leaf VXRs, adding upper levels if the chain is long.
     *
     * @param  var  variable
     * @param  blocks  data blocks in record order
     */
    private void writeIndex( VarRef var, List<IndexEntry> blocks )
            throws IOException {
        List<IndexEntry> vxrs = new ArrayList<IndexEntry>();
        long vxrOff = 0;
        for ( int ib = 0; ib < blocks.size(); ib++ ) {
            IndexEntry block = blocks.get( ib );
            if ( ib % NUM_VXR_ENTRIES == 0 ) {
                long prevOff = vxrOff;
                vxrOff = writeVxr( NUM_VXR_ENTRIES );
                if ( prevOff == 0 ) {
                    patchLong( var.offset_ + 28, vxrOff );
                }
                else {
                    patchLong( prevOff + 12, vxrOff );
                }
                patchLong( var.offset_ + 36, vxrOff );
                vxrs.add( new IndexEntry( block.first_, block.last_,
                                          vxrOff ) );
            }
            useVxrEntry( vxrOff, block.first_, block.last_, block.offset_ );
            vxrs.get( vxrs.size() - 1 ).last_ = block.last_;
        }
        if ( vxrs.size() > NUM_VXRLVL_ENTRIES ) {
            addVxrLevels( var, vxrs );
        }
    }

    /**
     * Builds upper levels of VXRs over a chain of VXRs until a level
     * has no more than {@link #NUM_VXRLVL_ENTRIES} members.
     * Each parent points down at up to that many children, and the
     * horizontal links between the children are cut.
     *
     * @param  var  variable
     * @param  level  VXR chain, with the record range of each
     */
    private void addVxrLevels( VarRef var, List<IndexEntry> level )
            throws IOException {
        int depth = 1;
        while ( level.size() > NUM_VXRLVL_ENTRIES ) {
            List<IndexEntry> parents = new ArrayList<IndexEntry>();
            for ( int i = 0; i < level.size(); i += NUM_VXRLVL_ENTRIES ) {
                List<IndexEntry> children =
                    level.subList( i, Math.min( i + NUM_VXRLVL_ENTRIES,
                                                level.size() ) );
                long parentOff = writeVxr( NUM_VXRLVL_ENTRIES );
                for ( IndexEntry child : children ) {
                    useVxrEntry( parentOff, child.first_, child.last_,
                                 child.offset_ );
                }
                if ( ! parents.isEmpty() ) {
                    patchLong( parents.get( parents.size() - 1 ).offset_ + 12,
                               parentOff );
                }
                parents.add( new IndexEntry( children.get( 0 ).first_,
                                             children.get( children.size()
                                                           - 1 ).last_,
                                             parentOff ) );
            }
            for ( IndexEntry child : level ) {
                patchLong( child.offset_ + 12, 0 );
            }
            level = parents;
            depth++;
        }
        patchLong( var.offset_ + 28, level.get( 0 ).offset_ );
        patchLong( var.offset_ + 36, level.get( level.size() - 1 ).offset_ );
        logger_.fine( var.name_ + ": VXR tree depth " + depth );
    }

    /**
     * Indexes one sparse block, using a free slot in an existing VXR
     * if there is one, else appending a new VXR to the chain.
     *
     * @param  var  variable
     * @param  first  first record
     * @param  last  last record
     * @param  vvrOff  VVR offset
     */
    private void addSparseEntry( VarRef var, int first, int last,
                                 long vvrOff ) throws IOException {
        long vxrOff = readLong( var.offset_ + 28 );
        long prevOff = 0;
        while ( vxrOff > 0 ) {
            if ( readInt( vxrOff + 24 ) < readInt( vxrOff + 20 ) ) {
                useVxrEntry( vxrOff, first, last, vvrOff );
                return;
            }
            prevOff = vxrOff;
            vxrOff = readLong( vxrOff + 12 );
        }
        long newOff = writeVxr( NUM_VXR_ENTRIES );
        useVxrEntry( newOff, first, last, vvrOff );
        if ( prevOff == 0 ) {
            patchLong( var.offset_ + 28, newOff );
        }
        else {
            patchLong( prevOff + 12, newOff );
        }
        patchLong( var.offset_ + 36, newOff );
    }

    /**
     * Fills the next unused entry of a VXR.
     *
     * @param  vxrOff  VXR offset
     * @param  first  first record
     * @param  last  last record
     * @param  offset  offset of the VVR, CVVR or lower VXR
     */
    private void useVxrEntry( long vxrOff, int first, int last, long offset )
            throws IOException {
        int nEntries = readInt( vxrOff + 20 );
        int nUsed = readInt( vxrOff + 24 );
        patchInt( vxrOff + VXR_BASE_SIZE + 4 * nUsed, first );
        patchInt( vxrOff + VXR_BASE_SIZE + 4 * nEntries + 4 * nUsed, last );
        patchLong( vxrOff + VXR_BASE_SIZE + 8 * nEntries + 8 * nUsed,
                   offset );
        patchInt( vxrOff + 24, nUsed + 1 );
    }

    /* Attribute writing. */

    /**
     * Checks that none of the given names belongs to a global attribute.
     *
     * @param  names  variable attribute names
     * @throws  CdfUsageException  on a scope collision
     */
    private void checkVariableAttNames( Collection<String> names ) {
        for ( String name : names ) {
            AttRef att = findAtt( name );
            if ( att != null && att.global_ ) {
                throw new CdfUsageException( "Attribute " + name
                                           + " already defined as a"
                                           + " global attribute" );
            }
        }
    }

    /**
     * Returns the variable attribute of a given name, creating it if
     * necessary.
     *
     * @param  name  attribute name
     * @return  attribute
     * @throws  CdfUsageException  if the name is taken by a global one
     */
    private AttRef getVariableAtt( String name ) throws IOException {
        checkVariableAttNames( Collections.singleton( name ) );
        AttRef att = findAtt( name );
        return att == null ? writeAdr( name, false ) : att;
    }

    /**
     * Writes an AEDR and links it into an attribute's entry chain.
     *
     * @param  att  attribute
     * @param  z  true for a zVariable entry
     * @param  entryNum  entry number
     * @param  entry  entry value
     */
    private void writeEntry( AttRef att, boolean z, int entryNum,
                             AttributeEntry entry ) throws IOException {
        if ( entry == null || entry.getValue() == null ) {
            return;
        }
        if ( findEntryOffset( att, z, entryNum ) > 0 ) {
            throw new CdfUsageException( "Entry " + entryNum
                                       + " of attribute " + att.name_
                                       + " already written" );
        }
        EncodedEntry enc = encodeEntry( entry );
        ByteBuffer rec =
            createRecord( AEDR_BASE_SIZE + enc.bytes_.length,
                          z ? RecordDecoder.AZEDR : RecordDecoder.AGREDR );
        rec.putLong( 0 )
           .putInt( att.num_ )
           .putInt( enc.dataType_.getCode() )
           .putInt( entryNum )
           .putInt( enc.numElems_ )
           .putInt( enc.numStrings_ )
           .putInt( 0 )
           .putInt( 0 )
           .putInt( -1 )
           .putInt( -1 )
           .put( enc.bytes_ );
        long aedrOff = append( rec );
        linkEntry( att, z, entryNum, aedrOff );
    }

    /**
     * Links an AEDR into an attribute's entry chain so that the chain
     * stays in ascending entry number order, and updates the counts.
     *
     * @param  att  attribute
     * @param  z  true for the zEntry chain
     * @param  entryNum  entry number
     * @param  aedrOff  AEDR offset
     */
    private void linkEntry( AttRef att, boolean z, int entryNum,
                            long aedrOff ) throws IOException {
        long headOff = att.offset_ + ( z ? 48 : 20 );
        long countOff = att.offset_ + ( z ? 56 : 36 );
        long maxOff = att.offset_ + ( z ? 60 : 40 );
        int count = readInt( countOff );
        long prev = 0;
        long cur = count > 0 ? readLong( headOff ) : 0;
        for ( int ie = 0; ie < count && cur != 0; ie++ ) {
            if ( readInt( cur + 28 ) > entryNum ) {
                break;
            }
            prev = cur;
            cur = readLong( cur + 12 );
        }
        patchLong( aedrOff + 12, cur );
        patchLong( prev == 0 ? headOff : prev + 12, aedrOff );
        patchInt( countOff, count + 1 );
        if ( readInt( maxOff ) < entryNum ) {
            patchInt( maxOff, entryNum );
        }
    }

    private long findEntryOffset( AttRef att, boolean z, int entryNum )
            throws IOException {
        int count = readInt( att.offset_ + ( z ? 56 : 36 ) );
        long cur = count > 0 ? readLong( att.offset_ + ( z ? 48 : 20 ) ) : 0;
        for ( int ie = 0; ie < count && cur != 0; ie++ ) {
            if ( readInt( cur + 28 ) == entryNum ) {
                return cur;
            }
            cur = readLong( cur + 12 );
        }
        return 0;
    }

    /**
     * Works out the data type, element count and bytes for an entry.
     *
     * @param  entry  entry
     * @return  encoded entry
     */
    private EncodedEntry encodeEntry( AttributeEntry entry ) {
        Object value = entry.getValue();
        DataType dataType = entry.getDataType() == null
                          ? inferDataType( value )
                          : entry.getDataType();
        if ( dataType.isCharacter() ) {
            final String txt;
            final int nstr;
            if ( value instanceof String ) {
                txt = (String) value;
                nstr = 1;
            }
            else if ( value instanceof String[] ) {
                String[] txts = (String[]) value;
                txt = String.join( STRING_SEP, txts );
                nstr = Math.max( 1, txts.length );
            }
            else {
                throw new CdfUsageException( "Non-string value for "
                                           + dataType.getToken()
                                           + " entry" );
            }
            byte[] bytes = txt.getBytes( charset_ );
            if ( bytes.length == 0 ) {
                bytes = new byte[] { (byte) ' ' };
            }
            return new EncodedEntry( dataType, bytes.length, nstr, bytes );
        }
        else {
            Object values = toValueArray( dataType, value );
            int nitem = Array.getLength( values ) / dataType.getGroupSize();
            if ( nitem == 0 ) {
                throw new CdfUsageException( "Empty attribute entry" );
            }
            return new EncodedEntry( dataType, nitem, 0,
                                     dataType.encode( values, 1, order_,
                                                      charset_ ) );
        }
    }

    /**
     * Picks a data type for an attribute value given without one.
     *
     * @param  value  value
     * @return  data type
     */
    private static DataType inferDataType( Object value ) {
        Class<?> clazz = getLeafClass( value );
        if ( clazz == String.class ) {
            return DataType.CHAR;
        }
        else if ( clazz == Epoch16.class ) {
            return DataType.EPOCH16;
        }
        else if ( clazz == Double.class || clazz == double.class
               || clazz == Float.class || clazz == float.class ) {
            return DataType.DOUBLE;
        }
        else if ( clazz == Boolean.class || clazz == boolean.class ) {
            return DataType.INT1;
        }
        else if ( clazz != null
                  && ( Number.class.isAssignableFrom( clazz )
                       || clazz == long.class || clazz == int.class
                       || clazz == short.class || clazz == byte.class ) ) {
            long[] lvals = (long[]) DataType.INT8.toValueArray( value );
            for ( long lval : lvals ) {
                if ( lval < Integer.MIN_VALUE || lval > Integer.MAX_VALUE ) {
                    return DataType.INT8;
                }
            }
            return DataType.INT4;
        }
        else {
            throw new CdfUsageException( "Can't infer data type for "
                                       + ( clazz == null ? "empty value"
                                                         : clazz.getName() ) );
        }
    }

    private static Class<?> getLeafClass( Object value ) {
        if ( value == null ) {
            return null;
        }
        Class<?> clazz = value.getClass();
        if ( ! clazz.isArray() ) {
            return clazz;
        }
        else if ( clazz.getComponentType().isPrimitive() ) {
            return clazz.getComponentType();
        }
        else {
            return Array.getLength( value ) == 0
                 ? null
                 : getLeafClass( Array.get( value, 0 ) );
        }
    }

    /**
     * Converts user data to a flat value array of a type's class.
     * Epoch16 objects become (real, imaginary) pairs, and strings given
     * for epoch types are parsed.
     *
     * @param  dataType  target type
     * @param  data  user data
     * @return  value array
     */
    private Object toValueArray( DataType dataType, Object data )
            throws CdfUsageException {
        if ( dataType.isEpoch() ) {
            if ( data instanceof String ) {
                data = new Object[] { parseEpoch( dataType, (String) data ) };
            }
            else if ( data instanceof String[] ) {
                String[] txts = (String[]) data;
                Object[] vals = new Object[ txts.length ];
                for ( int i = 0; i < txts.length; i++ ) {
                    vals[ i ] = parseEpoch( dataType, txts[ i ] );
                }
                data = vals;
            }
            if ( dataType == DataType.EPOCH16 ) {
                if ( data instanceof Epoch16 ) {
                    data = new Object[] { data };
                }
                if ( data instanceof Object[] ) {
                    Object[] items = (Object[]) data;
                    if ( items.length > 0 && items[ 0 ] instanceof Epoch16 ) {
                        double[] pairs = new double[ 2 * items.length ];
                        for ( int i = 0; i < items.length; i++ ) {
                            if ( ! ( items[ i ] instanceof Epoch16 ) ) {
                                throw new CdfUsageException( "Mixed EPOCH16"
                                                           + " values" );
                            }
                            Epoch16 e16 = (Epoch16) items[ i ];
                            pairs[ 2 * i ] = e16.getReal();
                            pairs[ 2 * i + 1 ] = e16.getImag();
                        }
                        return pairs;
                    }
                }
            }
        }
        return dataType.toValueArray( data );
    }

    private Object parseEpoch( DataType dataType, String txt ) {
        Object value = getEpochCodec().parse( txt );
        boolean ok = dataType == DataType.EPOCH ? value instanceof Double
                   : dataType == DataType.EPOCH16 ? value instanceof Epoch16
                   : value instanceof Long;
        if ( ! ok ) {
            throw new CdfUsageException( "\"" + txt + "\" is not a "
                                       + dataType.getToken() + " string" );
        }
        return value;
    }

    private EpochCodec getEpochCodec() {
        if ( codec_ == null ) {
            try {
                codec_ = new EpochCodec();
            }
            catch ( IOException e ) {
                throw new CdfUsageException( "Can't load leap second table",
                                             e );
            }
        }
        return codec_;
    }

    /* Record writing. */

    private long writeCdr() throws IOException {
        int flags = 0;
        if ( spec_.isRowMajor() ) {
            flags |= 1 << 0;
        }
        flags |= 1 << 1;
        if ( spec_.hasChecksum() ) {
            flags |= 1 << 2;
            flags |= 1 << 3;
        }
        ByteBuffer rec = createRecord( CDR_SIZE, RecordDecoder.CDR );
        rec.putLong( 8 + CDR_SIZE )
           .putInt( VERSION )
           .putInt( RELEASE )
           .putInt( encoding_.getCode() )
           .putInt( flags )
           .putInt( 0 )
           .putInt( 0 )
           .putInt( INCREMENT )
           .putInt( 2 )
           .putInt( -1 )
           .put( toField( COPYRIGHT, NAME_LENG ) );
        return append( rec );
    }

    private long writeGdr() throws IOException {
        int[] rDimSizes = spec_.getRDimSizes();
        int size = GDR_BASE_SIZE + 4 * rDimSizes.length;
        long offset = raf_.length();
        ByteBuffer rec = createRecord( size, RecordDecoder.GDR );
        rec.putLong( 0 )
           .putLong( 0 )
           .putLong( 0 )
           .putLong( offset + size )
           .putInt( 0 )
           .putInt( 0 )
           .putInt( -1 )
           .putInt( rDimSizes.length )
           .putInt( 0 )
           .putLong( 0 )
           .putInt( 0 )
           .putInt( LEAP_SECOND_LAST_UPDATED )
           .putInt( -1 );
        for ( int dimSize : rDimSizes ) {
            rec.putInt( dimSize );
        }
        return append( rec );
    }

    /**
     * Appends an ADR and links it to the attribute chain.
     *
     * @param  name  attribute name
     * @param  global  true for global scope
     * @return  new attribute
     */
    private AttRef writeAdr( String name, boolean global )
            throws IOException {
        int num = atts_.size();
        ByteBuffer rec = createRecord( ADR_SIZE, RecordDecoder.ADR );
        rec.putLong( 0 )
           .putLong( 0 )
           .putInt( global ? 1 : 2 )
           .putInt( num )
           .putInt( 0 )
           .putInt( -1 )
           .putInt( 0 )
           .putLong( 0 )
           .putInt( 0 )
           .putInt( -1 )
           .putInt( -1 )
           .put( toField( name, NAME_LENG ) );
        long offset = append( rec );
        if ( num > 0 ) {
            patchLong( atts_.get( num - 1 ).offset_ + 12, offset );
        }
        else {
            patchLong( gdrOffset_ + 28, offset );
        }
        patchInt( gdrOffset_ + 48, num + 1 );
        AttRef att = new AttRef( name, num, global, offset );
        atts_.add( att );
        return att;
    }

    /**
     * Appends a VDR, and a CPR if the variable is compressed,
     * and links it to the variable chain of its kind.
     * Sparse variables are never compressed.
     *
     * @param  vspec  declaration
     * @return  new variable
     */
    private VarRef writeVdr( VariableSpec vspec ) throws IOException {
        String name = vspec.getName();
        DataType dataType = vspec.getDataType();
        boolean z = vspec.isZVariable();
        final int[] dimSizes;
        final boolean[] dimVarys;
        if ( z ) {
            dimSizes = vspec.getDimSizes();
            dimVarys = new boolean[ dimSizes.length ];
            Arrays.fill( dimVarys, true );
        }
        else {
            dimSizes = spec_.getRDimSizes();
            boolean[] varys = vspec.getDimVarys();
            if ( varys == null && dimSizes.length == 0 ) {
                varys = new boolean[ 0 ];
            }
            if ( varys == null || varys.length != dimSizes.length ) {
                throw new CdfUsageException( "rVariable " + name + " needs "
                                           + dimSizes.length
                                           + " dimension variances" );
            }
            dimVarys = varys;
        }
        for ( int dimSize : dimSizes ) {
            if ( dimSize < 1 ) {
                throw new CdfUsageException( "Bad dimension size " + dimSize
                                           + " for " + name );
            }
        }
        byte[] pad = encodePad( vspec );
        int level = vspec.getSparse() == SparseMode.NO_SPARSE
                  ? vspec.getCompressionLevel()
                  : 0;
        long cprOff = level > 0 ? writeCpr( Compression.GZIP.getCType(),
                                            level )
                                : -1;
        int flags = 0;
        if ( vspec.isRecVary() ) {
            flags |= 1 << 0;
        }
        flags |= 1 << 1;
        if ( level > 0 ) {
            flags |= 1 << 2;
        }
        List<VarRef> vars = z ? zVars_ : rVars_;
        int num = vars.size();
        int ndim = dimSizes.length;
        int size = VDR_BASE_SIZE + ( z ? 4 + 8 * ndim : 4 * ndim )
                 + pad.length;
        ByteBuffer rec = createRecord( size, z ? RecordDecoder.ZVDR
                                               : RecordDecoder.RVDR );
        rec.putLong( 0 )
           .putInt( dataType.getCode() )
           .putInt( -1 )
           .putLong( 0 )
           .putLong( 0 )
           .putInt( flags )
           .putInt( vspec.getSparse().getCode() )
           .putInt( 0 )
           .putInt( -1 )
           .putInt( -1 )
           .putInt( vspec.getNumElems() )
           .putInt( num )
           .putLong( cprOff )
           .putInt( Math.max( 1, vspec.getBlockingFactor() ) )
           .put( toField( name, NAME_LENG ) );
        if ( z ) {
            rec.putInt( ndim );
            for ( int dimSize : dimSizes ) {
                rec.putInt( dimSize );
            }
        }
        for ( boolean vary : dimVarys ) {
            rec.putInt( vary ? VARY : NOVARY );
        }
        rec.put( pad );
        long offset = append( rec );
        if ( num > 0 ) {
            patchLong( vars.get( num - 1 ).offset_ + 12, offset );
        }
        else {
            patchLong( gdrOffset_ + ( z ? 20 : 12 ), offset );
        }
        patchInt( gdrOffset_ + ( z ? 60 : 44 ), num + 1 );
        int nvary = 0;
        for ( boolean vary : dimVarys ) {
            nvary += vary ? 1 : 0;
        }
        int[] recordDims = new int[ nvary ];
        for ( int i = 0, j = 0; i < ndim; i++ ) {
            if ( dimVarys[ i ] ) {
                recordDims[ j++ ] = dimSizes[ i ];
            }
        }
        VarRef var = new VarRef( name, num, z, offset, dataType,
                                 vspec.getNumElems(), recordDims );
        vars.add( var );
        logger_.fine( "Variable " + name + " (" + dataType.getToken()
                    + ( z ? ", z" : ", r" ) + ") at 0x"
                    + Long.toHexString( offset ) );
        return var;
    }

    /**
     * Encodes the pad value of a variable.
     *
     * @param  vspec  declaration
     * @return  bytes of one value
     */
    private byte[] encodePad( VariableSpec vspec ) {
        DataType dataType = vspec.getDataType();
        Object pad = vspec.getPad();
        if ( pad == null ) {
            return dataType.getDefaultPadBytes( vspec.getNumElems(), order_ );
        }
        Object values = dataType.isCharacter()
                      ? new String[] { pad.toString() }
                      : toValueArray( dataType, pad );
        if ( Array.getLength( values ) != dataType.getGroupSize() ) {
            throw new CdfUsageException( "Pad for " + vspec.getName()
                                       + " must be a single value" );
        }
        return dataType.encode( values, vspec.getNumElems(), order_,
                                charset_ );
    }

    private long writeCpr( int cType, int level ) throws IOException {
        ByteBuffer rec = createRecord( CPR_SIZE, RecordDecoder.CPR );
        rec.putInt( cType )
           .putInt( 0 )
           .putInt( 1 )
           .putInt( level );
        return append( rec );
    }

    private long writeVxr( int nEntries ) throws IOException {
        ByteBuffer rec = createRecord( VXR_BASE_SIZE + 16 * nEntries,
                                       RecordDecoder.VXR );
        rec.putLong( 0 )
           .putInt( nEntries )
           .putInt( 0 );
        for ( int i = 0; i < 2 * nEntries; i++ ) {
            rec.putInt( -1 );
        }
        for ( int i = 0; i < nEntries; i++ ) {
            rec.putLong( -1 );
        }
        return append( rec );
    }

    private long writeVvr( byte[] data ) throws IOException {
        ByteBuffer rec = createRecord( VVR_BASE_SIZE + data.length,
                                       RecordDecoder.VVR );
        rec.put( data );
        return append( rec );
    }

    private long writeCvvr( byte[] cdata ) throws IOException {
        ByteBuffer rec = createRecord( CVVR_BASE_SIZE + cdata.length,
                                       RecordDecoder.CVVR );
        rec.putInt( 0 )
           .putLong( cdata.length )
           .put( cdata );
        return append( rec );
    }

    /**
     * Writes a whole-file compressed copy of the finished uncompressed
     * file to a staging file alongside it.
     *
     * @param  eof  length of the uncompressed file
     * @return  staging file
     */
    private File writeCompressedCopy( long eof ) throws IOException {
        File dir = file_.getAbsoluteFile().getParentFile();
        File staging = File.createTempFile( "cdfio", ".tmp", dir );
        state_.staging_ = staging;
        int level = spec_.getCompressionLevel();
        try ( OutputStream fout =
                  new BufferedOutputStream( new FileOutputStream( staging ) ) ) {
            ByteBuffer head = ByteBuffer.allocate( 8 + CCR_BASE_SIZE );
            fout.write( head.array() );
            raf_.seek( 8 );
            InputStream in = Channels.newInputStream( raf_.getChannel() );
            OutputStream cout =
                Compression.GZIP.compressStream( new NonClosingStream( fout ),
                                                 level );
            in.transferTo( cout );
            cout.close();
        }
        long cSize = staging.length() - 8 - CCR_BASE_SIZE;
        try ( RandomAccessFile sraf = new RandomAccessFile( staging, "rw" ) ) {
            long cprOff = 8 + CCR_BASE_SIZE + cSize;
            ByteBuffer head = ByteBuffer.allocate( 8 + CCR_BASE_SIZE );
            head.putInt( CdfReader.V3_MAGIC )
                .putInt( CdfReader.COMPRESSED_MAGIC )
                .putLong( CCR_BASE_SIZE + cSize )
                .putInt( RecordDecoder.CCR )
                .putLong( cprOff )
                .putLong( eof - 8 )
                .putInt( 0 );
            sraf.seek( 0 );
            sraf.write( head.array() );
            ByteBuffer cpr = createRecord( CPR_SIZE, RecordDecoder.CPR );
            cpr.putInt( Compression.GZIP.getCType() )
               .putInt( 0 )
               .putInt( 1 )
               .putInt( level );
            sraf.seek( cprOff );
            sraf.write( cpr.array() );
        }
        logger_.config( "Compressed " + eof + " bytes to "
                      + staging.length() );
        return staging;
    }

    /**
     * Appends the MD5 digest of a file's current contents to it.
     *
     * @param  raf  file
     */
    private static void appendDigest( RandomAccessFile raf )
            throws IOException {
        MessageDigest md5;
        try {
            md5 = MessageDigest.getInstance( "MD5" );
        }
        catch ( NoSuchAlgorithmException e ) {
            throw new IOException( "MD5 not available", e );
        }
        long leng = raf.length();
        byte[] chunk = new byte[ 64 * 1024 ];
        raf.seek( 0 );
        for ( long pos = 0; pos < leng; ) {
            int n = raf.read( chunk, 0,
                              (int) Math.min( chunk.length, leng - pos ) );
            if ( n < 0 ) {
                throw new IOException( "Unexpected end of file" );
            }
            md5.update( chunk, 0, n );
            pos += n;
        }
        raf.seek( leng );
        raf.write( md5.digest() );
    }

    /* Low-level file access.  Record fields are big-endian. */

    private static ByteBuffer createRecord( int size, int recType ) {
        ByteBuffer rec = ByteBuffer.allocate( size );
        rec.putLong( size )
           .putInt( recType );
        return rec;
    }

    private long append( ByteBuffer rec ) throws IOException {
        if ( rec.hasRemaining() ) {
            throw new IllegalStateException( "Record under-filled by "
                                           + rec.remaining() );
        }
        long offset = raf_.length();
        raf_.seek( offset );
        raf_.write( rec.array() );
        if ( logger_.isLoggable( Level.FINE ) ) {
            logger_.fine( "Wrote record type " + rec.getInt( 8 ) + " at 0x"
                        + Long.toHexString( offset ) + " +"
                        + rec.capacity() );
        }
        return offset;
    }

    private void patchInt( long offset, int value ) throws IOException {
        raf_.seek( offset );
        raf_.writeInt( value );
    }

    private void patchLong( long offset, long value ) throws IOException {
        raf_.seek( offset );
        raf_.writeLong( value );
    }

    private int readInt( long offset ) throws IOException {
        raf_.seek( offset );
        return raf_.readInt();
    }

    private long readLong( long offset ) throws IOException {
        raf_.seek( offset );
        return raf_.readLong();
    }

    /**
     * Encodes a string into a fixed-width NUL-padded field.
     *
     * @param  txt  string
     * @param  leng  field width
     * @return  field bytes
     */
    private byte[] toField( String txt, int leng ) {
        byte[] bytes = txt.getBytes( charset_ );
        if ( bytes.length > leng ) {
            throw new CdfUsageException( "Name too long (" + bytes.length
                                       + " > " + leng + " bytes): " + txt );
        }
        byte[] field = new byte[ leng ];
        System.arraycopy( bytes, 0, field, 0, bytes.length );
        return field;
    }

    private VarRef findVar( String name ) {
        String target = name.trim();
        for ( List<VarRef> vars : Arrays.asList( zVars_, rVars_ ) ) {
            for ( VarRef var : vars ) {
                if ( var.name_.trim().equalsIgnoreCase( target ) ) {
                    return var;
                }
            }
        }
        return null;
    }

    private VarRef getVar( int num ) {
        if ( ! zVars_.isEmpty() && ! rVars_.isEmpty() ) {
            throw new CdfUsageException( "File has both r and zVariables; "
                                       + "use variable names" );
        }
        List<VarRef> vars = zVars_.isEmpty() ? rVars_ : zVars_;
        if ( num < 0 || num >= vars.size() ) {
            throw new CdfNotFoundException( "No variable number " + num );
        }
        return vars.get( num );
    }

    private AttRef findAtt( String name ) {
        String target = name.trim();
        for ( AttRef att : atts_ ) {
            if ( att.name_.trim().equalsIgnoreCase( target ) ) {
                return att;
            }
        }
        return null;
    }

    /**
     * Variable written so far.
     */
    private static class VarRef {
        final String name_;
        final int num_;
        final boolean z_;
        final long offset_;
        final DataType dataType_;
        final int numElems_;
        final int[] recordDims_;

        VarRef( String name, int num, boolean z, long offset,
                DataType dataType, int numElems, int[] recordDims ) {
            name_ = name;
            num_ = num;
            z_ = z;
            offset_ = offset;
            dataType_ = dataType;
            numElems_ = numElems;
            recordDims_ = recordDims;
        }

        int getValuesPerRecord() {
            int n = 1;
            for ( int dim : recordDims_ ) {
                n *= dim;
            }
            return n;
        }

        int getItemsPerRecord() {
            return getValuesPerRecord() * dataType_.getGroupSize();
        }

        int getRecordSize() {
            return getValuesPerRecord() * dataType_.getValueSize( numElems_ );
        }
    }

    /**
     * Attribute written so far.
     */
    private static class AttRef {
        final String name_;
        final int num_;
        final boolean global_;
        final long offset_;

        AttRef( String name, int num, boolean global, long offset ) {
            name_ = name;
            num_ = num;
            global_ = global;
            offset_ = offset;
        }
    }

    /**
     * Record range and offset of a data block or VXR.
     */
    private static class IndexEntry {
        final int first_;
        int last_;
        final long offset_;

        IndexEntry( int first, int last, long offset ) {
            first_ = first;
            last_ = last;
            offset_ = offset;
        }
    }

    /**
     * Attribute entry value ready for writing.
     */
    private static class EncodedEntry {
        final DataType dataType_;
        final int numElems_;
        final int numStrings_;
        final byte[] bytes_;

        EncodedEntry( DataType dataType, int numElems, int numStrings,
                      byte[] bytes ) {
            dataType_ = dataType;
            numElems_ = numElems;
            numStrings_ = numStrings;
            bytes_ = bytes;
        }
    }

    /**
     * Output stream whose close does not close the underlying stream.
     */
    private static class NonClosingStream extends FilterOutputStream {
        NonClosingStream( OutputStream out ) {
            super( out );
        }
        @Override
        public void write( byte[] b, int off, int len ) throws IOException {
            out.write( b, off, len );
        }
        @Override
        public void close() throws IOException {
            flush();
        }
    }

    /**
     * Resources released when a writer is closed or becomes unreachable.
     * Must not refer to the writer.
     */
    private static class WriterState implements Runnable {
        private final RandomAccessFile raf_;
        private volatile File staging_;

        WriterState( RandomAccessFile raf ) {
            raf_ = raf;
        }

        public void run() {
            try {
                raf_.close();
            }
            catch ( IOException e ) {
                logger_.log( Level.WARNING, "Failed to close CDF file", e );
            }
            File staging = staging_;
            if ( staging != null && staging.exists() && ! staging.delete() ) {
                logger_.warning( "Failed to delete temporary file "
                               + staging );
            }
        }
    }
}
