package io.github.mandar2812.cdfio.write;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.mandar2812.cdfio.AttributeEntry;
import io.github.mandar2812.cdfio.AttributeInfo;
import io.github.mandar2812.cdfio.CdfFormatException;
import io.github.mandar2812.cdfio.CdfInfo;
import io.github.mandar2812.cdfio.CdfNotFoundException;
import io.github.mandar2812.cdfio.CdfReader;
import io.github.mandar2812.cdfio.CdfUsageException;
import io.github.mandar2812.cdfio.DataType;
import io.github.mandar2812.cdfio.NumericEncoding;
import io.github.mandar2812.cdfio.SparseMode;
import io.github.mandar2812.cdfio.VarQuery;
import io.github.mandar2812.cdfio.VariableData;
import io.github.mandar2812.cdfio.VariableInfo;
import io.github.mandar2812.cdfio.epoch.Epoch16;
import io.github.mandar2812.cdfio.epoch.EpochCodec;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class CdfWriterTest {

    @TempDir
    Path tempDir;

    private File file;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve( "test.cdf" ).toFile();
    }

    @Test
    void writesAndReadsMultidimensionalColumnMajorData() throws IOException {
        double[][][] temps = {
            { { 1, 2, 3 }, { 4, 5, 6 } },
            { { 7, 8, 9 }, { 10, 11, 12 } },
        };
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeGlobalAttrs( globalAttr( "Project", 0, "cdfio" ) );
            Map<String,AttributeEntry> attrs =
                new LinkedHashMap<String,AttributeEntry>();
            attrs.put( "FIELDNAM", new AttributeEntry( "Temperature" ) );
            attrs.put( "UNITS", new AttributeEntry( "K" ) );
            writer.writeVar( new VariableSpec( "temp", DataType.REAL8 )
                            .zVariable( 2, 3 ),
                             attrs, temps );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            CdfInfo info = reader.getInfo();
            assertThat( info.getVersion() ).isEqualTo( "3.7.0" );
            assertThat( info.getRowMajor() ).isFalse();
            assertThat( info.getZVariables() ).containsExactly( "temp" );
            assertThat( info.getRVariables() ).isEmpty();
            assertThat( info.getAttributes() )
                .containsEntry( "Project", AttributeInfo.GLOBAL_SCOPE )
                .containsEntry( "UNITS", AttributeInfo.VARIABLE_SCOPE );

            VariableInfo var = reader.varinq( "temp" );
            assertThat( var.isZVariable() ).isTrue();
            assertThat( var.getDimSizes() ).containsExactly( 2, 3 );
            assertThat( var.getLastRec() ).isEqualTo( 1 );
            assertThat( var.getCompressionLevel() )
                .isEqualTo( VariableSpec.DEFAULT_COMPRESSION );

            VariableData data = reader.varget( "temp" );
            assertThat( data.getShape() ).containsExactly( 2, 2, 3 );
            assertThat( (double[]) data.getData() )
                .containsExactly( 1, 2, 3, 4, 5, 6, 7, 8, 9, 10, 11, 12 );
            assertThat( (double[]) data.getRecord( 1 ) )
                .containsExactly( 7, 8, 9, 10, 11, 12 );
            assertThat( data.getRealRecords() ).containsExactly( 0, 1 );

            assertThat( reader.varattsget( "temp" ).get( "UNITS" ).getValue() )
                .isEqualTo( "K" );
            assertThat( reader.attget( "FIELDNAM", "temp" ).getData() )
                .isEqualTo( "Temperature" );
            assertThat( reader.globalattsget().get( "Project" ) )
                .extracting( AttributeEntry::getValue )
                .containsExactly( "cdfio" );
        }
    }

    @Test
    void rowMajorFilesStoreRecordsAsGiven() throws IOException {
        int[] values = { 1, 2, 3, 4, 5, 6 };
        WriterSpec spec = new WriterSpec().rowMajor( true )
                                          .encoding( NumericEncoding.NETWORK );
        try ( CdfWriter writer = new CdfWriter( file, spec, false ) ) {
            writer.writeVar( new VariableSpec( "grid", DataType.INT4 )
                            .zVariable( 3, 2 ).compressionLevel( 0 ),
                             null, values );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            CdfInfo info = reader.getInfo();
            assertThat( info.getRowMajor() ).isTrue();
            assertThat( info.getMajority() ).isEqualToIgnoringCase( "row_major" );
            assertThat( info.getEncoding() ).isEqualTo( NumericEncoding.NETWORK );
            VariableData data = reader.varget( "grid" );
            assertThat( data.getRecordCount() ).isEqualTo( 1 );
            assertThat( (int[]) data.getData() ).containsExactly( values );
            assertThat( reader.varinq( "grid" ).getCompressionLevel() )
                .isZero();
        }
    }

    @Test
    void writesRVariablesWithSharedDimensions() throws IOException {
        WriterSpec spec = new WriterSpec().rDimSizes( 3 );
        try ( CdfWriter writer = new CdfWriter( file, spec, false ) ) {
            writer.writeVar( new VariableSpec( "lat", DataType.INT2 )
                            .rVariable( true ),
                             null, new short[] { -90, 0, 90, -45, 0, 45 } );
            writer.writeVar( new VariableSpec( "flag", DataType.INT1 )
                            .rVariable( false ),
                             null, new byte[] { 1, 0, 1, 1 } );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            CdfInfo info = reader.getInfo();
            assertThat( info.getRVariables() ).containsExactly( "lat", "flag" );
            assertThat( info.getRDimSizes() ).containsExactly( 3 );
            VariableInfo flag = reader.varinq( 1 );
            assertThat( flag.getName() ).isEqualTo( "flag" );
            assertThat( flag.getDimVarys() ).containsExactly( false );
            assertThat( flag.getRecordDims() ).isEmpty();
            assertThat( (short[]) reader.varget( "lat", 1, 1 ).getData() )
                .containsExactly( (short) -45, (short) 0, (short) 45 );
            assertThat( (byte[]) reader.varget( "flag" ).getData() )
                .containsExactly( 1, 0, 1, 1 );
        }
    }

    @Test
    void rejectsRVariableWithWrongVarianceCount() throws IOException {
        WriterSpec spec = new WriterSpec().rDimSizes( 3, 4 );
        try ( CdfWriter writer = new CdfWriter( file, spec, false ) ) {
            assertThatThrownBy( () -> writer.writeVar(
                                    new VariableSpec( "v", DataType.INT4 )
                                   .rVariable( true ), null, null ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "2 dimension variances" );
        }
    }

    @Test
    void compressesLargeVariablesInBlocksIndexedByTree()
            throws IOException {
        int nrec = 200000;
        double[] values = new double[ nrec ];
        for ( int i = 0; i < nrec; i++ ) {
            values[ i ] = i * 0.5;
        }
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "big", DataType.REAL8 ),
                             null, values );
        }
        assertThat( file.length() ).isLessThan( nrec * 8L );
        try ( CdfReader reader = new CdfReader( file ) ) {
            VariableInfo info = reader.varinq( "big" );
            assertThat( info.getBlockingFactor() ).isEqualTo( 8192 );
            assertThat( info.getLastRec() ).isEqualTo( nrec - 1 );
            VariableData all = reader.varget( "big" );
            assertThat( (double[]) all.getData() ).containsExactly( values );
            VariableData part = reader.varget( "big", 8190, 8194 );
            assertThat( (double[]) part.getData() )
                .containsExactly( 4095, 4095.5, 4096, 4096.5, 4097 );
            assertThat( part.getStartRecord() ).isEqualTo( 8190 );
        }
    }

    @Test
    void wholeFileCompressionWithChecksum() throws IOException {
        WriterSpec spec = new WriterSpec().compressionLevel( 9 )
                                          .checksum( true );
        String[] names = { "alpha", "beta", "gamma" };
        try ( CdfWriter writer = new CdfWriter( file, spec, false ) ) {
            writer.writeVar( new VariableSpec( "names", DataType.CHAR )
                            .numElems( 5 ),
                             null, names );
        }
        byte[] magic = new byte[ 8 ];
        try ( InputStream in = Files.newInputStream( file.toPath() ) ) {
            assertThat( in.read( magic ) ).isEqualTo( 8 );
        }
        assertThat( CdfReader.isMagic( magic ) ).isTrue();
        assertThat( magic[ 4 ] ).isEqualTo( (byte) 0xcc );
        try ( CdfReader reader =
                  new CdfReader( file, true, StandardCharsets.US_ASCII ) ) {
            CdfInfo info = reader.getInfo();
            assertThat( info.isCompressed() ).isTrue();
            assertThat( info.hasChecksum() ).isTrue();
            assertThat( (String[]) reader.varget( "names" ).getData() )
                .containsExactly( names );
        }
    }

    @Test
    void detectsCorruptionWhenValidating() throws IOException {
        try ( CdfWriter writer =
                  new CdfWriter( file, new WriterSpec().checksum( true ),
                                 false ) ) {
            writer.writeVar( new VariableSpec( "x", DataType.INT4 ),
                             null, new int[] { 1, 2, 3 } );
        }
        try ( CdfReader reader =
                  new CdfReader( file, true, StandardCharsets.US_ASCII ) ) {
            assertThat( reader.getInfo().hasChecksum() ).isTrue();
        }

        // Flip a byte of the copyright text, which nothing else reads.
        try ( RandomAccessFile raf = new RandomAccessFile( file, "rw" ) ) {
            raf.seek( 8 + 56 + 10 );
            int b = raf.read();
            raf.seek( 8 + 56 + 10 );
            raf.write( b ^ 0x01 );
        }
        assertThatThrownBy( () -> new CdfReader( file, true,
                                                 StandardCharsets.US_ASCII ) )
            .isInstanceOf( CdfFormatException.class )
            .hasMessageContaining( "Checksum mismatch" );
        try ( CdfReader reader = new CdfReader( file ) ) {
            assertThat( (int[]) reader.varget( "x" ).getData() )
                .containsExactly( 1, 2, 3 );
        }
    }

    @Test
    void selectsRecordsByTimeRangeThroughDepend0() throws IOException {
        EpochCodec codec = new EpochCodec();
        double[] times = new double[ 10 ];
        float[] flux = new float[ 10 ];
        for ( int i = 0; i < 10; i++ ) {
            times[ i ] = codec.computeEpoch( 2001, 1, i + 1 );
            flux[ i ] = i * 1.5f;
        }
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "time", DataType.EPOCH ),
                             null, times );
            writer.writeVar( new VariableSpec( "flux", DataType.REAL4 ),
                             Collections.singletonMap( "DEPEND_0",
                                                       new AttributeEntry(
                                                           "time" ) ),
                             flux );
            writer.writeVar( new VariableSpec( "short", DataType.REAL4 ),
                             Collections.singletonMap( "DEPEND_0",
                                                       new AttributeEntry(
                                                           "time" ) ),
                             new float[] { 10f, 20f, 30f } );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            assertThat( (double[]) reader.varget( "time" ).getData() )
                .containsExactly( times );
            VariableData sub =
                reader.varget( new VarQuery( "flux" )
                              .startTime( new int[] { 2001, 1, 3 } )
                              .endTime( new int[] { 2001, 1, 5 } ) );
            assertThat( sub.getStartRecord() ).isEqualTo( 2 );
            assertThat( (float[]) sub.getData() )
                .containsExactly( 3f, 4.5f, 6f );

            VariableData own =
                reader.varget( new VarQuery( "time" )
                              .startTime( Double.valueOf( times[ 8 ] ) ) );
            assertThat( (double[]) own.getData() )
                .containsExactly( times[ 8 ], times[ 9 ] );

            VariableData none =
                reader.varget( new VarQuery( "flux" )
                              .startTime( new int[] { 2002, 1, 1 } ) );
            assertThat( none.getRecordCount() ).isZero();

            VariableData clipped =
                reader.varget( new VarQuery( "short" )
                              .startTime( new int[] { 2001, 1, 2 } )
                              .endTime( new int[] { 2001, 1, 5 } ) );
            assertThat( clipped.getStartRecord() ).isEqualTo( 1 );
            assertThat( (float[]) clipped.getData() )
                .containsExactly( 20f, 30f );

            VariableData beyond =
                reader.varget( new VarQuery( "short" )
                              .startTime( new int[] { 2001, 1, 6 } )
                              .endTime( new int[] { 2001, 1, 9 } ) );
            assertThat( beyond.getRecordCount() ).isZero();
            assertThat( (float[]) beyond.getData() ).isEmpty();

            assertThatThrownBy( () -> reader.varget(
                                    new VarQuery( "flux" )
                                   .startTime( new int[] { 2001, 1, 1 } )
                                   .startRecord( 0 ) ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "both" );
        }
    }

    @Test
    void timeRangeNeedsAnEpochVariable() throws IOException {
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "x", DataType.INT4 ),
                             null, new int[] { 1, 2 } );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            assertThatThrownBy( () -> reader.varget(
                                    new VarQuery( "x" )
                                   .startTime( new int[] { 2001, 1, 1 } ) ) )
                .isInstanceOf( CdfNotFoundException.class )
                .hasMessageContaining( "No epoch variable" );
            assertThatThrownBy( () -> reader.varget(
                                    new VarQuery( "x" )
                                   .startTime( new int[] { 2001, 1, 1 } )
                                   .epochVariable( "x" ) ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "not an epoch type" );
        }
    }

    @Test
    void parsesEpochStringsForEpochTypes() throws IOException {
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "tt", DataType.TIME_TT2000 ),
                             null,
                             new String[] { "2005-12-04T20:19:18.176321123" } );
            writer.writeVar( new VariableSpec( "e16", DataType.EPOCH16 ),
                             null,
                             new Epoch16[] { new Epoch16( 1.0, 2.0 ),
                                             new Epoch16( 3.0, 4.0 ) } );
            Map<String,Map<Integer,AttributeEntry>> gatts =
                new LinkedHashMap<String,Map<Integer,AttributeEntry>>();
            gatts.put( "Created",
                       Collections.singletonMap(
                           Integer.valueOf( 0 ),
                           new AttributeEntry( DataType.TIME_TT2000,
                                               "2005-12-04T20:19:18.176321123"
                                               ) ) );
            writer.writeGlobalAttrs( gatts );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            assertThat( (long[]) reader.varget( "tt" ).getData() )
                .containsExactly( 186999622360321123L );
            assertThat( (double[]) reader.varget( "e16" ).getData() )
                .containsExactly( 1.0, 2.0, 3.0, 4.0 );
            assertThat( reader.attget( "Created", 0 ).getDataType() )
                .isSameAs( DataType.TIME_TT2000 );
            assertThat( (String[]) reader.globalattsgetExpanded()
                                         .get( "Created" )
                                         .get( Integer.valueOf( 0 ) )
                                         .getValue() )
                .containsExactly( "2005-12-04T20:19:18.176321123" );
        }
    }

    @Test
    void fillsSparseGapsWithPadOrPreviousRecord() throws IOException {
        int[] recs = { 0, 1, 2, 10, 11, 12 };
        int[] vals = { 0, 1, 2, 10, 11, 12 };
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "padded", DataType.INT4 )
                            .sparse( SparseMode.PAD_SPARSE )
                            .pad( Integer.valueOf( -1 ) ),
                             null, new SparseRecords( recs, vals ) );
            writer.writeVar( new VariableSpec( "prev", DataType.INT4 )
                            .sparse( SparseMode.PREV_SPARSE ),
                             null, new SparseRecords( recs, vals ) );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            VariableInfo info = reader.varinq( "padded" );
            assertThat( info.getSparse() ).isEqualTo( SparseMode.PAD_SPARSE );
            assertThat( info.getCompressionLevel() ).isZero();
            assertThat( (int[]) info.getPad() ).containsExactly( -1 );

            VariableData padded = reader.varget( "padded" );
            assertThat( (int[]) padded.getData() )
                .containsExactly( 0, 1, 2, -1, -1, -1, -1, -1, -1, -1,
                                  10, 11, 12 );
            assertThat( padded.getRealRecords() ).containsExactly( recs );

            VariableData prev = reader.varget( "prev", 2, 11 );
            assertThat( (int[]) prev.getData() )
                .containsExactly( 2, 2, 2, 2, 2, 2, 2, 2, 10, 11 );

            assertThatThrownBy( () -> reader.varget( "prev", 0, 15 ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "Invalid end record" );
        }
    }

    @Test
    void sparseDataMayCoverVirtualRecords() throws IOException {
        int[] all = new int[ 13 ];
        for ( int i = 0; i < all.length; i++ ) {
            all[ i ] = i * 10;
        }
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "late", DataType.INT4 )
                            .sparse( SparseMode.PREV_SPARSE ),
                             null,
                             new SparseRecords( new int[] { 5, 6 },
                                                new int[] { 50, 60 } ) );
            writer.writeVar( new VariableSpec( "full", DataType.INT4 )
                            .sparse( SparseMode.PAD_SPARSE ),
                             null,
                             new SparseRecords( new int[] { 0, 10, 12 },
                                                all ) );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            int pad = ((int[]) DataType.INT4.getDefaultPadValueArray())[ 0 ];
            assertThat( (int[]) reader.varget( "late" ).getData() )
                .containsExactly( pad, pad, pad, pad, pad, 50, 60 );
            int[] full = (int[]) reader.varget( "full" ).getData();
            assertThat( full[ 0 ] ).isZero();
            assertThat( full[ 1 ] ).isEqualTo( pad );
            assertThat( full[ 10 ] ).isEqualTo( 100 );
            assertThat( full[ 12 ] ).isEqualTo( 120 );
        }
    }

    @Test
    void chainsIndexRecordsForManySparseRuns() throws IOException {
        int[] recs = new int[ 20 ];
        int[] vals = new int[ 20 ];
        for ( int i = 0; i < recs.length; i++ ) {
            recs[ i ] = 3 * i;
            vals[ i ] = i;
        }
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "runs", DataType.INT4 )
                            .sparse( SparseMode.PAD_SPARSE ),
                             null, new SparseRecords( recs, vals ) );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            VariableData data = reader.varget( "runs" );
            assertThat( data.getRecordCount() ).isEqualTo( 58 );
            assertThat( data.getRealRecords() ).containsExactly( recs );
            assertThat( ((int[]) data.getData())[ 57 ] ).isEqualTo( 19 );
        }
    }

    @Test
    void rejectsMalformedSparseData() throws IOException {
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            assertThatThrownBy( () -> writer.writeVar(
                                    new VariableSpec( "s", DataType.INT4 )
                                   .sparse( SparseMode.PAD_SPARSE ),
                                    null,
                                    new SparseRecords( new int[] { 0, 5 },
                                                       new int[] { 1, 2,
                                                                   3 } ) ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "Sparse data" );
            assertThatThrownBy( () -> writer.writeVar(
                                    new VariableSpec( "t", DataType.INT4 ),
                                    null,
                                    new SparseRecords( new int[] { 0 },
                                                       new int[] { 1 } ) ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "non-sparse" );
        }
        assertThatThrownBy( () -> new SparseRecords( new int[] { 2, 1 },
                                                     new int[] { 1, 2 } ) )
            .isInstanceOf( CdfUsageException.class )
            .hasMessageContaining( "ascending" );
    }

    @Test
    void ordersAttributeEntriesByNumber() throws IOException {
        Map<Integer,AttributeEntry> entries =
            new LinkedHashMap<Integer,AttributeEntry>();
        entries.put( Integer.valueOf( 5 ), new AttributeEntry( "five" ) );
        entries.put( Integer.valueOf( 1 ), new AttributeEntry( "one" ) );
        entries.put( Integer.valueOf( 3 ),
                     new AttributeEntry( new int[] { 3, 33 } ) );
        Map<String,Map<Integer,AttributeEntry>> gatts =
            new LinkedHashMap<String,Map<Integer,AttributeEntry>>();
        gatts.put( "Notes", entries );
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeGlobalAttrs( gatts );
            writer.writeVar( new VariableSpec( "a", DataType.INT4 ), null,
                             null );
            writer.writeVar( new VariableSpec( "b", DataType.INT4 ), null,
                             null );
            writer.writeVar( new VariableSpec( "c", DataType.INT4 ), null,
                             null );
            Map<String,AttributeEntry> byVar =
                new LinkedHashMap<String,AttributeEntry>();
            byVar.put( "c", new AttributeEntry( Double.valueOf( 2.5 ) ) );
            byVar.put( "a", new AttributeEntry( Long.valueOf( 1L << 40 ) ) );
            writer.writeVariableAttrs( Collections.singletonMap( "SCALE",
                                                                 byVar ) );
            writer.writeVariableAttrsByNumber(
                Collections.singletonMap( "LABEL",
                    Collections.singletonMap( Integer.valueOf( 1 ),
                                              new AttributeEntry(
                                                  new String[] { "x",
                                                                 "y" } ) ) ) );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            Map<Integer,AttributeEntry> notes =
                reader.globalattsgetExpanded().get( "Notes" );
            assertThat( notes.keySet() ).containsExactly( 1, 3, 5 );
            assertThat( (int[]) notes.get( Integer.valueOf( 3 ) ).getValue() )
                .containsExactly( 3, 33 );
            AttributeInfo noteInfo = reader.attinq( "notes" );
            assertThat( noteInfo.getMaxGrEntry() ).isEqualTo( 5 );
            assertThat( noteInfo.getNumGrEntries() ).isEqualTo( 3 );

            AttributeInfo scale = reader.attinq( "SCALE" );
            assertThat( scale.getNumZEntries() ).isEqualTo( 2 );
            assertThat( scale.getMaxZEntry() ).isEqualTo( 2 );
            assertThat( reader.attget( "SCALE", 0 ).getDataType() )
                .isSameAs( DataType.INT8 );
            assertThat( (double[]) reader.attget( "SCALE", "c" ).getData() )
                .containsExactly( 2.5 );
            assertThat( (String[]) reader.attget( "LABEL", "b" ).getData() )
                .containsExactly( "x", "y" );

            Map<String,AttributeEntry> bAtts =
                reader.varattsgetExpanded( "b" );
            assertThat( bAtts ).containsKeys( "SCALE", "LABEL" );
            assertThat( bAtts.get( "SCALE" ) ).isNull();
            assertThat( reader.varattsget( "b" ) ).containsOnlyKeys( "LABEL" );

            assertThatThrownBy( () -> reader.attget( "Notes", 2 ) )
                .isInstanceOf( CdfNotFoundException.class );
            assertThatThrownBy( () -> reader.attget( "Notes", "a" ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "global scope" );
        }
    }

    @Test
    void rejectsAttributeNamesUsedInTheOtherScope() throws IOException {
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeGlobalAttrs( globalAttr( "TITLE", 0, "title" ) );
            writer.writeVar( new VariableSpec( "v", DataType.INT4 ),
                             Collections.singletonMap(
                                 "UNITS", new AttributeEntry( "m" ) ),
                             new int[] { 1 } );

            assertThatThrownBy( () -> writer.writeVariableAttrs(
                                    Collections.singletonMap(
                                        "TITLE",
                                        Collections.singletonMap(
                                            "v",
                                            new AttributeEntry( "v title" )
                                            ) ) ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "global attribute" );
            assertThatThrownBy( () -> writer.writeVariableAttrsByNumber(
                                    Collections.singletonMap(
                                        "title",
                                        Collections.singletonMap(
                                            Integer.valueOf( 0 ),
                                            new AttributeEntry( "t" ) ) ) ) )
                .isInstanceOf( CdfUsageException.class );
            assertThatThrownBy( () -> writer.writeVar(
                                    new VariableSpec( "w", DataType.INT4 ),
                                    Collections.singletonMap(
                                        "TITLE", new AttributeEntry( "w" ) ),
                                    new int[] { 2 } ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "global attribute" );
            assertThatThrownBy( () -> writer.writeGlobalAttrs(
                                          globalAttr( "Units", 0, "g" ) ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "variable attribute" );
            assertThatThrownBy( () -> writer.writeGlobalAttrs(
                                          globalAttr( "title", 1, "again" ) ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "already exists" );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            assertThat( reader.getInfo().getZVariables() ).containsExactly( "v" );
            assertThat( reader.varattsget( "v" ) ).containsOnlyKeys( "UNITS" );
            List<AttributeEntry> titles = reader.globalattsget().get( "TITLE" );
            assertThat( titles ).hasSize( 1 );
            assertThat( reader.getInfo().getAttributes() )
                .containsOnlyKeys( "TITLE", "UNITS" );
        }
    }

    @Test
    void writesSingleRecordOfNonVaryingVariable() throws IOException {
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "const", DataType.REAL4 )
                            .recVary( false ).zVariable( 2 ),
                             null, new float[] { 1f, 2f } );
            writer.writeVar( new VariableSpec( "empty", DataType.REAL4 ),
                             null, null );
            assertThatThrownBy( () -> writer.writeVar(
                                    new VariableSpec( "many", DataType.REAL4 )
                                   .recVary( false ).zVariable( 2 ),
                                    null, new float[] { 1f, 2f, 3f, 4f } ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "takes one record" );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            VariableInfo info = reader.varinq( "const" );
            assertThat( info.getRecVary() ).isFalse();
            assertThat( info.getLastRec() ).isZero();
            assertThat( (float[]) reader.varget( "const" ).getData() )
                .containsExactly( 1f, 2f );
            assertThat( (float[]) reader.varget( "const", 0, 0 ).getData() )
                .containsExactly( 1f, 2f );
            assertThat( reader.varinq( "empty" ).getLastRec() ).isEqualTo( -1 );
            assertThatThrownBy( () -> reader.varget( "empty" ) )
                .isInstanceOf( CdfNotFoundException.class )
                .hasMessageContaining( "No records found" );
        }
    }

    @Test
    void appendsSuffixAndRefusesToOverwrite() throws IOException {
        File bare = tempDir.resolve( "bare" ).toFile();
        try ( CdfWriter writer = new CdfWriter( bare ) ) {
            assertThat( writer.getFile().getName() ).isEqualTo( "bare.cdf" );
        }
        assertThatThrownBy( () -> new CdfWriter( bare ) )
            .isInstanceOf( CdfUsageException.class )
            .hasMessageContaining( "already exists" );
        try ( CdfWriter writer = new CdfWriter( bare, new WriterSpec(),
                                                true ) ) {
            writer.writeVar( new VariableSpec( "x", DataType.BYTE ), null,
                             new byte[] { 9 } );
        }
        try ( CdfReader reader = new CdfReader( bare ) ) {
            assertThat( reader.getFile().getName() ).isEqualTo( "bare.cdf" );
            assertThat( (byte[]) reader.varget( "x" ).getData() )
                .containsExactly( 9 );
        }
    }

    @Test
    void validatesVariableDeclarations() throws IOException {
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "dup", DataType.INT4 ), null,
                             null );
            assertThatThrownBy( () -> writer.writeVar(
                                    new VariableSpec( "DUP", DataType.INT4 ),
                                    null, null ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "already exists" );
            assertThatThrownBy( () -> writer.writeVar(
                                    new VariableSpec( "n", DataType.INT4 )
                                   .numElems( 2 ), null, null ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "element count" );
            assertThatThrownBy( () -> writer.writeVar(
                                    new VariableSpec( "odd", DataType.INT4 )
                                   .zVariable( 2 ), null,
                                    new int[] { 1, 2, 3 } ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "not a multiple" );
            assertThatThrownBy( () -> writer.writeVariableAttrs(
                                    Collections.singletonMap(
                                        "UNITS",
                                        Collections.singletonMap(
                                            "nosuch",
                                            new AttributeEntry( "m" ) ) ) ) )
                .isInstanceOf( CdfNotFoundException.class );
        }
        assertThatThrownBy( () -> new VariableSpec( " ", DataType.INT4 ) )
            .isInstanceOf( CdfUsageException.class );
        assertThatThrownBy( () -> new VariableSpec( "v", DataType.INT4 )
                                 .compressionLevel( 10 ) )
            .isInstanceOf( CdfUsageException.class )
            .hasMessageContaining( "0-9" );
        assertThatThrownBy( () -> new WriterSpec()
                                 .encoding( NumericEncoding.VAX ) )
            .isInstanceOf( CdfUsageException.class );
    }

    @Test
    void refusesUseAfterClose() throws IOException {
        CdfWriter writer = new CdfWriter( file );
        writer.close();
        writer.close();
        assertThatThrownBy( () -> writer.writeVar(
                                new VariableSpec( "late", DataType.INT4 ),
                                null, null ) )
            .isInstanceOf( CdfUsageException.class )
            .hasMessageContaining( "closed" );
    }

    @Test
    void readsFromStream() throws IOException {
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "x", DataType.UINT2 ), null,
                             new int[] { 65535, 0 } );
        }
        try ( InputStream in = Files.newInputStream( file.toPath() );
              CdfReader reader = CdfReader.open( in, false,
                                                 CdfReader.DEFAULT_CHARSET ) ) {
            assertThat( (int[]) reader.varget( 0 ).getData() )
                .containsExactly( 65535, 0 );
        }
    }

    private static Map<String,Map<Integer,AttributeEntry>>
            globalAttr( String name, int entry, Object value ) {
        Map<String,Map<Integer,AttributeEntry>> map =
            new LinkedHashMap<String,Map<Integer,AttributeEntry>>();
        map.put( name, Collections.singletonMap( Integer.valueOf( entry ),
                                                 new AttributeEntry( value ) ) );
        return map;
    }
}
