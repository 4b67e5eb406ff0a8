package io.github.mandar2812.cdfio.util;

import static org.assertj.core.api.Assertions.assertThat;

import io.github.mandar2812.cdfio.AttributeEntry;
import io.github.mandar2812.cdfio.DataType;
import io.github.mandar2812.cdfio.SparseMode;
import io.github.mandar2812.cdfio.write.CdfWriter;
import io.github.mandar2812.cdfio.write.SparseRecords;
import io.github.mandar2812.cdfio.write.VariableSpec;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class CdfListTest {

    @TempDir
    Path tempDir;

    private File file;
    private ByteArrayOutputStream outBytes;
    private ByteArrayOutputStream errBytes;
    private PrintStream out;
    private PrintStream err;

    @BeforeEach
    void setUp() throws IOException {
        file = tempDir.resolve( "list.cdf" ).toFile();
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeGlobalAttrs(
                Collections.singletonMap(
                    "Mission",
                    Collections.singletonMap( Integer.valueOf( 0 ),
                                              new AttributeEntry( "Test" ) ) ) );
            writer.writeVar( new VariableSpec( "time", DataType.TIME_TT2000 ),
                             Collections.singletonMap(
                                 "UNITS", new AttributeEntry( "ns" ) ),
                             new String[] { "2010-01-01T00:00:00.000000000" } );
            writer.writeVar( new VariableSpec( "label", DataType.CHAR )
                            .numElems( 3 ).recVary( false ),
                             null, "abc" );
            writer.writeVar( new VariableSpec( "counts", DataType.INT4 )
                            .sparse( SparseMode.PAD_SPARSE ),
                             null,
                             new SparseRecords( new int[] { 0, 2 },
                                                new int[] { 7, 9 } ) );
        }
        outBytes = new ByteArrayOutputStream();
        errBytes = new ByteArrayOutputStream();
        out = new PrintStream( outBytes, true, "UTF-8" );
        err = new PrintStream( errBytes, true, "UTF-8" );
    }

    @Test
    void listsMetadataWithoutData() throws IOException {
        int status = CdfList.runMain( new String[] { file.toString() },
                                      out, err );
        String txt = output();
        assertThat( status ).isZero();
        assertThat( txt ).contains( "Global Attributes" )
                         .contains( "Mission" )
                         .contains( "Variable 0: time" )
                         .contains( "UNITS" )
                         .doesNotContain( "01-Jan-2010" );
    }

    @Test
    void listsRecordsWithMarks() throws IOException {
        int status = CdfList.runMain( new String[] { "-data",
                                                     file.toString() },
                                      out, err );
        String txt = output();
        assertThat( status ).isZero();
        assertThat( txt ).contains( "  0:\t01-Jan-2010 00:00:00.000" )
                         .contains( "{ 0:\t\"abc\" }" )
                         .contains( "[ 1:" )
                         .contains( "  2:\t9" );
    }

    @Test
    void reportsUsageProblems() throws IOException {
        assertThat( CdfList.runMain( new String[] { "-help" }, out, err ) )
            .isZero();
        assertThat( output() ).contains( "Usage:" );
        assertThat( CdfList.runMain( new String[ 0 ], out, err ) )
            .isEqualTo( 1 );
        assertThat( CdfList.runMain( new String[] { file.toString(),
                                                    "-bogus" },
                                     out, err ) )
            .isEqualTo( 1 );
        assertThat( errBytes.toString( "UTF-8" ) ).contains( "-bogus" );
        assertThat( CdfList.runMain( new String[] { tempDir.resolve( "none" )
                                                           .toString() },
                                     out, err ) )
            .isEqualTo( 1 );
        assertThat( errBytes.toString( "UTF-8" ) ).contains( "not found" );
    }

    private String output() {
        return new String( outBytes.toByteArray(), StandardCharsets.UTF_8 );
    }
}
