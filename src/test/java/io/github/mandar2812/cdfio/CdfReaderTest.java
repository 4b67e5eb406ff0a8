package io.github.mandar2812.cdfio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.mandar2812.cdfio.write.CdfWriter;
import io.github.mandar2812.cdfio.write.WriterSpec;
import io.github.mandar2812.cdfio.write.VariableSpec;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

@Tag("unit")
class CdfReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void recognisesMagicNumbers() {
        assertThat( CdfReader.isMagic( new byte[] {
            (byte) 0xcd, (byte) 0xf3, 0x00, 0x01, 0x00, 0x00, (byte) 0xff,
            (byte) 0xff } ) ).isTrue();
        assertThat( CdfReader.isMagic( new byte[] {
            (byte) 0xcd, (byte) 0xf2, 0x60, 0x02, (byte) 0xcc, (byte) 0xcc,
            0x00, 0x01 } ) ).isTrue();
        assertThat( CdfReader.isMagic( new byte[] {
            0x00, 0x00, (byte) 0xff, (byte) 0xff, 0x00, 0x00, (byte) 0xff,
            (byte) 0xff } ) ).isTrue();
        assertThat( CdfReader.isMagic( "not a cdf".getBytes() ) ).isFalse();
        assertThat( CdfReader.isMagic( new byte[ 4 ] ) ).isFalse();
    }

    @Test
    void rejectsFilesThatAreNotCdfs() throws IOException {
        Path junk = tempDir.resolve( "junk.cdf" );
        Files.write( junk, "this is plainly not a CDF file".getBytes() );
        assertThatThrownBy( () -> new CdfReader( junk.toFile() ) )
            .isInstanceOf( CdfFormatException.class )
            .hasMessageContaining( "Unrecognised magic numbers" );

        Path tiny = tempDir.resolve( "tiny.cdf" );
        Files.write( tiny, new byte[] { (byte) 0xcd, (byte) 0xf3 } );
        assertThatThrownBy( () -> new CdfReader( tiny.toFile() ) )
            .isInstanceOf( CdfFormatException.class )
            .hasMessageContaining( "too short" );

        assertThatThrownBy( () -> new CdfReader( tempDir.resolve( "absent" )
                                                        .toFile() ) )
            .isInstanceOf( CdfNotFoundException.class );
    }

    @Test
    void addsSuffixAndClosesOnce() throws IOException {
        File file = tempDir.resolve( "named.cdf" ).toFile();
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "x", DataType.REAL4 ), null,
                             new float[] { 1.5f } );
        }
        CdfReader reader = new CdfReader( tempDir.resolve( "named" )
                                                 .toFile() );
        assertThat( reader.getFile() ).isEqualTo( file );
        CdfInfo info = reader.getInfo();
        assertThat( info.toString() ).contains( "1 zVariables" );
        assertThat( info.getLeapSecondLastUpdated() ).isEqualTo( 20170101 );
        assertThat( reader.varinq( 0 ).getDataType() )
            .isSameAs( DataType.REAL4 );
        assertThatThrownBy( () -> reader.varinq( "y" ) )
            .isInstanceOf( CdfNotFoundException.class )
            .hasMessageContaining( "No variable by name" );
        assertThatThrownBy( () -> reader.attinq( "none" ) )
            .isInstanceOf( CdfNotFoundException.class )
            .hasMessageContaining( "No attribute by name" );
        assertThatThrownBy( () -> reader.varget( "x", -1, 0 ) )
            .isInstanceOf( CdfUsageException.class )
            .hasMessageContaining( "Invalid start record" );
        reader.close();
        reader.close();
        assertThatThrownBy( reader::getInfo )
            .isInstanceOf( CdfUsageException.class );
    }

    @Test
    void rejectsNumericLookupsWhenBothVariableKindsExist()
            throws IOException {
        File file = tempDir.resolve( "mixed.cdf" ).toFile();
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "rv", DataType.INT4 )
                            .rVariable(),
                             Collections.singletonMap(
                                 "UNITS", new AttributeEntry( "m" ) ),
                             new int[] { 1, 2 } );
            writer.writeVar( new VariableSpec( "zv", DataType.INT4 ),
                             Collections.singletonMap(
                                 "UNITS", new AttributeEntry( "s" ) ),
                             new int[] { 3, 4, 5 } );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            assertThatThrownBy( () -> reader.attget( "UNITS", 0 ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "both r and zVariables" );
            assertThatThrownBy( () -> reader.varinq( 0 ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "both r and zVariables" );
            assertThatThrownBy( () -> reader.varget( 0 ) )
                .isInstanceOf( CdfUsageException.class );
            assertThatThrownBy( () -> reader.varattsget( 0 ) )
                .isInstanceOf( CdfUsageException.class );

            assertThat( reader.attget( "UNITS", "rv" ).getData() )
                .isEqualTo( "m" );
            assertThat( reader.attget( "UNITS", "zv" ).getData() )
                .isEqualTo( "s" );
            assertThat( reader.varinq( "rv" ).isZVariable() ).isFalse();
            assertThat( reader.varinq( "zv" ).isZVariable() ).isTrue();
        }
    }

    @Test
    void numericLookupsWorkWithOneVariableKind() throws IOException {
        File file = tempDir.resolve( "zonly.cdf" ).toFile();
        try ( CdfWriter writer = new CdfWriter( file ) ) {
            writer.writeVar( new VariableSpec( "a", DataType.INT4 ),
                             Collections.singletonMap(
                                 "UNITS", new AttributeEntry( "m" ) ),
                             new int[] { 1 } );
            writer.writeVar( new VariableSpec( "b", DataType.INT4 ), null,
                             new int[] { 2 } );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            assertThat( reader.varinq( 1 ).getName() ).isEqualTo( "b" );
            assertThat( reader.attget( "UNITS", 0 ).getData() )
                .isEqualTo( "m" );
            assertThatThrownBy( () -> reader.attget( "UNITS", 1 ) )
                .isInstanceOf( CdfNotFoundException.class );
            assertThatThrownBy( () -> reader.varinq( 2 ) )
                .isInstanceOf( CdfNotFoundException.class )
                .hasMessageContaining( "No variable number" );
        }
    }

    @Test
    void readsRecordRangeBoundaries() throws IOException {
        File file = tempDir.resolve( "range.cdf" ).toFile();
        try ( CdfWriter writer =
                  new CdfWriter( file, new WriterSpec(), false ) ) {
            writer.writeVar( new VariableSpec( "n", DataType.INT2 ), null,
                             new short[] { 10, 11, 12 } );
        }
        try ( CdfReader reader = new CdfReader( file ) ) {
            VariableData first = reader.varget( "n", 0, 0 );
            assertThat( first.getRecordCount() ).isEqualTo( 1 );
            assertThat( (short[]) first.getData() )
                .containsExactly( (short) 10 );
            VariableData last = reader.varget( "n", 2, 2 );
            assertThat( last.getStartRecord() ).isEqualTo( 2 );
            assertThat( (short[]) last.getData() )
                .containsExactly( (short) 12 );
            VariableData fromZero =
                reader.varget( new VarQuery( "n" ).endRecord( 0 ) );
            assertThat( fromZero.getRecordCount() ).isEqualTo( 1 );
            assertThatThrownBy( () -> reader.varget( "n", 1, 0 ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "Invalid end record" );
            assertThatThrownBy( () -> reader.varget( "n", 0, 3 ) )
                .isInstanceOf( CdfUsageException.class )
                .hasMessageContaining( "Invalid end record" );
        }
    }
}
