package io.github.mandar2812.cdfio.record;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.github.mandar2812.cdfio.CdfFormatException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CompressionTest {

    @Test
    void gzipShrinksRepetitiveData() throws IOException {
        byte[] data = new byte[ 10000 ];
        Arrays.fill( data, (byte) 7 );
        byte[] packed = Compression.GZIP.compress( data, 6 );
        assertThat( packed.length ).isLessThan( data.length / 10 );
        assertThat( Compression.GZIP.uncompress( packed ) ).isEqualTo( data );
    }

    @Test
    void levelZeroStillProducesValidGzip() throws IOException {
        byte[] data = "not very compressible".getBytes( "US-ASCII" );
        byte[] stored = Compression.GZIP.compress( data, 0 );
        assertThat( Compression.GZIP.uncompress( stored ) ).isEqualTo( data );
    }

    @Test
    void looksUpByCType() throws CdfFormatException {
        assertThat( Compression.getCompression( 5 ) )
            .isSameAs( Compression.GZIP );
        assertThat( Compression.getCompression( 1 ) )
            .isSameAs( Compression.RLE );
        assertThat( Compression.getCompression( 0 ) )
            .isSameAs( Compression.NONE );
        assertThat( Compression.GZIP.getName() ).isEqualTo( "GZIP" );
    }

    @Test
    void rejectsUnsupportedCodecs() {
        assertThatThrownBy( () -> Compression.getCompression( 2 ) )
            .isInstanceOf( CdfFormatException.class );
        assertThatThrownBy( () -> Compression.RLE.compress( new byte[ 1 ], 1 ) )
            .isInstanceOf( CdfFormatException.class )
            .hasMessageContaining( "RLE" );
    }

    @Test
    void rleExpandsZeroRuns() throws IOException {
        byte[] packed = { 1, 2, 3, 0, 0, 4, 5, 6, 0, 2 };
        InputStream in = Compression.RLE
                        .uncompressStream( new ByteArrayInputStream( packed ) );
        assertThat( in.readAllBytes() )
            .containsExactly( 1, 2, 3, 0, 4, 5, 6, 0, 0, 0 );
    }

    @Test
    void rleReportsTruncatedRun() {
        byte[] packed = { 9, 0 };
        assertThatThrownBy( () -> new RunLengthInputStream(
                                      new ByteArrayInputStream( packed ),
                                      (byte) 0 ).readAllBytes() )
            .isInstanceOf( CdfFormatException.class )
            .hasMessageContaining( "run count" );
    }
}
