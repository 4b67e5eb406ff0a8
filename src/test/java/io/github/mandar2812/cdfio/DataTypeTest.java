package io.github.mandar2812.cdfio;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.ByteOrder;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class DataTypeTest {

    private static final Charset ASCII = StandardCharsets.US_ASCII;

    @Test
    void looksUpTypesByCodeAndName() throws CdfFormatException {
        assertThat( DataType.getDataType( 45 ) ).isSameAs( DataType.DOUBLE );
        assertThat( DataType.getDataType( 33 ) )
            .isSameAs( DataType.TIME_TT2000 );
        assertThat( DataType.forName( "cdf_real8" ) )
            .isSameAs( DataType.REAL8 );
        assertThat( DataType.forName( "UINT2" ).getCode() ).isEqualTo( 12 );
        assertThat( DataType.EPOCH16.getGroupSize() ).isEqualTo( 2 );
        assertThat( DataType.EPOCH16.getByteCount() ).isEqualTo( 16 );
    }

    @Test
    void rejectsUnknownTypes() {
        assertThatThrownBy( () -> DataType.getDataType( 99 ) )
            .isInstanceOf( CdfFormatException.class )
            .hasMessageContaining( "99" );
        assertThatThrownBy( () -> DataType.forName( "REAL16" ) )
            .isInstanceOf( CdfUsageException.class );
    }

    @Test
    void decodesUnsignedIntoWiderTypes() {
        byte[] bytes = { (byte) 0xff, (byte) 0xff, (byte) 0xff, (byte) 0xff };
        assertThat( (long[]) DataType.UINT4
                   .decode( bytes, 0, 1, 1, ByteOrder.BIG_ENDIAN, ASCII ) )
            .containsExactly( 4294967295L );
        assertThat( (int[]) DataType.UINT2
                   .decode( bytes, 0, 2, 1, ByteOrder.BIG_ENDIAN, ASCII ) )
            .containsExactly( 65535, 65535 );
        assertThat( (short[]) DataType.UINT1
                   .decode( bytes, 0, 1, 1, ByteOrder.BIG_ENDIAN, ASCII ) )
            .containsExactly( (short) 255 );
    }

    @Test
    void honoursByteOrder() {
        byte[] little = DataType.INT4.encode( new int[] { 1 }, 1,
                                              ByteOrder.LITTLE_ENDIAN, ASCII );
        byte[] big = DataType.INT4.encode( new int[] { 1 }, 1,
                                           ByteOrder.BIG_ENDIAN, ASCII );
        assertThat( little ).containsExactly( 1, 0, 0, 0 );
        assertThat( big ).containsExactly( 0, 0, 0, 1 );
        assertThat( (int[]) DataType.INT4
                   .decode( little, 0, 1, 1, ByteOrder.LITTLE_ENDIAN, ASCII ) )
            .containsExactly( 1 );
    }

    @Test
    void padsAndTruncatesCharacterValues() {
        byte[] bytes = DataType.CHAR.encode( new String[] { "ab", "cdefg" },
                                             4, ByteOrder.BIG_ENDIAN, ASCII );
        assertThat( bytes ).containsExactly( 'a', 'b', 0, 0,
                                             'c', 'd', 'e', 'f' );
        assertThat( (String[]) DataType.CHAR
                   .decode( bytes, 0, 2, 4, ByteOrder.BIG_ENDIAN, ASCII ) )
            .containsExactly( "ab", "cdef" );
    }

    @Test
    void defaultPadValuesMatchFormatConventions() {
        assertThat( (int[]) DataType.INT4.getDefaultPadValueArray() )
            .containsExactly( -2147483647 );
        assertThat( (float[]) DataType.REAL4.getDefaultPadValueArray() )
            .containsExactly( -1.0e30f );
        byte[] charPad = DataType.CHAR.getDefaultPadBytes( 3,
                                                           ByteOrder
                                                          .BIG_ENDIAN );
        assertThat( charPad ).containsExactly( ' ', ' ', ' ' );
        byte[] int2Pad = DataType.INT2.getDefaultPadBytes( 1,
                                                           ByteOrder
                                                          .LITTLE_ENDIAN );
        assertThat( (short[]) DataType.INT2
                   .decode( int2Pad, 0, 1, 1, ByteOrder.LITTLE_ENDIAN,
                            ASCII ) )
            .containsExactly( (short) -32767 );
    }

    @Test
    void flattensNestedAndBoxedInput() {
        int[][] nested = { { 1, 2, 3 }, { 4, 5, 6 } };
        assertThat( (double[]) DataType.DOUBLE.toValueArray( nested ) )
            .containsExactly( 1, 2, 3, 4, 5, 6 );
        assertThat( (long[]) DataType.INT8
                   .toValueArray( Arrays.asList( Integer.valueOf( 7 ),
                                                 Long.valueOf( 8 ) ) ) )
            .containsExactly( 7L, 8L );
        assertThat( (byte[]) DataType.INT1
                   .toValueArray( new Boolean[] { Boolean.TRUE,
                                                  Boolean.FALSE } ) )
            .containsExactly( 1, 0 );
        float[] same = { 1f };
        assertThat( DataType.REAL4.toValueArray( same ) ).isSameAs( same );
    }

    @Test
    void rejectsMismatchedInput() {
        assertThatThrownBy( () -> DataType.INT4.toValueArray( "text" ) )
            .isInstanceOf( CdfUsageException.class )
            .hasMessageContaining( "Non-numeric" );
        assertThatThrownBy( () -> DataType.CHAR.toValueArray( new int[] { 1 } ) )
            .isInstanceOf( CdfUsageException.class )
            .hasMessageContaining( "Non-string" );
        assertThatThrownBy( () -> DataType.INT4.toValueArray( null ) )
            .isInstanceOf( CdfUsageException.class );
    }

    @Test
    void decodesNulTerminatedStrings() {
        byte[] bytes = { 'a', 'b', 0, 'x', 0 };
        assertThat( DataType.decodeString( bytes, 0, 5, ASCII ) )
            .isEqualTo( "ab" );
        byte[] full = { 'a', 'b', 'c' };
        assertThat( DataType.decodeString( full, 0, 3, ASCII ) )
            .isEqualTo( "abc" );
    }
}
