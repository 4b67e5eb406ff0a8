package io.github.mandar2812.cdfio.epoch;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

import io.github.mandar2812.cdfio.CdfUsageException;
import io.github.mandar2812.cdfio.DataType;
import java.io.IOException;
import java.time.LocalDateTime;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class EpochCodecTest {

    private static final double EPOCH_2000 = 63113904000000.0;

    private EpochCodec codec;

    @BeforeEach
    void setUp() throws IOException {
        codec = new EpochCodec();
    }

    @Test
    void tt2000EncodesKnownValue() {
        assertThat( codec.encodeTt2000( 186999622360321123L, true ) )
            .isEqualTo( "2005-12-04T20:19:18.176321123" );
        assertThat( codec.encodeTt2000( 186999622360321123L, false ) )
            .isEqualTo( "04-Dec-2005 20:19:18.176.321.123" );
    }

    @Test
    void tt2000ZeroIsJ2000InTerrestrialTime() {
        assertThat( codec.computeTt2000( 2000, 1, 1, 11, 58, 55, 816, 0, 0 ) )
            .isEqualTo( 0L );
        assertThat( codec.breakdownTt2000( 0L ) )
            .containsExactly( 2000, 1, 1, 11, 58, 55, 816, 0, 0 );
    }

    @Test
    void tt2000RoundTripsThroughComponents() {
        long tt = codec.computeTt2000( 2005, 12, 4, 20, 19, 18, 176, 321, 123 );
        assertThat( tt ).isEqualTo( 186999622360321123L );
        assertThat( codec.breakdownTt2000( tt ) )
            .containsExactly( 2005, 12, 4, 20, 19, 18, 176, 321, 123 );
    }

    @Test
    void tt2000ReportsLeapSecondAsSixty() {
        long leap = codec.computeTt2000( 2016, 12, 31, 23, 59, 60, 500, 0, 0 );
        long after = codec.computeTt2000( 2017, 1, 1, 0, 0, 0, 0, 0, 0 );
        assertThat( after - leap ).isEqualTo( 500000000L );
        assertThat( codec.breakdownTt2000( leap )[ 5 ] ).isEqualTo( 60 );
        assertThat( codec.encodeTt2000( leap, true ) )
            .isEqualTo( "2016-12-31T23:59:60.500000000" );
    }

    @Test
    void tt2000FillAndPadHaveFixedForms() {
        assertThat( codec.encodeTt2000( EpochCodec.TT2000_FILL, true ) )
            .startsWith( "9999-12-31T23:59:59.999" );
        assertThat( codec.encodeTt2000( EpochCodec.TT2000_PAD, true ) )
            .startsWith( "0000-01-01T00:00:00.000" );
    }

    @Test
    void epochComputesMillisecondsSinceYearZero() {
        assertThat( codec.computeEpoch( 2000, 1, 1, 0, 0, 0, 0 ) )
            .isEqualTo( EPOCH_2000 );
        assertThat( codec.computeEpoch( 2000, 1, 1 ) ).isEqualTo( EPOCH_2000 );
        assertThat( codec.encodeEpoch( EPOCH_2000 + 1500, true ) )
            .isEqualTo( "2000-01-01T00:00:01.500" );
        assertThat( codec.encodeEpoch( EPOCH_2000, false ) )
            .isEqualTo( "01-Jan-2000 00:00:00.000" );
    }

    @Test
    void epochFoldsOutOfRangeComponents() {
        assertThat( codec.computeEpoch( 1999, 12, 32 ) )
            .isEqualTo( EPOCH_2000 );
        assertThat( codec.computeEpoch( 2000, 0, 1 ) )
            .isEqualTo( EPOCH_2000 );
    }

    @Test
    void epochFillEncodesAsLastMillisecond() {
        assertThat( codec.computeEpoch( 9999, 12, 31, 23, 59, 59, 999 ) )
            .isEqualTo( EpochCodec.EPOCH_FILL );
        assertThat( codec.breakdownEpoch( EpochCodec.EPOCH_FILL ) )
            .containsExactly( 9999, 12, 31, 23, 59, 59, 999 );
    }

    @Test
    void epochRejectsNegativeYear() {
        assertThatThrownBy( () -> codec.computeEpoch( -1, 1, 1 ) )
            .isInstanceOf( CdfUsageException.class )
            .hasMessageContaining( "year" );
    }

    @Test
    void epoch16CarriesPicoseconds() {
        Epoch16 e16 = codec.computeEpoch16( 2000, 1, 1, 0, 0, 0,
                                            123, 456, 789, 12 );
        assertThat( e16.getReal() ).isEqualTo( EPOCH_2000 / 1000 );
        assertThat( e16.getImag() ).isEqualTo( 123456789012.0 );
        assertThat( codec.breakdownEpoch16( e16 ) )
            .containsExactly( 2000, 1, 1, 0, 0, 0, 123, 456, 789, 12 );
        assertThat( codec.encodeEpoch16( e16, true ) )
            .isEqualTo( "2000-01-01T00:00:00.123456789012" );
    }

    @Test
    void parseRecognisesEachKindByLength() {
        assertThat( codec.parse( "2000-01-01T00:00:00.000" ) )
            .isEqualTo( Double.valueOf( EPOCH_2000 ) );
        assertThat( codec.parse( "01-Jan-2000 00:00:00.000" ) )
            .isEqualTo( Double.valueOf( EPOCH_2000 ) );
        assertThat( codec.parse( "2005-12-04T20:19:18.176321123" ) )
            .isEqualTo( Long.valueOf( 186999622360321123L ) );
        assertThat( codec.parse( "2000-01-01T00:00:00.123456789012" ) )
            .isEqualTo( new Epoch16( EPOCH_2000 / 1000, 123456789012.0 ) );
    }

    @Test
    void parseRejectsUnknownForm() {
        assertThatThrownBy( () -> codec.parse( "yesterday" ) )
            .isInstanceOf( CdfUsageException.class )
            .hasMessageContaining( "Invalid cdf epoch string" );
    }

    @Test
    void encodeAndComputeDispatchOnType() {
        assertThat( codec.encode( Long.valueOf( 186999622360321123L ), true ) )
            .isEqualTo( "2005-12-04T20:19:18.176321123" );
        assertThat( (String[]) codec.encode( new double[] { EPOCH_2000 },
                                             true ) )
            .containsExactly( "2000-01-01T00:00:00.000" );
        assertThat( codec.compute( 2000, 1, 1, 0, 0, 0, 0 ) )
            .isEqualTo( Double.valueOf( EPOCH_2000 ) );
        assertThat( codec.compute( 2005, 12, 4, 20, 19, 18, 176, 321, 123 ) )
            .isEqualTo( Long.valueOf( 186999622360321123L ) );
        assertThat( codec.compute( 2000, 1, 1, 0, 0, 0, 123, 456, 789, 12 ) )
            .isInstanceOf( Epoch16.class );
    }

    @Test
    void convertsToDatetimeAndUnixTime() {
        assertThat( codec.toDatetime( EPOCH_2000 ) )
            .isEqualTo( LocalDateTime.of( 2000, 1, 1, 0, 0 ) );
        assertThat( codec.unixtime( EPOCH_2000 ) )
            .isCloseTo( 946684800.0, within( 1e-6 ) );
        long tt = codec.computeTt2000( 2017, 1, 1, 0, 0, 1, 0, 0, 0 );
        assertThat( codec.unixtime( tt ) )
            .isCloseTo( 1483228801.0, within( 1e-6 ) );
    }

    @Test
    void findsInclusiveEpochRanges() {
        double[] epochs = new double[ 10 ];
        for ( int i = 0; i < epochs.length; i++ ) {
            epochs[ i ] = codec.computeEpoch( 2001, 1, i + 1 );
        }
        assertThat( codec.findEpochRange( DataType.EPOCH, epochs,
                                          new int[] { 2001, 1, 3 },
                                          new int[] { 2001, 1, 5 } ) )
            .containsExactly( 2, 3, 4 );
        assertThat( codec.findEpochRange( epochs, null,
                                          Double.valueOf( epochs[ 1 ] ) ) )
            .containsExactly( 0, 1 );
        assertThat( codec.findEpochRange( epochs, null, null ) )
            .containsExactly( 0, 1, 2, 3, 4, 5, 6, 7, 8, 9 );
        assertThat( codec.findEpochRange( DataType.EPOCH, epochs,
                                          new int[] { 2002, 1, 1 }, null ) )
            .isEmpty();
    }

    @Test
    void findsEpoch16RangeFromPairs() {
        double[] pairs = { 10.0, 0.0, 10.0, 5.0, 11.0, 0.0 };
        assertThat( codec.findEpochRange( DataType.EPOCH16, pairs,
                                          new Epoch16( 10.0, 1.0 ),
                                          new Epoch16( 11.0, 0.0 ) ) )
            .containsExactly( 1, 2 );
    }

    @Test
    void rejectsInvertedRange() {
        assertThatThrownBy( () -> codec.findEpochRange( new long[] { 1L },
                                                        Long.valueOf( 5 ),
                                                        Long.valueOf( 1 ) ) )
            .isInstanceOf( CdfUsageException.class )
            .hasMessageContaining( "start/end" );
    }

    @Test
    void warnsOnlyWhenDataIsNewerThanTable() {
        assertThat( codec.checkLeapSecondLastUpdated( 20170101 ) ).isTrue();
        assertThat( codec.checkLeapSecondLastUpdated( 0 ) ).isTrue();
        assertThat( codec.checkLeapSecondLastUpdated( 99991231 ) ).isFalse();
    }
}
