package io.github.mandar2812.cdfio;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class ShaperTest {

    @Test
    void rowMajorAndVectorRecordsPassThrough() {
        int[] values = { 1, 2, 3, 4, 5, 6 };
        assertThat( Shaper.createShaper( DataType.INT4, new int[] { 2, 3 },
                                         true )
                          .toRowMajor( values, 1 ) )
            .isSameAs( values );
        assertThat( Shaper.createShaper( DataType.INT4, new int[] { 6 },
                                         false )
                          .fromRowMajor( values, 1 ) )
            .isSameAs( values );
    }

    @Test
    void transposesColumnMajorRecords() {
        Shaper shaper = Shaper.createShaper( DataType.INT4,
                                             new int[] { 2, 3 }, false );
        assertThat( shaper.getItemsPerRecord() ).isEqualTo( 6 );

        // Row-major [[0,1,2],[3,4,5]] is stored with the first index fastest.
        int[] rowMajor = { 0, 1, 2, 3, 4, 5, 10, 11, 12, 13, 14, 15 };
        int[] colMajor = (int[]) shaper.fromRowMajor( rowMajor, 2 );
        assertThat( colMajor )
            .containsExactly( 0, 3, 1, 4, 2, 5, 10, 13, 11, 14, 12, 15 );
        assertThat( (int[]) shaper.toRowMajor( colMajor, 2 ) )
            .containsExactly( rowMajor );
    }

    @Test
    void keepsEpoch16PairsTogether() {
        Shaper shaper = Shaper.createShaper( DataType.EPOCH16,
                                             new int[] { 2, 2 }, false );
        double[] rowMajor = { 0, 0.5, 1, 1.5, 2, 2.5, 3, 3.5 };
        assertThat( (double[]) shaper.fromRowMajor( rowMajor, 1 ) )
            .containsExactly( 0, 0.5, 2, 2.5, 1, 1.5, 3, 3.5 );
    }
}
