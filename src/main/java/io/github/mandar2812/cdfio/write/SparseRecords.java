package io.github.mandar2812.cdfio.write;

import io.github.mandar2812.cdfio.CdfUsageException;
import java.util.ArrayList;
import java.util.List;

/**
 * Data for a sparse-record variable: the numbers of the records that
 * are physically present, and their values.
 *
 * <p>The values may cover just the listed records, in order,
 * or every record from 0 to the highest one listed,
 * in which case the values of virtual records are ignored.
 *
 * @since    3 Jul 2013
 */
public class SparseRecords {

    private final int[] records_;
    private final Object data_;

    /**
     * Constructor.
     *
     * @param  records  physical record numbers, strictly ascending
     * @param  data  values, in any form accepted for variable data
     * @throws  CdfUsageException  if the record list is empty or
     *          not ascending
     */
    public SparseRecords( int[] records, Object data ) {
        if ( records == null || records.length == 0 ) {
            throw new CdfUsageException( "No sparse record numbers" );
        }
        if ( data == null ) {
            throw new CdfUsageException( "No sparse record data" );
        }
        for ( int i = 0; i < records.length; i++ ) {
            if ( records[ i ] < 0
                 || ( i > 0 && records[ i ] <= records[ i - 1 ] ) ) {
                throw new CdfUsageException( "Sparse record numbers must be "
                                           + "non-negative and ascending" );
            }
        }
        records_ = records.clone();
        data_ = data;
    }

    public int[] getRecords() {
        return records_.clone();
    }

    public Object getData() {
        return data_;
    }

    /**
     * Groups the physical records into runs of consecutive numbers.
     *
     * @return  array of (first, last) pairs
     */
    public int[][] getRuns() {
        List<int[]> runs = new ArrayList<int[]>();
        int first = records_[ 0 ];
        int last = first;
        for ( int i = 1; i < records_.length; i++ ) {
            if ( records_[ i ] == last + 1 ) {
                last = records_[ i ];
            }
            else {
                runs.add( new int[] { first, last } );
                first = records_[ i ];
                last = first;
            }
        }
        runs.add( new int[] { first, last } );
        return runs.toArray( new int[ 0 ][] );
    }
}
