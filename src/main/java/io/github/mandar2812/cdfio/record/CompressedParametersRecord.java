package io.github.mandar2812.cdfio.record;

/**
 * Field data for CDF record of type Compressed Parameters Record.
 *
 * @since    19 Jun 2013
 */
public class CompressedParametersRecord extends Record {

    public final int cType;
    public final int[] cParms;

    /**
     * Constructor.
     *
     * @param  plan   basic record information
     * @param  cType  compression type code
     * @param  cParms  compression parameters
     */
    public CompressedParametersRecord( RecordPlan plan, int cType,
                                       int[] cParms ) {
        super( plan, "CPR" );
        this.cType = cType;
        this.cParms = cParms;
    }

    /**
     * Returns the first compression parameter, the gzip level.
     *
     * @return  level, or 0 if no parameters
     */
    public int getLevel() {
        return cParms.length > 0 ? cParms[ 0 ] : 0;
    }
}
