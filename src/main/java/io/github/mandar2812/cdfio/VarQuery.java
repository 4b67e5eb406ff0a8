package io.github.mandar2812.cdfio;

/**
 * Parameters for reading variable data.
 * The variable is named, or given by number; a record range or a
 * time range may restrict the records read, but not both.
 *
 * <p>Time bounds are epoch values (Double, Long, Epoch16) or component
 * arrays (double[] or int[]) as accepted by
 * {@link io.github.mandar2812.cdfio.epoch.EpochCodec#findEpochRange(DataType,Object,Object,Object)}.
 *
 * @since    2 Jul 2013
 */
public class VarQuery {

    private String name_;
    private Integer number_;
    private Integer startRec_;
    private Integer endRec_;
    private Object startTime_;
    private Object endTime_;
    private String epochVariable_;

    /**
     * Constructs a query for a named variable.
     *
     * @param  name  variable name
     */
    public VarQuery( String name ) {
        name_ = name;
    }

    /**
     * Constructs a query for a numbered variable.
     *
     * @param  number  variable number
     */
    public VarQuery( int number ) {
        number_ = Integer.valueOf( number );
    }

    public VarQuery startRecord( int startRec ) {
        startRec_ = Integer.valueOf( startRec );
        return this;
    }

    public VarQuery endRecord( int endRec ) {
        endRec_ = Integer.valueOf( endRec );
        return this;
    }

    public VarQuery startTime( Object startTime ) {
        startTime_ = startTime;
        return this;
    }

    public VarQuery endTime( Object endTime ) {
        endTime_ = endTime;
        return this;
    }

    /**
     * Names the epoch variable used to resolve a time range.
     * If not set, the variable itself is used if it is an epoch,
     * otherwise the variable named by its DEPEND_0 attribute.
     *
     * @param  epochVariable  epoch variable name
     * @return  this query
     */
    public VarQuery epochVariable( String epochVariable ) {
        epochVariable_ = epochVariable;
        return this;
    }

    public String getName() {
        return name_;
    }

    public Integer getNumber() {
        return number_;
    }

    public Integer getStartRecord() {
        return startRec_;
    }

    public Integer getEndRecord() {
        return endRec_;
    }

    public Object getStartTime() {
        return startTime_;
    }

    public Object getEndTime() {
        return endTime_;
    }

    public String getEpochVariable() {
        return epochVariable_;
    }

    public boolean hasTimeRange() {
        return startTime_ != null || endTime_ != null;
    }

    public boolean hasRecordRange() {
        return startRec_ != null || endRec_ != null;
    }
}
