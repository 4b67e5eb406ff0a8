package io.github.mandar2812.cdfio.epoch;

/**
 * Value of the CDF_EPOCH16 data type.
 * The real part counts whole seconds since 0000-01-01T00:00:00,
 * the imaginary part counts picoseconds within that second.
 *
 * @since    4 Jul 2013
 */
public final class Epoch16 implements Comparable<Epoch16> {

    private final double real_;
    private final double imag_;

    /** Fill value, both parts -1e31. */
    public static final Epoch16 FILL = new Epoch16( -1.0e31, -1.0e31 );

    /**
     * Constructor.
     *
     * @param  real  seconds since year 0
     * @param  imag  picoseconds within the second
     */
    public Epoch16( double real, double imag ) {
        real_ = real;
        imag_ = imag;
    }

    /**
     * Returns the seconds part.
     *
     * @return  seconds since year 0
     */
    public double getReal() {
        return real_;
    }

    /**
     * Returns the picoseconds part.
     *
     * @return  picoseconds within the second
     */
    public double getImag() {
        return imag_;
    }

    /**
     * Indicates whether this is the fill value.
     *
     * @return  true for (-1e31, -1e31)
     */
    public boolean isFill() {
        return real_ == FILL.real_ && imag_ == FILL.imag_;
    }

    public int compareTo( Epoch16 other ) {
        int c = Double.compare( real_, other.real_ );
        return c != 0 ? c : Double.compare( imag_, other.imag_ );
    }

    @Override
    public boolean equals( Object o ) {
        if ( o instanceof Epoch16 ) {
            Epoch16 other = (Epoch16) o;
            return Double.compare( real_, other.real_ ) == 0
                && Double.compare( imag_, other.imag_ ) == 0;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode( real_ ) + Double.hashCode( imag_ );
    }

    @Override
    public String toString() {
        return "(" + real_ + ", " + imag_ + ")";
    }
}
