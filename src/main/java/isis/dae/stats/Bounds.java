package isis.dae.stats;

/**
 * A lower/upper pair along a spectrum's axis, either time of flight or
 * wavelength depending on its unit.
 */
public final class Bounds
{
    private final double lower;
    private final double upper;
    private final AxisUnit unit;

    public Bounds(final double lower, final double upper,
                  final AxisUnit unit)
    {
        if (unit == null) {
            throw new IllegalArgumentException("Bounds need a unit");
        }
        if (!(upper > lower)) {
            throw new IllegalArgumentException("Upper bound " + upper +
                                               " must be larger than lower" +
                                               " bound " + lower);
        }
        this.lower = lower;
        this.upper = upper;
        this.unit = unit;
    }

    /**
     * Build bounds from an array, which must hold exactly a lower and an
     * upper bound.
     */
    public static Bounds of(final double[] pair, final AxisUnit unit)
    {
        if (pair == null || pair.length != 2) {
            throw new IllegalArgumentException("Should contain lower and" +
                                               " upper bound");
        }
        return new Bounds(pair[0], pair[1], unit);
    }

    public double getLower()
    {
        return lower;
    }

    public double getUpper()
    {
        return upper;
    }

    public AxisUnit getUnit()
    {
        return unit;
    }

    /** Lower bound in microseconds or angstrom. */
    public double getBaseLower()
    {
        return unit.toBase(lower);
    }

    /** Upper bound in microseconds or angstrom. */
    public double getBaseUpper()
    {
        return unit.toBase(upper);
    }

    @Override
    public String toString()
    {
        return "[" + lower + ", " + upper + "] " + unit.getSymbol();
    }
}
