package isis.dae.stats;

/**
 * A scalar value with its variance.
 *
 * Arithmetic assumes the operands are statistically independent; use
 * {@link Polarisation} for quantities built twice from the same inputs.
 */
public final class Measurement
{
    public static final Measurement ZERO = new Measurement(0.0, 0.0);

    private final double value;
    private final double variance;

    public Measurement(final double value, final double variance)
    {
        if (variance < 0.0 || Double.isNaN(variance)) {
            throw new IllegalArgumentException("Bad variance " + variance +
                                               " for value " + value);
        }
        this.value = value;
        this.variance = variance;
    }

    /**
     * Raw Poisson counts, with the <tt>N + 0.5</tt> variance convention.
     */
    public static Measurement fromCounts(final double counts)
    {
        return new Measurement(counts, Uncertainty.countVariance(counts));
    }

    /**
     * A value known without uncertainty (frame counts, for example).
     */
    public static Measurement exact(final double value)
    {
        return new Measurement(value, 0.0);
    }

    public double getValue()
    {
        return value;
    }

    public double getVariance()
    {
        return variance;
    }

    public double getStddev()
    {
        return Math.sqrt(variance);
    }

    public Measurement plus(final Measurement other)
    {
        return new Measurement(value + other.value,
                               variance + other.variance);
    }

    public Measurement minus(final Measurement other)
    {
        return new Measurement(value - other.value,
                               variance + other.variance);
    }

    public Measurement scale(final double factor)
    {
        return new Measurement(value * factor, variance * factor * factor);
    }

    /**
     * Ratio of independent quantities:
     * <tt>Var(a/b) = (a/b)^2 (Var(a)/a^2 + Var(b)/b^2)</tt>, written in a
     * form that stays finite when <tt>a</tt> is zero.
     *
     * @throws ArithmeticException if the divisor is zero
     */
    public Measurement divide(final Measurement divisor)
    {
        final double b = divisor.value;
        if (b == 0.0) {
            throw new ArithmeticException("Division of " + this +
                                          " by zero");
        }

        final double ratio = value / b;
        final double b2 = b * b;
        final double var = variance / b2 +
            value * value * divisor.variance / (b2 * b2);
        return new Measurement(ratio, var);
    }

    @Override
    public boolean equals(final Object obj)
    {
        if (!(obj instanceof Measurement)) {
            return false;
        }
        Measurement m = (Measurement) obj;
        return Double.compare(value, m.value) == 0 &&
            Double.compare(variance, m.variance) == 0;
    }

    @Override
    public int hashCode()
    {
        return Double.valueOf(value).hashCode() * 31 +
            Double.valueOf(variance).hashCode();
    }

    @Override
    public String toString()
    {
        return value + "+/-" + getStddev();
    }
}
