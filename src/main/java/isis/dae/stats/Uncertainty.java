package isis.dae.stats;

/**
 * Counting-statistics conventions shared by every reducer.
 *
 * Raw Poisson counts <tt>N</tt> are given a variance of <tt>N + 0.5</tt>
 * rather than <tt>N</tt>.  A plain <tt>sqrt(N)</tt> uncertainty is zero for
 * empty bins, which hands downstream fits an infinite weight; the offset
 * keeps every uncertainty strictly positive and is within 0.3% of
 * <tt>sqrt(N)</tt> from <tt>N = 10</tt> upward.  It is applied once, where
 * counts first become a {@link Measurement}, and never again.
 */
public final class Uncertainty
{
    public static final double VARIANCE_ADDITION = 0.5;

    private Uncertainty()
    {
    }

    /**
     * @param counts a raw count, <tt>&gt;= 0</tt>
     * @return <tt>counts + 0.5</tt>
     */
    public static double countVariance(final double counts)
    {
        if (counts < 0.0 || Double.isNaN(counts)) {
            throw new IllegalArgumentException("Negative count " + counts);
        }
        return counts + VARIANCE_ADDITION;
    }

    public static double countStddev(final double counts)
    {
        return Math.sqrt(countVariance(counts));
    }

    public static double[] countVariances(final double[] counts)
    {
        double[] result = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            result[i] = countVariance(counts[i]);
        }
        return result;
    }

    public static double[] stddevs(final double[] variances)
    {
        double[] result = new double[variances.length];
        for (int i = 0; i < variances.length; i++) {
            result[i] = Math.sqrt(variances[i]);
        }
        return result;
    }
}
