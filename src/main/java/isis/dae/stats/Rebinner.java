package isis.dae.stats;

/**
 * Redistribute histogrammed values onto a new set of bin edges.
 *
 * Counts are assumed spread uniformly across each source bin, so a source
 * bin overlapping a target bin by a fraction <tt>f</tt> of its width gives
 * <tt>f</tt> of its value (and <tt>f</tt> of its variance) to that target.
 * Values outside the target range are dropped.
 */
public final class Rebinner
{
    private Rebinner()
    {
    }

    /**
     * @param oldEdges strictly ascending source edges, one longer than
     *                 <tt>values</tt>
     * @param values per-bin values (counts or variances)
     * @param newEdges strictly ascending target edges
     *
     * @return one value per target bin
     */
    public static double[] rebin(final double[] oldEdges,
                                 final double[] values,
                                 final double[] newEdges)
    {
        if (oldEdges.length != values.length + 1) {
            throw new IllegalArgumentException("Expected " +
                                               (values.length + 1) +
                                               " source edges, not " +
                                               oldEdges.length);
        }
        checkAscending(oldEdges, "Source");
        checkAscending(newEdges, "Target");

        double[] result = new double[newEdges.length - 1];

        int i = 0;
        int j = 0;
        while (i < values.length && j < result.length) {
            final double lo = Math.max(oldEdges[i], newEdges[j]);
            final double hi = Math.min(oldEdges[i + 1], newEdges[j + 1]);
            if (hi > lo) {
                final double width = oldEdges[i + 1] - oldEdges[i];
                result[j] += values[i] * (hi - lo) / width;
            }

            if (oldEdges[i + 1] < newEdges[j + 1]) {
                i++;
            } else if (oldEdges[i + 1] > newEdges[j + 1]) {
                j++;
            } else {
                i++;
                j++;
            }
        }

        return result;
    }

    /**
     * Sum the part of a histogram falling between two axis values.
     */
    public static double sumWithin(final double[] edges, final double[] values,
                                   final double lower, final double upper)
    {
        return rebin(edges, values, new double[] { lower, upper })[0];
    }

    /**
     * @throws IllegalArgumentException if there are fewer than two edges or
     *         they are not strictly ascending
     */
    public static void checkAscending(final double[] edges, final String what)
    {
        if (edges.length < 2) {
            throw new IllegalArgumentException(what + " bin edges need at" +
                                               " least two values");
        }
        for (int i = 1; i < edges.length; i++) {
            if (!(edges[i] > edges[i - 1])) {
                throw new IllegalArgumentException(what + " bin edges are" +
                                                   " not strictly ascending" +
                                                   " at index " + i);
            }
        }
    }
}
