package isis.dae.hardware;

import java.util.Arrays;

/**
 * Time-of-flight histogram for one detector or monitor element, as
 * fetched from the DAE for a single acquisition.
 *
 * The time axis is held as bin edges in microseconds; there is one more
 * edge than there are count bins.
 */
public final class Spectrum
{
    private final int number;
    private final double[] timeBinEdges;
    private final long[] counts;
    private final double[] countsPerTime;

    /**
     * Build a spectrum, deriving counts per unit time from the bin widths.
     */
    public Spectrum(final int number, final double[] timeBinEdges,
                    final long[] counts)
    {
        this(number, timeBinEdges, counts, perUnitTime(timeBinEdges, counts));
    }

    public Spectrum(final int number, final double[] timeBinEdges,
                    final long[] counts, final double[] countsPerTime)
    {
        if (timeBinEdges == null || counts == null || countsPerTime == null) {
            throw new IllegalArgumentException("Spectrum " + number +
                                               " has missing arrays");
        }
        if (counts.length != timeBinEdges.length - 1 ||
            countsPerTime.length != counts.length)
        {
            throw new IllegalArgumentException("Spectrum " + number +
                                               " has " + timeBinEdges.length +
                                               " bin edges but " +
                                               counts.length + " counts");
        }
        for (int i = 1; i < timeBinEdges.length; i++) {
            if (!(timeBinEdges[i] > timeBinEdges[i - 1])) {
                throw new IllegalArgumentException("Spectrum " + number +
                                                   " bin edges are not" +
                                                   " strictly increasing at " +
                                                   i);
            }
        }

        this.number = number;
        this.timeBinEdges = timeBinEdges.clone();
        this.counts = counts.clone();
        this.countsPerTime = countsPerTime.clone();
    }

    private static double[] perUnitTime(final double[] edges,
                                        final long[] counts)
    {
        if (edges == null || counts == null ||
            counts.length != edges.length - 1)
        {
            // let the main constructor report the shape problem
            return new double[counts == null ? 0 : counts.length];
        }

        double[] result = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            result[i] = counts[i] / (edges[i + 1] - edges[i]);
        }
        return result;
    }

    public int getNumber()
    {
        return number;
    }

    public int getNumBins()
    {
        return counts.length;
    }

    public double[] getTimeBinEdges()
    {
        return timeBinEdges.clone();
    }

    public long[] getCounts()
    {
        return counts.clone();
    }

    public double[] getCountsPerTime()
    {
        return countsPerTime.clone();
    }

    /**
     * @return counts as doubles, suitable for rebinning
     */
    public double[] getCountsAsDouble()
    {
        double[] result = new double[counts.length];
        for (int i = 0; i < counts.length; i++) {
            result[i] = counts[i];
        }
        return result;
    }

    public long getTotalCounts()
    {
        long total = 0;
        for (long c : counts) {
            total += c;
        }
        return total;
    }

    @Override
    public String toString()
    {
        return "Spectrum[" + number + ", " + counts.length + " bins, " +
            Arrays.toString(new double[] {
                    timeBinEdges[0], timeBinEdges[timeBinEdges.length - 1]
                }) + " us]";
    }
}
