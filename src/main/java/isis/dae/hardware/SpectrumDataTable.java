package isis.dae.hardware;

/**
 * View onto the DAE's per-pixel spectrum-data table for one period.
 *
 * The electronics publish the table as a flat array of
 * <tt>(numSpectra + 1) x (numTimeChannels + 1)</tt> integers.  Row 0 is
 * spectrum 0 (unused by instruments) so rows can be indexed directly by
 * spectrum number; column 0 is time channel 0, which holds junk and is
 * never exposed.
 */
public final class SpectrumDataTable
{
    /**
     * Upper bound on <tt>periods x (spectra + 1) x (channels + 1)</tt>
     * imposed by the size of the hardware table.
     */
    public static final long MAX_ELEMENTS = 5000000L;

    private final int[] data;
    private final int numSpectra;
    private final int numTimeChannels;

    public SpectrumDataTable(final int[] raw, final int numSpectra,
                             final int numTimeChannels)
        throws HardwareException
    {
        if (numSpectra < 0 || numTimeChannels < 0) {
            throw new IllegalArgumentException("Bad table shape " +
                                               numSpectra + "x" +
                                               numTimeChannels);
        }

        final int rowLength = numTimeChannels + 1;
        final long needed = (long) (numSpectra + 1) * rowLength;
        if (raw == null || raw.length < needed) {
            throw new HardwareException("Spectrum data table holds " +
                                        (raw == null ? 0 : raw.length) +
                                        " values, need " + needed + " for " +
                                        numSpectra + " spectra of " +
                                        numTimeChannels + " channels");
        }

        this.data = raw;
        this.numSpectra = numSpectra;
        this.numTimeChannels = numTimeChannels;
    }

    /**
     * Number of table elements needed for the given hardware shape.
     */
    public static long requiredElements(final int periods,
                                        final int numSpectra,
                                        final int numTimeChannels)
    {
        return (long) periods * (numSpectra + 1) * (numTimeChannels + 1);
    }

    /**
     * @return <tt>true</tt> if the shape fits in the hardware table
     */
    public static boolean fits(final int periods, final int numSpectra,
                               final int numTimeChannels)
    {
        return requiredElements(periods, numSpectra, numTimeChannels) <=
            MAX_ELEMENTS;
    }

    public int getNumSpectra()
    {
        return numSpectra;
    }

    public int getNumTimeChannels()
    {
        return numTimeChannels;
    }

    private int rowOffset(final int spectrum)
    {
        if (spectrum < 0 || spectrum > numSpectra) {
            throw new IndexOutOfBoundsException("Spectrum " + spectrum +
                                                " outside 0.." + numSpectra);
        }
        return spectrum * (numTimeChannels + 1);
    }

    /**
     * Counts for one spectrum, time channel 0 excluded.
     */
    public long[] getCounts(final int spectrum)
    {
        final int off = rowOffset(spectrum);
        long[] row = new long[numTimeChannels];
        for (int i = 0; i < numTimeChannels; i++) {
            row[i] = data[off + 1 + i];
        }
        return row;
    }

    /**
     * Sum of one spectrum over the full time-of-flight range.
     */
    public long integrate(final int spectrum)
    {
        final int off = rowOffset(spectrum);
        long total = 0;
        for (int i = 1; i <= numTimeChannels; i++) {
            total += data[off + i];
        }
        return total;
    }

    public long[] integrate(final int[] spectra)
    {
        long[] result = new long[spectra.length];
        for (int i = 0; i < spectra.length; i++) {
            result[i] = integrate(spectra[i]);
        }
        return result;
    }
}
