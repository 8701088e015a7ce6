package isis.dae.reduce;

import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.hardware.Spectrum;
import isis.dae.stats.Bounds;
import isis.dae.stats.Measurement;
import isis.dae.stats.NeutronConversions;
import isis.dae.stats.Rebinner;

import org.apache.log4j.Logger;

/**
 * The available ways of summing spectra.
 */
public final class SpectraSummers
{
    private static final Logger logger =
        Logger.getLogger(SpectraSummers.class);

    private static final SpectraSummer FULL = new FullSummer();

    private SpectraSummers()
    {
    }

    /**
     * Sum every time channel of each spectrum.
     */
    public static SpectraSummer full()
    {
        return FULL;
    }

    /**
     * Sum each spectrum between two time-of-flight bounds, splitting the
     * edge channels by fractional overlap.
     *
     * @throws IllegalArgumentException if the bounds are not in a time unit
     */
    public static SpectraSummer tofBounded(final Bounds bounds)
    {
        if (bounds == null || !bounds.getUnit().isTime()) {
            throw new IllegalArgumentException("Time-of-flight bounds need" +
                                               " a time unit, not " + bounds);
        }
        return new TofBoundedSummer(bounds);
    }

    /**
     * Sum each spectrum between two wavelength bounds.  The time axis is
     * converted to wavelength using the given flight path.
     *
     * @param lTotal source to detector distance in metres
     *
     * @throws IllegalArgumentException if the bounds are not in a length
     *         unit or the flight path is not positive
     */
    public static SpectraSummer wavelengthBounded(final Bounds bounds,
                                                  final double lTotal)
    {
        if (bounds == null || !bounds.getUnit().isLength()) {
            throw new IllegalArgumentException("Wavelength bounds need a" +
                                               " length unit, not " + bounds);
        }
        if (!(lTotal > 0.0)) {
            throw new IllegalArgumentException("Flight path length must be" +
                                               " positive, not " + lTotal);
        }
        return new WavelengthBoundedSummer(bounds, lTotal);
    }

    /**
     * Reads each spectrum and adds the per-spectrum counts.
     */
    abstract static class AbstractSummer
        implements SpectraSummer
    {
        abstract double countsIn(Spectrum spectrum);

        @Override
        public Measurement sum(final IDaeHardware hardware,
                               final int[] spectra)
            throws HardwareException
        {
            if (logger.isDebugEnabled()) {
                logger.debug("Summing " + spectra.length + " spectra with " +
                             this);
            }

            Measurement total = Measurement.ZERO;
            for (int spec : spectra) {
                final double counts = countsIn(hardware.readSpectrum(0, spec));
                total = total.plus(Measurement.fromCounts(counts));
            }

            if (logger.isDebugEnabled()) {
                logger.debug("Summed counts: " + total);
            }
            return total;
        }
    }

    static final class FullSummer
        extends AbstractSummer
    {
        @Override
        double countsIn(final Spectrum spectrum)
        {
            return spectrum.getTotalCounts();
        }

        @Override
        public String toString()
        {
            return "FullSummer";
        }
    }

    static final class TofBoundedSummer
        extends AbstractSummer
    {
        private final Bounds bounds;

        TofBoundedSummer(final Bounds bounds)
        {
            this.bounds = bounds;
        }

        @Override
        double countsIn(final Spectrum spectrum)
        {
            return Rebinner.sumWithin(spectrum.getTimeBinEdges(),
                                      spectrum.getCountsAsDouble(),
                                      bounds.getBaseLower(),
                                      bounds.getBaseUpper());
        }

        @Override
        public String toString()
        {
            return "TofBoundedSummer" + bounds;
        }
    }

    static final class WavelengthBoundedSummer
        extends AbstractSummer
    {
        private final Bounds bounds;
        private final double lTotal;

        WavelengthBoundedSummer(final Bounds bounds, final double lTotal)
        {
            this.bounds = bounds;
            this.lTotal = lTotal;
        }

        @Override
        double countsIn(final Spectrum spectrum)
        {
            final double[] wavelengths =
                NeutronConversions.wavelength(spectrum.getTimeBinEdges(),
                                              lTotal);
            return Rebinner.sumWithin(wavelengths,
                                      spectrum.getCountsAsDouble(),
                                      bounds.getBaseLower(),
                                      bounds.getBaseUpper());
        }

        @Override
        public String toString()
        {
            return "WavelengthBoundedSummer" + bounds + "@" + lTotal + "m";
        }
    }
}
