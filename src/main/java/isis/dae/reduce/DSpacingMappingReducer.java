package isis.dae.reduce;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.Reducer;
import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.hardware.Spectrum;
import isis.dae.hardware.SpectrumDataTable;
import isis.dae.signal.Signal;
import isis.dae.signal.SoftSignalBank;
import isis.dae.stats.NeutronConversions;
import isis.dae.stats.Rebinner;
import isis.dae.stats.Uncertainty;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Publishes a d-spacing histogram at each scan point.
 *
 * Each detector pixel's time-of-flight bin edges are converted to
 * d-spacing using the pixel's flight path and scattering angle, the pixel
 * is rebinned onto a common set of d-spacing edges, and all pixels are
 * summed.  The result is in counts, which may be fractional after
 * rebinning.
 *
 * All detectors are assumed to share the first detector's time channel
 * boundaries.  This is not checked.
 */
public class DSpacingMappingReducer
    implements Reducer
{
    private static final Logger logger =
        Logger.getLogger(DSpacingMappingReducer.class);

    private final int[] detectors;
    private final double[] lTotal;
    private final double[] twoTheta;
    private final double[] dspacingBinEdges;

    private final SoftSignalBank bank = new SoftSignalBank();
    private final SoftSignalBank.SoftSignal dspacing;

    /**
     * @param detectors detector spectra to map
     * @param lTotal total flight path of each detector, in metres
     * @param twoTheta scattering angle of each detector, in degrees
     * @param dspacingBinEdges strictly ascending output edges, in angstrom
     */
    public DSpacingMappingReducer(final int[] detectors, final double[] lTotal,
                                  final double[] twoTheta,
                                  final double[] dspacingBinEdges)
    {
        this.detectors = ReducerSupport.copySpectra(detectors, "detector");
        if (lTotal == null || lTotal.length != detectors.length) {
            throw new IllegalArgumentException("lTotal and detectors must" +
                                               " have same shape");
        }
        if (twoTheta == null || twoTheta.length != detectors.length) {
            throw new IllegalArgumentException("two theta and detectors" +
                                               " must have same shape");
        }
        for (int i = 0; i < detectors.length; i++) {
            if (!(lTotal[i] > 0.0)) {
                throw new IllegalArgumentException("Bad flight path " +
                                                   lTotal[i] +
                                                   " for detector " +
                                                   detectors[i]);
            }
            if (!(twoTheta[i] > 0.0 && twoTheta[i] < 360.0)) {
                throw new IllegalArgumentException("Bad scattering angle " +
                                                   twoTheta[i] +
                                                   " for detector " +
                                                   detectors[i]);
            }
        }
        Rebinner.checkAscending(dspacingBinEdges, "d-spacing");

        this.lTotal = lTotal.clone();
        this.twoTheta = twoTheta.clone();
        this.dspacingBinEdges = dspacingBinEdges.clone();

        dspacing = bank.register("dspacing", "counts",
                                 new double[dspacingBinEdges.length - 1]);
    }

    public double[] getDspacingBinEdges()
    {
        return dspacingBinEdges.clone();
    }

    @Override
    public void checkConfiguration(final IDaeHardware hardware)
        throws AcquisitionError
    {
        ReducerSupport.checkTableFits(hardware);
        ReducerSupport.checkSpectra(hardware, detectors, "detector");
    }

    @Override
    public void reduceData(final IDaeHardware hardware)
        throws AcquisitionError
    {
        logger.info("starting reduction reads");

        final SpectrumDataTable table = ReducerSupport.readTable(hardware);
        final Spectrum first;
        try {
            first = hardware.readSpectrum(0, detectors[0]);
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot read spectrum " +
                                       detectors[0], he);
        }

        final double[] tofEdges = first.getTimeBinEdges();
        if (tofEdges.length - 1 != table.getNumTimeChannels()) {
            throw new AcquisitionError("Spectrum " + detectors[0] + " has " +
                                       (tofEdges.length - 1) +
                                       " time channels but the data table" +
                                       " has " + table.getNumTimeChannels());
        }

        logger.info("starting reduction");

        final int numBins = dspacingBinEdges.length - 1;
        double[] summed = new double[numBins];
        double[] variance = new double[numBins];

        for (int i = 0; i < detectors.length; i++) {
            final double[] pixelEdges =
                NeutronConversions.dspacing(tofEdges, lTotal[i], twoTheta[i]);

            final long[] raw = table.getCounts(detectors[i]);
            double[] counts = new double[raw.length];
            for (int c = 0; c < raw.length; c++) {
                counts[c] = raw[c];
            }

            final double[] binned =
                Rebinner.rebin(pixelEdges, counts, dspacingBinEdges);
            final double[] binnedVar =
                Rebinner.rebin(pixelEdges,
                               Uncertainty.countVariances(counts),
                               dspacingBinEdges);
            for (int b = 0; b < numBins; b++) {
                summed[b] += binned[b];
                variance[b] += binnedVar[b];
            }
        }

        bank.update().set(dspacing, summed, variance).commit();
        logger.info("reduction complete");
    }

    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        List<Signal> list = new ArrayList<Signal>();
        list.add(dspacing);
        return list;
    }
}
