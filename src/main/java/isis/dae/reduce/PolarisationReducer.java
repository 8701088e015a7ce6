package isis.dae.reduce;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.Reducer;
import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.Signal;
import isis.dae.signal.SoftSignalBank;
import isis.dae.stats.Bounds;
import isis.dae.stats.Measurement;
import isis.dae.stats.Polarisation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Combine the spin-up and spin-down band intensities of a polarised
 * measurement into a polarisation and a flipping ratio for each band.
 *
 * Runs after both sub-acquisitions of a point have been reduced; it reads
 * nothing from the hardware itself.
 */
public class PolarisationReducer
    implements Reducer
{
    private static final Logger logger =
        Logger.getLogger(PolarisationReducer.class);

    private final List<Bounds> intervals;
    private final MultiWavelengthBandNormalizer reducerUp;
    private final MultiWavelengthBandNormalizer reducerDown;

    private final SoftSignalBank bank = new SoftSignalBank();
    private final SoftSignalBank.SoftSignal[][] bandSignals;

    private static final int POL = 0;
    private static final int POL_STDDEV = 1;
    private static final int RATIO = 2;
    private static final int RATIO_STDDEV = 3;

    /**
     * @param intervals wavelength intervals, one per band
     * @param reducerUp normalizer reduced after the spin-up acquisition
     * @param reducerDown normalizer reduced after the spin-down acquisition
     */
    public PolarisationReducer(final List<Bounds> intervals,
                               final MultiWavelengthBandNormalizer reducerUp,
                               final MultiWavelengthBandNormalizer reducerDown)
    {
        if (intervals == null || intervals.isEmpty()) {
            throw new IllegalArgumentException("No wavelength intervals");
        }
        if (reducerUp == null || reducerDown == null) {
            throw new IllegalArgumentException("Need spin-up and spin-down" +
                                               " reducers");
        }

        this.intervals = Collections.unmodifiableList(
            new ArrayList<Bounds>(intervals));
        this.reducerUp = reducerUp;
        this.reducerDown = reducerDown;

        bandSignals = new SoftSignalBank.SoftSignal[intervals.size()][];
        for (int i = 0; i < bandSignals.length; i++) {
            final String pre = WavelengthBand.signalPrefix(i);
            bandSignals[i] = new SoftSignalBank.SoftSignal[] {
                bank.register(pre + "polarisation", null),
                bank.register(pre + "polarisation_stddev", null),
                bank.register(pre + "polarisation_ratio", null),
                bank.register(pre + "polarisation_ratio_stddev", null),
            };
        }
    }

    public List<Bounds> getIntervals()
    {
        return intervals;
    }

    public MultiWavelengthBandNormalizer getReducerUp()
    {
        return reducerUp;
    }

    public MultiWavelengthBandNormalizer getReducerDown()
    {
        return reducerDown;
    }

    /**
     * @throws AcquisitionError if the spin-up and spin-down reducers do not
     *         produce one band per interval
     */
    @Override
    public void checkConfiguration(final IDaeHardware hardware)
        throws AcquisitionError
    {
        checkBandCounts(reducerUp.getNumBands(), reducerDown.getNumBands());
    }

    private void checkBandCounts(final int up, final int down)
        throws AcquisitionError
    {
        if (up != down) {
            throw new AcquisitionError("Mismatched number of wavelength" +
                                       " bands (" + up + " up, " + down +
                                       " down)");
        }
        if (up != intervals.size()) {
            throw new AcquisitionError("Got " + up + " wavelength bands for " +
                                       intervals.size() + " intervals");
        }
    }

    @Override
    public void reduceData(final IDaeHardware hardware)
        throws AcquisitionError
    {
        logger.info("starting polarisation");

        final List<WavelengthBand> up = reducerUp.getBands();
        final List<WavelengthBand> down = reducerDown.getBands();
        checkBandCounts(up.size(), down.size());

        SoftSignalBank.Update update = bank.update();
        for (int i = 0; i < intervals.size(); i++) {
            final Measurement a = up.get(i).getIntensity();
            final Measurement b = down.get(i).getIntensity();

            if (a.getValue() + b.getValue() == 0.0) {
                throw new AcquisitionError("Cannot calculate polarisation" +
                                           " in band " + i + "; up and down" +
                                           " intensities sum to zero");
            }
            if (b.getValue() == 0.0) {
                throw new AcquisitionError("Cannot calculate polarisation" +
                                           " ratio in band " + i +
                                           "; zero spin-down intensity");
            }

            final Measurement pol = Polarisation.calculate(a, b);
            final Measurement ratio = Polarisation.ratio(a, b);

            final SoftSignalBank.SoftSignal[] sigs = bandSignals[i];
            update.set(sigs[POL], pol.getValue(), pol.getVariance())
                .set(sigs[POL_STDDEV], pol.getStddev())
                .set(sigs[RATIO], ratio.getValue(), ratio.getVariance())
                .set(sigs[RATIO_STDDEV], ratio.getStddev());

            if (logger.isDebugEnabled()) {
                logger.debug("Band " + i + " " + intervals.get(i) + ": P=" +
                             pol + " R=" + ratio);
            }
        }
        update.commit();

        logger.info("polarisation complete");
    }

    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        return bank.getSignals();
    }
}
