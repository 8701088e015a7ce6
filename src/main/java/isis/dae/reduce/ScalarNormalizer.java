package isis.dae.reduce;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.Reducer;
import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.HardwareSignal;
import isis.dae.signal.Signal;
import isis.dae.signal.SoftSignalBank;
import isis.dae.stats.Measurement;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Sum a set of detector spectra, then divide by a scalar hardware counter.
 * The counter is treated as exact, so
 * <tt>Var(intensity) = Var(counts) / denominator^2</tt>.
 */
public abstract class ScalarNormalizer
    implements Reducer
{
    private static final Logger logger =
        Logger.getLogger(ScalarNormalizer.class);

    private final int[] detectors;
    private final SpectraSummer detectorSummer;

    private final SoftSignalBank bank = new SoftSignalBank();
    private final SoftSignalBank.SoftSignal detCounts =
        bank.register("det_counts", "counts");
    private final SoftSignalBank.SoftSignal intensity =
        bank.register("intensity", null);
    private final SoftSignalBank.SoftSignal detCountsStddev =
        bank.register("det_counts_stddev", "counts");
    private final SoftSignalBank.SoftSignal intensityStddev =
        bank.register("intensity_stddev", null);

    protected ScalarNormalizer(final int[] detectors)
    {
        this(detectors, SpectraSummers.full());
    }

    protected ScalarNormalizer(final int[] detectors,
                               final SpectraSummer detectorSummer)
    {
        if (detectorSummer == null) {
            throw new IllegalArgumentException("No detector summer");
        }
        this.detectors = ReducerSupport.copySpectra(detectors, "detector");
        this.detectorSummer = detectorSummer;
    }

    /**
     * The normalisation denominator.
     */
    public abstract HardwareSignal getDenominator(IDaeHardware hardware);

    public int[] getDetectors()
    {
        return detectors.clone();
    }

    @Override
    public void checkConfiguration(final IDaeHardware hardware)
        throws AcquisitionError
    {
        ReducerSupport.checkSpectra(hardware, detectors, "detector");
    }

    @Override
    public void reduceData(final IDaeHardware hardware)
        throws AcquisitionError
    {
        logger.info("starting reduction");

        final HardwareSignal denomSignal = getDenominator(hardware);

        final Measurement counts;
        final double denominator;
        try {
            counts = detectorSummer.sum(hardware, detectors);
            denominator = denomSignal.readValue().doubleValue();
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot read data to normalise", he);
        }

        if (denominator == 0.0) {
            throw new AcquisitionError("Cannot normalize; " +
                                       denomSignal.getName() +
                                       " is zero. Check beamline" +
                                       " configuration.");
        }

        final Measurement normalised =
            counts.divide(Measurement.exact(denominator));

        bank.update()
            .set(detCounts, counts.getValue(), counts.getVariance())
            .set(detCountsStddev, counts.getStddev())
            .set(intensity, normalised.getValue(), normalised.getVariance())
            .set(intensityStddev, normalised.getStddev())
            .commit();

        logger.info("reduction complete");
    }

    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        List<Signal> list = new ArrayList<Signal>();
        list.add(detCounts);
        list.add(intensity);
        list.add(getDenominator(hardware));
        list.add(detCountsStddev);
        list.add(intensityStddev);
        return list;
    }
}
