package isis.dae.reduce;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.Reducer;
import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.Signal;
import isis.dae.signal.SoftSignalBank;
import isis.dae.stats.Measurement;

import java.util.List;

import org.apache.log4j.Logger;

/**
 * Normalise summed detector spectra by summed monitor spectra.
 *
 * Detector and monitor sums are independent, so
 * <tt>Var(I) = I^2 (Var(D)/D^2 + Var(M)/M^2)</tt>.
 */
public class MonitorNormalizer
    implements Reducer
{
    private static final Logger logger =
        Logger.getLogger(MonitorNormalizer.class);

    private final int[] detectors;
    private final int[] monitors;
    private final SpectraSummer detectorSummer;
    private final SpectraSummer monitorSummer;

    private final SoftSignalBank bank = new SoftSignalBank();
    private final SoftSignalBank.SoftSignal detCounts =
        bank.register("det_counts", "counts");
    private final SoftSignalBank.SoftSignal monCounts =
        bank.register("mon_counts", "counts");
    private final SoftSignalBank.SoftSignal intensity =
        bank.register("intensity", null);
    private final SoftSignalBank.SoftSignal detCountsStddev =
        bank.register("det_counts_stddev", "counts");
    private final SoftSignalBank.SoftSignal monCountsStddev =
        bank.register("mon_counts_stddev", "counts");
    private final SoftSignalBank.SoftSignal intensityStddev =
        bank.register("intensity_stddev", null);

    public MonitorNormalizer(final int[] detectors, final int[] monitors)
    {
        this(detectors, monitors, SpectraSummers.full(),
             SpectraSummers.full());
    }

    public MonitorNormalizer(final int[] detectors, final int[] monitors,
                             final SpectraSummer detectorSummer,
                             final SpectraSummer monitorSummer)
    {
        if (detectorSummer == null || monitorSummer == null) {
            throw new IllegalArgumentException("Need detector and monitor" +
                                               " summers");
        }
        this.detectors = ReducerSupport.copySpectra(detectors, "detector");
        this.monitors = ReducerSupport.copySpectra(monitors, "monitor");
        this.detectorSummer = detectorSummer;
        this.monitorSummer = monitorSummer;
    }

    public int[] getDetectors()
    {
        return detectors.clone();
    }

    public int[] getMonitors()
    {
        return monitors.clone();
    }

    @Override
    public void checkConfiguration(final IDaeHardware hardware)
        throws AcquisitionError
    {
        ReducerSupport.checkSpectra(hardware, detectors, "detector");
        ReducerSupport.checkSpectra(hardware, monitors, "monitor");
    }

    @Override
    public void reduceData(final IDaeHardware hardware)
        throws AcquisitionError
    {
        logger.info("starting reduction");

        final Measurement det;
        final Measurement mon;
        try {
            det = detectorSummer.sum(hardware, detectors);
            mon = monitorSummer.sum(hardware, monitors);
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot read spectra", he);
        }

        if (mon.getValue() == 0.0) {
            throw new AcquisitionError("Cannot normalize; got zero monitor" +
                                       " counts. Check beamline" +
                                       " configuration.");
        }

        final Measurement normalised = det.divide(mon);

        bank.update()
            .set(detCounts, det.getValue(), det.getVariance())
            .set(monCounts, mon.getValue(), mon.getVariance())
            .set(intensity, normalised.getValue(), normalised.getVariance())
            .set(detCountsStddev, det.getStddev())
            .set(monCountsStddev, mon.getStddev())
            .set(intensityStddev, normalised.getStddev())
            .commit();

        logger.info("reduction complete");
    }

    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        return bank.getSignals();
    }
}
