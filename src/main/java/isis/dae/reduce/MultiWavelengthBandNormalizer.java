package isis.dae.reduce;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.Reducer;
import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.Signal;
import isis.dae.signal.SoftSignalBank;
import isis.dae.stats.Measurement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Monitor-normalise the same detectors over several wavelength bands.
 * Each band has its own summer, applied to both detectors and monitors.
 *
 * The most recent set of bands is replaced as a whole after each
 * successful reduction.
 */
public class MultiWavelengthBandNormalizer
    implements Reducer
{
    private static final Logger logger =
        Logger.getLogger(MultiWavelengthBandNormalizer.class);

    private final int[] detectors;
    private final int[] monitors;
    private final List<SpectraSummer> bandSummers;

    private final SoftSignalBank bank;
    private final BandSignals[] bandSignals;

    private volatile List<WavelengthBand> bands;

    /** The signals published for one band. */
    private static final class BandSignals
    {
        final SoftSignalBank.SoftSignal detCounts;
        final SoftSignalBank.SoftSignal detCountsStddev;
        final SoftSignalBank.SoftSignal monCounts;
        final SoftSignalBank.SoftSignal monCountsStddev;
        final SoftSignalBank.SoftSignal intensity;
        final SoftSignalBank.SoftSignal intensityStddev;

        BandSignals(final SoftSignalBank bank, final int index)
        {
            final String pre = WavelengthBand.signalPrefix(index);
            detCounts = bank.register(pre + "det_counts", "counts");
            detCountsStddev = bank.register(pre + "det_counts_stddev",
                                            "counts");
            monCounts = bank.register(pre + "mon_counts", "counts");
            monCountsStddev = bank.register(pre + "mon_counts_stddev",
                                            "counts");
            intensity = bank.register(pre + "intensity", null);
            intensityStddev = bank.register(pre + "intensity_stddev", null);
        }
    }

    public MultiWavelengthBandNormalizer(final int[] detectors,
                                         final int[] monitors,
                                         final List<SpectraSummer> bandSummers)
    {
        this("", detectors, monitors, bandSummers);
    }

    /**
     * @param prefix prepended to every published name, so that two
     *               normalizers (spin up and down) can be published
     *               side by side
     */
    public MultiWavelengthBandNormalizer(final String prefix,
                                         final int[] detectors,
                                         final int[] monitors,
                                         final List<SpectraSummer> bandSummers)
    {
        if (bandSummers == null || bandSummers.isEmpty()) {
            throw new IllegalArgumentException("No wavelength bands");
        }
        this.detectors = ReducerSupport.copySpectra(detectors, "detector");
        this.monitors = ReducerSupport.copySpectra(monitors, "monitor");
        this.bandSummers = Collections.unmodifiableList(
            new ArrayList<SpectraSummer>(bandSummers));

        bank = new SoftSignalBank(prefix);
        bandSignals = new BandSignals[bandSummers.size()];
        List<WavelengthBand> initial = new ArrayList<WavelengthBand>();
        for (int i = 0; i < bandSignals.length; i++) {
            bandSignals[i] = new BandSignals(bank, i);
            initial.add(new WavelengthBand(i, Measurement.ZERO,
                                           Measurement.ZERO,
                                           Measurement.ZERO));
        }
        bands = Collections.unmodifiableList(initial);
    }

    public int getNumBands()
    {
        return bandSummers.size();
    }

    /**
     * @return the bands from the last successful reduction
     */
    public List<WavelengthBand> getBands()
    {
        return bands;
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
        logger.info("starting normalisation");

        List<WavelengthBand> next = new ArrayList<WavelengthBand>();
        SoftSignalBank.Update update = bank.update();

        for (int i = 0; i < bandSummers.size(); i++) {
            final SpectraSummer summer = bandSummers.get(i);

            final Measurement det;
            final Measurement mon;
            try {
                det = summer.sum(hardware, detectors);
                mon = summer.sum(hardware, monitors);
            } catch (HardwareException he) {
                throw new AcquisitionError("Cannot read spectra for" +
                                           " wavelength band " + i, he);
            }

            if (mon.getValue() == 0.0) {
                throw new AcquisitionError("Cannot normalize; got zero" +
                                           " monitor counts in wavelength" +
                                           " band " + i + ". Check" +
                                           " beamline configuration.");
            }

            final Measurement normalised = det.divide(mon);
            next.add(new WavelengthBand(i, det, mon, normalised));

            final BandSignals sigs = bandSignals[i];
            update.set(sigs.detCounts, det.getValue(), det.getVariance())
                .set(sigs.detCountsStddev, det.getStddev())
                .set(sigs.monCounts, mon.getValue(), mon.getVariance())
                .set(sigs.monCountsStddev, mon.getStddev())
                .set(sigs.intensity, normalised.getValue(),
                     normalised.getVariance())
                .set(sigs.intensityStddev, normalised.getStddev());
        }

        update.commit();
        bands = Collections.unmodifiableList(next);

        if (logger.isDebugEnabled()) {
            logger.debug("Normalised bands " + next);
        }
        logger.info("normalisation complete");
    }

    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        return bank.getSignals();
    }
}
