package isis.dae.reduce;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.Reducer;
import isis.dae.hardware.IDaeHardware;
import isis.dae.hardware.SpectrumDataTable;
import isis.dae.signal.Signal;
import isis.dae.signal.SoftSignalBank;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Publishes the full time-of-flight integral of many spectra in the
 * current period, read from the spectrum-data table in a single round
 * trip.  No normalisation is done; downstream consumers decide how the
 * detector and monitor integrals are combined.
 */
public class PeriodSpecIntegralsReducer
    implements Reducer
{
    private static final Logger logger =
        Logger.getLogger(PeriodSpecIntegralsReducer.class);

    private final int[] monitors;
    private final int[] detectors;

    private final SoftSignalBank bank = new SoftSignalBank();
    private final SoftSignalBank.SoftSignal monIntegrals =
        bank.register("mon_integrals", "counts", new long[0]);
    private final SoftSignalBank.SoftSignal detIntegrals =
        bank.register("det_integrals", "counts", new long[0]);

    /**
     * @param monitors monitor spectra, in output order
     * @param detectors detector spectra, in output order
     */
    public PeriodSpecIntegralsReducer(final int[] monitors,
                                      final int[] detectors)
    {
        this.monitors = ReducerSupport.copySpectra(monitors, "monitor");
        this.detectors = ReducerSupport.copySpectra(detectors, "detector");
    }

    public int[] getMonitors()
    {
        return monitors.clone();
    }

    public int[] getDetectors()
    {
        return detectors.clone();
    }

    /**
     * Rejects hardware whose spectrum-data table would be too large to
     * read, before any data is taken.
     */
    @Override
    public void checkConfiguration(final IDaeHardware hardware)
        throws AcquisitionError
    {
        ReducerSupport.checkTableFits(hardware);
        ReducerSupport.checkSpectra(hardware, monitors, "monitor");
        ReducerSupport.checkSpectra(hardware, detectors, "detector");
    }

    @Override
    public void reduceData(final IDaeHardware hardware)
        throws AcquisitionError
    {
        logger.info("starting reduction");

        final SpectrumDataTable table = ReducerSupport.readTable(hardware);

        final long[] det;
        final long[] mon;
        try {
            det = table.integrate(detectors);
            mon = table.integrate(monitors);
        } catch (IndexOutOfBoundsException ioe) {
            throw new AcquisitionError("Spectrum data table is missing" +
                                       " requested spectra", ioe);
        }

        bank.update()
            .set(monIntegrals, mon)
            .set(detIntegrals, det)
            .commit();

        logger.info("reduction complete");
    }

    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        List<Signal> list = new ArrayList<Signal>();
        list.add(monIntegrals);
        list.add(detIntegrals);
        return list;
    }
}
