package isis.dae.acquisition;

import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.Signal;
import isis.dae.signal.SoftSignalBank;

import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Counts each scan point into its own run, which is ended or aborted when
 * the point stops counting.
 */
public class RunPerPointController
    extends AbstractController
{
    private static final Logger logger =
        Logger.getLogger(RunPerPointController.class);

    private final SoftSignalBank bank = new SoftSignalBank();
    /**
     * The run actually counted into.  The hardware run number moves on as
     * soon as a run ends, so it is captured while counting.
     */
    private final SoftSignalBank.SoftSignal runNumber =
        bank.register("run_number", null, Integer.valueOf(0));

    public RunPerPointController(final boolean saveRun)
    {
        super(saveRun);
    }

    @Override
    public AcquisitionUnit getAcquisitionUnit()
    {
        return AcquisitionUnit.RUN;
    }

    @Override
    public void setup(final IDaeHardware hardware)
    {
        setUnitOpen(false);
    }

    @Override
    public void startCounting(final IDaeHardware hardware)
        throws AcquisitionError, InterruptedException
    {
        logger.info("start counting");
        try {
            hardware.beginRun(false);
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot begin run", he);
        }
        setUnitOpen(true);

        waitForCounting(hardware);

        logger.info("saving current run number");
        final int num;
        try {
            num = hardware.getRunNumber();
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot read run number", he);
        }
        bank.update().set(runNumber, Integer.valueOf(num)).commit();
    }

    @Override
    public void stopCounting(final IDaeHardware hardware)
        throws AcquisitionError
    {
        logger.info("stop counting");
        endOrAbortRun(hardware);
        setUnitOpen(false);
    }

    /**
     * Closes a run left open by a point which failed while counting.
     */
    @Override
    public void teardown(final IDaeHardware hardware)
        throws AcquisitionError
    {
        if (isUnitOpen()) {
            logger.warn("Closing run left open by an unfinished point");
            endOrAbortRun(hardware);
            setUnitOpen(false);
        }
    }

    /**
     * The run number is only interesting if the run is kept.
     */
    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        if (saveRun) {
            return bank.getSignals();
        }
        return Collections.emptyList();
    }
}
