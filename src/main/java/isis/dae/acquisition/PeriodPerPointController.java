package isis.dae.acquisition;

import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.hardware.RunState;
import isis.dae.signal.HardwareSignal;
import isis.dae.signal.Signal;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Opens a single run in paused mode at setup, then counts each scan point
 * into the next period (starting from 1).  The run is ended or aborted at
 * teardown.
 */
public class PeriodPerPointController
    extends AbstractController
{
    private static final Logger logger =
        Logger.getLogger(PeriodPerPointController.class);

    private int currentPeriod;
    private boolean runOpen;

    public PeriodPerPointController(final boolean saveRun)
    {
        super(saveRun);
    }

    @Override
    public AcquisitionUnit getAcquisitionUnit()
    {
        return AcquisitionUnit.PERIOD;
    }

    public int getCurrentPeriod()
    {
        return currentPeriod;
    }

    @Override
    public void setup(final IDaeHardware hardware)
        throws AcquisitionError, InterruptedException
    {
        currentPeriod = 0;
        setUnitOpen(false);

        logger.info("setting up new run");
        try {
            hardware.beginRun(true);
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot begin paused run", he);
        }
        runOpen = true;

        waitForState(hardware, RunState.PAUSED);
        logger.info("setup complete");
    }

    @Override
    public void startCounting(final IDaeHardware hardware)
        throws AcquisitionError, InterruptedException
    {
        logger.info("start counting");
        final int next = currentPeriod + 1;

        try {
            final int maxPeriods = hardware.getNumberOfPeriods();
            if (next > maxPeriods) {
                throw new AcquisitionError("Cannot count into period " +
                                           next + "; only " + maxPeriods +
                                           " periods configured");
            }
            hardware.setPeriod(next);
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot set period " + next, he);
        }
        currentPeriod = next;

        // the electronics ignore a bad period rather than failing
        HardwarePoller.waitFor(hardware, "period " + next,
                               new HardwarePoller.Condition() {
                public boolean isSatisfied(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getPeriod() == next;
                }
            }, HardwarePoller.STATE_CHANGE_TIMEOUT_MILLIS);

        logger.info("waiting for frame counters to be zero");
        HardwarePoller.waitFor(hardware, "period frame counters to reset",
                               new HardwarePoller.Condition() {
                public boolean isSatisfied(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getPeriodGoodFrames() == 0 &&
                        hw.getPeriodRawFrames() == 0;
                }
            }, HardwarePoller.STATE_CHANGE_TIMEOUT_MILLIS);

        logger.info("resuming run");
        try {
            hardware.resumeRun();
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot resume run", he);
        }
        setUnitOpen(true);

        waitForCounting(hardware);
    }

    @Override
    public void stopCounting(final IDaeHardware hardware)
        throws AcquisitionError, InterruptedException
    {
        logger.info("stop counting");
        try {
            hardware.pauseRun();
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot pause run", he);
        }
        waitForState(hardware, RunState.PAUSED);
        setUnitOpen(false);
    }

    @Override
    public void teardown(final IDaeHardware hardware)
        throws AcquisitionError
    {
        if (!runOpen) {
            return;
        }
        endOrAbortRun(hardware);
        runOpen = false;
        setUnitOpen(false);
    }

    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        List<Signal> list = new ArrayList<Signal>();
        list.add(HardwareSignal.periodNumber(hardware));
        return list;
    }
}
