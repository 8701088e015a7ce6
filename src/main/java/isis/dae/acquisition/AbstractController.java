package isis.dae.acquisition;

import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.hardware.RunState;

import org.apache.log4j.Logger;

/**
 * Run-state handling shared by the run and period controllers.
 */
public abstract class AbstractController
    implements Controller
{
    private static final Logger logger =
        Logger.getLogger(AbstractController.class);

    /** <tt>true</tt> to end runs (saving data), <tt>false</tt> to abort. */
    protected final boolean saveRun;

    /** Set while a run or period is counting for the current point. */
    private boolean unitOpen;

    protected AbstractController(final boolean saveRun)
    {
        this.saveRun = saveRun;
    }

    public boolean isSaveRun()
    {
        return saveRun;
    }

    /**
     * @return <tt>true</tt> between a successful start of counting and the
     *         matching stop
     */
    public boolean isUnitOpen()
    {
        return unitOpen;
    }

    protected void setUnitOpen(final boolean open)
    {
        unitOpen = open;
    }

    /**
     * Wait until the hardware reports one of the counting states.
     */
    protected static void waitForCounting(final IDaeHardware hardware)
        throws AcquisitionError, InterruptedException
    {
        HardwarePoller.waitFor(hardware, "counting run state",
                               new HardwarePoller.Condition() {
                public boolean isSatisfied(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getRunState().isCounting();
                }
            }, HardwarePoller.STATE_CHANGE_TIMEOUT_MILLIS);
    }

    protected static void waitForState(final IDaeHardware hardware,
                                       final RunState state)
        throws AcquisitionError, InterruptedException
    {
        HardwarePoller.waitFor(hardware, "run state " + state,
                               new HardwarePoller.Condition() {
                public boolean isSatisfied(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getRunState() == state;
                }
            }, HardwarePoller.STATE_CHANGE_TIMEOUT_MILLIS);
    }

    /**
     * End the open run if saving, otherwise abort it.
     */
    protected void endOrAbortRun(final IDaeHardware hardware)
        throws AcquisitionError
    {
        try {
            if (saveRun) {
                logger.info("ending run");
                hardware.endRun();
                logger.info("run ended");
            } else {
                logger.info("aborting run");
                hardware.abortRun();
                logger.info("run aborted");
            }
        } catch (HardwareException he) {
            throw new AcquisitionError("Cannot " +
                                       (saveRun ? "end" : "abort") +
                                       " run", he);
        }
    }
}
