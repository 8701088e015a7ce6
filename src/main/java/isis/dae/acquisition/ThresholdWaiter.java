package isis.dae.acquisition;

import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.HardwareSignal;
import isis.dae.signal.Signal;

import java.util.ArrayList;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Wait for a single hardware counter to reach a value.
 *
 * The threshold may be changed between points with
 * {@link #setFinishWaitAt(double)}; the value in force when
 * {@link #awaitCompletion(IDaeHardware)} is entered is used for the whole
 * point.
 */
public abstract class ThresholdWaiter
    implements Waiter
{
    private static final Logger logger =
        Logger.getLogger(ThresholdWaiter.class);

    private volatile double finishWaitAt;
    private final long pollMillis;

    protected ThresholdWaiter(final double finishWaitAt)
    {
        this(finishWaitAt, 0L);
    }

    /**
     * @param pollMillis poll interval, or 0 for the configured default
     */
    protected ThresholdWaiter(final double finishWaitAt,
                              final long pollMillis)
    {
        if (Double.isNaN(finishWaitAt)) {
            throw new IllegalArgumentException("Threshold is not a number");
        }
        if (pollMillis < 0) {
            throw new IllegalArgumentException("Negative poll interval " +
                                               pollMillis);
        }
        this.finishWaitAt = finishWaitAt;
        this.pollMillis = pollMillis;
    }

    public double getFinishWaitAt()
    {
        return finishWaitAt;
    }

    public void setFinishWaitAt(final double value)
    {
        if (Double.isNaN(value)) {
            throw new IllegalArgumentException("Threshold is not a number");
        }
        finishWaitAt = value;
    }

    /**
     * The counter this waiter watches.
     */
    public abstract HardwareSignal getSignal(IDaeHardware hardware);

    @Override
    public void awaitCompletion(final IDaeHardware hardware)
        throws AcquisitionError, InterruptedException
    {
        final HardwareSignal signal = getSignal(hardware);
        final double target = finishWaitAt;
        logger.info("starting wait for signal " + signal.getName() +
                    " >= " + target);

        final long interval = pollMillis > 0 ? pollMillis :
            HardwarePoller.getPollIntervalMillis();
        HardwarePoller.waitFor(hardware, signal.getName() + " >= " + target,
                               new HardwarePoller.Condition() {
                public boolean isSatisfied(final IDaeHardware hw)
                    throws HardwareException
                {
                    return signal.readValue().doubleValue() >= target;
                }
            }, HardwarePoller.NO_TIMEOUT, interval);

        logger.info("completed wait for signal " + signal.getName());
    }

    /**
     * Publishes the counter being waited on.
     */
    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        List<Signal> list = new ArrayList<Signal>();
        list.add(getSignal(hardware));
        return list;
    }

    @Override
    public String toString()
    {
        return getClass().getSimpleName() + "[" + finishWaitAt + "]";
    }
}
