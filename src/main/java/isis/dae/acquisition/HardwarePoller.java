package isis.dae.acquisition;

import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;

import org.apache.log4j.Logger;

/**
 * Poll the hardware until a condition holds.
 */
public final class HardwarePoller
{
    private static final Logger logger =
        Logger.getLogger(HardwarePoller.class);

    /** System property overriding the default poll interval. */
    public static final String POLL_INTERVAL_PROPERTY =
        "isis.dae.pollIntervalMillis";

    public static final long DEFAULT_POLL_INTERVAL_MILLIS = 100L;

    /** How long controllers wait for a run state change. */
    public static final long STATE_CHANGE_TIMEOUT_MILLIS = 10000L;

    /** Wait forever. */
    public static final long NO_TIMEOUT = 0L;

    /**
     * Something to check on each poll.
     */
    public interface Condition
    {
        boolean isSatisfied(IDaeHardware hardware)
            throws HardwareException;
    }

    private HardwarePoller()
    {
    }

    /**
     * The poll interval, read from {@link #POLL_INTERVAL_PROPERTY} on each
     * call so tests can shorten it.
     */
    public static long getPollIntervalMillis()
    {
        final long interval = Long.getLong(POLL_INTERVAL_PROPERTY,
                                           DEFAULT_POLL_INTERVAL_MILLIS);
        if (interval <= 0) {
            logger.warn("Ignoring bad poll interval " + interval);
            return DEFAULT_POLL_INTERVAL_MILLIS;
        }
        return interval;
    }

    /**
     * Block until <tt>condition</tt> holds.
     *
     * @param description included in log and error messages
     * @param timeoutMillis give up after this long, or never if
     *                      {@link #NO_TIMEOUT}
     *
     * @throws AcquisitionError on timeout or hardware failure
     * @throws InterruptedException if the calling thread is interrupted
     */
    public static void waitFor(final IDaeHardware hardware,
                               final String description,
                               final Condition condition,
                               final long timeoutMillis)
        throws AcquisitionError, InterruptedException
    {
        waitFor(hardware, description, condition, timeoutMillis,
                getPollIntervalMillis());
    }

    public static void waitFor(final IDaeHardware hardware,
                               final String description,
                               final Condition condition,
                               final long timeoutMillis,
                               final long pollMillis)
        throws AcquisitionError, InterruptedException
    {
        final long start = System.currentTimeMillis();
        int polls = 0;

        while (true) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted while waiting" +
                                               " for " + description);
            }

            final boolean done;
            try {
                done = condition.isSatisfied(hardware);
            } catch (HardwareException he) {
                throw new AcquisitionError("Hardware failed while waiting" +
                                           " for " + description, he);
            }
            polls++;

            if (done) {
                if (logger.isDebugEnabled()) {
                    logger.debug("Got " + description + " after " + polls +
                                 " polls");
                }
                return;
            }

            final long elapsed = System.currentTimeMillis() - start;
            if (timeoutMillis != NO_TIMEOUT && elapsed >= timeoutMillis) {
                throw new AcquisitionError("Timed out after " + elapsed +
                                           " ms waiting for " + description);
            }

            Thread.sleep(pollMillis);
        }
    }
}
