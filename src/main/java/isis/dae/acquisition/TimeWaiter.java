package isis.dae.acquisition;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.Signal;

import java.util.Collections;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * Count for a fixed time, whatever the hardware is doing.
 */
public class TimeWaiter
    implements Waiter
{
    private static final Logger logger = Logger.getLogger(TimeWaiter.class);

    private final double seconds;

    public TimeWaiter(final double seconds)
    {
        if (!(seconds >= 0.0)) {
            throw new IllegalArgumentException("Bad wait time " + seconds);
        }
        this.seconds = seconds;
    }

    public double getSeconds()
    {
        return seconds;
    }

    @Override
    public void awaitCompletion(final IDaeHardware hardware)
        throws InterruptedException
    {
        logger.info("starting wait for " + seconds + " seconds");
        Thread.sleep(Math.round(seconds * 1000.0));
        logger.info("completed wait");
    }

    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        return Collections.emptyList();
    }
}
