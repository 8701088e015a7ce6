package isis.dae.acquisition;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.HardwareSignal;

/**
 * Wait for a number of millions of events.
 */
public class MEventsWaiter
    extends ThresholdWaiter
{
    public MEventsWaiter(final double value)
    {
        super(value);
    }

    public MEventsWaiter(final double value, final long pollMillis)
    {
        super(value, pollMillis);
    }

    @Override
    public HardwareSignal getSignal(final IDaeHardware hardware)
    {
        return HardwareSignal.mEvents(hardware);
    }
}
