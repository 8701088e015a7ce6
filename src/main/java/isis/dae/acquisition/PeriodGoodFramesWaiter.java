package isis.dae.acquisition;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.HardwareSignal;

/**
 * Wait for good frames in the current period to reach a value.
 */
public class PeriodGoodFramesWaiter
    extends ThresholdWaiter
{
    public PeriodGoodFramesWaiter(final double value)
    {
        super(value);
    }

    public PeriodGoodFramesWaiter(final double value, final long pollMillis)
    {
        super(value, pollMillis);
    }

    @Override
    public HardwareSignal getSignal(final IDaeHardware hardware)
    {
        return HardwareSignal.periodGoodFrames(hardware);
    }
}
