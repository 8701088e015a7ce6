package isis.dae.acquisition;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.HardwareSignal;

/**
 * Wait for the run's good frames to reach a value.
 */
public class GoodFramesWaiter
    extends ThresholdWaiter
{
    public GoodFramesWaiter(final double value)
    {
        super(value);
    }

    public GoodFramesWaiter(final double value, final long pollMillis)
    {
        super(value, pollMillis);
    }

    @Override
    public HardwareSignal getSignal(final IDaeHardware hardware)
    {
        return HardwareSignal.goodFrames(hardware);
    }
}
