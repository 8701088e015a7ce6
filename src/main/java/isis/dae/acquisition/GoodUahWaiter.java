package isis.dae.acquisition;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.HardwareSignal;

/**
 * Wait for good proton charge (microamp-hours) to reach a value.
 */
public class GoodUahWaiter
    extends ThresholdWaiter
{
    public GoodUahWaiter(final double value)
    {
        super(value);
    }

    public GoodUahWaiter(final double value, final long pollMillis)
    {
        super(value, pollMillis);
    }

    @Override
    public HardwareSignal getSignal(final IDaeHardware hardware)
    {
        return HardwareSignal.goodUah(hardware);
    }
}
