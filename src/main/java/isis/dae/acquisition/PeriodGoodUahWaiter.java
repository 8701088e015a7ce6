package isis.dae.acquisition;

import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.HardwareSignal;

/**
 * Wait for good proton charge in the current period to reach a value.
 */
public class PeriodGoodUahWaiter
    extends ThresholdWaiter
{
    public PeriodGoodUahWaiter(final double value)
    {
        super(value);
    }

    public PeriodGoodUahWaiter(final double value, final long pollMillis)
    {
        super(value, pollMillis);
    }

    @Override
    public HardwareSignal getSignal(final IDaeHardware hardware)
    {
        return HardwareSignal.periodGoodUah(hardware);
    }
}
