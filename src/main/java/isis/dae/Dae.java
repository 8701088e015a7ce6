package isis.dae;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.Controller;
import isis.dae.acquisition.Reducer;
import isis.dae.acquisition.Waiter;
import isis.dae.hardware.IDaeHardware;
import isis.dae.monitoring.AcquisitionMonitor;

import java.util.Collections;

/**
 * Orchestrator counting one run or period per scan point:
 * start counting, wait, stop counting, reduce.
 */
public class Dae
    extends AbstractDae
{
    private final Reducer reducer;

    public Dae(final IDaeHardware hardware, final Controller controller,
               final Waiter waiter, final Reducer reducer)
    {
        this("DAE", hardware, controller, waiter, reducer);
    }

    public Dae(final String name, final IDaeHardware hardware,
               final Controller controller, final Waiter waiter,
               final Reducer reducer)
    {
        super(name, hardware, controller, waiter,
              Collections.singletonList(reducer));
        this.reducer = reducer;
    }

    public Reducer getReducer()
    {
        return reducer;
    }

    @Override
    protected void acquirePoint(final AcquisitionMonitor monitor)
        throws AcquisitionError, InterruptedException
    {
        countAndReduce(monitor, reducer);
    }
}
