package isis.dae;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.DualRunController;
import isis.dae.acquisition.SpinState;
import isis.dae.acquisition.Waiter;
import isis.dae.hardware.IDaeHardware;
import isis.dae.monitoring.AcquisitionMonitor;
import isis.dae.reduce.MultiWavelengthBandNormalizer;
import isis.dae.reduce.PolarisationReducer;

import java.util.Arrays;

import org.apache.log4j.Logger;

/**
 * Orchestrator for polarised measurements.  Each scan point is two
 * complete acquisitions, spin up then spin down, each reduced by its own
 * band normalizer, followed by a reduction combining the two.
 */
public class PolarisingDae
    extends AbstractDae
{
    private static final Logger logger =
        Logger.getLogger(PolarisingDae.class);

    private final DualRunController dualController;
    private final MultiWavelengthBandNormalizer reducerUp;
    private final MultiWavelengthBandNormalizer reducerDown;
    private final PolarisationReducer reducer;

    public PolarisingDae(final IDaeHardware hardware,
                         final DualRunController controller,
                         final Waiter waiter,
                         final PolarisationReducer reducer)
    {
        this("PolarisingDAE", hardware, controller, waiter, reducer);
    }

    public PolarisingDae(final String name, final IDaeHardware hardware,
                         final DualRunController controller,
                         final Waiter waiter,
                         final PolarisationReducer reducer)
    {
        super(name, hardware, controller, waiter,
              Arrays.asList(reducer.getReducerUp(), reducer.getReducerDown(),
                            reducer));
        this.dualController = controller;
        this.reducerUp = reducer.getReducerUp();
        this.reducerDown = reducer.getReducerDown();
        this.reducer = reducer;
    }

    public DualRunController getDualRunController()
    {
        return dualController;
    }

    public PolarisationReducer getReducer()
    {
        return reducer;
    }

    @Override
    protected void acquirePoint(final AcquisitionMonitor monitor)
        throws AcquisitionError, InterruptedException
    {
        acquireSpinState(monitor, SpinState.UP, reducerUp);
        acquireSpinState(monitor, SpinState.DOWN, reducerDown);

        monitor.beginPhase(AcquisitionMonitor.Phase.REDUCING);
        reducer.reduceData(hardware);
    }

    private void acquireSpinState(final AcquisitionMonitor monitor,
                                  final SpinState spin,
                                  final MultiWavelengthBandNormalizer normalizer)
        throws AcquisitionError, InterruptedException
    {
        logger.info("acquiring spin " + spin);

        monitor.beginPhase(AcquisitionMonitor.Phase.FLIPPING);
        dualController.selectSpinState(hardware, spin);

        countAndReduce(monitor, normalizer);
    }
}
