package isis.dae;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.Controller;
import isis.dae.acquisition.Reducer;
import isis.dae.acquisition.Waiter;
import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;
import isis.dae.monitoring.AcquisitionMonitor;
import isis.dae.signal.Provenance;
import isis.dae.signal.PublishesSignals;
import isis.dae.signal.Reading;
import isis.dae.signal.Signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.log4j.Logger;

/**
 * Base class for acquisition orchestrators.
 * This class holds the lifecycle and the published signals but leaves the
 * content of a scan point to subclasses.
 * <ul>
 * <li>{@link #stage()} checks every reducer's configuration, then sets up
 * the controller,</li>
 * <li>{@link #trigger()} acquires and reduces one scan point,</li>
 * <li>{@link #unstage()} tears the controller down.</li>
 * </ul>
 * The published signals are collected from the strategies once, when the
 * orchestrator is built.  Only hardware signals may be published by more
 * than one strategy.
 */
public abstract class AbstractDae
    implements DaeMBean
{
    private static final Logger logger = Logger.getLogger(AbstractDae.class);

    protected final IDaeHardware hardware;
    protected final Controller controller;
    protected final Waiter waiter;
    private final List<Reducer> reducers;

    private final Map<String, Signal> signals;
    private final AcquisitionMonitor monitor;

    private volatile DaeState state = DaeState.IDLE;

    /**
     * @param name identifies this orchestrator in log messages
     * @param reducers every reducer used by a point, in the order they run
     *
     * @throws IllegalArgumentException if two strategies publish different
     *         derived signals under one name
     */
    protected AbstractDae(final String name, final IDaeHardware hardware,
                          final Controller controller, final Waiter waiter,
                          final List<? extends Reducer> reducers)
    {
        if (hardware == null || controller == null || waiter == null) {
            throw new IllegalArgumentException("Hardware, controller and" +
                                               " waiter are all required");
        }
        if (reducers == null || reducers.isEmpty()) {
            throw new IllegalArgumentException("No reducers");
        }

        this.hardware = hardware;
        this.controller = controller;
        this.waiter = waiter;
        this.reducers =
            Collections.unmodifiableList(new ArrayList<Reducer>(reducers));
        this.monitor = new AcquisitionMonitor(name);

        List<PublishesSignals> strategies = new ArrayList<PublishesSignals>();
        strategies.add(controller);
        strategies.add(waiter);
        strategies.addAll(reducers);

        signals = new LinkedHashMap<String, Signal>();
        for (PublishesSignals strategy : strategies) {
            for (Signal sig : strategy.getPublishedSignals(hardware)) {
                final Signal prev = signals.get(sig.getName());
                if (prev == null) {
                    signals.put(sig.getName(), sig);
                } else if (prev != sig && !isSameHardwareSignal(prev, sig)) {
                    throw new IllegalArgumentException("Signal " +
                                                       sig.getName() +
                                                       " is published by" +
                                                       " more than one" +
                                                       " strategy");
                }
            }
        }

        logger.info("created " + name + " with controller=" +
                    controller.getClass().getSimpleName() + ", waiter=" +
                    waiter + ", reducers=" + describeReducers() +
                    ", signals=" + signals.keySet());
    }

    /**
     * Hardware counters may be published by several strategies since they
     * all read the same value.
     */
    private static boolean isSameHardwareSignal(final Signal a,
                                                final Signal b)
    {
        return a.getProvenance() == Provenance.HARDWARE &&
            b.getProvenance() == Provenance.HARDWARE;
    }

    private String describeReducers()
    {
        StringBuilder sb = new StringBuilder("[");
        for (Reducer r : reducers) {
            if (sb.length() > 1) {
                sb.append(", ");
            }
            sb.append(r.getClass().getSimpleName());
        }
        return sb.append(']').toString();
    }

    public IDaeHardware getHardware()
    {
        return hardware;
    }

    public Controller getController()
    {
        return controller;
    }

    public Waiter getWaiter()
    {
        return waiter;
    }

    public List<Reducer> getReducers()
    {
        return reducers;
    }

    public DaeState getDaeState()
    {
        return state;
    }

    private void setDaeState(final DaeState newState)
    {
        state = newState;
        if (logger.isDebugEnabled()) {
            logger.debug("DAE state is " + newState);
        }
    }

    /**
     * Pre-scan setup.  Reducer configuration is checked before the
     * controller touches the hardware.
     *
     * @throws IllegalStateException if already staged
     */
    public synchronized void stage()
        throws AcquisitionError, InterruptedException
    {
        switch (state) {
        case IDLE:
            break;
        default:
            throw new IllegalStateException("Cannot stage from state " +
                                            state);
        }

        // from here on unstage() must tear the controller down
        setDaeState(DaeState.SETUP_FAILED);

        for (Reducer r : reducers) {
            r.checkConfiguration(hardware);
        }
        controller.setup(hardware);

        setDaeState(DaeState.STAGED);
        logger.info("staged");
    }

    /**
     * Acquire and reduce a single scan point.  When this returns every
     * published signal holds the new point's values.
     *
     * @throws IllegalStateException if not staged
     * @throws AcquisitionError if the point failed
     * @throws InterruptedException if the acquisition was cancelled
     */
    public synchronized void trigger()
        throws AcquisitionError, InterruptedException
    {
        switch (state) {
        case STAGED:
            break;
        default:
            throw new IllegalStateException("Cannot trigger from state " +
                                            state + "; call stage() first");
        }

        setDaeState(DaeState.ACQUIRING);
        monitor.initiatePoint();

        boolean success = false;
        try {
            acquirePoint(monitor);
            success = true;
        } catch (AcquisitionError ae) {
            logger.error("Scan point failed", ae);
            throw ae;
        } catch (RuntimeException re) {
            logger.error("Scan point failed", re);
            throw re;
        } finally {
            if (success) {
                monitor.completePoint();
            } else {
                monitor.failPoint();
                for (String line : monitor.logHistory()) {
                    logger.info(line);
                }
            }
            setDaeState(DaeState.STAGED);
        }
    }

    /**
     * Run the phases of one scan point, reporting each to the monitor.
     */
    protected abstract void acquirePoint(AcquisitionMonitor monitor)
        throws AcquisitionError, InterruptedException;

    /**
     * Start, wait for and stop one run or period, then run a reducer.
     */
    protected void countAndReduce(final AcquisitionMonitor monitor,
                                  final Reducer reducer)
        throws AcquisitionError, InterruptedException
    {
        monitor.beginPhase(AcquisitionMonitor.Phase.STARTING);
        controller.startCounting(hardware);

        monitor.beginPhase(AcquisitionMonitor.Phase.WAITING);
        waiter.awaitCompletion(hardware);

        monitor.beginPhase(AcquisitionMonitor.Phase.STOPPING);
        controller.stopCounting(hardware);

        monitor.beginPhase(AcquisitionMonitor.Phase.REDUCING);
        reducer.reduceData(hardware);
    }

    /**
     * Post-scan teardown.  Does nothing if not staged; otherwise tears the
     * controller down exactly once, even after a failed setup or point.
     */
    public synchronized void unstage()
        throws AcquisitionError, InterruptedException
    {
        if (state == DaeState.IDLE) {
            if (logger.isDebugEnabled()) {
                logger.debug("Ignoring unstage while idle");
            }
            return;
        }

        try {
            controller.teardown(hardware);
            logger.info("unstaged");
        } catch (AcquisitionError ae) {
            logger.error("Teardown failed", ae);
            throw ae;
        } finally {
            setDaeState(DaeState.IDLE);
        }
    }

    /**
     * Read every published signal.
     */
    public LinkedHashMap<String, Reading> read()
        throws HardwareException
    {
        LinkedHashMap<String, Reading> result =
            new LinkedHashMap<String, Reading>();
        for (Map.Entry<String, Signal> entry : signals.entrySet()) {
            result.put(entry.getKey(), entry.getValue().read());
        }
        return result;
    }

    /**
     * Names of the published signals with where their values come from.
     */
    public LinkedHashMap<String, Provenance> describe()
    {
        LinkedHashMap<String, Provenance> result =
            new LinkedHashMap<String, Provenance>();
        for (Map.Entry<String, Signal> entry : signals.entrySet()) {
            result.put(entry.getKey(), entry.getValue().getProvenance());
        }
        return result;
    }

    public AcquisitionMonitor getMonitor()
    {
        return monitor;
    }

    // Monitoring facility

    @Override
    public String getState()
    {
        return state.name();
    }

    @Override
    public String getAcquisitionUnit()
    {
        return controller.getAcquisitionUnit().name();
    }

    @Override
    public long getPointsAcquired()
    {
        return monitor.getPointsAcquired();
    }

    @Override
    public long getPointsFailed()
    {
        return monitor.getPointsFailed();
    }

    @Override
    public double getAveragePointMillis()
    {
        return monitor.getAveragePointMillis();
    }

    @Override
    public String[] getSignalNames()
    {
        return signals.keySet().toArray(new String[signals.size()]);
    }
}
