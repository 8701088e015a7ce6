package isis.dae;

import isis.dae.acquisition.ConfigurationError;
import isis.dae.acquisition.Controller;
import isis.dae.acquisition.DualRunController;
import isis.dae.acquisition.GoodFramesWaiter;
import isis.dae.acquisition.PeriodGoodFramesWaiter;
import isis.dae.acquisition.PeriodPerPointController;
import isis.dae.acquisition.Reducer;
import isis.dae.acquisition.RunPerPointController;
import isis.dae.acquisition.Waiter;
import isis.dae.hardware.Flipper;
import isis.dae.hardware.IDaeHardware;
import isis.dae.reduce.MonitorNormalizer;
import isis.dae.reduce.MultiWavelengthBandNormalizer;
import isis.dae.reduce.PolarisationReducer;
import isis.dae.reduce.SpectraSummer;
import isis.dae.reduce.SpectraSummers;
import isis.dae.stats.Bounds;

import java.util.ArrayList;
import java.util.List;

/**
 * Ready-made orchestrators for the common cases.
 */
public final class DaeFactory
{
    /** Flipper readback tolerance used by {@link #polarisingDae}. */
    public static final double DEFAULT_FLIPPER_TOLERANCE = 0.01;
    /** How long {@link #polarisingDae} waits for the flipper. */
    public static final long DEFAULT_FLIPPER_TIMEOUT_MILLIS = 30000L;

    private DaeFactory()
    {
    }

    private static Controller controller(final boolean periods,
                                         final boolean saveRun)
    {
        if (periods) {
            return new PeriodPerPointController(saveRun);
        }
        return new RunPerPointController(saveRun);
    }

    private static Waiter frameWaiter(final boolean periods, final long frames)
    {
        if (periods) {
            return new PeriodGoodFramesWaiter(frames);
        }
        return new GoodFramesWaiter(frames);
    }

    /**
     * Orchestrator which waits for a number of good frames, then normalises
     * the detector pixels by a single monitor.
     *
     * @param detPixels detector spectra to sum
     * @param frames good frames to count per point
     * @param periods count each point into a period (<tt>true</tt>) or a
     *                run (<tt>false</tt>)
     * @param monitor monitor spectrum
     * @param saveRun end runs (<tt>true</tt>) or abort them
     */
    public static Dae monitorNormalisingDae(final IDaeHardware hardware,
                                            final int[] detPixels,
                                            final long frames,
                                            final boolean periods,
                                            final int monitor,
                                            final boolean saveRun)
    {
        return new Dae(hardware, controller(periods, saveRun),
                       frameWaiter(periods, frames),
                       new MonitorNormalizer(detPixels, new int[] { monitor }));
    }

    /**
     * Orchestrator which measures each point with the flipper in both
     * states, normalises each state by monitor in several wavelength
     * bands, and calculates the polarisation of each band.
     *
     * @param upSetpoint flipper setpoint for spin up
     * @param downSetpoint flipper setpoint for spin down
     * @param intervals wavelength bands
     * @param lTotal flight path used to convert time of flight to
     *               wavelength, in metres
     */
    public static PolarisingDae polarisingDae(final IDaeHardware hardware,
                                              final int[] detPixels,
                                              final long frames,
                                              final Flipper flipper,
                                              final double upSetpoint,
                                              final double downSetpoint,
                                              final List<Bounds> intervals,
                                              final double lTotal,
                                              final boolean periods,
                                              final int monitor,
                                              final boolean saveRun)
    {
        List<SpectraSummer> summers = new ArrayList<SpectraSummer>();
        for (Bounds b : intervals) {
            summers.add(SpectraSummers.wavelengthBounded(b, lTotal));
        }

        final int[] monitors = new int[] { monitor };
        MultiWavelengthBandNormalizer up =
            new MultiWavelengthBandNormalizer("up.", detPixels, monitors,
                                              summers);
        MultiWavelengthBandNormalizer down =
            new MultiWavelengthBandNormalizer("down.", detPixels, monitors,
                                              summers);

        DualRunController dual =
            new DualRunController(controller(periods, saveRun), flipper,
                                  upSetpoint, downSetpoint,
                                  DEFAULT_FLIPPER_TOLERANCE,
                                  DEFAULT_FLIPPER_TIMEOUT_MILLIS);

        return new PolarisingDae(hardware, dual, frameWaiter(periods, frames),
                                 new PolarisationReducer(intervals, up, down));
    }

    /**
     * Check an orchestrator uses the strategy types a plan relies on.
     * A <tt>null</tt> expected type is not checked.
     *
     * @throws ConfigurationError naming the first mismatch
     */
    public static void checkDaeStrategies(final Dae dae,
                                          final Class<? extends Controller> expectedController,
                                          final Class<? extends Waiter> expectedWaiter,
                                          final Class<? extends Reducer> expectedReducer)
        throws ConfigurationError
    {
        check("controller", expectedController, dae.getController());
        check("waiter", expectedWaiter, dae.getWaiter());
        check("reducer", expectedReducer, dae.getReducer());
    }

    private static void check(final String role, final Class<?> expected,
                              final Object actual)
        throws ConfigurationError
    {
        if (expected != null && !expected.isInstance(actual)) {
            throw new ConfigurationError("DAE " + role + " must be of type " +
                                         expected.getSimpleName() + ", got " +
                                         actual.getClass().getSimpleName());
        }
    }

    /**
     * A contiguous range of pixels either side of a centre, inclusive;
     * a centre of 50 with a range of 3 gives 47 to 53.
     */
    public static int[] centredPixels(final int centre, final int pixelRange)
    {
        if (pixelRange < 0) {
            throw new IllegalArgumentException("Negative pixel range " +
                                               pixelRange);
        }
        int[] pixels = new int[2 * pixelRange + 1];
        for (int i = 0; i < pixels.length; i++) {
            pixels[i] = centre - pixelRange + i;
        }
        return pixels;
    }
}
