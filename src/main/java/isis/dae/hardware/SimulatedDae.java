package isis.dae.hardware;

import cern.jet.random.Poisson;
import cern.jet.random.engine.MersenneTwister;
import cern.jet.random.engine.RandomEngine;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.apache.log4j.Logger;

/**
 * In-memory stand-in for the DAE.  Good enough to drive the acquisition
 * strategies end to end without the electronics: runs and periods move
 * through the same states as the real thing, and while counting every
 * counter read advances the clock by one tick and accumulates
 * Poisson-distributed counts into each spectrum of the current period.
 *
 * Each spectrum has a mean number of counts per frame (see
 * {@link #setMeanCountsPerFrame(int, double)}) spread uniformly over its
 * time channels.
 */
public class SimulatedDae
    implements IDaeHardware
{
    private static final Logger logger = Logger.getLogger(SimulatedDae.class);

    private final int numSpectra;
    private final int numTimeChannels;
    private final double[] timeBinEdges;
    private final double[] meanCountsPerFrame;

    private final RandomEngine rand;
    private final Poisson poissonRandom;

    private RunState runState = RunState.SETUP;
    private int runNumber = 1;
    private int numberOfPeriods = 1;
    private int period = 1;

    private long[] goodFrames;
    private long[] rawFrames;
    private double[] goodUah;
    private long[][][] counts;
    private long ticks;

    private int framesPerTick = 10;
    private double uahPerFrame = 0.001;
    private double secondsPerTick = 1.0;

    private final List<Integer> savedRuns = new ArrayList<Integer>();
    private int abortedRuns;

    /**
     * @param numSpectra number of spectra (spectrum 0 is not counted)
     * @param numTimeChannels number of time channels per spectrum
     * @param tofStart first time bin edge in microseconds
     * @param tofStep time channel width in microseconds
     * @param seed random seed, fixed for reproducible tests
     */
    public SimulatedDae(final int numSpectra, final int numTimeChannels,
                        final double tofStart, final double tofStep,
                        final int seed)
    {
        if (numSpectra < 1 || numTimeChannels < 1 || tofStep <= 0.0) {
            throw new IllegalArgumentException("Bad simulated DAE shape " +
                                               numSpectra + "x" +
                                               numTimeChannels + " step " +
                                               tofStep);
        }

        this.numSpectra = numSpectra;
        this.numTimeChannels = numTimeChannels;

        timeBinEdges = new double[numTimeChannels + 1];
        for (int i = 0; i <= numTimeChannels; i++) {
            timeBinEdges[i] = tofStart + i * tofStep;
        }

        meanCountsPerFrame = new double[numSpectra + 1];
        Arrays.fill(meanCountsPerFrame, 1.0);
        meanCountsPerFrame[0] = 0.0;

        rand = new MersenneTwister(seed);
        poissonRandom = new Poisson(1.0, rand);

        allocatePeriods();
    }

    private void allocatePeriods()
    {
        goodFrames = new long[numberOfPeriods + 1];
        rawFrames = new long[numberOfPeriods + 1];
        goodUah = new double[numberOfPeriods + 1];
        counts = new long[numberOfPeriods + 1][numSpectra + 1][numTimeChannels + 1];
        ticks = 0;
    }

    public synchronized void setMeanCountsPerFrame(final int spectrum,
                                                   final double mean)
    {
        if (spectrum < 1 || spectrum > numSpectra || mean < 0.0) {
            throw new IllegalArgumentException("Bad rate " + mean +
                                               " for spectrum " + spectrum);
        }
        meanCountsPerFrame[spectrum] = mean;
    }

    public synchronized void setFramesPerTick(final int frames)
    {
        framesPerTick = frames;
    }

    public synchronized void setUahPerFrame(final double uah)
    {
        uahPerFrame = uah;
    }

    public synchronized List<Integer> getSavedRuns()
    {
        return new ArrayList<Integer>(savedRuns);
    }

    public synchronized int getAbortedRunCount()
    {
        return abortedRuns;
    }

    /**
     * Advance the simulated clock if counting.
     */
    private void tick()
    {
        if (!runState.isCounting()) {
            return;
        }

        ticks++;
        goodFrames[period] += framesPerTick;
        rawFrames[period] += framesPerTick;
        goodUah[period] += framesPerTick * uahPerFrame;

        for (int spec = 1; spec <= numSpectra; spec++) {
            final double mean =
                meanCountsPerFrame[spec] * framesPerTick / numTimeChannels;
            if (mean <= 0.0) {
                continue;
            }
            for (int chan = 1; chan <= numTimeChannels; chan++) {
                counts[period][spec][chan] += poissonRandom.nextInt(mean);
            }
        }

        if (logger.isDebugEnabled()) {
            logger.debug("Tick " + ticks + " period " + period +
                         " good frames " + goodFrames[period]);
        }
    }

    private void requireOpenRun(final String op)
        throws HardwareException
    {
        if (runState == RunState.SETUP) {
            throw new HardwareException("Cannot " + op + ": no run open");
        }
    }

    @Override
    public synchronized void beginRun(final boolean paused)
        throws HardwareException
    {
        if (runState != RunState.SETUP) {
            throw new HardwareException("Cannot begin run in state " +
                                        runState);
        }
        allocatePeriods();
        period = 1;
        runState = paused ? RunState.PAUSED : RunState.RUNNING;
        logger.info("Began run " + runNumber + (paused ? " (paused)" : ""));
    }

    @Override
    public synchronized void endRun()
        throws HardwareException
    {
        requireOpenRun("end run");
        savedRuns.add(runNumber);
        logger.info("Ended run " + runNumber);
        runNumber++;
        runState = RunState.SETUP;
    }

    @Override
    public synchronized void abortRun()
        throws HardwareException
    {
        requireOpenRun("abort run");
        abortedRuns++;
        logger.info("Aborted run " + runNumber);
        runState = RunState.SETUP;
    }

    @Override
    public synchronized void pauseRun()
        throws HardwareException
    {
        requireOpenRun("pause run");
        runState = RunState.PAUSED;
    }

    @Override
    public synchronized void resumeRun()
        throws HardwareException
    {
        requireOpenRun("resume run");
        runState = RunState.RUNNING;
    }

    @Override
    public synchronized void updateRun()
        throws HardwareException
    {
        requireOpenRun("update run");
    }

    @Override
    public synchronized RunState getRunState()
    {
        return runState;
    }

    @Override
    public synchronized int getRunNumber()
    {
        return runNumber;
    }

    @Override
    public synchronized int getPeriod()
    {
        return period;
    }

    @Override
    public synchronized void setPeriod(final int newPeriod)
    {
        if (newPeriod < 1 || newPeriod > numberOfPeriods) {
            // the real electronics silently keep the old period
            logger.warn("Rejected period " + newPeriod + "; " +
                        numberOfPeriods + " periods configured");
            return;
        }
        period = newPeriod;
    }

    @Override
    public synchronized int getNumberOfPeriods()
    {
        return numberOfPeriods;
    }

    @Override
    public synchronized void setNumberOfPeriods(final int periods)
        throws HardwareException
    {
        if (runState != RunState.SETUP) {
            throw new HardwareException("Cannot change period count in" +
                                        " state " + runState);
        }
        if (periods < 1) {
            throw new HardwareException("Bad period count " + periods);
        }
        numberOfPeriods = periods;
        allocatePeriods();
    }

    @Override
    public synchronized long getGoodFrames()
    {
        tick();
        long total = 0;
        for (long f : goodFrames) {
            total += f;
        }
        return total;
    }

    @Override
    public synchronized long getPeriodGoodFrames()
    {
        tick();
        return goodFrames[period];
    }

    @Override
    public synchronized long getRawFrames()
    {
        tick();
        long total = 0;
        for (long f : rawFrames) {
            total += f;
        }
        return total;
    }

    @Override
    public synchronized long getPeriodRawFrames()
    {
        tick();
        return rawFrames[period];
    }

    @Override
    public synchronized double getGoodUah()
    {
        tick();
        double total = 0.0;
        for (double u : goodUah) {
            total += u;
        }
        return total;
    }

    @Override
    public synchronized double getPeriodGoodUah()
    {
        tick();
        return goodUah[period];
    }

    @Override
    public synchronized double getMEvents()
    {
        tick();
        long total = 0;
        for (int p = 1; p <= numberOfPeriods; p++) {
            for (int s = 1; s <= numSpectra; s++) {
                for (int c = 1; c <= numTimeChannels; c++) {
                    total += counts[p][s][c];
                }
            }
        }
        return total / 1.0e6;
    }

    @Override
    public synchronized long getRunDurationSeconds()
    {
        return (long) (ticks * secondsPerTick);
    }

    @Override
    public int getNumSpectra()
    {
        return numSpectra;
    }

    @Override
    public int getNumTimeChannels()
    {
        return numTimeChannels;
    }

    @Override
    public synchronized int[] readSpectrumData()
    {
        final int rowLength = numTimeChannels + 1;
        int[] table = new int[(numSpectra + 1) * rowLength];
        for (int s = 0; s <= numSpectra; s++) {
            for (int c = 0; c <= numTimeChannels; c++) {
                table[s * rowLength + c] = (int) counts[period][s][c];
            }
        }
        return table;
    }

    @Override
    public synchronized Spectrum readSpectrum(final int forPeriod,
                                              final int spectrum)
        throws HardwareException
    {
        final int p = forPeriod == 0 ? period : forPeriod;
        if (p < 1 || p > numberOfPeriods || spectrum < 0 ||
            spectrum > numSpectra)
        {
            throw new HardwareException("No spectrum " + spectrum +
                                        " in period " + p);
        }

        return new Spectrum(spectrum, timeBinEdges,
                            Arrays.copyOfRange(counts[p][spectrum], 1,
                                               numTimeChannels + 1));
    }
}
