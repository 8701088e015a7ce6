package isis.dae.hardware;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.varia.NullAppender;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

public class SimulatedDaeTest
{
    @BeforeClass
    public static void setupLogging()
    {
        BasicConfigurator.resetConfiguration();
        BasicConfigurator.configure(new NullAppender());
        Logger.getRootLogger().setLevel(Level.ALL);
    }

    @AfterClass
    public static void tearDownLogging()
    {
        BasicConfigurator.resetConfiguration();
    }

    @Test
    public void testRunLifecycle()
        throws HardwareException
    {
        SimulatedDae dae = new SimulatedDae(4, 10, 100.0, 10.0, 1);
        assertEquals(RunState.SETUP, dae.getRunState());

        dae.beginRun(false);
        assertEquals(RunState.RUNNING, dae.getRunState());
        final int run = dae.getRunNumber();

        dae.pauseRun();
        assertEquals(RunState.PAUSED, dae.getRunState());
        dae.resumeRun();
        dae.endRun();

        assertEquals(RunState.SETUP, dae.getRunState());
        assertEquals(run + 1, dae.getRunNumber());
        assertEquals(1, dae.getSavedRuns().size());
        assertEquals(run, dae.getSavedRuns().get(0).intValue());

        dae.beginRun(true);
        assertEquals(RunState.PAUSED, dae.getRunState());
        dae.abortRun();
        assertEquals(1, dae.getAbortedRunCount());
        assertEquals(run + 1, dae.getRunNumber());
    }

    @Test
    public void testCannotBeginTwice()
        throws HardwareException
    {
        SimulatedDae dae = new SimulatedDae(1, 1, 0.0, 1.0, 1);
        dae.beginRun(false);
        try {
            dae.beginRun(false);
            fail("Second begin should fail");
        } catch (HardwareException he) {
            // expected
        }
    }

    @Test
    public void testCountsOnlyWhileCounting()
        throws HardwareException
    {
        SimulatedDae dae = new SimulatedDae(2, 5, 0.0, 1.0, 123);
        dae.setMeanCountsPerFrame(1, 50.0);
        dae.setFramesPerTick(10);

        assertEquals(0L, dae.getGoodFrames());

        dae.beginRun(false);
        final long first = dae.getGoodFrames();
        final long second = dae.getGoodFrames();
        assertEquals(10L, first);
        assertEquals(20L, second);
        assertTrue(dae.readSpectrum(0, 1).getTotalCounts() > 0);

        dae.pauseRun();
        final long paused = dae.getGoodFrames();
        assertEquals(paused, dae.getGoodFrames());
    }

    @Test
    public void testPeriods()
        throws HardwareException
    {
        SimulatedDae dae = new SimulatedDae(1, 2, 0.0, 1.0, 7);
        dae.setNumberOfPeriods(3);
        dae.beginRun(true);

        dae.setPeriod(2);
        assertEquals(2, dae.getPeriod());
        dae.resumeRun();
        dae.getPeriodGoodFrames();
        dae.pauseRun();

        dae.setPeriod(3);
        assertEquals(0L, dae.getPeriodGoodFrames());
        assertTrue(dae.getGoodFrames() > 0);

        // out of range is ignored, like the electronics
        dae.setPeriod(4);
        assertEquals(3, dae.getPeriod());

        try {
            dae.setNumberOfPeriods(2);
            fail("Period count cannot change during a run");
        } catch (HardwareException he) {
            // expected
        }
    }

    @Test
    public void testSpectrumData()
        throws HardwareException
    {
        SimulatedDae dae = new SimulatedDae(3, 4, 1000.0, 100.0, 5);
        dae.beginRun(false);
        dae.getGoodFrames();
        dae.pauseRun();

        SpectrumDataTable table =
            new SpectrumDataTable(dae.readSpectrumData(), 3, 4);
        for (int s = 1; s <= 3; s++) {
            assertEquals(dae.readSpectrum(0, s).getTotalCounts(),
                         table.integrate(s));
        }

        Spectrum spec = dae.readSpectrum(1, 2);
        assertEquals(5, spec.getTimeBinEdges().length);
        assertEquals(1000.0, spec.getTimeBinEdges()[0], 0.0);
        assertEquals(1400.0, spec.getTimeBinEdges()[4], 1.0e-9);

        try {
            dae.readSpectrum(0, 4);
            fail("Spectrum 4 does not exist");
        } catch (HardwareException he) {
            // expected
        }
    }
}
