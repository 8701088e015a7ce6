package isis.dae;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.ConfigurationError;
import isis.dae.acquisition.GoodFramesWaiter;
import isis.dae.hardware.test.MockDaeHardware;
import isis.dae.reduce.GoodFramesNormalizer;
import isis.dae.reduce.SpectraSummers;
import isis.dae.signal.Provenance;
import isis.dae.signal.Reading;
import isis.dae.test.MockController;
import isis.dae.test.MockReducer;
import isis.dae.test.MockWaiter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.varia.NullAppender;
import org.junit.AfterClass;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Test;

public class DaeTest
{
    private List<String> log;
    private MockController controller;
    private MockReducer reducer;
    private Dae dae;

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

    @Before
    public void setUp()
    {
        log = new ArrayList<String>();
        controller = new MockController(log);
        reducer = new MockReducer(log);
        dae = new Dae(new MockDaeHardware(), controller, new MockWaiter(log),
                      reducer);
    }

    @Test
    public void testLifecycle()
        throws AcquisitionError, InterruptedException
    {
        assertEquals(DaeState.IDLE, dae.getDaeState());

        dae.stage();
        assertEquals(DaeState.STAGED, dae.getDaeState());

        dae.trigger();
        dae.trigger();
        assertEquals(DaeState.STAGED, dae.getDaeState());

        dae.unstage();
        assertEquals(DaeState.IDLE, dae.getDaeState());

        List<String> expected = Arrays.asList(new String[] {
                "reducer.checkConfiguration",
                "controller.setup",
                "controller.startCounting",
                "waiter.awaitCompletion",
                "controller.stopCounting",
                "reducer.reduceData",
                "controller.startCounting",
                "waiter.awaitCompletion",
                "controller.stopCounting",
                "reducer.reduceData",
                "controller.teardown",
            });
        assertEquals(expected, log);

        assertEquals(2, dae.getPointsAcquired());
        assertEquals(0, dae.getPointsFailed());
        assertEquals("IDLE", dae.getState());
        assertEquals("RUN", dae.getAcquisitionUnit());
    }

    @Test
    public void testTriggerBeforeStage()
        throws AcquisitionError, InterruptedException
    {
        try {
            dae.trigger();
            fail("Trigger before stage should fail");
        } catch (IllegalStateException ise) {
            // expected
        }
        assertEquals(0, log.size());
    }

    @Test
    public void testStageTwice()
        throws AcquisitionError, InterruptedException
    {
        dae.stage();
        try {
            dae.stage();
            fail("Second stage should fail");
        } catch (IllegalStateException ise) {
            // expected
        }
    }

    @Test
    public void testUnstageWhileIdle()
        throws AcquisitionError, InterruptedException
    {
        dae.unstage();
        assertEquals(0, log.size());

        dae.stage();
        dae.unstage();
        dae.unstage();

        int teardowns = 0;
        for (String entry : log) {
            if (entry.equals("controller.teardown")) {
                teardowns++;
            }
        }
        assertEquals(1, teardowns);
    }

    @Test
    public void testFailedPoint()
        throws Exception
    {
        dae.stage();
        dae.trigger();

        reducer.setFailReduce(true);
        try {
            dae.trigger();
            fail("Reduction failure should be reported");
        } catch (AcquisitionError ae) {
            assertEquals("Injected reduction failure", ae.getMessage());
        }

        assertEquals(DaeState.STAGED, dae.getDaeState());
        assertEquals(1, dae.getPointsAcquired());
        assertEquals(1, dae.getPointsFailed());

        // previous point's value survives
        assertEquals(1, ((Integer) dae.read().get("points").getValue())
                     .intValue());

        reducer.setFailReduce(false);
        dae.trigger();
        assertEquals(2, ((Integer) dae.read().get("points").getValue())
                     .intValue());
    }

    @Test
    public void testControllerFailure()
        throws AcquisitionError, InterruptedException
    {
        dae.stage();
        controller.failOn("startCounting");
        try {
            dae.trigger();
            fail("Controller failure should be reported");
        } catch (AcquisitionError ae) {
            // expected
        }
        assertEquals(DaeState.STAGED, dae.getDaeState());
        assertEquals(1, dae.getPointsFailed());
    }

    @Test
    public void testBadConfigurationAtStage()
        throws AcquisitionError, InterruptedException
    {
        reducer.setBadConfiguration(true);
        try {
            dae.stage();
            fail("Bad configuration should be reported");
        } catch (ConfigurationError ce) {
            // expected
        }

        assertEquals(DaeState.SETUP_FAILED, dae.getDaeState());
        assertEquals(Arrays.asList(new String[] {
                    "reducer.checkConfiguration" }), log);

        try {
            dae.trigger();
            fail("Trigger after failed stage should fail");
        } catch (IllegalStateException ise) {
            // expected
        }

        dae.unstage();
        assertEquals(DaeState.IDLE, dae.getDaeState());
        assertEquals("controller.teardown", log.get(log.size() - 1));
    }

    @Test
    public void testFailedTeardownStillIdle()
        throws AcquisitionError, InterruptedException
    {
        dae.stage();
        controller.failOn("teardown");
        try {
            dae.unstage();
            fail("Teardown failure should be reported");
        } catch (AcquisitionError ae) {
            // expected
        }
        assertEquals(DaeState.IDLE, dae.getDaeState());
    }

    @Test
    public void testSignals()
        throws Exception
    {
        Map<String, Provenance> desc = dae.describe();
        assertArrayEquals(new String[] { "controller_signal", "shared",
                                         "points" },
                          desc.keySet().toArray(new String[0]));
        assertEquals(Provenance.DERIVED, desc.get("points"));
        assertArrayEquals(desc.keySet().toArray(new String[0]),
                          dae.getSignalNames());

        Map<String, Reading> data = dae.read();
        assertEquals(desc.keySet(), data.keySet());
        assertEquals("controller", data.get("shared").getValue());
    }

    @Test
    public void testDerivedSignalClash()
    {
        try {
            new Dae(new MockDaeHardware(), new MockController(log),
                    new MockWaiter(log), new MockReducer(log, "shared"));
            fail("Two derived signals named \"shared\" should be rejected");
        } catch (IllegalArgumentException iae) {
            assertTrue(iae.getMessage(), iae.getMessage().contains("shared"));
        }
    }

    @Test
    public void testSharedHardwareSignal()
        throws Exception
    {
        MockDaeHardware hw = new MockDaeHardware();
        hw.setGoodFrames(40);

        // waiter and normalizer both publish good_frames
        Dae frames = new Dae(hw, new MockController(log),
                             new GoodFramesWaiter(100),
                             new GoodFramesNormalizer(new int[] { 1 },
                                                      SpectraSummers.full()));

        int count = 0;
        for (String name : frames.getSignalNames()) {
            if (name.equals("good_frames")) {
                count++;
            }
        }
        assertEquals(1, count);
        assertEquals(Provenance.HARDWARE,
                     frames.describe().get("good_frames"));
        assertEquals(40L, frames.read().get("good_frames").longValue());
    }

    @Test
    public void testMissingStrategies()
    {
        try {
            new Dae(new MockDaeHardware(), null, new MockWaiter(log),
                    reducer);
            fail("Missing controller should be rejected");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }
}
