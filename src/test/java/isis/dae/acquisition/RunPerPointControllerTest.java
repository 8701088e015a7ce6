package isis.dae.acquisition;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import isis.dae.hardware.HardwareException;
import isis.dae.hardware.RunState;
import isis.dae.hardware.test.MockDaeHardware;
import isis.dae.signal.Signal;

import java.util.Arrays;
import java.util.List;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.varia.NullAppender;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

public class RunPerPointControllerTest
{
    @BeforeClass
    public static void setupLogging()
    {
        BasicConfigurator.resetConfiguration();
        BasicConfigurator.configure(new NullAppender());
        Logger.getRootLogger().setLevel(Level.ALL);

        System.setProperty(HardwarePoller.POLL_INTERVAL_PROPERTY, "1");
    }

    @AfterClass
    public static void tearDownLogging()
    {
        System.clearProperty(HardwarePoller.POLL_INTERVAL_PROPERTY);
        BasicConfigurator.resetConfiguration();
    }

    @Test
    public void testSavedRun()
        throws AcquisitionError, InterruptedException, HardwareException
    {
        MockDaeHardware hw = new MockDaeHardware();
        hw.setRunNumber(1234);

        RunPerPointController ctlr = new RunPerPointController(true);
        assertEquals(AcquisitionUnit.RUN, ctlr.getAcquisitionUnit());

        List<Signal> sigs = ctlr.getPublishedSignals(hw);
        assertEquals(1, sigs.size());
        assertEquals("run_number", sigs.get(0).getName());

        ctlr.setup(hw);
        assertTrue(hw.getCommands().isEmpty());

        ctlr.startCounting(hw);
        assertTrue(ctlr.isUnitOpen());
        assertEquals(RunState.RUNNING, hw.getRunState());
        assertEquals(1234L, sigs.get(0).read().longValue());

        ctlr.stopCounting(hw);
        assertFalse(ctlr.isUnitOpen());
        assertEquals(Arrays.asList("beginRun", "endRun"), hw.getCommands());

        ctlr.teardown(hw);
        assertEquals(2, hw.getCommands().size());
    }

    @Test
    public void testAbortedRunPublishesNothing()
        throws AcquisitionError, InterruptedException
    {
        MockDaeHardware hw = new MockDaeHardware();
        RunPerPointController ctlr = new RunPerPointController(false);
        assertTrue(ctlr.getPublishedSignals(hw).isEmpty());

        ctlr.setup(hw);
        ctlr.startCounting(hw);
        ctlr.stopCounting(hw);
        assertEquals(Arrays.asList("beginRun", "abortRun"), hw.getCommands());
    }

    @Test
    public void testTeardownClosesOpenRun()
        throws AcquisitionError, InterruptedException
    {
        MockDaeHardware hw = new MockDaeHardware();
        RunPerPointController ctlr = new RunPerPointController(false);
        ctlr.setup(hw);
        ctlr.startCounting(hw);

        ctlr.teardown(hw);
        assertEquals(1, hw.count("abortRun"));
        assertFalse(ctlr.isUnitOpen());

        ctlr.teardown(hw);
        assertEquals(1, hw.count("abortRun"));
    }

    @Test
    public void testBeginFailure()
        throws InterruptedException
    {
        MockDaeHardware hw = new MockDaeHardware();
        hw.failOn("beginRun");

        RunPerPointController ctlr = new RunPerPointController(true);
        try {
            ctlr.startCounting(hw);
            fail("Begin failure should propagate");
        } catch (AcquisitionError ae) {
            assertEquals("Cannot begin run", ae.getMessage());
        }
        assertFalse(ctlr.isUnitOpen());
    }
}
