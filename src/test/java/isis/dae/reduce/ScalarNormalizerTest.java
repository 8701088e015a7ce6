package isis.dae.reduce;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.ConfigurationError;
import isis.dae.hardware.HardwareException;
import isis.dae.hardware.test.MockDaeHardware;
import isis.dae.signal.Provenance;
import isis.dae.signal.Reading;
import isis.dae.signal.Signal;

import java.util.List;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.varia.NullAppender;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

public class ScalarNormalizerTest
{
    private static final double EPSILON = 1.0e-9;

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

    private static MockDaeHardware buildHardware()
    {
        MockDaeHardware hw = new MockDaeHardware();
        hw.setSpectrum(1, new long[] { 4L, 6L });
        hw.setSpectrum(2, new long[] { 5L, 15L });
        return hw;
    }

    private static Signal find(final List<Signal> sigs, final String name)
    {
        for (Signal s : sigs) {
            if (s.getName().equals(name)) {
                return s;
            }
        }
        fail("No signal " + name);
        return null;
    }

    @Test
    public void testNormaliseByGoodFrames()
        throws AcquisitionError, HardwareException
    {
        MockDaeHardware hw = buildHardware();
        hw.setGoodFrames(100);

        GoodFramesNormalizer red = new GoodFramesNormalizer(new int[] { 1, 2 });
        List<Signal> sigs = red.getPublishedSignals(hw);
        assertEquals(5, sigs.size());
        assertEquals("det_counts", sigs.get(0).getName());
        assertEquals("intensity", sigs.get(1).getName());
        assertEquals("good_frames", sigs.get(2).getName());
        assertEquals("det_counts_stddev", sigs.get(3).getName());
        assertEquals("intensity_stddev", sigs.get(4).getName());

        red.checkConfiguration(hw);
        red.reduceData(hw);

        Reading det = find(sigs, "det_counts").read();
        assertEquals(30.0, det.doubleValue(), EPSILON);
        assertEquals(Math.sqrt(31.0), det.getStddev(), EPSILON);
        assertEquals(Provenance.DERIVED, det.getProvenance());

        Reading intensity = find(sigs, "intensity").read();
        assertEquals(0.3, intensity.doubleValue(), EPSILON);
        assertEquals(Math.sqrt(31.0) / 100.0, intensity.getStddev(), EPSILON);

        assertEquals(Math.sqrt(31.0),
                     find(sigs, "det_counts_stddev").read().doubleValue(),
                     EPSILON);
        assertEquals(Math.sqrt(31.0) / 100.0,
                     find(sigs, "intensity_stddev").read().doubleValue(),
                     EPSILON);
        assertEquals(Provenance.HARDWARE,
                     find(sigs, "good_frames").read().getProvenance());
    }

    @Test
    public void testZeroFrames()
        throws HardwareException
    {
        MockDaeHardware hw = buildHardware();
        hw.setPeriodGoodFrames(0);

        PeriodGoodFramesNormalizer red =
            new PeriodGoodFramesNormalizer(new int[] { 1 });
        try {
            red.reduceData(hw);
            fail("Zero frames should fail");
        } catch (AcquisitionError ae) {
            assertTrue(ae.getMessage(),
                       ae.getMessage().contains("period_good_frames is zero"));
        }

        // nothing was published
        assertEquals(0.0,
                     find(red.getPublishedSignals(hw),
                          "det_counts").read().doubleValue(), 0.0);
    }

    @Test
    public void testSpectrumOutOfRange()
    {
        MockDaeHardware hw = buildHardware();
        GoodFramesNormalizer red =
            new GoodFramesNormalizer(new int[] { 1, 11 });
        try {
            red.checkConfiguration(hw);
            fail("Spectrum 11 is beyond the hardware");
        } catch (ConfigurationError ce) {
            assertTrue(ce.getMessage(), ce.getMessage().contains("11"));
        } catch (AcquisitionError ae) {
            fail("Expected a configuration error, not " + ae);
        }
    }

    @Test
    public void testReadFailure()
    {
        MockDaeHardware hw = buildHardware();
        hw.setGoodFrames(1);
        hw.failOn("readSpectrum");
        try {
            new GoodFramesNormalizer(new int[] { 1 }).reduceData(hw);
            fail("Read failure should propagate");
        } catch (AcquisitionError ae) {
            assertTrue(ae.getCause() instanceof HardwareException);
        }
    }

    @Test
    public void testNoDetectors()
    {
        try {
            new GoodFramesNormalizer(new int[0]);
            fail("Empty detector list should be rejected");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }
}
