package isis.dae.reduce;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.hardware.HardwareException;
import isis.dae.hardware.test.MockDaeHardware;
import isis.dae.signal.Signal;
import isis.dae.stats.Bounds;
import isis.dae.stats.Measurement;
import isis.dae.stats.Polarisation;

import java.util.List;

import org.apache.log4j.BasicConfigurator;
import org.apache.log4j.Level;
import org.apache.log4j.Logger;
import org.apache.log4j.varia.NullAppender;
import org.junit.AfterClass;
import org.junit.BeforeClass;
import org.junit.Test;

public class PolarisationReducerTest
{
    private static final double EPSILON = 1.0e-9;

    private MultiWavelengthBandNormalizer up;
    private MultiWavelengthBandNormalizer down;
    private PolarisationReducer reducer;
    private MockDaeHardware hw;

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

    private void build()
    {
        List<Bounds> bands = MultiWavelengthBandNormalizerTest.channelBands();
        hw = new MockDaeHardware(3, MultiWavelengthBandNormalizerTest.TOF_EDGES);
        up = new MultiWavelengthBandNormalizer("up.", new int[] { 2 },
                                               new int[] { 1 },
                                               MultiWavelengthBandNormalizerTest.summers(bands));
        down = new MultiWavelengthBandNormalizer("down.", new int[] { 2 },
                                                 new int[] { 1 },
                                                 MultiWavelengthBandNormalizerTest.summers(bands));
        reducer = new PolarisationReducer(bands, up, down);
    }

    private void measure(final long[] upDet, final long[] downDet)
        throws AcquisitionError
    {
        hw.setSpectrum(1, new long[] { 100L, 100L });
        hw.setSpectrum(2, upDet);
        up.reduceData(hw);
        hw.setSpectrum(2, downDet);
        down.reduceData(hw);
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
    public void testPolarisation()
        throws AcquisitionError, HardwareException
    {
        build();
        reducer.checkConfiguration(hw);
        measure(new long[] { 300L, 40L }, new long[] { 150L, 10L });
        reducer.reduceData(hw);

        List<Signal> sigs = reducer.getPublishedSignals(hw);
        assertEquals(8, sigs.size());

        assertEquals(1.0 / 3.0,
                     find(sigs, "band0.polarisation").read().doubleValue(),
                     EPSILON);
        assertEquals(0.6,
                     find(sigs, "band1.polarisation").read().doubleValue(),
                     EPSILON);
        assertEquals(2.0,
                     find(sigs, "band0.polarisation_ratio").read()
                     .doubleValue(), EPSILON);
        assertEquals(4.0,
                     find(sigs, "band1.polarisation_ratio").read()
                     .doubleValue(), EPSILON);

        final Measurement a = up.getBands().get(1).getIntensity();
        final Measurement b = down.getBands().get(1).getIntensity();
        assertEquals(Polarisation.calculate(a, b).getStddev(),
                     find(sigs, "band1.polarisation_stddev").read()
                     .doubleValue(), EPSILON);
        assertEquals(Polarisation.ratio(a, b).getStddev(),
                     find(sigs, "band1.polarisation_ratio_stddev").read()
                     .doubleValue(), EPSILON);
    }

    @Test
    public void testFailureLeavesPreviousValues()
        throws AcquisitionError, HardwareException
    {
        build();
        measure(new long[] { 300L, 40L }, new long[] { 150L, 10L });
        reducer.reduceData(hw);

        // spin-down band 1 is empty, so its ratio is undefined
        measure(new long[] { 200L, 40L }, new long[] { 100L, 0L });
        try {
            reducer.reduceData(hw);
            fail("Zero spin-down intensity should fail");
        } catch (AcquisitionError ae) {
            assertTrue(ae.getMessage(), ae.getMessage().contains("band 1"));
        }

        List<Signal> sigs = reducer.getPublishedSignals(hw);
        assertEquals(1.0 / 3.0,
                     find(sigs, "band0.polarisation").read().doubleValue(),
                     EPSILON);
        assertEquals(0.6,
                     find(sigs, "band1.polarisation").read().doubleValue(),
                     EPSILON);
    }

    @Test
    public void testBothStatesEmpty()
        throws AcquisitionError
    {
        build();
        measure(new long[] { 0L, 5L }, new long[] { 0L, 5L });
        try {
            reducer.reduceData(hw);
            fail("Empty band should fail");
        } catch (AcquisitionError ae) {
            assertTrue(ae.getMessage(), ae.getMessage().contains("band 0"));
        }
    }

    @Test
    public void testMismatchedBands()
    {
        build();
        MultiWavelengthBandNormalizer single =
            new MultiWavelengthBandNormalizer(new int[] { 2 }, new int[] { 1 },
                                              MultiWavelengthBandNormalizerTest
                                              .summers(MultiWavelengthBandNormalizerTest
                                                       .channelBands()
                                                       .subList(0, 1)));
        PolarisationReducer bad =
            new PolarisationReducer(MultiWavelengthBandNormalizerTest
                                    .channelBands(), up, single);
        try {
            bad.checkConfiguration(hw);
            fail("Mismatched band counts should be rejected");
        } catch (AcquisitionError ae) {
            assertTrue(ae.getMessage(), ae.getMessage().contains("Mismatched"));
        }
    }
}
