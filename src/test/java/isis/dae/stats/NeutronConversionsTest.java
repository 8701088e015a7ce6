package isis.dae.stats;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class NeutronConversionsTest
{
    @Test
    public void testWavelength()
    {
        // h/m_n is about 3956 m angstrom / s
        assertEquals(0.39560, NeutronConversions.wavelength(1000.0, 10.0),
                     1.0e-4);
        assertEquals(2.0 * NeutronConversions.wavelength(1000.0, 10.0),
                     NeutronConversions.wavelength(2000.0, 10.0), 1.0e-12);
    }

    @Test
    public void testWavelengthArray()
    {
        double[] tof = new double[] { 0.0, 500.0, 1000.0 };
        double[] lambda = NeutronConversions.wavelength(tof, 10.0);
        assertEquals(0.0, lambda[0], 0.0);
        for (int i = 1; i < lambda.length; i++) {
            assertTrue(lambda[i] > lambda[i - 1]);
        }
    }

    @Test
    public void testBackscatteringDspacingIsHalfWavelength()
    {
        final double lambda = NeutronConversions.wavelength(1500.0, 20.0);
        assertEquals(lambda / 2.0,
                     NeutronConversions.dspacing(1500.0, 20.0, 180.0),
                     1.0e-12);
    }

    @Test
    public void testDspacingArray()
    {
        double[] d = NeutronConversions.dspacing(new double[] { 100.0, 200.0 },
                                                 10.0, 90.0);
        final double sin45 = Math.sin(Math.toRadians(45.0));
        assertArrayEquals(new double[] {
                NeutronConversions.wavelength(100.0, 10.0) / (2.0 * sin45),
                NeutronConversions.wavelength(200.0, 10.0) / (2.0 * sin45),
            }, d, 1.0e-12);
    }

    @Test
    public void testBadArguments()
    {
        try {
            NeutronConversions.wavelength(1000.0, 0.0);
            fail("Zero flight path should be rejected");
        } catch (IllegalArgumentException iae) {
            // expected
        }

        try {
            NeutronConversions.dspacing(1000.0, 10.0, 0.0);
            fail("Zero scattering angle should be rejected");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }
}
