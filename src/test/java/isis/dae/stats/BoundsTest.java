package isis.dae.stats;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class BoundsTest
{
    @Test
    public void testBaseUnits()
    {
        Bounds ms = new Bounds(1.0, 2.5, AxisUnit.MILLISECONDS);
        assertEquals(1000.0, ms.getBaseLower(), 1.0e-9);
        assertEquals(2500.0, ms.getBaseUpper(), 1.0e-9);

        Bounds nm = Bounds.of(new double[] { 0.1, 0.5 }, AxisUnit.NANOMETRE);
        assertEquals(1.0, nm.getBaseLower(), 1.0e-12);
        assertEquals(5.0, nm.getBaseUpper(), 1.0e-12);
    }

    @Test
    public void testUpperMustExceedLower()
    {
        try {
            new Bounds(2.0, 2.0, AxisUnit.ANGSTROM);
            fail("Empty bounds should be rejected");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }

    @Test
    public void testPairLength()
    {
        try {
            Bounds.of(new double[] { 1.0, 2.0, 3.0 }, AxisUnit.ANGSTROM);
            fail("Three values should be rejected");
        } catch (IllegalArgumentException iae) {
            assertEquals("Should contain lower and upper bound",
                         iae.getMessage());
        }
    }

    @Test
    public void testParseUnits()
    {
        assertEquals(AxisUnit.MICROSECONDS, AxisUnit.parse("us"));
        assertEquals(AxisUnit.MICROSECONDS, AxisUnit.parse(" Microseconds "));
        assertEquals(AxisUnit.ANGSTROM, AxisUnit.parse("Angstrom"));
        assertEquals(AxisUnit.NANOMETRE, AxisUnit.parse("nm"));

        assertTrue(AxisUnit.NANOSECONDS.isTime());
        assertFalse(AxisUnit.NANOSECONDS.isLength());
        assertTrue(AxisUnit.ANGSTROM.isLength());

        try {
            AxisUnit.parse("furlong");
            fail("Unknown unit should be rejected");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }
}
