package isis.dae.hardware;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

public class SpectrumDataTableTest
{
    /** Two spectra of three channels, with junk in row and column 0. */
    private static int[] rawTable()
    {
        return new int[] {
            99, 99, 99, 99,
            99, 1, 2, 3,
            99, 10, 20, 30,
        };
    }

    @Test
    public void testSkipsChannelZero()
        throws HardwareException
    {
        SpectrumDataTable table = new SpectrumDataTable(rawTable(), 2, 3);
        assertArrayEquals(new long[] { 1L, 2L, 3L }, table.getCounts(1));
        assertEquals(60L, table.integrate(2));
        assertArrayEquals(new long[] { 60L, 6L },
                          table.integrate(new int[] { 2, 1 }));
    }

    @Test
    public void testSpectrumOutOfRange()
        throws HardwareException
    {
        SpectrumDataTable table = new SpectrumDataTable(rawTable(), 2, 3);
        try {
            table.getCounts(3);
            fail("Spectrum 3 should be out of range");
        } catch (IndexOutOfBoundsException ioobe) {
            // expected
        }
    }

    @Test
    public void testShortTable()
    {
        try {
            new SpectrumDataTable(new int[5], 2, 3);
            fail("Short table should be rejected");
        } catch (HardwareException he) {
            // expected
        }
    }

    @Test
    public void testSizeLimit()
    {
        assertEquals(2L * 11L * 101L,
                     SpectrumDataTable.requiredElements(2, 10, 100));
        assertTrue(SpectrumDataTable.fits(1, 999, 4999));
        assertFalse(SpectrumDataTable.fits(1, 1000, 5000));
        assertFalse(SpectrumDataTable.fits(100, 1000, 1000));
    }
}
