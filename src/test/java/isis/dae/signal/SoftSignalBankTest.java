package isis.dae.signal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.List;

import org.junit.Test;

public class SoftSignalBankTest
{
    @Test
    public void testInitialValues()
    {
        SoftSignalBank bank = new SoftSignalBank();
        SoftSignalBank.SoftSignal sig = bank.register("intensity", "counts");

        Reading rdg = sig.read();
        assertEquals(0.0, rdg.doubleValue(), 0.0);
        assertFalse(rdg.hasVariance());
        assertEquals("counts", rdg.getUnits());
        assertEquals(Provenance.DERIVED, rdg.getProvenance());
        assertEquals(Provenance.DERIVED, sig.getProvenance());
    }

    @Test
    public void testPrefix()
    {
        SoftSignalBank bank = new SoftSignalBank("up.");
        SoftSignalBank.SoftSignal sig = bank.register("intensity", null);
        assertEquals("up.intensity", sig.getName());

        List<Signal> list = bank.getSignals();
        assertEquals(1, list.size());
        assertEquals("up.intensity", list.get(0).getName());
    }

    @Test
    public void testDuplicateName()
    {
        SoftSignalBank bank = new SoftSignalBank();
        bank.register("x", null);
        try {
            bank.register("x", null);
            fail("Duplicate signal should be rejected");
        } catch (IllegalArgumentException iae) {
            // expected
        }
    }

    @Test
    public void testNothingVisibleBeforeCommit()
    {
        SoftSignalBank bank = new SoftSignalBank();
        SoftSignalBank.SoftSignal a = bank.register("a", null);
        SoftSignalBank.SoftSignal b = bank.register("b", null);

        SoftSignalBank.Update upd = bank.update().set(a, 1.0, 1.5);
        upd.set(b, 2.0);
        assertEquals(0.0, a.read().doubleValue(), 0.0);
        assertEquals(0.0, b.read().doubleValue(), 0.0);

        upd.commit();
        assertEquals(1.0, a.read().doubleValue(), 0.0);
        assertEquals(1.5, ((Number) a.read().getVariance()).doubleValue(),
                     0.0);
        assertEquals(Math.sqrt(1.5), a.read().getStddev(), 1.0e-12);
        assertEquals(2.0, b.read().doubleValue(), 0.0);
        assertNull(b.read().getVariance());
    }

    @Test
    public void testAbandonedUpdateLeavesOldValues()
    {
        SoftSignalBank bank = new SoftSignalBank();
        SoftSignalBank.SoftSignal a = bank.register("a", null);
        bank.update().set(a, 5.0).commit();

        // build an update but never commit it
        bank.update().set(a, 6.0);
        assertEquals(5.0, a.read().doubleValue(), 0.0);
    }

    @Test
    public void testForeignSignal()
    {
        SoftSignalBank bank = new SoftSignalBank();
        SoftSignalBank other = new SoftSignalBank();
        SoftSignalBank.SoftSignal sig = other.register("a", null);
        bank.register("a", null);

        try {
            bank.update().set(sig, 1.0);
            fail("Signal from another bank should be rejected");
        } catch (IllegalArgumentException iae) {
            assertTrue(iae.getMessage().contains("does not belong"));
        }
    }
}
