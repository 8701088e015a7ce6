package isis.dae.signal;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;

import isis.dae.hardware.HardwareException;
import isis.dae.hardware.test.MockDaeHardware;

import org.junit.Test;

public class HardwareSignalTest
{
    @Test
    public void testLiveReads()
        throws HardwareException
    {
        MockDaeHardware hw = new MockDaeHardware();
        HardwareSignal frames = HardwareSignal.goodFrames(hw);
        assertEquals("good_frames", frames.getName());
        assertEquals(Provenance.HARDWARE, frames.getProvenance());

        hw.setGoodFrames(17);
        assertEquals(17L, frames.read().longValue());
        hw.setGoodFrames(18);
        assertEquals(18L, frames.readValue().longValue());
        assertFalse(frames.read().hasVariance());
    }

    @Test
    public void testNames()
        throws HardwareException
    {
        MockDaeHardware hw = new MockDaeHardware();
        hw.setRunNumber(42);
        hw.setPeriodGoodUah(1.25);

        assertEquals("period_good_frames",
                     HardwareSignal.periodGoodFrames(hw).getName());
        assertEquals("good_uah", HardwareSignal.goodUah(hw).getName());
        assertEquals("period_good_uah",
                     HardwareSignal.periodGoodUah(hw).getName());
        assertEquals("period_num", HardwareSignal.periodNumber(hw).getName());
        assertEquals(42, HardwareSignal.runNumber(hw).read().longValue());
        assertEquals(1.25, HardwareSignal.periodGoodUah(hw).read().doubleValue(),
                     0.0);
        assertEquals(1L, HardwareSignal.periodNumber(hw).read().longValue());
    }
}
