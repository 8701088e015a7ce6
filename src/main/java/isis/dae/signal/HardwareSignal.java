package isis.dae.signal;

import isis.dae.hardware.HardwareException;
import isis.dae.hardware.IDaeHardware;

/**
 * A signal read directly from a hardware counter on every read.
 */
public class HardwareSignal
    implements Signal
{
    /**
     * Reads one scalar counter from the electronics.
     */
    public interface Counter
    {
        Number read(IDaeHardware hardware) throws HardwareException;
    }

    private final String name;
    private final String units;
    private final IDaeHardware hardware;
    private final Counter counter;

    public HardwareSignal(final String name, final String units,
                          final IDaeHardware hardware, final Counter counter)
    {
        this.name = name;
        this.units = units;
        this.hardware = hardware;
        this.counter = counter;
    }

    public static HardwareSignal goodFrames(final IDaeHardware hardware)
    {
        return new HardwareSignal("good_frames", "frames", hardware,
                                  new Counter() {
                public Number read(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getGoodFrames();
                }
            });
    }

    public static HardwareSignal periodGoodFrames(final IDaeHardware hardware)
    {
        return new HardwareSignal("period_good_frames", "frames", hardware,
                                  new Counter() {
                public Number read(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getPeriodGoodFrames();
                }
            });
    }

    public static HardwareSignal goodUah(final IDaeHardware hardware)
    {
        return new HardwareSignal("good_uah", "uAh", hardware,
                                  new Counter() {
                public Number read(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getGoodUah();
                }
            });
    }

    public static HardwareSignal periodGoodUah(final IDaeHardware hardware)
    {
        return new HardwareSignal("period_good_uah", "uAh", hardware,
                                  new Counter() {
                public Number read(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getPeriodGoodUah();
                }
            });
    }

    public static HardwareSignal mEvents(final IDaeHardware hardware)
    {
        return new HardwareSignal("m_events", "Mevents", hardware,
                                  new Counter() {
                public Number read(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getMEvents();
                }
            });
    }

    public static HardwareSignal periodNumber(final IDaeHardware hardware)
    {
        return new HardwareSignal("period_num", null, hardware,
                                  new Counter() {
                public Number read(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getPeriod();
                }
            });
    }

    public static HardwareSignal runNumber(final IDaeHardware hardware)
    {
        return new HardwareSignal("run_number", null, hardware,
                                  new Counter() {
                public Number read(final IDaeHardware hw)
                    throws HardwareException
                {
                    return hw.getRunNumber();
                }
            });
    }

    @Override
    public String getName()
    {
        return name;
    }

    @Override
    public Provenance getProvenance()
    {
        return Provenance.HARDWARE;
    }

    /**
     * Read the raw counter value without wrapping it in a {@link Reading}.
     */
    public Number readValue()
        throws HardwareException
    {
        return counter.read(hardware);
    }

    @Override
    public Reading read()
        throws HardwareException
    {
        return new Reading(readValue(), null, units, Provenance.HARDWARE);
    }

    @Override
    public String toString()
    {
        return "HardwareSignal[" + name + "]";
    }
}
