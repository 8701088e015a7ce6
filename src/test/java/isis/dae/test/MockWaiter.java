package isis.dae.test;

import isis.dae.acquisition.AcquisitionError;
import isis.dae.acquisition.Waiter;
import isis.dae.hardware.IDaeHardware;
import isis.dae.signal.Signal;

import java.util.ArrayList;
import java.util.List;

public class MockWaiter
    implements Waiter
{
    private final List<String> log;

    public MockWaiter(final List<String> log)
    {
        this.log = log;
    }

    @Override
    public List<Signal> getPublishedSignals(final IDaeHardware hardware)
    {
        return new ArrayList<Signal>();
    }

    @Override
    public void awaitCompletion(final IDaeHardware hardware)
        throws AcquisitionError
    {
        log.add("waiter.awaitCompletion");
    }

    @Override
    public String toString()
    {
        return "MockWaiter";
    }
}
