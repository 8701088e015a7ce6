package isis.dae.signal;

import isis.dae.hardware.IDaeHardware;

import java.util.List;

/**
 * Implemented by every acquisition strategy.  The orchestrator asks each
 * strategy once, at construction, which signals it considers interesting
 * and publishes the union of them on every read.
 */
public interface PublishesSignals
{
    /**
     * @param hardware the electronics the strategy will be driving
     * @return a fixed list of signals; never <tt>null</tt>
     */
    List<Signal> getPublishedSignals(IDaeHardware hardware);
}
