package isis.dae.signal;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the derived signals owned by one strategy.
 *
 * Values are only ever changed through {@link Update#commit()}, which
 * swaps the whole set of readings in one step: a reader sees either every
 * value from the previous commit or every value from the new one.  If a
 * reduction throws before committing, nothing it computed is visible.
 */
public class SoftSignalBank
{
    private final String prefix;
    private final Map<String, SoftSignal> signals =
        new LinkedHashMap<String, SoftSignal>();
    private final AtomicReference<Map<String, Reading>> current =
        new AtomicReference<Map<String, Reading>>(
            Collections.<String, Reading>emptyMap());

    public SoftSignalBank()
    {
        this("");
    }

    /**
     * @param prefix prepended to every registered name, e.g. "up."
     */
    public SoftSignalBank(final String prefix)
    {
        this.prefix = prefix;
    }

    /**
     * Register a scalar signal with an initial value of zero.
     */
    public synchronized SoftSignal register(final String name,
                                            final String units)
    {
        return register(name, units, Double.valueOf(0.0));
    }

    public synchronized SoftSignal register(final String name,
                                            final String units,
                                            final Object initial)
    {
        final String fullName = prefix + name;
        if (signals.containsKey(fullName)) {
            throw new IllegalArgumentException("Signal " + fullName +
                                               " already registered");
        }

        SoftSignal sig = new SoftSignal(fullName, units);
        signals.put(fullName, sig);

        Map<String, Reading> next =
            new HashMap<String, Reading>(current.get());
        next.put(fullName,
                 new Reading(initial, null, units, Provenance.DERIVED));
        current.set(Collections.unmodifiableMap(next));
        return sig;
    }

    public synchronized List<Signal> getSignals()
    {
        return new ArrayList<Signal>(signals.values());
    }

    Reading get(final String fullName)
    {
        return current.get().get(fullName);
    }

    /**
     * Start collecting a new set of values.
     */
    public Update update()
    {
        return new Update();
    }

    /**
     * Pending values for an atomic publication.
     */
    public final class Update
    {
        private final Map<String, Reading> pending =
            new HashMap<String, Reading>();

        private Update()
        {
        }

        public Update set(final SoftSignal sig, final Object value)
        {
            return set(sig, value, null);
        }

        public Update set(final SoftSignal sig, final Object value,
                          final Object variance)
        {
            if (!signals.containsKey(sig.getName()) ||
                signals.get(sig.getName()) != sig)
            {
                throw new IllegalArgumentException("Signal " + sig.getName() +
                                                   " does not belong to" +
                                                   " this bank");
            }
            pending.put(sig.getName(), new Reading(value, variance,
                                                   sig.getUnits(),
                                                   Provenance.DERIVED));
            return this;
        }

        /**
         * Publish every pending value at once.
         */
        public void commit()
        {
            synchronized (SoftSignalBank.this) {
                Map<String, Reading> next =
                    new HashMap<String, Reading>(current.get());
                next.putAll(pending);
                current.set(Collections.unmodifiableMap(next));
            }
        }
    }

    /**
     * A derived signal whose value lives in its owning bank.
     */
    public final class SoftSignal
        implements Signal
    {
        private final String name;
        private final String units;

        private SoftSignal(final String name, final String units)
        {
            this.name = name;
            this.units = units;
        }

        @Override
        public String getName()
        {
            return name;
        }

        public String getUnits()
        {
            return units;
        }

        @Override
        public Provenance getProvenance()
        {
            return Provenance.DERIVED;
        }

        @Override
        public Reading read()
        {
            return get(name);
        }

        @Override
        public String toString()
        {
            return "SoftSignal[" + name + "]";
        }
    }
}
