package isis.dae.signal;

/**
 * Where a published value came from.
 */
public enum Provenance
{
    /** Read straight from the acquisition electronics. */
    HARDWARE,
    /** Computed by a controller or reducer. */
    DERIVED
}
