package isis.dae;

/**
 * Lifecycle of an orchestrator.
 */
public enum DaeState
{
    /** Not staged; {@link AbstractDae#trigger()} is not allowed. */
    IDLE,
    /** Setup failed; only {@link AbstractDae#unstage()} is useful. */
    SETUP_FAILED,
    /** Ready to acquire a point. */
    STAGED,
    /** Acquiring or reducing a point. */
    ACQUIRING;
}
