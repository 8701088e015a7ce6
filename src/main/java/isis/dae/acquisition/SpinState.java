package isis.dae.acquisition;

/**
 * Flipper state for polarised measurements.
 */
public enum SpinState
{
    UP,
    DOWN;
}
