package at.sv.solcalc;

/**
 * Thrown if the sunlight level at a place does not change for longer than the configured number of half-days.
 */
public final class SunlightChangeNotFound extends RuntimeException {

    public SunlightChangeNotFound(String message) {
        super(message);
    }
}
