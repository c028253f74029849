package at.sv.solcalc.math;

/**
 * Signals an argument outside the domain of a {@link DecimalMath} function, e.g. the arcsine of a value greater than one
 * or the logarithm of zero. Never clamped or retried, always propagated to the caller.
 */
public final class InvalidMathArgument extends IllegalArgumentException {

    public InvalidMathArgument(String message) {
        super(message);
    }
}
