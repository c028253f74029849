package at.sv.solcalc.math;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

import static java.math.BigDecimal.ONE;
import static java.math.BigDecimal.ZERO;

/**
 * Counterpart of {@link Math} for {@link BigDecimal}. All functions are evaluated with Taylor series and Newton iterations
 * under {@link #CONTEXT}, so identical inputs produce identical outputs on every JVM, independent of the floating point
 * hardware.
 * <p>
 * The series and the argument reduction tricks were ported from the {@code DecimalMath} helper class of Ramin Rahimzada
 * (<a href="https://github.com/raminrahimzada/CSharp-Helper-Classes">CSharp-Helper-Classes</a>).
 */
public final class DecimalMath {

    /**
     * The precision every operation of this class (and of the solar formulas built on it) is rounded to.
     */
    public static final MathContext CONTEXT = MathContext.DECIMAL128;

    public static final BigDecimal PI = constant("3.14159265358979323846264338327950288419716939937510");
    public static final BigDecimal E = constant("2.7182818284590452353602874713526624977572470936999595749");
    /**
     * Tolerance used to decide if an exponent of {@link #pow(BigDecimal, BigDecimal)} is an integer.
     */
    public static final BigDecimal EPSILON = new BigDecimal("1E-19");

    private static final BigDecimal TWO_PI = constant("6.28318530717958647692528676655900576839433879875021");
    private static final BigDecimal HALF_PI = constant("1.570796326794896619231321691639751442098584699687552910487");
    private static final BigDecimal QUARTER_PI = constant("0.785398163397448309615660845819875721049292349843776455243");
    private static final BigDecimal E_INVERSE = constant("0.3678794411714423215955237701614608674458111310317678");
    private static final BigDecimal LOG10_INVERSE = constant("0.434294481903251827651128918916605082294397005803666566114");
    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    /**
     * Arguments of asin and acos may exceed one by this much due to rounding, and are treated as exactly one.
     */
    private static final BigDecimal DOMAIN_TOLERANCE = new BigDecimal("1E-30");
    private static final int MAX_ITERATION = 100;

    private DecimalMath() {
    }

    private static BigDecimal constant(String value) {
        return new BigDecimal(value, CONTEXT);
    }

    public static BigDecimal exp(BigDecimal x) {
        int count = 0;
        if (x.compareTo(ONE) > 0) {
            BigDecimal integerPart = truncate(x);
            count = integerPart.intValueExact();
            x = x.subtract(integerPart, CONTEXT);
        }
        if (x.signum() < 0) {
            BigDecimal integerPart = truncate(x);
            count = integerPart.intValueExact() - 1;
            x = ONE.add(x.subtract(integerPart, CONTEXT), CONTEXT);
        }

        BigDecimal result = ONE;
        BigDecimal term = ONE;
        BigDecimal previous;
        int iteration = 1;
        do {
            previous = result;
            term = term.multiply(x.divide(BigDecimal.valueOf(iteration++), CONTEXT), CONTEXT);
            result = result.add(term, CONTEXT);
        } while (previous.compareTo(result) != 0 && iteration <= MAX_ITERATION);

        if (count == 0) {
            return result;
        }
        return result.multiply(powN(E, count), CONTEXT);
    }

    /**
     * @throws InvalidMathArgument for a zero base with a negative exponent, or a negative base with a non-integer exponent
     */
    public static BigDecimal pow(BigDecimal value, BigDecimal exponent) {
        if (exponent.signum() == 0) {
            return ONE;
        }
        if (exponent.compareTo(ONE) == 0 || value.compareTo(ONE) == 0) {
            return value;
        }
        if (value.signum() == 0) {
            if (exponent.signum() > 0) {
                return ZERO;
            }
            throw new InvalidMathArgument("Zero base with negative exponent " + exponent.toPlainString());
        }
        if (exponent.compareTo(ONE.negate()) == 0) {
            return ONE.divide(value, CONTEXT);
        }

        boolean integerExponent = isInteger(exponent);
        if (value.signum() < 0 && !integerExponent) {
            throw new InvalidMathArgument("Negative base " + value.toPlainString() + " with non-integer exponent " +
                                          exponent.toPlainString());
        }
        if (integerExponent && value.signum() > 0) {
            return powN(value, exponent.intValue());
        }
        if (integerExponent) {
            BigDecimal magnitude = exp(exponent.multiply(log(value.negate()), CONTEXT));
            return exponent.intValue() % 2 == 0 ? magnitude : magnitude.negate();
        }
        return exp(exponent.multiply(log(value), CONTEXT));
    }

    private static boolean isInteger(BigDecimal value) {
        return value.subtract(truncate(value)).abs().compareTo(EPSILON) <= 0;
    }

    /**
     * Exponentiation by squaring.
     */
    public static BigDecimal powN(BigDecimal value, int power) {
        if (power == 0) {
            return ONE;
        }
        if (power < 0) {
            value = ONE.divide(value, CONTEXT);
            power = -power;
        }
        int remaining = power;
        BigDecimal product = ONE;
        BigDecimal current = value;
        while (remaining > 0) {
            if ((remaining & 1) == 1) {
                product = current.multiply(product, CONTEXT);
                remaining--;
            }
            current = current.multiply(current, CONTEXT);
            remaining >>= 1;
        }
        return product;
    }

    public static BigDecimal log10(BigDecimal x) {
        return log(x).multiply(LOG10_INVERSE, CONTEXT);
    }

    /**
     * Natural logarithm.
     *
     * @throws InvalidMathArgument if {@code x <= 0}
     */
    public static BigDecimal log(BigDecimal x) {
        if (x.signum() <= 0) {
            throw new InvalidMathArgument("Logarithm is undefined for " + x.toPlainString() + ", argument must be > 0");
        }
        int count = 0;
        while (x.compareTo(ONE) >= 0) {
            x = x.multiply(E_INVERSE, CONTEXT);
            count++;
        }
        while (x.compareTo(E_INVERSE) <= 0) {
            x = x.multiply(E, CONTEXT);
            count--;
        }

        x = x.subtract(ONE, CONTEXT);
        if (x.signum() == 0) {
            return BigDecimal.valueOf(count);
        }
        // ln(1 + x) = -sum((-x)^n / n)
        BigDecimal result = ZERO;
        BigDecimal power = ONE;
        BigDecimal previous = result.subtract(ONE);
        int iteration = 0;
        while (previous.compareTo(result) != 0 && iteration < MAX_ITERATION) {
            iteration++;
            previous = result;
            power = power.multiply(x.negate(), CONTEXT);
            result = result.add(power.divide(BigDecimal.valueOf(iteration), CONTEXT), CONTEXT);
        }
        return BigDecimal.valueOf(count).subtract(result, CONTEXT);
    }

    public static BigDecimal cos(BigDecimal x) {
        x = truncateToPeriodicInterval(x);
        if (x.compareTo(PI) >= 0) {
            return cos(x.subtract(PI, CONTEXT)).negate();
        }
        if (x.compareTo(PI.negate()) <= 0) {
            return cos(x.add(PI, CONTEXT)).negate();
        }

        // 1 - x^2/2! + x^4/4! - x^6/6! ...
        BigDecimal squared = x.multiply(x, CONTEXT);
        BigDecimal term = squared.negate().multiply(HALF, CONTEXT);
        BigDecimal result = ONE.add(term, CONTEXT);
        BigDecimal previous = result.subtract(ONE);
        for (int i = 1; previous.compareTo(result) != 0 && i < MAX_ITERATION; i++) {
            previous = result;
            BigDecimal factor = BigDecimal.valueOf((long) i * ((i << 1) + 3) + 1); // (2i + 1)(i + 1)
            factor = HALF.negate().divide(factor, CONTEXT);
            term = term.multiply(squared.multiply(factor, CONTEXT), CONTEXT);
            result = result.add(term, CONTEXT);
        }
        return result;
    }

    public static BigDecimal sin(BigDecimal x) {
        return sinFromCos(x, cos(x));
    }

    /**
     * @throws InvalidMathArgument if {@code cos(x)} is zero
     */
    public static BigDecimal tan(BigDecimal x) {
        BigDecimal cos = cos(x);
        if (cos.signum() == 0) {
            throw new InvalidMathArgument("Tangent is undefined for " + x.toPlainString());
        }
        return sinFromCos(x, cos).divide(cos, CONTEXT);
    }

    private static BigDecimal sinFromCos(BigDecimal x, BigDecimal cos) {
        BigDecimal sinSquared = ONE.subtract(cos.multiply(cos, CONTEXT), CONTEXT).max(ZERO);
        BigDecimal modulus = sqrt(sinSquared);
        return isSignOfSinePositive(x) ? modulus : modulus.negate();
    }

    private static boolean isSignOfSinePositive(BigDecimal x) {
        x = truncateToPeriodicInterval(x);
        if (x.compareTo(PI.negate()) <= 0) {
            return true;
        }
        if (x.signum() <= 0) {
            return false;
        }
        return x.compareTo(PI) <= 0;
    }

    /**
     * Wraps the given angle into the open interval (-2π, 2π).
     */
    private static BigDecimal truncateToPeriodicInterval(BigDecimal x) {
        while (x.compareTo(TWO_PI) >= 0) {
            BigDecimal periods = truncate(x.divide(TWO_PI, CONTEXT)).max(ONE);
            x = x.subtract(periods.multiply(TWO_PI, CONTEXT), CONTEXT);
        }
        BigDecimal negativeTwoPi = TWO_PI.negate();
        while (x.compareTo(negativeTwoPi) <= 0) {
            BigDecimal periods = truncate(x.divide(TWO_PI, CONTEXT)).abs().max(ONE);
            x = x.add(periods.multiply(TWO_PI, CONTEXT), CONTEXT);
        }
        return x;
    }

    public static BigDecimal sqrt(BigDecimal x) {
        return sqrt(x, ZERO);
    }

    /**
     * Newton-Raphson square root, seeded with the floating point square root.
     *
     * @param epsilon iterate until two successive approximations differ by at most this value. Values smaller than
     *                the unit in the last place of the approximation are treated as that unit.
     * @throws InvalidMathArgument if {@code x < 0}
     */
    public static BigDecimal sqrt(BigDecimal x, BigDecimal epsilon) {
        if (x.signum() < 0) {
            throw new InvalidMathArgument("Cannot calculate square root from a negative number: " + x.toPlainString());
        }
        if (x.signum() == 0) {
            return ZERO;
        }
        double seed = Math.sqrt(x.doubleValue());
        BigDecimal current = Double.isFinite(seed) && seed > 0 ? new BigDecimal(seed, CONTEXT) : x;
        BigDecimal previous;
        int iteration = 0;
        do {
            previous = current;
            current = previous.add(x.divide(previous, CONTEXT), CONTEXT).multiply(HALF, CONTEXT);
        } while (previous.subtract(current, CONTEXT).abs().compareTo(epsilon.max(current.ulp())) > 0
                 && ++iteration < MAX_ITERATION);
        return current;
    }

    public static BigDecimal sinh(BigDecimal x) {
        BigDecimal y = exp(x);
        BigDecimal inverse = ONE.divide(y, CONTEXT);
        return y.subtract(inverse, CONTEXT).multiply(HALF, CONTEXT);
    }

    public static BigDecimal cosh(BigDecimal x) {
        BigDecimal y = exp(x);
        BigDecimal inverse = ONE.divide(y, CONTEXT);
        return y.add(inverse, CONTEXT).multiply(HALF, CONTEXT);
    }

    public static BigDecimal tanh(BigDecimal x) {
        BigDecimal y = exp(x);
        BigDecimal inverse = ONE.divide(y, CONTEXT);
        return y.subtract(inverse, CONTEXT).divide(y.add(inverse, CONTEXT), CONTEXT);
    }

    /**
     * Arcsine in radians. Uses {@code asin(x) = (π/2 - asin(1 - 2x²)) / 2} to move the argument closer to zero, where
     * the series converges fastest.
     *
     * @throws InvalidMathArgument if {@code |x| > 1}
     */
    public static BigDecimal asin(BigDecimal x) {
        x = requireUnitInterval("Arcsine", x);
        if (x.signum() == 0) {
            return ZERO;
        }
        if (x.compareTo(ONE) == 0) {
            return HALF_PI;
        }
        if (x.signum() < 0) {
            return asin(x.negate()).negate();
        }

        BigDecimal reduced = ONE.subtract(TWO.multiply(x, CONTEXT).multiply(x, CONTEXT), CONTEXT);
        if (x.compareTo(reduced.abs()) > 0) {
            return HALF.multiply(HALF_PI.subtract(asin(reduced), CONTEXT), CONTEXT);
        }

        BigDecimal squared = x.multiply(x, CONTEXT);
        BigDecimal term = x;
        BigDecimal result = x;
        BigDecimal previous;
        int i = 1;
        do {
            previous = result;
            BigDecimal coefficient = ONE.subtract(HALF.divide(BigDecimal.valueOf(i), CONTEXT), CONTEXT);
            term = term.multiply(squared.multiply(coefficient, CONTEXT), CONTEXT);
            result = result.add(term.divide(BigDecimal.valueOf((i << 1) + 1), CONTEXT), CONTEXT);
            i++;
        } while (previous.compareTo(result) != 0 && i < MAX_ITERATION);
        return result;
    }

    /**
     * @throws InvalidMathArgument if {@code |x| > 1}
     */
    public static BigDecimal acos(BigDecimal x) {
        x = requireUnitInterval("Arccosine", x);
        if (x.signum() == 0) {
            return HALF_PI;
        }
        if (x.compareTo(ONE) == 0) {
            return ZERO;
        }
        if (x.signum() < 0) {
            return PI.subtract(acos(x.negate()), CONTEXT);
        }
        return HALF_PI.subtract(asin(x), CONTEXT);
    }

    public static BigDecimal atan(BigDecimal x) {
        if (x.signum() == 0) {
            return ZERO;
        }
        if (x.compareTo(ONE) == 0) {
            return QUARTER_PI;
        }
        return asin(x.divide(sqrt(ONE.add(x.multiply(x, CONTEXT), CONTEXT)), CONTEXT));
    }

    /**
     * @throws InvalidMathArgument if both {@code y} and {@code x} are zero
     */
    public static BigDecimal atan2(BigDecimal y, BigDecimal x) {
        if (x.signum() == 0) {
            if (y.signum() > 0) {
                return HALF_PI;
            }
            if (y.signum() < 0) {
                return HALF_PI.negate();
            }
            throw new InvalidMathArgument("Arctangent is undefined for y = 0 and x = 0");
        }
        BigDecimal atan = atan(y.divide(x, CONTEXT));
        if (x.signum() > 0) {
            return atan;
        }
        return y.signum() >= 0 ? atan.add(PI, CONTEXT) : atan.subtract(PI, CONTEXT);
    }

    private static BigDecimal requireUnitInterval(String function, BigDecimal x) {
        if (x.abs().compareTo(ONE) <= 0) {
            return x;
        }
        if (x.abs().subtract(ONE).compareTo(DOMAIN_TOLERANCE) > 0) {
            throw new InvalidMathArgument(function + " is undefined for " + x.toPlainString() +
                                          ", argument must be in [-1, 1]");
        }
        return x.signum() > 0 ? ONE : ONE.negate();
    }

    private static BigDecimal truncate(BigDecimal x) {
        return x.setScale(0, RoundingMode.DOWN);
    }
}
