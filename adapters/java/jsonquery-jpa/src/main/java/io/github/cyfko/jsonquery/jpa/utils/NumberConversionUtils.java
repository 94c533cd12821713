package io.github.cyfko.jsonquery.jpa.utils;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Map;
import java.util.Set;

/**
 * Conversions between decoded JSON numbers and the numeric Java types of entity attributes.
 * <p>
 * A decoded filter carries whatever {@link Number} the JSON decoder produced ({@link Integer},
 * {@link Long}, {@link BigInteger}, {@link Double}, ...). Binding it to a criteria expression of
 * another numeric type is provider-dependent, so values are first converted to the attribute's
 * own type. Conversions go through {@link BigDecimal} and are exact: a value that does not fit
 * the target type raises {@link ArithmeticException}.
 * </p>
 *
 * <pre>{@code
 * NumberConversionUtils.convert(new BigDecimal("12"), Integer.class);   // 12 (Integer)
 * NumberConversionUtils.convert(new BigDecimal("1e12"), Integer.class); // ArithmeticException
 * NumberConversionUtils.convert(new BigDecimal("1.5"), Double.class);   // 1.5 (Double)
 * }</pre>
 *
 * @since 1.0.0
 */
public final class NumberConversionUtils {

    private static final Map<Class<?>, Class<?>> WRAPPERS = Map.of(
            int.class, Integer.class,
            long.class, Long.class,
            short.class, Short.class,
            byte.class, Byte.class,
            double.class, Double.class,
            float.class, Float.class,
            boolean.class, Boolean.class,
            char.class, Character.class
    );

    private static final Set<Class<?>> INTEGRAL = Set.of(
            Integer.class, Long.class, Short.class, Byte.class, BigInteger.class);

    private static final Set<Class<?>> SUPPORTED = Set.of(
            Integer.class, Long.class, Short.class, Byte.class, BigInteger.class,
            Double.class, Float.class, BigDecimal.class);

    private NumberConversionUtils() {
        // Utility class - prevent instantiation
    }

    /**
     * Replaces a primitive type by its wrapper.
     *
     * @param type any type
     * @return the wrapper of {@code type} if it is primitive, {@code type} otherwise
     */
    public static Class<?> wrap(Class<?> type) {
        return WRAPPERS.getOrDefault(type, type);
    }

    /**
     * Indicates whether filters can compare an attribute of this type with a number.
     */
    public static boolean isNumeric(Class<?> type) {
        return SUPPORTED.contains(wrap(type));
    }

    public static boolean isIntegral(Class<?> type) {
        return INTEGRAL.contains(wrap(type));
    }

    /**
     * Converts a decoded number to an exact decimal.
     *
     * @param value the number
     * @return its exact decimal value
     * @throws IllegalArgumentException if {@code value} is not finite
     */
    public static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal decimal) return decimal;
        if (value instanceof BigInteger integer) return new BigDecimal(integer);
        if (value instanceof Double || value instanceof Float) {
            double d = value.doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                throw new IllegalArgumentException("Not a finite number: " + value);
            }
            return new BigDecimal(value.toString());
        }
        return BigDecimal.valueOf(value.longValue());
    }

    /**
     * Converts a decimal to a numeric attribute type.
     *
     * @param value  the decimal; must be integral when {@code target} is
     * @param target a type for which {@link #isNumeric(Class)} holds
     * @return the converted value
     * @throws ArithmeticException      if {@code value} does not fit {@code target} exactly
     * @throws IllegalArgumentException if {@code target} is not numeric
     */
    public static Number convert(BigDecimal value, Class<?> target) {
        Class<?> type = wrap(target);
        if (type == Integer.class) return value.intValueExact();
        if (type == Long.class) return value.longValueExact();
        if (type == Short.class) return value.shortValueExact();
        if (type == Byte.class) return value.byteValueExact();
        if (type == BigInteger.class) return value.toBigIntegerExact();
        if (type == Double.class) return value.doubleValue();
        if (type == Float.class) return value.floatValue();
        if (type == BigDecimal.class) return value;

        throw new IllegalArgumentException("Unsupported numeric type: " + target);
    }
}
