package com.narrative.sge.util;

import java.util.regex.Pattern;

/**
 * Conversions between the four variable payload types.
 *
 * Every method either returns a converted value or throws
 * {@link IllegalArgumentException} (which includes
 * {@link NumberFormatException}). Callers on the runtime path catch the
 * exception and fall back to a default; authoring-time callers let it
 * propagate.
 */
public final class Coercions {
    private static final Pattern INTEGER = Pattern.compile("[-+]?\\d+");
    private static final Pattern DECIMAL = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    private Coercions() {
        // Utility class
    }

    public static double toDouble(Object value) {
        if (value instanceof Number n)
            return n.doubleValue();
        if (value instanceof Boolean b)
            return b ? 1.0 : 0.0;
        if (value instanceof String s) {
            String t = s.trim();
            if (!DECIMAL.matcher(t).matches())
                throw new NumberFormatException("Not a number: '" + s + "'");
            return Double.parseDouble(t);
        }
        throw new IllegalArgumentException("Cannot convert " + describe(value) + " to a number");
    }

    public static float toFloat(Object value) {
        return (float) toDouble(value);
    }

    /** Integral conversion; fractional values are rounded half up. */
    public static int toInt(Object value) {
        if (value instanceof Integer || value instanceof Short || value instanceof Byte)
            return ((Number) value).intValue();
        if (value instanceof Long l)
            return Math.toIntExact(l);
        if (value instanceof String s && INTEGER.matcher(s.trim()).matches())
            return Integer.parseInt(s.trim());
        return (int) Math.round(toDouble(value));
    }

    /**
     * Boolean conversion: booleans as-is, numbers are true when non-zero,
     * strings must read "true" or "false" ignoring case.
     */
    public static boolean toBool(Object value) {
        if (value instanceof Boolean b)
            return b;
        if (value instanceof Number n)
            return n.doubleValue() != 0.0;
        if (value instanceof String s) {
            String t = s.trim();
            if ("true".equalsIgnoreCase(t))
                return true;
            if ("false".equalsIgnoreCase(t))
                return false;
            throw new IllegalArgumentException("Not a boolean: '" + s + "'");
        }
        throw new IllegalArgumentException("Cannot convert " + describe(value) + " to a boolean");
    }

    public static String toText(Object value) {
        if (value == null)
            throw new IllegalArgumentException("Cannot convert null to a string");
        return value.toString();
    }

    /**
     * Converts {@code value} to {@code type}. Supports the boxed primitive
     * types used by variables plus any type {@code value} is already an
     * instance of.
     */
    @SuppressWarnings("unchecked")
    public static <T> T coerce(Object value, Class<T> type) {
        if (value == null)
            throw new IllegalArgumentException("Cannot convert null to " + type.getSimpleName());
        if (type == Integer.class || type == int.class)
            return (T) Integer.valueOf(toInt(value));
        if (type == Float.class || type == float.class)
            return (T) Float.valueOf(toFloat(value));
        if (type == Double.class || type == double.class)
            return (T) Double.valueOf(toDouble(value));
        if (type == Long.class || type == long.class)
            return (T) Long.valueOf(Math.round(toDouble(value)));
        if (type == Boolean.class || type == boolean.class)
            return (T) Boolean.valueOf(toBool(value));
        if (type == String.class)
            return (T) toText(value);
        if (type.isInstance(value))
            return type.cast(value);
        throw new IllegalArgumentException("Cannot convert " + describe(value) + " to " + type.getSimpleName());
    }

    /**
     * Interprets an authored literal: "true"/"false" become booleans, integral
     * text an Integer, decimal text a Float, anything else stays a String.
     * Null and empty input are returned unchanged.
     */
    public static Object parseLiteral(String text) {
        if (text == null || text.isEmpty())
            return text;
        String t = text.trim();
        if ("true".equalsIgnoreCase(t))
            return Boolean.TRUE;
        if ("false".equalsIgnoreCase(t))
            return Boolean.FALSE;
        if (INTEGER.matcher(t).matches()) {
            try {
                return Integer.valueOf(t);
            } catch (NumberFormatException overflow) {
                return Float.valueOf(t);
            }
        }
        if (DECIMAL.matcher(t).matches())
            return Float.valueOf(t);
        return text;
    }

    private static String describe(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName() + " '" + value + "'";
    }
}
