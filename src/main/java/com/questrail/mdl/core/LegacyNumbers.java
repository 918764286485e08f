package com.questrail.mdl.core;

import com.questrail.mdl.format.ascii.internal.decode.MdlFormatException;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * LegacyNumbers
 * -----------------------------------------------------------------------------
 * Number parsing and formatting as the legacy toolchain reads and writes it.
 *
 * <p>Exporters built on old C runtimes print special floating-point values as
 * {@code 1.#QNAN}, {@code -1.#IND}, {@code 1.#INF0} and similar. Those spellings
 * are accepted on input (any case, optional sign, optional trailing digits)
 * together with the plain {@code nan}/{@code inf}/{@code infinity} forms.</p>
 */
public final class LegacyNumbers
{
    private static final Pattern LEGACY_NAN = Pattern.compile("1\\.#(qnan|snan|ind)\\d*");
    private static final Pattern PLAIN_INT = Pattern.compile("[+-]?\\d+");
    private static final Pattern LEGACY_INF = Pattern.compile("1\\.#inf\\d*");

    public static final String NAN_TEXT = "1.#QNAN";
    public static final String INF_TEXT = "1.#INF";

    private static final MathContext SEVEN_DIGITS = new MathContext(7, RoundingMode.HALF_EVEN);

    private LegacyNumbers() {}

    /**
     * Parses a float token.
     *
     * @throws MdlFormatException if the token is neither a decimal number nor a
     *         recognized special-value spelling
     */
    public static float parseFloatLenient(String text)
    {
        final String t = text.trim();
        final Float special = parseSpecial(t);
        if (special != null) {
            return special;
        }
        if (t.isEmpty() || !startsLikeNumber(t)) {
            throw new MdlFormatException("not a number: '" + text + "'");
        }
        try {
            return Float.parseFloat(t);
        } catch (NumberFormatException ex) {
            throw new MdlFormatException("not a number: '" + text + "'", MdlFormatException.UNKNOWN_LINE, ex);
        }
    }

    /**
     * Parses an integer token. Integral floats such as {@code 3.0} are
     * accepted because some exporters print every number as a float.
     */
    public static int parseIntLenient(String text)
    {
        final String t = text.trim();
        if (PLAIN_INT.matcher(t).matches()) {
            try {
                return Integer.parseInt(t);
            } catch (NumberFormatException ex) {
                throw new MdlFormatException("integer out of range: '" + text + "'", MdlFormatException.UNKNOWN_LINE, ex);
            }
        }
        final float f = parseFloatLenient(t);
        if (Float.isFinite(f) && f == Math.rint(f)) {
            return (int) f;
        }
        throw new MdlFormatException("not an integer: '" + text + "'");
    }

    /** True if {@link #parseFloatLenient} would accept the token. */
    public static boolean isNumeric(String text)
    {
        try {
            parseFloatLenient(text);
            return true;
        } catch (MdlFormatException ex) {
            return false;
        }
    }

    /**
     * Shortest decimal that reads back as the same float, never in exponent
     * form. Integral values carry no fractional part.
     */
    public static String formatPlain(float value)
    {
        if (Float.isNaN(value)) {
            return NAN_TEXT;
        }
        if (Float.isInfinite(value)) {
            return value > 0 ? INF_TEXT : "-" + INF_TEXT;
        }
        if (value == 0f) {
            return "0";
        }
        return new BigDecimal(Float.toString(value)).stripTrailingZeros().toPlainString();
    }

    /**
     * C {@code "% .7g"}: seven significant digits, trailing zeros removed,
     * exponent form below 1e-4 or at 1e7 and above, and a leading space in
     * place of the sign for non-negative values.
     */
    public static String formatG7(double value)
    {
        if (Double.isNaN(value)) {
            return " " + NAN_TEXT;
        }
        if (Double.isInfinite(value)) {
            return value > 0 ? " " + INF_TEXT : "-" + INF_TEXT;
        }
        // sign bit, so that -0.0 keeps its minus like C does
        final String sign = Math.copySign(1.0, value) < 0 ? "-" : " ";
        if (value == 0.0) {
            return sign + "0";
        }

        final BigDecimal rounded = new BigDecimal(Math.abs(value)).round(SEVEN_DIGITS);
        final int exponent = rounded.precision() - rounded.scale() - 1;

        if (exponent < -4 || exponent >= 7) {
            final BigDecimal mantissa = rounded.movePointLeft(exponent).stripTrailingZeros();
            final String exp = String.format(Locale.ROOT, "%+03d", exponent);
            return sign + mantissa.toPlainString() + "e" + exp;
        }

        final BigDecimal fixed = rounded.setScale(Math.max(0, 6 - exponent), RoundingMode.HALF_EVEN)
            .stripTrailingZeros();
        return sign + fixed.toPlainString();
    }

    private static Float parseSpecial(String t)
    {
        if (t.isEmpty()) {
            return null;
        }
        String body = t.toLowerCase(Locale.ROOT);
        boolean negative = false;
        if (body.charAt(0) == '-' || body.charAt(0) == '+') {
            negative = body.charAt(0) == '-';
            body = body.substring(1);
        }
        if (body.equals("nan") || LEGACY_NAN.matcher(body).matches()) {
            return Float.NaN;
        }
        if (body.equals("inf") || body.equals("infinity") || LEGACY_INF.matcher(body).matches()) {
            return negative ? Float.NEGATIVE_INFINITY : Float.POSITIVE_INFINITY;
        }
        return null;
    }

    // Float.parseFloat also takes hex literals and "1f"/"1d" suffixes; the
    // format has neither.
    private static boolean startsLikeNumber(String t)
    {
        final char last = Character.toLowerCase(t.charAt(t.length() - 1));
        if (last == 'f' || last == 'd') {
            return false;
        }
        return !t.toLowerCase(Locale.ROOT).contains("x");
    }
}
