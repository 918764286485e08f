package com.questrail.mdl.format.ascii.internal.decode;

/**
 * A line whose tokens do not fit the grammar of its keyword: too few values,
 * an unparsable number, an orientation row without four values.
 *
 * <p>Low-level helpers raise it without a position; the line cursor attaches
 * the 1-based line number through {@link #atLine(int)}.</p>
 */
public final class MdlFormatException extends MdlDecodeException
{
    public static final int UNKNOWN_LINE = -1;

    private final int lineNumber;
    private final String detail;

    public MdlFormatException(String detail) {
        this(detail, UNKNOWN_LINE, null);
    }

    public MdlFormatException(String detail, int lineNumber) {
        this(detail, lineNumber, null);
    }

    public MdlFormatException(String detail, int lineNumber, Throwable cause) {
        super(lineNumber == UNKNOWN_LINE ? detail : "line " + lineNumber + ": " + detail, cause);
        this.detail = detail;
        this.lineNumber = lineNumber;
    }

    public int lineNumber() {
        return lineNumber;
    }

    public String detail() {
        return detail;
    }

    /**
     * Returns this exception if it already carries a position, otherwise a
     * copy positioned at {@code line}.
     */
    public MdlFormatException atLine(int line) {
        if (lineNumber != UNKNOWN_LINE) {
            return this;
        }
        return new MdlFormatException(detail, line, getCause());
    }
}
