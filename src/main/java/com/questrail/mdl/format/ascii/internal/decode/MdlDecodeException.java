package com.questrail.mdl.format.ascii.internal.decode;

/**
 * Indicates that ASCII MDL text could not be turned into a model graph.
 *
 * This is the common base of:
 * <ul>
 *   <li>{@link MdlEmptyInputException}: nothing to read at all</li>
 *   <li>{@link MdlFormatException}: a malformed line</li>
 * </ul>
 */
public class MdlDecodeException extends RuntimeException
{
    public MdlDecodeException(String message) {
        super(message);
    }

    public MdlDecodeException(String message, Throwable cause) {
        super(message, cause);
    }
}
