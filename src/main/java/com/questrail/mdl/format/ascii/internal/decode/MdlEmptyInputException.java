package com.questrail.mdl.format.ascii.internal.decode;

/**
 * Raised when the input holds no content lines once blank lines and
 * comments are removed.
 */
public final class MdlEmptyInputException extends MdlDecodeException
{
    public MdlEmptyInputException(String message) {
        super(message);
    }
}
