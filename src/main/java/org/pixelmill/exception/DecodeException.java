package org.pixelmill.exception;

/**
 * Input bytes are not a decodable image.
 */
public class DecodeException extends Exception {

    public DecodeException(final String message) {
        super(message);
    }

    public DecodeException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
