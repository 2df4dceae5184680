package com.fixforge.core.platform;

/**
 * A hosting-platform call failed, or a platform operation was requested
 * without credentials.
 */
public class PlatformException extends RuntimeException {

    public PlatformException(String message) {
        super(message);
    }

    public PlatformException(String message, Throwable cause) {
        super(message, cause);
    }
}
