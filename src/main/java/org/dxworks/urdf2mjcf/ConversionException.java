package org.dxworks.urdf2mjcf;

/**
 * Fatal failure of a conversion run: unreadable or malformed input, or an
 * output file that cannot be written.
 */
public class ConversionException extends Exception {

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
