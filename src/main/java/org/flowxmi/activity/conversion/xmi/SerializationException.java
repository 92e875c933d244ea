package org.flowxmi.activity.conversion.xmi;

/**
 * The XML machinery failed and no document could be produced at all.
 * Problems with single elements are reported as diagnostics instead.
 */
public class SerializationException extends RuntimeException {
    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
