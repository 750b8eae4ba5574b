package com.sentient.exception;

/**
 * A single stream record could not be decoded into a reflection.
 * Terminal for that record only; the rest of the batch continues.
 */
public class InvalidStreamRecordException extends RuntimeException {

    public InvalidStreamRecordException(String message) {
        super(message);
    }

    public InvalidStreamRecordException(String message, Throwable cause) {
        super(message, cause);
    }
}
