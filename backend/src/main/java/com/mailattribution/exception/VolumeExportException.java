package com.mailattribution.exception;

/** Exception thrown when the asynchronous contact-activity export cannot produce a result */
public class VolumeExportException extends RuntimeException {

    public VolumeExportException(String message) {
        super(message);
    }

    public VolumeExportException(String message, Throwable cause) {
        super(message, cause);
    }
}
