package com.sentient.exception;

/**
 * Exception thrown when a pipeline stage cannot complete its work.
 *
 * Used by the artifact worker and its collaborators for failures that should
 * leave the job on the queue for redelivery (blob upload errors, broker
 * connectivity problems, store update failures). The stage and error code
 * travel with the exception so log lines and problem responses can be
 * categorised without parsing messages.
 *
 * GlobalExceptionHandler maps this to HTTP 500 Internal Server Error
 * (or 503 Service Unavailable for queue issues) with RFC 7807 format.
 *
 * @see com.sentient.worker.ArtifactWorker
 * @see com.sentient.exception.GlobalExceptionHandler
 */
public class ProcessingException extends RuntimeException {

    private final String processingStage;
    private final String errorCode;

    /**
     * @param processingStage the stage where processing failed (e.g., "upload", "queue")
     * @param errorCode the error code for categorization (e.g., "UPLOAD_FAILED")
     * @param message the detail message
     * @param cause the cause of the exception, may be null
     */
    public ProcessingException(String processingStage, String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.processingStage = processingStage;
        this.errorCode = errorCode;
    }

    public String getProcessingStage() {
        return processingStage;
    }

    public String getErrorCode() {
        return errorCode;
    }

    /**
     * Blob storage rejected or failed to store an artifact.
     *
     * @param key the object key that was being written
     * @param cause the underlying failure
     * @return a ProcessingException with a formatted message
     */
    public static ProcessingException uploadFailed(String key, Throwable cause) {
        return new ProcessingException(
                "upload",
                "UPLOAD_FAILED",
                String.format("Failed to store artifact '%s'.", key),
                cause
        );
    }

    /**
     * The job queue could not be reached or refused an operation.
     *
     * @param cause the underlying transport failure
     * @return a ProcessingException with a formatted message
     */
    public static ProcessingException queueUnavailable(Throwable cause) {
        return new ProcessingException(
                "queue",
                "QUEUE_UNAVAILABLE",
                "Artifact job queue is unavailable. The broker may be restarting or unreachable.",
                cause
        );
    }

    /**
     * The plan store could not apply the artifact back-fill.
     *
     * @param recordId the record being updated
     * @param cause the underlying failure
     * @return a ProcessingException with a formatted message
     */
    public static ProcessingException storeUpdateFailed(String recordId, Throwable cause) {
        return new ProcessingException(
                "store",
                "STORE_UPDATE_FAILED",
                String.format("Failed to back-fill artifact for record '%s'.", recordId),
                cause
        );
    }
}
