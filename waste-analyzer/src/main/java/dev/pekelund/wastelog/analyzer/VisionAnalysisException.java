package dev.pekelund.wastelog.analyzer;

/**
 * Raised when the vision collaborator cannot produce an analysis.
 */
public class VisionAnalysisException extends RuntimeException {

    private final VisionFailure failure;

    public VisionAnalysisException(VisionFailure failure) {
        this(failure, failure.defaultMessage(), null);
    }

    public VisionAnalysisException(VisionFailure failure, Throwable cause) {
        this(failure, failure.defaultMessage(), cause);
    }

    public VisionAnalysisException(VisionFailure failure, String message, Throwable cause) {
        super(message, cause);
        this.failure = failure;
    }

    public VisionFailure getFailure() {
        return failure;
    }
}
