package com.codeprism.core;

/**
 * Base type for failures raised while analyzing a source unit.
 *
 * <p>Unchecked, like the rest of the engine's failures: callers that want to keep
 * going after one file fails catch it at the run boundary.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
