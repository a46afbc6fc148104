package com.alertbridge.orchestrator.extraction;

/**
 * Thrown when the extraction service cannot produce ticket fields.
 *
 * Unchecked so only the two callers with a recovery strategy catch it:
 * the extractor (fatal for the run) and the inference engine (keep the
 * partial ticket and move on).
 */
public class ExtractionException extends RuntimeException {

    public enum Kind { MALFORMED, TIMEOUT, UNAVAILABLE }

    private final Kind kind;

    public ExtractionException(Kind kind, String message) {
        super("[" + kind + "] " + message);
        this.kind = kind;
    }

    public ExtractionException(Kind kind, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind = kind;
    }

    public Kind getKind() { return kind; }
}
