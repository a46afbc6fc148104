package com.alertbridge.orchestrator.ticket;

/**
 * Thrown when the issue tracker rejects or cannot serve a request.
 *
 * The {@link Kind} is the only thing the retry logic looks at.
 */
public class TicketSystemException extends RuntimeException {

    public enum Kind { TRANSIENT, PERMANENT }

    private final Kind kind;
    private final int  statusCode;

    public TicketSystemException(Kind kind, String message) {
        this(kind, 0, message, null);
    }

    public TicketSystemException(Kind kind, String message, Throwable cause) {
        this(kind, 0, message, cause);
    }

    public TicketSystemException(Kind kind, int statusCode, String message, Throwable cause) {
        super("[" + kind + "] " + message, cause);
        this.kind       = kind;
        this.statusCode = statusCode;
    }

    public Kind getKind()       { return kind; }
    public boolean isTransient() { return kind == Kind.TRANSIENT; }

    /** HTTP status that caused the failure, or 0 when there was no response. */
    public int getStatusCode()  { return statusCode; }
}
