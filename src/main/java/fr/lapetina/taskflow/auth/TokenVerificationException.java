package fr.lapetina.taskflow.auth;

/**
 * Raised by the external token verifier when a bearer token cannot be accepted.
 */
public final class TokenVerificationException extends RuntimeException {

    private final Reason reason;

    public TokenVerificationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    public enum Reason {
        MALFORMED,
        EXPIRED,
        NOT_YET_VALID
    }
}
