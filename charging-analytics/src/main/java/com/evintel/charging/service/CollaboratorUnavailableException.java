package com.evintel.charging.service;

/**
 * A collector or storage call still failed after its retry budget was spent.
 */
public class CollaboratorUnavailableException extends RuntimeException {

    private final String collaborator;
    private final int attempts;

    public CollaboratorUnavailableException(String collaborator, int attempts, Throwable cause) {
        super(collaborator + " unavailable after " + attempts + " attempt(s): " + describe(cause), cause);
        this.collaborator = collaborator;
        this.attempts = attempts;
    }

    public String collaborator() {
        return collaborator;
    }

    public int attempts() {
        return attempts;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
