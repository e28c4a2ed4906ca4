package com.anthem.apigw.debug.model;

/**
 * Outcome of one caller identity lookup: {@link Resolved} or {@link Failed}.
 */
public abstract class IdentityResult {

    private IdentityResult() {
    }

    public static IdentityResult resolved(CallerIdentity identity) {
        return new Resolved(identity);
    }

    public static IdentityResult failed(Throwable cause) {
        return new Failed(normalize(cause), cause);
    }

    /**
     * Message of the failure when it carries one, otherwise its string form.
     */
    public static String normalize(Throwable cause) {
        String message = cause.getMessage();
        if (message != null && !message.isBlank()) {
            return message;
        }
        return String.valueOf(cause);
    }

    public abstract boolean isResolved();

    public static final class Resolved extends IdentityResult {

        private final CallerIdentity identity;

        private Resolved(CallerIdentity identity) {
            this.identity = identity;
        }

        public CallerIdentity getIdentity() {
            return identity;
        }

        @Override
        public boolean isResolved() {
            return true;
        }

        @Override
        public String toString() {
            return "Resolved{" + identity + "}";
        }
    }

    public static final class Failed extends IdentityResult {

        private final String errorMessage;
        private final Throwable cause;

        private Failed(String errorMessage, Throwable cause) {
            this.errorMessage = errorMessage;
            this.cause = cause;
        }

        public String getErrorMessage() {
            return errorMessage;
        }

        public Throwable getCause() {
            return cause;
        }

        @Override
        public boolean isResolved() {
            return false;
        }

        @Override
        public String toString() {
            return "Failed{" + errorMessage + "}";
        }
    }
}
