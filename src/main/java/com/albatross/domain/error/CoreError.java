package com.albatross.domain.error;

/**
 * Error taxonomy shared by every command, store and projection path.
 * Aggregate-specific errors convert into one of these at the orchestration boundary.
 */
public sealed interface CoreError {

    record Validation(String detail) implements CoreError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public String code() {
            return "VALIDATION_ERROR";
        }
    }

    record NotFound(String detail) implements CoreError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public String code() {
            return "NOT_FOUND";
        }
    }

    record AlreadyExists(String detail) implements CoreError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public String code() {
            return "ALREADY_EXISTS";
        }
    }

    /**
     * The stream moved past the version the caller decided on.
     */
    record Concurrency(long expected, long actual) implements CoreError {
        @Override
        public String message() {
            return "Concurrency conflict: expected version " + expected + ", actual " + actual;
        }

        @Override
        public String code() {
            return "CONCURRENCY_CONFLICT";
        }
    }

    record Serialization(String detail) implements CoreError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public String code() {
            return "SERIALIZATION_ERROR";
        }
    }

    record Deserialization(String detail) implements CoreError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public String code() {
            return "DESERIALIZATION_ERROR";
        }
    }

    /**
     * Wrapped transport or database failure.
     */
    record Infrastructure(String detail) implements CoreError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public String code() {
            return "INFRASTRUCTURE_ERROR";
        }
    }

    record Unauthorized(String detail) implements CoreError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public String code() {
            return "UNAUTHORIZED";
        }
    }

    record Forbidden(String detail) implements CoreError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public String code() {
            return "FORBIDDEN";
        }
    }

    record Internal(String detail) implements CoreError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public String code() {
            return "INTERNAL_ERROR";
        }
    }

    record Configuration(String detail) implements CoreError {
        @Override
        public String message() {
            return detail;
        }

        @Override
        public String code() {
            return "CONFIGURATION_ERROR";
        }
    }

    String message();

    String code();
}
