package com.albatross.domain.error;

/**
 * Expected rejections of the User aggregate.
 */
public sealed interface UserError {

    record AlreadyExists(String userId) implements UserError {
        @Override
        public String message() {
            return "User already exists: " + userId;
        }

        @Override
        public String code() {
            return "USER_ALREADY_EXISTS";
        }

        @Override
        public CoreError toCoreError() {
            return new CoreError.AlreadyExists(message());
        }
    }

    record NotFound(String userId) implements UserError {
        @Override
        public String message() {
            return "User not found: " + userId;
        }

        @Override
        public String code() {
            return "USER_NOT_FOUND";
        }

        @Override
        public CoreError toCoreError() {
            return new CoreError.NotFound(message());
        }
    }

    record InvalidInput(String reason) implements UserError {
        @Override
        public String message() {
            return reason;
        }

        @Override
        public String code() {
            return "USER_INVALID_INPUT";
        }

        @Override
        public CoreError toCoreError() {
            return new CoreError.Validation(message());
        }
    }

    record TenantIdRequired() implements UserError {
        public static final TenantIdRequired INSTANCE = new TenantIdRequired();

        @Override
        public String message() {
            return "Tenant ID is required for non-PlatformAdmin roles";
        }

        @Override
        public String code() {
            return "TENANT_ID_REQUIRED";
        }

        @Override
        public CoreError toCoreError() {
            return new CoreError.Validation(message());
        }
    }

    record ApiKeyNotFound(String keyId) implements UserError {
        @Override
        public String message() {
            return "API key not found: " + keyId;
        }

        @Override
        public String code() {
            return "API_KEY_NOT_FOUND";
        }

        @Override
        public CoreError toCoreError() {
            return new CoreError.NotFound(message());
        }
    }

    String message();

    String code();

    CoreError toCoreError();
}
