package com.albatross.domain.error;

public sealed interface TenantError {

    record AlreadyExists(String tenantId) implements TenantError {
        @Override
        public String message() {
            return "Tenant already exists: " + tenantId;
        }

        @Override
        public String code() {
            return "TENANT_ALREADY_EXISTS";
        }

        @Override
        public CoreError toCoreError() {
            return new CoreError.AlreadyExists(message());
        }
    }

    record InvalidInput(String reason) implements TenantError {
        @Override
        public String message() {
            return reason;
        }

        @Override
        public String code() {
            return "TENANT_INVALID_INPUT";
        }

        @Override
        public CoreError toCoreError() {
            return new CoreError.Validation(message());
        }
    }

    String message();

    String code();

    CoreError toCoreError();
}
