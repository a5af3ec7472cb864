package com.albatross.domain.error;

public sealed interface PirepError {

    record AlreadyExists(String pirepId) implements PirepError {
        @Override
        public String message() {
            return "PIREP already exists: " + pirepId;
        }

        @Override
        public String code() {
            return "PIREP_ALREADY_EXISTS";
        }

        @Override
        public CoreError toCoreError() {
            return new CoreError.AlreadyExists(message());
        }
    }

    record InvalidInput(String reason) implements PirepError {
        @Override
        public String message() {
            return reason;
        }

        @Override
        public String code() {
            return "PIREP_INVALID_INPUT";
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
