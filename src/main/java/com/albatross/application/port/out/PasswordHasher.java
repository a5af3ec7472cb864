package com.albatross.application.port.out;

public interface PasswordHasher {

    String hash(String rawPassword);

    boolean verify(String rawPassword, String encodedHash);
}
