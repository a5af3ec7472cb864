package com.albatross.application.port.out;

/**
 * Random API key secrets and the one-way digest that is stored in their place.
 */
public interface SecretGenerator {

    String newSecret();

    String digest(String secret);
}
