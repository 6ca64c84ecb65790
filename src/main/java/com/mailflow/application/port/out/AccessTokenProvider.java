package com.mailflow.application.port.out;

/**
 * Supplies a currently valid bearer token. Acquiring and refreshing it happens elsewhere.
 */
@FunctionalInterface
public interface AccessTokenProvider {

    String accessToken();
}
