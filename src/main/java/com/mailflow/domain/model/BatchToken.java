package com.mailflow.domain.model;

/**
 * Correlation id minted once per inbound notification. All records derived from
 * the same notification carry the same token.
 */
public record BatchToken(long value) {

    @Override
    public String toString() {
        return Long.toUnsignedString(value);
    }
}
