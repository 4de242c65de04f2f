package com.bbthechange.mealvoting.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * Identifier of a chain, the isolated single-writer instance that owns one poll.
 * Rendered as 64 lowercase hex characters.
 */
public record ChainId(String value) {

    private static final Pattern CHAIN_ID_PATTERN = Pattern.compile("[0-9a-f]{64}");
    private static final SecureRandom RANDOM = new SecureRandom();

    public ChainId {
        if (value == null || !CHAIN_ID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException("Invalid chain ID format: " + value);
        }
    }

    /**
     * Generate a fresh random chain id.
     */
    public static ChainId generate() {
        byte[] bytes = new byte[32];
        RANDOM.nextBytes(bytes);
        return new ChainId(HexFormat.of().formatHex(bytes));
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static ChainId of(String value) {
        return new ChainId(value);
    }

    public static boolean isValid(String value) {
        return value != null && CHAIN_ID_PATTERN.matcher(value).matches();
    }

    @JsonValue
    @Override
    public String value() {
        return value;
    }

    @Override
    public String toString() {
        return value;
    }
}
