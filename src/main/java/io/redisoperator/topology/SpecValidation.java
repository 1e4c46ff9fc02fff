package io.redisoperator.topology;

import io.fabric8.kubernetes.api.model.Quantity;
import io.redisoperator.exceptions.InvalidSpecException;
import io.redisoperator.models.specs.StorageSpec;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Spec checks shared by the topology handlers.
 */
public final class SpecValidation {

    private SpecValidation() {
        // Utility class
    }

    public static <S> S requireSpec(S spec) throws InvalidSpecException {
        if (spec == null) {
            throw new InvalidSpecException("spec must be set");
        }
        return spec;
    }

    public static void requireImage(String image) throws InvalidSpecException {
        if (image == null || image.isBlank()) {
            throw new InvalidSpecException("spec.image must be set");
        }
    }

    public static int nonNegative(String field, Integer value, int fallback) throws InvalidSpecException {
        if (value == null) {
            return fallback;
        }
        if (value < 0) {
            throw new InvalidSpecException(field + " must not be negative, got " + value);
        }
        return value;
    }

    public static int positive(String field, Integer value, int fallback) throws InvalidSpecException {
        if (value == null) {
            return fallback;
        }
        if (value < 1) {
            throw new InvalidSpecException(field + " must be at least 1, got " + value);
        }
        return value;
    }

    public static void validateStorage(String field, StorageSpec storage) throws InvalidSpecException {
        if (storage == null || storage.getSize() == null) {
            return;
        }
        BigDecimal bytes;
        try {
            bytes = Quantity.getAmountInBytes(new Quantity(storage.getSize()));
        } catch (IllegalArgumentException | ArithmeticException e) {
            throw new InvalidSpecException(field + ".size '" + storage.getSize() + "' is not a valid quantity", e);
        }
        if (bytes.signum() <= 0) {
            throw new InvalidSpecException(field + ".size must be positive, got '" + storage.getSize() + "'");
        }
    }

    /**
     * Directive names must be single tokens and values single lines, so user config cannot inject directives.
     */
    public static void validateDirectives(String field, Map<String, String> directives) throws InvalidSpecException {
        if (directives == null) {
            return;
        }
        for (Map.Entry<String, String> entry : directives.entrySet()) {
            String key = entry.getKey();
            if (key == null || key.isBlank() || !key.equals(key.trim()) || key.chars().anyMatch(Character::isWhitespace)) {
                throw new InvalidSpecException(field + " has an invalid directive name '" + key + "'");
            }
            String value = entry.getValue();
            if (value == null || value.indexOf('\n') >= 0 || value.indexOf('\r') >= 0) {
                throw new InvalidSpecException(field + "." + key + " must be a single-line value");
            }
        }
    }
}
