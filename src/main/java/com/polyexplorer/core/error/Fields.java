package com.polyexplorer.core.error;

import java.time.Duration;
import java.util.Objects;

final class Fields {
    private Fields() {
    }

    static String required(String value, String name) {
        return Objects.requireNonNull(value, name + " must not be null");
    }

    static Duration nonNegative(Duration value, String name) {
        Objects.requireNonNull(value, name + " must not be null");
        if (value.isNegative()) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }

    static int nonNegative(int value, String name) {
        if (value < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + value);
        }
        return value;
    }
}
