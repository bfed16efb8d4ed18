package com.orgsuite.docflow.model.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Document access levels, declared in ascending order: {@code READ < WRITE < SIGN < ADMIN}.
 */
public enum PermissionLevel {

    READ("read"),
    WRITE("write"),
    SIGN("sign"),
    ADMIN("admin");

    private final String value;

    PermissionLevel(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean atLeast(PermissionLevel required) {
        return compareTo(required) >= 0;
    }

    public static PermissionLevel max(PermissionLevel a, PermissionLevel b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a.compareTo(b) >= 0 ? a : b;
    }

    @JsonCreator
    public static PermissionLevel fromValue(String value) {
        return Arrays.stream(values())
                .filter(l -> l.value.equalsIgnoreCase(value) || l.name().equalsIgnoreCase(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown permission level: " + value));
    }
}
