package com.orgsuite.docflow.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum SignatureType {

    AUTHOR("author"),
    VERIFIER("verifier"),
    VALIDATOR("validator");

    private final String value;

    SignatureType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
