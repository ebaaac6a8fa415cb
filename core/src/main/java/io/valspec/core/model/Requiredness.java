package io.valspec.core.model;

/** How a field was declared; only {@link #REQUIRED} documents the field as required. */
public enum Requiredness {
    REQUIRED,
    OPTIONAL,
    /** Schema-only field, documented as not required. */
    PLAIN;

    public boolean isRequired() {
        return this == REQUIRED;
    }
}
