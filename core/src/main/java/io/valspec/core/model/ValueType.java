package io.valspec.core.model;

/**
 * Value types understood by the validation engine. Documentation-only distinctions collapse here:
 * {@code uuid} and {@code enum} both validate as {@link #STRING}.
 */
public enum ValueType {
    STRING,
    INTEGER,
    NUMBER,
    BOOLEAN,
    DECIMAL,
    DATE,
    DATETIME,
    OBJECT,
    ARRAY
}
