package io.valspec.core.compile;

import io.valspec.core.model.FieldRule;
import io.valspec.core.model.SchemaNode;

/** One field compiled into both target representations. */
record MappedField(String name, SchemaNode documentation, FieldRule rule) {}
