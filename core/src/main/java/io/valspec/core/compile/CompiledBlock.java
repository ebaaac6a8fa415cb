package io.valspec.core.compile;

import io.valspec.core.model.SchemaNode;
import io.valspec.core.model.ValidationDescriptor;

/**
 * Result of compiling one declaration block, top-level or inline. The documentation side is always
 * an {@code object} node carrying {@code properties}, whatever the number of fields.
 */
record CompiledBlock(SchemaNode documentation, ValidationDescriptor validation) {}
