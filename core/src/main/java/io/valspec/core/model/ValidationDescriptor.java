package io.valspec.core.model;

import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Ordered, immutable list of {@link FieldRule}s handed to the validation engine. Field names are
 * unique within one descriptor.
 */
public final class ValidationDescriptor implements Iterable<FieldRule> {

    private static final ValidationDescriptor EMPTY = new ValidationDescriptor(List.of());

    private final List<FieldRule> rules;

    public ValidationDescriptor(List<FieldRule> rules) {
        this.rules = List.copyOf(rules);
    }

    public static ValidationDescriptor empty() {
        return EMPTY;
    }

    public List<FieldRule> rules() {
        return rules;
    }

    /**
     * Looks up the rule for a field.
     *
     * @param name field name
     * @return the rule, or null if the field is not declared
     */
    public FieldRule rule(String name) {
        for (FieldRule rule : rules) {
            if (rule.name().equals(name)) {
                return rule;
            }
        }
        return null;
    }

    public List<String> fieldNames() {
        return rules.stream().map(FieldRule::name).collect(Collectors.toList());
    }

    public int size() {
        return rules.size();
    }

    @Override
    public Iterator<FieldRule> iterator() {
        return rules.iterator();
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ValidationDescriptor that && rules.equals(that.rules);
    }

    @Override
    public int hashCode() {
        return rules.hashCode();
    }

    @Override
    public String toString() {
        return "ValidationDescriptor" + rules;
    }
}
