package com.example.alertengine.suppression.condition;

import com.example.alertengine.suppression.AlertFacts;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Predicate over an alert's attributes, stored on suppression rules as JSON, e.g.
 * <pre>
 * {"type":"and","conditions":[
 *     {"type":"equals","field":"metric_name","value":"cpu_high"},
 *     {"type":"in_set","field":"severity","values":["high","critical"]}]}
 * </pre>
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = Condition.Equals.class, name = "equals"),
        @JsonSubTypes.Type(value = Condition.InSet.class, name = "in_set"),
        @JsonSubTypes.Type(value = Condition.And.class, name = "and"),
        @JsonSubTypes.Type(value = Condition.Or.class, name = "or"),
        @JsonSubTypes.Type(value = Condition.Not.class, name = "not")
})
public interface Condition {

    boolean test(AlertFacts facts);

    /** Attribute names referenced anywhere in this predicate. */
    Set<String> fields();

    /** Matches every alert; the meaning of an empty condition set. */
    Condition ALWAYS = new And(List.of());

    record Equals(String field, String value) implements Condition {
        @Override
        public boolean test(AlertFacts facts) {
            return valueMatches(field, facts.field(field), value);
        }

        @Override
        public Set<String> fields() {
            return Set.of(field);
        }
    }

    record InSet(String field, List<String> values) implements Condition {
        public InSet {
            values = values == null ? List.of() : List.copyOf(values);
        }

        @Override
        public boolean test(AlertFacts facts) {
            String actual = facts.field(field);
            return values.stream().anyMatch(v -> valueMatches(field, actual, v));
        }

        @Override
        public Set<String> fields() {
            return Set.of(field);
        }
    }

    record And(List<Condition> conditions) implements Condition {
        public And {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }

        @Override
        public boolean test(AlertFacts facts) {
            return conditions.stream().allMatch(c -> c.test(facts));
        }

        @Override
        public Set<String> fields() {
            return collect(conditions);
        }
    }

    record Or(List<Condition> conditions) implements Condition {
        public Or {
            conditions = conditions == null ? List.of() : List.copyOf(conditions);
        }

        @Override
        public boolean test(AlertFacts facts) {
            return conditions.stream().anyMatch(c -> c.test(facts));
        }

        @Override
        public Set<String> fields() {
            return collect(conditions);
        }
    }

    record Not(Condition condition) implements Condition {
        @Override
        public boolean test(AlertFacts facts) {
            return !condition.test(facts);
        }

        @Override
        public Set<String> fields() {
            return condition.fields();
        }
    }

    private static boolean valueMatches(String field, String actual, String expected) {
        if (actual == null || expected == null) return false;
        return "severity".equals(field) ? actual.equalsIgnoreCase(expected) : actual.equals(expected);
    }

    private static Set<String> collect(List<Condition> conditions) {
        Set<String> fields = new HashSet<>();
        conditions.forEach(c -> fields.addAll(c.fields()));
        return fields;
    }
}
