package com.example.alertengine.suppression.condition;

import com.example.alertengine.exception.ConfigurationException;
import com.example.alertengine.suppression.AlertFacts;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes suppression-rule condition documents.
 * <p>
 * Besides the tagged form (see {@link Condition}) the flat form written by older rule
 * editors is accepted: {@code {"metric_name":"cpu_high","severity":["high","critical"]}},
 * where every key must hold (scalar = equality, array = membership).
 */
@Component
@RequiredArgsConstructor
public class ConditionCodec {

    private final ObjectMapper objectMapper;

    public Condition parse(String json) {
        if (json == null || json.isBlank()) return Condition.ALWAYS;
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Malformed condition document: " + e.getOriginalMessage(), e);
        }
        if (root == null || root.isNull()) return Condition.ALWAYS;
        if (!root.isObject()) {
            throw new ConfigurationException("Condition document must be a JSON object");
        }

        Condition condition = root.has("type") ? readTagged(root) : readFlat(root);
        for (String field : condition.fields()) {
            if (!AlertFacts.isKnownField(field)) {
                throw new ConfigurationException("Unknown condition field: " + field);
            }
        }
        return condition;
    }

    public String write(Condition condition) {
        try {
            return objectMapper.writeValueAsString(condition);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Cannot serialize condition: " + e.getOriginalMessage(), e);
        }
    }

    private Condition readTagged(JsonNode root) {
        try {
            Condition condition = objectMapper.treeToValue(root, Condition.class);
            requireComplete(condition);
            return condition;
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ConfigurationException("Malformed condition document: " + e.getMessage(), e);
        }
    }

    private Condition readFlat(JsonNode root) {
        List<Condition> clauses = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value.isArray()) {
                List<String> values = new ArrayList<>();
                for (JsonNode element : (ArrayNode) value) {
                    if (!element.isValueNode()) {
                        throw new ConfigurationException("Condition '" + field.getKey() + "' must list scalar values");
                    }
                    values.add(element.asText());
                }
                clauses.add(new Condition.InSet(field.getKey(), values));
            } else if (value.isValueNode() && !value.isNull()) {
                clauses.add(new Condition.Equals(field.getKey(), value.asText()));
            } else {
                throw new ConfigurationException("Condition '" + field.getKey() + "' has an unsupported value");
            }
        }
        return clauses.size() == 1 ? clauses.get(0) : new Condition.And(clauses);
    }

    private void requireComplete(Condition condition) {
        if (condition instanceof Condition.Equals eq) {
            if (eq.field() == null || eq.value() == null) {
                throw new ConfigurationException("'equals' needs both field and value");
            }
        } else if (condition instanceof Condition.InSet in) {
            if (in.field() == null) throw new ConfigurationException("'in_set' needs a field");
        } else if (condition instanceof Condition.And and) {
            and.conditions().forEach(this::requireComplete);
        } else if (condition instanceof Condition.Or or) {
            or.conditions().forEach(this::requireComplete);
        } else if (condition instanceof Condition.Not not) {
            if (not.condition() == null) throw new ConfigurationException("'not' needs a condition");
            requireComplete(not.condition());
        }
    }
}
