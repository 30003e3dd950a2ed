package io.github.drompincen.screencontrol.protocol.api;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

public record ParameterSpec(
        String type,
        String description,
        List<String> enumValues
) {
    public ParameterSpec {
        enumValues = enumValues == null ? List.of() : List.copyOf(enumValues);
    }

    public static ParameterSpec of(String type, String description) {
        return new ParameterSpec(type, description, List.of());
    }

    public static ParameterSpec string(String description) { return of("string", description); }

    public static ParameterSpec number(String description) { return of("number", description); }

    public static ParameterSpec bool(String description) { return of("boolean", description); }

    public static ParameterSpec oneOf(String description, String... values) {
        return new ParameterSpec("string", description, List.of(values));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("type", type);
        if (description != null) {
            node.put("description", description);
        }
        if (!enumValues.isEmpty()) {
            var values = node.putArray("enum");
            enumValues.forEach(values::add);
        }
        return node;
    }
}
