package com.pivotdeck.types;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.pivotdeck.exception.ConfigurationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses schema strings into {@link Schema} objects.
 *
 * <p>Supports two formats:
 * <ul>
 *   <li>DDL format: {@code age:numeric, country:string, signup_date:date}</li>
 *   <li>JSON format: {@code {"fields":[{"name":"age","type":"numeric","nullable":true},...]}}</li>
 * </ul>
 *
 * <p>Type names are case-insensitive and accept common aliases: {@code int},
 * {@code integer}, {@code long}, {@code double} and {@code decimal} all mean numeric;
 * {@code text}, {@code varchar} and {@code categorical} mean string; {@code bool}
 * means boolean; {@code timestamp} is stored as a date.
 */
public class SchemaParser {

    private static final ObjectMapper objectMapper = new ObjectMapper();

    /**
     * Parses a schema string.
     *
     * @param schemaStr the schema string in DDL or JSON format
     * @return the parsed schema
     * @throws ConfigurationException if the schema string is invalid
     */
    public static Schema parse(String schemaStr) {
        if (schemaStr == null || schemaStr.isBlank()) {
            throw new ConfigurationException("Schema string cannot be null or empty", null);
        }

        String trimmed = schemaStr.trim();
        if (trimmed.startsWith("{")) {
            return parseJsonSchema(trimmed);
        }
        return parseFieldList(trimmed);
    }

    /**
     * Parses a type name into a DataType.
     *
     * @param typeStr the type name
     * @return the data type
     * @throws ConfigurationException if the name is not a known type
     */
    public static DataType parseType(String typeStr) {
        String normalized = typeStr.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "numeric":
            case "number":
            case "int":
            case "integer":
            case "long":
            case "bigint":
            case "float":
            case "double":
            case "decimal":
                return NumericType.get();

            case "string":
            case "text":
            case "varchar":
            case "categorical":
                return StringType.get();

            case "date":
            case "timestamp":
                return DateType.get();

            case "boolean":
            case "bool":
                return BooleanType.get();

            default:
                throw new ConfigurationException("Unsupported type: " + typeStr, typeStr);
        }
    }

    private static Schema parseJsonSchema(String jsonStr) {
        JsonNode root;
        try {
            root = objectMapper.readTree(jsonStr);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Failed to parse JSON schema: " + e.getOriginalMessage(), null, e);
        }

        JsonNode fieldsNode = root.get("fields");
        if (fieldsNode == null || !fieldsNode.isArray()) {
            throw new ConfigurationException("JSON schema must contain a 'fields' array", null);
        }

        List<SchemaField> fields = new ArrayList<>();
        for (JsonNode fieldNode : fieldsNode) {
            JsonNode nameNode = fieldNode.get("name");
            JsonNode typeNode = fieldNode.get("type");
            if (nameNode == null || typeNode == null || !typeNode.isTextual()) {
                throw new ConfigurationException("Each field needs a 'name' and a textual 'type': " + fieldNode, null);
            }
            boolean nullable = !fieldNode.has("nullable") || fieldNode.get("nullable").asBoolean();
            fields.add(new SchemaField(nameNode.asText(), parseType(typeNode.asText()), nullable));
        }
        return new Schema(fields);
    }

    private static Schema parseFieldList(String fieldsStr) {
        List<SchemaField> fields = new ArrayList<>();
        for (String fieldDef : fieldsStr.split(",")) {
            String trimmed = fieldDef.trim();
            if (!trimmed.isEmpty()) {
                fields.add(parseField(trimmed));
            }
        }
        return new Schema(fields);
    }

    /**
     * Parses a single field definition such as {@code age:numeric} or
     * {@code nps_score:numeric not null}.
     */
    private static SchemaField parseField(String fieldDef) {
        int colonIndex = fieldDef.indexOf(':');
        if (colonIndex <= 0) {
            throw new ConfigurationException("Invalid field definition: " + fieldDef, fieldDef);
        }

        String name = fieldDef.substring(0, colonIndex).trim();
        String typeStr = fieldDef.substring(colonIndex + 1).trim();

        boolean nullable = true;
        String lower = typeStr.toLowerCase(Locale.ROOT);
        if (lower.endsWith(" not null")) {
            nullable = false;
            typeStr = typeStr.substring(0, typeStr.length() - " not null".length()).trim();
        }

        return new SchemaField(name, parseType(typeStr), nullable);
    }
}
