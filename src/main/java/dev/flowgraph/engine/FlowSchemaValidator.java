package dev.flowgraph.engine;

import com.fasterxml.jackson.core.JsonPointer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowgraph.model.Diagnostic;
import dev.flowgraph.model.DiagnosticCode;
import dev.flowgraph.model.JsonPointers;

import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Validates JSON trees against a JSON Schema (draft 2020-12 subset).
 *
 * <p>Supported keywords: {@code type}, {@code enum}, {@code const}, {@code minLength},
 * {@code maxLength}, {@code pattern}, {@code minimum}, {@code maximum}, {@code required},
 * {@code properties}, {@code patternProperties}, {@code additionalProperties},
 * {@code propertyNames}, {@code minProperties}, {@code maxProperties}, {@code items},
 * {@code minItems}, {@code maxItems}, {@code allOf}, {@code anyOf}, {@code oneOf}, {@code not}
 * and local {@code $ref}s ({@code #/...}). Unknown keywords are ignored.
 *
 * <p>Instances are immutable apart from a regex cache and may be shared between threads.
 */
public final class FlowSchemaValidator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final JsonNode root;
    private final Map<String, Pattern> patterns = new ConcurrentHashMap<>();

    private FlowSchemaValidator(JsonNode root) {
        this.root = root;
    }

    /**
     * Compile a schema from its JSON text.
     *
     * @throws IOException if the text is not JSON or not a schema object
     */
    public static FlowSchemaValidator compile(String schemaText) throws IOException {
        JsonNode schema = MAPPER.readTree(schemaText);
        if (schema == null || !(schema.isObject() || schema.isBoolean())) {
            throw new IOException("schema must be a JSON object");
        }
        return new FlowSchemaValidator(schema);
    }

    /**
     * Validate an instance. Returns every violation found, or an empty list.
     */
    public List<Diagnostic> validate(JsonNode instance) {
        var errors = new ArrayList<Diagnostic>();
        check(root, instance, "", errors);
        return errors;
    }

    private void check(JsonNode schema, JsonNode value, String pointer, List<Diagnostic> errors) {
        if (schema.isBoolean()) {
            if (!schema.asBoolean()) {
                errors.add(violation(pointer, "value is not allowed here"));
            }
            return;
        }

        JsonNode ref = schema.get("$ref");
        if (ref != null) {
            JsonNode target = resolveRef(ref.asText());
            if (target == null) {
                errors.add(violation(pointer, "unresolvable schema reference '%s'".formatted(ref.asText())));
                return;
            }
            check(target, value, pointer, errors);
        }

        JsonNode type = schema.get("type");
        if (type != null && !matchesType(type, value)) {
            errors.add(violation(pointer, "expected %s but found %s".formatted(describeType(type), kindOf(value))));
            return;
        }

        checkEnumAndConst(schema, value, pointer, errors);
        if (value.isTextual()) {
            checkString(schema, value.asText(), pointer, errors);
        } else if (value.isNumber()) {
            checkNumber(schema, value, pointer, errors);
        } else if (value.isObject()) {
            checkObject(schema, value, pointer, errors);
        } else if (value.isArray()) {
            checkArray(schema, value, pointer, errors);
        }
        checkCombinators(schema, value, pointer, errors);
    }

    private void checkEnumAndConst(JsonNode schema, JsonNode value, String pointer, List<Diagnostic> errors) {
        JsonNode allowed = schema.get("enum");
        if (allowed != null && allowed.isArray()) {
            boolean found = false;
            for (JsonNode candidate : allowed) {
                if (candidate.equals(value)) {
                    found = true;
                    break;
                }
            }
            if (!found) {
                errors.add(violation(pointer, "value %s is not one of %s".formatted(value, allowed)));
            }
        }
        JsonNode constant = schema.get("const");
        if (constant != null && !constant.equals(value)) {
            errors.add(violation(pointer, "value must be %s".formatted(constant)));
        }
    }

    private void checkString(JsonNode schema, String text, String pointer, List<Diagnostic> errors) {
        int length = text.codePointCount(0, text.length());
        if (schema.has("minLength") && length < schema.get("minLength").asInt()) {
            errors.add(violation(pointer, "string is shorter than %d".formatted(schema.get("minLength").asInt())));
        }
        if (schema.has("maxLength") && length > schema.get("maxLength").asInt()) {
            errors.add(violation(pointer, "string is longer than %d".formatted(schema.get("maxLength").asInt())));
        }
        JsonNode pattern = schema.get("pattern");
        if (pattern != null) {
            Pattern compiled = pattern(pattern.asText());
            if (compiled == null) {
                errors.add(violation(pointer, "schema pattern '%s' is not a valid regex".formatted(pattern.asText())));
            } else if (!compiled.matcher(text).find()) {
                errors.add(violation(pointer, "'%s' does not match pattern %s".formatted(text, pattern.asText())));
            }
        }
    }

    private void checkNumber(JsonNode schema, JsonNode value, String pointer, List<Diagnostic> errors) {
        if (schema.has("minimum") && value.decimalValue().compareTo(schema.get("minimum").decimalValue()) < 0) {
            errors.add(violation(pointer, "%s is less than minimum %s".formatted(value, schema.get("minimum"))));
        }
        if (schema.has("maximum") && value.decimalValue().compareTo(schema.get("maximum").decimalValue()) > 0) {
            errors.add(violation(pointer, "%s is greater than maximum %s".formatted(value, schema.get("maximum"))));
        }
    }

    private void checkObject(JsonNode schema, JsonNode value, String pointer, List<Diagnostic> errors) {
        JsonNode required = schema.get("required");
        if (required != null) {
            for (JsonNode name : required) {
                if (!value.has(name.asText())) {
                    errors.add(violation(pointer, "missing required property '%s'".formatted(name.asText())));
                }
            }
        }
        if (schema.has("minProperties") && value.size() < schema.get("minProperties").asInt()) {
            errors.add(violation(pointer, "object has fewer than %d properties".formatted(schema.get("minProperties").asInt())));
        }
        if (schema.has("maxProperties") && value.size() > schema.get("maxProperties").asInt()) {
            errors.add(violation(pointer, "object has more than %d properties".formatted(schema.get("maxProperties").asInt())));
        }

        JsonNode properties = schema.path("properties");
        JsonNode patternProperties = schema.path("patternProperties");
        JsonNode additional = schema.get("additionalProperties");
        JsonNode propertyNames = schema.get("propertyNames");

        for (var entry : value.properties()) {
            String key = entry.getKey();
            String childPointer = JsonPointers.append(pointer, key);

            if (propertyNames != null) {
                var nameErrors = new ArrayList<Diagnostic>();
                check(propertyNames, MAPPER.getNodeFactory().textNode(key), childPointer, nameErrors);
                if (!nameErrors.isEmpty()) {
                    errors.add(violation(childPointer, "property name '%s' is not allowed".formatted(key)));
                }
            }

            boolean matched = false;
            if (properties.has(key)) {
                matched = true;
                check(properties.get(key), entry.getValue(), childPointer, errors);
            }
            for (var patternEntry : patternProperties.properties()) {
                Pattern compiled = pattern(patternEntry.getKey());
                if (compiled != null && compiled.matcher(key).find()) {
                    matched = true;
                    check(patternEntry.getValue(), entry.getValue(), childPointer, errors);
                }
            }
            if (!matched && additional != null) {
                if (additional.isBoolean() && !additional.asBoolean()) {
                    errors.add(violation(childPointer, "additional property '%s' is not allowed".formatted(key)));
                } else if (additional.isObject()) {
                    check(additional, entry.getValue(), childPointer, errors);
                }
            }
        }
    }

    private void checkArray(JsonNode schema, JsonNode value, String pointer, List<Diagnostic> errors) {
        if (schema.has("minItems") && value.size() < schema.get("minItems").asInt()) {
            errors.add(violation(pointer, "array has fewer than %d items".formatted(schema.get("minItems").asInt())));
        }
        if (schema.has("maxItems") && value.size() > schema.get("maxItems").asInt()) {
            errors.add(violation(pointer, "array has more than %d items".formatted(schema.get("maxItems").asInt())));
        }
        JsonNode items = schema.get("items");
        if (items != null && (items.isObject() || items.isBoolean())) {
            for (int i = 0; i < value.size(); i++) {
                check(items, value.get(i), JsonPointers.append(pointer, i), errors);
            }
        }
    }

    private void checkCombinators(JsonNode schema, JsonNode value, String pointer, List<Diagnostic> errors) {
        JsonNode allOf = schema.get("allOf");
        if (allOf != null) {
            for (JsonNode sub : allOf) {
                check(sub, value, pointer, errors);
            }
        }

        JsonNode anyOf = schema.get("anyOf");
        if (anyOf != null && countMatches(anyOf, value, pointer) == 0) {
            errors.add(violation(pointer, "value does not match any of the allowed shapes"));
        }

        JsonNode oneOf = schema.get("oneOf");
        if (oneOf != null) {
            int matches = countMatches(oneOf, value, pointer);
            if (matches == 0) {
                errors.add(violation(pointer, "value does not match any of the allowed shapes"));
            } else if (matches > 1) {
                errors.add(violation(pointer, "value matches more than one exclusive shape"));
            }
        }

        JsonNode not = schema.get("not");
        if (not != null && countMatches(List.of(not), value, pointer) == 1) {
            errors.add(violation(pointer, "value matches a forbidden shape"));
        }
    }

    private int countMatches(Iterable<JsonNode> schemas, JsonNode value, String pointer) {
        int matches = 0;
        for (JsonNode sub : schemas) {
            var scratch = new ArrayList<Diagnostic>();
            check(sub, value, pointer, scratch);
            if (scratch.isEmpty()) {
                matches++;
            }
        }
        return matches;
    }

    private JsonNode resolveRef(String ref) {
        if (!ref.startsWith("#")) {
            return null;
        }
        String fragment = ref.substring(1);
        if (fragment.isEmpty()) {
            return root;
        }
        try {
            JsonNode target = root.at(JsonPointer.compile(fragment));
            return target.isMissingNode() ? null : target;
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    private Pattern pattern(String regex) {
        Pattern cached = patterns.get(regex);
        if (cached != null) {
            return cached;
        }
        try {
            Pattern compiled = Pattern.compile(regex);
            patterns.put(regex, compiled);
            return compiled;
        } catch (PatternSyntaxException e) {
            return null;
        }
    }

    private static boolean matchesType(JsonNode type, JsonNode value) {
        if (type.isArray()) {
            for (JsonNode t : type) {
                if (matchesSingleType(t.asText(), value)) {
                    return true;
                }
            }
            return false;
        }
        return matchesSingleType(type.asText(), value);
    }

    private static boolean matchesSingleType(String type, JsonNode value) {
        return switch (type) {
            case "object" -> value.isObject();
            case "array" -> value.isArray();
            case "string" -> value.isTextual();
            case "boolean" -> value.isBoolean();
            case "null" -> value.isNull();
            case "number" -> value.isNumber();
            case "integer" -> value.isIntegralNumber()
                || (value.isNumber() && value.decimalValue().stripTrailingZeros().scale() <= 0);
            default -> false;
        };
    }

    private static String describeType(JsonNode type) {
        if (!type.isArray()) {
            return type.asText();
        }
        Set<String> names = new LinkedHashSet<>();
        type.forEach(t -> names.add(t.asText()));
        return String.join(" or ", names);
    }

    private static String kindOf(JsonNode value) {
        if (value.isObject()) {
            return "object";
        } else if (value.isArray()) {
            return "array";
        } else if (value.isTextual()) {
            return "string";
        } else if (value.isBoolean()) {
            return "boolean";
        } else if (value.isNumber()) {
            return "number";
        } else if (value.isNull()) {
            return "null";
        }
        return value.getNodeType().name().toLowerCase();
    }

    private static Diagnostic violation(String pointer, String message) {
        return Diagnostic.of(DiagnosticCode.SCHEMA_VIOLATION, pointer, message);
    }
}
