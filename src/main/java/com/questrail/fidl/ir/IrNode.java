package com.questrail.fidl.ir;

import com.fasterxml.jackson.databind.JsonNode;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * IrNode
 * -----------------------------------------------------------------------------
 * Read-only view over one object of a parsed IR document: a declaration, a
 * member, a type reference, a method payload.
 *
 * <h2>Normalization</h2>
 * Lookups of {@code identifier} and {@link #name()} are normalized through
 * {@link Identifiers#normalize(String)}, so result and response names come out
 * the same regardless of how many times they are read. The {@code raw*}
 * accessors return the spelling found in the document, which is what the
 * declaration tables and the codec are keyed by.
 *
 * <h2>Ownership</h2>
 * Every node remembers the path of the IR file it came from; it is carried
 * into diagnostics so that a malformed document can be located.
 */
public class IrNode
{
    private static final String IDENTIFIER = "identifier";

    private final Path source;
    private final JsonNode json;

    public IrNode(Path source, JsonNode json) {
        this.source = source;
        this.json = Objects.requireNonNull(json, "json");
    }

    public Path source() {
        return source;
    }

    public JsonNode json() {
        return json;
    }

    public boolean has(String key) {
        JsonNode value = json.get(key);
        return value != null && !value.isNull();
    }

    /**
     * @throws IrFormatException if the key is absent
     */
    public IrNode get(String key) {
        return new IrNode(source, required(key));
    }

    public Optional<IrNode> find(String key) {
        return has(key) ? Optional.of(new IrNode(source, json.get(key))) : Optional.empty();
    }

    /**
     * Returns the elements of an array-valued key; an absent key yields an
     * empty list.
     */
    public List<IrNode> list(String key) {
        JsonNode value = json.get(key);
        if (value == null || value.isNull()) {
            return Collections.emptyList();
        }
        if (!value.isArray()) {
            throw new IrFormatException("Expected an array under '" + key + "' in " + source);
        }
        List<IrNode> nodes = new ArrayList<>(value.size());
        value.forEach(element -> nodes.add(new IrNode(source, element)));
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Required text value. The {@code identifier} key is returned normalized.
     */
    public String string(String key) {
        String text = required(key).asText();
        return IDENTIFIER.equals(key) ? Identifiers.normalize(text) : text;
    }

    public Optional<String> optionalString(String key) {
        return has(key) ? Optional.of(string(key)) : Optional.empty();
    }

    /**
     * Boolean flag; an absent key reads as {@code false}.
     */
    public boolean flag(String key) {
        JsonNode value = json.get(key);
        return value != null && value.asBoolean(false);
    }

    public long longValue(String key) {
        JsonNode value = required(key);
        if (value.isTextual()) {
            return Long.parseUnsignedLong(value.asText());
        }
        return value.asLong();
    }

    public String name() {
        return Identifiers.normalize(rawName());
    }

    public String rawName() {
        return required("name").asText();
    }

    public String identifier() {
        return string(IDENTIFIER);
    }

    public String rawIdentifier() {
        return required(IDENTIFIER).asText();
    }

    /**
     * Documentation from the {@code doc} attribute, trimmed.
     */
    public Optional<String> documentation() {
        for (IrNode attribute : list("maybe_attributes")) {
            if (!"doc".equals(attribute.optionalString("name").orElse(null))) {
                continue;
            }
            List<IrNode> arguments = attribute.list("arguments");
            if (arguments.isEmpty()) {
                return Optional.empty();
            }
            return arguments.get(0).find("value")
                    .flatMap(v -> v.optionalString("value"))
                    .map(String::strip);
        }
        return Optional.empty();
    }

    private JsonNode required(String key) {
        JsonNode value = json.get(key);
        if (value == null || value.isNull()) {
            throw new IrFormatException("Missing required key '" + key + "' in " + source);
        }
        return value;
    }

    @Override
    public String toString() {
        return "IrNode(" + source + ": " + json + ")";
    }
}
