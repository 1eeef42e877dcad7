package com.e2eq.twins.models.dtdl;

import com.e2eq.twins.exceptions.ModelParsingException;
import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.databind.JsonNode;
import org.jboss.logging.Logger;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Jackson based parser for the DTDL interface subset the twins engine validates against:
 * interfaces with {@code extends}, {@code contents} (Property, Relationship, Component,
 * Telemetry, Command) and {@code schemas}, primitive schemas and the Object, Enum, Map and
 * Array complex schemas.
 */
public class DtdlModelParser implements ModelParser {
    private static final Logger LOG = Logger.getLogger(DtdlModelParser.class);

    private static final Pattern DTMI = Pattern.compile("^dtmi:[A-Za-z][A-Za-z0-9_]*(?::[A-Za-z0-9_]+)*;[1-9][0-9]*(?:\\.[0-9]+)?$");
    private static final Pattern CONTENT_NAME = Pattern.compile("^[A-Za-z][A-Za-z0-9_]{0,63}$");

    @Override
    public Map<String, DtdlInterface> parse(Collection<String> definitions, ModelResolver resolver) {
        if (definitions == null || definitions.isEmpty()) {
            throw new ModelParsingException("No model definitions supplied");
        }
        Batch batch = new Batch(resolver != null ? resolver : ModelResolver.none());
        for (String definition : definitions) {
            batch.addDocument(definition);
        }
        batch.resolveExternalReferences();

        Map<String, DtdlInterface> result = new LinkedHashMap<>();
        for (String id : batch.raw.keySet()) {
            result.put(id, batch.resolve(id));
        }
        LOG.debugf("Parsed %d interface(s) from %d definition(s)", result.size(), definitions.size());
        return result;
    }

    private record RawInterface(String id, List<String> extendsIds, List<JsonNode> contents, JsonNode node) {}

    /**
     * Parse state for one call: raw interfaces by id, named schemas, and the resolved
     * interfaces memoized as they complete.
     */
    private static final class Batch {
        private final ModelResolver resolver;
        private final Map<String, RawInterface> raw = new LinkedHashMap<>();
        private final Map<String, JsonNode> namedSchemas = new HashMap<>();
        private final Map<String, DtdlInterface> resolved = new HashMap<>();
        private final Set<String> resolving = new HashSet<>();
        private final Set<String> resolvingSchemas = new HashSet<>();

        private Batch(ModelResolver resolver) {
            this.resolver = resolver;
        }

        void addDocument(String definition) {
            JsonNode root;
            try {
                root = JSONUtils.instance().readTree(definition);
            } catch (IllegalArgumentException e) {
                throw new ModelParsingException("Model definition is not valid JSON: " + e.getMessage(), e);
            }
            if (root == null) {
                throw new ModelParsingException("Model definition is empty");
            }
            if (root.isArray()) {
                for (JsonNode element : root) {
                    addInterface(element);
                }
            } else {
                addInterface(root);
            }
        }

        private void addInterface(JsonNode node) {
            if (!node.isObject() || !hasType(node, "Interface")) {
                throw new ModelParsingException("Top-level model elements must be DTDL Interfaces: " + abbreviate(node));
            }
            String id = requireId(node);
            if (raw.containsKey(id)) {
                throw new ModelParsingException("Duplicate definition of '" + id + "'");
            }

            List<String> extendsIds = new ArrayList<>();
            JsonNode ext = node.get("extends");
            if (ext != null) {
                if (ext.isTextual()) {
                    extendsIds.add(ext.asText());
                } else if (ext.isArray()) {
                    for (JsonNode e : ext) {
                        if (!e.isTextual()) {
                            throw new ModelParsingException("Interface '" + id + "': only interface ids are supported in extends");
                        }
                        extendsIds.add(e.asText());
                    }
                } else {
                    throw new ModelParsingException("Interface '" + id + "': only interface ids are supported in extends");
                }
            }

            List<JsonNode> contents = new ArrayList<>();
            JsonNode c = node.get("contents");
            if (c != null) {
                if (!c.isArray()) {
                    throw new ModelParsingException("Interface '" + id + "': contents must be an array");
                }
                for (JsonNode content : c) {
                    contents.add(content);
                    JsonNode schema = content.get("schema");
                    // inline component interfaces are registered like top-level ones
                    if (hasType(content, "Component") && schema != null && schema.isObject()) {
                        addInterface(schema);
                    }
                }
            }

            JsonNode schemas = node.get("schemas");
            if (schemas != null && schemas.isArray()) {
                for (JsonNode s : schemas) {
                    namedSchemas.put(requireId(s), s);
                }
            }
            raw.put(id, new RawInterface(id, extendsIds, contents, node));
        }

        void resolveExternalReferences() {
            Deque<String> pending = new ArrayDeque<>(referencedIds());
            Set<String> attempted = new HashSet<>();
            while (!pending.isEmpty()) {
                String id = pending.poll();
                if (raw.containsKey(id) || !attempted.add(id)) continue;
                Optional<String> definition = resolver.resolve(id);
                if (definition.isEmpty()) {
                    throw new ModelParsingException("Unable to resolve reference to '" + id + "'");
                }
                addDocument(definition.get());
                if (!raw.containsKey(id)) {
                    throw new ModelParsingException("Resolved definition does not contain '" + id + "'");
                }
                pending.addAll(referencedIds());
            }
        }

        private Set<String> referencedIds() {
            Set<String> ids = new LinkedHashSet<>();
            for (RawInterface r : raw.values()) {
                ids.addAll(r.extendsIds());
                for (JsonNode content : r.contents()) {
                    JsonNode schema = content.get("schema");
                    if (hasType(content, "Component") && schema != null && schema.isTextual()) {
                        ids.add(schema.asText());
                    }
                }
            }
            ids.removeAll(raw.keySet());
            return ids;
        }

        DtdlInterface resolve(String id) {
            DtdlInterface done = resolved.get(id);
            if (done != null) {
                return done;
            }
            RawInterface r = raw.get(id);
            if (r == null) {
                throw new ModelParsingException("Unable to resolve reference to '" + id + "'");
            }
            if (!resolving.add(id)) {
                throw new ModelParsingException("Interface '" + id + "' participates in a reference cycle");
            }

            Map<String, DtdlContent> contents = new LinkedHashMap<>();
            for (String base : r.extendsIds()) {
                for (DtdlContent inherited : resolve(base).contents().values()) {
                    DtdlContent existing = contents.putIfAbsent(inherited.name(), inherited);
                    if (existing != null && !existing.equals(inherited)) {
                        throw new ModelParsingException("Interface '" + id + "' inherits conflicting definitions of '" + inherited.name() + "'");
                    }
                }
            }
            for (JsonNode node : r.contents()) {
                DtdlContent content = parseContent(id, node);
                if (contents.containsKey(content.name())) {
                    throw new ModelParsingException("Interface '" + id + "' declares '" + content.name() + "' more than once or redefines an inherited content");
                }
                contents.put(content.name(), content);
            }

            DtdlInterface result = new DtdlInterface(id, r.extendsIds(), contents,
                    r.node().get("displayName"), r.node().get("description"), r.node());
            resolving.remove(id);
            resolved.put(id, result);
            return result;
        }

        private DtdlContent parseContent(String interfaceId, JsonNode node) {
            if (!node.isObject()) {
                throw new ModelParsingException("Interface '" + interfaceId + "': content must be an object");
            }
            DtdlContentKind kind = contentKind(node)
                    .orElseThrow(() -> new ModelParsingException("Interface '" + interfaceId + "': unknown content type " + node.get("@type")));
            String name = text(node, "name");
            if (name == null || !CONTENT_NAME.matcher(name).matches()) {
                throw new ModelParsingException("Interface '" + interfaceId + "': invalid content name '" + name + "'");
            }
            String where = interfaceId + "/" + name;
            boolean writable = node.path("writable").asBoolean(false);
            switch (kind) {
                case PROPERTY:
                case TELEMETRY:
                    return new DtdlContent(name, kind, parseSchema(where, requireSchema(where, node)), null, null, null, writable);
                case COMMAND:
                    return new DtdlContent(name, kind, null, null, null, null, false);
                case COMPONENT: {
                    JsonNode schema = requireSchema(where, node);
                    String componentId = schema.isObject() ? requireId(schema) : schema.asText();
                    return new DtdlContent(name, kind, null, null, resolve(componentId), null, false);
                }
                case RELATIONSHIP: {
                    Map<String, DtdlContent> properties = new LinkedHashMap<>();
                    JsonNode props = node.get("properties");
                    if (props != null) {
                        for (JsonNode p : props) {
                            String pName = text(p, "name");
                            if (pName == null || !CONTENT_NAME.matcher(pName).matches()) {
                                throw new ModelParsingException("Relationship '" + where + "': invalid property name '" + pName + "'");
                            }
                            properties.put(pName, DtdlContent.property(pName,
                                    parseSchema(where + "/" + pName, requireSchema(where + "/" + pName, p)),
                                    p.path("writable").asBoolean(false)));
                        }
                    }
                    return new DtdlContent(name, kind, null, text(node, "target"), null, properties, writable);
                }
                default:
                    throw new IllegalStateException("Unhandled content kind " + kind);
            }
        }

        private DtdlSchema parseSchema(String where, JsonNode node) {
            if (node.isTextual()) {
                String name = node.asText();
                DtdlSchema.PrimitiveType primitive = DtdlSchema.PrimitiveType.fromDtdlName(name);
                if (primitive != null) {
                    return new DtdlSchema.Primitive(primitive);
                }
                JsonNode named = namedSchemas.get(name);
                if (named == null) {
                    throw new ModelParsingException(where + ": unknown schema '" + name + "'");
                }
                if (!resolvingSchemas.add(name)) {
                    throw new ModelParsingException(where + ": schema '" + name + "' refers to itself");
                }
                try {
                    return parseSchema(where, named);
                } finally {
                    resolvingSchemas.remove(name);
                }
            }
            if (!node.isObject()) {
                throw new ModelParsingException(where + ": invalid schema " + abbreviate(node));
            }
            if (hasType(node, "Object")) {
                Map<String, DtdlSchema.Field> fields = new LinkedHashMap<>();
                for (JsonNode f : node.path("fields")) {
                    String fName = text(f, "name");
                    if (fName == null) {
                        throw new ModelParsingException(where + ": Object field without a name");
                    }
                    fields.put(fName, new DtdlSchema.Field(fName, parseSchema(where + "." + fName, requireSchema(where + "." + fName, f))));
                }
                return new DtdlSchema.ObjectSchema(fields);
            }
            if (hasType(node, "Enum")) {
                DtdlSchema.PrimitiveType valueSchema = DtdlSchema.PrimitiveType.fromDtdlName(text(node, "valueSchema"));
                if (valueSchema != DtdlSchema.PrimitiveType.INTEGER && valueSchema != DtdlSchema.PrimitiveType.STRING) {
                    throw new ModelParsingException(where + ": Enum valueSchema must be integer or string");
                }
                List<DtdlSchema.EnumValue> values = new ArrayList<>();
                for (JsonNode v : node.path("enumValues")) {
                    JsonNode enumValue = v.get("enumValue");
                    if (enumValue == null) {
                        throw new ModelParsingException(where + ": Enum value without enumValue");
                    }
                    values.add(new DtdlSchema.EnumValue(text(v, "name"), enumValue));
                }
                return new DtdlSchema.EnumSchema(valueSchema, values);
            }
            if (hasType(node, "Map")) {
                JsonNode mapKey = node.path("mapKey");
                JsonNode mapValue = node.path("mapValue");
                if (!mapValue.has("schema")) {
                    throw new ModelParsingException(where + ": Map requires mapValue.schema");
                }
                String keyName = mapKey.path("name").asText("key");
                return new DtdlSchema.MapSchema(keyName, parseSchema(where + "{}", mapValue.get("schema")));
            }
            if (hasType(node, "Array")) {
                JsonNode element = node.get("elementSchema");
                if (element == null) {
                    throw new ModelParsingException(where + ": Array requires elementSchema");
                }
                return new DtdlSchema.ArraySchema(parseSchema(where + "[]", element));
            }
            throw new ModelParsingException(where + ": unsupported schema type " + node.get("@type"));
        }

        private static JsonNode requireSchema(String where, JsonNode node) {
            JsonNode schema = node.get("schema");
            if (schema == null || schema.isNull()) {
                throw new ModelParsingException(where + ": schema is required");
            }
            return schema;
        }
    }

    private static Optional<DtdlContentKind> contentKind(JsonNode node) {
        JsonNode type = node.get("@type");
        if (type == null) return Optional.empty();
        if (type.isTextual()) {
            return DtdlContentKind.fromDtdlType(type.asText());
        }
        for (JsonNode t : type) {
            Optional<DtdlContentKind> kind = DtdlContentKind.fromDtdlType(t.asText());
            if (kind.isPresent()) return kind;
        }
        return Optional.empty();
    }

    private static boolean hasType(JsonNode node, String type) {
        JsonNode t = node.get("@type");
        if (t == null) return false;
        if (t.isTextual()) return type.equals(t.asText());
        for (JsonNode e : t) {
            if (type.equals(e.asText())) return true;
        }
        return false;
    }

    private static String requireId(JsonNode node) {
        String id = text(node, "@id");
        if (id == null || !DTMI.matcher(id).matches()) {
            throw new ModelParsingException("Invalid or missing @id '" + id + "'");
        }
        return id;
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        return v != null && v.isTextual() ? v.asText() : null;
    }

    private static String abbreviate(JsonNode node) {
        String s = String.valueOf(node);
        return s.length() > 80 ? s.substring(0, 80) + "..." : s;
    }
}
