package com.e2eq.twins.models.dtdl;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.Period;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A DTDL value schema. {@link #validate(JsonNode)} is the instance validator: it returns
 * every violation found in the value, an empty list when the value conforms.
 */
public interface DtdlSchema {

    List<String> validate(JsonNode value);

    String describe();

    enum PrimitiveType {
        BOOLEAN("boolean"),
        DATE("date"),
        DATE_TIME("dateTime"),
        DOUBLE("double"),
        DURATION("duration"),
        FLOAT("float"),
        INTEGER("integer"),
        LONG("long"),
        STRING("string"),
        TIME("time");

        private final String dtdlName;

        PrimitiveType(String dtdlName) {
            this.dtdlName = dtdlName;
        }

        public String getDtdlName() {
            return dtdlName;
        }

        public static PrimitiveType fromDtdlName(String name) {
            for (PrimitiveType t : values()) {
                if (t.dtdlName.equals(name)) return t;
            }
            return null;
        }
    }

    record Primitive(PrimitiveType type) implements DtdlSchema {
        @Override
        public List<String> validate(JsonNode value) {
            if (!conforms(value)) {
                return List.of(render(value) + " is not a valid " + type.getDtdlName());
            }
            return List.of();
        }

        private boolean conforms(JsonNode value) {
            if (value == null || value.isNull() || value.isMissingNode()) {
                return false;
            }
            switch (type) {
                case BOOLEAN:
                    return value.isBoolean();
                case INTEGER:
                    return value.isIntegralNumber() && value.canConvertToInt();
                case LONG:
                    return value.isIntegralNumber() && value.canConvertToLong();
                case DOUBLE:
                case FLOAT:
                    return value.isNumber();
                case STRING:
                    return value.isTextual();
                case DATE:
                    return value.isTextual() && parses(() -> LocalDate.parse(value.asText()));
                case DATE_TIME:
                    return value.isTextual() && parses(() -> OffsetDateTime.parse(value.asText()));
                case TIME:
                    return value.isTextual() && parses(() -> LocalTime.parse(value.asText()));
                case DURATION:
                    return value.isTextual() && (parses(() -> Duration.parse(value.asText())) || parses(() -> Period.parse(value.asText())));
                default:
                    return false;
            }
        }

        @Override
        public String describe() {
            return type.getDtdlName();
        }
    }

    record EnumValue(String name, JsonNode value) {}

    record EnumSchema(PrimitiveType valueSchema, List<EnumValue> values) implements DtdlSchema {
        public EnumSchema {
            values = List.copyOf(values);
        }

        @Override
        public List<String> validate(JsonNode value) {
            for (EnumValue v : values) {
                if (v.value().equals(value)) {
                    return List.of();
                }
            }
            List<String> allowed = new ArrayList<>();
            for (EnumValue v : values) {
                allowed.add(v.value().toString());
            }
            return List.of(render(value) + " is not one of the enum values " + allowed);
        }

        @Override
        public String describe() {
            return "Enum";
        }
    }

    record Field(String name, DtdlSchema schema) {}

    record ObjectSchema(Map<String, Field> fields) implements DtdlSchema {
        public ObjectSchema {
            fields = new LinkedHashMap<>(fields);
        }

        @Override
        public List<String> validate(JsonNode value) {
            if (value == null || !value.isObject()) {
                return List.of(render(value) + " is not a valid Object");
            }
            List<String> violations = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> it = value.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                Field field = fields.get(e.getKey());
                if (field == null) {
                    violations.add("field '" + e.getKey() + "' is not defined in the Object schema");
                    continue;
                }
                for (String v : field.schema().validate(e.getValue())) {
                    violations.add("field '" + e.getKey() + "': " + v);
                }
            }
            return violations;
        }

        @Override
        public String describe() {
            return "Object";
        }
    }

    record MapSchema(String keyName, DtdlSchema valueSchema) implements DtdlSchema {
        @Override
        public List<String> validate(JsonNode value) {
            if (value == null || !value.isObject()) {
                return List.of(render(value) + " is not a valid Map");
            }
            List<String> violations = new ArrayList<>();
            Iterator<Map.Entry<String, JsonNode>> it = value.fields();
            while (it.hasNext()) {
                Map.Entry<String, JsonNode> e = it.next();
                for (String v : valueSchema.validate(e.getValue())) {
                    violations.add(keyName + " '" + e.getKey() + "': " + v);
                }
            }
            return violations;
        }

        @Override
        public String describe() {
            return "Map";
        }
    }

    record ArraySchema(DtdlSchema elementSchema) implements DtdlSchema {
        @Override
        public List<String> validate(JsonNode value) {
            if (value == null || !value.isArray()) {
                return List.of(render(value) + " is not a valid Array");
            }
            List<String> violations = new ArrayList<>();
            for (int i = 0; i < value.size(); i++) {
                for (String v : elementSchema.validate(value.get(i))) {
                    violations.add("element " + i + ": " + v);
                }
            }
            return violations;
        }

        @Override
        public String describe() {
            return "Array";
        }
    }

    private static boolean parses(Runnable parse) {
        try {
            parse.run();
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static String render(JsonNode value) {
        return value == null || value.isMissingNode() ? "null" : value.toString();
    }
}
