package com.e2eq.twins.models;

import com.e2eq.twins.models.dtdl.DtdlInterface;
import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A stored model as returned by the registry. The vertex form kept in the graph is produced by
 * {@link #toProperties()} and read back with {@link #fromProperties(JsonNode)}.
 */
@Data
@NoArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class DigitalTwinsModelData {
    private String id;
    private JsonNode model;
    private Instant uploadTime;
    private Map<String, String> displayName = new LinkedHashMap<>();
    private Map<String, String> description = new LinkedHashMap<>();
    private boolean decommissioned;
    private List<String> bases = new ArrayList<>();

    public static DigitalTwinsModelData fromDefinition(DtdlInterface definition, List<String> bases, Instant uploadTime) {
        DigitalTwinsModelData data = new DigitalTwinsModelData();
        data.setId(definition.id());
        data.setModel(definition.source());
        data.setUploadTime(uploadTime);
        data.setDisplayName(languageMap(definition.displayName()));
        data.setDescription(languageMap(definition.description()));
        data.setBases(new ArrayList<>(bases));
        return data;
    }

    public ObjectNode toProperties() {
        ObjectNode node = JSONUtils.instance().createObjectNode();
        node.put("id", id);
        node.set("model", model);
        node.put("uploadTime", uploadTime != null ? uploadTime.toString() : null);
        node.set("displayName", JSONUtils.instance().valueToTree(displayName));
        node.set("description", JSONUtils.instance().valueToTree(description));
        node.put("decommissioned", decommissioned);
        ArrayNode baseArray = node.putArray("bases");
        bases.forEach(baseArray::add);
        return node;
    }

    public static DigitalTwinsModelData fromProperties(JsonNode properties) {
        DigitalTwinsModelData data = new DigitalTwinsModelData();
        data.setId(properties.path("id").asText(null));
        JsonNode model = properties.get("model");
        // older rows keep the definition as serialized text
        if (model != null && model.isTextual()) {
            model = JSONUtils.instance().readTree(model.asText());
        } else if (model != null && model.isNull()) {
            model = null;
        }
        data.setModel(model);
        String uploaded = properties.path("uploadTime").asText(null);
        data.setUploadTime(uploaded != null ? Instant.parse(uploaded) : null);
        data.setDisplayName(languageMap(properties.get("displayName")));
        data.setDescription(languageMap(properties.get("description")));
        data.setDecommissioned(properties.path("decommissioned").asBoolean(false));
        List<String> bases = new ArrayList<>();
        for (JsonNode b : properties.path("bases")) {
            bases.add(b.asText());
        }
        data.setBases(bases);
        return data;
    }

    /**
     * Copy without the DTDL definition, as listed when definitions are not requested.
     */
    public DigitalTwinsModelData withoutDefinition() {
        DigitalTwinsModelData copy = new DigitalTwinsModelData();
        copy.setId(id);
        copy.setUploadTime(uploadTime);
        copy.setDisplayName(new LinkedHashMap<>(displayName));
        copy.setDescription(new LinkedHashMap<>(description));
        copy.setDecommissioned(decommissioned);
        copy.setBases(new ArrayList<>(bases));
        return copy;
    }

    /**
     * A plain string becomes {@code {"en": value}}; a language map is copied as is.
     */
    static Map<String, String> languageMap(JsonNode node) {
        Map<String, String> map = new LinkedHashMap<>();
        if (node == null || node.isNull() || node.isMissingNode()) {
            return map;
        }
        if (node.isTextual()) {
            map.put("en", node.asText());
            return map;
        }
        Iterator<Map.Entry<String, JsonNode>> it = node.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            map.put(e.getKey(), e.getValue().asText());
        }
        return map;
    }
}
