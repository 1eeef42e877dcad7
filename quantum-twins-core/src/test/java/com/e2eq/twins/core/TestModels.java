package com.e2eq.twins.core;

import com.e2eq.twins.util.JSONUtils;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * DTDL fixtures shared by the engine tests: a room with a thermostat component and a
 * relationship to devices, and a sensor that extends device.
 */
final class TestModels {
    static final String THERMOSTAT_ID = "dtmi:test:Thermostat;1";
    static final String DEVICE_ID = "dtmi:test:Device;1";
    static final String SENSOR_ID = "dtmi:test:Sensor;1";
    static final String ROOM_ID = "dtmi:test:Room;1";

    static final String THERMOSTAT = """
            {"@id":"dtmi:test:Thermostat;1","@type":"Interface","@context":"dtmi:dtdl:context;3",
             "contents":[{"@type":"Property","name":"setPoint","schema":"double","writable":true}]}""";

    static final String DEVICE = """
            {"@id":"dtmi:test:Device;1","@type":"Interface","@context":"dtmi:dtdl:context;3",
             "contents":[{"@type":"Property","name":"serial","schema":"string"}]}""";

    static final String SENSOR = """
            {"@id":"dtmi:test:Sensor;1","@type":"Interface","@context":"dtmi:dtdl:context;3",
             "extends":"dtmi:test:Device;1",
             "contents":[{"@type":"Property","name":"unit","schema":"string"}]}""";

    static final String ROOM = """
            {"@id":"dtmi:test:Room;1","@type":"Interface","@context":"dtmi:dtdl:context;3",
             "contents":[
               {"@type":"Property","name":"name","schema":"string"},
               {"@type":"Property","name":"temperature","schema":"double"},
               {"@type":"Telemetry","name":"reading","schema":"double"},
               {"@type":"Component","name":"thermostat","schema":"dtmi:test:Thermostat;1"},
               {"@type":"Relationship","name":"contains","target":"dtmi:test:Device;1",
                "properties":[{"@type":"Property","name":"since","schema":"dateTime"}]}
             ]}""";

    static final List<String> ALL = List.of(THERMOSTAT, DEVICE, SENSOR, ROOM);

    private TestModels() {
    }

    static ObjectNode json(String text) {
        return (ObjectNode) JSONUtils.instance().readTree(text);
    }

    static ObjectNode room(String name, double temperature) {
        ObjectNode twin = json("{\"$metadata\":{\"$model\":\"" + ROOM_ID + "\"}}");
        twin.put("name", name);
        twin.put("temperature", temperature);
        return twin;
    }

    static ObjectNode twinOf(String modelId) {
        return json("{\"$metadata\":{\"$model\":\"" + modelId + "\"}}");
    }
}
