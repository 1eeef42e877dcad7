package com.e2eq.twins.models.dtdl;

import java.util.Optional;

public enum DtdlContentKind {
    PROPERTY("Property"),
    RELATIONSHIP("Relationship"),
    COMPONENT("Component"),
    TELEMETRY("Telemetry"),
    COMMAND("Command");

    private final String dtdlType;

    DtdlContentKind(String dtdlType) {
        this.dtdlType = dtdlType;
    }

    public String getDtdlType() {
        return dtdlType;
    }

    public static Optional<DtdlContentKind> fromDtdlType(String type) {
        for (DtdlContentKind kind : values()) {
            if (kind.dtdlType.equals(type)) {
                return Optional.of(kind);
            }
        }
        return Optional.empty();
    }
}
