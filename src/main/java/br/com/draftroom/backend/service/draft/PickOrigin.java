package br.com.draftroom.backend.service.draft;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Origem de um pick commitado.
 */
public enum PickOrigin {
    MANUAL("manual"),
    QUEUE("queue"),
    BEST_AVAILABLE("best-available");

    private final String wireValue;

    PickOrigin(String wireValue) {
        this.wireValue = wireValue;
    }

    @JsonValue
    public String getWireValue() {
        return wireValue;
    }

    public boolean isAutomatic() {
        return this != MANUAL;
    }

    public static PickOrigin fromWireValue(String value) {
        for (PickOrigin origin : values()) {
            if (origin.wireValue.equalsIgnoreCase(value) || origin.name().equalsIgnoreCase(value)) {
                return origin;
            }
        }
        throw new IllegalArgumentException("Origem de pick desconhecida: " + value);
    }
}
