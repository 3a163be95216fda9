package com.stockforecast.backend.forecast.artifact;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Serialized form of a model file. The {@code type} property selects the implementation.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = LinearWindowModel.class, name = LinearWindowModel.TYPE),
        @JsonSubTypes.Type(value = EmbeddedLinearWindowModel.class, name = EmbeddedLinearWindowModel.TYPE)
})
public interface ModelDefinition {

    /**
     * @throws IllegalStateException when the parameters cannot produce a forecast
     */
    void validate();
}
