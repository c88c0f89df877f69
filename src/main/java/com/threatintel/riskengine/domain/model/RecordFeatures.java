package com.threatintel.riskengine.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Numeric feature payload of a record. One variant per source type; the scoring engine
 * dispatches on {@link #sourceType()}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = ExternalSignalFeatures.class, name = "external-signal"),
        @JsonSubTypes.Type(value = InsiderFeatures.class, name = "insider-telemetry"),
        @JsonSubTypes.Type(value = VendorFeatures.class, name = "vendor-profile")
})
public sealed interface RecordFeatures permits ExternalSignalFeatures, InsiderFeatures, VendorFeatures {

    @JsonIgnore
    SourceType sourceType();
}
