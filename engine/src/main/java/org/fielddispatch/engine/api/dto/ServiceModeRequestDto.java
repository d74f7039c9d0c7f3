package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of POST /service-mode. A null or "auto" mode clears the operator override.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ServiceModeRequestDto {

    @JsonProperty("mode")
    private String mode;

    @JsonProperty("reason")
    private String reason;

    public String getMode() {
        return mode;
    }

    public void setMode(String mode) {
        this.mode = mode;
    }

    public String getReason() {
        return reason;
    }

    public void setReason(String reason) {
        this.reason = reason;
    }
}
