package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Body of POST /assign/batch and POST /compare.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class BatchRequestDto {

    @JsonProperty("tickets")
    private List<TicketDto> tickets = new ArrayList<>();

    /** Optional; the engine selects one when absent. */
    @JsonProperty("algorithm")
    private String algorithm;

    public List<TicketDto> getTickets() {
        return tickets;
    }

    public void setTickets(List<TicketDto> tickets) {
        this.tickets = tickets;
    }

    public String getAlgorithm() {
        return algorithm;
    }

    public void setAlgorithm(String algorithm) {
        this.algorithm = algorithm;
    }
}
