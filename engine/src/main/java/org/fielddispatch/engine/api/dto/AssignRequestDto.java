package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Body of POST /assign and POST /recommend.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AssignRequestDto {

    @JsonProperty("ticket")
    private TicketDto ticket;

    @JsonProperty("requesting_user")
    private String requestingUser;

    public TicketDto getTicket() {
        return ticket;
    }

    public void setTicket(TicketDto ticket) {
        this.ticket = ticket;
    }

    public String getRequestingUser() {
        return requestingUser;
    }

    public void setRequestingUser(String requestingUser) {
        this.requestingUser = requestingUser;
    }
}
