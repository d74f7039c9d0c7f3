package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.fielddispatch.engine.domain.model.Ticket;

import java.time.Instant;

/**
 * DTO for a service ticket.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class TicketDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("category")
    private String category;

    @JsonProperty("urgency")
    private int urgency = 3;

    @JsonProperty("description")
    private String description;

    @JsonProperty("zone")
    private String zone;

    @JsonProperty("created_at")
    private Instant createdAt;

    public static TicketDto from(Ticket ticket) {
        TicketDto dto = new TicketDto();
        dto.id = ticket.getId();
        dto.category = ticket.getCategory();
        dto.urgency = ticket.getUrgency();
        dto.description = ticket.getDescription();
        dto.zone = ticket.getZone();
        dto.createdAt = ticket.getCreatedAt();
        return dto;
    }

    /**
     * Convert to the domain model; rejects urgency outside 1..5.
     */
    public Ticket toTicket() {
        return Ticket.builder()
                .id(id)
                .category(category)
                .urgency(urgency)
                .description(description)
                .zone(zone)
                .createdAt(createdAt)
                .build();
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getCategory() {
        return category;
    }

    public void setCategory(String category) {
        this.category = category;
    }

    public int getUrgency() {
        return urgency;
    }

    public void setUrgency(int urgency) {
        this.urgency = urgency;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getZone() {
        return zone;
    }

    public void setZone(String zone) {
        this.zone = zone;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }
}
