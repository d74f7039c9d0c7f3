package org.fielddispatch.engine.domain.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Immutable snapshot of a service ticket awaiting assignment.
 * Owned by the external ticketing service.
 */
public final class Ticket {

    public static final int MIN_URGENCY = 1;
    public static final int MAX_URGENCY = 5;

    private final String id;
    private final String category;
    private final int urgency;
    private final String description;
    private final String zone;
    private final Instant createdAt;

    private Ticket(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.category = Objects.requireNonNull(builder.category, "category must not be null");
        if (builder.urgency < MIN_URGENCY || builder.urgency > MAX_URGENCY) {
            throw new IllegalArgumentException("urgency must be between 1 and 5, got " + builder.urgency);
        }
        this.urgency = builder.urgency;
        this.description = builder.description != null ? builder.description : "";
        this.zone = builder.zone;
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.EPOCH;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getCategory() {
        return category;
    }

    public int getUrgency() {
        return urgency;
    }

    public String getDescription() {
        return description;
    }

    /**
     * Zone or district of the ticket; may be null when the address could not be resolved.
     */
    public String getZone() {
        return zone;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .category(category)
                .urgency(urgency)
                .description(description)
                .zone(zone)
                .createdAt(createdAt);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Ticket)) {
            return false;
        }
        Ticket other = (Ticket) o;
        return urgency == other.urgency
                && id.equals(other.id)
                && category.equals(other.category)
                && description.equals(other.description)
                && Objects.equals(zone, other.zone)
                && createdAt.equals(other.createdAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, category, urgency, description, zone, createdAt);
    }

    @Override
    public String toString() {
        return String.format("Ticket{id='%s', category='%s', urgency=%d, zone='%s'}",
                id, category, urgency, zone);
    }

    /**
     * Builder for Ticket.
     */
    public static final class Builder {
        private String id;
        private String category;
        private int urgency = 3;
        private String description;
        private String zone;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder category(String category) {
            this.category = category;
            return this;
        }

        public Builder urgency(int urgency) {
            this.urgency = urgency;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder zone(String zone) {
            this.zone = zone;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Ticket build() {
            return new Ticket(this);
        }
    }
}
