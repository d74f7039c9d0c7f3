package org.fielddispatch.engine.domain.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable read-only snapshot of a field worker.
 * Owned by the external roster service.
 */
public final class Executor {

    /**
     * Orders executor ids numerically when both are numbers, lexically otherwise.
     */
    public static final Comparator<String> ID_ORDER = Executor::compareIds;

    private final String id;
    private final String name;
    private final Set<String> skills;
    private final String homeZone;
    private final double efficiencyRating;
    private final int workloadCapacity;
    private final int currentLoad;
    private final boolean available;

    private Executor(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.name = builder.name != null ? builder.name : builder.id;
        this.skills = Collections.unmodifiableSet(new LinkedHashSet<>(builder.skills));
        this.homeZone = builder.homeZone;
        if (builder.efficiencyRating < 0 || builder.efficiencyRating > 100) {
            throw new IllegalArgumentException("efficiencyRating must be between 0 and 100");
        }
        if (builder.workloadCapacity < 0) {
            throw new IllegalArgumentException("workloadCapacity must not be negative");
        }
        if (builder.currentLoad < 0) {
            throw new IllegalArgumentException("currentLoad must not be negative");
        }
        this.efficiencyRating = builder.efficiencyRating;
        this.workloadCapacity = builder.workloadCapacity;
        this.currentLoad = builder.currentLoad;
        this.available = builder.available;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Set<String> getSkills() {
        return skills;
    }

    public String getHomeZone() {
        return homeZone;
    }

    public double getEfficiencyRating() {
        return efficiencyRating;
    }

    public int getWorkloadCapacity() {
        return workloadCapacity;
    }

    public int getCurrentLoad() {
        return currentLoad;
    }

    public boolean isAvailable() {
        return available;
    }

    public boolean hasSkill(String skill) {
        return skill != null && skills.contains(skill);
    }

    /**
     * Number of additional tickets this executor can take, never negative.
     */
    public int getSpareCapacity() {
        return Math.max(0, workloadCapacity - currentLoad);
    }

    /**
     * Check if this executor can accept one more ticket.
     */
    public boolean canAcceptWork() {
        return available && currentLoad < workloadCapacity;
    }

    public Executor withCurrentLoad(int load) {
        return toBuilder().currentLoad(load).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .skills(skills)
                .homeZone(homeZone)
                .efficiencyRating(efficiencyRating)
                .workloadCapacity(workloadCapacity)
                .currentLoad(currentLoad)
                .available(available);
    }

    static int compareIds(String a, String b) {
        if (isNumeric(a) && isNumeric(b)) {
            int byLength = Integer.compare(a.length(), b.length());
            return byLength != 0 ? byLength : a.compareTo(b);
        }
        return a.compareTo(b);
    }

    private static boolean isNumeric(String value) {
        if (value.isEmpty() || (value.length() > 1 && value.charAt(0) == '0')) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Executor)) {
            return false;
        }
        Executor other = (Executor) o;
        return Double.compare(efficiencyRating, other.efficiencyRating) == 0
                && workloadCapacity == other.workloadCapacity
                && currentLoad == other.currentLoad
                && available == other.available
                && id.equals(other.id)
                && name.equals(other.name)
                && skills.equals(other.skills)
                && Objects.equals(homeZone, other.homeZone);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, skills, homeZone, efficiencyRating, workloadCapacity, currentLoad, available);
    }

    @Override
    public String toString() {
        return String.format("Executor{id='%s', skills=%s, zone='%s', efficiency=%.1f, load=%d/%d, available=%s}",
                id, skills, homeZone, efficiencyRating, currentLoad, workloadCapacity, available);
    }

    /**
     * Builder for Executor.
     */
    public static final class Builder {
        private String id;
        private String name;
        private Collection<String> skills = Collections.emptySet();
        private String homeZone;
        private double efficiencyRating = 50.0;
        private int workloadCapacity = 1;
        private int currentLoad;
        private boolean available = true;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder skills(Collection<String> skills) {
            this.skills = skills != null ? skills : Collections.emptySet();
            return this;
        }

        public Builder skills(String... skills) {
            this.skills = Arrays.asList(skills);
            return this;
        }

        public Builder homeZone(String homeZone) {
            this.homeZone = homeZone;
            return this;
        }

        public Builder efficiencyRating(double efficiencyRating) {
            this.efficiencyRating = efficiencyRating;
            return this;
        }

        public Builder workloadCapacity(int workloadCapacity) {
            this.workloadCapacity = workloadCapacity;
            return this;
        }

        public Builder currentLoad(int currentLoad) {
            this.currentLoad = currentLoad;
            return this;
        }

        public Builder available(boolean available) {
            this.available = available;
            return this;
        }

        public Executor build() {
            return new Executor(this);
        }
    }
}
