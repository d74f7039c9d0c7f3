package org.fielddispatch.engine.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.fielddispatch.engine.domain.model.Executor;

import java.util.ArrayList;
import java.util.List;

/**
 * DTO for a roster entry.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class ExecutorDto {

    @JsonProperty("id")
    private String id;

    @JsonProperty("name")
    private String name;

    @JsonProperty("skills")
    private List<String> skills = new ArrayList<>();

    @JsonProperty("home_zone")
    private String homeZone;

    @JsonProperty("efficiency_rating")
    private double efficiencyRating = 50.0;

    @JsonProperty("workload_capacity")
    private int workloadCapacity = 1;

    @JsonProperty("current_load")
    private int currentLoad;

    @JsonProperty("available")
    private boolean available = true;

    public static ExecutorDto from(Executor executor) {
        ExecutorDto dto = new ExecutorDto();
        dto.id = executor.getId();
        dto.name = executor.getName();
        dto.skills = new ArrayList<>(executor.getSkills());
        dto.homeZone = executor.getHomeZone();
        dto.efficiencyRating = executor.getEfficiencyRating();
        dto.workloadCapacity = executor.getWorkloadCapacity();
        dto.currentLoad = executor.getCurrentLoad();
        dto.available = executor.isAvailable();
        return dto;
    }

    public Executor toExecutor() {
        return Executor.builder()
                .id(id)
                .name(name)
                .skills(skills)
                .homeZone(homeZone)
                .efficiencyRating(efficiencyRating)
                .workloadCapacity(workloadCapacity)
                .currentLoad(currentLoad)
                .available(available)
                .build();
    }

    // Getters and Setters
    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public List<String> getSkills() {
        return skills;
    }

    public void setSkills(List<String> skills) {
        this.skills = skills;
    }

    public String getHomeZone() {
        return homeZone;
    }

    public void setHomeZone(String homeZone) {
        this.homeZone = homeZone;
    }

    public double getEfficiencyRating() {
        return efficiencyRating;
    }

    public void setEfficiencyRating(double efficiencyRating) {
        this.efficiencyRating = efficiencyRating;
    }

    public int getWorkloadCapacity() {
        return workloadCapacity;
    }

    public void setWorkloadCapacity(int workloadCapacity) {
        this.workloadCapacity = workloadCapacity;
    }

    public int getCurrentLoad() {
        return currentLoad;
    }

    public void setCurrentLoad(int currentLoad) {
        this.currentLoad = currentLoad;
    }

    public boolean isAvailable() {
        return available;
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }
}
