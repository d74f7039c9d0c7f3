package org.fielddispatch.engine.geo;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.fielddispatch.engine.exception.InvalidConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable lookup of zones by name (case-insensitive).
 * Loaded from a JSON array of {@code {"name", "lat", "lon"}} objects.
 */
public final class ZoneTable {

    private static final Logger log = LoggerFactory.getLogger(ZoneTable.class);
    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

    public static final String DEFAULT_RESOURCE = "zones.json";

    private final Map<String, Zone> zones;

    private ZoneTable(Map<String, Zone> zones) {
        this.zones = Collections.unmodifiableMap(zones);
    }

    public static ZoneTable of(Collection<Zone> zones) {
        Map<String, Zone> map = new LinkedHashMap<>();
        for (Zone zone : zones) {
            Zone previous = map.put(normalize(zone.getName()), zone);
            if (previous != null) {
                throw new InvalidConfigurationException("Duplicate zone in table: " + zone.getName());
            }
        }
        return new ZoneTable(map);
    }

    /**
     * Loads the built-in table bundled as {@value #DEFAULT_RESOURCE}.
     */
    public static ZoneTable loadDefault() {
        try (InputStream in = ZoneTable.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                throw new InvalidConfigurationException("Zone table resource not found: " + DEFAULT_RESOURCE);
            }
            return parse(in, DEFAULT_RESOURCE);
        } catch (IOException e) {
            throw new InvalidConfigurationException("Failed to read zone table " + DEFAULT_RESOURCE, e);
        }
    }

    public static ZoneTable load(Path file) {
        try (InputStream in = Files.newInputStream(file)) {
            return parse(in, file.toString());
        } catch (IOException e) {
            throw new InvalidConfigurationException("Failed to read zone table " + file, e);
        }
    }

    private static ZoneTable parse(InputStream in, String source) throws IOException {
        List<ZoneEntry> entries = OBJECT_MAPPER.readValue(in, new TypeReference<List<ZoneEntry>>() { });
        List<Zone> zones = new ArrayList<>(entries.size());
        for (ZoneEntry entry : entries) {
            if (entry.name == null || entry.name.isBlank()) {
                throw new InvalidConfigurationException("Zone without a name in " + source);
            }
            try {
                zones.add(new Zone(entry.name.trim(), entry.lat, entry.lon));
            } catch (IllegalArgumentException e) {
                throw new InvalidConfigurationException(e.getMessage(), e);
            }
        }
        ZoneTable table = of(zones);
        log.info("Loaded {} zones from {}", table.size(), source);
        return table;
    }

    public Optional<Zone> find(String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(zones.get(normalize(name)));
    }

    public boolean contains(String name) {
        return find(name).isPresent();
    }

    public Collection<Zone> all() {
        return zones.values();
    }

    public int size() {
        return zones.size();
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    private static final class ZoneEntry {
        @JsonProperty("name")
        private String name;
        @JsonProperty("lat")
        private double lat;
        @JsonProperty("lon")
        private double lon;
    }
}
