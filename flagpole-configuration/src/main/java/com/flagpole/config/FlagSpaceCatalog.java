package com.flagpole.config;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.flagpole.flags.ConfigurationException;
import com.flagpole.flags.FlagSpace;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Named flag spaces declared in JSON, e.g.
 * <pre>{@code
 * { "flagSpaces": { "alb": ["BASE", "LISTENERS", "RULES"] } }
 * }</pre>
 * Names keep the order in which they appear in the file. Every space is defined through
 * {@link FlagSpace#define(List)}, so a malformed declaration fails the whole catalog.
 */
public final class FlagSpaceCatalog {

    private static final Logger log = LoggerFactory.getLogger(FlagSpaceCatalog.class);

    private static final ObjectMapper MAPPER = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    private final Map<String, List<String>> declarations;
    private final Map<String, FlagSpace> spaces;

    @JsonCreator
    public FlagSpaceCatalog(@JsonProperty("flagSpaces") Map<String, List<String>> declarations) {
        Map<String, List<String>> decl = new LinkedHashMap<>();
        Map<String, FlagSpace> defined = new LinkedHashMap<>();
        if (declarations != null) {
            for (Map.Entry<String, List<String>> e : declarations.entrySet()) {
                String name = e.getKey();
                if (name == null || name.isBlank()) {
                    throw new ConfigurationException("Flag space name must be non-blank");
                }
                FlagSpace space;
                try {
                    space = FlagSpace.define(e.getValue());
                } catch (ConfigurationException ex) {
                    throw new ConfigurationException("Invalid flag space '" + name + "': " + ex.getMessage(), ex);
                }
                decl.put(name, List.copyOf(e.getValue()));
                defined.put(name, space);
            }
        }
        this.declarations = Collections.unmodifiableMap(decl);
        this.spaces = Collections.unmodifiableMap(defined);
    }

    /**
     * Parses a catalog from JSON.
     *
     * @throws ConfigurationException if the JSON is malformed or a flag space declaration is invalid
     */
    public static FlagSpaceCatalog fromJson(String json) {
        Objects.requireNonNull(json, "json");
        try {
            FlagSpaceCatalog catalog = MAPPER.readValue(json, FlagSpaceCatalog.class);
            return catalog != null ? catalog : new FlagSpaceCatalog(null);
        } catch (JsonProcessingException e) {
            for (Throwable t = e.getCause(); t != null; t = t.getCause()) {
                if (t instanceof ConfigurationException) throw (ConfigurationException) t;
            }
            throw new ConfigurationException("Malformed flag space catalog: " + e.getOriginalMessage(), e);
        }
    }

    /** Reads a catalog file. */
    public static FlagSpaceCatalog load(Path file) {
        Objects.requireNonNull(file, "file");
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read flag space catalog " + file, e);
        }
        FlagSpaceCatalog catalog = fromJson(json);
        log.info("Flag space catalog loaded | file={} | spaces={}", file, catalog.names());
        return catalog;
    }

    /** Reads the catalog named by {@link FlagpoleConfig#getCatalogFile()}. */
    public static FlagSpaceCatalog load(FlagpoleConfig config) {
        Objects.requireNonNull(config, "config");
        return load(Path.of(config.getCatalogFile()));
    }

    /** Returns the flag space with the given name, or null if the catalog does not declare it. */
    public FlagSpace get(String name) {
        return name != null ? spaces.get(name) : null;
    }

    public Set<String> names() {
        return spaces.keySet();
    }

    @JsonProperty("flagSpaces")
    public Map<String, List<String>> getDeclarations() {
        return declarations;
    }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize flag space catalog", e);
        }
    }
}
