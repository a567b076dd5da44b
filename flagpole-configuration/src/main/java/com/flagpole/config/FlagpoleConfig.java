package com.flagpole.config;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Registry settings.
 * <p>
 * From the environment: FLAGPOLE_DUPLICATE_POLICY ({@code REJECT} or {@code REPLACE}),
 * FLAGPOLE_PASS_STRUCTURE (pass the result map to every handler, not only to dependents),
 * FLAGPOLE_CATALOG_FILE (JSON file read by {@link FlagSpaceCatalog#load(FlagpoleConfig)}).
 */
public final class FlagpoleConfig {

    static final String ENV_DUPLICATE_POLICY = "FLAGPOLE_DUPLICATE_POLICY";
    static final String ENV_PASS_STRUCTURE = "FLAGPOLE_PASS_STRUCTURE";
    static final String ENV_CATALOG_FILE = "FLAGPOLE_CATALOG_FILE";

    private static final DuplicatePolicy DEFAULT_DUPLICATE_POLICY = DuplicatePolicy.REJECT;
    private static final boolean DEFAULT_PASS_STRUCTURE = false;
    private static final String DEFAULT_CATALOG_FILE = "flagpole.json";

    private static final FlagpoleConfig DEFAULTS = builder().build();

    private final DuplicatePolicy duplicatePolicy;
    private final boolean passStructureByDefault;
    private final String catalogFile;

    private FlagpoleConfig(Builder b) {
        this.duplicatePolicy = b.duplicatePolicy;
        this.passStructureByDefault = b.passStructureByDefault;
        this.catalogFile = b.catalogFile;
    }

    /** Built-in defaults; the environment is not consulted. */
    public static FlagpoleConfig defaults() {
        return DEFAULTS;
    }

    public static FlagpoleConfig fromEnvironment() {
        return fromEnvironment(System.getenv());
    }

    /** Reads settings from the given variables; missing or unparseable values fall back to defaults. */
    static FlagpoleConfig fromEnvironment(Map<String, String> env) {
        Objects.requireNonNull(env, "env");
        return builder()
                .duplicatePolicy(parsePolicy(env.get(ENV_DUPLICATE_POLICY), DEFAULT_DUPLICATE_POLICY))
                .passStructureByDefault(parseBoolean(env.get(ENV_PASS_STRUCTURE), DEFAULT_PASS_STRUCTURE))
                .catalogFile(getEnv(env, ENV_CATALOG_FILE, DEFAULT_CATALOG_FILE))
                .build();
    }

    public DuplicatePolicy getDuplicatePolicy() {
        return duplicatePolicy;
    }

    /** Default for {@code passFullStructure} on builds that do not set it. Default false. */
    public boolean isPassStructureByDefault() {
        return passStructureByDefault;
    }

    /** Flag space catalog file. Default {@code flagpole.json}. */
    public String getCatalogFile() {
        return catalogFile;
    }

    public Builder toBuilder() {
        return builder()
                .duplicatePolicy(duplicatePolicy)
                .passStructureByDefault(passStructureByDefault)
                .catalogFile(catalogFile);
    }

    public static Builder builder() {
        return new Builder();
    }

    private static DuplicatePolicy parsePolicy(String value, DuplicatePolicy defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return DuplicatePolicy.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultValue;
        }
    }

    private static boolean parseBoolean(String value, boolean defaultValue) {
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        return "true".equalsIgnoreCase(value.trim()) || "1".equals(value.trim());
    }

    private static String getEnv(Map<String, String> env, String key, String defaultValue) {
        String v = env.get(key);
        return (v != null && !v.isBlank()) ? v.trim() : defaultValue;
    }

    @Override
    public String toString() {
        return "FlagpoleConfig{duplicatePolicy=" + duplicatePolicy
                + ", passStructureByDefault=" + passStructureByDefault
                + ", catalogFile=" + catalogFile + "}";
    }

    public static final class Builder {
        private DuplicatePolicy duplicatePolicy = DEFAULT_DUPLICATE_POLICY;
        private boolean passStructureByDefault = DEFAULT_PASS_STRUCTURE;
        private String catalogFile = DEFAULT_CATALOG_FILE;

        private Builder() {
        }

        public Builder duplicatePolicy(DuplicatePolicy duplicatePolicy) {
            this.duplicatePolicy = duplicatePolicy != null ? duplicatePolicy : DEFAULT_DUPLICATE_POLICY;
            return this;
        }

        public Builder passStructureByDefault(boolean passStructureByDefault) {
            this.passStructureByDefault = passStructureByDefault;
            return this;
        }

        public Builder catalogFile(String catalogFile) {
            this.catalogFile = catalogFile != null ? catalogFile : DEFAULT_CATALOG_FILE;
            return this;
        }

        public FlagpoleConfig build() {
            return new FlagpoleConfig(this);
        }
    }
}
