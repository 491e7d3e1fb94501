package com.geography.sync.ingest;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A tenant's submission of one geography unit.
 *
 * @param parentId        the tenant's own parent unit id, null at level 0
 * @param names           language code to declared name, in submission order
 * @param primaryLanguage key into {@code names}; the first entry when null
 * @param governmentCode  optional official code
 */
public record IngestRequest(String tenantId, int level, String parentId, Map<String, String> names,
                            String primaryLanguage, String governmentCode) {

    public IngestRequest {
        names = names != null ? Collections.unmodifiableMap(new LinkedHashMap<>(names)) : Map.of();
    }

    /**
     * A single-language request, the common case for one tenant form entry.
     */
    public static IngestRequest of(String tenantId, int level, String parentId, String name) {
        return builder().tenantId(tenantId).level(level).parentId(parentId).name("en", name).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String tenantId;
        private int level;
        private String parentId;
        private final Map<String, String> names = new LinkedHashMap<>();
        private String primaryLanguage;
        private String governmentCode;

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder level(int level) {
            this.level = level;
            return this;
        }

        public Builder parentId(String parentId) {
            this.parentId = parentId;
            return this;
        }

        public Builder name(String language, String name) {
            this.names.put(language, name);
            return this;
        }

        public Builder names(Map<String, String> names) {
            this.names.putAll(names);
            return this;
        }

        public Builder primaryLanguage(String primaryLanguage) {
            this.primaryLanguage = primaryLanguage;
            return this;
        }

        public Builder governmentCode(String governmentCode) {
            this.governmentCode = governmentCode;
            return this;
        }

        public IngestRequest build() {
            return new IngestRequest(tenantId, level, parentId, names, primaryLanguage, governmentCode);
        }
    }
}
