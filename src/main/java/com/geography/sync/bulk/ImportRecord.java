package com.geography.sync.bulk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Map;

/**
 * One line of a JSON Lines import.
 *
 * @param ref       identifier of the record within the stream
 * @param parentRef {@code ref} of an earlier record in the same stream
 * @param parentId  id of a tenant unit that already exists; used when {@code parentRef} is absent
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ImportRecord(String ref, String parentRef, String parentId, String tenantId, int level,
                           Map<String, String> names, String primaryLanguage, String governmentCode) {
}
