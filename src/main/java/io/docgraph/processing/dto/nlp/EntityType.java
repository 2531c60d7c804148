package io.docgraph.processing.dto.nlp;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * Coarse entity type. Tags coming from an NER collaborator are mapped here once;
 * anything unrecognised becomes {@link #UNKNOWN} instead of being dropped.
 */
public enum EntityType {
    @JsonProperty("PERSON")
    PERSON,

    @JsonProperty("ORGANIZATION")
    ORGANIZATION,

    @JsonProperty("LOCATION")
    LOCATION,

    @JsonProperty("DATE")
    DATE,

    @JsonProperty("MISC")
    MISC,

    @JsonProperty("UNKNOWN")
    UNKNOWN;

    public static EntityType fromTag(String tag) {
        if (tag == null || tag.isBlank()) {
            return UNKNOWN;
        }
        return switch (tag.trim().toUpperCase(Locale.ROOT)) {
            case "PERSON", "PER" -> PERSON;
            case "ORGANIZATION", "ORG" -> ORGANIZATION;
            case "LOCATION", "LOC", "GPE", "CITY", "COUNTRY", "STATE_OR_PROVINCE", "FAC" -> LOCATION;
            case "DATE", "TIME" -> DATE;
            case "MISC", "PRODUCT", "EVENT", "WORK_OF_ART", "LAW", "LANGUAGE",
                 "NATIONALITY", "NORP", "RELIGION", "IDEOLOGY", "TITLE" -> MISC;
            default -> UNKNOWN;
        };
    }
}
