package io.docgraph.processing.dto.nlp;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Result of entity extraction: canonical entities plus the mentions behind them.
 * {@code mentionEntityIds.get(i)} is the entity id of {@code mentions.get(i)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EntityExtractionResult(
        @JsonProperty("entities") List<CanonicalEntity> entities,
        @JsonProperty("mentions") List<EntityMention> mentions,
        @JsonProperty("mentionEntityIds") List<String> mentionEntityIds,
        @JsonProperty("discardedMentions") List<EntityMention> discardedMentions,
        @JsonProperty("processingTimeMs") long processingTimeMs
) {

    public EntityExtractionResult {
        entities = List.copyOf(entities);
        mentions = List.copyOf(mentions);
        mentionEntityIds = List.copyOf(mentionEntityIds);
        discardedMentions = List.copyOf(discardedMentions);
        if (mentions.size() != mentionEntityIds.size()) {
            throw new IllegalArgumentException("Every mention needs exactly one entity id");
        }
    }

    /**
     * Create empty result for error cases
     */
    public static EntityExtractionResult empty() {
        return new EntityExtractionResult(Collections.emptyList(), Collections.emptyList(),
                Collections.emptyList(), Collections.emptyList(), 0);
    }

    @JsonIgnore
    public Map<EntityType, List<CanonicalEntity>> getEntitiesByType() {
        return entities.stream()
                .collect(Collectors.groupingBy(CanonicalEntity::type));
    }

    /**
     * Get summary statistics
     */
    public EntityExtractionSummary getSummary() {
        Map<EntityType, List<CanonicalEntity>> byType = getEntitiesByType();

        return new EntityExtractionSummary(
                entities.size(),
                mentions.size(),
                discardedMentions.size(),
                byType.getOrDefault(EntityType.PERSON, Collections.emptyList()).size(),
                byType.getOrDefault(EntityType.ORGANIZATION, Collections.emptyList()).size(),
                byType.getOrDefault(EntityType.LOCATION, Collections.emptyList()).size(),
                processingTimeMs
        );
    }

    public record EntityExtractionSummary(
            @JsonProperty("totalEntities") int totalEntities,
            @JsonProperty("totalMentions") int totalMentions,
            @JsonProperty("discardedMentions") int discardedMentions,
            @JsonProperty("persons") int persons,
            @JsonProperty("organizations") int organizations,
            @JsonProperty("locations") int locations,
            @JsonProperty("processingTimeMs") long processingTimeMs
    ) {}
}
