package io.docgraph.processing.service.relation;

import io.docgraph.processing.dto.nlp.EntityMention;
import io.docgraph.processing.dto.text.TextSpan;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Finds the canonical entity whose mention overlaps a character span.
 * Relies on mentions being non-overlapping, which entity extraction guarantees.
 */
class MentionIndex {

    private final NavigableMap<Integer, Entry> byBegin = new TreeMap<>();

    MentionIndex(List<EntityMention> mentions, List<String> entityIds) {
        for (int i = 0; i < mentions.size(); i++) {
            TextSpan span = mentions.get(i).span();
            byBegin.put(span.begin(), new Entry(span, entityIds.get(i)));
        }
    }

    /**
     * @return id of the entity with the largest overlap, the earliest mention on ties
     */
    Optional<String> resolve(TextSpan span) {
        String best = null;
        int bestOverlap = 0;
        for (Map.Entry<Integer, Entry> candidate : byBegin.headMap(span.end(), false).descendingMap().entrySet()) {
            Entry entry = candidate.getValue();
            if (entry.span().end() <= span.begin()) {
                break;
            }
            int overlap = entry.span().overlapLength(span);
            if (overlap > 0 && overlap >= bestOverlap) {
                best = entry.entityId();
                bestOverlap = overlap;
            }
        }
        return Optional.ofNullable(best);
    }

    private record Entry(TextSpan span, String entityId) {}
}
