package io.docgraph.processing.service.nlp;

import io.docgraph.processing.config.NlpConfig;
import io.docgraph.processing.config.ProcessingConfig;
import io.docgraph.processing.dto.analysis.PipelineStage;
import io.docgraph.processing.dto.nlp.CanonicalEntity;
import io.docgraph.processing.dto.nlp.EntityExtractionResult;
import io.docgraph.processing.dto.nlp.EntityMention;
import io.docgraph.processing.dto.nlp.EntityType;
import io.docgraph.processing.dto.text.NormalizedText;
import io.docgraph.processing.dto.text.TextSpan;
import io.docgraph.processing.exception.ExtractionFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs NER over the normalized text and merges the mentions into canonical entities.
 */
@Service
public class EntityExtractor {

    private static final Logger logger = LoggerFactory.getLogger(EntityExtractor.class);

    private final NerTagger nerTagger;
    private final NlpConfig.Entities settings;
    private final EntityMerger merger;

    public EntityExtractor(NerTagger nerTagger, ProcessingConfig config) {
        this.nerTagger = nerTagger;
        this.settings = config.nlp().entities();
        this.merger = new EntityMerger(settings);
    }

    public EntityExtractionResult extract(NormalizedText text) {
        long startTime = System.currentTimeMillis();

        List<EntityMention> tagged;
        try {
            tagged = nerTagger.tag(text.text());
        } catch (RuntimeException e) {
            throw new ExtractionFailureException(PipelineStage.ENTITIES, "NER tagging failed: " + e.getMessage(), e);
        }

        List<EntityMention> mentions = resolveOverlaps(validate(tagged, text));
        List<List<Integer>> groups = merger.group(mentions);

        List<CanonicalEntity> entities = new ArrayList<>();
        List<String> entityIds = new ArrayList<>(mentions.size());
        mentions.forEach(mention -> entityIds.add(null));
        List<EntityMention> discarded = new ArrayList<>();

        for (List<Integer> group : groups) {
            List<EntityMention> members = group.stream().map(mentions::get).toList();
            String label = selectLabel(members);
            EntityType type = selectType(members);

            if (isNoise(members, label, type)) {
                discarded.addAll(members);
                continue;
            }

            String id = "e" + (entities.size() + 1);
            Set<String> surfaceForms = new LinkedHashSet<>();
            members.forEach(member -> surfaceForms.add(member.text()));

            entities.add(new CanonicalEntity(
                    id,
                    label,
                    type,
                    members.stream().map(EntityMention::span).toList(),
                    surfaceForms
            ));
            group.forEach(index -> entityIds.set(index, id));
        }

        List<EntityMention> kept = new ArrayList<>();
        List<String> keptIds = new ArrayList<>();
        for (int i = 0; i < mentions.size(); i++) {
            if (entityIds.get(i) != null) {
                kept.add(mentions.get(i));
                keptIds.add(entityIds.get(i));
            }
        }

        long processingTime = System.currentTimeMillis() - startTime;
        logger.debug("Merged {} mentions into {} entities ({} discarded as noise) in {}ms",
                mentions.size(), entities.size(), discarded.size(), processingTime);

        return new EntityExtractionResult(entities, kept, keptIds, discarded, processingTime);
    }

    /**
     * Collaborator output is re-anchored on the normalized text: the surface form is read from the
     * span, out-of-bounds or over-long mentions are dropped and missing types become UNKNOWN.
     */
    private List<EntityMention> validate(List<EntityMention> tagged, NormalizedText text) {
        List<EntityMention> valid = new ArrayList<>();
        if (tagged == null) {
            return valid;
        }
        int length = text.text().length();
        for (EntityMention mention : tagged) {
            if (mention == null || mention.span() == null || mention.span().end() > length) {
                logger.debug("Dropping mention outside the document: {}", mention);
                continue;
            }
            TextSpan span = trim(text.text(), mention.span());
            if (span.length() == 0 || span.length() > settings.maxSurfaceLength()) {
                continue;
            }
            EntityType type = mention.type() == null ? EntityType.UNKNOWN : mention.type();
            valid.add(new EntityMention(text.slice(span), span, type));
        }
        return valid;
    }

    private TextSpan trim(String text, TextSpan span) {
        int begin = span.begin();
        int end = span.end();
        while (begin < end && Character.isWhitespace(text.charAt(begin))) {
            begin++;
        }
        while (end > begin && Character.isWhitespace(text.charAt(end - 1))) {
            end--;
        }
        return new TextSpan(begin, end);
    }

    /**
     * Of two overlapping mentions the longer wins, the earlier one on equal length.
     */
    private List<EntityMention> resolveOverlaps(List<EntityMention> mentions) {
        List<EntityMention> byPreference = new ArrayList<>(mentions);
        byPreference.sort(Comparator.comparingInt((EntityMention mention) -> mention.span().length()).reversed()
                .thenComparing(EntityMention::span));

        List<EntityMention> kept = new ArrayList<>();
        for (EntityMention candidate : byPreference) {
            if (kept.stream().noneMatch(existing -> existing.span().overlaps(candidate.span()))) {
                kept.add(candidate);
            }
        }
        kept.sort(Comparator.comparing(EntityMention::span));
        return kept;
    }

    /**
     * Most frequent surface form; ties go to the longer string, then to the earliest occurrence.
     */
    private String selectLabel(List<EntityMention> members) {
        Map<String, Integer> counts = new LinkedHashMap<>();
        members.forEach(member -> counts.merge(member.text(), 1, Integer::sum));

        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            String surface = entry.getKey();
            int count = entry.getValue();
            if (best == null || count > bestCount || (count == bestCount && surface.length() > best.length())) {
                best = surface;
                bestCount = count;
            }
        }
        return best;
    }

    private EntityType selectType(List<EntityMention> members) {
        Map<EntityType, Integer> counts = new EnumMap<>(EntityType.class);
        members.forEach(member -> counts.merge(member.type(), 1, Integer::sum));
        return EntityMerger.dominantType(counts);
    }

    private boolean isNoise(List<EntityMention> members, String label, EntityType type) {
        return members.size() == 1
                && type == EntityType.MISC
                && label.length() < settings.minSurfaceLength();
    }
}
