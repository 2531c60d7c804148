package io.docgraph.processing.service.nlp;

import edu.stanford.nlp.pipeline.CoreDocument;
import edu.stanford.nlp.pipeline.CoreEntityMention;
import edu.stanford.nlp.util.Pair;
import io.docgraph.processing.dto.nlp.EntityMention;
import io.docgraph.processing.dto.nlp.EntityType;
import io.docgraph.processing.dto.text.TextSpan;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class CoreNlpNerTagger implements NerTagger {

    private static final Logger logger = LoggerFactory.getLogger(CoreNlpNerTagger.class);

    private final CoreNlpPipelineProvider pipelineProvider;

    public CoreNlpNerTagger(CoreNlpPipelineProvider pipelineProvider) {
        this.pipelineProvider = pipelineProvider;
    }

    @Override
    public List<EntityMention> tag(String text) {
        CoreDocument document = new CoreDocument(text);
        pipelineProvider.nerPipeline().annotate(document);

        List<EntityMention> mentions = new ArrayList<>();
        for (CoreEntityMention mention : document.entityMentions()) {
            Pair<Integer, Integer> offsets = mention.charOffsets();
            mentions.add(new EntityMention(
                    mention.text(),
                    new TextSpan(offsets.first(), offsets.second()),
                    EntityType.fromTag(mention.entityType())
            ));
        }

        logger.debug("CoreNLP tagged {} entity mentions", mentions.size());
        return mentions;
    }
}
