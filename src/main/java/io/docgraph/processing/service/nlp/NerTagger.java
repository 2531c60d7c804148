package io.docgraph.processing.service.nlp;

import io.docgraph.processing.dto.nlp.EntityMention;

import java.util.List;

/**
 * Named-entity recognition collaborator. Mention spans index into the text passed in.
 */
public interface NerTagger {

    List<EntityMention> tag(String text);
}
