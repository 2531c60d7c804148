package io.docgraph.processing.service.nlp;

import edu.stanford.nlp.pipeline.StanfordCoreNLP;
import io.docgraph.processing.config.ProcessingConfig;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Properties;

/**
 * Process-wide Stanford CoreNLP pipelines, built on first use and never modified afterwards.
 * {@link StanfordCoreNLP#annotate} is safe for concurrent callers, so every analysis worker shares them.
 */
@Component
public class CoreNlpPipelineProvider {

    private static final Logger logger = LoggerFactory.getLogger(CoreNlpPipelineProvider.class);

    private final ProcessingConfig config;

    private volatile StanfordCoreNLP nerPipeline;
    private volatile StanfordCoreNLP parsePipeline;

    public CoreNlpPipelineProvider(ProcessingConfig config) {
        this.config = config;
    }

    public StanfordCoreNLP nerPipeline() {
        StanfordCoreNLP pipeline = nerPipeline;
        if (pipeline == null) {
            synchronized (this) {
                pipeline = nerPipeline;
                if (pipeline == null) {
                    pipeline = create("NER", nerProperties());
                    nerPipeline = pipeline;
                }
            }
        }
        return pipeline;
    }

    public StanfordCoreNLP parsePipeline() {
        StanfordCoreNLP pipeline = parsePipeline;
        if (pipeline == null) {
            synchronized (this) {
                pipeline = parsePipeline;
                if (pipeline == null) {
                    pipeline = create("dependency parse", parseProperties());
                    parsePipeline = pipeline;
                }
            }
        }
        return pipeline;
    }

    public boolean isReady() {
        return nerPipeline != null && parsePipeline != null;
    }

    Properties nerProperties() {
        Properties props = new Properties();
        props.setProperty("annotators", String.join(",", config.nlp().stanford().nerAnnotators()));
        props.setProperty("ner.language", "english");
        props.setProperty("ner.applyFineGrained", "false");
        props.setProperty("ner.useSUTime", String.valueOf(config.nlp().stanford().useSuTime()));
        props.setProperty("ner.buildEntityMentions", "true");
        props.setProperty("timeout", String.valueOf(config.nlp().stanford().timeout() * 1000));
        return props;
    }

    Properties parseProperties() {
        Properties props = new Properties();
        props.setProperty("annotators", String.join(",", config.nlp().stanford().parseAnnotators()));
        // Sentence boundaries come from TextNormalizer
        props.setProperty("ssplit.isOneSentence", "true");
        props.setProperty("timeout", String.valueOf(config.nlp().stanford().timeout() * 1000));
        return props;
    }

    private StanfordCoreNLP create(String purpose, Properties props) {
        long startTime = System.currentTimeMillis();
        logger.info("Initializing Stanford CoreNLP {} pipeline with annotators: {}",
                purpose, props.getProperty("annotators"));

        StanfordCoreNLP pipeline = new StanfordCoreNLP(props);

        logger.info("Stanford CoreNLP {} pipeline ready in {}ms", purpose, System.currentTimeMillis() - startTime);
        return pipeline;
    }

    @PreDestroy
    public void cleanup() {
        if (nerPipeline != null || parsePipeline != null) {
            logger.info("Releasing Stanford CoreNLP pipelines");
            nerPipeline = null;
            parsePipeline = null;
        }
    }
}
