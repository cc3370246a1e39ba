package com.oyemi.lexicon.source;

import com.oyemi.lexicon.config.LexiconProperties;
import edu.mit.jwi.IDictionary;
import edu.mit.jwi.RAMDictionary;
import edu.mit.jwi.data.ILoadPolicy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.File;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Wires the WordNet and SentiWordNet collaborators from configured locations.
 */
@Slf4j
@Configuration
public class KnowledgeBaseConfig {

    @Bean(destroyMethod = "close")
    public IDictionary wordNetDictionary(LexiconProperties properties) throws IOException {
        File dir = new File(properties.getWordnetDir());
        if (!dir.isDirectory()) {
            throw new IllegalStateException("WordNet dictionary directory not found: " + dir.getAbsolutePath());
        }
        IDictionary dictionary = new RAMDictionary(dir, ILoadPolicy.IMMEDIATE_LOAD);
        dictionary.open();
        log.info("Opened WordNet dictionary at {}", dir.getAbsolutePath());
        return dictionary;
    }

    @Bean
    public SentiWordNetIndex sentiWordNetIndex(LexiconProperties properties) {
        return SentiWordNetIndex.load(Path.of(properties.getSentiWordNetFile()));
    }

    @Bean
    public KnowledgeBase knowledgeBase(IDictionary wordNetDictionary, SentiWordNetIndex sentiWordNetIndex) {
        return new JwiKnowledgeBase(wordNetDictionary, sentiWordNetIndex);
    }

    @Bean
    public BaseFormResolver baseFormResolver(IDictionary wordNetDictionary) {
        return new JwiBaseFormResolver(wordNetDictionary);
    }
}
