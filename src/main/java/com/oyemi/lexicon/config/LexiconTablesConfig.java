package com.oyemi.lexicon.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Exposes the curated tables as immutable beans so each resolver receives only what it reads.
 */
@Configuration
public class LexiconTablesConfig {

    @Bean
    public LexiconTables lexiconTables(LexiconProperties properties) {
        return new LexiconTablesLoader().load(properties.getTablesResource());
    }

    @Bean
    public SuperclassTable superclassTable(LexiconTables tables) {
        return tables.superclasses();
    }

    @Bean
    public AbstractnessAnchors abstractnessAnchors(LexiconTables tables) {
        return tables.anchors();
    }

    @Bean
    public ValenceOverrides valenceOverrides(LexiconTables tables) {
        return tables.overrides();
    }
}
