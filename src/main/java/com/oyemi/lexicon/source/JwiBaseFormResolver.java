package com.oyemi.lexicon.source;

import edu.mit.jwi.IDictionary;
import edu.mit.jwi.item.POS;
import edu.mit.jwi.morph.IStemmer;
import edu.mit.jwi.morph.WordnetStemmer;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Noun base forms from WordNet's morphological rules and exception lists.
 * When several stems exist the shortest wins.
 */
@Slf4j
public class JwiBaseFormResolver implements BaseFormResolver {

    private final IStemmer stemmer;

    public JwiBaseFormResolver(IDictionary dictionary) {
        this.stemmer = new WordnetStemmer(dictionary);
    }

    @Override
    public String baseForm(String word) {
        try {
            List<String> stems = stemmer.findStems(word, POS.NOUN);
            String shortest = word;
            boolean found = false;
            for (String stem : stems) {
                if (!found || stem.length() < shortest.length()) {
                    shortest = stem;
                    found = true;
                }
            }
            return shortest;
        } catch (RuntimeException e) {
            log.debug("Stemming failed for '{}': {}", word, e.getMessage());
            return word;
        }
    }
}
