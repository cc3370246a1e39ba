package com.oyemi.lexicon.source;

import com.oyemi.lexicon.model.Concept;
import com.oyemi.lexicon.model.HypernymPath;
import com.oyemi.lexicon.model.Lemma;
import com.oyemi.lexicon.model.PartOfSpeech;
import com.oyemi.lexicon.model.SentimentScore;
import edu.mit.jwi.IDictionary;
import edu.mit.jwi.item.IIndexWord;
import edu.mit.jwi.item.ISenseEntry;
import edu.mit.jwi.item.ISynset;
import edu.mit.jwi.item.ISynsetID;
import edu.mit.jwi.item.IWord;
import edu.mit.jwi.item.IWordID;
import edu.mit.jwi.item.POS;
import edu.mit.jwi.item.Pointer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * WordNet, read through MIT JWI, joined with SentiWordNet scores.
 * <p>
 * Concept identifiers follow the {@code lemma.pos.NN} convention: the first lemma of
 * the synset, the POS letter ({@code s} for satellite adjectives) and the synset's
 * sense number for that lemma. Concepts are enumerated noun, verb, adjective, adverb,
 * each in synset offset order.
 */
@Slf4j
public class JwiKnowledgeBase implements KnowledgeBase {

    private final IDictionary dictionary;
    private final SentiWordNetIndex sentiment;

    private HypernymGraph graph;
    private Map<ISynsetID, Integer> nodeBySynset;
    private List<ISynset> synsets;

    public JwiKnowledgeBase(IDictionary dictionary, SentiWordNetIndex sentiment) {
        this.dictionary = dictionary;
        this.sentiment = sentiment;
    }

    @Override
    public Stream<Concept> concepts() {
        ensureGraph();
        return synsets.stream().map(this::toConcept);
    }

    private synchronized void ensureGraph() {
        if (graph != null) {
            return;
        }
        List<ISynset> ordered = new ArrayList<>();
        for (PartOfSpeech pos : PartOfSpeech.values()) {
            List<ISynset> ofPos = new ArrayList<>();
            Iterator<ISynset> iterator = dictionary.getSynsetIterator(toJwi(pos));
            iterator.forEachRemaining(ofPos::add);
            ofPos.sort(Comparator.comparingInt(ISynset::getOffset));
            ordered.addAll(ofPos);
        }

        HypernymGraph built = new HypernymGraph();
        Map<ISynsetID, Integer> nodes = new HashMap<>();
        for (ISynset synset : ordered) {
            nodes.put(synset.getID(), built.add(conceptId(synset)));
        }
        for (ISynset synset : ordered) {
            int child = nodes.get(synset.getID());
            List<ISynsetID> parents = new ArrayList<>(synset.getRelatedSynsets(Pointer.HYPERNYM));
            parents.addAll(synset.getRelatedSynsets(Pointer.HYPERNYM_INSTANCE));
            for (ISynsetID parent : parents) {
                Integer parentNode = nodes.get(parent);
                if (parentNode != null) {
                    built.link(child, parentNode);
                }
            }
        }

        log.info("Indexed {} WordNet synsets into the hypernym graph", ordered.size());
        this.synsets = ordered;
        this.nodeBySynset = nodes;
        this.graph = built;
    }

    private Concept toConcept(ISynset synset) {
        PartOfSpeech pos = PartOfSpeech.fromTag(synset.getPOS().getTag());
        int node = nodeBySynset.get(synset.getID());
        String id = graph.idOf(node);

        boolean degraded = false;
        List<HypernymPath> paths;
        try {
            paths = graph.paths(node);
        } catch (RuntimeException e) {
            log.debug("Hypernym traversal failed for {}: {}", id, e.getMessage());
            paths = List.of();
            degraded = true;
        }

        SentimentScore score;
        try {
            score = sentiment.scoreOf(pos, synset.getOffset());
        } catch (RuntimeException e) {
            log.debug("Sentiment lookup failed for {}: {}", id, e.getMessage());
            score = SentimentScore.NONE;
            degraded = true;
        }

        List<IWord> words = synset.getWords();
        List<Lemma> lemmas = new ArrayList<>(words.size());
        for (int ordinal = 0; ordinal < words.size(); ordinal++) {
            IWord word = words.get(ordinal);
            lemmas.add(new Lemma(word.getLemma(), frequencyOf(word), antonymsOf(word), ordinal));
        }
        return new Concept(id, pos, paths, score, lemmas, degraded);
    }

    String conceptId(ISynset synset) {
        IWord first = synset.getWords().get(0);
        String lemma = first.getLemma().toLowerCase(Locale.ROOT);
        char tag = synset.isAdjectiveSatellite() ? 's' : synset.getPOS().getTag();
        int senseNumber = 1;
        IIndexWord indexWord = dictionary.getIndexWord(lemma, synset.getPOS());
        if (indexWord != null) {
            List<IWordID> senses = indexWord.getWordIDs();
            for (int i = 0; i < senses.size(); i++) {
                if (senses.get(i).getSynsetID().equals(synset.getID())) {
                    senseNumber = i + 1;
                    break;
                }
            }
        }
        return String.format("%s.%s.%02d", lemma, tag, senseNumber);
    }

    private int frequencyOf(IWord word) {
        try {
            ISenseEntry entry = dictionary.getSenseEntry(word.getSenseKey());
            return entry == null ? 0 : entry.getTagCount();
        } catch (RuntimeException e) {
            log.debug("No sense entry for {}: {}", word.getLemma(), e.getMessage());
            return 0;
        }
    }

    private List<String> antonymsOf(IWord word) {
        List<IWordID> related = word.getRelatedWords(Pointer.ANTONYM);
        if (related.isEmpty()) {
            return List.of();
        }
        List<String> antonyms = new ArrayList<>(related.size());
        for (IWordID id : related) {
            IWord antonym = dictionary.getWord(id);
            if (antonym != null) {
                antonyms.add(antonym.getLemma());
            }
        }
        return antonyms;
    }

    static POS toJwi(PartOfSpeech pos) {
        return switch (pos) {
            case NOUN -> POS.NOUN;
            case VERB -> POS.VERB;
            case ADJECTIVE -> POS.ADJECTIVE;
            case ADVERB -> POS.ADVERB;
        };
    }
}
