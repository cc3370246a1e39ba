package com.oyemi.lexicon.service;

import com.oyemi.lexicon.config.LexiconProperties;
import com.oyemi.lexicon.entity.AntonymPair;
import com.oyemi.lexicon.entity.LexiconEntry;
import com.oyemi.lexicon.model.AntonymLink;
import com.oyemi.lexicon.model.CodeUpdate;
import com.oyemi.lexicon.model.EncodedSense;
import com.oyemi.lexicon.model.SemanticCode;
import com.oyemi.lexicon.model.Valence;
import com.oyemi.lexicon.repository.AntonymPairRepository;
import com.oyemi.lexicon.repository.LemmaBaseFormRepository;
import com.oyemi.lexicon.repository.LexiconEntryRepository;
import jakarta.persistence.EntityManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LexiconPersistenceServiceTest {

    @Mock
    private LexiconEntryRepository lexiconEntryRepository;

    @Mock
    private LemmaBaseFormRepository lemmaBaseFormRepository;

    @Mock
    private AntonymPairRepository antonymPairRepository;

    @Mock
    private EntityManager entityManager;

    private LexiconPersistenceService service;

    @BeforeEach
    void setUp() {
        LexiconProperties properties = new LexiconProperties();
        properties.setBatchSize(2);
        service = new LexiconPersistenceService(lexiconEntryRepository, lemmaBaseFormRepository,
                antonymPairRepository, entityManager, properties);
    }

    private static EncodedSense sense(String word, String code) {
        return new EncodedSense(word, SemanticCode.parse(code), 10);
    }

    @Test
    @SuppressWarnings("unchecked")
    void testInsertsInBatches() {
        List<EncodedSense> senses = List.of(
                sense("a", "0001-00001-1-1-0"),
                sense("b", "0001-00002-1-1-0"),
                sense("c", "0001-00003-1-1-0"));

        service.insertAll(senses, Map.of(), List.of());

        ArgumentCaptor<List<LexiconEntry>> batches = ArgumentCaptor.forClass(List.class);
        verify(lexiconEntryRepository, times(2)).saveAll(batches.capture());
        assertEquals(2, batches.getAllValues().get(0).size());
        assertEquals("c", batches.getAllValues().get(1).get(0).getWord());
        verify(entityManager, times(2)).clear();
        verify(lemmaBaseFormRepository, never()).saveAll(any());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testStoresBothAntonymDirections() {
        service.insertAll(List.of(), Map.of(), List.of(new AntonymLink("hot", "cold")));

        ArgumentCaptor<List<AntonymPair>> saved = ArgumentCaptor.forClass(List.class);
        verify(antonymPairRepository).saveAll(saved.capture());
        List<AntonymPair> pairs = saved.getValue();
        assertEquals(2, pairs.size());
        assertEquals("hot", pairs.get(0).getWord());
        assertEquals("cold", pairs.get(1).getWord());
        assertEquals("hot", pairs.get(1).getAntonym());
    }

    @Test
    @SuppressWarnings("unchecked")
    void testReciprocalLinksStoreOneRowPerDirection() {
        service.insertAll(List.of(), Map.of(),
                List.of(new AntonymLink("hot", "cold"), new AntonymLink("cold", "hot")));

        ArgumentCaptor<List<AntonymPair>> saved = ArgumentCaptor.forClass(List.class);
        verify(antonymPairRepository).saveAll(saved.capture());
        List<AntonymPair> pairs = saved.getValue();
        assertEquals(2, pairs.size());
        assertNotEquals(pairs.get(0).getWord(), pairs.get(1).getWord());
    }

    @Test
    void testApplyUpdatesCountsRewrittenRows() {
        SemanticCode old = SemanticCode.parse("3999-00002-3-1-0");
        when(lexiconEntryRepository.updateCode("cold", "3999-00002-3-1-0", "3999-00002-3-1-2")).thenReturn(1);
        when(lexiconEntryRepository.updateCode("gone", "3999-00002-3-1-0", "3999-00002-3-1-2")).thenReturn(0);

        int rewritten = service.applyUpdates("antonym-propagation", List.of(
                new CodeUpdate("cold", old, old.withValence(Valence.NEGATIVE)),
                new CodeUpdate("gone", old, old.withValence(Valence.NEGATIVE))));

        assertEquals(1, rewritten);
    }
}
