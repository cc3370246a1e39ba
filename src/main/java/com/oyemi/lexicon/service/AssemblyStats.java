package com.oyemi.lexicon.service;

import com.oyemi.lexicon.model.Valence;
import com.oyemi.lexicon.model.ValenceStrength;
import lombok.Getter;

import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Per-concept counters gathered while encoding.
 */
@Getter
public class AssemblyStats {

    private int concepts;
    private int fallbackConcepts;
    private int orderSensitiveConcepts;
    private int degradedConcepts;
    private int droppedSurfaceForms;
    private final Map<Valence, Integer> valenceDistribution = new EnumMap<>(Valence.class);
    private final Map<ValenceStrength, Integer> strengthDistribution = new EnumMap<>(ValenceStrength.class);
    private final Map<String, Integer> conceptsPerSuperclass = new TreeMap<>();

    void recordConcept(SuperclassAssignment superclass, Valence valence, ValenceStrength strength) {
        concepts++;
        if (!superclass.specific()) {
            fallbackConcepts++;
        }
        if (superclass.orderSensitive()) {
            orderSensitiveConcepts++;
        }
        valenceDistribution.merge(valence, 1, Integer::sum);
        strengthDistribution.merge(strength, 1, Integer::sum);
        conceptsPerSuperclass.merge(superclass.code(), 1, Integer::sum);
    }

    void recordDegradedConcept() {
        degradedConcepts++;
    }

    void recordDroppedSurfaceForm() {
        droppedSurfaceForms++;
    }
}
