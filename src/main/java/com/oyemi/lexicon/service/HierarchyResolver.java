package com.oyemi.lexicon.service;

import com.oyemi.lexicon.config.SuperclassTable;
import com.oyemi.lexicon.model.Concept;
import com.oyemi.lexicon.model.HypernymPath;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Maps a concept to its four-digit superclass.
 * <p>
 * Paths are visited in the order the knowledge base enumerates them and each path
 * is scanned from the concept outward. The first path holding any table entry
 * decides; later paths are never consulted for the result, even when they hold a
 * closer ancestor. Such concepts are flagged as order sensitive so the build
 * summary can report how many classifications depend on path enumeration order.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class HierarchyResolver {

    private final SuperclassTable superclassTable;

    public SuperclassAssignment resolve(Concept concept) {
        String fallback = superclassTable.fallback(concept.pos());
        try {
            List<HypernymPath> paths = concept.paths();
            for (int i = 0; i < paths.size(); i++) {
                Optional<Match> match = firstMatch(paths.get(i));
                if (match.isPresent()) {
                    Match winner = match.get();
                    return new SuperclassAssignment(winner.code(), true, winner.ancestor(),
                            isOrderSensitive(winner, paths.subList(i + 1, paths.size())), false);
                }
            }
        } catch (RuntimeException e) {
            log.debug("Hierarchy lookup failed for {}, using fallback {}: {}", concept.id(), fallback, e.getMessage());
            return SuperclassAssignment.degraded(fallback);
        }
        return SuperclassAssignment.fallback(fallback);
    }

    private Optional<Match> firstMatch(HypernymPath path) {
        List<String> ancestors = path.ancestors();
        for (int depth = 0; depth < ancestors.size(); depth++) {
            String ancestor = ancestors.get(depth);
            Optional<String> code = superclassTable.lookup(ancestor);
            if (code.isPresent()) {
                return Optional.of(new Match(ancestor, code.get(), depth));
            }
        }
        return Optional.empty();
    }

    private boolean isOrderSensitive(Match winner, List<HypernymPath> laterPaths) {
        for (HypernymPath path : laterPaths) {
            Optional<Match> other = firstMatch(path);
            if (other.isPresent() && other.get().depth() < winner.depth()
                    && !other.get().code().equals(winner.code())) {
                return true;
            }
        }
        return false;
    }

    private record Match(String ancestor, String code, int depth) {
    }
}
