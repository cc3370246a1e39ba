package com.oyemi.lexicon.source;

import com.oyemi.lexicon.model.HypernymPath;

import java.util.ArrayList;
import java.util.BitSet;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Hypernym DAG stored as an arena: concepts are int indices, parent links are index lists.
 * <p>
 * Multiple inheritance gives a concept several paths to a root. Paths are enumerated
 * in parent order, depth first, the same way WordNet tooling traditionally lists
 * them, and each returned path starts at the concept and ends at a root.
 */
public class HypernymGraph {

    private static final int[] NO_PARENTS = new int[0];

    private final List<String> ids = new ArrayList<>();
    private final Map<String, Integer> indexById = new HashMap<>();
    private final List<int[]> parents = new ArrayList<>();

    public int add(String id) {
        Integer existing = indexById.get(id);
        if (existing != null) {
            return existing;
        }
        int index = ids.size();
        ids.add(id);
        indexById.put(id, index);
        parents.add(NO_PARENTS);
        return index;
    }

    public void link(int child, int parent) {
        int[] current = parents.get(child);
        int[] extended = new int[current.length + 1];
        System.arraycopy(current, 0, extended, 0, current.length);
        extended[current.length] = parent;
        parents.set(child, extended);
    }

    public int indexOf(String id) {
        Integer index = indexById.get(id);
        if (index == null) {
            throw new IllegalArgumentException("Unknown concept: " + id);
        }
        return index;
    }

    public String idOf(int index) {
        return ids.get(index);
    }

    public int size() {
        return ids.size();
    }

    public List<HypernymPath> paths(int node) {
        List<int[]> rootFirst = rootFirstPaths(node, new BitSet());
        List<HypernymPath> result = new ArrayList<>(rootFirst.size());
        for (int[] path : rootFirst) {
            List<String> ancestors = new ArrayList<>(path.length);
            for (int i = path.length - 1; i >= 0; i--) {
                ancestors.add(ids.get(path[i]));
            }
            result.add(new HypernymPath(ancestors));
        }
        return result;
    }

    public List<HypernymPath> paths(String id) {
        return paths(indexOf(id));
    }

    private List<int[]> rootFirstPaths(int node, BitSet onStack) {
        if (onStack.get(node)) {
            throw new IllegalStateException("Hypernym cycle through " + ids.get(node));
        }
        int[] nodeParents = parents.get(node);
        List<int[]> paths = new ArrayList<>();
        if (nodeParents.length == 0) {
            paths.add(new int[]{node});
            return paths;
        }
        onStack.set(node);
        for (int parent : nodeParents) {
            for (int[] ancestorPath : rootFirstPaths(parent, onStack)) {
                int[] path = new int[ancestorPath.length + 1];
                System.arraycopy(ancestorPath, 0, path, 0, ancestorPath.length);
                path[ancestorPath.length] = node;
                paths.add(path);
            }
        }
        onStack.clear(node);
        return paths;
    }
}
