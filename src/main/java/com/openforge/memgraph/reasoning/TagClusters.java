package com.openforge.memgraph.reasoning;

import com.openforge.memgraph.model.MemoryNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Groups nodes that share the same key or at least two tags (transitively, via union-find).
 */
final class TagClusters {

    static final int MIN_SHARED_TAGS = 2;

    private TagClusters() {}

    /** Clusters with two or more members, largest first. */
    static List<List<MemoryNode>> of(List<MemoryNode> nodes) {
        int n = nodes.size();
        int[] parent = new int[n];
        for (int i = 0; i < n; i++) parent[i] = i;

        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (linked(nodes.get(i), nodes.get(j))) union(parent, i, j);
            }
        }

        Map<Integer, List<MemoryNode>> groups = new LinkedHashMap<>();
        for (int i = 0; i < n; i++) {
            groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>()).add(nodes.get(i));
        }
        List<List<MemoryNode>> out = new ArrayList<>();
        for (List<MemoryNode> g : groups.values()) {
            if (g.size() >= 2) out.add(g);
        }
        out.sort(Comparator.comparingInt((List<MemoryNode> g) -> g.size()).reversed());
        return out;
    }

    static boolean linked(MemoryNode a, MemoryNode b) {
        if (a.key() != null && b.key() != null && !a.key().isBlank()
                && a.key().trim().equalsIgnoreCase(b.key().trim())) {
            return true;
        }
        Set<String> tagsA = normalize(a.tags());
        int shared = 0;
        for (String t : normalize(b.tags())) {
            if (tagsA.contains(t) && ++shared >= MIN_SHARED_TAGS) return true;
        }
        return false;
    }

    private static Set<String> normalize(Set<String> tags) {
        Set<String> out = new HashSet<>();
        for (String t : tags) {
            if (t != null && !t.isBlank()) out.add(t.trim().toLowerCase(Locale.ROOT));
        }
        return out;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int ra = find(parent, a);
        int rb = find(parent, b);
        if (ra != rb) parent[rb] = ra;
    }
}
