package com.openforge.memgraph.store;

import java.util.List;

public final class VectorMath {

    private VectorMath() {}

    /** Cosine similarity; 0 when either vector is missing, empty, zero or of a different length. */
    public static double cosine(List<Float> a, List<Float> b) {
        if (a == null || b == null || a.isEmpty() || a.size() != b.size()) return 0.0;
        double dot = 0, na = 0, nb = 0;
        for (int i = 0; i < a.size(); i++) {
            double x = a.get(i);
            double y = b.get(i);
            dot += x * y;
            na  += x * x;
            nb  += y * y;
        }
        if (na == 0 || nb == 0) return 0.0;
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
