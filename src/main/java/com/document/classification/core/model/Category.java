package com.document.classification.core.model;

import com.document.classification.rules.Rule;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A configured classification target: a name, its rules and an optional
 * precomputed centroid embedding.
 */
public record Category(String name, String description, List<Rule> rules, float[] centroid) {

    public Category {
        Objects.requireNonNull(name, "name is required");
        description = description != null ? description : "";
        rules = rules != null ? List.copyOf(rules) : List.of();
        centroid = centroid != null ? centroid.clone() : null;
    }

    public Category(String name, List<Rule> rules) {
        this(name, null, rules, null);
    }

    public boolean hasCentroid() {
        return centroid != null;
    }

    /**
     * Returns a copy of the centroid, or {@code null} when none was configured.
     */
    @Override
    public float[] centroid() {
        return centroid != null ? centroid.clone() : null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Category that = (Category) o;
        return name.equals(that.name)
                && description.equals(that.description)
                && rules.equals(that.rules)
                && Arrays.equals(centroid, that.centroid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, rules, Arrays.hashCode(centroid));
    }

    @Override
    public String toString() {
        return "Category{" +
                "name='" + name + '\'' +
                ", rules=" + rules.size() +
                ", centroidDimension=" + (centroid != null ? centroid.length : 0) +
                '}';
    }
}
