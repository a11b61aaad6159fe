package com.document.classification.core.model;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * The closed, immutable set of categories for a run.
 * Built once at startup and shared by all workers without synchronization.
 * Iteration is always in ascending name order.
 */
public final class CategorySet {

    private final Map<String, Category> byName;
    private final List<String> names;
    private final int centroidDimension;

    private CategorySet(Map<String, Category> byName, int centroidDimension) {
        this.byName = Collections.unmodifiableMap(byName);
        this.names = List.copyOf(byName.keySet());
        this.centroidDimension = centroidDimension;
    }

    /**
     * Creates a category set, checking that names are unique and centroids share one dimension.
     *
     * @throws IllegalArgumentException when the categories are inconsistent
     */
    public static CategorySet of(Collection<Category> categories) {
        if (categories == null || categories.isEmpty()) {
            throw new IllegalArgumentException("At least one category is required");
        }
        TreeMap<String, Category> map = new TreeMap<>();
        int dimension = 0;
        for (Category category : categories) {
            if (map.put(category.name(), category) != null) {
                throw new IllegalArgumentException("Duplicate category name: " + category.name());
            }
            if (category.hasCentroid()) {
                int length = category.centroid().length;
                if (dimension == 0) {
                    dimension = length;
                } else if (dimension != length) {
                    throw new IllegalArgumentException("Centroid dimension mismatch for category '"
                            + category.name() + "': expected " + dimension + ", got " + length);
                }
            }
        }
        return new CategorySet(map, dimension);
    }

    public static CategorySet of(Category... categories) {
        return of(List.of(categories));
    }

    /**
     * Category names in ascending lexicographic order.
     */
    public List<String> names() {
        return names;
    }

    public Collection<Category> categories() {
        return byName.values();
    }

    public Optional<Category> get(String name) {
        return Optional.ofNullable(byName.get(name));
    }

    public boolean contains(String name) {
        return name != null && byName.containsKey(name);
    }

    public int size() {
        return byName.size();
    }

    /**
     * Dimension shared by all configured centroids, or 0 when none is configured.
     */
    public int centroidDimension() {
        return centroidDimension;
    }

    public boolean hasCentroids() {
        return centroidDimension > 0;
    }

    @Override
    public String toString() {
        return "CategorySet{names=" + names + ", centroidDimension=" + centroidDimension + '}';
    }
}
