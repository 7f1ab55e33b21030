package com.project.raster.segmentation.model;

import com.project.raster.segmentation.exceptions.InvalidConfigurationException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.TreeMap;

/**
 * Immutable catalogue of models, keyed by name and then revision.
 * Revisions are calendar strings, so the lexicographically greatest one is the latest.
 */
public class ModelRegistry {

    private final Map<String, NavigableMap<String, ModelConfig>> models;

    public ModelRegistry(List<ModelConfig> configs) {
        Map<String, NavigableMap<String, ModelConfig>> byName = new TreeMap<>();
        for (ModelConfig config : configs) {
            config.validate();
            NavigableMap<String, ModelConfig> revisions = byName.computeIfAbsent(config.name(), n -> new TreeMap<>());
            if (revisions.putIfAbsent(config.revision(), config) != null) {
                throw new InvalidConfigurationException("Duplicate model revision " + config.id());
            }
        }
        byName.replaceAll((name, revisions) -> Collections.unmodifiableNavigableMap(revisions));
        this.models = Collections.unmodifiableMap(byName);
    }

    /**
     * @param revision a specific revision, or {@code null} / blank for the latest one
     */
    public ModelConfig resolve(String name, String revision) {
        NavigableMap<String, ModelConfig> revisions = revisionsOf(name);
        if (revision == null || revision.isBlank()) {
            return revisions.lastEntry().getValue();
        }
        ModelConfig config = revisions.get(revision);
        if (config == null) {
            throw new InvalidConfigurationException("Unknown revision '" + revision + "' of model '" + name
                    + "'. Available revisions: " + revisions.keySet());
        }
        return config;
    }

    /** Every revision of {@code name}, latest first. */
    public List<ModelConfig> revisions(String name) {
        return new ArrayList<>(revisionsOf(name).descendingMap().values());
    }

    public boolean contains(String name) {
        return models.containsKey(name);
    }

    /** Latest revision of every model, ordered by name. */
    public List<ModelConfig> latest() {
        List<ModelConfig> latest = new ArrayList<>();
        models.values().forEach(revisions -> latest.add(revisions.lastEntry().getValue()));
        return latest;
    }

    /** Every registered revision, ordered by name and revision. */
    public List<ModelConfig> all() {
        List<ModelConfig> all = new ArrayList<>();
        models.values().forEach(revisions -> all.addAll(revisions.values()));
        return all;
    }

    public boolean isEmpty() {
        return models.isEmpty();
    }

    private NavigableMap<String, ModelConfig> revisionsOf(String name) {
        NavigableMap<String, ModelConfig> revisions = models.get(name);
        if (revisions == null) {
            throw new InvalidConfigurationException("Unknown model '" + name + "'. Available models: " + models.keySet());
        }
        return revisions;
    }
}
