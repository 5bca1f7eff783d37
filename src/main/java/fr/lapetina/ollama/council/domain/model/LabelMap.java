package fr.lapetina.ollama.council.domain.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Bijection between labels and advisor identities for one Stage 2 invocation.
 * Iteration order is label assignment order, which is Stage 1 output order.
 * Immutable and thread-safe.
 */
public final class LabelMap {

    private static final LabelMap EMPTY = new LabelMap(new LinkedHashMap<>());

    private final Map<Label, String> labelToModel;
    private final Map<String, Label> modelToLabel;

    private LabelMap(LinkedHashMap<Label, String> labelToModel) {
        this.labelToModel = Collections.unmodifiableMap(labelToModel);
        Map<String, Label> reverse = new HashMap<>();
        labelToModel.forEach((label, model) -> {
            if (reverse.put(model, label) != null) {
                throw new IllegalArgumentException("Model labeled twice: " + model);
            }
        });
        this.modelToLabel = Collections.unmodifiableMap(reverse);
    }

    /**
     * Assigns sequential labels to the given responses, in order.
     */
    public static LabelMap assign(List<AdvisorResponse> responses) {
        LinkedHashMap<Label, String> map = new LinkedHashMap<>();
        for (int i = 0; i < responses.size(); i++) {
            map.put(Label.ofIndex(i), responses.get(i).model());
        }
        return new LabelMap(map);
    }

    public static LabelMap empty() {
        return EMPTY;
    }

    public Optional<String> resolve(Label label) {
        return Optional.ofNullable(labelToModel.get(label));
    }

    public Optional<Label> labelFor(String model) {
        return Optional.ofNullable(modelToLabel.get(model));
    }

    public List<Label> labels() {
        return List.copyOf(labelToModel.keySet());
    }

    public List<String> models() {
        return List.copyOf(labelToModel.values());
    }

    public int size() {
        return labelToModel.size();
    }

    public boolean isEmpty() {
        return labelToModel.isEmpty();
    }

    /**
     * Label text to model, in assignment order. This is the wire shape of the map.
     */
    @JsonValue
    public Map<String, String> asMap() {
        Map<String, String> map = new LinkedHashMap<>();
        labelToModel.forEach((label, model) -> map.put(label.value(), model));
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LabelMap)) return false;
        LabelMap other = (LabelMap) o;
        return labels().equals(other.labels()) && labelToModel.equals(other.labelToModel);
    }

    @Override
    public int hashCode() {
        return labelToModel.hashCode();
    }

    @Override
    public String toString() {
        return "LabelMap" + asMap();
    }
}
