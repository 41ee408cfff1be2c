package com.architecture.memory.inevitability.model.intervention;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Order-free set of interventions keyed by variable. A later intervention on the same
 * variable replaces the earlier one.
 */
@EqualsAndHashCode
@ToString
public final class InterventionSet {

    private static final InterventionSet EMPTY = new InterventionSet(new TreeMap<>());

    private final SortedMap<String, Intervention> byVariable;

    private InterventionSet(SortedMap<String, Intervention> byVariable) {
        this.byVariable = Collections.unmodifiableSortedMap(byVariable);
    }

    public static InterventionSet empty() {
        return EMPTY;
    }

    public static InterventionSet of(Collection<Intervention> interventions) {
        SortedMap<String, Intervention> map = new TreeMap<>();
        interventions.forEach(i -> map.put(i.getVariable(), i));
        return new InterventionSet(map);
    }

    public static InterventionSet of(Intervention... interventions) {
        return of(List.of(interventions));
    }

    public static InterventionSet fromValues(Map<String, Boolean> values) {
        SortedMap<String, Intervention> map = new TreeMap<>();
        values.forEach((k, v) -> map.put(k, Intervention.of(k, v)));
        return new InterventionSet(map);
    }

    public InterventionSet with(Intervention intervention) {
        SortedMap<String, Intervention> map = new TreeMap<>(byVariable);
        map.put(intervention.getVariable(), intervention);
        return new InterventionSet(map);
    }

    public InterventionSet with(String variable, boolean value) {
        return with(Intervention.of(variable, value));
    }

    public InterventionSet merge(InterventionSet other) {
        SortedMap<String, Intervention> map = new TreeMap<>(byVariable);
        map.putAll(other.byVariable);
        return new InterventionSet(map);
    }

    public boolean isEmpty() {
        return byVariable.isEmpty();
    }

    public int size() {
        return byVariable.size();
    }

    public boolean targets(String variable) {
        return byVariable.containsKey(variable);
    }

    public Boolean valueOf(String variable) {
        Intervention intervention = byVariable.get(variable);
        return intervention != null ? intervention.isValue() : null;
    }

    public Collection<Intervention> interventions() {
        return byVariable.values();
    }

    public SortedMap<String, Boolean> asValues() {
        return byVariable.values().stream()
                .collect(Collectors.toMap(Intervention::getVariable, Intervention::isValue,
                        (a, b) -> b, TreeMap::new));
    }

    /**
     * Stable textual form used for cache keys.
     */
    public String canonical() {
        return byVariable.values().stream()
                .map(Intervention::canonical)
                .collect(Collectors.joining(",", "{", "}"));
    }
}
