package com.example.triage.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Visão somente leitura das respostas de uma sessão, com acessores tipados
 * usados pelos cálculos de pontuação. Respostas ausentes valem 0 / false.
 */
public final class ResponseSet {

    private static final ResponseSet EMPTY = new ResponseSet(Collections.emptyMap());

    private final Map<String, Object> values;

    private ResponseSet(Map<String, Object> values) {
        this.values = values;
    }

    public static ResponseSet empty() {
        return EMPTY;
    }

    public static ResponseSet of(Map<String, ?> raw) {
        Map<String, Object> copy = new LinkedHashMap<>();
        raw.forEach((id, value) -> copy.put(id, normalize(value)));
        return new ResponseSet(Collections.unmodifiableMap(copy));
    }

    /**
     * Números inteiros viram Integer, os demais Double; listas são copiadas.
     * Assim 2, 2L e 2.0 vindos do JSON comparam iguais.
     */
    public static Object normalize(Object value) {
        if (value instanceof Number) {
            double d = ((Number) value).doubleValue();
            if (!Double.isInfinite(d) && d == Math.rint(d) && Math.abs(d) <= Integer.MAX_VALUE) {
                return (int) d;
            }
            return d;
        }
        if (value instanceof List) {
            List<Object> copy = new ArrayList<>();
            for (Object item : (List<?>) value) {
                copy.add(normalize(item));
            }
            return Collections.unmodifiableList(copy);
        }
        return value;
    }

    @JsonValue
    public Map<String, Object> asMap() {
        return values;
    }

    public Object get(String questionId) {
        return values.get(questionId);
    }

    public boolean has(String questionId) {
        return values.containsKey(questionId) && values.get(questionId) != null;
    }

    public int size() {
        return values.size();
    }

    public OptionalDouble number(String questionId) {
        Object value = values.get(questionId);
        if (value instanceof Number) {
            return OptionalDouble.of(((Number) value).doubleValue());
        }
        return OptionalDouble.empty();
    }

    public int intValue(String questionId) {
        Object value = values.get(questionId);
        return value instanceof Number ? ((Number) value).intValue() : 0;
    }

    public double doubleValue(String questionId) {
        return number(questionId).orElse(0);
    }

    public Optional<String> text(String questionId) {
        Object value = values.get(questionId);
        return value instanceof String ? Optional.of((String) value) : Optional.empty();
    }

    public boolean is(String questionId, String expected) {
        return expected.equals(values.get(questionId));
    }

    public boolean isTrue(String questionId) {
        return Boolean.TRUE.equals(values.get(questionId));
    }

    public List<String> list(String questionId) {
        Object value = values.get(questionId);
        if (!(value instanceof List)) {
            return Collections.emptyList();
        }
        List<String> items = new ArrayList<>();
        for (Object item : (List<?>) value) {
            items.add(String.valueOf(item));
        }
        return items;
    }

    public boolean listContains(String questionId, String item) {
        return list(questionId).contains(item);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ResponseSet)) return false;
        return values.equals(((ResponseSet) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        // apenas os ids; valores são dados de saúde
        return "ResponseSet" + values.keySet();
    }
}
