package com.agile.Buro.dto;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Partial update over a closed set of fields. A field that is present may carry
 * {@code null}, which is different from the field being absent.
 */
public abstract class FieldUpdate<F extends Enum<F>> {

    private final Map<F, Object> values;

    protected FieldUpdate(Map<F, Object> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    public boolean has(F field) {
        return values.containsKey(field);
    }

    public Set<F> fields() {
        return values.keySet();
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    protected <T> T get(F field, Class<T> type) {
        return type.cast(values.get(field));
    }

    protected abstract static class Builder<F extends Enum<F>, B extends Builder<F, B>> {
        protected final EnumMap<F, Object> values;

        protected Builder(Class<F> fieldType) {
            this.values = new EnumMap<>(fieldType);
        }

        @SuppressWarnings("unchecked")
        protected B put(F field, Object value) {
            values.put(field, value);
            return (B) this;
        }
    }
}
