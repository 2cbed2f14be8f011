package com.courier.domain;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One RFC5424 structured-data element: an SD-ID and its ordered parameters.
 */
public final class StructuredDataElement {

    private final String id;
    private final Map<String, String> params;

    public StructuredDataElement(String id, Map<String, String> params) {
        this.id = Objects.requireNonNull(id, "id");
        this.params = Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }

    public String getId() {
        return id;
    }

    public Map<String, String> getParams() {
        return params;
    }

    public String getParam(String name) {
        return params.get(name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof StructuredDataElement)) return false;
        StructuredDataElement that = (StructuredDataElement) o;
        return id.equals(that.id) && params.equals(that.params);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, params);
    }

    @Override
    public String toString() {
        return "[" + id + " " + params + "]";
    }
}
