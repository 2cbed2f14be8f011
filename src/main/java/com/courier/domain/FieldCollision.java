package com.courier.domain;

import java.util.Objects;

/**
 * Diagnostic recorded when a plugin tries to set an event-data key that an
 * earlier plugin in the same chain already set. The earlier value is kept.
 */
public final class FieldCollision {

    private final String key;
    private final Object keptValue;
    private final Object rejectedValue;
    private final String pluginName;

    public FieldCollision(String key, Object keptValue, Object rejectedValue, String pluginName) {
        this.key = key;
        this.keptValue = keptValue;
        this.rejectedValue = rejectedValue;
        this.pluginName = pluginName;
    }

    public String getKey() {
        return key;
    }

    public Object getKeptValue() {
        return keptValue;
    }

    public Object getRejectedValue() {
        return rejectedValue;
    }

    /**
     * @return name of the plugin whose write was rejected
     */
    public String getPluginName() {
        return pluginName;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FieldCollision)) return false;
        FieldCollision that = (FieldCollision) o;
        return key.equals(that.key)
            && Objects.equals(keptValue, that.keptValue)
            && Objects.equals(rejectedValue, that.rejectedValue)
            && Objects.equals(pluginName, that.pluginName);
    }

    @Override
    public int hashCode() {
        return Objects.hash(key, keptValue, rejectedValue, pluginName);
    }

    @Override
    public String toString() {
        return "FieldCollision{key=" + key + ", kept=" + keptValue
            + ", rejected=" + rejectedValue + ", plugin=" + pluginName + "}";
    }
}
