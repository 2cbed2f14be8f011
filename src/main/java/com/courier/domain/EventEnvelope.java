package com.courier.domain;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Canonical event record.
 *
 * One instance is created by a top-level grammar for every raw message, is
 * enriched in place by the plugin chain and is frozen by the orchestrator
 * before it is handed to a consumer. Every mutator throws
 * {@link IllegalStateException} once the record is frozen.
 */
public class EventEnvelope {

    private final RecordVariant variant;
    private final String rawText;

    private Instant timestamp;
    private Integer facility;
    private Integer severity;
    private String hostname;
    private String appName;
    private String procId;
    private String msgId;
    private final List<StructuredDataElement> structuredData = new ArrayList<>();
    private String message;

    private StructureClassification structureClassification;
    private final Map<String, Object> eventData = new LinkedHashMap<>();
    private final Map<String, HandlerEntry> handlerData = new LinkedHashMap<>();

    // Diagnostics
    private final List<FieldCollision> collisions = new ArrayList<>();
    private final List<StructureClassification> classificationConflicts = new ArrayList<>();

    private boolean frozen;

    /**
     * Constructor
     *
     * @param variant the grammar variant that produced this record
     * @param rawText the original message text
     */
    public EventEnvelope(RecordVariant variant, String rawText) {
        this.variant = Objects.requireNonNull(variant, "variant");
        this.rawText = rawText;
    }

    // Header fields

    public RecordVariant getVariant() {
        return variant;
    }

    public String getRawText() {
        return rawText;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        ensureMutable();
        this.timestamp = timestamp;
    }

    public Integer getFacility() {
        return facility;
    }

    public Integer getSeverity() {
        return severity;
    }

    /**
     * Set facility and severity from a decoded PRI value
     *
     * @param facility facility 0-23
     * @param severity severity 0-7
     */
    public void setPriority(int facility, int severity) {
        ensureMutable();
        if (facility < 0 || facility > 23) {
            throw new IllegalArgumentException("Facility out of range: " + facility);
        }
        if (severity < 0 || severity > 7) {
            throw new IllegalArgumentException("Severity out of range: " + severity);
        }
        this.facility = facility;
        this.severity = severity;
    }

    public String getHostname() {
        return hostname;
    }

    public void setHostname(String hostname) {
        ensureMutable();
        this.hostname = hostname;
    }

    public String getAppName() {
        return appName;
    }

    public void setAppName(String appName) {
        ensureMutable();
        this.appName = appName;
    }

    public String getProcId() {
        return procId;
    }

    public void setProcId(String procId) {
        ensureMutable();
        this.procId = procId;
    }

    public String getMsgId() {
        return msgId;
    }

    public void setMsgId(String msgId) {
        ensureMutable();
        this.msgId = msgId;
    }

    public List<StructuredDataElement> getStructuredData() {
        return Collections.unmodifiableList(structuredData);
    }

    public void addStructuredData(StructuredDataElement element) {
        ensureMutable();
        structuredData.add(Objects.requireNonNull(element, "element"));
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        ensureMutable();
        this.message = message;
    }

    // Enrichment

    public StructureClassification getStructureClassification() {
        return structureClassification;
    }

    /**
     * Set the classification unless one is already present
     *
     * @param classification the classification to assign
     * @return true if assigned, false if a classification was already set
     */
    public boolean classifyIfAbsent(StructureClassification classification) {
        ensureMutable();
        Objects.requireNonNull(classification, "classification");
        if (structureClassification != null) {
            return false;
        }
        structureClassification = classification;
        return true;
    }

    public Map<String, Object> getEventData() {
        return Collections.unmodifiableMap(eventData);
    }

    /**
     * Insert an event-data attribute unless the key is already present
     *
     * @return true if inserted, false if the key already existed
     */
    public boolean putEventDataIfAbsent(String key, Object value) {
        ensureMutable();
        Objects.requireNonNull(key, "key");
        if (eventData.containsKey(key)) {
            return false;
        }
        eventData.put(key, value);
        return true;
    }

    public Map<String, HandlerEntry> getHandlerData() {
        return Collections.unmodifiableMap(handlerData);
    }

    public void putHandlerEntry(String pluginName, HandlerEntry entry) {
        ensureMutable();
        handlerData.put(pluginName, entry);
    }

    public List<FieldCollision> getCollisions() {
        return Collections.unmodifiableList(collisions);
    }

    public void addCollision(FieldCollision collision) {
        ensureMutable();
        collisions.add(collision);
    }

    public List<StructureClassification> getClassificationConflicts() {
        return Collections.unmodifiableList(classificationConflicts);
    }

    public void addClassificationConflict(StructureClassification rejected) {
        ensureMutable();
        classificationConflicts.add(rejected);
    }

    // Lifecycle

    /**
     * Make this record read-only. Called by the orchestrator when decoding ends.
     */
    public void freeze() {
        this.frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void ensureMutable() {
        if (frozen) {
            throw new IllegalStateException("Event record is frozen");
        }
    }

    @Override
    public String toString() {
        return "EventEnvelope{" +
            "variant=" + variant +
            ", timestamp=" + timestamp +
            ", facility=" + facility +
            ", severity=" + severity +
            ", hostname='" + hostname + '\'' +
            ", appName='" + appName + '\'' +
            ", procId='" + procId + '\'' +
            ", msgId='" + msgId + '\'' +
            ", structuredData=" + structuredData +
            ", classification=" + structureClassification +
            ", eventData=" + eventData +
            '}';
    }
}
