package com.courier.normalization.plugin;

import com.courier.domain.EventEnvelope;
import com.courier.domain.FieldCollision;
import com.courier.domain.HandlerEntry;
import com.courier.domain.StructureClassification;
import com.courier.normalization.DecoderMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Copies parsed fields into a record's event data and assigns its
 * classification.
 *
 * Both are first-writer-wins: a key that is already present keeps its value
 * and the rejected write is recorded as a {@link FieldCollision}; a second,
 * different classification is recorded as a conflict.
 */
public class FieldMapper {

    private static final Logger log = LoggerFactory.getLogger(FieldMapper.class);

    private final DecoderMetrics metrics;

    public FieldMapper(DecoderMetrics metrics) {
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    /**
     * Classify the record and merge the given fields into its event data
     *
     * @param record      record to enrich
     * @param fieldNames  field names, same length as fieldValues
     * @param fieldValues field values
     * @param vendor      classification vendor
     * @param product     classification product
     * @param msgclass    classification message class
     * @param pluginName  plugin doing the write, used for diagnostics
     * @throws IllegalArgumentException if the lists differ in length
     */
    public void applyFieldMapping(EventEnvelope record, List<String> fieldNames, List<?> fieldValues,
                                  String vendor, String product, String msgclass, String pluginName) {
        checkSizes(fieldNames, fieldValues);

        StructureClassification classification = new StructureClassification(vendor, product, msgclass);
        if (!record.classifyIfAbsent(classification)
                && !classification.equals(record.getStructureClassification())) {
            record.addClassificationConflict(classification);
            metrics.recordClassificationConflict();
            log.debug("Plugin {} classified record as {} but it is already {}",
                pluginName, classification, record.getStructureClassification());
        }

        insertAll(record, fieldNames, fieldValues, pluginName);
        record.putHandlerEntry(pluginName, new HandlerEntry(vendor, product, msgclass, fieldNames));
    }

    /**
     * Map based variant of
     * {@link #applyFieldMapping(EventEnvelope, List, List, String, String, String, String)}.
     * Map iteration order is kept.
     */
    public void applyFieldMapping(EventEnvelope record, Map<String, ?> fields,
                                  String vendor, String product, String msgclass, String pluginName) {
        List<String> names = new ArrayList<>(fields.size());
        List<Object> values = new ArrayList<>(fields.size());
        fields.forEach((k, v) -> {
            names.add(k);
            values.add(v);
        });
        applyFieldMapping(record, names, values, vendor, product, msgclass, pluginName);
    }

    /**
     * Merge fields into event data without touching the classification
     */
    public void mergeEventData(EventEnvelope record, List<String> fieldNames, List<?> fieldValues, String pluginName) {
        checkSizes(fieldNames, fieldValues);
        insertAll(record, fieldNames, fieldValues, pluginName);
    }

    private void insertAll(EventEnvelope record, List<String> fieldNames, List<?> fieldValues, String pluginName) {
        for (int i = 0; i < fieldNames.size(); i++) {
            String key = fieldNames.get(i);
            Object value = fieldValues.get(i);
            if (!record.putEventDataIfAbsent(key, value)) {
                Object kept = record.getEventData().get(key);
                record.addCollision(new FieldCollision(key, kept, value, pluginName));
                metrics.recordFieldCollision();
                log.debug("Field {} already set to '{}', {} value '{}' rejected", key, kept, pluginName, value);
            }
        }
    }

    private static void checkSizes(List<String> fieldNames, List<?> fieldValues) {
        if (fieldNames.size() != fieldValues.size()) {
            throw new IllegalArgumentException("Field names and values differ in length: "
                + fieldNames.size() + " != " + fieldValues.size());
        }
    }
}
