package io.b2mash.b2b.dynamicfields.dynamicfield;

import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfig;
import java.time.Instant;

/**
 * Read model of a dynamic field with its config decoded. Services hand these out instead of the
 * entity so callers never see the raw config blob.
 */
public record DynamicFieldDefinition(
    Long id,
    boolean internal,
    String name,
    String label,
    int fieldOrder,
    FieldType fieldType,
    ObjectType objectType,
    FieldConfig config,
    boolean valid,
    Instant createTime,
    long createBy,
    Instant changeTime,
    long changeBy) {}
