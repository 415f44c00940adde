package io.b2mash.b2b.dynamicfields.dynamicfield.dto;

import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldDefinition;
import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.ConfigDocument;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfigCodec;
import java.time.Instant;

public record DynamicFieldResponse(
    Long id,
    String name,
    String label,
    int fieldOrder,
    FieldType fieldType,
    ObjectType objectType,
    boolean valid,
    boolean internal,
    ConfigDocument config,
    Instant createTime,
    long createBy,
    Instant changeTime,
    long changeBy) {

  public static DynamicFieldResponse from(DynamicFieldDefinition df, FieldConfigCodec codec) {
    return new DynamicFieldResponse(
        df.id(),
        df.name(),
        df.label(),
        df.fieldOrder(),
        df.fieldType(),
        df.objectType(),
        df.valid(),
        df.internal(),
        codec.toDocument(df.config()),
        df.createTime(),
        df.createBy(),
        df.changeTime(),
        df.changeBy());
  }
}
