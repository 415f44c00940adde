package io.b2mash.b2b.dynamicfields.dynamicfield;

import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfigCodec;
import org.springframework.stereotype.Component;

/** Decodes entity rows into {@link DynamicFieldDefinition} snapshots. */
@Component
public class DynamicFieldMapper {

  private final FieldConfigCodec configCodec;

  public DynamicFieldMapper(FieldConfigCodec configCodec) {
    this.configCodec = configCodec;
  }

  public DynamicFieldDefinition toDefinition(DynamicField field) {
    return new DynamicFieldDefinition(
        field.getId(),
        field.isInternalField(),
        field.getName(),
        field.getLabel(),
        field.getFieldOrder(),
        field.getFieldType(),
        field.getObjectType(),
        configCodec.parse(field.getFieldType(), field.getConfig()),
        field.isValid(),
        field.getCreateTime(),
        field.getCreateBy(),
        field.getChangeTime(),
        field.getChangeBy());
  }
}
