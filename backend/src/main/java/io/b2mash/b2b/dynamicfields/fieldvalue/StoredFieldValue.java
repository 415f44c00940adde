package io.b2mash.b2b.dynamicfields.fieldvalue;

/** A stored value together with the field and object it belongs to. */
public record StoredFieldValue(Long fieldId, long objectId, FieldValue value) {

  static StoredFieldValue from(DynamicFieldValue row) {
    return new StoredFieldValue(row.getFieldId(), row.getObjectId(), row.toFieldValue());
  }
}
