package io.b2mash.b2b.dynamicfields.fieldvalue;

import io.b2mash.b2b.dynamicfields.fieldvalue.FieldValue.DateValue;
import io.b2mash.b2b.dynamicfields.fieldvalue.FieldValue.IntegerValue;
import io.b2mash.b2b.dynamicfields.fieldvalue.FieldValue.TextValue;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.LocalDateTime;

/** EAV row: one value of one field for one object, held in exactly one of the value slots. */
@Entity
@Table(name = "dynamic_field_value")
public class DynamicFieldValue {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "field_id", nullable = false)
  private Long fieldId;

  @Column(name = "object_id", nullable = false)
  private long objectId;

  @Column(name = "value_text")
  private String valueText;

  @Column(name = "value_date")
  private LocalDateTime valueDate;

  @Column(name = "value_int")
  private Long valueInt;

  protected DynamicFieldValue() {}

  public DynamicFieldValue(Long fieldId, long objectId, FieldValue value) {
    this.fieldId = fieldId;
    this.objectId = objectId;
    if (value instanceof TextValue text) {
      this.valueText = text.value();
    } else if (value instanceof IntegerValue integer) {
      this.valueInt = integer.value();
    } else if (value instanceof DateValue date) {
      this.valueDate = date.value();
    }
  }

  /** The populated slot as a {@link FieldValue}, or null when every slot is empty. */
  public FieldValue toFieldValue() {
    if (valueText != null) {
      return new TextValue(valueText);
    }
    if (valueInt != null) {
      return new IntegerValue(valueInt);
    }
    if (valueDate != null) {
      return new DateValue(valueDate);
    }
    return null;
  }

  public Long getId() {
    return id;
  }

  public Long getFieldId() {
    return fieldId;
  }

  public long getObjectId() {
    return objectId;
  }

  public String getValueText() {
    return valueText;
  }

  public LocalDateTime getValueDate() {
    return valueDate;
  }

  public Long getValueInt() {
    return valueInt;
  }
}
