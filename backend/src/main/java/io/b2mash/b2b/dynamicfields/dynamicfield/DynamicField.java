package io.b2mash.b2b.dynamicfields.dynamicfield;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

@Entity
@Table(name = "dynamic_field")
public class DynamicField {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "internal_field", nullable = false)
  private boolean internalField;

  @Column(name = "name", nullable = false, length = 200, unique = true)
  private String name;

  @Column(name = "label", nullable = false, length = 200)
  private String label;

  @Column(name = "field_order", nullable = false)
  private int fieldOrder;

  @Enumerated(EnumType.STRING)
  @Column(name = "field_type", nullable = false, length = 20)
  private FieldType fieldType;

  @Enumerated(EnumType.STRING)
  @Column(name = "object_type", nullable = false, length = 20)
  private ObjectType objectType;

  /** YAML-encoded type-specific config, see {@code FieldConfigCodec}. */
  @Column(name = "config")
  private byte[] config;

  @Column(name = "valid", nullable = false)
  private boolean valid;

  @Column(name = "create_time", nullable = false, updatable = false)
  private Instant createTime;

  @Column(name = "create_by", nullable = false, updatable = false)
  private long createBy;

  @Column(name = "change_time", nullable = false)
  private Instant changeTime;

  @Column(name = "change_by", nullable = false)
  private long changeBy;

  protected DynamicField() {}

  public DynamicField(
      String name, FieldType fieldType, ObjectType objectType, boolean internalField, long userId) {
    this.name = name;
    this.fieldType = fieldType;
    this.objectType = objectType;
    this.internalField = internalField;
    this.valid = true;
    this.fieldOrder = 1;
    this.createTime = Instant.now();
    this.createBy = userId;
    this.changeTime = this.createTime;
    this.changeBy = userId;
  }

  /** Replaces every mutable attribute and stamps the change audit columns. */
  public void update(
      String name,
      String label,
      int fieldOrder,
      FieldType fieldType,
      ObjectType objectType,
      byte[] config,
      boolean valid,
      long userId) {
    this.name = name;
    this.label = label;
    this.fieldOrder = fieldOrder;
    this.fieldType = fieldType;
    this.objectType = objectType;
    this.config = config;
    this.valid = valid;
    this.changeTime = Instant.now();
    this.changeBy = userId;
  }

  public Long getId() {
    return id;
  }

  public boolean isInternalField() {
    return internalField;
  }

  public String getName() {
    return name;
  }

  public String getLabel() {
    return label;
  }

  public int getFieldOrder() {
    return fieldOrder;
  }

  public FieldType getFieldType() {
    return fieldType;
  }

  public ObjectType getObjectType() {
    return objectType;
  }

  public byte[] getConfig() {
    return config;
  }

  public boolean isValid() {
    return valid;
  }

  public Instant getCreateTime() {
    return createTime;
  }

  public long getCreateBy() {
    return createBy;
  }

  public Instant getChangeTime() {
    return changeTime;
  }

  public long getChangeBy() {
    return changeBy;
  }
}
