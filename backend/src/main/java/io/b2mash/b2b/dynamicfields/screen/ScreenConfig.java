package io.b2mash.b2b.dynamicfields.screen;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import java.time.Instant;

/** One enabled or required cell of the field x screen matrix; disabled cells are not stored. */
@Entity
@Table(name = "dynamic_field_screen_config")
public class ScreenConfig {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  private Long id;

  @Column(name = "field_id", nullable = false)
  private Long fieldId;

  @Column(name = "screen_key", nullable = false, length = 200)
  private String screenKey;

  @Column(name = "config_value", nullable = false)
  private int configValue;

  @Column(name = "create_time", nullable = false, updatable = false)
  private Instant createTime;

  @Column(name = "create_by", nullable = false, updatable = false)
  private long createBy;

  @Column(name = "change_time", nullable = false)
  private Instant changeTime;

  @Column(name = "change_by", nullable = false)
  private long changeBy;

  protected ScreenConfig() {}

  public ScreenConfig(Long fieldId, String screenKey, ScreenVisibility visibility, long userId) {
    this.fieldId = fieldId;
    this.screenKey = screenKey;
    this.configValue = visibility.level();
    this.createTime = Instant.now();
    this.createBy = userId;
    this.changeTime = this.createTime;
    this.changeBy = userId;
  }

  public Long getId() {
    return id;
  }

  public Long getFieldId() {
    return fieldId;
  }

  public String getScreenKey() {
    return screenKey;
  }

  public int getConfigValue() {
    return configValue;
  }

  public ScreenVisibility getVisibility() {
    return ScreenVisibility.fromLevel(configValue);
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
