package io.b2mash.b2b.dynamicfields.config;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the dynamic field engine.
 *
 * @param searchCacheTtl freshness window of the searchable-field snapshot
 * @param filterParamPrefix prefix identifying dynamic field filters among query parameters
 * @param multiselectDelimiter separator used to join multiselect keys in {@code value_text}
 * @param systemUserId user id stamped on audit columns when no acting user is bound
 * @param distinctValuesLimit default cap on distinct values returned for filter dropdowns
 */
@ConfigurationProperties(prefix = "dynamicfields")
public record DynamicFieldProperties(
    Duration searchCacheTtl,
    String filterParamPrefix,
    String multiselectDelimiter,
    long systemUserId,
    int distinctValuesLimit) {

  public DynamicFieldProperties {
    if (searchCacheTtl == null) {
      searchCacheTtl = Duration.ofSeconds(30);
    }
    if (filterParamPrefix == null || filterParamPrefix.isEmpty()) {
      filterParamPrefix = "df_";
    }
    if (multiselectDelimiter == null || multiselectDelimiter.isEmpty()) {
      multiselectDelimiter = "||";
    }
    if (systemUserId <= 0) {
      systemUserId = 1;
    }
    if (distinctValuesLimit <= 0) {
      distinctValuesLimit = 100;
    }
  }

  /** Defaults used when no {@code dynamicfields.*} properties are set. */
  public static DynamicFieldProperties defaults() {
    return new DynamicFieldProperties(null, null, null, 0, 0);
  }
}
