package io.b2mash.b2b.dynamicfields.filter;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import io.b2mash.b2b.dynamicfields.config.DynamicFieldProperties;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldMapper;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldRepository;
import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.OptionsConfig;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * Short-lived snapshot of the valid ticket fields offered by search forms. A stale or missing
 * snapshot is reloaded synchronously by the reader that finds it; concurrent readers may each
 * reload.
 */
@Service
public class SearchableFieldCache {

  private static final Logger log = LoggerFactory.getLogger(SearchableFieldCache.class);
  private static final String SNAPSHOT_KEY = "ticket-fields";

  private final DynamicFieldRepository dynamicFieldRepository;
  private final DynamicFieldMapper mapper;
  private final Cache<String, List<SearchableField>> snapshot;

  @Autowired
  public SearchableFieldCache(
      DynamicFieldRepository dynamicFieldRepository,
      DynamicFieldMapper mapper,
      DynamicFieldProperties properties) {
    this(dynamicFieldRepository, mapper, properties.searchCacheTtl(), Ticker.systemTicker());
  }

  SearchableFieldCache(
      DynamicFieldRepository dynamicFieldRepository,
      DynamicFieldMapper mapper,
      Duration ttl,
      Ticker ticker) {
    this.dynamicFieldRepository = dynamicFieldRepository;
    this.mapper = mapper;
    this.snapshot =
        Caffeine.newBuilder().expireAfterWrite(ttl).maximumSize(1).ticker(ticker).build();
  }

  public List<SearchableField> getFieldsForSearch() {
    var cached = snapshot.getIfPresent(SNAPSHOT_KEY);
    if (cached != null) {
      return cached;
    }
    var loaded = load();
    snapshot.put(SNAPSHOT_KEY, loaded);
    log.debug("Reloaded searchable dynamic fields: count={}", loaded.size());
    return loaded;
  }

  public void invalidate() {
    snapshot.invalidateAll();
  }

  private List<SearchableField> load() {
    return dynamicFieldRepository.findValidByObjectTypeOrdered(ObjectType.TICKET).stream()
        .map(mapper::toDefinition)
        .map(
            field -> {
              var options = new ArrayList<Map<String, String>>();
              if (field.config() instanceof OptionsConfig enumerated) {
                enumerated
                    .possibleValues()
                    .forEach(
                        (key, label) ->
                            options.add(Map.of("key", key, "value", label == null ? key : label)));
              }
              return new SearchableField(field, options);
            })
        .toList();
  }
}
