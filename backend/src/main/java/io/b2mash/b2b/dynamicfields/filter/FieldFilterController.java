package io.b2mash.b2b.dynamicfields.filter;

import io.b2mash.b2b.dynamicfields.filter.dto.SearchableFieldResponse;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dynamic-fields")
public class FieldFilterController {

  private final FieldFilterService fieldFilterService;
  private final SearchableFieldCache searchableFieldCache;

  public FieldFilterController(
      FieldFilterService fieldFilterService, SearchableFieldCache searchableFieldCache) {
    this.fieldFilterService = fieldFilterService;
    this.searchableFieldCache = searchableFieldCache;
  }

  @GetMapping("/searchable")
  public ResponseEntity<List<SearchableFieldResponse>> searchable() {
    return ResponseEntity.ok(
        searchableFieldCache.getFieldsForSearch().stream()
            .map(SearchableFieldResponse::from)
            .toList());
  }

  /** Object ids matching every {@code df_} query parameter. */
  @GetMapping("/matches")
  public ResponseEntity<List<Long>> matches(@RequestParam MultiValueMap<String, String> params) {
    return ResponseEntity.ok(fieldFilterService.findMatchingObjectIds(params));
  }

  @PostMapping("/matches")
  public ResponseEntity<List<Long>> matchesFilters(@RequestBody List<FieldFilter> filters) {
    return ResponseEntity.ok(fieldFilterService.findMatchingObjectIds(filters));
  }
}
