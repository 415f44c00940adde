package io.b2mash.b2b.dynamicfields.filter;

import io.b2mash.b2b.dynamicfields.exception.StorageException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.PersistenceException;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/** Compiles dynamic field filters and runs them against the value store. */
@Service
public class FieldFilterService {

  private static final String OBJECT_IDS =
      "SELECT t.id FROM (SELECT DISTINCT object_id AS id FROM dynamic_field_value) t";

  private final DynamicFieldFilterCompiler compiler;
  private final SqlFilterRenderer renderer;
  private final FieldFilterParser parser;

  @PersistenceContext private EntityManager entityManager;

  public FieldFilterService(
      DynamicFieldFilterCompiler compiler, SqlFilterRenderer renderer, FieldFilterParser parser) {
    this.compiler = compiler;
    this.renderer = renderer;
    this.parser = parser;
  }

  /**
   * Builds a fragment for embedding into a caller's own query, where {@code outerIdColumn} is the
   * object id column the sub-queries correlate on.
   */
  @Transactional(readOnly = true)
  public SqlFragment buildFilter(List<FieldFilter> filters, int startIndex, String outerIdColumn) {
    return renderer.render(compiler.compile(filters), startIndex, outerIdColumn);
  }

  /**
   * Ids of objects with at least one stored value that satisfy every filter, ascending. With no
   * applicable filter every such object matches.
   */
  @Transactional(readOnly = true)
  public List<Long> findMatchingObjectIds(List<FieldFilter> filters) {
    var fragment = buildFilter(filters, 1, "t.id");
    var sql = fragment.isEmpty() ? OBJECT_IDS : OBJECT_IDS + " WHERE " + fragment.sql();
    try {
      var query = entityManager.createNativeQuery(sql + " ORDER BY t.id");
      var parameters = fragment.parameters();
      for (int i = 0; i < parameters.size(); i++) {
        query.setParameter(i + 1, parameters.get(i));
      }
      @SuppressWarnings("unchecked")
      List<Number> ids = query.getResultList();
      return ids.stream().map(Number::longValue).toList();
    } catch (PersistenceException e) {
      throw new StorageException("filter objects by dynamic fields", e);
    }
  }

  @Transactional(readOnly = true)
  public List<Long> findMatchingObjectIds(Map<String, List<String>> queryParams) {
    return findMatchingObjectIds(parser.parse(queryParams));
  }
}
