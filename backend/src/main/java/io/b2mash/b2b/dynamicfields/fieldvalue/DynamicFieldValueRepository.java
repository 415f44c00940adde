package io.b2mash.b2b.dynamicfields.fieldvalue;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DynamicFieldValueRepository extends JpaRepository<DynamicFieldValue, Long> {

  List<DynamicFieldValue> findByObjectIdOrderByFieldId(long objectId);

  boolean existsByFieldId(Long fieldId);

  @Modifying
  @Query("DELETE FROM DynamicFieldValue v WHERE v.fieldId = :fieldId")
  int deleteByFieldId(@Param("fieldId") Long fieldId);

  @Modifying
  @Query("DELETE FROM DynamicFieldValue v WHERE v.fieldId = :fieldId AND v.objectId = :objectId")
  int deleteByFieldIdAndObjectId(@Param("fieldId") Long fieldId, @Param("objectId") long objectId);

  @Query(
      value =
          "SELECT DISTINCT value_text FROM dynamic_field_value"
              + " WHERE field_id = :fieldId AND value_text IS NOT NULL AND value_text <> ''"
              + " ORDER BY value_text LIMIT :limit",
      nativeQuery = true)
  List<String> findDistinctTextValues(@Param("fieldId") Long fieldId, @Param("limit") int limit);
}
