package io.b2mash.b2b.dynamicfields.dynamicfield;

import java.util.List;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface DynamicFieldRepository extends JpaRepository<DynamicField, Long> {

  @Query(
      "SELECT df FROM DynamicField df"
          + " WHERE (:objectType IS NULL OR df.objectType = :objectType)"
          + " AND (:fieldType IS NULL OR df.fieldType = :fieldType)"
          + " ORDER BY df.objectType, df.fieldOrder, df.name")
  List<DynamicField> findFiltered(
      @Param("objectType") ObjectType objectType, @Param("fieldType") FieldType fieldType);

  Optional<DynamicField> findByName(String name);

  List<DynamicField> findByNameIn(List<String> names);

  boolean existsByName(String name);

  boolean existsByNameAndIdNot(String name, Long id);

  @Query(
      "SELECT df FROM DynamicField df WHERE df.objectType = :objectType"
          + " ORDER BY df.fieldOrder, df.name")
  List<DynamicField> findByObjectTypeOrdered(@Param("objectType") ObjectType objectType);

  @Query(
      "SELECT df FROM DynamicField df WHERE df.objectType = :objectType AND df.valid = true"
          + " ORDER BY df.fieldOrder, df.name")
  List<DynamicField> findValidByObjectTypeOrdered(@Param("objectType") ObjectType objectType);
}
