package io.b2mash.b2b.dynamicfields.screen;

import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

public interface ScreenConfigRepository extends JpaRepository<ScreenConfig, Long> {

  List<ScreenConfig> findByFieldIdOrderByScreenKey(Long fieldId);

  List<ScreenConfig> findByFieldIdIn(Collection<Long> fieldIds);

  @Query(
      "SELECT sc FROM ScreenConfig sc WHERE sc.screenKey = :screenKey AND sc.configValue > 0")
  List<ScreenConfig> findEnabledByScreenKey(@Param("screenKey") String screenKey);

  @Modifying
  @Query("DELETE FROM ScreenConfig sc WHERE sc.fieldId = :fieldId")
  int deleteByFieldId(@Param("fieldId") Long fieldId);

  @Modifying
  @Query("DELETE FROM ScreenConfig sc WHERE sc.fieldId = :fieldId AND sc.screenKey = :screenKey")
  int deleteByFieldIdAndScreenKey(
      @Param("fieldId") Long fieldId, @Param("screenKey") String screenKey);
}
