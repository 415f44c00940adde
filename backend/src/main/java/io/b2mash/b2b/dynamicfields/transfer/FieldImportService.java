package io.b2mash.b2b.dynamicfields.transfer;

import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldCommand;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldService;
import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfigCodec;
import io.b2mash.b2b.dynamicfields.screen.ScreenConfigService;
import io.b2mash.b2b.dynamicfields.transfer.FieldBundle.FieldEntry;
import io.b2mash.b2b.dynamicfields.transfer.ImportPreview.FieldPreview;
import io.b2mash.b2b.dynamicfields.transfer.ImportResult.FieldOutcome;
import io.b2mash.b2b.dynamicfields.transfer.ImportResult.ScreenOutcome;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Applies an exported bundle to this instance. Not transactional itself: every field is written
 * through the registry in its own transaction so one failed entry leaves the others in place.
 */
@Service
public class FieldImportService {

  private static final Logger log = LoggerFactory.getLogger(FieldImportService.class);

  private final DynamicFieldService dynamicFieldService;
  private final ScreenConfigService screenConfigService;
  private final FieldConfigCodec configCodec;
  private final FieldBundleCodec bundleCodec;

  public FieldImportService(
      DynamicFieldService dynamicFieldService,
      ScreenConfigService screenConfigService,
      FieldConfigCodec configCodec,
      FieldBundleCodec bundleCodec) {
    this.dynamicFieldService = dynamicFieldService;
    this.screenConfigService = screenConfigService;
    this.configCodec = configCodec;
    this.bundleCodec = bundleCodec;
  }

  public FieldBundle parse(String yaml) {
    return bundleCodec.read(yaml);
  }

  public ImportPreview preview(FieldBundle bundle) {
    var previews = new ArrayList<FieldPreview>();
    for (var entry : bundle.dynamicFields()) {
      previews.add(
          new FieldPreview(
              entry.name(),
              entry.label(),
              entry.fieldType(),
              entry.objectType(),
              dynamicFieldService.findByName(entry.name()).isPresent(),
              bundle.hasScreensFor(entry.name())));
    }
    return new ImportPreview(previews);
  }

  /**
   * Imports the selected entries in bundle order, then replaces the screen configuration of the
   * fields named in {@code selectedScreens}. A null selection means every entry of the bundle.
   *
   * <p>Screens are only replaced for fields created or updated by this commit. Without {@code
   * overwrite}, the screens of fields that were skipped or not selected stay as they are.
   */
  public ImportResult commit(
      FieldBundle bundle,
      Collection<String> selectedFields,
      Collection<String> selectedScreens,
      boolean overwrite) {
    var fieldOutcomes = new ArrayList<FieldOutcome>();
    var statusByName = new HashMap<String, ImportStatus>();
    for (var entry : bundle.dynamicFields()) {
      if (selectedFields != null && !selectedFields.contains(entry.name())) {
        continue;
      }
      var outcome = importField(entry, overwrite);
      fieldOutcomes.add(outcome);
      statusByName.put(outcome.name(), outcome.status());
    }

    var screenOutcomes = new ArrayList<ScreenOutcome>();
    for (var screens : screensByField(bundle).entrySet()) {
      var fieldName = screens.getKey();
      if (selectedScreens != null && !selectedScreens.contains(fieldName)) {
        continue;
      }
      var status = statusByName.get(fieldName);
      if (status == ImportStatus.SKIPPED) {
        screenOutcomes.add(notApplied(fieldName, "Field was skipped"));
      } else if (status == ImportStatus.FAILED) {
        screenOutcomes.add(notApplied(fieldName, "Field import failed"));
      } else if (status == null && !overwrite) {
        screenOutcomes.add(notApplied(fieldName, "Field was not imported"));
      } else {
        screenOutcomes.add(importScreens(fieldName, screens.getValue()));
      }
    }

    var result = new ImportResult(fieldOutcomes, screenOutcomes);
    log.info(
        "Imported dynamic fields: created={}, updated={}, skipped={}, failed={}, screenConfigs={}",
        result.count(ImportStatus.CREATED),
        result.count(ImportStatus.UPDATED),
        result.count(ImportStatus.SKIPPED),
        result.count(ImportStatus.FAILED),
        screenOutcomes.size());
    return result;
  }

  /** Convenience for callers holding the raw document. */
  public ImportResult commit(
      String yaml, List<String> selectedFields, List<String> selectedScreens, boolean overwrite) {
    return commit(parse(yaml), selectedFields, selectedScreens, overwrite);
  }

  private FieldOutcome importField(FieldEntry entry, boolean overwrite) {
    try {
      var existing = dynamicFieldService.findByName(entry.name());
      if (existing.isPresent() && !overwrite) {
        return new FieldOutcome(entry.name(), ImportStatus.SKIPPED, "Field already exists");
      }
      var fieldType = FieldType.fromExternalName(entry.fieldType());
      var config = configCodec.fromDocument(fieldType, entry.config());

      if (existing.isEmpty()) {
        var objectType = ObjectType.fromExternalName(entry.objectType());
        dynamicFieldService.create(
            new DynamicFieldCommand(
                entry.name(),
                entry.label(),
                order(entry),
                fieldType,
                objectType,
                config,
                entry.valid() == null || entry.valid(),
                false,
                false));
        return new FieldOutcome(entry.name(), ImportStatus.CREATED, null);
      }

      var field = existing.get();
      if (field.fieldType() != fieldType) {
        return failed(
            entry.name(),
            "Cannot change field type from "
                + field.fieldType().externalName()
                + " to "
                + fieldType.externalName());
      }
      dynamicFieldService.update(
          field.id(),
          new DynamicFieldCommand(
              field.name(),
              entry.label(),
              order(entry),
              field.fieldType(),
              field.objectType(),
              config,
              entry.valid() == null || entry.valid(),
              field.internal(),
              false));
      return new FieldOutcome(entry.name(), ImportStatus.UPDATED, null);
    } catch (RuntimeException e) {
      return failed(entry.name(), e.getMessage());
    }
  }

  private ScreenOutcome importScreens(String fieldName, Map<String, Integer> levels) {
    var field = dynamicFieldService.findByName(fieldName);
    if (field.isEmpty()) {
      log.warn("Skipping screen config import for missing field: name={}", fieldName);
      return new ScreenOutcome(fieldName, false, 0, "Field does not exist");
    }
    try {
      screenConfigService.bulkSet(field.get().id(), levels);
      return new ScreenOutcome(fieldName, true, levels.size(), null);
    } catch (RuntimeException e) {
      log.warn("Screen config import failed: name={}, reason={}", fieldName, e.getMessage());
      return new ScreenOutcome(fieldName, false, 0, e.getMessage());
    }
  }

  private static ScreenOutcome notApplied(String fieldName, String reason) {
    log.debug("Screen config not applied: name={}, reason={}", fieldName, reason);
    return new ScreenOutcome(fieldName, false, 0, reason);
  }

  private static FieldOutcome failed(String name, String message) {
    log.warn("Dynamic field import failed: name={}, reason={}", name, message);
    return new FieldOutcome(name, ImportStatus.FAILED, message);
  }

  private static int order(FieldEntry entry) {
    return entry.fieldOrder() == null ? 1 : entry.fieldOrder();
  }

  private static Map<String, Map<String, Integer>> screensByField(FieldBundle bundle) {
    var grouped = new LinkedHashMap<String, Map<String, Integer>>();
    for (var screen : bundle.screens()) {
      grouped
          .computeIfAbsent(screen.fieldName(), name -> new LinkedHashMap<>())
          .put(screen.screenKey(), screen.level() == null ? 0 : screen.level());
    }
    return grouped;
  }
}
