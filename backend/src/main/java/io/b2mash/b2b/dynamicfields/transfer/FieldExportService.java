package io.b2mash.b2b.dynamicfields.transfer;

import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldService;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfigCodec;
import io.b2mash.b2b.dynamicfields.screen.ScreenConfigService;
import io.b2mash.b2b.dynamicfields.transfer.FieldBundle.FieldEntry;
import io.b2mash.b2b.dynamicfields.transfer.FieldBundle.ScreenEntry;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class FieldExportService {

  private static final Logger log = LoggerFactory.getLogger(FieldExportService.class);

  private final DynamicFieldService dynamicFieldService;
  private final ScreenConfigService screenConfigService;
  private final FieldConfigCodec configCodec;
  private final FieldBundleCodec bundleCodec;

  public FieldExportService(
      DynamicFieldService dynamicFieldService,
      ScreenConfigService screenConfigService,
      FieldConfigCodec configCodec,
      FieldBundleCodec bundleCodec) {
    this.dynamicFieldService = dynamicFieldService;
    this.screenConfigService = screenConfigService;
    this.configCodec = configCodec;
    this.bundleCodec = bundleCodec;
  }

  /** Exports the named fields in request order; unknown and repeated names are skipped. */
  @Transactional(readOnly = true)
  public FieldBundle export(List<String> fieldNames, boolean includeScreens) {
    var fields = new ArrayList<FieldEntry>();
    var screens = new ArrayList<ScreenEntry>();
    for (var name : new LinkedHashSet<>(fieldNames)) {
      var found = dynamicFieldService.findByName(name);
      if (found.isEmpty()) {
        log.debug("Skipping unknown dynamic field in export: name={}", name);
        continue;
      }
      var field = found.get();
      fields.add(
          new FieldEntry(
              field.name(),
              field.label(),
              field.fieldOrder(),
              field.fieldType().externalName(),
              field.objectType().externalName(),
              field.valid(),
              configCodec.toDocument(field.config())));
      if (includeScreens) {
        screenConfigService
            .getConfigForField(field.id())
            .forEach(
                (screenKey, visibility) ->
                    screens.add(new ScreenEntry(field.name(), screenKey, visibility.level())));
      }
    }
    log.info("Exported dynamic fields: count={}, screenConfigs={}", fields.size(), screens.size());
    return new FieldBundle(fields, screens);
  }

  public String exportYaml(List<String> fieldNames, boolean includeScreens) {
    return bundleCodec.write(export(fieldNames, includeScreens));
  }
}
