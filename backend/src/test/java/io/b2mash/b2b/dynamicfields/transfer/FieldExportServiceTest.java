package io.b2mash.b2b.dynamicfields.transfer;

import static io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldFixtures.CODEC;
import static io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldFixtures.definition;
import static io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldFixtures.field;
import static io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldFixtures.ticketField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldService;
import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.DropdownConfig;
import io.b2mash.b2b.dynamicfields.screen.ScreenConfigService;
import io.b2mash.b2b.dynamicfields.screen.ScreenVisibility;
import io.b2mash.b2b.dynamicfields.transfer.FieldBundle.ScreenEntry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class FieldExportServiceTest {

  @Mock private DynamicFieldService dynamicFieldService;
  @Mock private ScreenConfigService screenConfigService;

  private FieldExportService service;

  @BeforeEach
  void setUp() {
    service =
        new FieldExportService(
            dynamicFieldService, screenConfigService, CODEC, new FieldBundleCodec());
  }

  @Test
  void exportsRequestedFieldsOnceInRequestOrder() {
    var priority =
        definition(
            field(
                1L,
                "Priority1",
                FieldType.DROPDOWN,
                ObjectType.TICKET,
                DropdownConfig.of(Map.of("1", "Low"))));
    var notes = definition(ticketField(2L, "Notes", FieldType.TEXT));
    when(dynamicFieldService.findByName("Notes")).thenReturn(Optional.of(notes));
    when(dynamicFieldService.findByName("Priority1")).thenReturn(Optional.of(priority));
    when(dynamicFieldService.findByName("Unknown")).thenReturn(Optional.empty());

    var bundle = service.export(List.of("Notes", "Unknown", "Priority1", "Notes"), false);

    assertThat(bundle.dynamicFields())
        .extracting(FieldBundle.FieldEntry::name)
        .containsExactly("Notes", "Priority1");
    var exported = bundle.dynamicFields().get(1);
    assertThat(exported.fieldType()).isEqualTo("Dropdown");
    assertThat(exported.objectType()).isEqualTo("Ticket");
    assertThat(exported.config().possibleValues()).containsEntry("1", "Low");
    assertThat(bundle.screens()).isEmpty();
    verify(dynamicFieldService, times(1)).findByName("Notes");
    verify(screenConfigService, never()).getConfigForField(any());
  }

  @Test
  void includesStoredScreenLevels() {
    var notes = definition(ticketField(2L, "Notes", FieldType.TEXT));
    when(dynamicFieldService.findByName("Notes")).thenReturn(Optional.of(notes));
    var screens = new LinkedHashMap<String, ScreenVisibility>();
    screens.put("AgentTicketPhone", ScreenVisibility.REQUIRED);
    screens.put("AgentTicketZoom", ScreenVisibility.ENABLED);
    when(screenConfigService.getConfigForField(2L)).thenReturn(screens);

    var bundle = service.export(List.of("Notes"), true);

    assertThat(bundle.screens())
        .containsExactly(
            new ScreenEntry("Notes", "AgentTicketPhone", 2),
            new ScreenEntry("Notes", "AgentTicketZoom", 1));
  }

  @Test
  void exportYamlCanBeReadBack() {
    var notes = definition(ticketField(2L, "Notes", FieldType.TEXT));
    when(dynamicFieldService.findByName("Notes")).thenReturn(Optional.of(notes));

    var yaml = service.exportYaml(List.of("Notes"), false);

    var bundle = new FieldBundleCodec().read(yaml);
    assertThat(bundle.dynamicFields()).hasSize(1);
    assertThat(bundle.dynamicFields().get(0).label()).isEqualTo("Notes label");
  }
}
