package io.b2mash.b2b.dynamicfields.fieldvalue;

import static io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldFixtures.MAPPER;
import static io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldFixtures.definition;
import static io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldFixtures.ticketField;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import io.b2mash.b2b.dynamicfields.config.DynamicFieldProperties;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldRepository;
import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.exception.ResourceNotFoundException;
import io.b2mash.b2b.dynamicfields.exception.StorageException;
import io.b2mash.b2b.dynamicfields.screen.FieldWithScreenConfig;
import io.b2mash.b2b.dynamicfields.screen.ScreenConfigService;
import io.b2mash.b2b.dynamicfields.screen.ScreenVisibility;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import tools.jackson.databind.json.JsonMapper;

@ExtendWith(MockitoExtension.class)
class FieldValueServiceTest {

  private static final String SCREEN = "AgentTicketZoom";

  @Mock private DynamicFieldValueRepository valueRepository;
  @Mock private DynamicFieldRepository dynamicFieldRepository;
  @Mock private ScreenConfigService screenConfigService;

  private FieldValueService service;

  @BeforeEach
  void setUp() {
    var properties = DynamicFieldProperties.defaults();
    service =
        new FieldValueService(
            valueRepository,
            dynamicFieldRepository,
            MAPPER,
            screenConfigService,
            new FieldValueFormatter(properties),
            properties);
  }

  private static FieldWithScreenConfig onScreen(long id, String name, FieldType type) {
    return new FieldWithScreenConfig(
        definition(ticketField(id, name, type)), ScreenVisibility.ENABLED);
  }

  @Test
  void setValueOnUnknownFieldIsNotFound() {
    when(dynamicFieldRepository.existsById(9L)).thenReturn(false);

    assertThatThrownBy(() -> service.setValue(9L, 100L, FieldValue.text("x")))
        .isInstanceOf(ResourceNotFoundException.class);
    verifyNoInteractions(valueRepository);
  }

  @Test
  void setValueReplacesExistingRow() {
    when(dynamicFieldRepository.existsById(1L)).thenReturn(true);

    service.setValue(1L, 100L, FieldValue.integer(2));

    var captor = ArgumentCaptor.forClass(DynamicFieldValue.class);
    var order = inOrder(valueRepository);
    order.verify(valueRepository).deleteByFieldIdAndObjectId(1L, 100L);
    order.verify(valueRepository).saveAndFlush(captor.capture());
    var saved = captor.getValue();
    assertThat(saved.getValueInt()).isEqualTo(2L);
    assertThat(saved.getValueText()).isNull();
    assertThat(saved.getValueDate()).isNull();
  }

  @Test
  void setNullValueOnlyClears() {
    when(dynamicFieldRepository.existsById(1L)).thenReturn(true);

    service.setValue(1L, 100L, null);

    verify(valueRepository).deleteByFieldIdAndObjectId(1L, 100L);
    verify(valueRepository, never()).saveAndFlush(any());
  }

  @Test
  void typedValueWithoutPayloadOnlyClears() {
    when(dynamicFieldRepository.existsById(1L)).thenReturn(true);
    var parsed = JsonMapper.builder().build().readValue("{\"type\":\"text\"}", FieldValue.class);

    service.setValue(1L, 100L, parsed);
    service.setValue(1L, 100L, FieldValue.date(null));

    verify(valueRepository, times(2)).deleteByFieldIdAndObjectId(1L, 100L);
    verify(valueRepository, never()).saveAndFlush(any());
  }

  @Test
  void storageFailureIsWrapped() {
    when(dynamicFieldRepository.existsById(1L)).thenReturn(true);
    when(valueRepository.saveAndFlush(any()))
        .thenThrow(new DataAccessResourceFailureException("connection lost"));

    assertThatThrownBy(() -> service.setValue(1L, 100L, FieldValue.text("x")))
        .isInstanceOf(StorageException.class);
  }

  @Test
  void processFormConvertsEachFieldTypeAndSkipsEmptyInput() {
    when(screenConfigService.getFieldsForScreen(SCREEN, ObjectType.TICKET))
        .thenReturn(
            List.of(
                onScreen(1L, "Priority1", FieldType.DROPDOWN),
                onScreen(2L, "Urgent", FieldType.CHECKBOX),
                onScreen(3L, "Due", FieldType.DATE),
                onScreen(4L, "Start", FieldType.DATE_TIME),
                onScreen(5L, "Tags", FieldType.MULTISELECT),
                onScreen(6L, "Notes", FieldType.TEXT_AREA),
                onScreen(7L, "Missing", FieldType.TEXT)));
    Map<String, List<String>> form =
        Map.of(
            "DynamicField_Priority1", List.of("2"),
            "DynamicField_Urgent", List.of("on"),
            "DynamicField_Due", List.of("2024-05-01"),
            "DynamicField_Start", List.of("2024-05-01 10:15:00"),
            "DynamicField_Tags[]", List.of("a", "b"),
            "DynamicField_Notes", List.of(""),
            "Subject", List.of("unrelated"));

    int written = service.processForm(form, 100L, ObjectType.TICKET, SCREEN);

    assertThat(written).isEqualTo(5);
    var captor = ArgumentCaptor.forClass(DynamicFieldValue.class);
    verify(valueRepository, times(5)).saveAndFlush(captor.capture());
    var saved = captor.getAllValues();
    assertThat(saved.get(0).toFieldValue()).isEqualTo(FieldValue.text("2"));
    assertThat(saved.get(1).toFieldValue()).isEqualTo(FieldValue.integer(1));
    assertThat(saved.get(2).toFieldValue())
        .isEqualTo(FieldValue.date(LocalDateTime.of(2024, 5, 1, 0, 0)));
    assertThat(saved.get(3).toFieldValue())
        .isEqualTo(FieldValue.date(LocalDateTime.of(2024, 5, 1, 10, 15)));
    assertThat(saved.get(4).toFieldValue()).isEqualTo(FieldValue.text("a||b"));
    verify(valueRepository, never()).deleteByFieldIdAndObjectId(6L, 100L);
  }

  @Test
  void processFormKeepsUnparseableDateAsText() {
    when(screenConfigService.getFieldsForScreen(SCREEN, ObjectType.TICKET))
        .thenReturn(
            List.of(
                onScreen(3L, "Due", FieldType.DATE),
                onScreen(2L, "Urgent", FieldType.CHECKBOX)));

    service.processForm(
        Map.of("DynamicField_Due", List.of("next week"), "DynamicField_Urgent", List.of("off")),
        100L,
        ObjectType.TICKET,
        SCREEN);

    var captor = ArgumentCaptor.forClass(DynamicFieldValue.class);
    verify(valueRepository, times(2)).saveAndFlush(captor.capture());
    assertThat(captor.getAllValues().get(0).toFieldValue()).isEqualTo(FieldValue.text("next week"));
    assertThat(captor.getAllValues().get(1).toFieldValue()).isEqualTo(FieldValue.integer(0));
  }

  @Test
  void displayFallsBackToValidFieldsWithoutScreen() {
    var notes = ticketField(6L, "Notes", FieldType.TEXT);
    var due = ticketField(3L, "Due", FieldType.DATE);
    when(dynamicFieldRepository.findValidByObjectTypeOrdered(ObjectType.TICKET))
        .thenReturn(List.of(due, notes));
    when(valueRepository.findByObjectIdOrderByFieldId(100L))
        .thenReturn(List.of(new DynamicFieldValue(6L, 100L, FieldValue.text("hello"))));

    var display = service.getValuesForDisplay(100L, ObjectType.TICKET, null);

    assertThat(display)
        .extracting(FieldDisplay::displayValue)
        .containsExactly("-", "hello");
    verifyNoInteractions(screenConfigService);
  }

  @Test
  void distinctValuesUseConfiguredLimitByDefault() {
    when(valueRepository.findDistinctTextValues(1L, 100)).thenReturn(List.of("a", "b"));

    assertThat(service.getDistinctTextValues(1L, null)).containsExactly("a", "b");
  }
}
