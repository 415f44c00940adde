package io.b2mash.b2b.dynamicfields.fieldvalue;

import io.b2mash.b2b.dynamicfields.config.DynamicFieldProperties;
import io.b2mash.b2b.dynamicfields.dynamicfield.DynamicFieldDefinition;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.OptionsConfig;
import io.b2mash.b2b.dynamicfields.fieldvalue.FieldValue.DateValue;
import io.b2mash.b2b.dynamicfields.fieldvalue.FieldValue.IntegerValue;
import io.b2mash.b2b.dynamicfields.fieldvalue.FieldValue.TextValue;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Renders stored values for read-only display. A missing value, or a value held in a slot the
 * field type does not read, renders as {@value #EMPTY}.
 */
@Component
public class FieldValueFormatter {

  public static final String EMPTY = "-";

  private static final DateTimeFormatter DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");
  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

  private final Pattern delimiter;

  public FieldValueFormatter(DynamicFieldProperties properties) {
    this.delimiter = Pattern.compile(Pattern.quote(properties.multiselectDelimiter()));
  }

  public String format(DynamicFieldDefinition field, FieldValue value) {
    if (value == null) {
      return EMPTY;
    }
    return switch (field.fieldType()) {
      case TEXT, TEXT_AREA -> value instanceof TextValue text ? text.value() : EMPTY;
      case DROPDOWN ->
          value instanceof TextValue text
              ? ((OptionsConfig) field.config()).labelFor(text.value())
              : EMPTY;
      case MULTISELECT -> {
        if (!(value instanceof TextValue text)) {
          yield EMPTY;
        }
        var options = (OptionsConfig) field.config();
        yield Arrays.stream(delimiter.split(text.value(), -1))
            .map(options::labelFor)
            .collect(Collectors.joining(", "));
      }
      case CHECKBOX ->
          value instanceof IntegerValue integer ? (integer.value() == 1 ? "Yes" : "No") : EMPTY;
      case DATE -> value instanceof DateValue date ? DATE.format(date.value()) : EMPTY;
      case DATE_TIME -> value instanceof DateValue date ? DATE_TIME.format(date.value()) : EMPTY;
    };
  }
}
