package io.b2mash.b2b.dynamicfields.filter;

import static org.assertj.core.api.Assertions.assertThat;

import io.b2mash.b2b.dynamicfields.config.DynamicFieldProperties;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class FieldFilterParserTest {

  private final FieldFilterParser parser =
      new FieldFilterParser(DynamicFieldProperties.defaults());

  @Test
  void bareNameMeansEquality() {
    assertThat(parser.parse(Map.of("df_Priority1", List.of("2"))))
        .containsExactly(FieldFilter.byName("Priority1", FilterOperator.EQ, "2"));
  }

  @Test
  void longestOperatorSuffixWins() {
    var filters =
        parser.parse(
            Map.of(
                "df_Notes_notempty", List.of("1"),
                "df_Due_gte", List.of("2024-01-01"),
                "df_Tags_notin", List.of("a,b")));

    assertThat(filters)
        .containsExactly(
            FieldFilter.byName("Due", FilterOperator.GTE, "2024-01-01"),
            FieldFilter.byName("Notes", FilterOperator.NOT_EMPTY, "1"),
            FieldFilter.byName("Tags", FilterOperator.NOT_IN, "a,b"));
  }

  @Test
  void suffixMustLeaveAFieldName() {
    assertThat(parser.parse(Map.of("df__gt", List.of("1"))))
        .containsExactly(FieldFilter.byName("_gt", FilterOperator.EQ, "1"));
  }

  @Test
  void ignoresForeignAndEmptyParameters() {
    var filters =
        parser.parse(
            Map.of(
                "page", List.of("2"),
                "df_Empty", List.of(""),
                "df_None", List.of(),
                "df_Urgent", List.of("1", "0")));

    assertThat(filters).containsExactly(FieldFilter.byName("Urgent", FilterOperator.EQ, "1"));
  }

  @Test
  void customPrefixIsHonoured() {
    var custom = new FieldFilterParser(new DynamicFieldProperties(null, "field.", null, 0, 0));

    assertThat(custom.parse(Map.of("field.Priority1_lt", List.of("3"), "df_X", List.of("1"))))
        .containsExactly(FieldFilter.byName("Priority1", FilterOperator.LT, "3"));
  }
}
