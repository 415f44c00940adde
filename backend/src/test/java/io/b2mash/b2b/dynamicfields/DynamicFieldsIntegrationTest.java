package io.b2mash.b2b.dynamicfields;

import static org.assertj.core.api.Assertions.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.jayway.jsonpath.JsonPath;
import io.b2mash.b2b.dynamicfields.actor.RequestAttributeActorResolver;
import io.b2mash.b2b.dynamicfields.fieldvalue.DynamicFieldValueRepository;
import io.b2mash.b2b.dynamicfields.screen.ScreenConfigRepository;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.webmvc.test.autoconfigure.AutoConfigureMockMvc;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Import(TestcontainersConfiguration.class)
@ActiveProfiles("test")
@Testcontainers(disabledWithoutDocker = true)
class DynamicFieldsIntegrationTest {

  @Autowired private MockMvc mockMvc;
  @Autowired private DynamicFieldValueRepository valueRepository;
  @Autowired private ScreenConfigRepository screenConfigRepository;

  private long createField(String json) throws Exception {
    var result =
        mockMvc
            .perform(
                post("/api/dynamic-fields")
                    .requestAttr(RequestAttributeActorResolver.USER_ID_ATTRIBUTE, 42L)
                    .contentType(MediaType.APPLICATION_JSON)
                    .content(json))
            .andExpect(status().isCreated())
            .andReturn();
    return ((Number) JsonPath.read(result.getResponse().getContentAsString(), "$.id"))
        .longValue();
  }

  @Test
  void dropdownValuesAreFilterableByComparison() throws Exception {
    long fieldId =
        createField(
            """
            {
              "name": "Priority1",
              "label": "Priority",
              "fieldOrder": 1,
              "fieldType": "Dropdown",
              "objectType": "Ticket",
              "config": {"PossibleValues": {"1": "Low", "2": "High"}}
            }
            """);

    mockMvc
        .perform(get("/api/dynamic-fields/" + fieldId))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.fieldType").value("Dropdown"))
        .andExpect(jsonPath("$.config.PossibleValues['2']").value("High"))
        .andExpect(jsonPath("$.createBy").value(42));

    mockMvc
        .perform(
            put("/api/dynamic-fields/values/1001/" + fieldId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"text\", \"value\": \"2\"}"))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(
            put("/api/dynamic-fields/values/1002/" + fieldId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"text\", \"value\": \"1\"}"))
        .andExpect(status().isNoContent());

    mockMvc
        .perform(get("/api/dynamic-fields/matches").param("df_Priority1_gt", "1"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.length()").value(1))
        .andExpect(jsonPath("$[0]").value(1001));

    mockMvc
        .perform(get("/api/dynamic-fields/" + fieldId + "/distinct-values"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0]").value("1"))
        .andExpect(jsonPath("$[1]").value("2"));
  }

  @Test
  void screenPlacementDrivesFormProcessingAndDisplay() throws Exception {
    long fieldId =
        createField(
            """
            {"name": "Urgent", "label": "Urgent", "fieldType": "Checkbox", "objectType": "Ticket"}
            """);

    mockMvc
        .perform(
            put("/api/dynamic-fields/" + fieldId + "/screens")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"AgentTicketPhone\": 2, \"AgentTicketZoom\": 1}"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.AgentTicketPhone").value(2));

    mockMvc
        .perform(
            post("/api/dynamic-fields/values/2001/form")
                .contentType(MediaType.APPLICATION_FORM_URLENCODED)
                .param("objectType", "Ticket")
                .param("screenKey", "AgentTicketPhone")
                .param("DynamicField_Urgent", "on"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.written").value(1));

    mockMvc
        .perform(
            get("/api/dynamic-fields/values/2001/display")
                .param("objectType", "Ticket")
                .param("screenKey", "AgentTicketZoom"))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$[0].name").value("Urgent"))
        .andExpect(jsonPath("$[0].displayValue").value("Yes"));

    mockMvc
        .perform(
            put("/api/dynamic-fields/" + fieldId + "/screens")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"AgentTicketZoom\": 2}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.attribute").value("level"));
  }

  @Test
  void deletingFieldRemovesValuesAndScreenRows() throws Exception {
    long fieldId =
        createField(
            """
            {"name": "Notes", "label": "Notes", "fieldType": "Text", "objectType": "Ticket"}
            """);
    mockMvc
        .perform(
            post("/api/dynamic-fields/" + fieldId + "/screen")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"screenKey\": \"AgentTicketNote\", \"level\": 1}"))
        .andExpect(status().isOk());
    mockMvc
        .perform(
            put("/api/dynamic-fields/values/3001/" + fieldId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"text\", \"value\": \"hello\"}"))
        .andExpect(status().isNoContent());
    mockMvc
        .perform(
            put("/api/dynamic-fields/values/3002/" + fieldId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\": \"text\"}"))
        .andExpect(status().isNoContent());
    assertThat(valueRepository.findByObjectIdOrderByFieldId(3002L)).isEmpty();

    mockMvc.perform(delete("/api/dynamic-fields/" + fieldId)).andExpect(status().isNoContent());

    mockMvc.perform(get("/api/dynamic-fields/" + fieldId)).andExpect(status().isNotFound());
    assertThat(valueRepository.findByObjectIdOrderByFieldId(3001L)).isEmpty();
    assertThat(screenConfigRepository.findByFieldIdOrderByScreenKey(fieldId)).isEmpty();
  }

  @Test
  void duplicateNameIsConflict() throws Exception {
    createField(
        """
        {"name": "Region", "label": "Region", "fieldType": "Text", "objectType": "Ticket"}
        """);

    mockMvc
        .perform(
            post("/api/dynamic-fields")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    """
                    {"name": "Region", "label": "Other", "fieldType": "Text", "objectType": "Ticket"}
                    """))
        .andExpect(status().isConflict());
  }

  @Test
  void exportedBundleImportsAsSkippedWithoutOverwrite() throws Exception {
    createField(
        """
        {"name": "Channel", "label": "Channel", "fieldType": "Text", "objectType": "Ticket"}
        """);

    var export =
        mockMvc
            .perform(
                post("/api/dynamic-fields/export")
                    .contentType(MediaType.APPLICATION_JSON)
                    .content("{\"fieldNames\": [\"Channel\"], \"includeScreens\": true}"))
            .andExpect(status().isOk())
            .andExpect(header().string("Content-Disposition", containsString("attachment")))
            .andReturn()
            .getResponse()
            .getContentAsString();

    mockMvc
        .perform(
            post("/api/dynamic-fields/import/preview")
                .contentType("application/yaml")
                .content(export))
        .andExpect(status().isOk())
        .andExpect(jsonPath("$.fields[0].name").value("Channel"))
        .andExpect(jsonPath("$.fields[0].exists").value(true));
  }
}
