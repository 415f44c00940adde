package io.b2mash.b2b.dynamicfields.fieldvalue;

import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.fieldvalue.dto.FieldDisplayResponse;
import io.b2mash.b2b.dynamicfields.fieldvalue.dto.FormProcessingResponse;
import java.util.List;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.util.MultiValueMap;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dynamic-fields")
public class FieldValueController {

  private final FieldValueService fieldValueService;

  public FieldValueController(FieldValueService fieldValueService) {
    this.fieldValueService = fieldValueService;
  }

  @GetMapping("/values/{objectId}")
  public ResponseEntity<List<StoredFieldValue>> getValues(@PathVariable long objectId) {
    return ResponseEntity.ok(fieldValueService.getValues(objectId));
  }

  /** An empty body clears the value. */
  @PutMapping("/values/{objectId}/{fieldId}")
  public ResponseEntity<Void> setValue(
      @PathVariable long objectId,
      @PathVariable Long fieldId,
      @RequestBody(required = false) FieldValue value) {
    fieldValueService.setValue(fieldId, objectId, value);
    return ResponseEntity.noContent().build();
  }

  @DeleteMapping("/values/{objectId}/{fieldId}")
  public ResponseEntity<Void> clearValue(@PathVariable long objectId, @PathVariable Long fieldId) {
    fieldValueService.setValue(fieldId, objectId, null);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/values/{objectId}/display")
  public ResponseEntity<List<FieldDisplayResponse>> display(
      @PathVariable long objectId,
      @RequestParam String objectType,
      @RequestParam(required = false) String screenKey) {
    var displays =
        fieldValueService.getValuesForDisplay(
            objectId, ObjectType.fromExternalName(objectType), screenKey);
    return ResponseEntity.ok(displays.stream().map(FieldDisplayResponse::from).toList());
  }

  @PostMapping(
      value = "/values/{objectId}/form",
      consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
  public ResponseEntity<FormProcessingResponse> processForm(
      @PathVariable long objectId,
      @RequestParam String objectType,
      @RequestParam String screenKey,
      @RequestBody MultiValueMap<String, String> form) {
    int written =
        fieldValueService.processForm(
            form, objectId, ObjectType.fromExternalName(objectType), screenKey);
    return ResponseEntity.ok(new FormProcessingResponse(objectId, screenKey, written));
  }

  @GetMapping("/{fieldId}/distinct-values")
  public ResponseEntity<List<String>> distinctValues(
      @PathVariable Long fieldId, @RequestParam(required = false) Integer limit) {
    return ResponseEntity.ok(fieldValueService.getDistinctTextValues(fieldId, limit));
  }
}
