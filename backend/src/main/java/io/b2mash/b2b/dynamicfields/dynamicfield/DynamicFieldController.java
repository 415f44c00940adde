package io.b2mash.b2b.dynamicfields.dynamicfield;

import io.b2mash.b2b.dynamicfields.dynamicfield.config.FieldConfigCodec;
import io.b2mash.b2b.dynamicfields.dynamicfield.dto.CreateDynamicFieldRequest;
import io.b2mash.b2b.dynamicfields.dynamicfield.dto.DynamicFieldResponse;
import io.b2mash.b2b.dynamicfields.dynamicfield.dto.UpdateDynamicFieldRequest;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
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
public class DynamicFieldController {

  private final DynamicFieldService dynamicFieldService;
  private final FieldConfigCodec configCodec;

  public DynamicFieldController(
      DynamicFieldService dynamicFieldService, FieldConfigCodec configCodec) {
    this.dynamicFieldService = dynamicFieldService;
    this.configCodec = configCodec;
  }

  @GetMapping
  public ResponseEntity<List<DynamicFieldResponse>> list(
      @RequestParam(required = false) String objectType,
      @RequestParam(required = false) String fieldType) {
    var fields =
        dynamicFieldService.list(
            objectType == null || objectType.isBlank()
                ? null
                : ObjectType.fromExternalName(objectType),
            fieldType == null || fieldType.isBlank()
                ? null
                : FieldType.fromExternalName(fieldType));
    return ResponseEntity.ok(fields.stream().map(this::toResponse).toList());
  }

  @GetMapping("/grouped")
  public ResponseEntity<Map<String, List<DynamicFieldResponse>>> grouped() {
    var grouped = new LinkedHashMap<String, List<DynamicFieldResponse>>();
    dynamicFieldService
        .listGroupedByObjectType()
        .forEach(
            (objectType, fields) ->
                grouped.put(
                    objectType.externalName(), fields.stream().map(this::toResponse).toList()));
    return ResponseEntity.ok(grouped);
  }

  @GetMapping("/{id}")
  public ResponseEntity<DynamicFieldResponse> get(@PathVariable Long id) {
    return ResponseEntity.ok(toResponse(dynamicFieldService.getById(id)));
  }

  @PostMapping
  public ResponseEntity<DynamicFieldResponse> create(
      @Valid @RequestBody CreateDynamicFieldRequest request) {
    var command =
        new DynamicFieldCommand(
            request.name(),
            request.label(),
            request.fieldOrder() == null ? 1 : request.fieldOrder(),
            request.fieldType(),
            request.objectType(),
            request.config() == null
                ? null
                : configCodec.fromDocument(request.fieldType(), request.config()),
            request.valid() == null || request.valid(),
            Boolean.TRUE.equals(request.internal()),
            Boolean.TRUE.equals(request.autoConfig()));
    var response = toResponse(dynamicFieldService.create(command));
    return ResponseEntity.created(URI.create("/api/dynamic-fields/" + response.id()))
        .body(response);
  }

  @PutMapping("/{id}")
  public ResponseEntity<DynamicFieldResponse> update(
      @PathVariable Long id, @Valid @RequestBody UpdateDynamicFieldRequest request) {
    var command =
        new DynamicFieldCommand(
            request.name(),
            request.label(),
            request.fieldOrder() == null ? 1 : request.fieldOrder(),
            request.fieldType(),
            request.objectType(),
            request.config() == null
                ? null
                : configCodec.fromDocument(request.fieldType(), request.config()),
            request.valid() == null || request.valid(),
            false,
            Boolean.TRUE.equals(request.autoConfig()));
    return ResponseEntity.ok(toResponse(dynamicFieldService.update(id, command)));
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable Long id) {
    dynamicFieldService.delete(id);
    return ResponseEntity.noContent().build();
  }

  private DynamicFieldResponse toResponse(DynamicFieldDefinition definition) {
    return DynamicFieldResponse.from(definition, configCodec);
  }
}
