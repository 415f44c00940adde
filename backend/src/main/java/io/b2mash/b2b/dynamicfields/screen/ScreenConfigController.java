package io.b2mash.b2b.dynamicfields.screen;

import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.screen.dto.ScreenFieldResponse;
import io.b2mash.b2b.dynamicfields.screen.dto.ScreenMatrixResponse;
import io.b2mash.b2b.dynamicfields.screen.dto.SetScreenConfigRequest;
import jakarta.validation.Valid;
import java.util.List;
import java.util.Map;
import org.springframework.http.ResponseEntity;
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
public class ScreenConfigController {

  private final ScreenConfigService screenConfigService;

  public ScreenConfigController(ScreenConfigService screenConfigService) {
    this.screenConfigService = screenConfigService;
  }

  @GetMapping("/screens")
  public ResponseEntity<ScreenMatrixResponse> matrix(
      @RequestParam(defaultValue = "Ticket") String objectType) {
    var matrix = screenConfigService.getMatrix(ObjectType.fromExternalName(objectType));
    return ResponseEntity.ok(ScreenMatrixResponse.from(matrix));
  }

  @GetMapping("/screens/definitions")
  public ResponseEntity<List<ScreenDefinition>> definitions(
      @RequestParam(required = false) String objectType) {
    if (objectType == null || objectType.isBlank()) {
      return ResponseEntity.ok(ScreenDefinitions.all());
    }
    return ResponseEntity.ok(
        ScreenDefinitions.forObjectType(ObjectType.fromExternalName(objectType)));
  }

  @GetMapping("/screens/{screenKey}/fields")
  public ResponseEntity<List<ScreenFieldResponse>> fieldsForScreen(
      @PathVariable String screenKey, @RequestParam(defaultValue = "Ticket") String objectType) {
    var fields =
        screenConfigService.getFieldsForScreen(screenKey, ObjectType.fromExternalName(objectType));
    return ResponseEntity.ok(fields.stream().map(ScreenFieldResponse::from).toList());
  }

  @GetMapping("/{id}/screens")
  public ResponseEntity<Map<String, ScreenVisibility>> configForField(@PathVariable Long id) {
    return ResponseEntity.ok(screenConfigService.getConfigForField(id));
  }

  @PutMapping("/{id}/screens")
  public ResponseEntity<Map<String, ScreenVisibility>> bulkSet(
      @PathVariable Long id, @RequestBody Map<String, Integer> levels) {
    return ResponseEntity.ok(screenConfigService.bulkSet(id, levels));
  }

  @PostMapping("/{id}/screen")
  public ResponseEntity<Map<String, ScreenVisibility>> set(
      @PathVariable Long id, @Valid @RequestBody SetScreenConfigRequest request) {
    screenConfigService.set(id, request.screenKey(), request.level());
    return ResponseEntity.ok(screenConfigService.getConfigForField(id));
  }
}
