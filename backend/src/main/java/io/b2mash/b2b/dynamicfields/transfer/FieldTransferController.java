package io.b2mash.b2b.dynamicfields.transfer;

import io.b2mash.b2b.dynamicfields.transfer.dto.ExportRequest;
import io.b2mash.b2b.dynamicfields.transfer.dto.ImportCommitRequest;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/dynamic-fields")
public class FieldTransferController {

  private static final MediaType YAML = MediaType.parseMediaType("application/yaml");

  private final FieldExportService fieldExportService;
  private final FieldImportService fieldImportService;

  public FieldTransferController(
      FieldExportService fieldExportService, FieldImportService fieldImportService) {
    this.fieldExportService = fieldExportService;
    this.fieldImportService = fieldImportService;
  }

  @PostMapping("/export")
  public ResponseEntity<String> export(@Valid @RequestBody ExportRequest request) {
    var yaml =
        fieldExportService.exportYaml(
            request.fieldNames(), Boolean.TRUE.equals(request.includeScreens()));
    return ResponseEntity.ok()
        .contentType(YAML)
        .header(
            HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"dynamic-fields.yml\"")
        .body(yaml);
  }

  /** Accepts the raw YAML document as the request body. */
  @PostMapping(value = "/import/preview", consumes = MediaType.ALL_VALUE)
  public ResponseEntity<ImportPreview> preview(@RequestBody String yaml) {
    return ResponseEntity.ok(fieldImportService.preview(fieldImportService.parse(yaml)));
  }

  @PostMapping("/import/commit")
  public ResponseEntity<ImportResult> commit(@Valid @RequestBody ImportCommitRequest request) {
    return ResponseEntity.ok(
        fieldImportService.commit(
            request.bundle(),
            request.selectedFields(),
            request.selectedScreens(),
            Boolean.TRUE.equals(request.overwrite())));
  }
}
