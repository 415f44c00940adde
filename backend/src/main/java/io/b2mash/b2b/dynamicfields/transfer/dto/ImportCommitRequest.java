package io.b2mash.b2b.dynamicfields.transfer.dto;

import jakarta.validation.constraints.NotBlank;
import java.util.List;

/**
 * @param bundle the exported YAML document
 * @param selectedFields names to import; null imports every entry
 * @param selectedScreens names whose screen config is applied; null applies all
 */
public record ImportCommitRequest(
    @NotBlank String bundle,
    List<String> selectedFields,
    List<String> selectedScreens,
    Boolean overwrite) {}
