package io.b2mash.b2b.dynamicfields.transfer.dto;

import jakarta.validation.constraints.NotEmpty;
import java.util.List;

public record ExportRequest(@NotEmpty List<String> fieldNames, Boolean includeScreens) {}
