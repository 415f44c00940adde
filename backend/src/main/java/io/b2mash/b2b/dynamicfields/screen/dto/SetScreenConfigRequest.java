package io.b2mash.b2b.dynamicfields.screen.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;

public record SetScreenConfigRequest(@NotBlank String screenKey, @NotNull Integer level) {}
