package io.b2mash.b2b.dynamicfields.dynamicfield.dto;

import io.b2mash.b2b.dynamicfields.dynamicfield.FieldType;
import io.b2mash.b2b.dynamicfields.dynamicfield.ObjectType;
import io.b2mash.b2b.dynamicfields.dynamicfield.config.ConfigDocument;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

public record UpdateDynamicFieldRequest(
    @NotBlank @Size(max = 200) String name,
    @NotBlank @Size(max = 200) String label,
    Integer fieldOrder,
    @NotNull FieldType fieldType,
    @NotNull ObjectType objectType,
    Boolean valid,
    Boolean autoConfig,
    ConfigDocument config) {}
