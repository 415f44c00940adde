package io.b2mash.b2b.dynamicfields.fieldvalue.dto;

public record FormProcessingResponse(long objectId, String screenKey, int written) {}
