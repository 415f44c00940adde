package io.b2mash.b2b.dynamicfields.transfer;

import java.util.List;

/** What a commit of the bundle would do, computed without writing anything. */
public record ImportPreview(List<FieldPreview> fields) {

  public record FieldPreview(
      String name,
      String label,
      String fieldType,
      String objectType,
      boolean exists,
      boolean hasScreenConfig) {}
}
