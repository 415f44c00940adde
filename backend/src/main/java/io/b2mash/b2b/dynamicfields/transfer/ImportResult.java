package io.b2mash.b2b.dynamicfields.transfer;

import java.util.List;

/** Per-item outcome of an import commit, in processing order. */
public record ImportResult(List<FieldOutcome> fields, List<ScreenOutcome> screens) {

  public record FieldOutcome(String name, ImportStatus status, String message) {}

  public record ScreenOutcome(String fieldName, boolean applied, int screens, String message) {}

  public long count(ImportStatus status) {
    return fields.stream().filter(outcome -> outcome.status() == status).count();
  }
}
