package io.b2mash.b2b.dynamicfields.transfer;

public enum ImportStatus {
  CREATED,
  UPDATED,
  SKIPPED,
  FAILED
}
