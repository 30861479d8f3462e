package com.example.platformauth.domain.entity;

/**
 * Outcome of a session store write. When {@code applied} is false the write was older than the
 * stored record and {@code record} is the record that was kept.
 */
public record SaveResult(SessionRecord record, boolean applied) {

  public static SaveResult applied(SessionRecord record) {
    return new SaveResult(record, true);
  }

  public static SaveResult stale(SessionRecord current) {
    return new SaveResult(current, false);
  }
}
