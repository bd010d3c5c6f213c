package com.evoila.rosetta.common.plan;

public record DataSource(
    String name, String database, String retentionPolicy, String alias, SourceKind kind) {

  public DataSource {
    if (kind == null) {
      kind = SourceKind.Basic.TABLE;
    }
  }

  public static DataSource of(String name, SourceKind kind) {
    return new DataSource(name, null, null, null, kind);
  }

  public static DataSource table(String name) {
    return of(name, SourceKind.Basic.TABLE);
  }

  public static DataSource metric(String name) {
    return of(name, SourceKind.Basic.METRIC);
  }

  public static DataSource measurement(String name) {
    return of(name, SourceKind.Basic.MEASUREMENT);
  }
}
