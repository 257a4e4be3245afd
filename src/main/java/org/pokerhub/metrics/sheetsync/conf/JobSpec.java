/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.conf;

import org.pokerhub.metrics.sheetsync.destination.ColumnRange;
import org.pokerhub.metrics.sheetsync.source.SourceSettings;
import org.pokerhub.metrics.sheetsync.source.TunnelSettings;

/**
 * Immutable descriptor of one source to destination synchronization.
 * Created once at startup and only read afterwards.
 */
public final class JobSpec {

  private final String name;

  private final SourceSettings source;

  private final TunnelSettings tunnel;

  private final String sheetTab;

  private final ColumnRange columnRange;

  private final int startRow;

  private final boolean clearTail;

  private final boolean enrich;

  private JobSpec(Builder builder) {
    this.name = builder.name;
    this.source = builder.source;
    this.tunnel = builder.tunnel;
    this.sheetTab = builder.sheetTab;
    this.columnRange = builder.columnRange;
    this.startRow = builder.startRow;
    this.clearTail = builder.clearTail;
    this.enrich = builder.enrich;
  }

  public static Builder builder(String name) {
    return new Builder(name);
  }

  public String getName() {
    return name;
  }

  public SourceSettings getSource() {
    return source;
  }

  /** Tunnel credentials, or {@code null} if the source is reachable. */
  public TunnelSettings getTunnel() {
    return tunnel;
  }

  public String getSheetTab() {
    return sheetTab;
  }

  public ColumnRange getColumnRange() {
    return columnRange;
  }

  public int getStartRow() {
    return startRow;
  }

  public boolean isClearTail() {
    return clearTail;
  }

  public boolean isEnrich() {
    return enrich;
  }

  @Override
  public String toString() {
    return name + " (" + source + " -> '" + sheetTab + "')";
  }

  /** Builder for {@link JobSpec}; used by the loader and by tests. */
  public static final class Builder {

    private final String name;
    private SourceSettings source;
    private TunnelSettings tunnel;
    private String sheetTab;
    private ColumnRange columnRange = ColumnRange.parse("A:R");
    private int startRow = 1;
    private boolean clearTail = true;
    private boolean enrich;

    private Builder(String name) {
      this.name = name;
    }

    public Builder source(SourceSettings source) {
      this.source = source;
      return this;
    }

    public Builder tunnel(TunnelSettings tunnel) {
      this.tunnel = tunnel;
      return this;
    }

    public Builder sheetTab(String sheetTab) {
      this.sheetTab = sheetTab;
      return this;
    }

    public Builder columnRange(ColumnRange columnRange) {
      this.columnRange = columnRange;
      return this;
    }

    public Builder startRow(int startRow) {
      this.startRow = startRow;
      return this;
    }

    public Builder clearTail(boolean clearTail) {
      this.clearTail = clearTail;
      return this;
    }

    public Builder enrich(boolean enrich) {
      this.enrich = enrich;
      return this;
    }

    public JobSpec build() {
      return new JobSpec(this);
    }
  }
}
