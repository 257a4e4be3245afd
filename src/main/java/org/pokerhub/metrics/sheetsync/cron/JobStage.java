/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.cron;

/**
 * Stages a job passes through per tick, strictly in declaration order.
 * Any stage may end in {@link #FAILED}.
 */
public enum JobStage {

  IDLE("idle"),
  CONNECTING("connecting"),
  FETCHING("fetching"),
  MERGING("merging"),
  ENRICHING("enriching"),
  WRITING("writing"),
  REPORTING_STATUS("reporting status"),
  DONE("done"),
  FAILED("failed");

  private final String description;

  JobStage(String description) {
    this.description = description;
  }

  @Override
  public String toString() {
    return description;
  }
}
