/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.enrichment;

import java.io.IOException;
import java.util.List;

/**
 * Remote partner service that supplies profile records for subject ids.
 */
public interface EnrichmentService {

  /**
   * Fetches the records of one batch of subject ids in a single request.
   *
   * @throws IOException on transport errors and non-2xx answers.
   * @throws PartnerResponseException if the answer cannot be decoded.
   */
  List<EnrichmentRecord> fetchRecords(List<Long> subjectIds)
      throws IOException, PartnerResponseException;

  /** Returns whether the service answers a request for no ids. */
  boolean healthCheck();

}
