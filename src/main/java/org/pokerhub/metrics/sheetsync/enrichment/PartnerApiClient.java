/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.enrichment;

import org.pokerhub.metrics.sheetsync.downloader.Downloader;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URL;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Client of the partner service: {@code POST {"users": [ids...]}} answered
 * by a JSON array of user objects.
 *
 * <p>User objects are decoded one by one. An object that cannot be decoded
 * is logged and skipped, so the other users of the batch keep their
 * data.</p>
 */
public class PartnerApiClient implements EnrichmentService {

  private static final Logger logger =
      LoggerFactory.getLogger(PartnerApiClient.class);

  private static final ObjectMapper objectMapper = new ObjectMapper()
      .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private final URL apiUrl;

  private final Downloader downloader;

  public PartnerApiClient(URL apiUrl, Downloader downloader) {
    this.apiUrl = apiUrl;
    this.downloader = downloader;
  }

  /** Request body of the partner service. */
  static class UsersRequest {

    @JsonProperty("users")
    final List<Long> users;

    UsersRequest(List<Long> users) {
      this.users = users;
    }
  }

  @Override
  public List<EnrichmentRecord> fetchRecords(List<Long> subjectIds)
      throws IOException, PartnerResponseException {
    byte[] body = objectMapper.writeValueAsBytes(new UsersRequest(subjectIds));
    byte[] response = downloader.postJson(apiUrl,
        Collections.<String, String>emptyMap(), body);
    JsonNode tree;
    try {
      tree = objectMapper.readTree(response);
    } catch (JsonProcessingException e) {
      throw new PartnerResponseException("Cannot decode partner response: "
          + e.getOriginalMessage(), e);
    }
    if (null == tree || tree.isNull() || tree.isMissingNode()) {
      return Collections.emptyList();
    }
    if (!tree.isArray()) {
      throw new PartnerResponseException("Cannot decode partner response: "
          + "expected an array of users, got " + tree.getNodeType());
    }
    List<EnrichmentRecord> records = new ArrayList<>(tree.size());
    int index = 0;
    for (JsonNode user : tree) {
      try {
        records.add(objectMapper.treeToValue(user, EnrichmentRecord.class));
      } catch (JsonProcessingException | IllegalArgumentException e) {
        logger.warn("Skipping undecodable partner record #{} (tg_id {}): {}",
            index, user.path("tg_id").asText("?"), e.getMessage());
      }
      index++;
    }
    logger.debug("Partner service returned {} records for {} ids.",
        records.size(), subjectIds.size());
    return records;
  }

  @Override
  public boolean healthCheck() {
    try {
      fetchRecords(Collections.<Long>emptyList());
      return true;
    } catch (IOException | PartnerResponseException e) {
      logger.error("Partner service health check failed: {}", e.getMessage());
      return false;
    }
  }
}
