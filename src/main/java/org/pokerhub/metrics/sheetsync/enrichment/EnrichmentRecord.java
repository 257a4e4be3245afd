/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.enrichment;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * User object returned by the partner service, keyed by {@code tg_id}.
 * Fields the service does not send stay {@code null}; {@code utm} and
 * {@code courses} are kept as trees and read only when they are objects.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EnrichmentRecord {

  /**
   * Subject id as known to the relational sources.
   */
  @JsonProperty("tg_id")
  Long subjectId;

  /**
   * Acquisition attributes like {@code utm_medium}; other shapes are
   * treated as absent.
   */
  @JsonProperty("utm")
  JsonNode utm;

  @JsonProperty("referer")
  String referer;

  /**
   * ISO-8601 timestamp of the first authorization, as sent.
   */
  @JsonProperty("authorization_date")
  String authorizationDate;

  /**
   * ISO-8601 timestamp of the last visit, as sent.
   */
  @JsonProperty("last_visit_date")
  String lastVisitDate;

  /**
   * Group memberships; a single string is accepted as a one-element list.
   */
  @JsonProperty("group")
  @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
  List<Object> group;

  /**
   * Course titles mapped to the titles of their lessons; other shapes are
   * treated as absent.
   */
  @JsonProperty("courses")
  JsonNode courses;

  /**
   * Flat lesson list; a single string is accepted as a one-element list.
   */
  @JsonProperty("lessons")
  @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
  List<Object> lessons;

  public Long getSubjectId() {
    return subjectId;
  }

  public String getUtmMedium() {
    return utmValue("utm_medium");
  }

  public String getUtmSource() {
    return utmValue("utm_source");
  }

  public String getUtmCampaign() {
    return utmValue("utm_campaign");
  }

  private String utmValue(String field) {
    if (null == utm || !utm.isObject()) {
      return null;
    }
    JsonNode value = utm.get(field);
    return null == value || value.isNull() ? null : value.asText();
  }

  public String getReferer() {
    return referer;
  }

  public String getAuthorizationDate() {
    return authorizationDate;
  }

  public String getLastVisitDate() {
    return lastVisitDate;
  }

  public List<Object> getGroup() {
    return null == group ? Collections.emptyList() : group;
  }

  /**
   * Returns course titles mapped to their lesson titles in the order sent.
   * A single lesson string counts as a one-element list.
   */
  public Map<String, List<String>> getCourses() {
    if (null == courses || !courses.isObject()) {
      return Collections.emptyMap();
    }
    Map<String, List<String>> result = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> fields = courses.fields();
    while (fields.hasNext()) {
      Map.Entry<String, JsonNode> course = fields.next();
      List<String> lessons = new ArrayList<>();
      JsonNode value = course.getValue();
      if (value.isArray()) {
        for (JsonNode lesson : value) {
          if (lesson.isValueNode() && !lesson.isNull()) {
            lessons.add(lesson.asText());
          }
        }
      } else if (value.isTextual()) {
        lessons.add(value.asText());
      }
      result.put(course.getKey(), lessons);
    }
    return result;
  }

  public List<Object> getLessons() {
    return null == lessons ? Collections.emptyList() : lessons;
  }
}
