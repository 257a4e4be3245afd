/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.enrichment;

import org.pokerhub.metrics.sheetsync.classify.CourseClassifier;
import org.pokerhub.metrics.sheetsync.classify.CourseSummary;
import org.pokerhub.metrics.sheetsync.source.RowSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Joins rows with partner records by subject id and rewrites the row
 * schema.
 *
 * <p>The two trailing synchronization columns of the input are moved behind
 * the partner columns. Rows without a partner record keep empty partner
 * cells. All output rows, and the header, are padded with empty cells or
 * cut to the given width.</p>
 */
public class EnrichmentMerger {

  private static final Logger logger =
      LoggerFactory.getLogger(EnrichmentMerger.class);

  /** Names of the partner columns inserted before the trailing columns. */
  public static final List<String> PARTNER_COLUMNS = Collections
      .unmodifiableList(Arrays.asList("ph_utm_medium", "ph_utm_source",
          "ph_utm_campaign", "ph_referer", "auth_date", "last_visit", "group",
          "courses", "lessons"));

  static final int TRAILING_COLUMNS = 2;

  private static final DateTimeFormatter DATE_TIME =
      DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

  private final CourseClassifier classifier;

  public EnrichmentMerger(CourseClassifier classifier) {
    this.classifier = classifier;
  }

  /**
   * Returns the enriched rows.
   *
   * @param width Output column count.
   * @throws IllegalArgumentException if the rows lack the trailing columns.
   */
  public RowSet enrich(RowSet rows, Collection<EnrichmentRecord> records,
      int width) {
    List<String> header = rows.getHeader();
    if (header.size() < TRAILING_COLUMNS) {
      throw new IllegalArgumentException("Rows need at least "
          + TRAILING_COLUMNS + " columns, but have " + header.size() + ".");
    }
    Map<Long, EnrichmentRecord> bySubject = new HashMap<>();
    for (EnrichmentRecord record : records) {
      if (null != record.getSubjectId()) {
        bySubject.put(record.getSubjectId(), record);
      }
    }
    logger.info("Merging {} rows with {} partner records.", rows.size(),
        bySubject.size());
    List<String> newHeader = new ArrayList<>(
        header.subList(0, header.size() - TRAILING_COLUMNS));
    newHeader.addAll(PARTNER_COLUMNS);
    newHeader.addAll(header.subList(header.size() - TRAILING_COLUMNS,
        header.size()));
    List<List<Object>> newRows = new ArrayList<>(rows.size());
    for (List<Object> row : rows.getRows()) {
      Long subjectId = RowSet.subjectId(row.get(0));
      EnrichmentRecord record = null == subjectId ? null
          : bySubject.get(subjectId);
      List<Object> newRow = new ArrayList<>(
          row.subList(0, row.size() - TRAILING_COLUMNS));
      newRow.addAll(partnerCells(record));
      newRow.addAll(row.subList(row.size() - TRAILING_COLUMNS, row.size()));
      newRows.add(fitWidth(newRow, width, ""));
    }
    return new RowSet(fitWidth(newHeader, width, ""), newRows);
  }

  private List<Object> partnerCells(EnrichmentRecord record) {
    if (null == record) {
      List<Object> empty = new ArrayList<>();
      for (int i = 0; i < PARTNER_COLUMNS.size(); i++) {
        empty.add("");
      }
      return empty;
    }
    CourseSummary summary = classifier.parse(classifierInput(record));
    return Arrays.<Object>asList(
        nullToEmpty(record.getUtmMedium()),
        nullToEmpty(record.getUtmSource()),
        nullToEmpty(record.getUtmCampaign()),
        nullToEmpty(record.getReferer()),
        reformatTimestamp(record.getAuthorizationDate()),
        reformatTimestamp(record.getLastVisitDate()),
        groupText(record.getGroup()),
        summary.getTags(),
        summary.getLessons());
  }

  /** Course map first, then the flat lesson list, then the groups. */
  static List<Object> classifierInput(EnrichmentRecord record) {
    List<Object> input = new ArrayList<>();
    if (!record.getCourses().isEmpty()) {
      input.add(record.getCourses());
    }
    input.addAll(record.getLessons());
    input.addAll(record.getGroup());
    return input;
  }

  /** Newline-joined string memberships that are not lesson entries. */
  static String groupText(List<Object> group) {
    List<String> names = new ArrayList<>();
    for (Object item : group) {
      if (item instanceof String
          && !CourseClassifier.isLessonEntry((String) item)) {
        names.add((String) item);
      }
    }
    return String.join("\n", names);
  }

  /**
   * Reformats an ISO-8601 timestamp to {@code yyyy-MM-dd HH:mm:ss} in its
   * own offset. Values that do not parse are returned unchanged.
   */
  static String reformatTimestamp(String value) {
    if (null == value || value.isEmpty()) {
      return "";
    }
    String iso = value.trim();
    if (iso.length() > 10 && iso.charAt(10) == ' ') {
      iso = iso.substring(0, 10) + 'T' + iso.substring(11);
    }
    try {
      return OffsetDateTime.parse(iso).format(DATE_TIME);
    } catch (DateTimeParseException e) {
      logger.trace("'{}' has no offset.", value);
    }
    try {
      return LocalDateTime.parse(iso).format(DATE_TIME);
    } catch (DateTimeParseException e) {
      logger.trace("'{}' is no local date-time.", value);
    }
    try {
      return LocalDate.parse(iso).atStartOfDay().format(DATE_TIME);
    } catch (DateTimeParseException e) {
      logger.debug("Keeping unparseable timestamp '{}' as is.", value);
      return value;
    }
  }

  /** Pads with the filler or cuts the list to exactly the given width. */
  static <T> List<T> fitWidth(List<T> values, int width, T filler) {
    List<T> fitted = new ArrayList<>(values.subList(0,
        Math.min(values.size(), width)));
    while (fitted.size() < width) {
      fitted.add(filler);
    }
    return fitted;
  }

  private static String nullToEmpty(String value) {
    return null == value ? "" : value;
  }
}
