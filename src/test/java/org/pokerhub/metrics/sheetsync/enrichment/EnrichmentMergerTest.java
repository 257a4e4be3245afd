/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.enrichment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import org.pokerhub.metrics.sheetsync.classify.CourseClassifier;
import org.pokerhub.metrics.sheetsync.source.RowSet;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.Test;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;

public class EnrichmentMergerTest {

  private static final int WIDTH = 24;

  private static final LocalDateTime LAST_ACTION =
      LocalDateTime.of(2024, 1, 5, 10, 0);

  private final EnrichmentMerger merger =
      new EnrichmentMerger(new CourseClassifier());

  private static RowSet rows() {
    return new RowSet(Arrays.asList("id", "username", "funnel_history",
        "last_action_date", "max_funnel_action"), Arrays.asList(
        Arrays.<Object>asList(1001L, "ann", "start", LAST_ACTION, "paid"),
        Arrays.<Object>asList("1002", "bob", "", null, "")));
  }

  private static EnrichmentRecord annRecord() {
    EnrichmentRecord record = new EnrichmentRecord();
    record.subjectId = 1001L;
    ObjectNode utm = JsonNodeFactory.instance.objectNode();
    utm.put("utm_medium", "cpc");
    utm.put("utm_source", "tg");
    record.utm = utm;
    record.referer = "https://pokerhub.example/";
    record.authorizationDate = "2024-01-05T10:00:00+03:00";
    record.lastVisitDate = "2024-02-01 08:30:00";
    record.group = Arrays.<Object>asList("VIP", "SPIN Модуль 2 Урок 3");
    ObjectNode courses = JsonNodeFactory.instance.objectNode();
    courses.putArray("MTT Course 1").add("Модуль 1 Урок 2")
        .add("Модуль 1 Урок 1");
    record.courses = courses;
    return record;
  }

  @Test()
  public void testHeaderMovesTrailingColumns() {
    RowSet enriched = merger.enrich(rows(),
        Collections.<EnrichmentRecord>emptyList(), WIDTH);
    List<String> header = enriched.getHeader();
    assertEquals(WIDTH, header.size());
    assertEquals("funnel_history", header.get(2));
    assertEquals(EnrichmentMerger.PARTNER_COLUMNS, header.subList(3, 12));
    assertEquals("last_action_date", header.get(12));
    assertEquals("max_funnel_action", header.get(13));
    assertEquals("", header.get(14));
    assertEquals("", header.get(23));
  }

  @Test()
  public void testRowWithRecord() {
    RowSet enriched = merger.enrich(rows(),
        Collections.singletonList(annRecord()), WIDTH);
    List<Object> ann = enriched.getRows().get(0);
    assertEquals(WIDTH, ann.size());
    assertEquals(1001L, ann.get(0));
    assertEquals("cpc", ann.get(3));
    assertEquals("tg", ann.get(4));
    assertEquals("", ann.get(5));
    assertEquals("https://pokerhub.example/", ann.get(6));
    assertEquals("2024-01-05 10:00:00", ann.get(7));
    assertEquals("2024-02-01 08:30:00", ann.get(8));
    assertEquals("VIP", ann.get(9));
    assertEquals("MTT1\nSPIN2", ann.get(10));
    String lessons = (String) ann.get(11);
    assertTrue(lessons.contains("Модуль 1 Урок 1"));
    assertTrue(lessons.contains("SPIN Модуль 2 Урок 3"));
    assertTrue(lessons.indexOf("Модуль 1 Урок 1")
        < lessons.indexOf("Модуль 1 Урок 2"));
    assertEquals(LAST_ACTION, ann.get(12));
    assertEquals("paid", ann.get(13));
  }

  @Test()
  public void testRowWithoutRecordKeepsEmptyPartnerCells() {
    RowSet enriched = merger.enrich(rows(),
        Collections.singletonList(annRecord()), WIDTH);
    List<Object> bob = enriched.getRows().get(1);
    assertEquals(WIDTH, bob.size());
    assertEquals("1002", bob.get(0));
    for (int i = 3; i < 12; i++) {
      assertEquals("", bob.get(i));
    }
    assertNull(bob.get(12));
  }

  @Test()
  public void testStringSubjectIdsMatch() {
    EnrichmentRecord bob = new EnrichmentRecord();
    bob.subjectId = 1002L;
    bob.referer = "ads";
    RowSet enriched = merger.enrich(rows(), Collections.singletonList(bob),
        WIDTH);
    assertEquals("ads", enriched.getRows().get(1).get(6));
  }

  @Test()
  public void testLastRecordWins() {
    EnrichmentRecord second = annRecord();
    second.referer = "second";
    RowSet enriched = merger.enrich(rows(), Arrays.asList(annRecord(),
        second), WIDTH);
    assertEquals("second", enriched.getRows().get(0).get(6));
  }

  @Test()
  public void testNarrowWidthCuts() {
    RowSet enriched = merger.enrich(rows(),
        Collections.<EnrichmentRecord>emptyList(), 4);
    assertEquals(4, enriched.getHeader().size());
    assertEquals(4, enriched.getRows().get(0).size());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRowsNeedTrailingColumns() {
    merger.enrich(new RowSet(Collections.singletonList("id"),
        new ArrayList<List<Object>>()),
        Collections.<EnrichmentRecord>emptyList(), WIDTH);
  }

  @Test()
  public void testClassifierInputOrder() {
    EnrichmentRecord record = annRecord();
    record.lessons = Collections.<Object>singletonList("CASH Модуль 3");
    List<Object> input = EnrichmentMerger.classifierInput(record);
    assertEquals(4, input.size());
    assertTrue(input.get(0) instanceof Map);
    assertEquals("CASH Модуль 3", input.get(1));
    assertEquals("VIP", input.get(2));
  }

  @Test()
  public void testGroupText() {
    assertEquals("VIP\nAlumni", EnrichmentMerger.groupText(
        Arrays.<Object>asList("VIP", "Модуль 1 Урок 1", 5, null, "Alumni")));
    assertEquals("", EnrichmentMerger.groupText(
        Collections.<Object>emptyList()));
  }

  @Test()
  public void testReformatTimestamp() {
    assertEquals("", EnrichmentMerger.reformatTimestamp(null));
    assertEquals("", EnrichmentMerger.reformatTimestamp(""));
    assertEquals("2024-01-05 10:00:00",
        EnrichmentMerger.reformatTimestamp("2024-01-05T10:00:00Z"));
    assertEquals("2024-01-05 10:00:00",
        EnrichmentMerger.reformatTimestamp("2024-01-05 10:00:00.123456"));
    assertEquals("2024-01-05 00:00:00",
        EnrichmentMerger.reformatTimestamp("2024-01-05"));
    assertEquals("yesterday",
        EnrichmentMerger.reformatTimestamp("yesterday"));
  }
}
