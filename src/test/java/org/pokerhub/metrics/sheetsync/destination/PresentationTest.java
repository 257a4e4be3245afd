/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.destination;

import static org.junit.Assert.assertEquals;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

public class PresentationTest {

  private static final List<String> HEADER = Arrays.asList("id",
      "funnel_history", "group", "courses", "lessons", "last_visit");

  @Test()
  public void testRequestsForKnownColumns() {
    ArrayNode requests = Presentation.requests(7, HEADER,
        ColumnRange.parse("A:F"), 2, 11);
    assertEquals(9, requests.size());
    JsonNode history = requests.get(0).path("repeatCell");
    assertEquals(7, history.path("range").path("sheetId").asInt());
    assertEquals(1, history.path("range").path("startRowIndex").asInt());
    assertEquals(12, history.path("range").path("endRowIndex").asInt());
    assertEquals(1, history.path("range").path("startColumnIndex").asInt());
    assertEquals(2, history.path("range").path("endColumnIndex").asInt());
    assertEquals("CLIP", history.path("cell").path("userEnteredFormat")
        .path("wrapStrategy").asText());
    assertEquals("TOP", history.path("cell").path("userEnteredFormat")
        .path("verticalAlignment").asText());
    JsonNode historyWidth = requests.get(1)
        .path("updateDimensionProperties");
    assertEquals("COLUMNS", historyWidth.path("range").path("dimension")
        .asText());
    assertEquals(100, historyWidth.path("properties").path("pixelSize")
        .asInt());
    JsonNode tags = requests.get(4).path("repeatCell");
    assertEquals(3, tags.path("range").path("startColumnIndex").asInt());
    assertEquals("WRAP", tags.path("cell").path("userEnteredFormat")
        .path("wrapStrategy").asText());
    assertEquals(200, requests.get(7).path("updateDimensionProperties")
        .path("properties").path("pixelSize").asInt());
    JsonNode rows = requests.get(8).path("updateDimensionProperties");
    assertEquals("ROWS", rows.path("range").path("dimension").asText());
    assertEquals(1, rows.path("range").path("startIndex").asInt());
    assertEquals(12, rows.path("range").path("endIndex").asInt());
    assertEquals(Presentation.ROW_HEIGHT, rows.path("properties")
        .path("pixelSize").asInt());
  }

  @Test()
  public void testColumnsAreOffsetByRangeStart() {
    ArrayNode requests = Presentation.requests(0, HEADER,
        ColumnRange.parse("C:H"), 1, 3);
    assertEquals(3, requests.get(0).path("repeatCell").path("range")
        .path("startColumnIndex").asInt());
  }

  @Test()
  public void testOnlyRowHeightsWithoutKnownColumns() {
    ArrayNode requests = Presentation.requests(0, Arrays.asList("id",
        "name"), ColumnRange.parse("A:R"), 1, 5);
    assertEquals(1, requests.size());
    assertEquals("ROWS", requests.get(0).path("updateDimensionProperties")
        .path("range").path("dimension").asText());
  }
}
