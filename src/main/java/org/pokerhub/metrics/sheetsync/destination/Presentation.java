/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.destination;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Formatting requests for freshly written rows: long text columns are
 * clipped, the tag column wraps, and columns and rows get fixed sizes.
 * Columns are located by their header name; absent columns are skipped.
 */
public final class Presentation {

  static final String HISTORY = "funnel_history";

  static final String GROUP = "group";

  static final String TAGS = "courses";

  static final String LESSONS = "lessons";

  static final int ROW_HEIGHT = 100;

  private static final Map<String, Integer> COLUMN_WIDTHS =
      new LinkedHashMap<>();

  static {
    COLUMN_WIDTHS.put(HISTORY, 100);
    COLUMN_WIDTHS.put(GROUP, 120);
    COLUMN_WIDTHS.put(TAGS, 80);
    COLUMN_WIDTHS.put(LESSONS, 200);
  }

  private static final String FORMAT_FIELDS =
      "userEnteredFormat(wrapStrategy,verticalAlignment)";

  private static final JsonNodeFactory json = JsonNodeFactory.instance;

  private Presentation() {}

  /**
   * Builds the requests for a written block.
   *
   * @param sheetId Numeric id of the tab.
   * @param header Header names of the written block.
   * @param startRow 1-based row of the header.
   * @param rowCount Number of written rows, header included.
   */
  public static ArrayNode requests(int sheetId, List<String> header,
      ColumnRange range, int startRow, int rowCount) {
    ArrayNode requests = json.arrayNode();
    int startRowIndex = startRow - 1;
    int endRowIndex = startRow - 1 + rowCount;
    for (Map.Entry<String, Integer> column : COLUMN_WIDTHS.entrySet()) {
      int offset = header.indexOf(column.getKey());
      if (offset < 0) {
        continue;
      }
      int columnIndex = range.firstIndex() - 1 + offset;
      String wrapStrategy = TAGS.equals(column.getKey()) ? "WRAP" : "CLIP";
      requests.add(repeatCell(sheetId, startRowIndex, endRowIndex,
          columnIndex, wrapStrategy));
      requests.add(dimension(sheetId, "COLUMNS", columnIndex,
          columnIndex + 1, column.getValue()));
    }
    requests.add(dimension(sheetId, "ROWS", startRowIndex, endRowIndex,
        ROW_HEIGHT));
    return requests;
  }

  private static ObjectNode repeatCell(int sheetId, int startRowIndex,
      int endRowIndex, int columnIndex, String wrapStrategy) {
    ObjectNode range = json.objectNode()
        .put("sheetId", sheetId)
        .put("startRowIndex", startRowIndex)
        .put("endRowIndex", endRowIndex)
        .put("startColumnIndex", columnIndex)
        .put("endColumnIndex", columnIndex + 1);
    ObjectNode format = json.objectNode()
        .put("wrapStrategy", wrapStrategy)
        .put("verticalAlignment", "TOP");
    ObjectNode repeatCell = json.objectNode();
    repeatCell.set("range", range);
    repeatCell.set("cell", json.objectNode().set("userEnteredFormat",
        format));
    repeatCell.put("fields", FORMAT_FIELDS);
    ObjectNode request = json.objectNode();
    request.set("repeatCell", repeatCell);
    return request;
  }

  private static ObjectNode dimension(int sheetId, String dimension,
      int startIndex, int endIndex, int pixelSize) {
    ObjectNode range = json.objectNode()
        .put("sheetId", sheetId)
        .put("dimension", dimension)
        .put("startIndex", startIndex)
        .put("endIndex", endIndex);
    ObjectNode update = json.objectNode();
    update.set("range", range);
    update.set("properties", json.objectNode().put("pixelSize", pixelSize));
    update.put("fields", "pixelSize");
    ObjectNode request = json.objectNode();
    request.set("updateDimensionProperties", update);
    return request;
  }
}
