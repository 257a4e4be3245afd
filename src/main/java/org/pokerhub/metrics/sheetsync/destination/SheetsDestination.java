/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.destination;

import org.pokerhub.metrics.sheetsync.downloader.Downloader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UnsupportedEncodingException;
import java.net.URL;
import java.net.URLEncoder;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Spreadsheet destination talking to the Sheets REST API.
 *
 * <p>Instances hold no per-write state, so concurrent jobs may share one.
 * Presentation requests run on a separate thread while the values are
 * written; their failure is logged and does not fail the write.</p>
 */
public class SheetsDestination implements Destination, AutoCloseable {

  private static final Logger logger =
      LoggerFactory.getLogger(SheetsDestination.class);

  static final String API_BASE =
      "https://sheets.googleapis.com/v4/spreadsheets/";

  private static final Pattern SPREADSHEET_ID =
      Pattern.compile("/spreadsheets/d/([a-zA-Z0-9-_]+)");

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private final String spreadsheetId;

  private final String apiBase;

  private final Downloader downloader;

  private final AccessTokenProvider tokens;

  private final ExecutorService presentationExecutor;

  /** Creates a destination for the spreadsheet behind the given URL. */
  public SheetsDestination(String spreadsheetUrl, Downloader downloader,
      AccessTokenProvider tokens) {
    this(spreadsheetUrl, API_BASE, downloader, tokens);
  }

  SheetsDestination(String spreadsheetUrl, String apiBase,
      Downloader downloader, AccessTokenProvider tokens) {
    this.spreadsheetId = spreadsheetId(spreadsheetUrl);
    this.apiBase = apiBase;
    this.downloader = downloader;
    this.tokens = tokens;
    AtomicInteger threadNumber = new AtomicInteger();
    this.presentationExecutor = Executors.newCachedThreadPool(runnable -> {
      Thread thread = new Thread(runnable,
          "SheetSync-Presentation-Thread-" + threadNumber.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    });
  }

  /**
   * Extracts the spreadsheet id from its URL, or accepts a bare id.
   *
   * @throws IllegalArgumentException if the URL holds no id.
   */
  static String spreadsheetId(String spreadsheetUrl) {
    if (null == spreadsheetUrl || spreadsheetUrl.trim().isEmpty()) {
      throw new IllegalArgumentException("Spreadsheet URL is missing.");
    }
    Matcher matcher = SPREADSHEET_ID.matcher(spreadsheetUrl);
    if (matcher.find()) {
      return matcher.group(1);
    }
    if (spreadsheetUrl.matches("[a-zA-Z0-9-_]+")) {
      return spreadsheetUrl;
    }
    throw new IllegalArgumentException("No spreadsheet id in '"
        + spreadsheetUrl + "'.");
  }

  @Override
  public void connect() throws IOException {
    JsonNode sheets = metadata().path("sheets");
    logger.info("Connected to spreadsheet {} with {} tabs.", spreadsheetId,
        sheets.size());
  }

  @Override
  public void write(String tab, List<List<String>> grid, int startRow,
      ColumnRange range, boolean clearTail) throws IOException {
    SheetInfo sheet = sheet(tab);
    if (grid.size() <= 1) {
      logger.warn("No data to write for '{}'.", tab);
      if (clearTail) {
        clear(tab, range.toA1(startRow, Math.max(startRow, sheet.rowCount)));
      }
      return;
    }
    Future<?> styling = presentationExecutor.submit(() -> {
      applyPresentation(sheet, grid.get(0), range, startRow, grid.size());
      return null;
    });
    ObjectNode body = objectMapper.createObjectNode();
    String target = a1(tab, range.first() + startRow);
    body.put("range", target);
    body.put("majorDimension", "ROWS");
    body.set("values", objectMapper.valueToTree(grid));
    downloader.putJson(url("/values/" + encode(target)
        + "?valueInputOption=USER_ENTERED"), authorization(),
        objectMapper.writeValueAsBytes(body));
    awaitPresentation(tab, styling);
    logger.info("Wrote {} rows to '{}'.", grid.size() - 1, tab);
    if (clearTail) {
      int tailStart = startRow + grid.size();
      int rowCount = sheet(tab).rowCount;
      if (rowCount >= tailStart) {
        clear(tab, range.toA1(tailStart, rowCount));
      }
    }
  }

  private void awaitPresentation(String tab, Future<?> styling)
      throws IOException {
    try {
      styling.get();
    } catch (ExecutionException e) {
      logger.warn("Failed to apply formatting for '{}': {}", tab,
          e.getCause().getMessage());
    } catch (InterruptedException e) {
      styling.cancel(true);
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while formatting '" + tab + "'.", e);
    }
  }

  private void applyPresentation(SheetInfo sheet, List<String> header,
      ColumnRange range, int startRow, int rowCount) throws IOException {
    ArrayNode requests = Presentation.requests(sheet.sheetId, header, range,
        startRow, rowCount);
    ObjectNode body = objectMapper.createObjectNode();
    body.set("requests", requests);
    downloader.postJson(url(":batchUpdate"), authorization(),
        objectMapper.writeValueAsBytes(body));
    logger.debug("Formatting applied for '{}'.", sheet.title);
  }

  @Override
  public void writeStatus(String tab, String status) throws IOException {
    ObjectNode body = objectMapper.createObjectNode();
    String target = a1(tab, "A1");
    body.put("range", target);
    body.put("majorDimension", "ROWS");
    body.set("values", objectMapper.valueToTree(
        Collections.singletonList(Collections.singletonList(status))));
    downloader.putJson(url("/values/" + encode(target)
        + "?valueInputOption=USER_ENTERED"), authorization(),
        objectMapper.writeValueAsBytes(body));
  }

  private void clear(String tab, String cells) throws IOException {
    ObjectNode body = objectMapper.createObjectNode();
    body.putArray("ranges").add(a1(tab, cells));
    downloader.postJson(url("/values:batchClear"), authorization(),
        objectMapper.writeValueAsBytes(body));
    logger.debug("Cleared {} in '{}'.", cells, tab);
  }

  private JsonNode metadata() throws IOException {
    byte[] response = downloader.get(url("?fields=" + encode(
        "sheets.properties(sheetId,title,gridProperties.rowCount)")),
        authorization());
    return objectMapper.readTree(response);
  }

  SheetInfo sheet(String tab) throws IOException {
    for (JsonNode sheet : metadata().path("sheets")) {
      JsonNode properties = sheet.path("properties");
      if (tab.equals(properties.path("title").asText())) {
        return new SheetInfo(tab, properties.path("sheetId").asInt(),
            properties.path("gridProperties").path("rowCount").asInt());
      }
    }
    throw new IOException("Tab '" + tab + "' not found in spreadsheet "
        + spreadsheetId + ".");
  }

  private Map<String, String> authorization() throws IOException {
    return Collections.singletonMap("Authorization",
        "Bearer " + tokens.getAccessToken());
  }

  private URL url(String suffix) throws IOException {
    return new URL(apiBase + spreadsheetId + suffix);
  }

  static String a1(String tab, String cells) {
    return "'" + tab.replace("'", "''") + "'!" + cells;
  }

  private static String encode(String text)
      throws UnsupportedEncodingException {
    return URLEncoder.encode(text, "UTF-8").replace("+", "%20");
  }

  @Override
  public void close() {
    presentationExecutor.shutdown();
    try {
      if (!presentationExecutor.awaitTermination(10, TimeUnit.SECONDS)) {
        presentationExecutor.shutdownNow();
      }
    } catch (InterruptedException e) {
      presentationExecutor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  /** Properties of one tab. */
  static final class SheetInfo {

    final String title;

    final int sheetId;

    final int rowCount;

    SheetInfo(String title, int sheetId, int rowCount) {
      this.title = title;
      this.sheetId = sheetId;
      this.rowCount = rowCount;
    }
  }
}
