/* Copyright 2026 The SheetSync Authors
 * See LICENSE for licensing information */

package org.pokerhub.metrics.sheetsync.destination;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import org.pokerhub.metrics.sheetsync.downloader.Downloader;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;

import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

public class SheetsDestinationTest {

  private static final String SPREADSHEET_URL =
      "https://docs.google.com/spreadsheets/d/abc-DEF_123/edit#gid=0";

  private static final String API = "http://localhost/sheets/";

  private static final ObjectMapper objectMapper = new ObjectMapper();

  private Downloader downloader;

  private SheetsDestination destination;

  @Before
  public void setUp() throws Exception {
    downloader = mock(Downloader.class);
    destination = new SheetsDestination(SPREADSHEET_URL, API, downloader,
        () -> "token");
    given(downloader.get(any(URL.class), anyMap())).willReturn(
        metadata("Leads", 7, 10));
  }

  @After
  public void tearDown() {
    destination.close();
  }

  private static byte[] metadata(String title, int sheetId, int rowCount) {
    return ("{\"sheets\":[{\"properties\":{\"sheetId\":" + sheetId
        + ",\"title\":\"" + title + "\",\"gridProperties\":{\"rowCount\":"
        + rowCount + "}}}]}").getBytes(StandardCharsets.UTF_8);
  }

  private static List<List<String>> grid(int rows) {
    List<List<String>> grid = new ArrayList<>();
    grid.add(Arrays.asList("id", "name", "funnel_history"));
    for (int i = 1; i <= rows; i++) {
      grid.add(Arrays.asList(String.valueOf(i), "user" + i, ""));
    }
    return grid;
  }

  @Test()
  public void testSpreadsheetId() {
    assertEquals("abc-DEF_123", SheetsDestination.spreadsheetId(
        SPREADSHEET_URL));
    assertEquals("abc-DEF_123", SheetsDestination.spreadsheetId(
        "abc-DEF_123"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNoSpreadsheetId() {
    SheetsDestination.spreadsheetId("https://docs.google.com/document/x y");
  }

  @Test()
  public void testA1QuotesTabNames() {
    assertEquals("'Leads'!A1", SheetsDestination.a1("Leads", "A1"));
    assertEquals("'Bob''s leads'!A2:R9",
        SheetsDestination.a1("Bob's leads", "A2:R9"));
  }

  @Test()
  public void testConnectReadsMetadata() throws Exception {
    destination.connect();
    ArgumentCaptor<URL> url = ArgumentCaptor.forClass(URL.class);
    @SuppressWarnings({"unchecked", "rawtypes"})
    ArgumentCaptor<Map<String, String>> headers =
        ArgumentCaptor.forClass((Class) Map.class);
    verify(downloader).get(url.capture(), headers.capture());
    assertTrue(url.getValue().toString().startsWith(API + "abc-DEF_123?"));
    assertEquals("Bearer token", headers.getValue().get("Authorization"));
  }

  @Test()
  public void testWriteValuesFormatsAndClearsTail() throws Exception {
    destination.write("Leads", grid(3), 2, ColumnRange.parse("A:C"), true);
    ArgumentCaptor<URL> putUrl = ArgumentCaptor.forClass(URL.class);
    ArgumentCaptor<byte[]> putBody = ArgumentCaptor.forClass(byte[].class);
    verify(downloader).putJson(putUrl.capture(), anyMap(),
        putBody.capture());
    assertEquals(API + "abc-DEF_123/values/%27Leads%27%21A2"
        + "?valueInputOption=USER_ENTERED", putUrl.getValue().toString());
    JsonNode body = objectMapper.readTree(putBody.getValue());
    assertEquals("'Leads'!A2", body.path("range").asText());
    assertEquals("ROWS", body.path("majorDimension").asText());
    assertEquals(4, body.path("values").size());
    assertEquals("user3", body.path("values").get(3).get(1).asText());

    ArgumentCaptor<URL> postUrl = ArgumentCaptor.forClass(URL.class);
    ArgumentCaptor<byte[]> postBody = ArgumentCaptor.forClass(byte[].class);
    verify(downloader, times(2)).postJson(postUrl.capture(), anyMap(),
        postBody.capture());
    assertEquals(API + "abc-DEF_123:batchUpdate",
        postUrl.getAllValues().get(0).toString());
    JsonNode requests = objectMapper.readTree(postBody.getAllValues().get(0))
        .path("requests");
    assertEquals(3, requests.size());
    assertEquals(API + "abc-DEF_123/values:batchClear",
        postUrl.getAllValues().get(1).toString());
    JsonNode clear = objectMapper.readTree(postBody.getAllValues().get(1));
    assertEquals("'Leads'!A6:C10", clear.path("ranges").get(0).asText());
  }

  @Test()
  public void testNoTailToClear() throws Exception {
    destination.write("Leads", grid(9), 2, ColumnRange.parse("A:C"), true);
    verify(downloader, never()).postJson(
        argThat((URL url) -> url.toString().endsWith(":batchClear")),
        anyMap(), any(byte[].class));
  }

  @Test()
  public void testKeepTail() throws Exception {
    destination.write("Leads", grid(1), 1, ColumnRange.parse("A:C"), false);
    verify(downloader, never()).postJson(
        argThat((URL url) -> url.toString().endsWith(":batchClear")),
        anyMap(), any(byte[].class));
  }

  @Test()
  public void testFormattingFailureDoesNotFailWrite() throws Exception {
    given(downloader.postJson(
        argThat((URL url) -> url.toString().endsWith(":batchUpdate")),
        anyMap(), any(byte[].class))).willThrow(new IOException("quota"));
    destination.write("Leads", grid(2), 1, ColumnRange.parse("A:C"), false);
    verify(downloader).putJson(any(URL.class), anyMap(), any(byte[].class));
  }

  @Test()
  public void testEmptyGridClearsFromStartRow() throws Exception {
    destination.write("Leads", grid(0), 2, ColumnRange.parse("A:R"), true);
    verify(downloader, never()).putJson(any(URL.class), anyMap(),
        any(byte[].class));
    ArgumentCaptor<byte[]> postBody = ArgumentCaptor.forClass(byte[].class);
    verify(downloader).postJson(any(URL.class), anyMap(),
        postBody.capture());
    assertEquals("'Leads'!A2:R10", objectMapper.readTree(postBody.getValue())
        .path("ranges").get(0).asText());
  }

  @Test()
  public void testMissingTab() throws Exception {
    try {
      destination.write("Robot", grid(1), 1, ColumnRange.parse("A:C"), true);
      fail("Should have thrown an IOException.");
    } catch (IOException e) {
      assertTrue(e.getMessage().contains("'Robot'"));
    }
    verify(downloader, never()).putJson(any(URL.class), anyMap(),
        any(byte[].class));
  }

  @Test()
  public void testWriteStatus() throws Exception {
    destination.writeStatus("Leads", "2024-01-05 10:00:00 | Leads | "
        + "records: 3");
    ArgumentCaptor<URL> putUrl = ArgumentCaptor.forClass(URL.class);
    ArgumentCaptor<byte[]> putBody = ArgumentCaptor.forClass(byte[].class);
    verify(downloader).putJson(putUrl.capture(), anyMap(),
        putBody.capture());
    assertTrue(putUrl.getValue().toString().contains("%27Leads%27%21A1"));
    JsonNode values = objectMapper.readTree(putBody.getValue())
        .path("values");
    assertEquals(1, values.size());
    assertEquals("2024-01-05 10:00:00 | Leads | records: 3",
        values.get(0).get(0).asText());
  }
}
