package com.spreadsheet.calc.controllers;

import com.spreadsheet.calc.CalcApplication;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * These tests verify end-to-end HTTP behavior and JSON handling.
 */
@SpringBootTest(
        classes = CalcApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class SheetControllerIntegrationTest {

    @LocalServerPort
    int port;

    private RestTemplate restTemplate;

    @BeforeEach
    void setUp() {
        restTemplate = new RestTemplate();
    }

    private String url(String path) {
        return "http://localhost:" + port + path;
    }

    private long createSheet(String json) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        ResponseEntity<Long> response =
                restTemplate.postForEntity(url("/sheet"), new HttpEntity<>(json, headers), Long.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertNotNull(response.getBody());
        return response.getBody();
    }

    private void setCell(long sheetId, String a1, String rawValue) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        restTemplate.put(url("/sheet/" + sheetId + "/cell/" + a1), new HttpEntity<>(rawValue, headers));
    }

    private Map<String, String> getSheet(long sheetId) {
        ResponseEntity<Map> response = restTemplate.getForEntity(url("/sheet/" + sheetId), Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        return response.getBody();
    }

    /**
     * Creates a sheet, sets values and formulas, then changes an input.
     */
    @Test
    void testSetCellsAndRecalculate() {
        long sheetId = createSheet("{\"rows\": 10, \"columns\": 5}");

        setCell(sheetId, "A1", "10");
        setCell(sheetId, "B1", "=A1*2");
        setCell(sheetId, "C1", "=B1+10");
        assertEquals("30", getSheet(sheetId).get("C1"));

        setCell(sheetId, "A1", "5");
        Map<String, String> data = getSheet(sheetId);
        assertEquals("5", data.get("A1"));
        assertEquals("20", data.get("C1"));
        assertFalse(data.containsKey("D1"));
    }

    @Test
    void testDefaultSizeComesFromConfiguration() {
        long sheetId = createSheet("{}");
        setCell(sheetId, "J20", "ok");
        assertEquals("ok", getSheet(sheetId).get("J20"));

        HttpClientErrorException error = assertThrows(HttpClientErrorException.class,
                () -> setCell(sheetId, "K1", "too far"));
        assertEquals(HttpStatus.BAD_REQUEST, error.getStatusCode());
        assertTrue(error.getResponseBodyAsString().contains("CELL_OUT_OF_BOUNDS"));
    }

    @Test
    void testErrorResponses() {
        long sheetId = createSheet("{\"rows\": 5, \"columns\": 5}");

        HttpClientErrorException badRef = assertThrows(HttpClientErrorException.class,
                () -> setCell(sheetId, "1A", "x"));
        assertEquals(HttpStatus.BAD_REQUEST, badRef.getStatusCode());
        assertTrue(badRef.getResponseBodyAsString().contains("INVALID_REFERENCE"));

        HttpClientErrorException missing = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForEntity(url("/sheet/999999"), Map.class));
        assertEquals(HttpStatus.NOT_FOUND, missing.getStatusCode());

        // Formula errors are cell values, not HTTP errors
        setCell(sheetId, "A1", "=1/0");
        assertEquals("#ERROR!", getSheet(sheetId).get("A1"));
    }

    @Test
    void testCellDetailsAndDecimalPlaces() {
        long sheetId = createSheet("{\"rows\": 5, \"columns\": 5}");
        setCell(sheetId, "A1", "=1/3");
        restTemplate.put(url("/sheet/" + sheetId + "/cell/A1/decimalPlaces/3"), null);

        ResponseEntity<Map> cell = restTemplate.getForEntity(url("/sheet/" + sheetId + "/cell/A1"), Map.class);
        assertEquals("0.333", cell.getBody().get("displayValue"));
        assertEquals("=1/3", cell.getBody().get("rawValue"));
        assertEquals("FORMULA", cell.getBody().get("dataType"));

        restTemplate.delete(url("/sheet/" + sheetId + "/cell/A1/decimalPlaces"));
        assertEquals("0.3333333333333333", getSheet(sheetId).get("A1"));
    }

    @Test
    void testEvaluateEndpoint() {
        long sheetId = createSheet("{\"rows\": 5, \"columns\": 5}");
        setCell(sheetId, "A1", "4");
        setCell(sheetId, "A2", "6");

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.TEXT_PLAIN);
        ResponseEntity<String> response = restTemplate.postForEntity(url("/sheet/" + sheetId + "/evaluate"),
                new HttpEntity<>("=AVERAGE(A1:A2)", headers), String.class);
        assertEquals("5", response.getBody());
    }

    @Test
    void testStructuralEdits() {
        long sheetId = createSheet("{\"rows\": 6, \"columns\": 3}");
        for (int i = 1; i <= 5; i++) {
            setCell(sheetId, "A" + i, String.valueOf(i));
        }
        setCell(sheetId, "B1", "=SUM(A1:A5)");
        assertEquals("15", getSheet(sheetId).get("B1"));

        restTemplate.postForEntity(url("/sheet/" + sheetId + "/rows/1"), null, Map.class);
        setCell(sheetId, "A2", "100");
        assertEquals("115", getSheet(sheetId).get("B1"));

        restTemplate.delete(url("/sheet/" + sheetId + "/rows/1"));
        assertEquals("15", getSheet(sheetId).get("B1"));

        restTemplate.postForEntity(url("/sheet/" + sheetId + "/columns/0/move/2"), null, Map.class);
        Map<String, String> data = getSheet(sheetId);
        assertEquals("15", data.get("A1"));
        assertEquals("1", data.get("C1"));
    }

    @Test
    void testDependencyGraphs() {
        long sheetId = createSheet("{\"rows\": 5, \"columns\": 5}");
        setCell(sheetId, "A1", "5");
        setCell(sheetId, "B1", "=A1*2");
        setCell(sheetId, "C1", "=B1+1");

        ResponseEntity<Map> forwardResponse =
                restTemplate.getForEntity(url("/sheet/" + sheetId + "/dependencies"), Map.class);
        Map<String, List<String>> forward = forwardResponse.getBody();
        assertEquals(List.of("A1"), forward.get("B1"));
        assertEquals(List.of("B1"), forward.get("C1"));

        ResponseEntity<Map> reverseResponse =
                restTemplate.getForEntity(url("/sheet/" + sheetId + "/dependents"), Map.class);
        Map<String, List<String>> reverse = reverseResponse.getBody();
        assertEquals(List.of("B1"), reverse.get("A1"));
        assertEquals(List.of("C1"), reverse.get("B1"));
    }
}
