package com.spreadsheet.drilldown.controllers;

import com.spreadsheet.drilldown.DrillDownApplication;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.*;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.util.LinkedMultiValueMap;
import org.springframework.util.MultiValueMap;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests using a running server instance (RANDOM_PORT).
 * Each test uploads a small workbook generated with POI and drives the REST API.
 */
@SpringBootTest(
        classes = DrillDownApplication.class,
        webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT
)
@ActiveProfiles("test")
class DrillDownControllerIntegrationTest {

    @LocalServerPort
    int port;

    private final RestTemplate restTemplate = new RestTemplate();
    private String base;
    private String sessionId;

    @BeforeEach
    void setUp() throws IOException {
        base = "http://localhost:" + port + "/api/sessions";
        ResponseEntity<Map> created = upload("model.xlsx", buildWorkbook());
        assertEquals(HttpStatus.OK, created.getStatusCode());
        sessionId = (String) created.getBody().get("sessionId");
        assertNotNull(sessionId);
        assertEquals(List.of("Sheet1", "Labels"), created.getBody().get("sheets"));
    }

    /**
     * Sheet1: A1=10, A2==C1*2, C1=5, B5==A1+A2, D1==Labels!B2
     * Labels: A2="Revenue", B2=7
     */
    private byte[] buildWorkbook() throws IOException {
        try (XSSFWorkbook workbook = new XSSFWorkbook()) {
            Sheet sheet = workbook.createSheet("Sheet1");
            Row row1 = sheet.createRow(0);
            row1.createCell(0).setCellValue(10);
            row1.createCell(2).setCellValue(5);
            row1.createCell(3).setCellFormula("Labels!B2");
            sheet.createRow(1).createCell(0).setCellFormula("C1*2");
            sheet.createRow(4).createCell(1).setCellFormula("A1+A2");

            Sheet labels = workbook.createSheet("Labels");
            Row labelRow = labels.createRow(1);
            labelRow.createCell(0).setCellValue("Revenue");
            labelRow.createCell(1).setCellValue(7);

            workbook.getCreationHelper().createFormulaEvaluator().evaluateAll();
            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            return out.toByteArray();
        }
    }

    private ResponseEntity<Map> upload(String filename, byte[] content) {
        MultiValueMap<String, Object> body = new LinkedMultiValueMap<>();
        body.add("file", new ByteArrayResource(content) {
            @Override
            public String getFilename() {
                return filename;
            }
        });
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.MULTIPART_FORM_DATA);
        return restTemplate.postForEntity(base, new HttpEntity<>(body, headers), Map.class);
    }

    private HttpEntity<String> json(String body) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        return new HttpEntity<>(body, headers);
    }

    /**
     * Drill into B5, then expand A2 by its pathId.
     */
    @Test
    void testDrillDownAndExpand() {
        ResponseEntity<Map> response = restTemplate.postForEntity(
                base + "/" + sessionId + "/sheets/Sheet1/cells/B5/drill-down", null, Map.class);
        assertEquals(HttpStatus.OK, response.getStatusCode());
        Map<String, Object> result = response.getBody();
        assertEquals("Sheet1!B5", result.get("sourceCell"));
        assertEquals("=A1+A2", result.get("sourceFormula"));
        assertEquals(20.0, ((Number) result.get("sourceValue")).doubleValue());

        List<Map<String, Object>> dependencies = (List<Map<String, Object>>) result.get("dependencies");
        assertEquals(2, dependencies.size());
        assertEquals("Sheet1!A1", dependencies.get(0).get("cellReference"));
        assertEquals(true, dependencies.get(0).get("isLeaf"));
        assertEquals(false, dependencies.get(1).get("isLeaf"));
        assertEquals(true, dependencies.get(1).get("canExpand"));
        assertEquals("simple", dependencies.get(1).get("complexity"));

        String pathId = (String) dependencies.get(1).get("pathId");
        ResponseEntity<List> children = restTemplate.postForEntity(
                base + "/" + sessionId + "/sheets/Sheet1/cells/A2/expand/" + pathId, null, List.class);
        assertEquals(HttpStatus.OK, children.getStatusCode());
        Map<String, Object> c1 = (Map<String, Object>) children.getBody().get(0);
        assertEquals("Sheet1!C1", c1.get("cellReference"));
        assertEquals(5.0, ((Number) c1.get("value")).doubleValue());

        ResponseEntity<Void> collapsed = restTemplate.postForEntity(
                base + "/" + sessionId + "/nodes/" + pathId + "/collapse", null, Void.class);
        assertEquals(HttpStatus.OK, collapsed.getStatusCode());
    }

    /**
     * Label column set after drill-down renames the visible cross-sheet node.
     */
    @Test
    void testNamingFlow() {
        restTemplate.postForEntity(base + "/" + sessionId + "/sheets/Sheet1/cells/D1/drill-down", null, Map.class);

        ResponseEntity<Map> config = restTemplate.exchange(
                base + "/" + sessionId + "/sheets/Labels/naming/label-column",
                HttpMethod.PUT, json("{\"column\": \"A\"}"), Map.class);
        assertEquals("A", config.getBody().get("labelColumn"));

        ResponseEntity<Map> resolved = restTemplate.postForEntity(base + "/" + sessionId + "/names/resolve",
                json("{\"cellReferences\": [\"Labels!B2\", \"Sheet1!A1\"]}"), Map.class);
        Map<String, Object> b2 = (Map<String, Object>) resolved.getBody().get("Labels!B2");
        assertEquals("Revenue", b2.get("name"));
        assertEquals("component", b2.get("source"));
        Map<String, Object> a1 = (Map<String, Object>) resolved.getBody().get("Sheet1!A1");
        assertEquals("fallback", a1.get("source"));

        restTemplate.exchange(base + "/" + sessionId + "/naming-mode", HttpMethod.PUT,
                json("{\"mode\": \"generated\"}"), Void.class);
        ResponseEntity<Map> ai = restTemplate.postForEntity(base + "/" + sessionId + "/ai-suggestions",
                json("{\"cellReference\": \"Labels!B2\", \"suggestedName\": \"Total Revenue\","
                        + " \"confidence\": 0.85, \"status\": \"success\"}"), Map.class);
        assertEquals("Total Revenue", ai.getBody().get("name"));
        assertEquals("ai", ai.getBody().get("source"));

        ResponseEntity<Map> manual = restTemplate.exchange(
                base + "/" + sessionId + "/sheets/Labels/cells/B2/manual-name",
                HttpMethod.PUT, json("{\"name\": \"Top line\"}"), Map.class);
        assertEquals("manual", manual.getBody().get("source"));

        ResponseEntity<Map> allConfig = restTemplate.getForEntity(base + "/" + sessionId + "/naming-config",
                Map.class);
        assertTrue(allConfig.getBody().containsKey("Labels"));
    }

    @Test
    void testCellInfoAndRowValues() {
        ResponseEntity<Map> info = restTemplate.getForEntity(
                base + "/" + sessionId + "/sheets/Sheet1/cells/B5", Map.class);
        assertEquals(true, info.getBody().get("canDrillDown"));
        assertEquals(2, info.getBody().get("referenceCount"));

        ResponseEntity<List> row = restTemplate.getForEntity(
                base + "/" + sessionId + "/sheets/Labels/rows/2", List.class);
        assertEquals(2, row.getBody().size());
    }

    @Test
    void testErrors() {
        HttpClientErrorException notFound = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForEntity(base + "/missing/sheets", List.class));
        assertEquals(HttpStatus.NOT_FOUND, notFound.getStatusCode());

        HttpClientErrorException badAddress = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.postForEntity(base + "/" + sessionId + "/sheets/Sheet1/cells/1A/drill-down",
                        null, Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, badAddress.getStatusCode());
        assertTrue(badAddress.getResponseBodyAsString().contains("INVALID_CELL_ADDRESS"));

        HttpClientErrorException badColumn = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.exchange(base + "/" + sessionId + "/sheets/Labels/naming/label-column",
                        HttpMethod.PUT, json("{\"column\": \"Z\"}"), Map.class));
        assertEquals(HttpStatus.BAD_REQUEST, badColumn.getStatusCode());

        HttpClientErrorException unknownNode = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.postForEntity(base + "/" + sessionId + "/nodes/abc/expand", null, List.class));
        assertEquals(HttpStatus.NOT_FOUND, unknownNode.getStatusCode());

        HttpClientErrorException unreadable = assertThrows(HttpClientErrorException.class,
                () -> upload("notes.txt", "not a workbook".getBytes()));
        assertEquals(HttpStatus.UNPROCESSABLE_ENTITY, unreadable.getStatusCode());
    }

    @Test
    void testCloseSession() {
        restTemplate.delete(base + "/" + sessionId);

        HttpClientErrorException gone = assertThrows(HttpClientErrorException.class,
                () -> restTemplate.getForEntity(base + "/" + sessionId, Map.class));
        assertEquals(HttpStatus.NOT_FOUND, gone.getStatusCode());
    }
}
