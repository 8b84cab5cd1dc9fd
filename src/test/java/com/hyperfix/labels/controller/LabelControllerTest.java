package com.hyperfix.labels.controller;

import com.hyperfix.labels.config.AppProperties;
import com.hyperfix.labels.model.LabelRecord;
import com.hyperfix.labels.service.LabelExportService;
import com.hyperfix.labels.service.LabelImportService;
import com.hyperfix.labels.service.normalization.BrandCatalog;
import com.hyperfix.labels.service.normalization.LabelNormalizer;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.io.ByteArrayInputStream;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class LabelControllerTest {

    private AppProperties props;
    private WebTestClient client;

    @BeforeEach
    public void setUp() {
        props = new AppProperties();
        LabelController controller = new LabelController(
                new LabelNormalizer(BrandCatalog.defaults()),
                new LabelImportService(),
                new LabelExportService(),
                props);
        client = WebTestClient.bindToController(controller)
                .controllerAdvice(new GlobalErrorHandler())
                .build();
    }

    @Test
    public void normalizeReturnsOriginalAndCorrected() {
        client.post().uri("/labels/normalize")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("label", "1L PET PUR JUS POMME CRF EXTRA"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.original").isEqualTo("1L PET PUR JUS POMME CRF EXTRA")
                .jsonPath("$.corrected").isEqualTo("CRF PET PUR JUS POMME EXTRA 1L");
    }

    @Test
    public void analyzeExposesWarnings() {
        client.post().uri("/labels/analyze")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("label", "CRF huile 1,50L"))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.brand").isEqualTo("CRF")
                .jsonPath("$.quantities[0]").isEqualTo("1,50L")
                .jsonPath("$.quantities[1]").isEqualTo("50L")
                .jsonPath("$.corrected").isEqualTo("CRF HUILE 1,50L 50L")
                .jsonPath("$.warnings[0].code").isEqualTo("QUANTITY_OVERLAP");
    }

    @Test
    public void batchReturnsRecordsAndCounts() {
        client.post().uri("/labels/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("labels", List.of(
                        "6X30g chips lisse nat. CRF clas",
                        "Désodorisant 2.5ml 4scent",
                        "PAPERMATE 4 Magic+ effaceurs fins réécr")))
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.total").isEqualTo(3)
                .jsonPath("$.with_brand").isEqualTo(2)
                .jsonPath("$.with_quantity").isEqualTo(2)
                .jsonPath("$.records[0].corrected").isEqualTo("CRF CHIPS LISSE NAT CLAS 6X30G")
                .jsonPath("$.records[1].corrected").isEqualTo("DESODORISANT 4SCENT 2,5ML")
                .jsonPath("$.records[2].processing").isEqualTo(false);
    }

    @Test
    public void batchOverLimitIsRejected() {
        props.setMaxBatchSize(2);
        client.post().uri("/labels/batch")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(Map.of("labels", List.of("a", "b", "c")))
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("bad_request")
                .jsonPath("$.reason").isEqualTo("Batch of 3 labels exceeds the limit of 2");
    }

    @Test
    public void importSplitsLines() {
        client.post().uri("/labels/import")
                .contentType(MediaType.TEXT_PLAIN)
                .bodyValue("6X30g chips lisse nat. CRF clas\n\n  5 BQ ALU 1,5L PROFONDE  \n")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.count").isEqualTo(2)
                .jsonPath("$.labels[1]").isEqualTo("5 BQ ALU 1,5L PROFONDE");
    }

    @Test
    public void exportCsvIsAnAttachment() {
        client.post().uri("/labels/export?format=csv")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of(new LabelRecord("5 BQ ALU 1,5L PROFONDE", "5 BQ ALU PROFONDE 1,5L", false)))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentTypeCompatibleWith(MediaType.parseMediaType("text/csv"))
                .expectHeader().valueEquals(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"libelles_corriges.csv\"")
                .expectBody(String.class)
                .isEqualTo("Libellé Original,Libellé Corrigé\n\"5 BQ ALU 1,5L PROFONDE\",\"5 BQ ALU PROFONDE 1,5L\"");
    }

    @Test
    public void exportTsvHasNoAttachmentHeader() {
        String body = client.post().uri("/labels/export?format=tsv")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of(new LabelRecord("1L eau", "EAU 1L", false)))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().doesNotExist(HttpHeaders.CONTENT_DISPOSITION)
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();
        assertEquals("Libellé Original\tLibellé Corrigé\n1L eau\tEAU 1L", body);
    }

    @Test
    public void exportUnknownFormatIsRejected() {
        client.post().uri("/labels/export?format=pdf")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of())
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.reason").isEqualTo("Unsupported export format: pdf");
    }

    @Test
    public void exportXlsxIsAWorkbookAttachment() throws Exception {
        byte[] body = client.post().uri("/labels/export?format=xlsx")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue(List.of(new LabelRecord("1L eau", "EAU 1L", false)))
                .exchange()
                .expectStatus().isOk()
                .expectHeader().contentType(MediaType.parseMediaType(
                        "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet"))
                .expectHeader().valueEquals(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"libelles_corriges.xlsx\"")
                .expectBody(byte[].class)
                .returnResult()
                .getResponseBody();

        assertNotNull(body);
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(body))) {
            assertEquals("Articles Traités", workbook.getSheetName(0));
            assertEquals("EAU 1L", workbook.getSheetAt(0).getRow(1).getCell(1).getStringCellValue());
        }
    }
}
