package com.hyperfix.labels.service;

import com.hyperfix.labels.model.LabelRecord;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LabelExportServiceTest {

    private final LabelExportService service = new LabelExportService();

    private final List<LabelRecord> records = List.of(
            new LabelRecord("5 BQ ALU 1,5L PROFONDE", "5 BQ ALU PROFONDE 1,5L", false),
            new LabelRecord("stylo \"fin\"", "STYLO FIN", false));

    @Test
    public void tsvHasHeaderAndOneRowPerRecord() {
        String tsv = service.toTsv(records);
        assertEquals("Libellé Original\tLibellé Corrigé\n"
                + "5 BQ ALU 1,5L PROFONDE\t5 BQ ALU PROFONDE 1,5L\n"
                + "stylo \"fin\"\tSTYLO FIN", tsv);
    }

    @Test
    public void tsvFlattensTabsAndLineBreaks() {
        String tsv = service.toTsv(List.of(new LabelRecord("a\tb\nc", null, false)));
        assertEquals("Libellé Original\tLibellé Corrigé\na b c\t", tsv);
    }

    @Test
    public void csvQuotesEveryValue() {
        String csv = service.toCsv(records);
        assertEquals("Libellé Original,Libellé Corrigé\n"
                + "\"5 BQ ALU 1,5L PROFONDE\",\"5 BQ ALU PROFONDE 1,5L\"\n"
                + "\"stylo \"\"fin\"\"\",\"STYLO FIN\"", csv);
    }

    @Test
    public void headerOnlyForEmptyList() {
        assertEquals("Libellé Original,Libellé Corrigé",
                new String(service.export(List.of(), LabelExportService.Format.CSV), StandardCharsets.UTF_8));
        assertEquals("Libellé Original\tLibellé Corrigé",
                new String(service.export(null, LabelExportService.Format.TSV), StandardCharsets.UTF_8));
    }

    @Test
    public void parsesFormat() {
        assertEquals(LabelExportService.Format.TSV, LabelExportService.Format.parse(" tsv "));
        assertEquals(LabelExportService.Format.CSV, LabelExportService.Format.parse("CSV"));
        assertEquals(LabelExportService.Format.XLSX, LabelExportService.Format.parse("xlsx"));
        assertEquals(LabelExportService.Format.CSV, LabelExportService.Format.parse(null));
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> LabelExportService.Format.parse("pdf"));
        assertEquals("Unsupported export format: pdf", e.getMessage());
        assertEquals("libelles_corriges.xlsx", LabelExportService.Format.XLSX.getFileName());
        assertFalse(LabelExportService.Format.XLSX.isText());
    }

    @Test
    public void xlsxHasStyledFrozenFilteredSheet() throws Exception {
        byte[] bytes = service.export(records, LabelExportService.Format.XLSX);

        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(bytes))) {
            assertEquals(1, workbook.getNumberOfSheets());
            XSSFSheet sheet = workbook.getSheet("Articles Traités");
            assertNotNull(sheet);
            assertEquals(2, sheet.getLastRowNum());

            XSSFCell original = sheet.getRow(0).getCell(0);
            assertEquals("Libellé Original", original.getStringCellValue());
            assertEquals("Libellé Corrigé", sheet.getRow(0).getCell(1).getStringCellValue());
            assertEquals("5 BQ ALU 1,5L PROFONDE", sheet.getRow(1).getCell(0).getStringCellValue());
            assertEquals("STYLO FIN", sheet.getRow(2).getCell(1).getStringCellValue());

            XSSFCellStyle header = original.getCellStyle();
            assertTrue(header.getFont().getBold());
            assertEquals("Calibri", header.getFont().getFontName());
            assertEquals(12, header.getFont().getFontHeightInPoints());
            assertEquals(FillPatternType.SOLID_FOREGROUND, header.getFillPattern());
            assertEquals("FF366092", header.getFillForegroundXSSFColor().getARGBHex());
            assertEquals(HorizontalAlignment.CENTER, header.getAlignment());

            XSSFCellStyle body = sheet.getRow(1).getCell(1).getCellStyle();
            assertFalse(body.getFont().getBold());
            assertEquals(11, body.getFont().getFontHeightInPoints());
            assertTrue(body.getWrapText());
            assertEquals(VerticalAlignment.TOP, body.getVerticalAlignment());

            assertEquals(50 * 256, sheet.getColumnWidth(0));
            assertEquals(50 * 256, sheet.getColumnWidth(1));
            assertTrue(sheet.getPaneInformation().isFreezePane());
            assertEquals(1, sheet.getPaneInformation().getHorizontalSplitPosition());
            assertEquals("A1:B3", sheet.getCTWorksheet().getAutoFilter().getRef());
        }
    }

    @Test
    public void xlsxOfEmptyListHasOnlyTheHeader() throws Exception {
        try (XSSFWorkbook workbook = new XSSFWorkbook(new ByteArrayInputStream(service.toXlsx(null)))) {
            XSSFSheet sheet = workbook.getSheetAt(0);
            assertEquals(0, sheet.getLastRowNum());
            assertEquals("A1:B1", sheet.getCTWorksheet().getAutoFilter().getRef());
        }
    }
}
