package com.hyperfix.labels.service;

import com.hyperfix.labels.model.LabelRecord;
import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.IndexedColors;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;

/**
 * Renders corrected records for the clipboard (TSV) or for download (CSV, XLSX).
 */
@Service
public class LabelExportService {
    private static final Logger log = LoggerFactory.getLogger(LabelExportService.class);

    public static final String HEADER_ORIGINAL = "Libellé Original";
    public static final String HEADER_CORRECTED = "Libellé Corrigé";
    public static final String FILE_BASENAME = "libelles_corriges";
    public static final String XLSX_SHEET = "Articles Traités";

    /** Column width in characters for both XLSX columns */
    private static final int XLSX_COLUMN_WIDTH = 50;
    private static final byte[] HEADER_FILL_RGB = {0x36, 0x60, (byte) 0x92};

    public enum Format {
        TSV("text/tab-separated-values", "tsv", false),
        CSV("text/csv", "csv", true),
        XLSX("application/vnd.openxmlformats-officedocument.spreadsheetml.sheet", "xlsx", true);

        private final String contentType;
        private final String extension;
        private final boolean attachment;

        Format(String contentType, String extension, boolean attachment) {
            this.contentType = contentType;
            this.extension = extension;
            this.attachment = attachment;
        }

        public String getContentType() {
            return contentType;
        }

        /** True for text formats, served with a UTF-8 charset. */
        public boolean isText() {
            return this != XLSX;
        }

        /** True when the export is meant to be downloaded rather than pasted. */
        public boolean isAttachment() {
            return attachment;
        }

        public String getFileName() {
            return FILE_BASENAME + "." + extension;
        }

        /**
         * @throws IllegalArgumentException for anything other than tsv, csv or xlsx
         */
        public static Format parse(String value) {
            if (value == null || value.isBlank()) return CSV;
            try {
                return Format.valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unsupported export format: " + value, e);
            }
        }
    }

    public byte[] export(List<LabelRecord> records, Format format) {
        switch (format) {
            case TSV:
                return toTsv(records).getBytes(StandardCharsets.UTF_8);
            case XLSX:
                return toXlsx(records);
            default:
                return toCsv(records).getBytes(StandardCharsets.UTF_8);
        }
    }

    /** Tab separated, no quoting; tabs and line breaks inside values become spaces. */
    public String toTsv(List<LabelRecord> records) {
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER_ORIGINAL).append('\t').append(HEADER_CORRECTED);
        if (records != null) {
            for (LabelRecord r : records) {
                sb.append('\n').append(tsvCell(r.getOriginal())).append('\t').append(tsvCell(r.getCorrected()));
            }
        }
        return sb.toString();
    }

    /** Every value quoted, inner quotes doubled. */
    public String toCsv(List<LabelRecord> records) {
        StringBuilder sb = new StringBuilder();
        sb.append(HEADER_ORIGINAL).append(',').append(HEADER_CORRECTED);
        if (records != null) {
            for (LabelRecord r : records) {
                sb.append('\n').append(csvCell(r.getOriginal())).append(',').append(csvCell(r.getCorrected()));
            }
        }
        return sb.toString();
    }

    /**
     * One sheet with a styled, frozen header row, fixed-width wrapped columns and an
     * autofilter over the whole table.
     */
    public byte[] toXlsx(List<LabelRecord> records) {
        List<LabelRecord> rows = records != null ? records : List.of();
        try (XSSFWorkbook workbook = new XSSFWorkbook();
             ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            XSSFSheet sheet = workbook.createSheet(XLSX_SHEET);
            XSSFCellStyle headerStyle = headerStyle(workbook);
            XSSFCellStyle bodyStyle = bodyStyle(workbook);

            Row header = sheet.createRow(0);
            writeCell(header, 0, HEADER_ORIGINAL, headerStyle);
            writeCell(header, 1, HEADER_CORRECTED, headerStyle);
            for (int i = 0; i < rows.size(); i++) {
                LabelRecord r = rows.get(i);
                Row row = sheet.createRow(i + 1);
                writeCell(row, 0, r.getOriginal(), bodyStyle);
                writeCell(row, 1, r.getCorrected(), bodyStyle);
            }

            sheet.setColumnWidth(0, XLSX_COLUMN_WIDTH * 256);
            sheet.setColumnWidth(1, XLSX_COLUMN_WIDTH * 256);
            sheet.createFreezePane(0, 1);
            sheet.setAutoFilter(new CellRangeAddress(0, rows.size(), 0, 1));

            workbook.write(out);
            log.debug("Rendered XLSX export with {} rows", rows.size());
            return out.toByteArray();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to render XLSX export", e);
        }
    }

    private static XSSFCellStyle headerStyle(XSSFWorkbook workbook) {
        XSSFFont font = workbook.createFont();
        font.setFontName("Calibri");
        font.setFontHeightInPoints((short) 12);
        font.setBold(true);
        font.setColor(IndexedColors.WHITE.getIndex());

        XSSFCellStyle style = workbook.createCellStyle();
        style.setFont(font);
        style.setFillForegroundColor(new XSSFColor(HEADER_FILL_RGB, null));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
        style.setAlignment(HorizontalAlignment.CENTER);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        thinBorders(style);
        return style;
    }

    private static XSSFCellStyle bodyStyle(XSSFWorkbook workbook) {
        XSSFFont font = workbook.createFont();
        font.setFontName("Calibri");
        font.setFontHeightInPoints((short) 11);

        XSSFCellStyle style = workbook.createCellStyle();
        style.setFont(font);
        style.setAlignment(HorizontalAlignment.LEFT);
        style.setVerticalAlignment(VerticalAlignment.TOP);
        style.setWrapText(true);
        thinBorders(style);
        return style;
    }

    private static void thinBorders(XSSFCellStyle style) {
        style.setBorderTop(BorderStyle.THIN);
        style.setBorderBottom(BorderStyle.THIN);
        style.setBorderLeft(BorderStyle.THIN);
        style.setBorderRight(BorderStyle.THIN);
    }

    private static void writeCell(Row row, int column, String value, XSSFCellStyle style) {
        Cell cell = row.createCell(column);
        cell.setCellValue(value != null ? value : "");
        cell.setCellStyle(style);
    }

    private static String tsvCell(String value) {
        if (value == null) return "";
        return value.replaceAll("[\\t\\r\\n]+", " ");
    }

    private static String csvCell(String value) {
        String v = value == null ? "" : value;
        return '"' + v.replace("\"", "\"\"") + '"';
    }
}
