package com.largomodo.platelayout.service;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Spreadsheet metadata via Apache POI.
 * <p>
 * Reads the first sheet. The first row holds the column headers; column A holds the image file
 * name and every other column a metadata field named by its header. Cells are rendered the way
 * the spreadsheet displays them, so dates and numbers keep their formatting. Rows without a
 * file name are skipped, as are columns without a header.
 */
public class XlsxMetadataLoader implements MetadataLoader {

    private static final Logger log = LoggerFactory.getLogger(XlsxMetadataLoader.class);

    @Override
    public Map<String, Map<String, String>> load(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file); Workbook workbook = open(in, file)) {
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter();
            List<String> headers = readHeaders(sheet, formatter);

            Map<String, Map<String, String>> result = new LinkedHashMap<>();
            for (int r = sheet.getFirstRowNum() + 1; r <= sheet.getLastRowNum(); r++) {
                Row row = sheet.getRow(r);
                if (row == null) {
                    continue;
                }
                String fileName = text(row.getCell(0), formatter);
                if (fileName.isEmpty()) {
                    continue;
                }
                Map<String, String> fields = new LinkedHashMap<>();
                for (int c = 1; c < headers.size(); c++) {
                    String header = headers.get(c);
                    if (!header.isEmpty()) {
                        fields.put(header, text(row.getCell(c), formatter));
                    }
                }
                if (result.put(fileName, Collections.unmodifiableMap(fields)) != null) {
                    log.warn("Duplicate metadata row for {} in {}, keeping the last one", fileName, file.getFileName());
                }
            }
            log.info("Read metadata for {} images from {}", result.size(), file.getFileName());
            return result;
        }
    }

    @Override
    public List<String> headers(Path file) throws IOException {
        try (InputStream in = Files.newInputStream(file); Workbook workbook = open(in, file)) {
            List<String> headers = readHeaders(workbook.getSheetAt(0), new DataFormatter());
            return headers.isEmpty()
                    ? List.of()
                    : headers.subList(1, headers.size()).stream().filter(h -> !h.isEmpty()).toList();
        }
    }

    private static Workbook open(InputStream in, Path file) throws IOException {
        try {
            return WorkbookFactory.create(in);
        } catch (IllegalArgumentException e) {
            // POI reports unknown file formats as IllegalArgumentException subclasses
            throw new IOException("Not a spreadsheet: " + file.getFileName(), e);
        }
    }

    private static List<String> readHeaders(Sheet sheet, DataFormatter formatter) {
        Row header = sheet.getRow(sheet.getFirstRowNum());
        List<String> headers = new ArrayList<>();
        if (header == null || header.getLastCellNum() < 0) {
            return headers;
        }
        for (int c = 0; c < header.getLastCellNum(); c++) {
            headers.add(text(header.getCell(c), formatter));
        }
        return headers;
    }

    private static String text(Cell cell, DataFormatter formatter) {
        return cell == null ? "" : formatter.formatCellValue(cell).trim();
    }
}
