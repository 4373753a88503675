package com.openforge.filemate.document;

import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Excel workbooks: a "Sheet: name" header per sheet followed by its non-empty
 * rows as "a | b | c", with cell values as Excel would display them.
 */
@Component
public class XlsxDocumentReader implements DocumentReader {

    @Override
    public Set<String> extensions() {
        return Set.of(".xlsx");
    }

    @Override
    public ExtractedText read(Path file) {
        DataFormatter formatter = new DataFormatter();
        try (InputStream in = Files.newInputStream(file);
             XSSFWorkbook workbook = new XSSFWorkbook(in)) {

            List<String> lines = new ArrayList<>();
            for (Sheet sheet : workbook) {
                lines.add("Sheet: " + sheet.getSheetName());
                for (Row row : sheet) {
                    List<String> cells = new ArrayList<>();
                    boolean any = false;
                    for (Cell cell : row) {
                        String text = formatter.formatCellValue(cell);
                        cells.add(text);
                        any |= !text.isBlank();
                    }
                    if (any) {
                        lines.add(String.join(" | ", cells));
                    }
                }
            }
            return new ExtractedText(String.join("\n", lines),
                    Metadata.ofCoreProperties(workbook.getProperties().getCoreProperties()));
        } catch (IOException | RuntimeException e) {
            throw new DocumentReadException(file, "Cannot read workbook " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
