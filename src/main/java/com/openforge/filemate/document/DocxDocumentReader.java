package com.openforge.filemate.document;

import org.apache.poi.xwpf.usermodel.XWPFDocument;
import org.apache.poi.xwpf.usermodel.XWPFParagraph;
import org.apache.poi.xwpf.usermodel.XWPFTable;
import org.apache.poi.xwpf.usermodel.XWPFTableCell;
import org.apache.poi.xwpf.usermodel.XWPFTableRow;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Word documents: non-empty paragraphs, then table rows as "a | b | c",
 * plus the core properties.
 */
@Component
public class DocxDocumentReader implements DocumentReader {

    @Override
    public Set<String> extensions() {
        return Set.of(".docx");
    }

    @Override
    public ExtractedText read(Path file) {
        try (InputStream in = Files.newInputStream(file);
             XWPFDocument doc = new XWPFDocument(in)) {

            List<String> lines = new ArrayList<>();
            for (XWPFParagraph paragraph : doc.getParagraphs()) {
                String text = paragraph.getText();
                if (text != null && !text.isBlank()) {
                    lines.add(text.strip());
                }
            }
            for (XWPFTable table : doc.getTables()) {
                for (XWPFTableRow row : table.getRows()) {
                    List<String> cells = new ArrayList<>();
                    for (XWPFTableCell cell : row.getTableCells()) {
                        String text = cell.getText();
                        if (text != null && !text.isBlank()) {
                            cells.add(text.strip());
                        }
                    }
                    if (!cells.isEmpty()) {
                        lines.add(String.join(" | ", cells));
                    }
                }
            }

            Map<String, String> metadata = Metadata.ofCoreProperties(doc.getProperties().getCoreProperties());
            return new ExtractedText(String.join("\n", lines), metadata);
        } catch (IOException | RuntimeException e) {
            throw new DocumentReadException(file, "Cannot read Word document " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
