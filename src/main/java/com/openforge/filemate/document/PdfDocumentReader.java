package com.openforge.filemate.document;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDDocumentInformation;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Set;

/**
 * PDF text via PDFBox, plus the document information dictionary.
 */
@Component
public class PdfDocumentReader implements DocumentReader {

    @Override
    public Set<String> extensions() {
        return Set.of(".pdf");
    }

    @Override
    public ExtractedText read(Path file) {
        try (PDDocument pdf = Loader.loadPDF(file.toFile())) {
            String text = new PDFTextStripper().getText(pdf);

            Metadata metadata = new Metadata();
            PDDocumentInformation info = pdf.getDocumentInformation();
            if (info != null) {
                metadata.put("title", info.getTitle());
                metadata.put("author", info.getAuthor());
                metadata.put("subject", info.getSubject());
                metadata.put("created", info.getCreationDate());
                metadata.put("modified", info.getModificationDate());
            }
            return new ExtractedText(text, metadata.asMap());
        } catch (IOException | RuntimeException e) {
            throw new DocumentReadException(file, "Cannot read PDF " + file.getFileName() + ": " + e.getMessage(), e);
        }
    }
}
