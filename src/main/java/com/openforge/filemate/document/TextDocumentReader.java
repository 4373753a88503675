package com.openforge.filemate.document;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Plain text and Markdown.
 *
 * A byte-order mark decides the charset when present.  Otherwise the bytes are
 * decoded strictly as UTF-8, then GB18030 (which covers GBK / GB2312 files
 * from Chinese Windows), and finally ISO-8859-1, which accepts anything.
 * The charset used is reported as the "encoding" metadata entry.
 */
@Slf4j
@Component
public class TextDocumentReader implements DocumentReader {

    private static final List<Charset> CANDIDATES = List.of(
            StandardCharsets.UTF_8,
            Charset.forName("GB18030"),
            StandardCharsets.ISO_8859_1);

    @Override
    public Set<String> extensions() {
        return Set.of(".txt", ".md");
    }

    @Override
    public ExtractedText read(Path file) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (IOException e) {
            throw new DocumentReadException(file, "Cannot read " + file.getFileName() + ": " + e.getMessage(), e);
        }
        Decoded decoded = decode(bytes);
        log.debug("[Reader] {} decoded as {}", file.getFileName(), decoded.charset().name());
        return new ExtractedText(decoded.text(), Map.of("encoding", decoded.charset().name()));
    }

    static Decoded decode(byte[] bytes) {
        if (bytes.length >= 3 && (bytes[0] & 0xFF) == 0xEF && (bytes[1] & 0xFF) == 0xBB && (bytes[2] & 0xFF) == 0xBF) {
            return new Decoded(new String(bytes, 3, bytes.length - 3, StandardCharsets.UTF_8), StandardCharsets.UTF_8);
        }
        if (bytes.length >= 2) {
            int b0 = bytes[0] & 0xFF;
            int b1 = bytes[1] & 0xFF;
            if (b0 == 0xFE && b1 == 0xFF) {
                return new Decoded(new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16BE), StandardCharsets.UTF_16BE);
            }
            if (b0 == 0xFF && b1 == 0xFE) {
                return new Decoded(new String(bytes, 2, bytes.length - 2, StandardCharsets.UTF_16LE), StandardCharsets.UTF_16LE);
            }
        }
        for (Charset charset : CANDIDATES) {
            try {
                String text = charset.newDecoder()
                        .onMalformedInput(CodingErrorAction.REPORT)
                        .onUnmappableCharacter(CodingErrorAction.REPORT)
                        .decode(ByteBuffer.wrap(bytes))
                        .toString();
                return new Decoded(text, charset);
            } catch (CharacterCodingException e) {
                // try the next candidate
            }
        }
        return new Decoded(new String(bytes, StandardCharsets.ISO_8859_1), StandardCharsets.ISO_8859_1);
    }

    record Decoded(String text, Charset charset) {}
}
