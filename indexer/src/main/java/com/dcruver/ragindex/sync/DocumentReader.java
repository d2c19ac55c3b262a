package com.dcruver.ragindex.sync;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads source documents as UTF-8, replacing malformed input instead of failing.
 */
@Component
@Slf4j
public class DocumentReader {

    /**
     * Read a document, or empty when the file cannot be read at all
     */
    public Optional<String> read(String path) {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(Path.of(path));
        } catch (IOException e) {
            log.warn("Could not read {}: {}", path, e.getMessage());
            return Optional.empty();
        }

        try {
            return Optional.of(StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPORT)
                .onUnmappableCharacter(CodingErrorAction.REPORT)
                .decode(ByteBuffer.wrap(bytes))
                .toString());
        } catch (CharacterCodingException e) {
            log.warn("{} is not valid UTF-8, decoding with replacement characters", path);
            return Optional.of(new String(bytes, StandardCharsets.UTF_8));
        }
    }
}
