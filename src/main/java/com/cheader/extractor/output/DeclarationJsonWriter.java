package com.cheader.extractor.output;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.cheader.extractor.model.Declaration;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Serializes a declaration list to JSON for downstream consumers.
 *
 * Each declaration carries a {@code declKind} discriminator and macro kinds a
 * {@code shape} one. List order is preserved; null properties are omitted.
 */
public class DeclarationJsonWriter {

    private final ObjectWriter writer;

    public DeclarationJsonWriter() {
        ObjectMapper mapper = new ObjectMapper()
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .enable(SerializationFeature.INDENT_OUTPUT);
        this.writer = mapper.writerFor(new TypeReference<List<Declaration>>() {
        });
    }

    public String toJson(List<Declaration> declarations) throws JsonProcessingException {
        return writer.writeValueAsString(declarations);
    }

    /**
     * Writes the JSON document, creating parent directories if needed.
     */
    public void write(List<Declaration> declarations, Path target) throws IOException {
        Path parentDir = target.toAbsolutePath().getParent();
        if (parentDir != null) {
            Files.createDirectories(parentDir);
        }
        Files.writeString(target, toJson(declarations));
    }
}
