package com.nodeguardian.rule;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.nodeguardian.exception.ConfigException;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Reads declarative documents (rules, alert templates) from a directory.
 *
 * <p>{@code *.json} files hold one document; {@code *.yaml} and {@code *.yml} files may hold
 * several separated by {@code ---}. A file that cannot be parsed is logged and skipped so one
 * broken file never hides the others.
 */
@Component
public class DocumentReader {

    private static final Logger log = LoggerFactory.getLogger(DocumentReader.class);

    private final ObjectMapper jsonMapper;
    private final ObjectMapper yamlMapper;

    public DocumentReader(ObjectMapper objectMapper) {
        this.jsonMapper = objectMapper;
        this.yamlMapper = new ObjectMapper(new YAMLFactory());
    }

    public List<SourcedDocument> readDirectory(Path directory) {
        List<SourcedDocument> documents = new ArrayList<>();
        if (directory == null || !Files.isDirectory(directory)) {
            log.warn("Document directory {} does not exist", directory);
            return documents;
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*.{yaml,yml,json}")) {
            stream.forEach(files::add);
        } catch (IOException e) {
            throw new ConfigException("Cannot list document directory " + directory, e);
        }
        files.sort(Comparator.comparing(Path::toString));

        for (Path file : files) {
            try {
                for (JsonNode node : readFile(file)) {
                    documents.add(new SourcedDocument(file.getFileName().toString(), node));
                }
            } catch (IOException | RuntimeException e) {
                // MappingIterator reports mid-stream YAML errors unchecked
                log.error("Skipping unreadable document {}: {}", file, e.getMessage());
            }
        }
        return documents;
    }

    public List<JsonNode> readFile(Path file) throws IOException {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return List.of(jsonMapper.readTree(file.toFile()));
        }
        List<JsonNode> nodes = new ArrayList<>();
        try (MappingIterator<JsonNode> iterator = yamlMapper.readerFor(JsonNode.class).readValues(file.toFile())) {
            while (iterator.hasNext()) {
                JsonNode node = iterator.next();
                if (node != null && !node.isNull() && !node.isMissingNode()) {
                    nodes.add(node);
                }
            }
        }
        return nodes;
    }

    /** A parsed document and where it came from, for error messages. */
    public record SourcedDocument(String source, JsonNode content) {}
}
