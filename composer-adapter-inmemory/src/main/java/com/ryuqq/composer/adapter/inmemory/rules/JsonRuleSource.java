package com.ryuqq.composer.adapter.inmemory.rules;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.composer.core.model.Rule;
import com.ryuqq.composer.core.spi.RuleSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * {@link RuleSource} reading one JSON file per rule from a directory.
 *
 * <p>Each {@code <dir>/<RULE-ID>.json} file holds a single rule object:</p>
 * <pre>
 * {
 *   "id": "ESS-01",
 *   "naam": "Essentie, niet doel",
 *   "prioriteit": "hoog",
 *   "uitleg": "...",
 *   "toetsvraag": "...",
 *   "goede_voorbeelden": ["..."],
 *   "foute_voorbeelden": ["..."]
 * }
 * </pre>
 *
 * <p>The rule id defaults to the file name without extension; the category is the id prefix before
 * the first {@code '-'}. A file that cannot be read or parsed fails the whole load with
 * {@link UncheckedIOException}, so a cache in front of this source never stores a partial rule set.</p>
 *
 * <p>A missing directory yields an empty list.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class JsonRuleSource implements RuleSource {

    private static final Logger log = LoggerFactory.getLogger(JsonRuleSource.class);

    private static final String DEFAULT_PRIORITY = "midden";

    private final Path directory;
    private final ObjectMapper mapper;

    public JsonRuleSource(Path directory) {
        this(directory, new ObjectMapper());
    }

    /**
     * Constructor.
     *
     * @param directory rule directory
     * @param mapper Jackson mapper
     * @throws IllegalArgumentException if directory or mapper is null
     */
    public JsonRuleSource(Path directory, ObjectMapper mapper) {
        if (directory == null) {
            throw new IllegalArgumentException("directory cannot be null");
        }
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.directory = directory;
        this.mapper = mapper;
    }

    @Override
    public List<Rule> load(String category) {
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category cannot be null or blank");
        }
        if (!Files.isDirectory(directory)) {
            log.warn("Rule directory does not exist: {}", directory);
            return List.of();
        }

        List<Rule> rules = new ArrayList<>();
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                Rule rule = read(file);
                if (rule.category().equals(category)) {
                    rules.add(rule);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list rule directory " + directory, e);
        }

        rules.sort(Comparator.comparing(Rule::id));
        log.debug("Read {} rule(s) for category {} from {}", rules.size(), category, directory);
        return List.copyOf(rules);
    }

    public Path getDirectory() {
        return directory;
    }

    private Rule read(Path file) {
        JsonNode node;
        try {
            node = mapper.readTree(file.toFile());
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read rule file " + file, e);
        }
        if (node == null || !node.isObject()) {
            throw new UncheckedIOException(new IOException("Rule file is not a JSON object: " + file));
        }

        String fileName = file.getFileName().toString();
        String fallbackId = fileName.substring(0, fileName.length() - ".json".length());
        String id = node.path("id").asText(fallbackId);
        if (id.isBlank()) {
            id = fallbackId;
        }

        return new Rule(
            id,
            node.path("naam").asText(""),
            Rule.categoryOf(id),
            node.path("prioriteit").asText(DEFAULT_PRIORITY),
            node.path("uitleg").asText(""),
            node.path("toetsvraag").asText(""),
            textList(node.path("goede_voorbeelden")),
            textList(node.path("foute_voorbeelden"))
        );
    }

    private static List<String> textList(JsonNode node) {
        if (!node.isArray()) {
            return List.of();
        }
        List<String> values = new ArrayList<>(node.size());
        node.forEach(element -> values.add(element.asText()));
        return values;
    }
}
