package com.ryuqq.composer.adapter.runner.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.composer.adapter.runner.SchedulerConfig;
import com.ryuqq.composer.core.contract.ModuleConfig;
import com.ryuqq.composer.core.exception.PipelineConfigurationException;
import com.ryuqq.composer.core.model.ModuleDescriptor;
import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * JSON 파이프라인 정의 로더 (Jackson).
 *
 * <p><strong>형식:</strong></p>
 * <pre>
 * {
 *   "workerPoolSize": 4,
 *   "runTimeoutMs": 30000,
 *   "moduleTimeoutMs": 5000,
 *   "includeFailurePlaceholders": false,
 *   "modules": [
 *     { "id": "expertise", "priority": 10, "required": true },
 *     { "id": "semantic_categorisation", "priority": 20, "produces": ["ontological_category"] },
 *     { "id": "ess_rules", "priority": 40, "dependsOn": ["semantic_categorisation"],
 *       "consumes": ["ontological_category"], "timeoutMs": 2000,
 *       "config": { "include_examples": false, "max_rules": 12 } }
 *   ]
 * }
 * </pre>
 *
 * <p>생략된 스케줄러 항목은 {@link SchedulerConfig} 기본값을, 생략된 모듈 항목은
 * {@link ModuleDescriptor#of(String)} 기본값을 사용합니다. 모듈의 {@code config}는 객체여야 하며
 * {@link ModuleConfig}로 변환됩니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class PipelineDefinitionReader {

    private static final Logger log = LoggerFactory.getLogger(PipelineDefinitionReader.class);

    private static final TypeReference<Map<String, Object>> CONFIG_TYPE = new TypeReference<Map<String, Object>>() {
    };

    private final ObjectMapper mapper;

    public PipelineDefinitionReader() {
        this(new ObjectMapper());
    }

    public PipelineDefinitionReader(ObjectMapper mapper) {
        if (mapper == null) {
            throw new IllegalArgumentException("mapper cannot be null");
        }
        this.mapper = mapper;
    }

    /**
     * 파일에서 정의 로드.
     *
     * @param file JSON 파일
     * @return PipelineDefinition
     * @throws UncheckedIOException 파일을 읽지 못한 경우
     * @throws PipelineConfigurationException 형식이 잘못된 경우
     */
    public PipelineDefinition read(Path file) {
        if (file == null) {
            throw new IllegalArgumentException("file cannot be null");
        }
        String json;
        try {
            json = Files.readString(file);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read pipeline definition " + file, e);
        }
        PipelineDefinition definition = parse(json);
        log.info("Pipeline definition loaded from {}: {} modules", file, definition.modules().size());
        return definition;
    }

    /**
     * JSON 문자열에서 정의 로드.
     *
     * @param json JSON 문자열
     * @return PipelineDefinition
     * @throws PipelineConfigurationException 형식이 잘못된 경우
     */
    public PipelineDefinition parse(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("json cannot be null or blank");
        }
        JsonNode root;
        try {
            root = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new PipelineConfigurationException("Malformed pipeline definition: " + e.getOriginalMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new PipelineConfigurationException("Pipeline definition must be a JSON object");
        }

        SchedulerConfig defaults = new SchedulerConfig();
        SchedulerConfig scheduler;
        try {
            scheduler = new SchedulerConfig(
                root.path("workerPoolSize").asInt(defaults.workerPoolSize()),
                root.path("runTimeoutMs").asLong(defaults.runTimeoutMs()),
                root.path("moduleTimeoutMs").asLong(defaults.moduleTimeoutMs()),
                root.path("includeFailurePlaceholders").asBoolean(defaults.includeFailurePlaceholders())
            );
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("Invalid scheduler settings: " + e.getMessage(), e);
        }

        List<ModuleDescriptor> modules = new ArrayList<>();
        Map<ModuleId, ModuleConfig> configs = new LinkedHashMap<>();
        JsonNode moduleNodes = root.path("modules");
        if (!moduleNodes.isMissingNode() && !moduleNodes.isArray()) {
            throw new PipelineConfigurationException("'modules' must be an array");
        }
        for (JsonNode node : moduleNodes) {
            ModuleDescriptor descriptor = toDescriptor(node);
            modules.add(descriptor);
            ModuleConfig config = toConfig(descriptor.id(), node.path("config"));
            if (!config.isEmpty()) {
                configs.put(descriptor.id(), config);
            }
        }
        return new PipelineDefinition(scheduler, modules, configs);
    }

    private ModuleDescriptor toDescriptor(JsonNode node) {
        String id = node.path("id").asText("");
        if (!ModuleId.isValid(id)) {
            throw new PipelineConfigurationException("Module entry has missing or invalid id: " + node);
        }
        try {
            return new ModuleDescriptor(
                ModuleId.of(id),
                node.path("priority").asInt(ModuleDescriptor.DEFAULT_PRIORITY),
                strings(node.path("dependsOn"), ModuleId::of),
                strings(node.path("produces"), StateKey::of),
                strings(node.path("consumes"), StateKey::of),
                node.path("required").asBoolean(false),
                node.path("timeoutMs").asLong(0)
            );
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("Invalid module '" + id + "': " + e.getMessage(), e);
        }
    }

    private ModuleConfig toConfig(ModuleId id, JsonNode node) {
        if (node.isMissingNode() || node.isNull()) {
            return ModuleConfig.empty();
        }
        if (!node.isObject()) {
            throw new PipelineConfigurationException("Module '" + id + "' config must be an object");
        }
        try {
            return ModuleConfig.of(mapper.convertValue(node, CONFIG_TYPE));
        } catch (IllegalArgumentException e) {
            throw new PipelineConfigurationException("Invalid config for module '" + id + "': " + e.getMessage(), e);
        }
    }

    private static <T> Set<T> strings(JsonNode node, Function<String, T> converter) {
        Set<T> values = new LinkedHashSet<>();
        if (node.isArray()) {
            node.forEach(element -> values.add(converter.apply(element.asText())));
        }
        return values;
    }
}
