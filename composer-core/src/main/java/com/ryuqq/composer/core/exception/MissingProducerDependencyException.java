package com.ryuqq.composer.core.exception;

import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;

/**
 * 소비 키의 생산자가 소비 모듈의 (전이적) 의존성에 포함되지 않음.
 *
 * <p>생산자와 소비자가 같은 wave에 배치될 수 있으므로 읽기 결과가 비결정적이 됩니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class MissingProducerDependencyException extends PipelineConfigurationException {

    private final ModuleId consumer;
    private final StateKey key;
    private final ModuleId producer;

    public MissingProducerDependencyException(ModuleId consumer, StateKey key, ModuleId producer) {
        super("Module '" + consumer + "' consumes '" + key + "' produced by '" + producer
            + "' but does not depend on it");
        this.consumer = consumer;
        this.key = key;
        this.producer = producer;
    }

    public ModuleId consumer() {
        return consumer;
    }

    public StateKey key() {
        return key;
    }

    public ModuleId producer() {
        return producer;
    }
}
