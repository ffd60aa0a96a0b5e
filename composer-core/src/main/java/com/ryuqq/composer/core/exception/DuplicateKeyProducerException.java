package com.ryuqq.composer.core.exception;

import com.ryuqq.composer.core.model.ModuleId;
import com.ryuqq.composer.core.model.StateKey;

/**
 * 하나의 Shared State 키를 두 모듈이 생산하려고 함 (단일 생산자 불변식 위반).
 *
 * @author Composer Team
 * @since 1.0.0
 */
public class DuplicateKeyProducerException extends PipelineConfigurationException {

    private final StateKey key;
    private final ModuleId existingProducer;
    private final ModuleId rejectedProducer;

    public DuplicateKeyProducerException(StateKey key, ModuleId existingProducer, ModuleId rejectedProducer) {
        super("Key '" + key + "' is already produced by '" + existingProducer
            + "', cannot also be produced by '" + rejectedProducer + "'");
        this.key = key;
        this.existingProducer = existingProducer;
        this.rejectedProducer = rejectedProducer;
    }

    public StateKey key() {
        return key;
    }

    public ModuleId existingProducer() {
        return existingProducer;
    }

    public ModuleId rejectedProducer() {
        return rejectedProducer;
    }
}
