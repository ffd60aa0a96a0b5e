package com.ryuqq.composer.application.orchestrator;

import com.ryuqq.composer.core.model.StateKey;
import com.ryuqq.composer.core.status.RunStatus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 파이프라인 실행 결과.
 *
 * <p><strong>두 가지 형태:</strong></p>
 * <ul>
 *   <li><strong>실행됨:</strong> artifact + metadata + Shared State 스냅샷.
 *       status는 COMPLETE, PARTIAL_FAILURE, CANCELLED 중 하나</li>
 *   <li><strong>거부됨:</strong> status = REJECTED, artifact는 빈 문자열,
 *       rejectionReasonOrNull에 거부 사유</li>
 * </ul>
 *
 * <p>호출자는 {@link RunStatus#isTrustworthy()}로 아티팩트를 그대로 사용할 수 있는지 확인해야 합니다.</p>
 *
 * @author Composer Team
 * @since 1.0.0
 */
public final class PipelineResult {

    private final String artifact;
    private final RunMetadata metadata;
    private final Map<StateKey, Object> sharedStateSnapshot;
    private final String rejectionReasonOrNull;

    private PipelineResult(String artifact, RunMetadata metadata, Map<StateKey, Object> sharedStateSnapshot,
                           String rejectionReasonOrNull) {
        if (artifact == null) {
            throw new IllegalArgumentException("artifact cannot be null");
        }
        if (metadata == null) {
            throw new IllegalArgumentException("metadata cannot be null");
        }
        this.artifact = artifact;
        this.metadata = metadata;
        this.sharedStateSnapshot = sharedStateSnapshot == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(sharedStateSnapshot));
        this.rejectionReasonOrNull = rejectionReasonOrNull;
    }

    /**
     * 실행된 파이프라인의 결과 생성.
     *
     * @param artifact 조립된 아티팩트
     * @param metadata 실행 메타데이터 (status는 REJECTED가 아니어야 함)
     * @param sharedStateSnapshot 실행 종료 시점 Shared State
     * @return PipelineResult
     */
    public static PipelineResult of(String artifact, RunMetadata metadata, Map<StateKey, Object> sharedStateSnapshot) {
        if (metadata != null && metadata.status() == RunStatus.REJECTED) {
            throw new IllegalArgumentException("use rejected() for REJECTED results");
        }
        return new PipelineResult(artifact, metadata, sharedStateSnapshot, null);
    }

    /**
     * 거부된 요청의 결과 생성.
     *
     * @param runId 실행 ID
     * @param reason 거부 사유
     * @return PipelineResult (status = REJECTED)
     */
    public static PipelineResult rejected(String runId, String reason) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("reason cannot be null or blank");
        }
        RunMetadata metadata = new RunMetadata(runId, RunStatus.REJECTED, 0, 0, 0, List.of(), List.of(), 0);
        return new PipelineResult("", metadata, Map.of(), reason);
    }

    public String getArtifact() {
        return artifact;
    }

    public RunMetadata getMetadata() {
        return metadata;
    }

    public RunStatus getStatus() {
        return metadata.status();
    }

    public Map<StateKey, Object> getSharedStateSnapshot() {
        return sharedStateSnapshot;
    }

    /**
     * 거부 사유 조회.
     *
     * @return 거부 사유 (REJECTED가 아니면 null)
     */
    public String getRejectionReasonOrNull() {
        return rejectionReasonOrNull;
    }

    @Override
    public String toString() {
        return "PipelineResult{" +
            "runId=" + metadata.runId() +
            ", status=" + metadata.status() +
            ", artifactLength=" + artifact.length() +
            ", modules=" + metadata.modules().size() +
            '}';
    }
}
