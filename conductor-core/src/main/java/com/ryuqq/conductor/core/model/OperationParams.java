package com.ryuqq.conductor.core.model;

import com.ryuqq.conductor.core.config.ConductorSettings;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Operation 입력 스냅샷.
 *
 * <p>{@code start()} 호출 시점에 캡처되는 불변 입력입니다.
 * Worker는 UI가 동시에 수정할 수 있는 live 상태를 절대 읽지 않고,
 * 오직 이 스냅샷만 사용합니다.</p>
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>values: 문자열 파라미터 (예: diff, dryRun)</li>
 *   <li>settings: 설정 스냅샷 ({@link ConductorSettings})</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * OperationParams params = OperationParams.builder(settings)
 *     .put(OperationParams.DIFF, diffText)
 *     .build();
 * </pre>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class OperationParams {

    /** 분석 대상 diff 텍스트. */
    public static final String DIFF = "diff";

    /** semantic-release dry-run 여부 ("true"/"false"). */
    public static final String DRY_RUN = "dryRun";

    private final Map<String, String> values;
    private final ConductorSettings settings;

    private OperationParams(Map<String, String> values, ConductorSettings settings) {
        if (values == null) {
            throw new IllegalArgumentException("values cannot be null");
        }
        if (settings == null) {
            throw new IllegalArgumentException("settings cannot be null");
        }
        this.values = Map.copyOf(values);
        this.settings = settings;
    }

    /**
     * 파라미터 없이 설정만으로 생성.
     *
     * @param settings 설정 스냅샷
     * @return OperationParams 인스턴스
     */
    public static OperationParams of(ConductorSettings settings) {
        return new OperationParams(Map.of(), settings);
    }

    /**
     * 파라미터 맵과 설정으로 생성 (맵은 복사됨).
     *
     * @param values 파라미터
     * @param settings 설정 스냅샷
     * @return OperationParams 인스턴스
     */
    public static OperationParams of(Map<String, String> values, ConductorSettings settings) {
        return new OperationParams(values, settings);
    }

    /**
     * 빌더 생성.
     *
     * @param settings 설정 스냅샷
     * @return Builder
     */
    public static Builder builder(ConductorSettings settings) {
        return new Builder(settings);
    }

    /**
     * 파라미터 조회.
     *
     * @param key 키
     * @return 값 (없으면 empty)
     */
    public Optional<String> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    /**
     * boolean 파라미터 조회.
     *
     * @param key 키
     * @param defaultValue 값이 없을 때 기본값
     * @return boolean 값
     */
    public boolean getBoolean(String key, boolean defaultValue) {
        String value = values.get(key);
        return value == null ? defaultValue : Boolean.parseBoolean(value.trim());
    }

    /**
     * 전체 파라미터 (불변 맵).
     *
     * @return 파라미터 맵
     */
    public Map<String, String> values() {
        return values;
    }

    /**
     * 설정 스냅샷.
     *
     * @return ConductorSettings
     */
    public ConductorSettings settings() {
        return settings;
    }

    @Override
    public String toString() {
        return "OperationParams{keys=" + values.keySet() + ", settings=" + settings + '}';
    }

    /**
     * OperationParams 빌더.
     */
    public static final class Builder {

        private final Map<String, String> values = new HashMap<>();
        private final ConductorSettings settings;

        private Builder(ConductorSettings settings) {
            this.settings = settings;
        }

        public Builder put(String key, String value) {
            if (key == null || key.isBlank()) {
                throw new IllegalArgumentException("key cannot be null or blank");
            }
            if (value == null) {
                throw new IllegalArgumentException("value cannot be null (key: " + key + ")");
            }
            values.put(key, value);
            return this;
        }

        public OperationParams build() {
            return new OperationParams(values, settings);
        }
    }
}
