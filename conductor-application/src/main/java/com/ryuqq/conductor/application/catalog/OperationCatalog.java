package com.ryuqq.conductor.application.catalog;

import com.ryuqq.conductor.core.model.OperationKind;

import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 작업 종류 → {@link OperationFactory} 매핑.
 *
 * <p>생성 후 불변입니다. 같은 종류가 두 번 등록되면 생성 시점에 실패합니다.</p>
 *
 * @author Conductor Team
 * @since 1.0.0
 */
public final class OperationCatalog {

    private final Map<OperationKind, OperationFactory> factories;

    private OperationCatalog(Map<OperationKind, OperationFactory> factories) {
        this.factories = Collections.unmodifiableMap(factories);
    }

    /**
     * 카탈로그 생성.
     *
     * @param factories 등록할 팩토리
     * @return 카탈로그
     * @throws IllegalArgumentException null 요소 또는 중복 종류가 있는 경우
     */
    public static OperationCatalog of(Collection<? extends OperationFactory> factories) {
        if (factories == null) {
            throw new IllegalArgumentException("factories cannot be null");
        }
        Map<OperationKind, OperationFactory> map = new EnumMap<>(OperationKind.class);
        for (OperationFactory factory : factories) {
            if (factory == null || factory.kind() == null) {
                throw new IllegalArgumentException("factory and its kind cannot be null");
            }
            OperationFactory previous = map.putIfAbsent(factory.kind(), factory);
            if (previous != null) {
                throw new IllegalArgumentException("Duplicate factory for kind: " + factory.kind());
            }
        }
        return new OperationCatalog(map);
    }

    public static OperationCatalog of(OperationFactory... factories) {
        if (factories == null) {
            throw new IllegalArgumentException("factories cannot be null");
        }
        return of(Arrays.asList(factories));
    }

    public Optional<OperationFactory> find(OperationKind kind) {
        return Optional.ofNullable(factories.get(kind));
    }

    /**
     * @throws IllegalArgumentException 등록되지 않은 종류인 경우
     */
    public OperationFactory require(OperationKind kind) {
        OperationFactory factory = factories.get(kind);
        if (factory == null) {
            throw new IllegalArgumentException("No operation registered for kind: " + kind);
        }
        return factory;
    }

    public Set<OperationKind> kinds() {
        return factories.keySet();
    }
}
