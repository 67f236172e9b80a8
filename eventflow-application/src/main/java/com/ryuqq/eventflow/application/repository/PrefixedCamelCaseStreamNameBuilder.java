package com.ryuqq.eventflow.application.repository;

import com.ryuqq.eventflow.core.spi.StreamNameBuilder;

import java.util.Locale;
import java.util.UUID;

/**
 * camelCase 타입명 기반 스트림 이름 생성기.
 *
 * <p><strong>형식:</strong></p>
 * <ul>
 *   <li>Aggregate: {@code [prefix.]camelName-<dash 없는 uuid>}</li>
 *   <li>Category: {@code $ce-[prefix.]camelName}</li>
 *   <li>Event type: {@code $et-<TypeName>}</li>
 * </ul>
 *
 * <p>Aggregate 스트림에서 첫 '-' 앞부분이 category 이름과 같아야 저장소의 $ce- 프로젝션과 맞물립니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public class PrefixedCamelCaseStreamNameBuilder implements StreamNameBuilder {

    public static final String CATEGORY_PREFIX = "$ce-";
    public static final String EVENT_TYPE_PREFIX = "$et-";

    private final String prefix;

    public PrefixedCamelCaseStreamNameBuilder() {
        this.prefix = "";
    }

    /**
     * @param prefix 스트림 이름 앞에 붙일 소문자 접두사
     * @throws IllegalArgumentException prefix가 null 또는 공백인 경우
     */
    public PrefixedCamelCaseStreamNameBuilder(String prefix) {
        if (prefix == null || prefix.isBlank()) {
            throw new IllegalArgumentException("Provide with prefix or use default constructor instead.");
        }
        this.prefix = prefix.toLowerCase(Locale.ROOT) + ".";
    }

    @Override
    public String generateForAggregate(Class<?> aggregateType, UUID id) {
        if (aggregateType == null) {
            throw new IllegalArgumentException("aggregateType cannot be null");
        }
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        return prefix + camelCase(aggregateType) + "-" + id.toString().replace("-", "");
    }

    @Override
    public String generateForCategory(Class<?> aggregateType) {
        if (aggregateType == null) {
            throw new IllegalArgumentException("aggregateType cannot be null");
        }
        return CATEGORY_PREFIX + prefix + camelCase(aggregateType);
    }

    @Override
    public String generateForEventType(String eventTypeName) {
        if (eventTypeName == null || eventTypeName.isBlank()) {
            throw new IllegalArgumentException("eventTypeName cannot be null or blank");
        }
        return EVENT_TYPE_PREFIX + eventTypeName;
    }

    private static String camelCase(Class<?> type) {
        String name = type.getSimpleName();
        return Character.toLowerCase(name.charAt(0)) + name.substring(1);
    }
}
