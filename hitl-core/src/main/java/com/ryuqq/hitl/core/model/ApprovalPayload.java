package com.ryuqq.hitl.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 승인 대상 작업의 설명.
 *
 * <p>정책 컴포넌트가 "무엇을 승인받으려는지" 기술하는 데이터입니다.
 * 일반적으로 도구 호출 하나를 표현합니다 (도구 이름, 설명, 호출 인자).</p>
 *
 * <p>Core는 이 값을 해석하지 않으며, 목록 조회 시 요약본으로 복사하기만 합니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * ApprovalPayload payload = ApprovalPayload.of(
 *     "delete_file",
 *     "Delete a file from the filesystem",
 *     Map.of("path", "/tmp/report.txt")
 * );
 * </pre>
 *
 * <p><strong>불변성:</strong> arguments, metadata는 방어적으로 복사되며 수정 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>name: null 또는 빈 문자열 불가</li>
 *   <li>description: null 허용 (빈 문자열로 정규화)</li>
 *   <li>arguments, metadata: null 허용 (빈 Map으로 정규화), 입력 순서 유지</li>
 * </ul>
 *
 * @author HITL Team
 * @since 1.0.0
 */
public final class ApprovalPayload {

    private final String name;
    private final String description;
    private final Map<String, Object> arguments;
    private final Map<String, Object> metadata;

    private ApprovalPayload(String name, String description,
                            Map<String, Object> arguments, Map<String, Object> metadata) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.description = description == null ? "" : description;
        this.arguments = copyOf(arguments);
        this.metadata = copyOf(metadata);
    }

    /**
     * 이름만으로 ApprovalPayload 생성.
     *
     * @param name 작업 이름 (예: delete_file)
     * @return ApprovalPayload 인스턴스
     * @throws IllegalArgumentException name이 null 또는 빈 문자열인 경우
     */
    public static ApprovalPayload of(String name) {
        return new ApprovalPayload(name, null, null, null);
    }

    /**
     * ApprovalPayload 생성.
     *
     * @param name 작업 이름
     * @param description 작업 설명 (null 허용)
     * @param arguments 호출 인자 (null 허용)
     * @return ApprovalPayload 인스턴스
     * @throws IllegalArgumentException name이 null 또는 빈 문자열인 경우
     */
    public static ApprovalPayload of(String name, String description, Map<String, Object> arguments) {
        return new ApprovalPayload(name, description, arguments, null);
    }

    /**
     * 메타데이터를 포함한 ApprovalPayload 생성.
     *
     * @param name 작업 이름
     * @param description 작업 설명 (null 허용)
     * @param arguments 호출 인자 (null 허용)
     * @param metadata 부가 정보 (null 허용)
     * @return ApprovalPayload 인스턴스
     * @throws IllegalArgumentException name이 null 또는 빈 문자열인 경우
     */
    public static ApprovalPayload of(String name, String description,
                                     Map<String, Object> arguments, Map<String, Object> metadata) {
        return new ApprovalPayload(name, description, arguments, metadata);
    }

    private static Map<String, Object> copyOf(Map<String, Object> source) {
        if (source == null || source.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new LinkedHashMap<>(source));
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    /**
     * 호출 인자 조회.
     *
     * @return 수정 불가능한 인자 Map (입력 순서 유지)
     */
    public Map<String, Object> getArguments() {
        return arguments;
    }

    /**
     * 부가 정보 조회.
     *
     * @return 수정 불가능한 메타데이터 Map
     */
    public Map<String, Object> getMetadata() {
        return metadata;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ApprovalPayload that = (ApprovalPayload) o;
        return name.equals(that.name)
            && description.equals(that.description)
            && arguments.equals(that.arguments)
            && metadata.equals(that.metadata);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, description, arguments, metadata);
    }

    @Override
    public String toString() {
        return "ApprovalPayload{name=" + name + ", arguments=" + arguments + '}';
    }
}
