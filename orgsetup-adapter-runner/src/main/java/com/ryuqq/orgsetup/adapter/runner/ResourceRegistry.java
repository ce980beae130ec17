package com.ryuqq.orgsetup.adapter.runner;

import com.ryuqq.orgsetup.core.model.ResourceHandle;
import com.ryuqq.orgsetup.core.model.ResourceKind;

import java.util.ArrayList;
import java.util.List;

/**
 * 셋업 실행 하나가 확보한 리소스의 순서 있는 기록.
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>추가만 가능 (중간 삭제 불가)</li>
 *   <li>항상 단계 순서의 접두사 (ORGANIZATION, TENANT, ADMIN_USER, API_KEY, DOMAIN)</li>
 * </ul>
 *
 * <p>실행 스레드 하나가 소유하며 스레드 간 공유하지 않습니다.</p>
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public final class ResourceRegistry {

    private static final ResourceKind[] ORDER = ResourceKind.values();

    private final List<ResourceHandle> handles = new ArrayList<>();

    /**
     * 리소스 핸들 기록.
     *
     * @param handle 리소스 핸들
     * @throws IllegalArgumentException handle이 null인 경우
     * @throws IllegalStateException 단계 순서상 다음 리소스가 아닌 경우
     */
    public void register(ResourceHandle handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null");
        }
        if (handles.size() >= ORDER.length || ORDER[handles.size()] != handle.kind()) {
            ResourceKind expected = handles.size() < ORDER.length ? ORDER[handles.size()] : null;
            throw new IllegalStateException(
                "Out-of-order registration: expected " + expected + " but was " + handle.kind()
            );
        }
        handles.add(handle);
    }

    /**
     * 현재까지 기록된 핸들의 불변 스냅샷 (생성 순서).
     *
     * @return 불변 리스트
     */
    public List<ResourceHandle> snapshot() {
        return List.copyOf(handles);
    }

    /**
     * 기록 초기화.
     */
    public void clear() {
        handles.clear();
    }

    public boolean isEmpty() {
        return handles.isEmpty();
    }

    public int size() {
        return handles.size();
    }
}
