package com.ryuqq.pubsub.core.dedup;

import com.ryuqq.pubsub.core.model.Message;
import com.ryuqq.pubsub.core.model.MessageIdentity;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * 최근 전달한 메시지 식별자를 보관하는 유한 크기 캐시.
 *
 * <p>같은 식별자를 가진 메시지가 보관 구간 안에서 다시 도착하면 전달하지 않습니다.
 * 용량을 넘으면 가장 먼저 들어온 식별자부터 제거합니다 (삽입 순서 기준 FIFO).</p>
 *
 * <p><strong>동시성:</strong> 엔진의 단일 처리 레인에서만 호출되므로 동기화하지 않습니다.
 * 여러 스레드에서 공유하면 안 됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * DedupCache cache = new DedupCache(100);
 * if (cache.shouldDeliver(message.identity())) {
 *     listener.onMessage(message);
 * }
 * </pre>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public class DedupCache {

    /** 기본 최대 크기. */
    public static final int DEFAULT_MAXIMUM_CACHE_SIZE = 100;

    private static final DedupCache DISABLED = new DedupCache(0);

    private final int maximumCacheSize;
    private final LinkedHashSet<MessageIdentity> identities;

    /**
     * 생성자.
     *
     * @param maximumCacheSize 최대 보관 개수 (0이면 비활성화, 음수 불가)
     * @throws IllegalArgumentException maximumCacheSize가 음수인 경우
     */
    public DedupCache(int maximumCacheSize) {
        if (maximumCacheSize < 0) {
            throw new IllegalArgumentException(
                "maximumCacheSize must be non-negative (current: " + maximumCacheSize + ")"
            );
        }
        this.maximumCacheSize = maximumCacheSize;
        this.identities = new LinkedHashSet<>();
    }

    /**
     * 모든 메시지를 통과시키는 비활성 캐시.
     *
     * @return 비활성 DedupCache
     */
    public static DedupCache disabled() {
        return DISABLED;
    }

    /**
     * 메시지를 전달해도 되는지 확인하고, 전달 대상이면 식별자를 기록.
     *
     * @param identity 메시지 식별자
     * @return 처음 보는 식별자이면 true, 보관 구간 안의 중복이면 false
     * @throws IllegalArgumentException identity가 null인 경우
     */
    public boolean shouldDeliver(MessageIdentity identity) {
        if (identity == null) {
            throw new IllegalArgumentException("identity cannot be null");
        }
        if (!isEnabled()) {
            return true;
        }
        if (identities.contains(identity)) {
            return false;
        }
        if (identities.size() >= maximumCacheSize) {
            Iterator<MessageIdentity> oldest = identities.iterator();
            oldest.next();
            oldest.remove();
        }
        identities.add(identity);
        return true;
    }

    /**
     * 메시지 목록에서 중복을 제거.
     *
     * <p>같은 배치 안의 중복도 제거됩니다.</p>
     *
     * @param messages 수신한 메시지
     * @return 전달할 메시지 (수신 순서 유지)
     */
    public List<Message> filter(List<Message> messages) {
        List<Message> deliverable = new ArrayList<>(messages.size());
        for (Message message : messages) {
            if (shouldDeliver(message.identity())) {
                deliverable.add(message);
            }
        }
        return deliverable;
    }

    public boolean isEnabled() {
        return maximumCacheSize > 0;
    }

    public int getMaximumCacheSize() {
        return maximumCacheSize;
    }

    /**
     * 현재 보관 중인 식별자 수.
     *
     * @return 보관 개수 (maximumCacheSize 이하)
     */
    public int size() {
        return identities.size();
    }

    /**
     * 보관 중인 식별자를 모두 제거.
     */
    public void clear() {
        identities.clear();
    }
}
