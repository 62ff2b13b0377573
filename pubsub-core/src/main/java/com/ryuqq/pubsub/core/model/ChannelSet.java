package com.ryuqq.pubsub.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * 구독 중인 채널 이름 집합.
 *
 * <p>삽입 순서를 유지하는 불변 집합입니다. 순서는 멤버십 판단에는 영향이 없지만
 * 요청 URL을 결정적으로 구성하기 위해 보존합니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>중복 없음 (이미 있는 이름 추가는 no-op)</li>
 *   <li>이름: null/blank 불가, 공백과 쉼표 불가</li>
 * </ul>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class ChannelSet {

    private static final ChannelSet EMPTY = new ChannelSet(Set.of());

    private final Set<String> names;

    private ChannelSet(Set<String> names) {
        this.names = names;
    }

    public static ChannelSet empty() {
        return EMPTY;
    }

    /**
     * ChannelSet 생성.
     *
     * @param names channel 이름들
     * @return ChannelSet 인스턴스
     * @throws com.ryuqq.pubsub.core.exception.ConfigurationException 유효하지 않은 이름이 있는 경우
     */
    public static ChannelSet of(String... names) {
        if (names == null) {
            return of((Collection<String>) null);
        }
        return of(Arrays.asList(names));
    }

    public static ChannelSet of(Collection<String> names) {
        Set<String> copy = Names.copyOf("channel", names);
        return copy.isEmpty() ? EMPTY : new ChannelSet(copy);
    }

    public ChannelSet union(ChannelSet other) {
        return new ChannelSet(Names.union(names, other.names));
    }

    public ChannelSet difference(ChannelSet other) {
        return new ChannelSet(Names.difference(names, other.names));
    }

    public ChannelSet intersection(ChannelSet other) {
        return new ChannelSet(Names.intersection(names, other.names));
    }

    /**
     * presence 전용 이름(<code>-pnpres</code> 접미사)을 제외한 집합.
     *
     * @return presence 이름이 제거된 ChannelSet
     */
    public ChannelSet withoutPresence() {
        return new ChannelSet(Names.withoutPresence(names));
    }

    public boolean contains(String name) {
        return names.contains(name);
    }

    public boolean isEmpty() {
        return names.isEmpty();
    }

    public int size() {
        return names.size();
    }

    /**
     * 삽입 순서대로 이름 목록 반환.
     *
     * @return 불변 목록
     */
    public List<String> names() {
        return List.copyOf(names);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return names.equals(((ChannelSet) o).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "ChannelSet" + names;
    }
}
