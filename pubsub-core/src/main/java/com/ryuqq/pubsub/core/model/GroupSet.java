package com.ryuqq.pubsub.core.model;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Insertion-ordered, duplicate-free set of channel group names.
 *
 * <p>Same rules as {@link ChannelSet}; kept as a separate type so channel and group
 * arguments cannot be swapped silently.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class GroupSet {

    private static final GroupSet EMPTY = new GroupSet(Set.of());

    private final Set<String> names;

    private GroupSet(Set<String> names) {
        this.names = names;
    }

    public static GroupSet empty() {
        return EMPTY;
    }

    /**
     * GroupSet 생성.
     *
     * @param names group 이름들
     * @return GroupSet 인스턴스
     * @throws com.ryuqq.pubsub.core.exception.ConfigurationException 유효하지 않은 이름이 있는 경우
     */
    public static GroupSet of(String... names) {
        if (names == null) {
            return of((Collection<String>) null);
        }
        return of(Arrays.asList(names));
    }

    public static GroupSet of(Collection<String> names) {
        Set<String> copy = Names.copyOf("group", names);
        return copy.isEmpty() ? EMPTY : new GroupSet(copy);
    }

    public GroupSet union(GroupSet other) {
        return new GroupSet(Names.union(names, other.names));
    }

    public GroupSet difference(GroupSet other) {
        return new GroupSet(Names.difference(names, other.names));
    }

    public GroupSet intersection(GroupSet other) {
        return new GroupSet(Names.intersection(names, other.names));
    }

    /**
     * presence 전용 이름(<code>-pnpres</code> 접미사)을 제외한 집합.
     *
     * @return presence 이름이 제거된 GroupSet
     */
    public GroupSet withoutPresence() {
        return new GroupSet(Names.withoutPresence(names));
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
        return names.equals(((GroupSet) o).names);
    }

    @Override
    public int hashCode() {
        return names.hashCode();
    }

    @Override
    public String toString() {
        return "GroupSet" + names;
    }
}
