package com.ryuqq.pubsub.core.model;

import com.ryuqq.pubsub.core.exception.ConfigurationException;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Shared validation and set algebra for {@link ChannelSet} and {@link GroupSet}.
 */
final class Names {

    static final String PRESENCE_SUFFIX = "-pnpres";

    private Names() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static Set<String> copyOf(String kind, Collection<String> names) {
        if (names == null) {
            throw new ConfigurationException(kind + " names cannot be null");
        }
        LinkedHashSet<String> copy = new LinkedHashSet<>();
        for (String name : names) {
            validate(kind, name);
            copy.add(name);
        }
        return Collections.unmodifiableSet(copy);
    }

    static void validate(String kind, String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException(kind + " name cannot be null or blank");
        }
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isWhitespace(c) || c == ',') {
                throw new ConfigurationException(kind + " name contains invalid characters: '" + name + "'");
            }
        }
    }

    static Set<String> union(Set<String> left, Set<String> right) {
        LinkedHashSet<String> result = new LinkedHashSet<>(left);
        result.addAll(right);
        return Collections.unmodifiableSet(result);
    }

    static Set<String> difference(Set<String> left, Set<String> right) {
        LinkedHashSet<String> result = new LinkedHashSet<>(left);
        result.removeAll(right);
        return Collections.unmodifiableSet(result);
    }

    static Set<String> intersection(Set<String> left, Set<String> right) {
        LinkedHashSet<String> result = new LinkedHashSet<>(left);
        result.retainAll(right);
        return Collections.unmodifiableSet(result);
    }

    static Set<String> withoutPresence(Set<String> names) {
        LinkedHashSet<String> result = new LinkedHashSet<>();
        for (String name : names) {
            if (!name.endsWith(PRESENCE_SUFFIX)) {
                result.add(name);
            }
        }
        return Collections.unmodifiableSet(result);
    }
}
