package com.ryuqq.pubsub.core.exception;

/**
 * Invalid caller input (channel/group names, cursor values, configuration).
 *
 * <p>Raised synchronously before any event reaches an engine, so a rejected call never
 * causes a state transition. Extends {@link IllegalArgumentException} so callers that
 * already guard against bad arguments keep working.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public class ConfigurationException extends IllegalArgumentException {

    public ConfigurationException(String message) {
        super(message);
    }
}
