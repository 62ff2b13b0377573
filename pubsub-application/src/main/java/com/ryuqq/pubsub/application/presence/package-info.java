/**
 * Presence Event Engine.
 *
 * <p>Announces the client on a channel/group set with periodic heartbeats and sends
 * leave requests when members are removed.</p>
 *
 * @since 1.0.0
 * @author PubSub Team
 */
package com.ryuqq.pubsub.application.presence;
