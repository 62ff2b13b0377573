package com.ryuqq.pubsub.adapter.runner;

import com.ryuqq.pubsub.core.model.ChannelSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 채널별 프레즌스 상태 보관소.
 *
 * <p>호출자가 설정한 상태를 보관했다가 다음 heartbeat 요청에 실어 보냅니다.
 * 채널을 떠나면 해당 채널의 상태도 지워집니다.</p>
 *
 * <p>상태 값은 Transport가 그대로 전송하는 직렬화된 문자열(보통 JSON 객체)입니다.</p>
 *
 * <p><strong>스레드 안전성:</strong> 호출자 스레드에서 쓰고 프레즌스 레인에서 읽습니다.
 * 모든 연산은 ConcurrentHashMap으로 처리합니다.</p>
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public final class PresenceStateStore {

    private final Map<String, String> states = new ConcurrentHashMap<>();

    /**
     * 채널 상태 설정.
     *
     * @param channels 대상 채널
     * @param state 직렬화된 상태 (null이면 해당 채널 상태 제거)
     */
    public void put(ChannelSet channels, String state) {
        for (String channel : channels.names()) {
            if (state == null) {
                states.remove(channel);
            } else {
                states.put(channel, state);
            }
        }
    }

    public void remove(ChannelSet channels) {
        for (String channel : channels.names()) {
            states.remove(channel);
        }
    }

    public void clear() {
        states.clear();
    }

    /**
     * heartbeat 대상 채널의 상태.
     *
     * @param channels heartbeat 채널
     * @return 채널 순서대로 상태가 있는 항목만 담은 불변 Map
     */
    public Map<String, String> stateFor(ChannelSet channels) {
        Map<String, String> result = new LinkedHashMap<>();
        for (String channel : channels.names()) {
            String state = states.get(channel);
            if (state != null) {
                result.put(channel, state);
            }
        }
        return Collections.unmodifiableMap(result);
    }
}
