package com.ryuqq.pubsub.core.model;

import com.ryuqq.pubsub.core.exception.ConfigurationException;

import java.math.BigInteger;

/**
 * 실시간 업데이트 스트림의 재개 위치 (timetoken + region).
 *
 * <p>timetoken은 서버가 부여하는 단조 증가 값으로, 17자리 이상이 될 수 있어
 * 10진수 문자열로 보관합니다. 비교는 숫자 기준입니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>timetoken: null/blank 불가, 0 이상의 10진수</li>
 *   <li>region: 0 이상</li>
 * </ul>
 *
 * @param timetoken 서버 timetoken (10진수 문자열)
 * @param region 서버 region
 *
 * @author PubSub Team
 * @since 1.0.0
 */
public record Cursor(String timetoken, int region) implements Comparable<Cursor> {

    /**
     * 스트림의 처음 위치. handshake 요청에 사용됩니다.
     */
    public static final Cursor ZERO = new Cursor("0", 0);

    /**
     * Compact Constructor.
     *
     * @throws ConfigurationException 유효하지 않은 값인 경우
     */
    public Cursor {
        if (timetoken == null || timetoken.isBlank()) {
            throw new ConfigurationException("timetoken cannot be null or blank");
        }
        for (int i = 0; i < timetoken.length(); i++) {
            if (!Character.isDigit(timetoken.charAt(i))) {
                throw new ConfigurationException("timetoken must be a non-negative decimal (current: " + timetoken + ")");
            }
        }
        if (region < 0) {
            throw new ConfigurationException("region must be non-negative (current: " + region + ")");
        }
    }

    /**
     * Cursor 생성.
     *
     * @param timetoken timetoken 값
     * @param region region 값
     * @return Cursor 인스턴스
     */
    public static Cursor of(long timetoken, int region) {
        if (timetoken < 0) {
            throw new ConfigurationException("timetoken must be non-negative (current: " + timetoken + ")");
        }
        return new Cursor(Long.toString(timetoken), region);
    }

    /**
     * 두 Cursor 중 더 앞선(최신) 위치 반환.
     *
     * @param current 현재 Cursor (null 허용)
     * @param candidate 새 Cursor (null 허용)
     * @return 최신 Cursor, 둘 다 null이면 null
     */
    public static Cursor latest(Cursor current, Cursor candidate) {
        if (current == null) {
            return candidate;
        }
        if (candidate == null) {
            return current;
        }
        return candidate.compareTo(current) >= 0 ? candidate : current;
    }

    /**
     * timetoken만 유지하고 region을 교체한 새 Cursor.
     *
     * <p>restore 이후 handshake 응답의 region을 적용할 때 사용합니다.</p>
     *
     * @param region 새 region
     * @return 새 Cursor
     */
    public Cursor withRegion(int region) {
        return new Cursor(timetoken, region);
    }

    /**
     * 스트림 처음 위치(timetoken 0)인지 확인.
     *
     * @return timetoken이 0이면 true
     */
    public boolean isZero() {
        return new BigInteger(timetoken).signum() == 0;
    }

    @Override
    public int compareTo(Cursor other) {
        int byTimetoken = new BigInteger(timetoken).compareTo(new BigInteger(other.timetoken));
        if (byTimetoken != 0) {
            return byTimetoken;
        }
        return Integer.compare(region, other.region);
    }
}
