package com.teambind.checkout.common.util;

/**
 * 체크아웃 세션 ID 생성기 (Snowflake 방식)
 *
 * ID 구조 (64 bits):
 * - 1 bit: 부호 (항상 0)
 * - 41 bits: 기준 시각 이후 경과 밀리초
 * - 5 bits: 데이터센터 ID
 * - 5 bits: 워커 ID
 * - 12 bits: 같은 밀리초 내 시퀀스
 */
public class CheckoutIdGenerator {

    private static final long EPOCH = 1704067200000L; // 2024-01-01 00:00:00 UTC

    private static final int NODE_BITS = 5;
    private static final int SEQUENCE_BITS = 12;
    private static final long MAX_NODE_ID = (1L << NODE_BITS) - 1;
    private static final long SEQUENCE_MASK = (1L << SEQUENCE_BITS) - 1;

    private final long nodeBits;

    private long sequence;
    private long lastTimestamp = -1L;

    public CheckoutIdGenerator(long workerId, long datacenterId) {
        requireNodeId("workerId", workerId);
        requireNodeId("datacenterId", datacenterId);
        this.nodeBits = (datacenterId << (SEQUENCE_BITS + NODE_BITS)) | (workerId << SEQUENCE_BITS);
    }

    private static void requireNodeId(String name, long value) {
        if (value < 0 || value > MAX_NODE_ID) {
            throw new IllegalArgumentException(name + " must be between 0 and " + MAX_NODE_ID + ": " + value);
        }
    }

    public synchronized long nextId() {
        long now = System.currentTimeMillis();
        if (now < lastTimestamp) {
            throw new IllegalStateException("Clock moved backwards by " + (lastTimestamp - now) + "ms");
        }

        if (now == lastTimestamp) {
            sequence = (sequence + 1) & SEQUENCE_MASK;
            if (sequence == 0) {
                // 시퀀스 소진 시 다음 밀리초까지 대기
                while (now <= lastTimestamp) {
                    now = System.currentTimeMillis();
                }
            }
        } else {
            sequence = 0;
        }
        lastTimestamp = now;

        return ((now - EPOCH) << (SEQUENCE_BITS + 2 * NODE_BITS)) | nodeBits | sequence;
    }
}
