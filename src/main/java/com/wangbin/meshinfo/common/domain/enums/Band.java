package com.wangbin.meshinfo.common.domain.enums;

import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

/**
 * 无线频段
 */
public enum Band {

    NINE_HUNDRED_MHZ("900MHz"),
    TWO_GHZ("2GHz"),
    THREE_GHZ("3GHz"),
    FIVE_GHZ("5GHz"),
    OFF("Off"),
    UNKNOWN("Unknown");

    private static final Set<String> NINE_HUNDRED_MHZ_BOARDS = Set.of("0xe009", "0xe1b9", "0xe239");

    private static final Set<String> TWO_GHZ_CHANNELS = IntStream.rangeClosed(-4, 11)
            .filter(ch -> ch != 0)
            .mapToObj(String::valueOf)
            .collect(Collectors.toUnmodifiableSet());

    // 有的固件上报信道号，有的上报频率
    private static final Set<String> THREE_GHZ_CHANNELS = Stream.concat(
                    IntStream.rangeClosed(76, 99).mapToObj(String::valueOf),
                    IntStream.iterate(3380, f -> f <= 3495, f -> f + 5).mapToObj(String::valueOf))
            .collect(Collectors.toUnmodifiableSet());

    private static final Set<String> FIVE_GHZ_CHANNELS = Stream.concat(
                    Stream.of("37", "40", "44", "48", "52", "56", "60", "64",
                            "100", "104", "108", "112", "116", "120", "124", "128"),
                    IntStream.rangeClosed(131, 184).mapToObj(String::valueOf))
            .collect(Collectors.toUnmodifiableSet());

    private final String label;

    Band(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * 根据射频状态、板卡ID和信道推断频段
     */
    public static Band resolve(String radioStatus, String boardId, String channel) {
        if (!"on".equals(radioStatus)) {
            return OFF;
        }
        if (boardId != null && NINE_HUNDRED_MHZ_BOARDS.contains(boardId)) {
            return NINE_HUNDRED_MHZ;
        }
        if (channel == null) {
            return UNKNOWN;
        }
        if (TWO_GHZ_CHANNELS.contains(channel)) {
            return TWO_GHZ;
        }
        if (THREE_GHZ_CHANNELS.contains(channel)) {
            return THREE_GHZ;
        }
        if (FIVE_GHZ_CHANNELS.contains(channel)) {
            return FIVE_GHZ;
        }
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return label;
    }
}
