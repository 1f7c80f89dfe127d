package com.roundtrip.common.utils;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;

/**
 * 日历日期工具。
 * <p>所有日期都是不带时分秒、不带时区的 {@link LocalDate}，等价于按 UTC 零点做加减，
 * 跨月、跨年与闰年由日历本身处理，不存在夏令时漂移。</p>
 */
public class DateUtil {

    private static final DateTimeFormatter ISO_DATE = DateTimeFormatter.ISO_LOCAL_DATE;

    /** 可接受的年份范围，超出的按非法日期处理，保证后续加减天数不会越过 LocalDate 的边界 */
    public static final int MIN_YEAR = 1;
    public static final int MAX_YEAR = 9999;

    private DateUtil() {
    }

    public static LocalDate addDays(LocalDate date, long days) {
        return date.plusDays(days);
    }

    /**
     * 格式化为 YYYY-MM-DD；入参为 null 时返回 null。
     */
    public static String formatDate(LocalDate date) {
        return date == null ? null : date.format(ISO_DATE);
    }

    /**
     * 解析 YYYY-MM-DD。空串、格式不合法或年份不在 [MIN_YEAR, MAX_YEAR] 内时返回 null，
     * 而不是抛异常，由调用方按“缺失日期”降级处理。
     */
    public static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        LocalDate date;
        try {
            date = LocalDate.parse(text.trim(), ISO_DATE);
        } catch (DateTimeParseException e) {
            return null;
        }
        if (date.getYear() < MIN_YEAR || date.getYear() > MAX_YEAR) {
            return null;
        }
        return date;
    }

    /**
     * 两个日期之间相差的天数，满足 addDays(from, daysBetween(from, to)) == to。
     */
    public static long daysBetween(LocalDate from, LocalDate to) {
        return ChronoUnit.DAYS.between(from, to);
    }
}
