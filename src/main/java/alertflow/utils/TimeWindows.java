package alertflow.utils;

import java.time.DayOfWeek;
import java.time.LocalTime;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Locale;

/**
 * 时间窗口工具
 */
public final class TimeWindows {

    private TimeWindows() {
    }

    /**
     * 判断时间是否落在 [start, end) 内,start 晚于 end 时视为跨零点
     */
    public static boolean contains(LocalTime start, LocalTime end, LocalTime time) {
        if (start == null && end == null) {
            return true;
        }
        if (start == null) {
            return time.isBefore(end);
        }
        if (end == null) {
            return !time.isBefore(start);
        }
        if (!start.isAfter(end)) {
            return !time.isBefore(start) && time.isBefore(end);
        }
        return !time.isBefore(start) || time.isBefore(end);
    }

    /**
     * 跨零点窗口中零点之后的部分
     */
    public static boolean inWrappedTail(LocalTime start, LocalTime end, LocalTime time) {
        return start != null && end != null && start.isAfter(end) && time.isBefore(end);
    }

    public static String dayAbbreviation(DayOfWeek day) {
        return day.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    public static String monthAbbreviation(Month month) {
        return month.getDisplayName(TextStyle.SHORT, Locale.ENGLISH);
    }

    /**
     * 当月第几周,1号到7号为第1周
     */
    public static int weekOfMonth(int dayOfMonth) {
        return (dayOfMonth - 1) / 7 + 1;
    }
}
