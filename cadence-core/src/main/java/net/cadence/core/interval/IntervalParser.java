package net.cadence.core.interval;

import java.time.Duration;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 사람이 쓰는 주기 문자열을 고정 길이로 바꾼다.
 * <p>
 * 허용 문법 (대소문자 무시, 앞뒤 공백 제거):
 * <ul>
 *   <li>{@code <정수> (m|min|mins|minute|minutes)}</li>
 *   <li>{@code <정수> (h|hr|hrs|hour|hours)}</li>
 *   <li>{@code daily} = 24h, {@code weekly} = 7d</li>
 * </ul>
 * 초 단위, 복합 단위, cron 식은 받지 않는다.
 * {@link #MAX_INTERVAL} 보다 긴 주기는 발화 시각 계산이 넘칠 수 있어 거절한다.
 */
public final class IntervalParser {
    private static final Pattern MINUTES = Pattern.compile("^(\\d+)\\s*(?:m|min|mins|minute|minutes)$");
    private static final Pattern HOURS = Pattern.compile("^(\\d+)\\s*(?:h|hr|hrs|hour|hours)$");

    /** 허용하는 가장 긴 주기 (100년) */
    public static final Duration MAX_INTERVAL = Duration.ofDays(36_500);

    private IntervalParser() {}

    public static ParsedInterval parse(String intervalText) {
        if (intervalText == null) throw new InvalidIntervalException(null);
        String s = intervalText.trim().toLowerCase(Locale.ROOT);

        if (s.equals("daily")) return new ParsedInterval(intervalText, Duration.ofDays(1));
        if (s.equals("weekly")) return new ParsedInterval(intervalText, Duration.ofDays(7));

        Matcher m = MINUTES.matcher(s);
        if (m.matches()) return new ParsedInterval(intervalText, amount(intervalText, m.group(1), false));
        Matcher h = HOURS.matcher(s);
        if (h.matches()) return new ParsedInterval(intervalText, amount(intervalText, h.group(1), true));

        throw new InvalidIntervalException(intervalText);
    }

    /** 예외 없이 판별만 할 때 */
    public static boolean isValid(String intervalText) {
        try {
            parse(intervalText);
            return true;
        } catch (InvalidIntervalException e) {
            return false;
        }
    }

    private static Duration amount(String original, String digits, boolean hours) {
        try {
            long n = Long.parseLong(digits);
            Duration d = hours ? Duration.ofHours(n) : Duration.ofMinutes(n);
            if (d.compareTo(MAX_INTERVAL) > 0) throw new InvalidIntervalException(original);
            return d;
        } catch (NumberFormatException | ArithmeticException overflow) {
            throw new InvalidIntervalException(original, overflow);
        }
    }
}
