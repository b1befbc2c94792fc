package net.cadence.core.interval;

/** 인식할 수 없는 주기 문자열. 엔진 경계에서 REJECTED 결과로 변환된다. */
public class InvalidIntervalException extends IllegalArgumentException {
    private final String intervalText;

    public InvalidIntervalException(String intervalText) {
        this(intervalText, null);
    }

    public InvalidIntervalException(String intervalText, Throwable cause) {
        super("Can't understand interval: '" + intervalText + "'", cause);
        this.intervalText = intervalText;
    }

    public String intervalText() {
        return intervalText;
    }
}
