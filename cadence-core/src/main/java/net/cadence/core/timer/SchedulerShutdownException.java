package net.cadence.core.timer;

/** shutdown 이 시작된 뒤 런타임을 다시 쓰려 할 때. */
public class SchedulerShutdownException extends IllegalStateException {
    public SchedulerShutdownException(String message) {
        super(message);
    }
}
