package com.fastpublish.exception;

import com.fastpublish.model.DispatchAttempt;

import java.util.List;

/**
 * 尝试次数耗尽仍未发送成功
 * 按尝试顺序携带每一次的失败原因, 构造后不可变
 */
public class FailoverException extends PublishException {

    private final int attempts;

    private final List<PublishFailureException> errors;

    private final List<DispatchAttempt> attemptLog;

    public FailoverException(int attempts, List<DispatchAttempt> attemptLog) {
        super(buildMessage(attempts, attemptLog), lastError(attemptLog));
        this.attempts = attempts;
        this.attemptLog = List.copyOf(attemptLog);
        this.errors = this.attemptLog.stream()
                .map(DispatchAttempt::getError)
                .toList();
        // 全部失败原因挂到 suppressed, 打印堆栈时可见
        this.errors.forEach(this::addSuppressed);
    }

    public int getAttempts() {
        return attempts;
    }

    public List<PublishFailureException> getErrors() {
        return errors;
    }

    public List<DispatchAttempt> getAttemptLog() {
        return attemptLog;
    }

    private static Throwable lastError(List<DispatchAttempt> attemptLog) {
        return attemptLog.isEmpty() ? null : attemptLog.get(attemptLog.size() - 1).getError();
    }

    private static String buildMessage(int attempts, List<DispatchAttempt> attemptLog) {
        StringBuilder sb = new StringBuilder("failed to send message after ")
                .append(attempts).append(" attempt(s)");
        if (!attemptLog.isEmpty()) {
            sb.append(", brokers=");
            sb.append(attemptLog.stream().map(DispatchAttempt::getBrokerUrl).toList());
        }
        return sb.toString();
    }
}
