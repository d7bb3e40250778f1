package com.fastpublish.exception;

/**
 * 单个 producer 的一次发布失败
 * 在发送循环内部被消化, 只作为 FailoverException 的组成部分暴露给调用方
 */
public class PublishFailureException extends PublishException {

    private final String brokerUrl;

    private final int attempt;

    public PublishFailureException(String brokerUrl, int attempt, Throwable cause) {
        super("attempt " + attempt + " via " + brokerUrl + " failed: " + describe(cause), cause);
        this.brokerUrl = brokerUrl;
        this.attempt = attempt;
    }

    public String getBrokerUrl() {
        return brokerUrl;
    }

    public int getAttempt() {
        return attempt;
    }

    private static String describe(Throwable cause) {
        if (cause == null) {
            return "unknown";
        }
        return cause.getMessage() == null ? cause.getClass().getSimpleName() : cause.getMessage();
    }
}
