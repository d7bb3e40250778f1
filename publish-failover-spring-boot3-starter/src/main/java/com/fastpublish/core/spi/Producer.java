package com.fastpublish.core.spi;

import com.fastpublish.model.Message;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * 绑定到单个 broker 端点的消息发送者
 * 连接管理、编码由实现方负责; 实现方的生命周期由调用方管理, 框架不会关闭它
 */
public interface Producer {

    /**
     * 发送一条消息
     * @return 异步结果, 正常完成=成功, 异常完成=失败
     */
    CompletionStage<Void> publish(Message message);

    /**
     * 端点描述（如连接串）, 仅用于日志与诊断
     */
    String brokerUrl();

    /**
     * 请求/应答, 默认不支持
     */
    default <R> CompletionStage<R> request(Message message, Class<R> responseType) {
        return CompletableFuture.failedFuture(
                new UnsupportedOperationException("request/reply is not supported by " + brokerUrl()));
    }
}
