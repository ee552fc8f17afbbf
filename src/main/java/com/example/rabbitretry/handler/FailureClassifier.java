package com.example.rabbitretry.handler;

import org.springframework.amqp.AmqpConnectException;

import com.google.common.base.Throwables;
import com.rabbitmq.client.ShutdownSignalException;

/**
 * 区分连接级致命错误与单条消息级错误
 *
 * 沿异常链查找：
 * - ShutdownSignalException 存在时以 isHardError() 为准（连接级关闭才致命，channel 级关闭不算）
 * - 否则出现 AmqpConnectException 即视为致命
 * - 其余一律为 UNEXPECTED
 */
public class FailureClassifier {

    public FailureCategory classify(Throwable failure) {
        if (failure == null) {
            return FailureCategory.UNEXPECTED;
        }

        boolean connectException = false;
        for (Throwable cause : Throwables.getCausalChain(failure)) {
            if (cause instanceof ShutdownSignalException) {
                return ((ShutdownSignalException) cause).isHardError()
                        ? FailureCategory.CONNECTION_FATAL
                        : FailureCategory.UNEXPECTED;
            }
            if (cause instanceof AmqpConnectException) {
                connectException = true;
            }
        }
        return connectException ? FailureCategory.CONNECTION_FATAL : FailureCategory.UNEXPECTED;
    }

    public boolean isConnectionFatal(Throwable failure) {
        return classify(failure) == FailureCategory.CONNECTION_FATAL;
    }
}
