package alertflow.dispatch;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import lombok.extern.slf4j.Slf4j;

import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 调用渠道发送器: 每次尝试带超时,失败按次数重试,结果以 SendOutcome 返回,不向上抛出
 */
@Slf4j
public class ChannelInvoker implements AutoCloseable {
    private final ChannelSenderRegistry registry;
    private final ExecutorService sendExecutor;
    private final long timeoutSeconds;
    private final int maxAttempts;

    public ChannelInvoker(ChannelSenderRegistry registry, int coreSize, int maxSize,
                          long timeoutSeconds, int maxAttempts) {
        this.registry = registry;
        this.timeoutSeconds = timeoutSeconds;
        this.maxAttempts = Math.max(1, maxAttempts);
        this.sendExecutor = new ThreadPoolExecutor(
                coreSize, maxSize, 60L, TimeUnit.SECONDS,
                new LinkedBlockingQueue<>(1000),
                new ThreadFactoryBuilder().setNameFormat("channel-sender-%d").build(),
                new ThreadPoolExecutor.CallerRunsPolicy()
        );
    }

    public SendOutcome invoke(NotificationChannel channel, DispatchIntent intent) {
        Optional<ChannelSender> sender = registry.get(channel.getType());
        if (!sender.isPresent()) {
            log.error("不支持的通知渠道类型: channel={}, type={}", channel.getId(), channel.getType());
            return SendOutcome.failure("unsupported channel type: " + channel.getType(), 0);
        }

        String lastError = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            Future<?> future = sendExecutor.submit(() -> {
                sender.get().send(channel, intent);
                return null;
            });
            try {
                future.get(timeoutSeconds, TimeUnit.SECONDS);
                log.info("通知发送成功: alert={}, rule={}, channel={}, attempt={}",
                        intent.getAlertId(), intent.getRuleId(), channel.getId(), attempt);
                return SendOutcome.success(attempt);
            } catch (TimeoutException e) {
                future.cancel(true);
                lastError = "timeout after " + timeoutSeconds + "s";
                log.error("通知发送超时: alert={}, channel={}, attempt={}/{}",
                        intent.getAlertId(), channel.getId(), attempt, maxAttempts, e);
            } catch (ExecutionException e) {
                Throwable cause = e.getCause() != null ? e.getCause() : e;
                lastError = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
                log.error("通知发送失败: alert={}, channel={}, attempt={}/{}",
                        intent.getAlertId(), channel.getId(), attempt, maxAttempts, cause);
            } catch (InterruptedException e) {
                future.cancel(true);
                Thread.currentThread().interrupt();
                return SendOutcome.failure("interrupted", attempt);
            }
        }
        log.warn("通知发送重试次数耗尽: alert={}, rule={}, channel={}",
                intent.getAlertId(), intent.getRuleId(), channel.getId());
        return SendOutcome.failure(lastError, maxAttempts);
    }

    @Override
    public void close() {
        sendExecutor.shutdown();
        try {
            if (!sendExecutor.awaitTermination(timeoutSeconds, TimeUnit.SECONDS)) {
                sendExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            sendExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
