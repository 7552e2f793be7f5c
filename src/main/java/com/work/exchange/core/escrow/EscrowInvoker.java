package com.work.exchange.core.escrow;

import com.work.exchange.core.model.Escrow;
import com.work.exchange.core.model.Offer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.work.exchange.core.support.ValidationUtils.requireNonNull;
import static com.work.exchange.core.support.ValidationUtils.requirePositive;

/**
 * 负责把一次 settle 翻译成对 escrow handler 的单次调用，并把 handler 的成功 / 失败统一折算为 {@link EscrowOutcome}。
 *
 * 约束：
 * 1. 每次调用最多触达 handler 一次
 * 2. 调用期间持有 {@link ReentrancyGuard}，handler 无法重入 orderbook 的任何状态变更操作
 * 3. handler 抛出的任何异常（包括 Error）都不会继续向上传播，而是转为失败结果
 * 4. handler 在独立的 worker 线程上执行，超过 escrowTimeout 即判定失败并中断，
 *    保证 settle 总能在事务超时和锁 TTL 之前落库
 */
public class EscrowInvoker {

    public static final String HANDLER_UNAVAILABLE = "unable to call escrow method";
    public static final String NO_OUTCOME = "escrow returned no outcome";
    public static final String TIMED_OUT = "escrow timeout";
    public static final String HANDLER_BUSY = "escrow handler busy";
    public static final String INTERRUPTED = "escrow interrupted";

    private static final Logger log = LoggerFactory.getLogger(EscrowInvoker.class);

    private final EscrowHandlerRegistry handlers;
    private final ReentrancyGuard guard;
    private final Duration timeout;
    private final ThreadPoolExecutor worker;

    /**
     * 标记当前线程正在执行 handler，供门面层识别 handler 回调。
     */
    private final ThreadLocal<Boolean> handlerThread = ThreadLocal.withInitial(() -> Boolean.FALSE);

    public EscrowInvoker(EscrowHandlerRegistry handlers, ReentrancyGuard guard) {
        this(handlers, guard, Duration.ofSeconds(3));
    }

    public EscrowInvoker(EscrowHandlerRegistry handlers, ReentrancyGuard guard, Duration timeout) {
        this.handlers = requireNonNull(handlers, "handlers");
        this.guard = requireNonNull(guard, "guard");
        this.timeout = requirePositive(timeout, "timeout");
        // 单线程 + 容量 1 的队列：上一次超时的 handler 未退出时新调用最多排队一个，再多直接判定失败
        this.worker = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS, new ArrayBlockingQueue<>(1), r -> {
            Thread t = new Thread(r);
            t.setName("escrow-handler");
            t.setDaemon(true);
            return t;
        });
    }

    public EscrowOutcome invoke(Offer offer) {
        requireNonNull(offer, "offer");
        Escrow escrow = offer.getEscrow();
        Optional<EscrowHandler> handler = handlers.find(escrow.getHandler());
        if (!handler.isPresent()) {
            log.warn("escrow handler missing offerId={} handler={}", offer.getId(), escrow.getHandler());
            return EscrowOutcome.failure(HANDLER_UNAVAILABLE);
        }
        EscrowCall call = new EscrowCall(offer.getId(), escrow.getSelector(), escrow.getArgs());
        return guard.runGuarded(() -> attempt(handler.get(), call));
    }

    /**
     * 当前线程是否是 handler 执行线程。
     */
    public boolean isHandlerThread() {
        return handlerThread.get();
    }

    public Duration getTimeout() {
        return timeout;
    }

    private EscrowOutcome attempt(EscrowHandler handler, EscrowCall call) {
        Future<EscrowOutcome> f;
        try {
            f = worker.submit(() -> {
                handlerThread.set(Boolean.TRUE);
                try {
                    return handler.attempt(call);
                } finally {
                    handlerThread.remove();
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("escrow handler still busy offerId={}", call.getOfferId());
            return EscrowOutcome.failure(HANDLER_BUSY);
        }

        try {
            EscrowOutcome outcome = f.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return outcome == null ? EscrowOutcome.failure(NO_OUTCOME) : outcome;
        } catch (TimeoutException e) {
            f.cancel(true);
            log.warn("escrow handler timed out offerId={} timeout={}", call.getOfferId(), timeout);
            return EscrowOutcome.failure(TIMED_OUT);
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            return EscrowOutcome.failure(INTERRUPTED);
        } catch (ExecutionException e) {
            // 等同链上 revert：原因作为数据上报，不中断 settle
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String reason = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            log.warn("escrow handler reverted offerId={} err={}", call.getOfferId(), cause.toString());
            return EscrowOutcome.failure(reason);
        }
    }
}
