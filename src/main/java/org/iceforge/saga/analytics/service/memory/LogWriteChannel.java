package org.iceforge.saga.analytics.service.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;

import java.util.concurrent.*;

/**
 * Fire-and-forget channel for log writes. The async variant runs every write on one worker
 * thread behind a bounded queue, so writes land in submission order and a slow log store
 * never holds up a request. Rejected or failing writes are logged and dropped.
 */
public class LogWriteChannel implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(LogWriteChannel.class);

    private final Executor executor;

    private LogWriteChannel(Executor executor) {
        this.executor = executor;
    }

    public static LogWriteChannel async(int queueCapacity) {
        ThreadPoolExecutor worker = new ThreadPoolExecutor(
                1, 1, 0L, TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(queueCapacity),
                r -> {
                    Thread t = new Thread(r, "saga-log-writer");
                    t.setDaemon(true);
                    return t;
                },
                new ThreadPoolExecutor.AbortPolicy());
        return new LogWriteChannel(worker);
    }

    /**
     * Runs writes on the calling thread. Used where callers need to read their own writes.
     */
    public static LogWriteChannel direct() {
        return new LogWriteChannel(Runnable::run);
    }

    public void submit(String description, Runnable write) {
        try {
            executor.execute(() -> {
                try {
                    write.run();
                } catch (RuntimeException e) {
                    log.warn("Log write failed ({}): {}", description, e.getMessage());
                }
            });
        } catch (RejectedExecutionException e) {
            log.warn("Log write dropped ({}): queue full or channel closed", description);
        }
    }

    @Override
    public void destroy() throws InterruptedException {
        if (executor instanceof ExecutorService es) {
            es.shutdown();
            if (!es.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Log writer did not drain within 5s; {} pending writes discarded", es.shutdownNow().size());
            }
        }
    }
}
