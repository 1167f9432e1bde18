package com.exposureplatform.exposure.queue;

import com.exposureplatform.common.exception.ExposureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.util.function.Supplier;

/**
 * Runs submitted reactive tasks strictly one at a time, in submission order.
 *
 * <p>Every read-modify-write of the exposure status goes through here. Tasks are pushed
 * into a unicast sink drained with {@code concatMap}, so a task starts only after the
 * previous one has terminated. A failing task fails only its own caller; the queue
 * keeps draining.
 */
@Component
public class SerialTaskQueue implements DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(SerialTaskQueue.class);

    private final Sinks.Many<QueuedTask<?>> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final Disposable drain;

    public SerialTaskQueue() {
        this.drain = sink.asFlux()
            .publishOn(Schedulers.boundedElastic())
            .concatMap(QueuedTask::run)
            .subscribe(
                v   -> {},
                err -> log.error("[TaskQueue] drain terminated unexpectedly", err)
            );
    }

    /**
     * Enqueues {@code work} and returns a {@code Mono} of its outcome.
     * The supplier is invoked only when the task reaches the head of the queue.
     *
     * @param name label used in logs
     * @param work deferred task body
     */
    public <T> Mono<T> submit(String name, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            QueuedTask<T> task = new QueuedTask<>(name, work, Sinks.one());
            Sinks.EmitResult emitResult;
            synchronized (sink) {
                emitResult = sink.tryEmitNext(task);
            }
            if (emitResult.isFailure()) {
                return Mono.error(new ExposureException(ExposureException.Store.TASK_QUEUE,
                    "Task rejected. name=" + name + " result=" + emitResult));
            }
            return task.result().asMono();
        });
    }

    @Override
    public void destroy() {
        synchronized (sink) {
            sink.tryEmitComplete();
        }
        drain.dispose();
    }

    private record QueuedTask<T>(String name, Supplier<Mono<T>> work, Sinks.One<T> result) {

        Mono<Void> run() {
            log.debug("[TaskQueue] task started. name={}", name);
            return Mono.defer(work)
                .doOnNext(result::tryEmitValue)
                .switchIfEmpty(Mono.fromRunnable(result::tryEmitEmpty))
                .doOnError(result::tryEmitError)
                .onErrorResume(e -> {
                    log.warn("[TaskQueue] task failed. name={} reason={}", name, e.getMessage());
                    return Mono.empty();
                })
                .then();
        }
    }
}
