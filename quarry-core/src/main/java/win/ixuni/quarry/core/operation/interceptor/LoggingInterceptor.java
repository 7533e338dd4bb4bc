package win.ixuni.quarry.core.operation.interceptor;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.exception.QuarryException;
import win.ixuni.quarry.core.operation.DriverContext;
import win.ixuni.quarry.core.operation.HandlerInterceptor;
import win.ixuni.quarry.core.operation.InterceptorChain;
import win.ixuni.quarry.core.operation.Operation;

import java.util.concurrent.TimeUnit;

/**
 * 日志拦截器
 * <p>
 * One line per driver operation with its elapsed time. Client-side failures (missing key, bad precondition)
 * stay at debug; only server-side failures reach warn.
 */
@Slf4j
public class LoggingInterceptor implements HandlerInterceptor {

    static final int ORDER = -100;

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(O operation, DriverContext context,
                                                         InterceptorChain<O, R> chain) {
        return Mono.defer(() -> {
            long started = System.nanoTime();
            return chain.proceed(operation, context)
                    .doOnSuccess(result -> log.debug("[{}] {} ok ({} ms)",
                            context.getDriverName(), operation.getOperationName(), elapsedMillis(started)))
                    .doOnError(error -> {
                        if (error instanceof QuarryException qe && qe.getHttpStatus() < 500) {
                            log.debug("[{}] {} -> {} ({} ms)", context.getDriverName(),
                                    operation.getOperationName(), qe.getErrorCode(), elapsedMillis(started));
                        } else {
                            log.warn("[{}] {} failed after {} ms: {}", context.getDriverName(),
                                    operation.getOperationName(), elapsedMillis(started), error.toString());
                        }
                    });
        });
    }

    private static long elapsedMillis(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }

    @Override
    public int getOrder() {
        return ORDER;
    }
}
