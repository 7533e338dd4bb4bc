package win.ixuni.quarry.core.operation.interceptor;

import reactor.core.publisher.Mono;
import win.ixuni.quarry.core.exception.StorageIOException;
import win.ixuni.quarry.core.operation.DriverContext;
import win.ixuni.quarry.core.operation.HandlerInterceptor;
import win.ixuni.quarry.core.operation.InterceptorChain;
import win.ixuni.quarry.core.operation.Operation;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Translates raw I/O failures from a driver into {@link StorageIOException}
 * <p>
 * Only the operation's own Mono is covered; content streams returned by reads map their errors themselves.
 */
public class IOExceptionTranslationInterceptor implements HandlerInterceptor {

    @Override
    public <O extends Operation<R>, R> Mono<R> intercept(
            O operation,
            DriverContext context,
            InterceptorChain<O, R> chain) {
        return chain.proceed(operation, context)
                .onErrorMap(this::isIOFailure, e -> translate(operation, context, e));
    }

    private boolean isIOFailure(Throwable e) {
        return e instanceof IOException || e instanceof UncheckedIOException;
    }

    private Throwable translate(Operation<?> operation, DriverContext context, Throwable e) {
        Throwable cause = e instanceof UncheckedIOException ? e.getCause() : e;
        return new StorageIOException(
                "[" + context.getDriverName() + "] " + operation.getOperationName() + " failed: "
                        + cause.getMessage(), cause);
    }

    @Override
    public int getOrder() {
        return -50;
    }
}
