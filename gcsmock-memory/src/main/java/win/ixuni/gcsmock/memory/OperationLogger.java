package win.ixuni.gcsmock.memory;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * 操作日志
 * <p>
 * Logs start, completion time and failures of file operations.
 */
@Slf4j
final class OperationLogger {

    private OperationLogger() {
    }

    static <R> Mono<R> trace(String target, String operationName, Mono<R> operation) {
        return Mono.defer(() -> {
            final long startTime = System.currentTimeMillis();
            log.debug("[{}] Starting operation: {}", target, operationName);

            return operation
                    .doOnSuccess(result -> log.debug("[{}] Operation {} completed successfully in {}ms",
                            target, operationName, System.currentTimeMillis() - startTime))
                    .doOnError(error -> log.warn("[{}] Operation {} failed after {}ms: {}",
                            target, operationName, System.currentTimeMillis() - startTime, error.getMessage()));
        });
    }
}
