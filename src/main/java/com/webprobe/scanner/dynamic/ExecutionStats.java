package com.webprobe.scanner.dynamic;

import lombok.Builder;
import lombok.Value;

/**
 * Итоги прогона тест-кейсов.
 */
@Value
@Builder
public class ExecutionStats {
    int dispatched;
    int completed;
    /** Ответы со статусом 0. */
    int failed;
    int handlerErrors;
    boolean cancelled;
    long elapsedMs;
}
