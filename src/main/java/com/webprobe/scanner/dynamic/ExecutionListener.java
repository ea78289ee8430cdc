package com.webprobe.scanner.dynamic;

import com.webprobe.scanner.models.ResponseRecord;
import com.webprobe.scanner.models.TestCase;

public interface ExecutionListener {

    ExecutionListener NONE = new ExecutionListener() {
    };

    default void onCaseCompleted(TestCase testCase, ResponseRecord response) {
    }

    default void onExecutionFinished(ExecutionStats stats) {
    }
}
