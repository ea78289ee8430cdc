package com.webprobe.scanner.support;

import com.webprobe.scanner.crawler.Sleeper;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Sleeper без реального ожидания: только запоминает запрошенные паузы.
 */
public class RecordingSleeper implements Sleeper {

    private final List<Duration> pauses = new CopyOnWriteArrayList<>();

    @Override
    public void sleep(Duration duration) {
        pauses.add(duration);
    }

    public List<Duration> getPauses() {
        return List.copyOf(pauses);
    }

    public long count(Duration duration) {
        return pauses.stream().filter(duration::equals).count();
    }
}
