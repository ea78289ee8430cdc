package com.webprobe.scanner.dynamic;

import com.webprobe.scanner.config.HttpClientFactory;
import com.webprobe.scanner.fuzzing.TestUrlBuilder;
import com.webprobe.scanner.models.ResponseRecord;
import com.webprobe.scanner.models.TestCase;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Call;
import okhttp3.FormBody;
import okhttp3.Headers;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.time.Duration;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Отправка тест-кейса через OkHttp.
 *
 * <p>GET: url тест-кейса; у GET формы поля дописываются в query string.
 * POST: тело application/x-www-form-urlencoded, целевое поле несет нагрузку,
 * остальные поля формы - заглушку.</p>
 */
@Slf4j
public class TestCaseExecutor implements RequestSubmitter {

    public static final String DEFAULT_PLACEHOLDER = "test_value";

    private final OkHttpClient httpClient;
    private final String placeholder;
    private final TelemetryCollector telemetry;
    /** Выставляется cancelAll(); call.isCanceled() истинно и после call timeout. */
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public TestCaseExecutor(int timeoutSec) {
        this(HttpClientFactory.create(timeoutSec), DEFAULT_PLACEHOLDER, new TelemetryCollector());
    }

    public TestCaseExecutor(OkHttpClient httpClient, String placeholder, TelemetryCollector telemetry) {
        this.httpClient = httpClient;
        this.placeholder = placeholder != null ? placeholder : DEFAULT_PLACEHOLDER;
        this.telemetry = telemetry != null ? telemetry : new TelemetryCollector();
    }

    @Override
    public ResponseRecord submit(TestCase testCase, Duration timeout) {
        String method = methodOf(testCase);
        long start = System.nanoTime();

        Request request;
        try {
            request = buildRequest(testCase, method);
        } catch (IllegalArgumentException e) {
            telemetry.recordNetworkError(method, testCase.getUrl(), e.getMessage());
            return ResponseRecord.failure(testCase.getUrl(), 0.0, "invalid url: " + e.getMessage());
        }

        Call call = httpClient.newCall(request);
        if (timeout != null && !timeout.isZero() && !timeout.isNegative()) {
            call.timeout().timeout(timeout.toMillis(), TimeUnit.MILLISECONDS);
        }

        try (Response response = call.execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            long durationNanos = System.nanoTime() - start;
            telemetry.recordResponse(method, testCase.getUrl(), response.code(),
                TimeUnit.NANOSECONDS.toMillis(durationNanos));
            return ResponseRecord.builder()
                .statusCode(response.code())
                .headers(headersOf(response.headers()))
                .body(body)
                .finalUrl(response.request().url().toString())
                .elapsedSeconds(seconds(durationNanos))
                .build();
        } catch (InterruptedIOException timeoutException) {
            long durationNanos = System.nanoTime() - start;
            if (cancelRequested.get()) {
                telemetry.recordCancelled(method, testCase.getUrl());
                return ResponseRecord.failure(testCase.getUrl(), seconds(durationNanos), "cancelled");
            }
            telemetry.recordTimeout(method, testCase.getUrl(), TimeUnit.NANOSECONDS.toMillis(durationNanos));
            return ResponseRecord.failure(testCase.getUrl(), seconds(durationNanos), "timeout");
        } catch (IOException ioe) {
            long durationNanos = System.nanoTime() - start;
            if (cancelRequested.get() && call.isCanceled()) {
                telemetry.recordCancelled(method, testCase.getUrl());
                return ResponseRecord.failure(testCase.getUrl(), seconds(durationNanos), "cancelled");
            }
            log.debug("{} {}: {}", method, testCase.getUrl(), ioe.toString());
            telemetry.recordNetworkError(method, testCase.getUrl(), ioe.getMessage());
            return ResponseRecord.failure(testCase.getUrl(), seconds(durationNanos), describe(ioe));
        } catch (RuntimeException e) {
            log.warn("Непредвиденная ошибка при отправке {} {}: {}", method, testCase.getUrl(), e.toString());
            telemetry.recordNetworkError(method, testCase.getUrl(), e.getMessage());
            return ResponseRecord.failure(testCase.getUrl(), seconds(System.nanoTime() - start), describe(e));
        }
    }

    @Override
    public void cancelAll() {
        cancelRequested.set(true);
        httpClient.dispatcher().cancelAll();
    }

    public TelemetryCollector getTelemetry() {
        return telemetry;
    }

    Request buildRequest(TestCase testCase, String method) {
        Map<String, String> fields = TestUrlBuilder.formFields(testCase, placeholder);
        Request.Builder builder = new Request.Builder()
            .header("User-Agent", HttpClientFactory.USER_AGENT)
            .header("Accept", HttpClientFactory.ACCEPT);

        if ("POST".equals(method)) {
            FormBody.Builder form = new FormBody.Builder();
            fields.forEach((name, value) -> form.add(name, value != null ? value : ""));
            return builder.url(testCase.getUrl()).post(form.build()).build();
        }

        String url = testCase.hasFormContext()
            ? TestUrlBuilder.mergeQuery(testCase.getUrl(), fields)
            : testCase.getUrl();
        return builder.url(url).get().build();
    }

    private static String methodOf(TestCase testCase) {
        return testCase.getMethod() != null ? testCase.getMethod().toUpperCase(Locale.ROOT) : "GET";
    }

    private static Map<String, String> headersOf(Headers headers) {
        Map<String, String> result = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        for (String name : headers.names()) {
            result.put(name, String.join(", ", headers.values(name)));
        }
        return Collections.unmodifiableMap(result);
    }

    private static double seconds(long nanos) {
        return nanos / 1_000_000_000.0;
    }

    private static String describe(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
