package com.webprobe.scanner.crawler;

import com.webprobe.scanner.config.HttpClientFactory;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

@Slf4j
public class OkHttpPageFetcher implements PageFetcher {

    private final OkHttpClient httpClient;

    public OkHttpPageFetcher(int timeoutSec) {
        this(HttpClientFactory.create(timeoutSec));
    }

    public OkHttpPageFetcher(OkHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @Override
    public FetchResult fetch(String url) throws IOException {
        Request request;
        try {
            request = new Request.Builder()
                .url(url)
                .header("User-Agent", HttpClientFactory.USER_AGENT)
                .header("Accept", HttpClientFactory.ACCEPT)
                .get()
                .build();
        } catch (IllegalArgumentException e) {
            throw new IOException("Некорректный URL: " + url, e);
        }

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody body = response.body();
            String text = body != null ? body.string() : "";
            String contentType = response.header("Content-Type");
            log.debug("GET {} -> {} ({} байт)", url, response.code(), text.length());
            return FetchResult.builder()
                .statusCode(response.code())
                .finalUrl(response.request().url().toString())
                .body(text)
                .contentType(contentType)
                .build();
        }
    }

    @Override
    public void cancelAll() {
        httpClient.dispatcher().cancelAll();
    }
}
