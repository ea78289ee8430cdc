package com.webprobe.scanner.models;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FormTest {

    private static Form form(String page, String action, FormMethod method, String... inputs) {
        return Form.builder()
            .pageUrl(page)
            .actionUrl(action)
            .method(method)
            .inputNames(List.of(inputs))
            .build();
    }

    @Test
    void separatorInsideUrlsDoesNotMergeDistinctForms() {
        Form first = form("http://a.test/?x=1|b", "c", FormMethod.GET, "q");
        Form second = form("http://a.test/?x=1", "b|c", FormMethod.GET, "q");

        assertNotEquals(first.dedupKey(), second.dedupKey());
    }

    @Test
    void inputsDoNotTakePartInKey() {
        Form first = form("http://a.test/", "http://a.test/login", FormMethod.POST, "user");
        Form second = form("http://a.test/", "http://a.test/login", FormMethod.POST, "user", "pass");

        assertEquals(first.dedupKey(), second.dedupKey());
        assertNotEquals(first.dedupKey(),
            form("http://a.test/", "http://a.test/login", FormMethod.GET, "user").dedupKey());
    }
}
