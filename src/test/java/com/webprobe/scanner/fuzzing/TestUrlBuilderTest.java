package com.webprobe.scanner.fuzzing;

import com.webprobe.scanner.models.TestCase;
import com.webprobe.scanner.models.TestOrigin;
import com.webprobe.scanner.payload.LiteralPayload;
import com.webprobe.scanner.payload.NumericDirective;
import okhttp3.HttpUrl;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class TestUrlBuilderTest {

    @Test
    void literalPayloadIsEncodedAndOtherParamsKept() {
        String payload = "' OR 1=1--";
        String url = TestUrlBuilder.withParam("http://x.test/search?q=1&page=1", "q", payload);

        HttpUrl parsed = HttpUrl.parse(url);
        assertNotNull(parsed);
        assertEquals("x.test", parsed.host());
        assertEquals("/search", parsed.encodedPath());
        assertEquals(payload, parsed.queryParameter("q"));
        assertEquals("1", parsed.queryParameter("page"));
        assertEquals(List.of("q", "page"), List.of(parsed.queryParameterName(0), parsed.queryParameterName(1)));
        assertFalse(url.contains(" "), url);
        assertFalse(url.contains("'"), url);
        assertTrue(url.endsWith("&page=1"), url);
    }

    @Test
    void adjacentDirectiveAddsDeltaToNumericValue() {
        NumericDirective next = NumericDirective.adjacent(1, "IDOR adjacent test");
        String value = TestUrlBuilder.injectedValue(next, TestUrlBuilder.originalValue("http://x.test/item?id=123", "id"));
        assertEquals("124", value);
        assertEquals("http://x.test/item?id=124", TestUrlBuilder.withParam("http://x.test/item?id=123", "id", value));

        NumericDirective previous = NumericDirective.adjacent(-1, "IDOR adjacent test");
        assertEquals("122", TestUrlBuilder.injectedValue(previous, "123"));
    }

    @Test
    void adjacentDirectiveFallsBackToDelta() {
        NumericDirective next = NumericDirective.adjacent(1, "IDOR adjacent test");
        assertEquals("1", TestUrlBuilder.injectedValue(next, "abc"));
        assertEquals("1", TestUrlBuilder.injectedValue(next, ""));
        assertEquals("1", TestUrlBuilder.injectedValue(next, String.valueOf(Long.MAX_VALUE)));
        // параметра нет в URL: считаем исходным значением 1
        assertEquals("2", TestUrlBuilder.injectedValue(next, null));
    }

    @Test
    void fixedDirectivesUseTheirValue() {
        assertEquals("999999", TestUrlBuilder.injectedValue(
            NumericDirective.fixed(NumericDirective.Kind.LARGE, 999999, "large"), "5"));
        assertEquals("-1", TestUrlBuilder.injectedValue(
            NumericDirective.fixed(NumericDirective.Kind.NEGATIVE, -1, "negative"), "5"));
        assertEquals("<b>", TestUrlBuilder.injectedValue(LiteralPayload.of("<b>", "n"), "5"));
    }

    @Test
    void duplicateTargetCollapsedAndMissingTargetAppended() {
        assertEquals("http://x.test/?a=1&q=new&b=2",
            TestUrlBuilder.withParam("http://x.test/?a=1&q=old&b=2&q=older", "q", "new"));
        assertEquals("http://x.test/p?a=1&id=5",
            TestUrlBuilder.withParam("http://x.test/p?a=1", "id", "5"));
        assertNull(TestUrlBuilder.withParam("not a url", "id", "5"));
    }

    @Test
    void formFieldsFillOthersWithPlaceholder() {
        TestCase testCase = TestCase.builder()
            .id("1")
            .method("POST")
            .url("http://x.test/login")
            .targetParam("pass")
            .injectedValue("<script>")
            .origin(TestOrigin.FORM)
            .category("xss")
            .formInputs(List.of("user", "pass", "remember"))
            .build();

        Map<String, String> fields = TestUrlBuilder.formFields(testCase, "test_value");
        assertEquals(List.of("user", "pass", "remember"), List.copyOf(fields.keySet()));
        assertEquals("test_value", fields.get("user"));
        assertEquals("<script>", fields.get("pass"));
        assertEquals("test_value", fields.get("remember"));
    }

    @Test
    void mergeQueryReplacesExistingFields() {
        String merged = TestUrlBuilder.mergeQuery("http://x.test/find?lang=en&q=old",
            new LinkedHashMap<>(Map.of("q", "a b")));
        HttpUrl parsed = HttpUrl.parse(merged);
        assertNotNull(parsed);
        assertEquals("en", parsed.queryParameter("lang"));
        assertEquals("a b", parsed.queryParameter("q"));
        assertEquals(1, parsed.queryParameterValues("q").size());
    }
}
