package com.webprobe.scanner.payload;

import com.webprobe.scanner.config.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PayloadCatalogTest {

    @Test
    void defaultCatalogHasAllCategoriesInOrder() {
        PayloadCatalog catalog = PayloadCatalog.defaults();
        assertEquals(List.of("sqli", "xss", "traversal", "idor_numeric",
            "command_injection", "ldap_injection", "nosql_injection"), catalog.categories());

        Map<String, Integer> counts = catalog.counts();
        assertEquals(8, counts.get("sqli"));
        assertEquals(8, counts.get("xss"));
        assertEquals(6, counts.get("traversal"));
        assertEquals(6, counts.get("idor_numeric"));
        assertEquals(5, counts.get("command_injection"));
        assertEquals(4, counts.get("ldap_injection"));
        assertEquals(4, counts.get("nosql_injection"));
        assertEquals(41, catalog.size());
    }

    @Test
    void safeProfileDropsTraversal() {
        PayloadCatalog safe = PayloadCatalog.forProfile(PayloadProfile.SAFE);
        assertFalse(safe.categories().contains(PayloadCatalog.TRAVERSAL));
        assertTrue(safe.payloads(PayloadCatalog.TRAVERSAL).isEmpty());
        assertEquals(35, safe.size());

        assertEquals(PayloadCatalog.defaults().size(), PayloadCatalog.forProfile(PayloadProfile.LAB).size());
        assertEquals(PayloadCatalog.defaults().size(), PayloadCatalog.forProfile(PayloadProfile.ALL).size());
        assertFalse(PayloadCatalog.countsFor(PayloadProfile.SAFE).containsKey(PayloadCatalog.TRAVERSAL));
    }

    @Test
    void labOnlyByCategoryOrNote() {
        Payload plain = LiteralPayload.of("' OR 1=1--", "safe SQL injection test");
        assertTrue(PayloadCatalog.isLabOnly(PayloadCatalog.TRAVERSAL, plain));
        assertFalse(PayloadCatalog.isLabOnly(PayloadCatalog.SQLI, plain));
        assertTrue(PayloadCatalog.isLabOnly(PayloadCatalog.SQLI, LiteralPayload.of("x", "Lab-Only check")));
        assertTrue(PayloadCatalog.isLabOnly("custom", LiteralPayload.of("x", "DESTRUCTIVE payload")));
        assertFalse(PayloadCatalog.isLabOnly("custom", LiteralPayload.of("x", null)));
    }

    @Test
    void idorEntriesAreNumericDirectives() {
        List<Payload> idor = PayloadCatalog.defaults().payloads(PayloadCatalog.IDOR_NUMERIC);
        NumericDirective first = assertInstanceOf(NumericDirective.class, idor.get(0));
        assertEquals(NumericDirective.Kind.ADJACENT, first.getKind());
        assertEquals(1, first.getAmount());
        assertEquals("adjacent(+1)", first.describe());
        assertEquals("large(999999)", idor.get(2).describe());
    }

    @Test
    void customCatalogIsImmutableCopy() {
        List<Payload> source = new ArrayList<>(List.of(LiteralPayload.of("a", "n")));
        PayloadCatalog catalog = PayloadCatalog.of(Map.of("xss", source));
        source.add(LiteralPayload.of("b", "n"));
        assertEquals(1, catalog.payloads("xss").size());
        assertThrows(UnsupportedOperationException.class,
            () -> catalog.payloads("xss").add(LiteralPayload.of("c", "n")));
    }

    @Test
    void profileParsing() {
        assertEquals(PayloadProfile.SAFE, PayloadProfile.parse("safe"));
        assertEquals(PayloadProfile.LAB, PayloadProfile.parse(" LAB "));
        assertEquals(PayloadProfile.ALL, PayloadProfile.parse("all"));
        assertThrows(ConfigurationException.class, () -> PayloadProfile.parse("aggressive"));
        assertThrows(ConfigurationException.class, () -> PayloadProfile.parse(""));
        assertFalse(PayloadProfile.SAFE.allowsLabOnly());
        assertTrue(PayloadProfile.LAB.allowsLabOnly());
        assertFalse(PayloadProfile.ALL.allowsLabOnly());
    }
}
