package com.webprobe.scanner.crawler;

import com.webprobe.scanner.models.Form;
import com.webprobe.scanner.models.FormMethod;
import com.webprobe.scanner.models.ParameterizedUrl;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Извлечение ссылок, форм и query-параметров из HTML (jsoup).
 * Без состояния, один экземпляр можно использовать из нескольких воркеров.
 */
@Slf4j
public class PageParser {

    private static final String FIELD_SELECTOR = "input[name], textarea[name], select[name]";

    /**
     * @param html    тело страницы
     * @param pageUrl нормализованный адрес страницы (после редиректов)
     */
    public ParsedPage parse(String html, String pageUrl) {
        if (html == null || html.isEmpty() || pageUrl == null) {
            return ParsedPage.builder().build();
        }
        Document document = Jsoup.parse(html, pageUrl);

        Set<String> links = new LinkedHashSet<>();
        Map<String, ParameterizedUrl> params = new LinkedHashMap<>();
        for (Element anchor : document.select("a[href]")) {
            String link = UrlNormalizer.normalize(anchor.attr("href"), pageUrl);
            if (link == null) {
                continue;
            }
            links.add(link);
            recordParams(link, params);
        }

        List<Form> forms = new ArrayList<>();
        for (Element formElement : document.select("form")) {
            Form form = toForm(formElement, pageUrl);
            forms.add(form);
            recordParams(form.getActionUrl(), params);
        }

        log.debug("{}: ссылок {}, форм {}, параметризованных URL {}",
            pageUrl, links.size(), forms.size(), params.size());
        return ParsedPage.builder()
            .links(List.copyOf(links))
            .forms(List.copyOf(forms))
            .params(List.copyOf(params.values()))
            .build();
    }

    private Form toForm(Element formElement, String pageUrl) {
        String action = formElement.attr("action");
        String actionUrl = UrlNormalizer.normalize(action, pageUrl);
        if (actionUrl == null) {
            actionUrl = pageUrl;
        }

        Set<String> inputNames = new LinkedHashSet<>();
        for (Element field : formElement.select(FIELD_SELECTOR)) {
            String name = field.attr("name").trim();
            if (!name.isEmpty()) {
                inputNames.add(name);
            }
        }

        return Form.builder()
            .pageUrl(pageUrl)
            .actionUrl(actionUrl)
            .method(FormMethod.fromAttribute(formElement.attr("method")))
            .inputNames(List.copyOf(inputNames))
            .build();
    }

    private void recordParams(String url, Map<String, ParameterizedUrl> params) {
        if (params.containsKey(url)) {
            return;
        }
        Set<String> names = UrlNormalizer.queryParamNames(url);
        if (!names.isEmpty()) {
            params.put(url, ParameterizedUrl.builder().url(url).paramNames(names).build());
        }
    }
}
