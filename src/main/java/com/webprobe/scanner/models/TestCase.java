package com.webprobe.scanner.models;

import com.webprobe.scanner.payload.Payload;
import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * Одна конкретная попытка инъекции: точка входа плюс одна нагрузка.
 * Неизменяема, исполняется движком ровно один раз.
 */
@Value
@Builder
public class TestCase {
    String id;
    String method;
    String url;
    String targetParam;
    Payload payload;
    /** Строка, которая фактически подставлена в целевой параметр. */
    String injectedValue;
    TestOrigin origin;
    String category;
    boolean labOnly;
    /** Все поля формы; null для query-параметров. */
    List<String> formInputs;

    public boolean hasFormContext() {
        return formInputs != null && !formInputs.isEmpty();
    }
}
