package com.webprobe.scanner.models;

import lombok.Builder;
import lombok.Value;

import java.util.Set;

/**
 * URL с query-параметрами. Ключ дедупликации - сам url.
 */
@Value
@Builder
public class ParameterizedUrl {
    String url;
    Set<String> paramNames;
}
