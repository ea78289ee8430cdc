package com.webprobe.scanner.payload;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class LiteralPayload implements Payload {
    String value;
    String note;

    public static LiteralPayload of(String value, String note) {
        return new LiteralPayload(value, note);
    }

    @Override
    public String describe() {
        return value;
    }
}
