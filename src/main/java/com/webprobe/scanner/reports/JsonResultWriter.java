package com.webprobe.scanner.reports;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webprobe.scanner.models.ScanResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Выгрузка результата сканирования в JSON. Без шаблонов, только данные.
 */
@Slf4j
public class JsonResultWriter {

    private final ObjectMapper objectMapper;

    public JsonResultWriter() {
        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    public String toJson(ScanResult result) throws JsonProcessingException {
        if (result == null) {
            throw new IllegalArgumentException("ScanResult не может быть null");
        }
        return objectMapper.writeValueAsString(result);
    }

    public void write(ScanResult result, Path outputPath) throws IOException {
        log.info("Запись JSON результата: {}", outputPath);
        String json = toJson(result);
        Path parent = outputPath.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(outputPath, json);
        log.info("JSON сохранен: {} ({} байт)", outputPath, Files.size(outputPath));
    }
}
