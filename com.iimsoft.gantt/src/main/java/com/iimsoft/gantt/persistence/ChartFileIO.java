package com.iimsoft.gantt.persistence;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.iimsoft.gantt.api.dto.ChartRequest;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads chart documents. The parser is lenient in the JSON5 direction: comments, single quotes,
 * unquoted field names and trailing commas are accepted.
 */
public class ChartFileIO {

    private final ObjectMapper mapper;

    public ChartFileIO() {
        this(createMapper());
    }

    public ChartFileIO(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    public static ObjectMapper createMapper() {
        return JsonMapper.builder()
                .enable(JsonReadFeature.ALLOW_JAVA_COMMENTS)
                .enable(JsonReadFeature.ALLOW_SINGLE_QUOTES)
                .enable(JsonReadFeature.ALLOW_UNQUOTED_FIELD_NAMES)
                .enable(JsonReadFeature.ALLOW_TRAILING_COMMA)
                .build();
    }

    public ChartRequest read(Path path) throws IOException {
        if (!Files.exists(path) || Files.isDirectory(path)) {
            throw new IOException("Unable to open file '" + path + "'");
        }
        try (InputStream in = Files.newInputStream(path)) {
            return read(in);
        }
    }

    public ChartRequest read(InputStream in) throws IOException {
        return mapper.readValue(in, ChartRequest.class);
    }

    public ChartRequest read(String json) throws IOException {
        return mapper.readValue(json, ChartRequest.class);
    }
}
