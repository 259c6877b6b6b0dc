package com.worklog.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.worklog.aggregation.Report;

import java.io.IOException;
import java.util.Objects;

public class JsonReportExporter implements ReportExporter<String> {

    private final ObjectMapper objectMapper;

    public JsonReportExporter() {
        this(createMapper());
    }

    public JsonReportExporter(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper");
    }

    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public String export(Report report) throws IOException {
        Objects.requireNonNull(report, "report");
        return objectMapper.writeValueAsString(report);
    }
}
