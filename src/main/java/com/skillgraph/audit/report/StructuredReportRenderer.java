package com.skillgraph.audit.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.skillgraph.audit.report.ReportModels.AuditReport;
import org.springframework.stereotype.Component;

/** JSON rendering, so downstream tooling can re-consume orphan lists and recommendations. */
@Component
public class StructuredReportRenderer implements ReportRenderer {
    private final ObjectMapper mapper;

    public StructuredReportRenderer() {
        this.mapper = new ObjectMapper()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    @Override
    public ReportFormat format() {
        return ReportFormat.STRUCTURED;
    }

    @Override
    public String render(AuditReport report) {
        try {
            return mapper.writeValueAsString(report) + System.lineSeparator();
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize audit report", e);
        }
    }

    public AuditReport read(String json) {
        try {
            return mapper.readValue(json, AuditReport.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Not a structured audit report", e);
        }
    }
}
