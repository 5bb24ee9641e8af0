package com.example.einvoice.service;

import com.example.einvoice.domain.EReportingSubmission;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * JSON payloads of e-reporting submissions as handed to the filing platform.
 * Dates are written as ISO-8601 strings.
 */
@Service
public class EReportingPayloadMapper {

    private static final Logger log = LoggerFactory.getLogger(EReportingPayloadMapper.class);

    private final ObjectMapper objectMapper;

    public EReportingPayloadMapper() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    public String toJson(EReportingSubmission submission) {
        try {
            return objectMapper.writeValueAsString(submission);
        } catch (JsonProcessingException e) {
            log.error("Failed to serialize e-reporting submission {}", submission.submissionId(), e);
            throw new EReportingException("Failed to serialize e-reporting submission " + submission.submissionId(), e);
        }
    }

    /**
     * Reads a stored payload back as a tree, for inspection.
     */
    public JsonNode readTree(String json) {
        try {
            return objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new EReportingException("Invalid e-reporting payload: " + e.getOriginalMessage(), e);
        }
    }
}
