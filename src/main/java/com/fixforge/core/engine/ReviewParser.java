package com.fixforge.core.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fixforge.core.model.ReviewReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts the JSON review object embedded in a free-text review transcript.
 * The span runs from the first opening brace to the last closing brace.
 */
public class ReviewParser {

    private static final Logger log = LoggerFactory.getLogger(ReviewParser.class);
    private static final Pattern JSON_OBJECT = Pattern.compile("\\{[\\s\\S]*\\}");

    private final ObjectMapper objectMapper = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    public Optional<ReviewReport> parse(String transcript) {
        if (transcript == null || transcript.isBlank()) {
            return Optional.empty();
        }
        Matcher m = JSON_OBJECT.matcher(transcript);
        if (!m.find()) {
            log.debug("Review output contains no JSON object");
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(objectMapper.readValue(m.group(), ReviewReport.class));
        } catch (JsonProcessingException e) {
            log.debug("Review output present but not parseable: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
