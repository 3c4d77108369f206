package com.example.jobscheduler.service.handler;

import com.example.jobscheduler.client.CallbackClient;
import com.example.jobscheduler.exception.ExternalServiceException;
import com.example.jobscheduler.exception.JobHandlerException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Handler for "http-callback" jobs.
 * <p>
 * POSTs a JSON body to a URL.
 * <p>
 * Expected parameters:
 * - url: absolute target URL (required)
 * - body: JSON value sent as the request body; a string is sent as-is (default: {})
 * <p>
 * 5xx, 408, 429 and connection errors are retryable; other 4xx responses are not.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpCallbackHandler implements JobHandler {

    public static final String HANDLER_TYPE = "http-callback";

    private static final int MAX_RESULT_LENGTH = 1000;

    private final CallbackClient callbackClient;
    private final ObjectMapper objectMapper;

    @Override
    public String getHandlerType() {
        return HANDLER_TYPE;
    }

    @Override
    public String execute(String parameters) {
        var params = parse(parameters);
        var url = params.path("url").asText("");
        if (url.isBlank()) {
            throw JobHandlerException.fatal(HANDLER_TYPE, "Parameter 'url' is required");
        }

        var bodyNode = params.get("body");
        String body;
        if (bodyNode == null || bodyNode.isNull()) {
            body = "{}";
        } else if (bodyNode.isTextual()) {
            body = bodyNode.asText();
        } else {
            body = bodyNode.toString();
        }

        try {
            var response = callbackClient.post(url, body);
            log.info("Callback to {} succeeded", url);
            return "Callback to " + url + " succeeded: " + truncate(response);
        } catch (ExternalServiceException e) {
            throw new JobHandlerException(HANDLER_TYPE, e.getMessage(), e, e.isRetryable());
        }
    }

    private JsonNode parse(String parameters) {
        try {
            var node = objectMapper.readTree(parameters == null || parameters.isBlank() ? "{}" : parameters);
            if (!node.isObject()) {
                throw JobHandlerException.fatal(HANDLER_TYPE, "Parameters must be a JSON object");
            }
            return node;
        } catch (JsonProcessingException e) {
            throw new JobHandlerException(HANDLER_TYPE, "Invalid parameters: " + e.getOriginalMessage(), e, false);
        }
    }

    private String truncate(String text) {
        return text.length() <= MAX_RESULT_LENGTH ? text : text.substring(0, MAX_RESULT_LENGTH) + "...";
    }
}
