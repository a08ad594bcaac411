package com.clinicmate.backend.global.security;

import java.io.IOException;

import com.clinicmate.backend.global.error.ProblemException;
import com.clinicmate.backend.global.error.ProblemResponse;
import com.clinicmate.backend.global.error.RetryableProblemException;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

/**
 * Writes problem bodies from the filter chain, where the controller advice does not reach.
 */
@Component
public class ProblemResponseWriter {

    private final ObjectMapper objectMapper;

    public ProblemResponseWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(HttpServletRequest request, HttpServletResponse response, ProblemException ex)
            throws IOException {
        if (ex instanceof RetryableProblemException retryable) {
            response.setHeader(HttpHeaders.RETRY_AFTER, String.valueOf(retryable.getRetryAfterSeconds()));
        }
        write(response, ProblemResponse.of(ex, request.getRequestURI()));
    }

    public void write(HttpServletRequest request, HttpServletResponse response, HttpStatus status, String code,
                      String detail) throws IOException {
        write(response, ProblemResponse.of(status, code, detail, request.getRequestURI()));
    }

    private void write(HttpServletResponse response, ProblemResponse body) throws IOException {
        response.setStatus(body.status());
        response.setContentType(MediaType.APPLICATION_PROBLEM_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
