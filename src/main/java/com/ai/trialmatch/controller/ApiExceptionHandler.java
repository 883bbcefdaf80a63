package com.ai.trialmatch.controller;

import com.ai.trialmatch.component.ResponsePhrases;
import com.ai.trialmatch.dto.ErrorResponse;
import com.ai.trialmatch.dto.MessageResponse;
import com.ai.trialmatch.exception.IntakeValidationException;
import com.ai.trialmatch.exception.MissingFieldException;
import com.ai.trialmatch.exception.SessionNotFoundException;
import jakarta.servlet.http.HttpServletRequest;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Every failure leaves as a well-formed JSON body with a readable {@code response}.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);
    private static final int MAX_MESSAGE_LENGTH = 300;

    private final ResponsePhrases phrases;

    public ApiExceptionHandler(ResponsePhrases phrases) {
        this.phrases = phrases;
    }

    @ExceptionHandler(IntakeValidationException.class)
    public ResponseEntity<ErrorResponse> handleValidation(IntakeValidationException ex, HttpServletRequest request) {
        logWarn(request, ex);
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .response(ex.getMessage())
                .error("validation_error")
                .fields(ex.getFields())
                .build());
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public MessageResponse handleSessionNotFound(SessionNotFoundException ex, HttpServletRequest request) {
        logWarn(request, ex);
        return MessageResponse.builder()
                .response(phrases.requiresIntake())
                .requiresIntake(true)
                .build();
    }

    @ExceptionHandler({
            HttpMessageNotReadableException.class,
            HttpMediaTypeNotSupportedException.class,
            MissingFieldException.class
    })
    public ResponseEntity<ErrorResponse> handleBadRequest(Exception ex, HttpServletRequest request) {
        logWarn(request, ex);
        String info = ex instanceof HttpMessageNotReadableException
                ? "Request body is missing or malformed"
                : StringUtils.defaultIfBlank(ex.getMessage(), "Bad request");
        return ResponseEntity.badRequest().body(ErrorResponse.builder()
                .response(StringUtils.abbreviate(info, MAX_MESSAGE_LENGTH))
                .error("bad_request")
                .build());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleUnknown(Exception ex, HttpServletRequest request) {
        log.error("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                path(request), method(request), ex.getClass().getSimpleName(),
                StringUtils.abbreviate(ex.getMessage(), MAX_MESSAGE_LENGTH), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(ErrorResponse.builder()
                .response(phrases.internalError())
                .error("internal_error")
                .build());
    }

    private void logWarn(HttpServletRequest request, Exception ex) {
        log.warn("HTTP_ERROR path={}, method={}, errorType={}, errorMessage={}",
                path(request), method(request), ex.getClass().getSimpleName(),
                StringUtils.abbreviate(ex.getMessage(), MAX_MESSAGE_LENGTH));
    }

    private static String path(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-");
    }

    private static String method(HttpServletRequest request) {
        return request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-");
    }
}
