package com.example.proctorstream.controller;

import com.example.proctorstream.error.ErrorCode;
import com.example.proctorstream.error.ProctorException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ServerWebInputException;

import java.util.Map;

@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(ApiExceptionHandler.class);

    @ExceptionHandler(ProctorException.class)
    public ResponseEntity<Map<String, Object>> handleProctorException(ProctorException e) {
        logger.debug("Request refused: {} {}", e.getCode().getWireName(), e.getMessage());
        return ResponseEntity.status(e.getCode().getHttpStatus()).body(Map.of("error", e.toMap()));
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleBadInput(ServerWebInputException e) {
        ProctorException wrapped = ProctorException.invalidInput(e.getReason() != null ? e.getReason() : "Malformed request");
        return ResponseEntity.status(ErrorCode.INVALID_INPUT.getHttpStatus()).body(Map.of("error", wrapped.toMap()));
    }
}
