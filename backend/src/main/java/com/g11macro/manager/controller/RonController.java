package com.g11macro.manager.controller;

import com.g11macro.manager.dto.NormalizeResponse;
import com.g11macro.manager.dto.ParseResponse;
import com.g11macro.manager.dto.SerializeRequest;
import com.g11macro.manager.dto.SerializeResponse;
import com.g11macro.manager.dto.TextRequest;
import com.g11macro.manager.dto.TokenizeResponse;
import com.g11macro.manager.service.RonDocumentService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.*;

import jakarta.validation.Valid;

@RestController
@RequestMapping("/api/ron")
@Validated
public class RonController {

    private static final Logger logger = LoggerFactory.getLogger(RonController.class);

    private final RonDocumentService documentService;

    public RonController(RonDocumentService documentService) {
        this.documentService = documentService;
    }

    @PostMapping("/parse")
    public ResponseEntity<ParseResponse> parse(@Valid @RequestBody TextRequest request) {
        try {
            logger.debug("Received parse request for {} characters", request.text().length());

            ParseResponse response = documentService.parse(request);

            logger.debug("Parse completed: success={}, bindings={}",
                response.success(), response.bindings().size());

            return ResponseEntity.ok(response);

        } catch (Exception e) {
            logger.error("Unexpected error during parse", e);
            return ResponseEntity.internalServerError()
                .body(ParseResponse.error("Internal server error: " + e.getMessage(), 0));
        }
    }

    @PostMapping("/serialize")
    public ResponseEntity<SerializeResponse> serialize(@Valid @RequestBody SerializeRequest request) {
        logger.debug("Received serialize request for {} bindings", request.bindings().size());
        SerializeResponse response = documentService.serialize(request);
        if (!response.success()) {
            return ResponseEntity.badRequest().body(response);
        }
        return ResponseEntity.ok(response);
    }

    @PostMapping("/tokens")
    public ResponseEntity<TokenizeResponse> tokenize(@Valid @RequestBody TextRequest request) {
        return ResponseEntity.ok(documentService.tokenize(request));
    }

    @PostMapping("/normalize")
    public ResponseEntity<NormalizeResponse> normalize(@Valid @RequestBody TextRequest request) {
        try {
            return ResponseEntity.ok(documentService.normalize(request));
        } catch (Exception e) {
            logger.error("Unexpected error during normalize", e);
            return ResponseEntity.internalServerError()
                .body(NormalizeResponse.error("Internal server error: " + e.getMessage()));
        }
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ParseResponse> handleValidationException(MethodArgumentNotValidException e) {
        StringBuilder errorMessage = new StringBuilder("Validation error: ");

        e.getBindingResult().getFieldErrors().forEach(error ->
            errorMessage.append(error.getField())
                       .append(" - ")
                       .append(error.getDefaultMessage())
                       .append("; ")
        );

        logger.warn("Validation error: {}", errorMessage);

        return ResponseEntity.badRequest().body(ParseResponse.error(errorMessage.toString(), 0));
    }
}
