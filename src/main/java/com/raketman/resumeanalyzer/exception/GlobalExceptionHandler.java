package com.raketman.resumeanalyzer.exception;

import com.raketman.resumeanalyzer.dto.ServiceResponse;
import com.raketman.resumeanalyzer.util.ResponseBuilder;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.ConstraintViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ControllerAdvice;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;

@ControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ServiceResponse<Object>> handleConstraintViolation(
            ConstraintViolationException ex, HttpServletRequest request) {

        return ResponseBuilder.error(
                "Validation error: " + ex.getMessage(),
                "VALIDATION_ERROR",
                HttpStatus.BAD_REQUEST,
                request.getRequestURI()
        );
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ServiceResponse<Object>> handleValidationErrors(
            MethodArgumentNotValidException ex, HttpServletRequest request) {

        String errorMessage = ex.getBindingResult().getAllErrors().get(0).getDefaultMessage();

        return ResponseBuilder.error(
                "Validation error: " + errorMessage,
                "VALIDATION_ERROR",
                HttpStatus.BAD_REQUEST,
                request.getRequestURI()
        );
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ServiceResponse<Object>> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {

        return ResponseBuilder.error(
                "Invalid parameter: " + ex.getName(),
                "TYPE_MISMATCH",
                HttpStatus.BAD_REQUEST,
                request.getRequestURI()
        );
    }

    @ExceptionHandler({MissingServletRequestPartException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<ServiceResponse<Object>> handleMissingInput(
            Exception ex, HttpServletRequest request) {

        return ResponseBuilder.error(
                ex.getMessage(),
                "MISSING_INPUT",
                HttpStatus.BAD_REQUEST,
                request.getRequestURI()
        );
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ServiceResponse<Object>> handleUploadTooLarge(
            MaxUploadSizeExceededException ex, HttpServletRequest request) {

        return ResponseBuilder.error(
                "Uploaded file exceeds the size limit",
                "DOCUMENT_PARSING_ERROR",
                HttpStatus.PAYLOAD_TOO_LARGE,
                request.getRequestURI()
        );
    }

    @ExceptionHandler(DocumentParsingException.class)
    public ResponseEntity<ServiceResponse<Object>> handleDocumentParsing(
            DocumentParsingException ex, HttpServletRequest request) {
        return ResponseBuilder.error(
                ex.getMessage(),
                "DOCUMENT_PARSING_ERROR",
                HttpStatus.BAD_REQUEST,
                request.getRequestURI()
        );
    }

    @ExceptionHandler(UnknownRoleException.class)
    public ResponseEntity<ServiceResponse<Object>> handleUnknownRole(
            UnknownRoleException ex, HttpServletRequest request) {
        return ResponseBuilder.error(
                ex.getMessage(),
                "UNKNOWN_ROLE",
                HttpStatus.BAD_REQUEST,
                request.getRequestURI()
        );
    }

    @ExceptionHandler(DirectoryAnalysisException.class)
    public ResponseEntity<ServiceResponse<Object>> handleDirectoryAnalysis(
            DirectoryAnalysisException ex, HttpServletRequest request) {

        logger.warn("Directory analysis failed for {}: {}", ex.getDirectory(), ex.getMessage());
        HttpStatus status = ex.getCause() == null ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseBuilder.error(
                ex.getMessage(),
                "DIRECTORY_ANALYSIS_ERROR",
                status,
                request.getRequestURI()
        );
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ServiceResponse<Object>> handleGeneralException(
            Exception ex, HttpServletRequest request) {

        logger.error("Unhandled error on {}", request.getRequestURI(), ex);
        return ResponseBuilder.error(
                "Internal server error",
                "INTERNAL_ERROR",
                HttpStatus.INTERNAL_SERVER_ERROR,
                request.getRequestURI()
        );
    }
}
