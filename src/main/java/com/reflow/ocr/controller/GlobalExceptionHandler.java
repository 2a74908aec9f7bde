package com.reflow.ocr.controller;

import com.reflow.ocr.exception.DocumentNotReadyException;
import com.reflow.ocr.exception.EmptySessionException;
import com.reflow.ocr.exception.EntityNotFoundException;
import com.reflow.ocr.exception.InvalidArchiveException;
import com.reflow.ocr.exception.StorageException;
import com.reflow.ocr.exception.TaskConflictException;
import com.reflow.ocr.exception.UnsupportedExportFormatException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.context.request.async.AsyncRequestTimeoutException;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import org.springframework.web.multipart.MaxUploadSizeExceededException;
import org.springframework.web.multipart.support.MissingServletRequestPartException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(EntityNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleNotFound(EntityNotFoundException ex) {
        return error(ex.getMessage(), "RESOURCE_NOT_FOUND", HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(TaskConflictException.class)
    public ResponseEntity<ErrorResponse> handleTaskConflict(TaskConflictException ex) {
        return error(ex.getMessage(), "TASK_CONFLICT", HttpStatus.CONFLICT);
    }

    @ExceptionHandler(InvalidArchiveException.class)
    public ResponseEntity<ErrorResponse> handleInvalidArchive(InvalidArchiveException ex) {
        return error(ex.getMessage(), "INVALID_ARCHIVE", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(EmptySessionException.class)
    public ResponseEntity<ErrorResponse> handleEmptySession(EmptySessionException ex) {
        return error(ex.getMessage(), "EMPTY_SESSION", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(DocumentNotReadyException.class)
    public ResponseEntity<ErrorResponse> handleDocumentNotReady(DocumentNotReadyException ex) {
        return error(ex.getMessage(), "DOCUMENT_NOT_READY", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(UnsupportedExportFormatException.class)
    public ResponseEntity<ErrorResponse> handleUnsupportedFormat(UnsupportedExportFormatException ex) {
        return error(ex.getMessage(), "UNSUPPORTED_FORMAT", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(fieldError -> fieldError.getField() + " " + fieldError.getDefaultMessage())
            .findFirst()
            .orElse("Invalid request");
        return error(message, "VALIDATION_ERROR", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex) {
        return error("Malformed request body", "VALIDATION_ERROR", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ErrorResponse> handleTypeMismatch(MethodArgumentTypeMismatchException ex) {
        String message = String.format("Parameter '%s' has an invalid value", ex.getName());
        return error(message, "VALIDATION_ERROR", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorResponse> handleMissingParams(MissingServletRequestParameterException ex) {
        String message = String.format("Parameter '%s' is missing", ex.getParameterName());
        return error(message, "VALIDATION_ERROR", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MissingServletRequestPartException.class)
    public ResponseEntity<ErrorResponse> handleMissingPart(MissingServletRequestPartException ex) {
        String message = String.format("Part '%s' is missing", ex.getRequestPartName());
        return error(message, "VALIDATION_ERROR", HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(MaxUploadSizeExceededException.class)
    public ResponseEntity<ErrorResponse> handleUploadTooLarge(MaxUploadSizeExceededException ex) {
        return error("Upload is too large", "PAYLOAD_TOO_LARGE", HttpStatus.PAYLOAD_TOO_LARGE);
    }

    @ExceptionHandler(NoResourceFoundException.class)
    public ResponseEntity<ErrorResponse> handleNoResource(NoResourceFoundException ex) {
        return error(ex.getMessage(), "RESOURCE_NOT_FOUND", HttpStatus.NOT_FOUND);
    }

    // event streams outliving the async request timeout; the body is already committed
    @ExceptionHandler(AsyncRequestTimeoutException.class)
    public ResponseEntity<Void> handleAsyncTimeout(AsyncRequestTimeoutException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).build();
    }

    @ExceptionHandler(StorageException.class)
    public ResponseEntity<ErrorResponse> handleStorage(StorageException ex) {
        log.error("Storage failure", ex);
        return error("Session storage is unavailable", "STORAGE_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        log.error("Unhandled request failure", ex);
        return error("An unexpected error occurred", "INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private static ResponseEntity<ErrorResponse> error(String message, String errorCode, HttpStatus status) {
        ErrorResponse body = new ErrorResponse(message, errorCode, status.value(), Instant.now().toEpochMilli());
        return new ResponseEntity<>(body, status);
    }
}
