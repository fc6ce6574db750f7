package com.example.pdfcrop.controller;

import com.example.pdfcrop.exception.CropBusyException;
import com.example.pdfcrop.exception.CropException;
import com.example.pdfcrop.exception.CropParseException;
import com.example.pdfcrop.exception.RasterException;
import com.example.pdfcrop.exception.SessionNotFoundException;
import com.example.pdfcrop.model.ErrorResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import javax.servlet.http.HttpServletRequest;
import java.io.IOException;
import java.time.Instant;

@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    @ExceptionHandler(CropParseException.class)
    public ResponseEntity<ErrorResponse> handleParse(CropParseException exception, HttpServletRequest request) {
        return respond(HttpStatus.BAD_REQUEST, exception, request);
    }

    @ExceptionHandler(RasterException.class)
    public ResponseEntity<ErrorResponse> handleRaster(RasterException exception, HttpServletRequest request) {
        log.error("裁剪计算中止: {}", exception.getMessage());
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, exception, request);
    }

    @ExceptionHandler(CropBusyException.class)
    public ResponseEntity<ErrorResponse> handleBusy(CropBusyException exception, HttpServletRequest request) {
        return respond(HttpStatus.CONFLICT, exception, request);
    }

    @ExceptionHandler(CropException.class)
    public ResponseEntity<ErrorResponse> handleCrop(CropException exception, HttpServletRequest request) {
        return respond(HttpStatus.UNPROCESSABLE_ENTITY, exception, request);
    }

    @ExceptionHandler(SessionNotFoundException.class)
    public ResponseEntity<ErrorResponse> handleSessionNotFound(SessionNotFoundException exception,
                                                               HttpServletRequest request) {
        HttpStatus status = HttpStatus.NOT_FOUND;
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(),
                exception.getMessage(), null, "sessionId", request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    @ExceptionHandler(IOException.class)
    public ResponseEntity<ErrorResponse> handleIo(IOException exception, HttpServletRequest request) {
        log.error("文件读写失败", exception);
        HttpStatus status = HttpStatus.INTERNAL_SERVER_ERROR;
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(),
                exception.getMessage(), null, null, request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }

    private ResponseEntity<ErrorResponse> respond(HttpStatus status, CropException exception,
                                                  HttpServletRequest request) {
        ErrorResponse body = new ErrorResponse(Instant.now(), status.value(), status.getReasonPhrase(),
                exception.getMessage(), exception.getPageIndex(), exception.getParameter(),
                request.getRequestURI());
        return ResponseEntity.status(status).body(body);
    }
}
