package com.example.roster.exception;

import com.example.roster.engine.RunLedger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger logger = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    static final String SCHEDULER_BUSY = "SCHEDULER_BUSY";

    static final Set<String> CONFLICT_CODES = Set.of("SHIFT_OVERLAP", "DUPLICATE_NAME", "ALREADY_CANCELLED", "EMPLOYEE_IN_USE", "PROJECT_IN_USE");

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(MethodArgumentNotValidException ex) {
        Map<String, String> errors = new HashMap<>();
        ex.getBindingResult().getAllErrors().forEach((error) -> {
            String fieldName = error instanceof FieldError fieldError ? fieldError.getField() : error.getObjectName();
            errors.put(fieldName, error.getDefaultMessage());
        });

        ErrorResponse errorResponse = new ErrorResponse(
                "バリデーションエラー",
                "入力データに問題があります",
                errors,
                LocalDateTime.now()
        );

        logger.warn("バリデーションエラーが発生しました: {}", errors);
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(ScheduleValidationException.class)
    public ResponseEntity<ErrorResponse> handleScheduleValidationException(ScheduleValidationException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "スケジュール入力エラー",
                ex.getMessage(),
                Map.of("errorCode", ex.getErrorCode()),
                LocalDateTime.now()
        );

        logger.warn("スケジュール入力エラーが発生しました: [{}] {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorResponse> handleBusinessException(BusinessException ex) {
        HttpStatus status = statusOf(ex.getErrorCode());
        ErrorResponse errorResponse = new ErrorResponse(
                status == HttpStatus.NOT_FOUND ? "リソースなし" : "ビジネスロジックエラー",
                ex.getMessage(),
                Map.of("errorCode", ex.getErrorCode()),
                LocalDateTime.now()
        );

        logger.warn("ビジネスロジックエラーが発生しました: [{}] {}", ex.getErrorCode(), ex.getMessage());
        return ResponseEntity.status(status).body(errorResponse);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class})
    public ResponseEntity<ErrorResponse> handleMalformedRequest(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "リクエスト形式エラー",
                "リクエストの形式が正しくありません",
                null,
                LocalDateTime.now()
        );

        logger.warn("リクエスト形式エラーが発生しました: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgumentException(IllegalArgumentException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "引数エラー",
                ex.getMessage(),
                null,
                LocalDateTime.now()
        );

        logger.warn("引数エラーが発生しました: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(errorResponse);
    }

    @ExceptionHandler(OverlapConflictException.class)
    public ResponseEntity<ErrorResponse> handleOverlapConflictException(OverlapConflictException ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "内部サーバーエラー",
                "割り当ての整合性エラーが発生しました",
                null,
                LocalDateTime.now()
        );

        RunLedger.Booking existing = ex.getConflictingBooking();
        logger.error("二重割り当てを検出しました: 従業員={}, 既存={} {} (プロジェクト={})", ex.getEmployeeId(),
                existing.date(), existing.shiftType(), existing.projectId(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex) {
        ErrorResponse errorResponse = new ErrorResponse(
                "内部サーバーエラー",
                "予期しないエラーが発生しました",
                null,
                LocalDateTime.now()
        );

        logger.error("予期しないエラーが発生しました", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(errorResponse);
    }

    static HttpStatus statusOf(String errorCode) {
        if (ResourceNotFoundException.NOT_FOUND.equals(errorCode)) {
            return HttpStatus.NOT_FOUND;
        }
        if (CONFLICT_CODES.contains(errorCode)) {
            return HttpStatus.CONFLICT;
        }
        if (SCHEDULER_BUSY.equals(errorCode)) {
            return HttpStatus.SERVICE_UNAVAILABLE;
        }
        return HttpStatus.BAD_REQUEST;
    }

    public record ErrorResponse(
            String error,
            String message,
            Map<String, String> details,
            LocalDateTime timestamp
    ) {}
}
