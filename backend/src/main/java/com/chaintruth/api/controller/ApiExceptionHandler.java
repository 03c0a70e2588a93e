package com.chaintruth.api.controller;

import com.chaintruth.api.dto.ErrorBody;
import com.chaintruth.chain.RpcException;
import com.chaintruth.common.MalformedAmountException;
import com.chaintruth.domain.IntentNotFoundException;
import com.chaintruth.intent.DepositAddressUnavailableException;
import com.chaintruth.intent.FiatRateUnavailableException;
import com.chaintruth.intent.InvalidIntentRequestException;
import com.chaintruth.registry.UnknownAssetException;
import com.chaintruth.registry.UnknownNetworkException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;

import java.util.Optional;

/**
 * Maps input errors to 400, unknown intents to 404 and unavailable collaborators to 503, all as ErrorBody.
 */
@RestControllerAdvice
@Slf4j
public class ApiExceptionHandler {

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorBody> handleValidation(WebExchangeBindException ex) {
        String error = Optional.ofNullable(ex.getFieldError())
                .map(FieldError::getDefaultMessage)
                .filter(msg -> msg != null && !msg.isBlank())
                .orElse("VALIDATION_ERROR");
        String message = ex.getFieldErrors().stream()
                .findFirst()
                .map(e -> e.getField() + ": " + e.getDefaultMessage())
                .orElse("Validation failed");
        return ResponseEntity.badRequest().body(ErrorBody.of(error, message));
    }

    @ExceptionHandler(MalformedAmountException.class)
    public ResponseEntity<ErrorBody> handleMalformedAmount(MalformedAmountException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("MALFORMED_AMOUNT", ex.getMessage()));
    }

    @ExceptionHandler(UnknownNetworkException.class)
    public ResponseEntity<ErrorBody> handleUnknownNetwork(UnknownNetworkException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("UNKNOWN_NETWORK", ex.getMessage()));
    }

    @ExceptionHandler(UnknownAssetException.class)
    public ResponseEntity<ErrorBody> handleUnknownAsset(UnknownAssetException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("UNKNOWN_ASSET", ex.getMessage()));
    }

    @ExceptionHandler(InvalidIntentRequestException.class)
    public ResponseEntity<ErrorBody> handleInvalidRequest(InvalidIntentRequestException ex) {
        return ResponseEntity.badRequest().body(ErrorBody.of("INVALID_REQUEST", ex.getMessage()));
    }

    @ExceptionHandler(IntentNotFoundException.class)
    public ResponseEntity<ErrorBody> handleNotFound(IntentNotFoundException ex) {
        return ResponseEntity.status(HttpStatus.NOT_FOUND).body(ErrorBody.of("INTENT_NOT_FOUND", ex.getMessage()));
    }

    @ExceptionHandler(RpcException.class)
    public ResponseEntity<ErrorBody> handleRpc(RpcException ex) {
        log.warn("Chain unavailable: {}", ex.getMessage());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("RPC_UNAVAILABLE", "Chain data source unavailable; retry later"));
    }

    @ExceptionHandler(FiatRateUnavailableException.class)
    public ResponseEntity<ErrorBody> handleFiatRate(FiatRateUnavailableException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorBody.of("FIAT_RATE_UNAVAILABLE", ex.getMessage()));
    }

    @ExceptionHandler(DepositAddressUnavailableException.class)
    public ResponseEntity<ErrorBody> handleDepositAddress(DepositAddressUnavailableException ex) {
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(ErrorBody.of("DEPOSIT_ADDRESS_UNAVAILABLE", ex.getMessage()));
    }

    @ExceptionHandler(DataAccessException.class)
    public ResponseEntity<ErrorBody> handleStorage(DataAccessException ex) {
        log.error("Storage failure", ex);
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE)
                .body(ErrorBody.of("STORAGE_UNAVAILABLE", "Storage temporarily unavailable; retry later"));
    }
}
