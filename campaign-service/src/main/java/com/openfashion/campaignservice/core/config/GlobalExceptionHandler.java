package com.openfashion.campaignservice.core.config;

import com.openfashion.campaignservice.core.exceptions.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvalidParametersException.class)
    public ResponseEntity<Object> handleInvalid(InvalidParametersException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_PARAMETERS", ex.getMessage());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Object> handleValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getAllErrors().stream()
                .map(error -> error instanceof FieldError fieldError
                        ? fieldError.getField() + ": " + fieldError.getDefaultMessage()
                        : error.getDefaultMessage())
                .collect(Collectors.joining("; "));
        return buildResponse(HttpStatus.BAD_REQUEST, "INVALID_PARAMETERS", message);
    }

    @ExceptionHandler(CampaignNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(CampaignNotFoundException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "CAMPAIGN_NOT_FOUND", ex.getMessage());
    }

    @ExceptionHandler(CampaignClosedException.class)
    public ResponseEntity<Object> handleClosed(CampaignClosedException ex) {
        return buildResponse(HttpStatus.CONFLICT, "CAMPAIGN_CLOSED", ex.getMessage());
    }

    @ExceptionHandler(CampaignNotFundedException.class)
    public ResponseEntity<Object> handleNotFunded(CampaignNotFundedException ex) {
        return buildResponse(HttpStatus.CONFLICT, "CAMPAIGN_NOT_FUNDED", ex.getMessage());
    }

    @ExceptionHandler(DeadlinePassedException.class)
    public ResponseEntity<Object> handleDeadline(DeadlinePassedException ex) {
        return buildResponse(HttpStatus.CONFLICT, "DEADLINE_PASSED", ex.getMessage());
    }

    @ExceptionHandler(ContributionOutOfBoundsException.class)
    public ResponseEntity<Object> handleOutOfBounds(ContributionOutOfBoundsException ex) {
        return buildResponse(HttpStatus.BAD_REQUEST, "CONTRIBUTION_OUT_OF_BOUNDS", ex.getMessage());
    }

    @ExceptionHandler(UnauthorizedException.class)
    public ResponseEntity<Object> handleUnauthorized(UnauthorizedException ex) {
        return buildResponse(HttpStatus.FORBIDDEN, "UNAUTHORIZED", ex.getMessage());
    }

    @ExceptionHandler(PlatformPausedException.class)
    public ResponseEntity<Object> handlePaused(PlatformPausedException ex) {
        return buildResponse(HttpStatus.SERVICE_UNAVAILABLE, "PLATFORM_PAUSED", ex.getMessage());
    }

    @ExceptionHandler(RefundsUnavailableException.class)
    public ResponseEntity<Object> handleRefundsUnavailable(RefundsUnavailableException ex) {
        return buildResponse(HttpStatus.CONFLICT, "REFUNDS_UNAVAILABLE", ex.getMessage());
    }

    @ExceptionHandler(NoContributionException.class)
    public ResponseEntity<Object> handleNoContribution(NoContributionException ex) {
        return buildResponse(HttpStatus.NOT_FOUND, "NO_CONTRIBUTION", ex.getMessage());
    }

    @ExceptionHandler(NoExcessException.class)
    public ResponseEntity<Object> handleNoExcess(NoExcessException ex) {
        return buildResponse(HttpStatus.CONFLICT, "NO_EXCESS", ex.getMessage());
    }

    @ExceptionHandler(InsufficientFundsException.class)
    public ResponseEntity<Object> handleNSF(InsufficientFundsException ex) {
        return buildResponse(HttpStatus.PAYMENT_REQUIRED, "INSUFFICIENT_FUNDS", ex.getMessage());
    }

    @ExceptionHandler(WithdrawalsDisabledException.class)
    public ResponseEntity<Object> handleWithdrawalsDisabled(WithdrawalsDisabledException ex) {
        return buildResponse(HttpStatus.CONFLICT, "WITHDRAWALS_DISABLED", ex.getMessage());
    }

    @ExceptionHandler(WithdrawalLimitExceededException.class)
    public ResponseEntity<Object> handleLimit(WithdrawalLimitExceededException ex) {
        return buildResponse(HttpStatus.CONFLICT, "WITHDRAWAL_LIMIT_EXCEEDED", ex.getMessage());
    }

    @ExceptionHandler(IntervalNotElapsedException.class)
    public ResponseEntity<Object> handleInterval(IntervalNotElapsedException ex) {
        return buildResponse(HttpStatus.TOO_MANY_REQUESTS, "INTERVAL_NOT_ELAPSED", ex.getMessage());
    }

    @ExceptionHandler(MilestoneAlreadyCompletedException.class)
    public ResponseEntity<Object> handleMilestoneCompleted(MilestoneAlreadyCompletedException ex) {
        return buildResponse(HttpStatus.CONFLICT, "MILESTONE_ALREADY_COMPLETED", ex.getMessage());
    }

    @ExceptionHandler(TransferFailedException.class)
    public ResponseEntity<Object> handleTransferFailed(TransferFailedException ex) {
        return buildResponse(HttpStatus.BAD_GATEWAY, "TRANSFER_FAILED", ex.getMessage());
    }

    private ResponseEntity<Object> buildResponse(HttpStatus status, String code, String message) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("timestamp", Instant.now());
        body.put("status", status.value());
        body.put("error", code);
        body.put("message", message);
        return new ResponseEntity<>(body, status);
    }
}
