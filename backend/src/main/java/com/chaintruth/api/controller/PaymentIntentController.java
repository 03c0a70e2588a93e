package com.chaintruth.api.controller;

import com.chaintruth.api.dto.CreateIntentRequest;
import com.chaintruth.api.dto.IntentResponse;
import com.chaintruth.api.dto.VerificationResponse;
import com.chaintruth.api.dto.VerifyTxRequest;
import com.chaintruth.domain.PaymentIntent;
import com.chaintruth.intent.CreateIntentCommand;
import com.chaintruth.intent.PaymentIntentService;
import com.chaintruth.registry.AssetNetworkRegistry;
import com.chaintruth.verification.ChainTruthVerifier;
import com.chaintruth.verification.VerificationMode;
import com.chaintruth.verification.VerificationOutcome;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * POST /intents, GET /intents/{id}, POST /intents/{id}/verify.
 * Chain calls block, so handlers run on the bounded elastic scheduler rather than the event loop.
 */
@RestController
@RequestMapping("/api/v1/intents")
@RequiredArgsConstructor
public class PaymentIntentController {

    private final PaymentIntentService intentService;
    private final ChainTruthVerifier verifier;
    private final AssetNetworkRegistry registry;

    @PostMapping
    public Mono<ResponseEntity<IntentResponse>> create(@RequestBody @Valid CreateIntentRequest request) {
        CreateIntentCommand command = new CreateIntentCommand(
                request.campaignId(),
                request.networkId(),
                request.assetId(),
                request.amountUsd(),
                request.amountNative(),
                request.donorRef());
        return Mono.fromCallable(() -> intentService.create(command))
                .subscribeOn(Schedulers.boundedElastic())
                .map(intent -> ResponseEntity.status(HttpStatus.CREATED).body(toResponse(intent)));
    }

    @GetMapping("/{intentId}")
    public ResponseEntity<IntentResponse> get(@PathVariable String intentId) {
        return ResponseEntity.ok(toResponse(intentService.get(intentId)));
    }

    @PostMapping("/{intentId}/verify")
    public Mono<ResponseEntity<VerificationResponse>> verify(@PathVariable String intentId,
                                                             @RequestBody @Valid VerifyTxRequest request) {
        return Mono.fromCallable(() -> verifier.verify(intentId, request.txHash(), VerificationMode.MANUAL))
                .subscribeOn(Schedulers.boundedElastic())
                .map(outcome -> ResponseEntity.status(httpStatus(outcome)).body(VerificationResponse.from(outcome)));
    }

    static HttpStatus httpStatus(VerificationOutcome outcome) {
        switch (outcome.kind()) {
            case CONFIRMED:
            case ALREADY_RECORDED:
                return HttpStatus.OK;
            case PENDING:
                return HttpStatus.ACCEPTED;
            default:
                break;
        }
        return switch (outcome.reason().category()) {
            case INPUT -> HttpStatus.BAD_REQUEST;
            case TRANSIENT -> HttpStatus.SERVICE_UNAVAILABLE;
            case STRUCTURAL, FINANCIAL -> HttpStatus.UNPROCESSABLE_ENTITY;
            case TERMINAL -> HttpStatus.CONFLICT;
        };
    }

    private IntentResponse toResponse(PaymentIntent intent) {
        return IntentResponse.from(intent, registry.network(intent.getNetworkId()));
    }
}
