package com.chaintruth.api.controller;

import com.chaintruth.api.dto.VerificationResponse;
import com.chaintruth.api.dto.WatcherObservationRequest;
import com.chaintruth.verification.PassiveWatcherFeed;
import com.chaintruth.verification.WatcherObservation;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.List;

/**
 * POST /watchers/observations: chain watchers report (network, address, txHash, blockHeight) sightings.
 */
@RestController
@RequestMapping("/api/v1/watchers")
@RequiredArgsConstructor
public class WatcherController {

    private final PassiveWatcherFeed watcherFeed;

    @PostMapping("/observations")
    public Mono<ResponseEntity<List<VerificationResponse>>> observe(@RequestBody @Valid WatcherObservationRequest request) {
        WatcherObservation observation = new WatcherObservation(
                request.networkId(), request.address(), request.txHash(), request.blockHeight());
        return Mono.fromCallable(() -> watcherFeed.onObservation(observation))
                .subscribeOn(Schedulers.boundedElastic())
                .map(outcomes -> ResponseEntity.ok(outcomes.stream().map(VerificationResponse::from).toList()));
    }
}
