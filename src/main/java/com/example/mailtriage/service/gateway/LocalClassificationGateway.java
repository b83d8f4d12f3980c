package com.example.mailtriage.service.gateway;

import com.example.mailtriage.model.CandidateOutput;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Slot for a self-hosted model. Not wired to anything yet, so every call fails
 * and the pipeline answers with the fallback output.
 */
@Slf4j
public class LocalClassificationGateway implements ClassificationGateway {

    @Override
    public Mono<CandidateOutput> classify(ClassificationRequest request) {
        log.debug("Local model requested for message {}", request.getMessageId());
        return Mono.error(new ClassificationException("Local classification model is not configured"));
    }

    @Override
    public String name() {
        return "local";
    }
}
