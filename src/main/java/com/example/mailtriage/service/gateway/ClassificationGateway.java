package com.example.mailtriage.service.gateway;

import com.example.mailtriage.model.CandidateOutput;
import reactor.core.publisher.Mono;

/**
 * Boundary to the model that classifies a message. Implementations may fail, time out
 * or return malformed output; the pipeline treats every such case as a fallback.
 */
public interface ClassificationGateway {

    Mono<CandidateOutput> classify(ClassificationRequest request);

    /** Identifier reported on the model info endpoint. */
    String name();
}
