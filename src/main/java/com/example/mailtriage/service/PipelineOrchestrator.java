package com.example.mailtriage.service;

import com.example.mailtriage.config.PipelineSettings;
import com.example.mailtriage.dto.request.mail.Message;
import com.example.mailtriage.dto.response.triage.DebugInfo;
import com.example.mailtriage.dto.response.triage.TriageOutput;
import com.example.mailtriage.model.CandidateOutput;
import com.example.mailtriage.model.NormalizedMessage;
import com.example.mailtriage.model.PipelineStage;
import com.example.mailtriage.model.SignalsBundle;
import com.example.mailtriage.service.gateway.ClassificationException;
import com.example.mailtriage.service.gateway.ClassificationGateway;
import com.example.mailtriage.service.gateway.ClassificationRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * Runs one message through decode, signal extraction, classification and normalization.
 * Always emits exactly one {@link TriageOutput}; classification problems end in the fallback output.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PipelineOrchestrator {

    private final MimeDecoder mimeDecoder;
    private final SignalExtractor signalExtractor;
    private final TriagePromptBuilder promptBuilder;
    private final ClassificationGateway classificationGateway;
    private final ResultNormalizer resultNormalizer;
    private final PipelineSettings settings;
    private final PipelineStats stats;
    private final Clock clock;

    public Mono<TriageOutput> run(Message raw) {
        return Mono.defer(() -> {
            String messageId = raw != null ? raw.getId() : null;
            long startedAt = clock.millis();
            stats.recordRequest();
            log.info("stage={} messageId={}", PipelineStage.RECEIVED, messageId);

            NormalizedMessage message = mimeDecoder.decode(raw);
            log.debug("stage={} messageId={} subject='{}'", PipelineStage.PARSED, messageId, message.getSubject());

            SignalsBundle signals = signalExtractor.extract(message);
            log.debug("stage={} messageId={}", PipelineStage.SIGNALS_EXTRACTED, messageId);

            OffsetDateTime reference = referenceTimestamp(message);
            ClassificationRequest request = promptBuilder.build(message, signals);

            return classificationGateway.classify(request)
                    .timeout(settings.getClassificationTimeout())
                    .switchIfEmpty(Mono.error(() -> new ClassificationException("Classification returned no output")))
                    .doOnNext(candidate -> log.debug("stage={} messageId={}", PipelineStage.CLASSIFIED, messageId))
                    .map(candidate -> normalizeOrFallback(candidate, message, signals, reference))
                    .onErrorResume(e -> {
                        log.warn("stage={} messageId={} error={}", PipelineStage.CLASSIFICATION_FAILED, messageId, e.toString());
                        stats.recordError(messageId, PipelineStage.CLASSIFICATION_FAILED.name(), e);
                        return Mono.just(resultNormalizer.fallback(message, signals, reference, e.toString()));
                    })
                    .doOnNext(output -> {
                        boolean fallback = output.getDebug().getFlags().contains(DebugInfo.FLAG_CLASSIFICATION_FALLBACK);
                        stats.recordCompleted(fallback);
                        log.info("stage={} messageId={} category={} key={} fallback={} elapsedMs={}",
                                PipelineStage.COMPLETED, messageId, output.getMajorCategory().getValue(),
                                output.getSubActionKey(), fallback, clock.millis() - startedAt);
                    });
        });
    }

    private TriageOutput normalizeOrFallback(CandidateOutput candidate,
                                             NormalizedMessage message,
                                             SignalsBundle signals,
                                             OffsetDateTime reference) {
        try {
            TriageOutput output = resultNormalizer.normalize(candidate, message, signals, reference);
            log.debug("stage={} messageId={}", PipelineStage.NORMALIZED, message.getMessageId());
            return output;
        } catch (IllegalStateException e) {
            log.error("Normalization defect for message {}", message.getMessageId(), e);
            stats.recordError(message.getMessageId(), PipelineStage.NORMALIZED.name(), e);
            return resultNormalizer.fallback(message, signals, reference, "normalization defect: " + e.getMessage());
        }
    }

    /**
     * Anchor for relative dates: the Date header, else the provider receive time, else now.
     */
    OffsetDateTime referenceTimestamp(NormalizedMessage message) {
        if (message.getSentAt() != null) {
            return message.getSentAt();
        }
        if (message.getInternalDate() != null) {
            return message.getInternalDate().atOffset(ZoneOffset.UTC);
        }
        return OffsetDateTime.now(clock);
    }
}
