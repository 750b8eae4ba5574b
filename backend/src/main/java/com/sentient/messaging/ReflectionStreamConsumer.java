package com.sentient.messaging;

import com.sentient.entity.PlanRecord;
import com.sentient.exception.InvalidStreamRecordException;
import com.sentient.secrets.SecretBundle;
import com.sentient.secrets.SecretCache;
import com.sentient.service.PlanAnalysis;
import com.sentient.service.PlanAnalysisService;
import com.sentient.service.PlanStoreWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.amqp.core.Message;
import org.springframework.amqp.rabbit.annotation.RabbitListener;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.UUID;

/**
 * Stream-consumer stage: turns batches of raw reflection records into stored plans.
 *
 * Processing Flow (per record, sequential within a batch):
 * 1. Decode the record (invalid records are logged and counted as errors)
 * 2. Skip records with blank text
 * 3. Analyse the text (never fails; degrades to the fallback plan)
 * 4. Store the plan record with a pending canvas
 * 5. Dispatch the canvas job (failure is logged, the record stays valid)
 *
 * A failure on one record never fails the batch. The only batch-level failure
 * is an unresolvable secret bundle, which is thrown so the broker redelivers
 * the whole batch.
 *
 * @see ArtifactJobDispatcher
 * @see com.sentient.config.RabbitMQConfig#streamBatchContainerFactory
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ReflectionStreamConsumer {

    private final SecretCache secretCache;
    private final StreamRecordDecoder streamRecordDecoder;
    private final PlanAnalysisService planAnalysisService;
    private final PlanStoreWriter planStoreWriter;
    private final ArtifactJobDispatcher artifactJobDispatcher;

    /**
     * Counters for one processed batch.
     */
    public record BatchResult(int received, int processed, int skipped, int errors) {
    }

    @RabbitListener(
            queues = "${app.rabbitmq.queue.stream:reflection.stream.queue}",
            containerFactory = "streamBatchContainerFactory",
            autoStartup = "${app.stream.enabled:true}"
    )
    public void onBatch(List<Message> messages) {
        BatchResult result = processBatch(messages);
        log.info("Stream batch complete: received={}, processed={}, skipped={}, errors={}",
                result.received(), result.processed(), result.skipped(), result.errors());
    }

    /**
     * Process one batch of stream records.
     *
     * @param messages raw records
     * @return batch counters
     * @throws com.sentient.exception.SecretResolutionException if secrets cannot be resolved
     */
    public BatchResult processBatch(List<Message> messages) {
        SecretBundle secrets = secretCache.get();

        int processed = 0;
        int skipped = 0;
        int errors = 0;

        for (Message message : messages) {
            String deliveryId = message.getMessageProperties().getMessageId();
            try {
                ReflectionInput input = streamRecordDecoder.decode(message.getBody());

                if (input.text().isBlank()) {
                    log.warn("Skipping stream record with empty text: deliveryId={}, userId={}",
                            deliveryId, input.userId());
                    skipped++;
                    continue;
                }

                PlanAnalysis analysis = planAnalysisService.analyze(input.text(), secrets.inferenceApiKey());

                String recordId = UUID.randomUUID().toString();
                PlanRecord record = planStoreWriter.put(input.userId(), recordId, input.text(), analysis);

                dispatchCanvasJob(record);
                processed++;

            } catch (InvalidStreamRecordException e) {
                log.error("Invalid stream record: deliveryId={}, error={}", deliveryId, e.getMessage());
                errors++;
            } catch (Exception e) {
                log.error("Failed to process stream record: deliveryId={}, error={}",
                        deliveryId, e.getMessage(), e);
                errors++;
            }
        }

        return new BatchResult(messages.size(), processed, skipped, errors);
    }

    private void dispatchCanvasJob(PlanRecord record) {
        ArtifactJobMessage job = new ArtifactJobMessage(
                record.getRecordId(),
                record.getUserId(),
                record.getEmotion(),
                record.getCreatedAt().toString()
        );
        try {
            if (!artifactJobDispatcher.enqueue(job)) {
                log.warn("Canvas job not queued, plan stays pending: recordId={}", record.getRecordId());
            }
        } catch (Exception e) {
            log.error("Canvas job dispatch failed, plan stays pending: recordId={}, error={}",
                    record.getRecordId(), e.getMessage());
        }
    }
}
