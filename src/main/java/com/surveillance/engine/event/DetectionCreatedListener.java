package com.surveillance.engine.event;

import com.surveillance.engine.service.DetectionEventHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;

/**
 * In-process transport adapter: feeds committed detections to the handler.
 *
 * Runs after the ingesting transaction commits, so the handler's window query sees the
 * new record. Failures surface through the async uncaught-exception handler after the
 * handler has logged them.
 */
@Component
@RequiredArgsConstructor
public class DetectionCreatedListener {

    private final DetectionEventHandler detectionEventHandler;

    @Async("detectionEventExecutor")
    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onDetectionCreated(DetectionCreatedEvent event) {
        detectionEventHandler.handle(event.detection(), event.detectionId());
    }
}
