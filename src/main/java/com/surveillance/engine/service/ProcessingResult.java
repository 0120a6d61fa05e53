package com.surveillance.engine.service;

import com.surveillance.engine.entity.OutbreakAlert;

import java.util.List;

/**
 * Side effects of handling one detection.
 *
 * @param detectionId the detection handled
 * @param alert       alert created, or null
 * @param counters    one outcome per configured model type
 * @param skipped     true when the delivery was a duplicate and nothing ran
 */
public record ProcessingResult(
    String detectionId,
    OutbreakAlert alert,
    List<CounterOutcome> counters,
    boolean skipped
) {

    public static ProcessingResult skipped(String detectionId) {
        return new ProcessingResult(detectionId, null, List.of(), true);
    }

    public boolean alertCreated() {
        return alert != null;
    }

    public long triggersCreated() {
        return counters.stream().filter(CounterOutcome::triggered).count();
    }
}
