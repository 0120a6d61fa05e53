package com.surveillance.engine.service;

import com.surveillance.engine.config.SurveillanceProperties;
import com.surveillance.engine.entity.ModelStatus;
import com.surveillance.engine.entity.ModelTrainingMeta;
import com.surveillance.engine.entity.TrainingTrigger;
import com.surveillance.engine.repository.ModelTrainingMetaRepository;
import com.surveillance.engine.repository.TrainingTriggerRepository;
import com.surveillance.engine.store.JpaModelMetaStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.jdbc.AutoConfigureTestDatabase;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Counter behaviour against the database, with every store call in its own transaction.
 */
@DataJpaTest
@AutoConfigureTestDatabase(replace = AutoConfigureTestDatabase.Replace.NONE)
@TestPropertySource(properties = {
    "spring.datasource.url=jdbc:h2:mem:counter-contention;DB_CLOSE_DELAY=-1;LOCK_TIMEOUT=10000",
    "spring.datasource.username=sa",
    "spring.datasource.password=",
    "spring.jpa.hibernate.ddl-auto=create-drop"
})
@Import({JpaModelMetaStore.class, RetrainingCounterJpaTest.ClockConfig.class})
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class RetrainingCounterJpaTest {

    private static final String MODEL = "habitat_predictor";

    // Matches the default processing worker count
    private static final int WORKERS = 8;

    @Autowired
    private JpaModelMetaStore store;

    @Autowired
    private ModelTrainingMetaRepository metaRepository;

    @Autowired
    private TrainingTriggerRepository triggerRepository;

    @Autowired
    private Clock clock;

    private RetrainingCounter counter;

    @BeforeEach
    void setUp() {
        counter = new RetrainingCounter(store, new SurveillanceProperties(), clock);
    }

    @AfterEach
    void tearDown() {
        triggerRepository.deleteAll();
        metaRepository.deleteAll();
    }

    @Test
    void shouldCountTwentyConcurrentDetectionsForUnseenModel() throws Exception {
        List<CounterOutcome> outcomes = recordConcurrently(20);

        assertThat(outcomes).hasSize(20);
        ModelTrainingMeta meta = metaRepository.findById(MODEL).orElseThrow();
        assertThat(meta.getTotalDataCount()).isEqualTo(20);
        assertThat(meta.getNewDataCount()).isZero();
        assertThat(meta.getStatus()).isEqualTo(ModelStatus.RETRAINING_QUEUED);
        assertThat(outcomes).filteredOn(CounterOutcome::triggered).hasSize(2);
        assertThat(triggerRepository.findByModelTypeOrderByCreatedAtDesc(MODEL))
            .hasSize(2)
            .extracting(TrainingTrigger::getDataCount)
            .containsOnly(10);
    }

    @Test
    void shouldKeepCountingAcrossRepeatedBursts() throws Exception {
        for (int burst = 0; burst < 3; burst++) {
            recordConcurrently(20);
        }

        ModelTrainingMeta meta = metaRepository.findById(MODEL).orElseThrow();
        assertThat(meta.getTotalDataCount()).isEqualTo(60);
        assertThat(meta.getNewDataCount()).isZero();
        assertThat(triggerRepository.findByModelTypeOrderByCreatedAtDesc(MODEL)).hasSize(6);
    }

    private List<CounterOutcome> recordConcurrently(int detections) throws Exception {
        ExecutorService pool = Executors.newFixedThreadPool(WORKERS);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<CounterOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < detections; i++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    return counter.recordDetection(MODEL);
                }));
            }
            start.countDown();

            List<CounterOutcome> outcomes = new ArrayList<>();
            for (Future<CounterOutcome> future : futures) {
                outcomes.add(future.get(60, TimeUnit.SECONDS));
            }
            return outcomes;
        } finally {
            pool.shutdownNow();
        }
    }

    @TestConfiguration
    static class ClockConfig {
        @Bean
        Clock clock() {
            return Clock.systemUTC();
        }
    }
}
