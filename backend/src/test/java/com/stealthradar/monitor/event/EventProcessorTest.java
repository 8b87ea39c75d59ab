package com.stealthradar.monitor.event;

import com.stealthradar.domain.ChainDescriptor;
import com.stealthradar.domain.EventIdentity;
import com.stealthradar.monitor.adapter.RawLog;
import com.stealthradar.monitor.event.ProcessingResult.Processed;
import com.stealthradar.monitor.event.ProcessingResult.SkipReason;
import com.stealthradar.monitor.event.ProcessingResult.Skipped;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EventProcessorTest {

    private static final ChainDescriptor MAINNET = new ChainDescriptor("mainnet", 1);
    private static final ChainDescriptor BASE = new ChainDescriptor("base", 8453);
    private static final String STEALTH = "0x1111111111111111111111111111111111111111";
    private static final String CALLER = "0x2222222222222222222222222222222222222222";

    private ProcessedEventSet processedEvents;
    private EventProcessor processor;

    @BeforeEach
    void setUp() {
        processedEvents = new ProcessedEventSet(4);
        Clock clock = Clock.fixed(Instant.parse("2025-03-01T12:00:00Z"), ZoneOffset.UTC);
        processor = new EventProcessor(processedEvents, new StealthEventDecoder(), clock);
    }

    @Test
    void sameLogTwice_secondIsDuplicate() {
        RawLog log = StealthLogFixtures.announcement("0xabc", 100, 1, STEALTH, CALLER);

        assertThat(processor.process(log, MAINNET)).isInstanceOf(Processed.class);
        assertThat(processor.process(log, MAINNET))
                .isInstanceOfSatisfying(Skipped.class, s -> {
                    assertThat(s.reason()).isEqualTo(SkipReason.DUPLICATE);
                    assertThat(s.identity()).isEqualTo(new EventIdentity(1, "0xabc", 1));
                });
        assertThat(processor.processedEventCount()).isEqualTo(1);
    }

    @Test
    void sameTxDifferentChain_bothProcessed() {
        RawLog log = StealthLogFixtures.announcement("0xabc", 100, 1, STEALTH, CALLER);

        assertThat(processor.process(log, MAINNET)).isInstanceOf(Processed.class);
        assertThat(processor.process(log, BASE)).isInstanceOf(Processed.class);
    }

    @Test
    void undecodableLog_recordedAndNotRetried() {
        RawLog log = new RawLog(StealthLogFixtures.ANNOUNCER, "0xbad", 100, 0,
                List.of(StealthContracts.ANNOUNCEMENT_TOPIC), "0x");

        assertThat(processor.process(log, BASE))
                .isInstanceOfSatisfying(Skipped.class, s -> assertThat(s.reason()).isEqualTo(SkipReason.MALFORMED));
        assertThat(processor.process(log, BASE))
                .isInstanceOfSatisfying(Skipped.class, s -> assertThat(s.reason()).isEqualTo(SkipReason.DUPLICATE));
    }

    @Test
    void missingTxHash_malformedWithoutIdentity() {
        RawLog log = new RawLog(StealthLogFixtures.ANNOUNCER, null, 100, 0, List.of(StealthContracts.ANNOUNCEMENT_TOPIC), "0x");

        assertThat(processor.process(log, BASE))
                .isInstanceOfSatisfying(Skipped.class, s -> {
                    assertThat(s.reason()).isEqualTo(SkipReason.MALFORMED);
                    assertThat(s.identity()).isNull();
                });
        assertThat(processor.processedEventCount()).isZero();
    }

    @Test
    void cleanupProcessedEvents_boundsSet() {
        for (int i = 0; i < 6; i++) {
            processor.process(StealthLogFixtures.registration("0x" + i, 100 + i, 0, CALLER, new byte[]{1}), BASE);
        }

        assertThat(processor.cleanupProcessedEvents()).isEqualTo(4);
        assertThat(processor.processedEventCount()).isEqualTo(2);
    }
}
