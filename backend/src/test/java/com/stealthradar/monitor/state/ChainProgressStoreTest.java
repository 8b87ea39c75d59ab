package com.stealthradar.monitor.state;

import com.stealthradar.monitor.config.MonitorProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.Optional;
import java.util.OptionalLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChainProgressStoreTest {

    @Mock private StateStore stateStore;

    private ChainProgressStore progressStore;

    @BeforeEach
    void setUp() {
        MonitorProperties properties = new MonitorProperties();
        properties.setProgressTtl(Duration.ofHours(24));
        progressStore = new ChainProgressStore(stateStore, properties);
    }

    @Test
    void key_followsChainNaming() {
        assertThat(ChainProgressStore.key("base")).isEqualTo("stealth-monitor:base:last-block");
    }

    @Test
    void load_parsesPersistedBlock() {
        when(stateStore.get("stealth-monitor:base:last-block")).thenReturn(Optional.of("1000"));

        assertThat(progressStore.load("base")).isEqualTo(OptionalLong.of(1000));
    }

    @Test
    void load_absentCorruptOrNegative_readsAsAbsent() {
        when(stateStore.get("stealth-monitor:a:last-block")).thenReturn(Optional.empty());
        when(stateStore.get("stealth-monitor:b:last-block")).thenReturn(Optional.of("not-a-number"));
        when(stateStore.get("stealth-monitor:c:last-block")).thenReturn(Optional.of("-4"));

        assertThat(progressStore.load("a")).isEmpty();
        assertThat(progressStore.load("b")).isEmpty();
        assertThat(progressStore.load("c")).isEmpty();
    }

    @Test
    void load_storeUnavailable_readsAsAbsent() {
        when(stateStore.get(anyString())).thenThrow(new StateStoreException("down", null));

        assertThat(progressStore.load("mainnet")).isEmpty();
    }

    @Test
    void save_writesWithTtl() {
        assertThat(progressStore.save("base", 1050)).isTrue();

        verify(stateStore).set("stealth-monitor:base:last-block", "1050", Duration.ofHours(24));
    }

    @Test
    void save_failureReportedNotThrown() {
        doThrow(new StateStoreException("down", null)).when(stateStore).set(anyString(), anyString(), any());

        assertThat(progressStore.save("base", 1050)).isFalse();
    }
}
