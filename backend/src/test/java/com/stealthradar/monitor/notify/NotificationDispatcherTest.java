package com.stealthradar.monitor.notify;

import com.stealthradar.domain.EventIdentity;
import com.stealthradar.domain.MonitoredUser;
import com.stealthradar.domain.NotificationPrefs;
import com.stealthradar.domain.StealthEvent;
import com.stealthradar.monitor.config.NotificationProperties;
import com.stealthradar.monitor.user.UserStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.math.BigInteger;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class NotificationDispatcherTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:00:00Z");
    private static final String ALICE = "0xaAaAaAaAaAaAaAaAaAaAaAaAaAaAaAaAaAaAaAaA";
    private static final String STEALTH = "0x1111111111111111111111111111111111111111";
    private static final String STRANGER = "0x9999999999999999999999999999999999999999";

    @Mock private NotificationClient notificationClient;
    @Mock private StealthAddressMatcher stealthAddressMatcher;
    @Mock private NotificationRateLimiter rateLimiter;
    @Mock private UserStore userStore;

    private NotificationDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        NotificationProperties properties = new NotificationProperties();
        properties.setMinNotificationInterval(Duration.ofMinutes(5));
        properties.setTargetUrl("https://app.example/privacy");
        when(rateLimiter.allows(anyString(), any())).thenReturn(true);
        dispatcher = new NotificationDispatcher(notificationClient, stealthAddressMatcher, rateLimiter, userStore,
                properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("caller of an announcement gets 'Stealth Payment Sent'")
    void sender_notified() {
        MonitoredUser alice = user("u1", ALICE, NotificationPrefs.all(), null);

        DispatchOutcome outcome = dispatcher.maybeNotify(announcement(ALICE.toLowerCase()), alice);

        assertThat(outcome).isEqualTo(DispatchOutcome.NOTIFIED);
        ArgumentCaptor<NotificationMessage> sent = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationClient).send(sent.capture());
        NotificationMessage message = sent.getValue();
        assertThat(message.userId()).isEqualTo("u1");
        assertThat(message.type()).isEqualTo("stealth");
        assertThat(message.title()).isEqualTo("Stealth Payment Sent");
        assertThat(message.targetUrl()).isEqualTo("https://app.example/privacy");
        assertThat(message.data())
                .containsEntry("eventType", "announcement")
                .containsEntry("txHash", "0xabc")
                .containsEntry("blockNumber", 1001L)
                .containsEntry("chain", "base")
                .containsEntry("stealthAddress", STEALTH)
                .containsEntry("timestamp", NOW.getEpochSecond());
        verify(rateLimiter).record("u1", NOW);
        verify(userStore).updateLastNotified("u1", NOW);
        assertThat(alice.getLastNotifiedAt()).isEqualTo(NOW);
    }

    @Test
    void scanKeyMatch_recipientNotified() {
        MonitoredUser bob = user("u2", STRANGER, NotificationPrefs.all(), List.of("0x01:0x02"));
        when(stealthAddressMatcher.matches(any(), anyList())).thenReturn(true);

        assertThat(dispatcher.maybeNotify(announcement(ALICE), bob)).isEqualTo(DispatchOutcome.NOTIFIED);

        ArgumentCaptor<NotificationMessage> sent = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationClient).send(sent.capture());
        assertThat(sent.getValue().title()).isEqualTo("Stealth Payment Received");
    }

    @Test
    void registrant_notified() {
        MonitoredUser alice = user("u1", ALICE, NotificationPrefs.all(), null);
        StealthEvent.Registration registration = new StealthEvent.Registration(
                new EventIdentity(1, "0xdef", 4), "mainnet", 2000, NOW, BigInteger.ONE, ALICE.toLowerCase(), "0x0a");

        assertThat(dispatcher.maybeNotify(registration, alice)).isEqualTo(DispatchOutcome.NOTIFIED);

        ArgumentCaptor<NotificationMessage> sent = ArgumentCaptor.forClass(NotificationMessage.class);
        verify(notificationClient).send(sent.capture());
        assertThat(sent.getValue().title()).isEqualTo("Stealth Address Registered");
        assertThat(sent.getValue().data()).containsEntry("eventType", "registration").doesNotContainKey("stealthAddress");
    }

    @Test
    void unrelatedUser_notRelevant() {
        MonitoredUser stranger = user("u3", STRANGER, NotificationPrefs.all(), null);

        assertThat(dispatcher.maybeNotify(announcement(ALICE), stranger)).isEqualTo(DispatchOutcome.NOT_RELEVANT);
        verify(stealthAddressMatcher, never()).matches(any(), anyList());
        verify(notificationClient, never()).send(any());
    }

    @Test
    void announcementsDisabled_neverNotified() {
        MonitoredUser alice = user("u1", ALICE, new NotificationPrefs(false, true), null);

        assertThat(dispatcher.maybeNotify(announcement(ALICE), alice)).isEqualTo(DispatchOutcome.PREFERENCE_DISABLED);
        verify(notificationClient, never()).send(any());
    }

    @Test
    @DisplayName("lastNotifiedAt = now - 1s with 5 min cooldown: skipped, no external call")
    void withinCooldown_skipped() {
        MonitoredUser alice = new MonitoredUser("u1", ALICE, NotificationPrefs.all(), NOW.minusSeconds(1), List.of());

        assertThat(dispatcher.maybeNotify(announcement(ALICE), alice)).isEqualTo(DispatchOutcome.COOLDOWN);
        verify(notificationClient, never()).send(any());
        verify(rateLimiter, never()).record(anyString(), any());
    }

    @Test
    @DisplayName("cooldown holds for the refreshed copy of a user notified through the previous snapshot")
    void cooldownSurvivesSnapshotReplacement() {
        MonitoredUser beforeRefresh = user("u1", ALICE, NotificationPrefs.all(), null);
        MonitoredUser afterRefresh = user("u1", ALICE, NotificationPrefs.all(), null);

        assertThat(dispatcher.maybeNotify(announcement(ALICE), beforeRefresh)).isEqualTo(DispatchOutcome.NOTIFIED);
        assertThat(afterRefresh.getLastNotifiedAt()).isEqualTo(Instant.EPOCH);

        assertThat(dispatcher.maybeNotify(announcement(ALICE), afterRefresh)).isEqualTo(DispatchOutcome.COOLDOWN);
        verify(notificationClient, times(1)).send(any());
    }

    @Test
    void hourlyBudgetExhausted_rateLimited() {
        MonitoredUser alice = user("u1", ALICE, NotificationPrefs.all(), null);
        when(rateLimiter.allows("u1", NOW)).thenReturn(false);

        assertThat(dispatcher.maybeNotify(announcement(ALICE), alice)).isEqualTo(DispatchOutcome.RATE_LIMITED);
        verify(notificationClient, never()).send(any());
    }

    @Test
    void sendFailure_leavesThrottleStateUntouched() {
        MonitoredUser alice = user("u1", ALICE, NotificationPrefs.all(), null);
        doThrow(new NotificationException("503", null)).when(notificationClient).send(any());

        assertThat(dispatcher.maybeNotify(announcement(ALICE), alice)).isEqualTo(DispatchOutcome.SEND_FAILED);
        assertThat(alice.getLastNotifiedAt()).isEqualTo(Instant.EPOCH);
        verify(rateLimiter, never()).record(anyString(), any());
        verify(userStore, never()).updateLastNotified(anyString(), any());
    }

    @Test
    void lastNotifiedWriteFailure_stillNotified() {
        MonitoredUser alice = user("u1", ALICE, NotificationPrefs.all(), null);
        doThrow(new IllegalStateException("mongo down")).when(userStore).updateLastNotified(anyString(), any());

        assertThat(dispatcher.maybeNotify(announcement(ALICE), alice)).isEqualTo(DispatchOutcome.NOTIFIED);
        assertThat(alice.getLastNotifiedAt()).isEqualTo(NOW);
    }

    @Test
    void dispatch_countsNotifiedUsersAndIsolatesFailures() {
        MonitoredUser alice = user("u1", ALICE, NotificationPrefs.all(), null);
        MonitoredUser broken = user("u2", STRANGER, NotificationPrefs.all(), List.of("key"));
        MonitoredUser stranger = user("u3", "0x3333333333333333333333333333333333333333", NotificationPrefs.all(), null);
        when(stealthAddressMatcher.matches(any(), anyList())).thenThrow(new IllegalStateException("boom"));

        int notified = dispatcher.dispatch(announcement(ALICE), List.of(broken, alice, stranger));

        assertThat(notified).isEqualTo(1);
        verify(notificationClient).send(any());
    }

    private static StealthEvent.Announcement announcement(String caller) {
        return new StealthEvent.Announcement(new EventIdentity(8453, "0xabc", 0), "base", 1001, NOW,
                BigInteger.ONE, STEALTH, caller, "0x02", "0x01");
    }

    private static MonitoredUser user(String id, String address, NotificationPrefs prefs, List<String> scanKeys) {
        return new MonitoredUser(id, address, prefs, null, scanKeys);
    }
}
