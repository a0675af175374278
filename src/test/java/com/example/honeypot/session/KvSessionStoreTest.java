package com.example.honeypot.session;

import com.example.honeypot.kv.InMemoryKvClient;
import com.example.honeypot.kv.KvClient;
import com.example.honeypot.model.FindingKind;
import com.example.honeypot.model.IntelligenceFinding;
import com.example.honeypot.model.Message;
import com.example.honeypot.model.Session;
import com.example.honeypot.report.DeliveryStatus;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class KvSessionStoreTest {

    private static final String PREFIX = "honeypot:session:";

    @Mock
    private KvClient primary;

    private InMemoryKvClient fallback;
    private SessionCodec codec;
    private KvSessionStore store;
    private final Clock clock = Clock.fixed(Instant.parse("2026-01-15T10:00:00Z"), ZoneOffset.UTC);

    @BeforeEach
    void setUp() {
        fallback = new InMemoryKvClient(clock);
        codec = new SessionCodec(new ObjectMapper().findAndRegisterModules());
        store = new KvSessionStore(primary, fallback, codec, clock);
        ReflectionTestUtils.setField(store, "ttlSeconds", 3600L);
        ReflectionTestUtils.setField(store, "keyPrefix", PREFIX);
    }

    @Test
    void testSave_ConnectedWritesPrimaryWithTtl() {
        // Given
        when(primary.ping()).thenReturn(true);
        store.probeOnStartup();

        // When
        store.save(sampleSession("s1"));

        // Then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(primary).set(eq(PREFIX + "s1"), json.capture(), eq(Duration.ofSeconds(3600)));
        assertEquals(StoreStatus.CONNECTED, store.status());
        assertTrue(fallback.get(PREFIX + "s1").isEmpty());

        Session decoded = codec.decode("s1", json.getValue()).orElseThrow();
        assertEquals(1, decoded.getMessageCount());
        assertTrue(decoded.getIntelligence().contains(IntelligenceFinding.of(FindingKind.UPI_HANDLE, "pramod@paytm")));
        assertTrue(decoded.isScamConfirmed());
    }

    @Test
    void testProbeOnStartup_UnreachableUsesFallback() {
        // Given
        when(primary.ping()).thenThrow(new IllegalStateException("Connection refused"));

        // When
        store.probeOnStartup();
        store.save(sampleSession("s1"));

        // Then
        assertEquals(StoreStatus.FALLBACK, store.status());
        verify(primary, never()).set(anyString(), anyString(), any());
        assertEquals(1, store.find("s1").orElseThrow().getMessageCount());
    }

    @Test
    void testSave_PrimaryFailureSwitchesToFallback() {
        // Given
        when(primary.ping()).thenReturn(true);
        store.probeOnStartup();
        doThrow(new IllegalStateException("Connection reset")).when(primary).set(anyString(), anyString(), any());

        // When
        store.save(sampleSession("s1"));

        // Then
        assertEquals(StoreStatus.FALLBACK, store.status());
        assertTrue(fallback.get(PREFIX + "s1").isPresent());
        assertEquals("s1", store.load("s1").getSessionId());
        assertEquals(1, store.load("s1").getMessageCount());
    }

    @Test
    void testReprobe_MovesFallbackSessionsToPrimary() {
        // Given
        when(primary.ping()).thenReturn(false, true);
        store.probeOnStartup();
        store.save(sampleSession("s1"));

        // When
        store.reprobe();

        // Then
        ArgumentCaptor<String> json = ArgumentCaptor.forClass(String.class);
        verify(primary).set(eq(PREFIX + "s1"), json.capture(), eq(Duration.ofSeconds(3600)));
        assertEquals(StoreStatus.CONNECTED, store.status());
        assertTrue(fallback.get(PREFIX + "s1").isEmpty());
        assertEquals(1, codec.decode("s1", json.getValue()).orElseThrow().getMessageCount());
    }

    @Test
    void testReprobe_FailedMoveStaysInFallback() {
        // Given
        when(primary.ping()).thenReturn(false, true);
        store.probeOnStartup();
        store.save(sampleSession("s1"));
        doThrow(new IllegalStateException("READONLY")).when(primary).set(anyString(), anyString(), any());

        // When
        store.reprobe();

        // Then
        assertEquals(StoreStatus.FALLBACK, store.status());
        assertTrue(fallback.get(PREFIX + "s1").isPresent());
        assertEquals(1, store.find("s1").orElseThrow().getMessageCount());
    }

    @Test
    void testReprobe_OutageWritesWinOverOlderPrimaryCopy() {
        // Given
        SwitchableKvClient redis = new SwitchableKvClient(new InMemoryKvClient(clock));
        KvSessionStore tiered = new KvSessionStore(redis, fallback, codec, clock);
        ReflectionTestUtils.setField(tiered, "ttlSeconds", 3600L);
        ReflectionTestUtils.setField(tiered, "keyPrefix", PREFIX);
        tiered.probeOnStartup();
        tiered.save(sampleSession("s1"));

        Session session = tiered.load("s1");
        redis.down = true;
        session.recordCounterpartMessage(Message.counterpart("Share the OTP now", 3L));
        session.markReported(DeliveryStatus.DELIVERED, clock.instant());
        tiered.save(session);
        assertEquals(StoreStatus.FALLBACK, tiered.status());

        // When
        redis.down = false;
        tiered.reprobe();
        Session reloaded = tiered.load("s1");

        // Then
        assertEquals(StoreStatus.CONNECTED, tiered.status());
        assertEquals(2, reloaded.getMessageCount());
        assertTrue(reloaded.isReported());
        assertTrue(fallback.get(PREFIX + "s1").isEmpty());
        Session inPrimary = codec.decode("s1", redis.get(PREFIX + "s1").orElseThrow()).orElseThrow();
        assertEquals(2, inPrimary.getMessageCount());
    }

    @Test
    void testFind_FallbackCopyReadFirstWhileConnected() {
        // Given
        when(primary.ping()).thenReturn(true);
        store.probeOnStartup();
        Session newer = sampleSession("s1");
        newer.recordCounterpartMessage(Message.counterpart("Hurry up", 3L));
        fallback.set(PREFIX + "s1", codec.encode(newer), Duration.ofSeconds(3600));

        // When
        Session found = store.find("s1").orElseThrow();

        // Then
        assertEquals(2, found.getMessageCount());
        verify(primary, never()).get(anyString());
    }

    @Test
    void testLoad_MissingSessionStartsFresh() {
        // Given
        when(primary.ping()).thenReturn(true);
        store.probeOnStartup();
        when(primary.get(PREFIX + "new-session")).thenReturn(Optional.empty());

        // When
        Session session = store.load("new-session");

        // Then
        assertEquals("new-session", session.getSessionId());
        assertTrue(session.isNew());
        assertEquals(0, session.getMessageCount());
    }

    @Test
    void testFind_UnreadablePayloadIsAbsent() {
        // Given
        when(primary.ping()).thenReturn(true);
        store.probeOnStartup();
        when(primary.get(PREFIX + "s1")).thenReturn(Optional.of("{not json"));

        // Then
        assertTrue(store.find("s1").isEmpty());
        assertEquals(StoreStatus.CONNECTED, store.status());
    }

    @Test
    void testListSessionIds() {
        // Given
        when(primary.ping()).thenReturn(true);
        store.probeOnStartup();
        when(primary.scan(PREFIX, 10)).thenReturn(List.of(PREFIX + "s1", PREFIX + "s2"));

        // When
        List<String> ids = store.listSessionIds(10);

        // Then
        assertEquals(List.of("s1", "s2"), ids);
    }

    @Test
    void testRemainingTtl_FromFallbackWhenDegraded() {
        // Given
        when(primary.ping()).thenReturn(false);
        store.probeOnStartup();
        store.save(sampleSession("s1"));

        // Then
        assertEquals(Optional.of(Duration.ofSeconds(3600)), store.remainingTtl("s1"));
        verify(primary, never()).ttl(anyString());
    }

    private Session sampleSession(String sessionId) {
        Session session = Session.start(sessionId, clock.instant());
        session.recordCounterpartMessage(Message.counterpart("Pay to pramod@paytm now", 1L));
        session.recordAgentReply(Message.agent("Which bank is this?", 2L));
        session.mergeIntelligence(List.of(IntelligenceFinding.of(FindingKind.UPI_HANDLE, "pramod@paytm")));
        session.recordAssessment(true, 0.85, "upi_fraud");
        return session;
    }

    private static final class SwitchableKvClient implements KvClient {
        private final KvClient delegate;
        private volatile boolean down;

        private SwitchableKvClient(KvClient delegate) {
            this.delegate = delegate;
        }

        @Override
        public Optional<String> get(String key) {
            check();
            return delegate.get(key);
        }

        @Override
        public void set(String key, String value, Duration ttl) {
            check();
            delegate.set(key, value, ttl);
        }

        @Override
        public void del(String key) {
            check();
            delegate.del(key);
        }

        @Override
        public Optional<Duration> ttl(String key) {
            check();
            return delegate.ttl(key);
        }

        @Override
        public List<String> scan(String prefix, int limit) {
            check();
            return delegate.scan(prefix, limit);
        }

        @Override
        public boolean ping() {
            return !down;
        }

        private void check() {
            if (down) {
                throw new IllegalStateException("Connection refused");
            }
        }
    }
}
