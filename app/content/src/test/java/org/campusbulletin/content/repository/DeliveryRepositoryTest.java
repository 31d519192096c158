/*
 * Where: content delivery repository tests
 * What: Conflict-ignoring inserts, the guarded read-state update and the live unread queries
 * Why: Fan-out and mark-read idempotency live in these statements
 */
package org.campusbulletin.content.repository;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import org.campusbulletin.content.AbstractPostgresContainerTest;
import org.campusbulletin.content.ContentFixtures;
import org.campusbulletin.content.model.InboxEntry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

@SpringBootTest
@ActiveProfiles("test")
class DeliveryRepositoryTest extends AbstractPostgresContainerTest {

    private static final Instant NOW = Instant.parse("2026-03-10T09:00:00Z");

    @Autowired
    private DeliveryRepository deliveryRepository;

    @Autowired
    private NotificationRepository notificationRepository;

    @Autowired
    private NamedParameterJdbcTemplate jdbcTemplate;

    private UUID recipientId;

    @BeforeEach
    void setUp() {
        truncateAll(jdbcTemplate);
        recipientId = insertUser(jdbcTemplate, null, null, null);
    }

    @Test
    void insertIfAbsentIgnoresDuplicates() {
        final UUID notificationId = insertNotification(true, NOW);

        assertThat(deliveryRepository.insertIfAbsent(notificationId, recipientId, NOW)).isTrue();
        assertThat(deliveryRepository.insertIfAbsent(notificationId, recipientId, NOW)).isFalse();
        assertThat(deliveryRepository.countByNotification(notificationId)).isEqualTo(1);
    }

    @Test
    void markReadChangesRowOnlyOnce() {
        final UUID notificationId = insertNotification(true, NOW);
        deliveryRepository.insertIfAbsent(notificationId, recipientId, NOW);

        assertThat(deliveryRepository.markRead(notificationId, recipientId, NOW)).isEqualTo(1);
        assertThat(deliveryRepository.markRead(notificationId, recipientId, NOW.plusSeconds(5)))
                .isZero();
        assertThat(deliveryRepository.exists(notificationId, recipientId)).isTrue();
        assertThat(deliveryRepository.exists(notificationId, UUID.randomUUID())).isFalse();
    }

    @Test
    void unreadLiveExcludesReadUnpublishedAndExpired() {
        final UUID older = insertNotification(true, null, NOW.minus(Duration.ofHours(1)));
        final UUID newer = insertNotification(true, NOW.plusSeconds(1), NOW);
        final UUID read = insertNotification(true, null, NOW);
        final UUID draft = insertNotification(false, null, NOW);
        final UUID expiredAtNow = insertNotification(true, NOW, NOW);
        for (UUID id : List.of(older, newer, read, draft, expiredAtNow)) {
            deliveryRepository.insertIfAbsent(id, recipientId, NOW);
        }
        deliveryRepository.markRead(read, recipientId, NOW);

        final List<InboxEntry> unread = deliveryRepository.findUnreadLive(recipientId, NOW, 10, 0);

        assertThat(unread)
                .extracting(entry -> entry.notification().notificationId())
                .containsExactly(newer, older);
        assertThat(unread.get(0).delivery().read()).isFalse();
        assertThat(unread.get(0).delivery().recipientId()).isEqualTo(recipientId);
        assertThat(deliveryRepository.countUnreadLive(recipientId, NOW)).isEqualTo(2);
    }

    @Test
    void unreadLivePagesInTheQuery() {
        final UUID first = insertNotification(true, null, NOW);
        final UUID second = insertNotification(true, null, NOW.minusSeconds(10));
        final UUID third = insertNotification(true, null, NOW.minusSeconds(20));
        for (UUID id : List.of(first, second, third)) {
            deliveryRepository.insertIfAbsent(id, recipientId, NOW);
        }

        assertThat(deliveryRepository.findUnreadLive(recipientId, NOW, 2, 0))
                .extracting(entry -> entry.notification().notificationId())
                .containsExactly(first, second);
        assertThat(deliveryRepository.findUnreadLive(recipientId, NOW, 2, 2))
                .extracting(entry -> entry.notification().notificationId())
                .containsExactly(third);
        assertThat(deliveryRepository.findUnreadLive(recipientId, NOW, 2, 5)).isEmpty();
    }

    @Test
    void markAllLiveReadLeavesExpiredRowsAlone() {
        final UUID live = insertNotification(true, null, NOW);
        final UUID expired = insertNotification(true, NOW.minusSeconds(1), NOW.minusSeconds(60));
        final UUID other = insertUser(jdbcTemplate, null, null, null);
        deliveryRepository.insertIfAbsent(live, recipientId, NOW);
        deliveryRepository.insertIfAbsent(expired, recipientId, NOW);
        deliveryRepository.insertIfAbsent(live, other, NOW);

        assertThat(deliveryRepository.markAllLiveRead(recipientId, NOW)).isEqualTo(1);
        assertThat(deliveryRepository.markAllLiveRead(recipientId, NOW)).isZero();
        assertThat(deliveryRepository.markRead(expired, recipientId, NOW)).isEqualTo(1);
        assertThat(deliveryRepository.countUnreadLive(other, NOW)).isEqualTo(1);
    }

    @Test
    void concurrentInsertsForOnePairLeaveOneRow() throws Exception {
        final UUID notificationId = insertNotification(true, null, NOW);

        final List<Boolean> inserted =
                runTogether(() -> deliveryRepository.insertIfAbsent(notificationId, recipientId, NOW));

        assertThat(inserted).containsExactlyInAnyOrder(true, false);
        assertThat(deliveryRepository.countByNotification(notificationId)).isEqualTo(1);
    }

    @Test
    void concurrentMarkReadChangesTheRowOnce() throws Exception {
        final UUID notificationId = insertNotification(true, null, NOW);
        deliveryRepository.insertIfAbsent(notificationId, recipientId, NOW);

        final List<Integer> changed =
                runTogether(() -> deliveryRepository.markRead(notificationId, recipientId, NOW));

        assertThat(changed).containsExactlyInAnyOrder(1, 0);
        assertThat(deliveryRepository.countUnreadLive(recipientId, NOW)).isZero();
    }

    @Test
    void deleteByNotificationIdsRemovesAllRecipients() {
        final UUID notificationId = insertNotification(true, NOW);
        final UUID other = insertUser(jdbcTemplate, null, null, null);
        deliveryRepository.insertIfAbsent(notificationId, recipientId, NOW);
        deliveryRepository.insertIfAbsent(notificationId, other, NOW);

        assertThat(deliveryRepository.deleteByNotificationIds(List.of(notificationId))).isEqualTo(2);
        assertThat(deliveryRepository.deleteByNotificationIds(List.of())).isZero();
    }

    private UUID insertNotification(boolean published, Instant createdAt) {
        return insertNotification(published, null, createdAt);
    }

    private UUID insertNotification(boolean published, Instant expiresAt, Instant createdAt) {
        final UUID id = UUID.randomUUID();
        notificationRepository.insert(ContentFixtures.notification(id, published, expiresAt, createdAt));
        return id;
    }

    // Two threads released by one latch, so the statements race on the same row.
    private static <T> List<T> runTogether(Callable<T> action) throws Exception {
        final ExecutorService executor = Executors.newFixedThreadPool(2);
        try {
            final CountDownLatch start = new CountDownLatch(1);
            final Callable<T> gated = () -> {
                start.await();
                return action.call();
            };
            final Future<T> first = executor.submit(gated);
            final Future<T> second = executor.submit(gated);
            start.countDown();
            return List.of(first.get(30, TimeUnit.SECONDS), second.get(30, TimeUnit.SECONDS));
        } finally {
            executor.shutdownNow();
        }
    }
}
