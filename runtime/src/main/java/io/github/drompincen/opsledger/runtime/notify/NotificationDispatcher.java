package io.github.drompincen.opsledger.runtime.notify;

import io.github.drompincen.opsledger.persistence.document.MasterContactDocument;
import io.github.drompincen.opsledger.persistence.document.NotificationDocument;
import io.github.drompincen.opsledger.persistence.repository.MasterContactRepository;
import io.github.drompincen.opsledger.persistence.repository.NotificationRepository;
import io.github.drompincen.opsledger.protocol.api.ActionKind;
import io.github.drompincen.opsledger.protocol.api.DeliveryStatus;
import io.github.drompincen.opsledger.protocol.api.NotificationChannel;
import io.github.drompincen.opsledger.protocol.api.NotificationType;
import io.github.drompincen.opsledger.protocol.api.Priority;
import io.github.drompincen.opsledger.protocol.api.ReferenceType;
import io.github.drompincen.opsledger.protocol.event.LedgerEvent;
import io.github.drompincen.opsledger.protocol.event.LedgerEventType;
import io.github.drompincen.opsledger.runtime.config.LedgerProperties;
import io.github.drompincen.opsledger.runtime.error.BudgetExceededException;
import io.github.drompincen.opsledger.runtime.error.DeliveryFailureException;
import io.github.drompincen.opsledger.runtime.error.InvalidStateException;
import io.github.drompincen.opsledger.runtime.error.NotFoundException;
import io.github.drompincen.opsledger.runtime.error.ValidationException;
import io.github.drompincen.opsledger.runtime.event.LedgerEventBus;
import io.github.drompincen.opsledger.runtime.notify.channel.ChannelSender;
import io.github.drompincen.opsledger.runtime.retry.RetryBackoff;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Turns ledger events into notifications for the agent's master contact and delivers them.
 * <p>
 * {@link #notify} persists a {@code pending} row on the caller's thread and returns; delivery
 * runs on the {@code notification-delivery} pool. The channel is taken from the contact's
 * preferred channel at each attempt. Failed attempts back off exponentially until
 * {@code max-attempts}, after which the row is {@code failed} until someone resends it.
 */
@Service
public class NotificationDispatcher {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);
    private static final int CONCURRENT_WRITE_ATTEMPTS = 3;
    private static final Set<String> CRITICAL_CODES = Set.of("EXECUTOR_ERROR", "INTERRUPTED");

    private final NotificationRepository notificationRepository;
    private final MasterContactRepository contactRepository;
    private final Map<NotificationChannel, ChannelSender> senders = new EnumMap<>(NotificationChannel.class);
    private final LedgerEventBus eventBus;
    private final LedgerProperties properties;
    private final Clock clock;
    private final ScheduledExecutorService deliveryPool;
    private final Set<String> inFlight = ConcurrentHashMap.newKeySet();
    private final Consumer<LedgerEvent> listener = this::onLedgerEvent;

    @Autowired
    public NotificationDispatcher(NotificationRepository notificationRepository,
                                  MasterContactRepository contactRepository,
                                  List<ChannelSender> channelSenders,
                                  LedgerEventBus eventBus,
                                  LedgerProperties properties,
                                  Clock clock) {
        this(notificationRepository, contactRepository, channelSenders, eventBus, properties, clock,
                Executors.newScheduledThreadPool(2, named("notification-delivery")));
    }

    public NotificationDispatcher(NotificationRepository notificationRepository,
                                  MasterContactRepository contactRepository,
                                  List<ChannelSender> channelSenders,
                                  LedgerEventBus eventBus,
                                  LedgerProperties properties,
                                  Clock clock,
                                  ScheduledExecutorService deliveryPool) {
        this.notificationRepository = notificationRepository;
        this.contactRepository = contactRepository;
        for (ChannelSender sender : channelSenders) {
            ChannelSender previous = senders.put(sender.channel(), sender);
            if (previous != null) {
                throw new IllegalStateException("Two senders for channel " + sender.channel().wire());
            }
        }
        this.eventBus = eventBus;
        this.properties = properties;
        this.clock = clock;
        this.deliveryPool = deliveryPool;
    }

    @PostConstruct
    public void init() {
        eventBus.subscribe(listener);
    }

    @PreDestroy
    public void shutdown() {
        eventBus.unsubscribe(listener);
        deliveryPool.shutdownNow();
    }

    /** Records a pending notification and queues its first delivery attempt. */
    public NotificationDocument notify(String agentId, NotificationType type, String title, String message,
                                       Priority priority, ReferenceType referenceType, String referenceId) {
        Instant now = clock.instant();
        NotificationDocument n = new NotificationDocument();
        n.setNotificationId(UUID.randomUUID().toString());
        n.setAgentId(agentId);
        contactRepository.findByAgentId(agentId).ifPresent(c -> {
            n.setMasterContactId(c.getContactId());
            n.setChannel(c.getPreferredChannel());
        });
        n.setType(type);
        n.setTitle(title != null ? title : type.label());
        n.setMessage(message);
        n.setPriority(priority != null ? priority : Priority.NORMAL);
        n.setStatus(DeliveryStatus.PENDING);
        n.setActionRequired(type.actionRequired());
        n.setReferenceType(referenceType);
        n.setReferenceId(referenceId);
        n.setCreatedAt(now);
        n.setNextAttemptAt(now);
        NotificationDocument saved = notificationRepository.save(n);
        log.info("Notification {} ({}) queued for agent {}", saved.getNotificationId(), type.wire(), agentId);
        schedule(saved.getNotificationId(), 0);
        return saved;
    }

    /**
     * One delivery attempt, run on the calling thread. Rows that are no longer pending, not yet
     * due, or already being attempted elsewhere are returned unchanged.
     */
    public NotificationDocument deliver(String notificationId) {
        if (!inFlight.add(notificationId)) {
            return notificationRepository.findById(notificationId)
                    .orElseThrow(() -> NotFoundException.of("Notification", notificationId));
        }
        try {
            NotificationDocument n = notificationRepository.findById(notificationId)
                    .orElseThrow(() -> NotFoundException.of("Notification", notificationId));
            if (n.getStatus() != DeliveryStatus.PENDING) return n;
            if (n.getNextAttemptAt() != null && n.getNextAttemptAt().isAfter(clock.instant())) return n;
            return attempt(n);
        } finally {
            inFlight.remove(notificationId);
        }
    }

    /** Re-dispatches pending rows whose next attempt is due, so delivery survives restarts. */
    @Scheduled(fixedDelayString = "${opsledger.notification.sweep-interval-ms:30000}")
    public void sweepPending() {
        List<NotificationDocument> due = notificationRepository
                .findByStatusAndNextAttemptAtLessThanEqual(DeliveryStatus.PENDING, clock.instant());
        for (NotificationDocument n : due) {
            if (inFlight.contains(n.getNotificationId())) continue;
            try {
                deliver(n.getNotificationId());
            } catch (Exception e) {
                log.error("Sweep failed on notification {}: {}", n.getNotificationId(), e.getMessage(), e);
            }
        }
    }

    /**
     * Marks a notification read. Allowed from any status but {@code pending}; the first call
     * sets {@code readAt}, later calls change nothing. Losing a race to a concurrent read
     * returns the winner's row.
     */
    public NotificationDocument markRead(String agentId, String notificationId) {
        return updateLatest(agentId, notificationId, n -> {
            if (n.getStatus() == DeliveryStatus.PENDING) {
                throw new InvalidStateException("Notification " + notificationId + " has not been sent yet");
            }
            if (n.getReadAt() != null) return null;
            n.setReadAt(clock.instant());
            n.setStatus(DeliveryStatus.READ);
            return n;
        });
    }

    /** Delivery receipt from the channel: {@code sent -> delivered}. Repeats are no-ops. */
    public NotificationDocument markDelivered(String agentId, String notificationId) {
        return updateLatest(agentId, notificationId, n -> switch (n.getStatus()) {
            case DELIVERED, READ -> null;
            case SENT -> {
                n.setStatus(DeliveryStatus.DELIVERED);
                n.setDeliveredAt(clock.instant());
                yield n;
            }
            default -> throw new InvalidStateException("Notification " + notificationId + " is "
                    + n.getStatus().wire() + " and cannot be marked delivered");
        });
    }

    /** Re-queues a failed notification with a fresh attempt budget. */
    public NotificationDocument resend(String agentId, String notificationId) {
        NotificationDocument n = get(agentId, notificationId);
        if (n.getStatus() != DeliveryStatus.FAILED) {
            throw new InvalidStateException("Only failed notifications can be resent; "
                    + notificationId + " is " + n.getStatus().wire());
        }
        n.setStatus(DeliveryStatus.PENDING);
        n.setDeliveryAttempts(0);
        n.setResendCount(n.getResendCount() + 1);
        n.setNextAttemptAt(clock.instant());
        NotificationDocument saved = notificationRepository.save(n);
        log.info("Notification {} re-queued (resend {})", notificationId, saved.getResendCount());
        schedule(notificationId, 0);
        return saved;
    }

    public NotificationDocument sendTest(String agentId, String message) {
        return notify(agentId, NotificationType.TEST, "Test notification",
                message != null && !message.isBlank() ? message : "Notifications are working.",
                Priority.LOW, null, null);
    }

    public NotificationDocument get(String agentId, String notificationId) {
        return notificationRepository.findByNotificationIdAndAgentId(notificationId, agentId)
                .orElseThrow(() -> NotFoundException.of("Notification", notificationId));
    }

    /** Newest first, optionally filtered by type and status. */
    public List<NotificationDocument> list(String agentId, NotificationType type, DeliveryStatus status, int limit) {
        if (limit <= 0) throw new ValidationException("limit must be positive");
        Pageable page = PageRequest.of(0, limit);
        if (type != null && status != null) {
            return notificationRepository.findByAgentIdAndTypeAndStatusOrderByCreatedAtDesc(agentId, type, status, page);
        }
        if (type != null) return notificationRepository.findByAgentIdAndTypeOrderByCreatedAtDesc(agentId, type, page);
        if (status != null) return notificationRepository.findByAgentIdAndStatusOrderByCreatedAtDesc(agentId, status, page);
        return notificationRepository.findByAgentIdOrderByCreatedAtDesc(agentId, page);
    }

    /**
     * Applies {@code change} to the latest copy of the row and saves it. A {@code null} from
     * {@code change} means there is nothing to write. On a version conflict the row is re-read
     * and the change re-evaluated against it.
     */
    private NotificationDocument updateLatest(String agentId, String notificationId,
                                              UnaryOperator<NotificationDocument> change) {
        for (int attempt = 1; ; attempt++) {
            NotificationDocument current = get(agentId, notificationId);
            NotificationDocument changed = change.apply(current);
            if (changed == null) return current;
            try {
                NotificationDocument saved = notificationRepository.save(changed);
                publishUpdate(saved);
                return saved;
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= CONCURRENT_WRITE_ATTEMPTS) throw e;
                log.debug("Notification {} changed underneath us, re-reading: {}", notificationId, e.getMessage());
            }
        }
    }

    private NotificationDocument attempt(NotificationDocument n) {
        Instant now = clock.instant();
        n.setDeliveryAttempts(n.getDeliveryAttempts() + 1);
        try {
            MasterContactDocument contact = contactRepository.findByAgentId(n.getAgentId())
                    .orElseThrow(() -> new DeliveryFailureException("Agent " + n.getAgentId() + " has no master contact"));
            NotificationChannel channel = contact.getPreferredChannel();
            n.setMasterContactId(contact.getContactId());
            n.setChannel(channel);
            ChannelSender sender = senders.get(channel);
            if (sender == null) throw new DeliveryFailureException("No sender for channel " + channel.wire());
            sender.send(contact.addressFor(channel),
                    NotificationFormatter.format(n, channel, properties.getNotification().getEmailSubjectPrefix()));

            n.setStatus(DeliveryStatus.SENT);
            n.setSentAt(now);
            n.setNextAttemptAt(null);
            n.setLastError(null);
            NotificationDocument saved = notificationRepository.save(n);
            log.info("Notification {} sent via {} (attempt {})", n.getNotificationId(), channel.wire(),
                    n.getDeliveryAttempts());
            publishUpdate(saved);
            return saved;
        } catch (RuntimeException e) {
            return attemptFailed(n, e, now);
        }
    }

    private NotificationDocument attemptFailed(NotificationDocument n, RuntimeException e, Instant now) {
        n.setLastError(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
        LedgerProperties.Notification config = properties.getNotification();
        if (n.getDeliveryAttempts() >= config.getMaxAttempts()) {
            n.setStatus(DeliveryStatus.FAILED);
            n.setNextAttemptAt(null);
            NotificationDocument saved = notificationRepository.save(n);
            log.warn("Notification {} failed permanently after {} attempts: {}", n.getNotificationId(),
                    n.getDeliveryAttempts(), n.getLastError());
            publishUpdate(saved);
            return saved;
        }
        long delay = RetryBackoff.doubling(config.getInitialBackoffMs(), config.getMaxBackoffMs())
                .delayMs(n.getDeliveryAttempts());
        n.setNextAttemptAt(now.plusMillis(delay));
        NotificationDocument saved = notificationRepository.save(n);
        log.warn("Notification {} attempt {} failed, retrying in {} ms: {}", n.getNotificationId(),
                n.getDeliveryAttempts(), delay, n.getLastError());
        schedule(n.getNotificationId(), delay);
        return saved;
    }

    private void schedule(String notificationId, long delayMs) {
        try {
            deliveryPool.schedule(() -> {
                try {
                    deliver(notificationId);
                } catch (Exception e) {
                    log.error("Delivery of notification {} crashed: {}", notificationId, e.getMessage(), e);
                }
            }, delayMs, TimeUnit.MILLISECONDS);
        } catch (RuntimeException e) {
            log.warn("Could not schedule notification {}, the sweep will pick it up: {}", notificationId, e.getMessage());
        }
    }

    private void onLedgerEvent(LedgerEvent event) {
        NotificationType type = typeFor(event);
        if (type == null) return;
        notify(event.agentId(), type, event.title(), event.message(), event.priority(),
                event.referenceType(), event.referenceId());
    }

    /**
     * Which notification, if any, an event produces. Retried failures stay quiet until the last
     * attempt; failures of the executor itself, rather than of the action, are critical.
     */
    static NotificationType typeFor(LedgerEvent event) {
        Map<String, Object> payload = event.payload();
        return switch (event.type()) {
            case JOB_COMPLETED -> ActionKind.SEND_REPORT.wire().equals(payload.get("actionType"))
                    ? NotificationType.DAILY_REPORT : NotificationType.TASK_COMPLETED;
            case JOB_FAILED -> Boolean.TRUE.equals(payload.get("retryScheduled")) ? null
                    : critical(payload.get("errorCode")) ? NotificationType.CRITICAL_ERROR : NotificationType.TASK_FAILED;
            case JOB_SKIPPED -> BudgetExceededException.CODE.equals(payload.get("errorCode"))
                    ? NotificationType.BUDGET_EXCEEDED : NotificationType.JOB_SKIPPED;
            case JOB_CANCELLED -> NotificationType.JOB_CANCELLED;
            case APPROVAL_REQUESTED -> NotificationType.APPROVAL_NEEDED;
            case APPROVAL_REMINDER -> NotificationType.APPROVAL_REMINDER;
            case BUDGET_WARNING -> NotificationType.BUDGET_WARNING;
            case BUDGET_EXCEEDED -> NotificationType.BUDGET_EXCEEDED;
            case APPROVAL_DECIDED, BUDGET_RESET, NOTIFICATION_UPDATED -> null;
        };
    }

    private static boolean critical(Object errorCode) {
        return errorCode != null && CRITICAL_CODES.contains(errorCode.toString());
    }

    private void publishUpdate(NotificationDocument n) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("notificationId", n.getNotificationId());
        payload.put("status", n.getStatus().wire());
        payload.put("type", n.getType().wire());
        payload.put("deliveryAttempts", n.getDeliveryAttempts());
        if (n.getChannel() != null) payload.put("channel", n.getChannel().wire());
        eventBus.publish(LedgerEvent.of(LedgerEventType.NOTIFICATION_UPDATED, n.getAgentId(), null,
                n.getNotificationId(), n.getTitle(), n.getLastError(), n.getPriority(), payload, clock.instant()));
    }

    private static ThreadFactory named(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
