package com.paymentengine.notifications;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.util.List;

/**
 * Stores notifications in the user's inbox.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NotificationService {

    private final NotificationRepository notificationRepository;
    private final Clock clock;

    /**
     * Runs in its own transaction: it is called after the caller's transaction has committed.
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public Notification send(NotificationEvent event) {
        Notification notification = new Notification(
            event.getUserId(),
            event.getTitle(),
            event.getMessage(),
            event.getType(),
            event.getReferenceId(),
            clock.instant()
        );
        notificationRepository.save(notification);
        log.info("Sent {} notification to {} for {}", event.getType(), event.getUserId(), event.getReferenceId());
        return notification;
    }

    @Transactional(readOnly = true)
    public List<Notification> getInbox(String userId) {
        return notificationRepository.findByUserIdOrderByCreatedAtDesc(userId);
    }
}
