package org.bookshelf.service.event;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bookshelf.config.AppProperties;
import org.bookshelf.model.entity.BookStatusEntity;
import org.bookshelf.model.event.StatusBroadcastEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Hands newly created statuses to whatever federates them.
 * <p>
 * Events are published inside the transaction that creates the status. Listeners that send anything outside
 * this process must use {@code @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT)} so a status
 * whose transaction rolls back is never federated.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StatusBroadcaster {

    public static final String SOFTWARE = "software";

    private final ApplicationEventPublisher eventPublisher;
    private final AppProperties appProperties;

    public void broadcast(BookStatusEntity status) {
        broadcast(status, Map.of());
    }

    public void broadcast(BookStatusEntity status, Map<String, String> metadata) {
        Map<String, String> effective = new LinkedHashMap<>(metadata);
        effective.putIfAbsent(SOFTWARE, appProperties.getImporter().getSoftwareName());
        eventPublisher.publishEvent(new StatusBroadcastEvent(status, effective));
        log.debug("Broadcast {} id={} with metadata {}", status.getClass().getSimpleName(), status.getId(), effective);
    }
}
