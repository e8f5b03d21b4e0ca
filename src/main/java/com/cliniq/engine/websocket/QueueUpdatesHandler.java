package com.cliniq.engine.websocket;

import com.cliniq.engine.dto.QueueChangedEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.transaction.event.TransactionPhase;
import org.springframework.transaction.event.TransactionalEventListener;
import org.springframework.util.MultiValueMap;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.ConcurrentWebSocketSessionDecorator;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Push channel for queue boards: {@code /ws/queue?doctorId=&date=}. Each committed
 * queue change is sent as a small JSON notice; clients re-read status through the
 * pull API.
 */
@Component
public class QueueUpdatesHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(QueueUpdatesHandler.class);

    private static final int SEND_TIME_LIMIT_MS = 5_000;
    private static final int BUFFER_LIMIT_BYTES = 64 * 1024;
    private static final String KEY_ATTRIBUTE = "queueKey";

    private final ObjectMapper mapper;
    private final Map<String, Set<WebSocketSession>> subscribers = new ConcurrentHashMap<>();

    public QueueUpdatesHandler(ObjectMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        String key = subscriptionKey(session);
        if (key == null) {
            log.warn("Rejecting queue subscription {}: doctorId and date are required", session.getId());
            session.close(CloseStatus.BAD_DATA.withReason("doctorId and date query parameters are required"));
            return;
        }
        session.getAttributes().put(KEY_ATTRIBUTE, key);
        subscribers.computeIfAbsent(key, k -> ConcurrentHashMap.newKeySet())
                .add(new ConcurrentWebSocketSessionDecorator(session, SEND_TIME_LIMIT_MS, BUFFER_LIMIT_BYTES));
        log.info("Queue subscriber {} joined {}", session.getId(), key);
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        if ("ping".equalsIgnoreCase(StringUtils.trim(message.getPayload()))) {
            session.sendMessage(new TextMessage("pong"));
        }
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Object key = session.getAttributes().get(KEY_ATTRIBUTE);
        if (key != null) {
            remove(key.toString(), session.getId());
        }
        log.debug("Queue subscriber {} left ({})", session.getId(), status);
    }

    @TransactionalEventListener(phase = TransactionPhase.AFTER_COMMIT, fallbackExecution = true)
    public void onQueueChanged(QueueChangedEvent event) {
        String key = key(event.doctorId(), event.queueDate());
        Set<WebSocketSession> sessions = subscribers.get(key);
        if (sessions == null || sessions.isEmpty()) {
            return;
        }
        TextMessage message = new TextMessage(toJson(event));
        for (WebSocketSession session : sessions) {
            if (!session.isOpen()) {
                remove(key, session.getId());
                continue;
            }
            try {
                session.sendMessage(message);
            } catch (IOException | RuntimeException e) {
                log.warn("Dropping queue subscriber {} on {}: {}", session.getId(), key, e.getMessage());
                remove(key, session.getId());
            }
        }
    }

    int subscriberCount(Long doctorId, LocalDate date) {
        Set<WebSocketSession> sessions = subscribers.get(key(doctorId, date));
        return sessions == null ? 0 : sessions.size();
    }

    private String toJson(QueueChangedEvent event) {
        ObjectNode node = mapper.createObjectNode();
        node.put("type", "queue.changed");
        node.put("doctorId", event.doctorId());
        node.put("date", event.queueDate().toString());
        node.put("entryId", event.entryId());
        node.put("token", event.token());
        node.put("status", event.status().name());
        return node.toString();
    }

    private void remove(String key, String sessionId) {
        subscribers.computeIfPresent(key, (k, sessions) -> {
            sessions.removeIf(s -> s.getId().equals(sessionId));
            return sessions.isEmpty() ? null : sessions;
        });
    }

    private static String subscriptionKey(WebSocketSession session) {
        if (session.getUri() == null) {
            return null;
        }
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(session.getUri()).build().getQueryParams();
        String doctorId = params.getFirst("doctorId");
        String date = params.getFirst("date");
        if (!StringUtils.isNumeric(doctorId) || StringUtils.isBlank(date)) {
            return null;
        }
        try {
            return key(Long.valueOf(doctorId), LocalDate.parse(date));
        } catch (DateTimeParseException e) {
            log.debug("Unparseable date '{}' in queue subscription {}", date, session.getId());
            return null;
        }
    }

    private static String key(Long doctorId, LocalDate date) {
        return doctorId + ":" + date;
    }
}
