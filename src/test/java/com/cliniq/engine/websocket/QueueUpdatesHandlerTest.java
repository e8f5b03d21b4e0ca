package com.cliniq.engine.websocket;

import com.cliniq.engine.domain.QueueStatus;
import com.cliniq.engine.dto.QueueChangedEvent;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.net.URI;
import java.time.LocalDate;
import java.util.HashMap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class QueueUpdatesHandlerTest {

    private static final LocalDate DAY = LocalDate.of(2030, 1, 7);

    private final ObjectMapper mapper = new ObjectMapper();
    private QueueUpdatesHandler handler;

    @BeforeEach
    void setUp() {
        handler = new QueueUpdatesHandler(mapper);
    }

    private WebSocketSession session(String id, String uri) {
        WebSocketSession session = Mockito.mock(WebSocketSession.class);
        Mockito.when(session.getId()).thenReturn(id);
        Mockito.when(session.getUri()).thenReturn(URI.create(uri));
        Mockito.when(session.getAttributes()).thenReturn(new HashMap<>());
        Mockito.when(session.isOpen()).thenReturn(true);
        return session;
    }

    @Test
    void pushesChangesToSubscribersOfThatQueueDay() throws Exception {
        WebSocketSession subscribed = session("s1", "ws://localhost/ws/queue?doctorId=7&date=2030-01-07");
        WebSocketSession otherDay = session("s2", "ws://localhost/ws/queue?doctorId=7&date=2030-01-08");
        handler.afterConnectionEstablished(subscribed);
        handler.afterConnectionEstablished(otherDay);

        handler.onQueueChanged(new QueueChangedEvent(7L, DAY, 40L, 3, QueueStatus.WAITING));

        ArgumentCaptor<TextMessage> sent = ArgumentCaptor.forClass(TextMessage.class);
        verify(subscribed).sendMessage(sent.capture());
        JsonNode json = mapper.readTree(sent.getValue().getPayload());
        assertThat(json.path("type").asText()).isEqualTo("queue.changed");
        assertThat(json.path("token").asInt()).isEqualTo(3);
        assertThat(json.path("status").asText()).isEqualTo("WAITING");
        verify(otherDay, never()).sendMessage(any());
    }

    @Test
    void rejectsSubscriptionWithoutQueueDay() throws Exception {
        WebSocketSession session = session("s3", "ws://localhost/ws/queue?doctorId=abc");

        handler.afterConnectionEstablished(session);

        verify(session).close(any(CloseStatus.class));
    }

    @Test
    void closedSessionsStopReceiving() throws Exception {
        WebSocketSession session = session("s4", "ws://localhost/ws/queue?doctorId=9&date=2030-01-07");
        handler.afterConnectionEstablished(session);
        assertThat(handler.subscriberCount(9L, DAY)).isEqualTo(1);

        handler.afterConnectionClosed(session, CloseStatus.NORMAL);

        assertThat(handler.subscriberCount(9L, DAY)).isZero();
    }

    @Test
    void failingSessionIsDropped() throws Exception {
        WebSocketSession session = session("s5", "ws://localhost/ws/queue?doctorId=9&date=2030-01-07");
        Mockito.doThrow(new IOException("broken pipe")).when(session).sendMessage(any());
        handler.afterConnectionEstablished(session);

        handler.onQueueChanged(new QueueChangedEvent(9L, DAY, 1L, 1, QueueStatus.QUEUED));

        assertThat(handler.subscriberCount(9L, DAY)).isZero();
    }

    @Test
    void answersPing() throws Exception {
        WebSocketSession session = session("s6", "ws://localhost/ws/queue?doctorId=9&date=2030-01-07");

        handler.handleTextMessage(session, new TextMessage("ping"));

        verify(session).sendMessage(new TextMessage("pong"));
    }
}
