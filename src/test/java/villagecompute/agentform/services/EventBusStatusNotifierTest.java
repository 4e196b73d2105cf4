package villagecompute.agentform.services;

import io.vertx.core.eventbus.EventBus;
import io.vertx.core.json.JsonObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link EventBusStatusNotifier}.
 */
class EventBusStatusNotifierTest {

    @Mock
    EventBus eventBus;

    private EventBusStatusNotifier notifier;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        notifier = new EventBusStatusNotifier();
        notifier.eventBus = eventBus;
    }

    @Test
    void testNotify_publishesJsonToChannel() {
        notifier.notify("work_unit:resp-1", Map.of("type", "failed", "workUnitId", "resp-1"));

        ArgumentCaptor<Object> message = ArgumentCaptor.forClass(Object.class);
        verify(eventBus).publish(eq("work_unit:resp-1"), message.capture());
        JsonObject json = (JsonObject) message.getValue();
        assertEquals("failed", json.getString("type"));
        assertEquals("resp-1", json.getString("workUnitId"));
    }

    @Test
    void testNotify_publishFailureIsLogged() {
        when(eventBus.publish(anyString(), any())).thenThrow(new IllegalStateException("event bus closed"));

        assertDoesNotThrow(() -> notifier.notify("form:form-1", Map.of("type", "form_completed")));
    }
}
