package villagecompute.agentform.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.agentform.api.types.FormResponseSnapshotType;
import villagecompute.agentform.api.types.FormSnapshotType;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Completion notifications configured on a form ({@code completion_notifications}).
 *
 * <p>
 * Email, Slack and webhook delivery belong to the UI tier; this service records which channels are due and publishes
 * a {@code form_completed} event on the form's channel ({@code form:<formId>}) for that tier to pick up.
 */
@ApplicationScoped
public class CompletionNotificationService {

    private static final Logger LOG = Logger.getLogger(CompletionNotificationService.class);

    @Inject
    Clock clock;

    @Inject
    StatusNotifier statusNotifier;

    /**
     * @return channels notified, e.g. {@code [email, slack]}
     */
    public List<String> sendCompletionNotifications(FormSnapshotType form, FormResponseSnapshotType response) {
        Map<String, Object> settings = form.completionNotifications();
        List<String> channels = new ArrayList<>();

        if (RecordValues.booleanValue(settings.get("email_enabled"))) {
            LOG.infof("Email completion notification for form %s, response %s (recipients: %s)", form.id(),
                    response.id(), settings.get("email_recipients"));
            channels.add("email");
        }
        if (RecordValues.booleanValue(settings.get("slack_enabled"))) {
            LOG.infof("Slack completion notification for form %s, response %s (channel: %s)", form.id(),
                    response.id(), settings.get("slack_channel"));
            channels.add("slack");
        }
        if (RecordValues.booleanValue(settings.get("webhook_enabled"))) {
            LOG.infof("Webhook completion notification for form %s, response %s (url: %s)", form.id(),
                    response.id(), settings.get("webhook_url"));
            channels.add("webhook");
        }

        if (!channels.isEmpty()) {
            Map<String, Object> event = new LinkedHashMap<>();
            event.put("type", "form_completed");
            event.put("formId", form.id());
            event.put("formResponseId", response.id());
            event.put("channels", List.copyOf(channels));
            event.put("occurredAt", clock.instant().toString());
            statusNotifier.notify(RecordKeys.form(form.id()), event);
        }
        return channels;
    }
}
