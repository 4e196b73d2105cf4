package villagecompute.agentform.data.models;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Supported outbound integration kinds. Configuration names are resolved to a type once, when the form's integration
 * settings are read; handlers are looked up by type, never by name.
 */
public enum IntegrationType {

    /** Signed JSON POST to a customer endpoint. */
    WEBHOOK("webhook"),

    /** Zapier catch hook; same wire format as {@link #WEBHOOK}. */
    ZAPIER("zapier"),

    /** Slack incoming-webhook message. */
    SLACK("slack"),

    /** Field-mapped contact sync to a CRM endpoint (Salesforce, HubSpot). */
    CRM("crm", "salesforce", "hubspot");

    private final String wireName;
    private final List<String> aliases;

    IntegrationType(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = List.of(aliases);
    }

    public String getWireName() {
        return wireName;
    }

    public static Optional<IntegrationType> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(t -> t.wireName.equals(normalized) || t.aliases.contains(normalized))
                .findFirst();
    }
}
