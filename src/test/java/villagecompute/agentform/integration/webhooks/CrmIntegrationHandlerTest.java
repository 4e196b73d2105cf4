package villagecompute.agentform.integration.webhooks;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import villagecompute.agentform.WireMockTestBase;
import villagecompute.agentform.api.types.IntegrationConfigType;
import villagecompute.agentform.exceptions.ValidationException;
import villagecompute.agentform.testing.MutableClock;
import villagecompute.agentform.testing.Snapshots;

import java.util.LinkedHashMap;
import java.util.Map;

import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalToJson;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

/**
 * Tests for {@link CrmIntegrationHandler}.
 */
class CrmIntegrationHandlerTest extends WireMockTestBase {

    private CrmIntegrationHandler handler;

    @BeforeEach
    void setUp() {
        ObjectMapper objectMapper = new ObjectMapper();
        handler = new CrmIntegrationHandler();
        handler.clock = MutableClock.at("2025-03-01T10:06:00Z");
        handler.webhookClient = new WebhookClient(objectMapper);
        handler.objectMapper = objectMapper;
    }

    @Test
    void testDeliver_syncsMappedRecord() throws Exception {
        stubCrmRecordCreated("/crm/contacts");

        Map<String, Object> result = handler.deliver(request("salesforce", crmConfig(null, url("/crm/contacts"))));

        assertEquals(true, result.get("success"));
        assertEquals("salesforce", result.get("crm_type"));
        assertEquals(201, result.get("status_code"));
        assertEquals("003Dn00000XyZ12", result.get("record_id"));
        assertEquals("2025-03-01T10:06:00Z", result.get("synced_at"));
        wireMockServer.verify(postRequestedFor(urlPathEqualTo("/crm/contacts"))
                .withHeader("Authorization", equalTo("Bearer crm-key"))
                .withRequestBody(equalToJson("{\"crm_type\":\"salesforce\",\"record\":{\"Email\":\"ada@example.com\","
                        + "\"Form_Response_Id__c\":\"resp-1\",\"Source_Form__c\":\"Customer Feedback\"}}")));
    }

    @Test
    void testDeliver_nonJsonResponseHasNoRecordId() throws Exception {
        stubPost("/crm/contacts", 200, "accepted");

        Map<String, Object> result = handler.deliver(request("hubspot", crmConfig(null, url("/crm/contacts"))));

        assertEquals("hubspot", result.get("crm_type"));
        assertFalse(result.containsKey("record_id"));
    }

    @Test
    void testDeliver_requiresUrlAndMapping() {
        IntegrationConfigType noMapping = new IntegrationConfigType(true, "crm", "https://crm.test", null, null, null,
                null, null, null, null, Map.of(), null);

        assertThrows(ValidationException.class, () -> handler.deliver(request("crm", crmConfig(null, null))));
        assertThrows(ValidationException.class, () -> handler.deliver(request("crm", noMapping)));
    }

    @Test
    void testCrmType_resolution() {
        assertEquals("hubspot", CrmIntegrationHandler.crmType(request("contacts", crmConfig("HubSpot", "x"))));
        assertEquals("salesforce", CrmIntegrationHandler.crmType(request("crm", crmConfig("crm", "x"))));
        assertEquals("pipedrive", CrmIntegrationHandler.crmType(request("Pipedrive", crmConfig(null, "x"))));
    }

    @Test
    void testMapFields_skipsMissingAnswers() {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("q-missing", "Notes");
        mapping.put("trigger_event", "Trigger__c");
        mapping.put("form_id", "Form_Id__c");
        IntegrationConfigType config = new IntegrationConfigType(true, "crm", "https://crm.test", null, null, null,
                null, null, null, null, mapping, null);

        Map<String, Object> record = handler.mapFields(request("crm", config));

        assertEquals(Map.of("Trigger__c", "form_completed", "Form_Id__c", "form-1"), record);
    }

    private static IntegrationRequest request(String name, IntegrationConfigType config) {
        return new IntegrationRequest(name, config, Snapshots.form().build(),
                Snapshots.response().answer(Snapshots.answer("qr-1", "q-email", "Email", "ada@example.com")).build(),
                "form_completed");
    }

    private static IntegrationConfigType crmConfig(String type, String url) {
        Map<String, String> mapping = new LinkedHashMap<>();
        mapping.put("q-email", "Email");
        mapping.put("response_id", "Form_Response_Id__c");
        mapping.put("form_name", "Source_Form__c");
        return new IntegrationConfigType(true, type, url, null, null, null, null, null, null, "crm-key", mapping,
                null);
    }
}
