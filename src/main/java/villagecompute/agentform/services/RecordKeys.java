package villagecompute.agentform.services;

import java.time.LocalDate;

/**
 * Entity keys used with {@link RecordStore}.
 */
public final class RecordKeys {

    private RecordKeys() {
        // Utility class, no instantiation
    }

    public static String form(String formId) {
        return "form:" + formId;
    }

    public static String dailyFormAnalytics(String formId, LocalDate date) {
        return "form_analytics:" + formId + ":" + date;
    }

    public static String questionAnalytics(String questionId) {
        return "question_analytics:" + questionId;
    }

    public static String questionResponse(String questionResponseId) {
        return "question_response:" + questionResponseId;
    }

    public static String formResponse(String formResponseId) {
        return "form_response:" + formResponseId;
    }
}
