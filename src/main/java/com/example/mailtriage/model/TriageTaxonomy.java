package com.example.mailtriage.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Fixed option set the classification step must choose from.
 */
public final class TriageTaxonomy {

    public static final MajorCategory FALLBACK_CATEGORY = MajorCategory.OTHER;
    public static final String FALLBACK_ACTION_KEY = "OTHER";

    private static final Map<MajorCategory, List<String>> ACTION_KEYS = new EnumMap<>(MajorCategory.class);
    private static final Set<String> ALL_KEYS;

    static {
        ACTION_KEYS.put(MajorCategory.SCHEDULE_AND_TIME, List.of(
                "SCHEDULE_PROPOSE_TIME", "SCHEDULE_CONFIRM_TIME", "SCHEDULE_RESCHEDULE",
                "SCHEDULE_RSVP", "SCHEDULE_ADD_CALENDAR_BLOCK", "SCHEDULE_DEADLINE_CONFIRM"));
        ACTION_KEYS.put(MajorCategory.DECISIONS_AND_APPROVALS, List.of(
                "DECISION_APPROVE_REJECT", "DECISION_CHOOSE_OPTION", "DECISION_CONFIRM_OUTCOME"));
        ACTION_KEYS.put(MajorCategory.CORE_COMMUNICATION, List.of(
                "COMM_REPLY_REQUIRED", "COMM_CLARIFICATION_REQUEST", "COMM_STATUS_UPDATE_RESPONSE"));
        ACTION_KEYS.put(MajorCategory.DOCUMENTS_AND_REVIEW, List.of(
                "DOC_REVIEW_REQUEST", "DOC_COMMENT_REQUEST", "DOC_SIGNOFF_REQUEST"));
        ACTION_KEYS.put(MajorCategory.FINANCIAL_AND_ADMIN, List.of(
                "FINANCE_PAY_INVOICE", "FINANCE_APPROVE_EXPENSE", "FINANCE_UPDATE_BILLING", "FINANCE_RENEW_CANCEL"));
        ACTION_KEYS.put(MajorCategory.META_AND_SYSTEMS, List.of(
                "SYSTEM_ALERT", "SYSTEM_SECURITY", "SYSTEM_NOTIFICATION"));
        ACTION_KEYS.put(MajorCategory.SOCIAL_AND_PEOPLE, List.of(
                "SOCIAL_INTRO", "SOCIAL_INVITE", "SOCIAL_CONGRATS"));
        ACTION_KEYS.put(MajorCategory.PEOPLE_AND_PROCESS, List.of(
                "PROCESS_HANDOFF", "PROCESS_OWNERSHIP_CHANGE", "PROCESS_WORKFLOW_UPDATE"));
        ACTION_KEYS.put(MajorCategory.INFORMATION_AND_ORG, List.of(
                "INFO_FYI", "INFO_STATUS_REPORT", "INFO_ANNOUNCEMENT"));
        ACTION_KEYS.put(MajorCategory.LEARNING_AND_AWARENESS, List.of(
                "LEARN_ARTICLE", "LEARN_WEBINAR", "LEARN_COURSE"));
        ACTION_KEYS.put(MajorCategory.OTHER, List.of(FALLBACK_ACTION_KEY));

        Set<String> all = new LinkedHashSet<>();
        ACTION_KEYS.values().forEach(all::addAll);
        ALL_KEYS = Collections.unmodifiableSet(all);
    }

    private TriageTaxonomy() {}

    public static List<String> actionKeysFor(MajorCategory category) {
        return ACTION_KEYS.getOrDefault(category, List.of());
    }

    public static Set<String> allActionKeys() {
        return ALL_KEYS;
    }

    public static boolean isKnownActionKey(String key) {
        return key != null && ALL_KEYS.contains(key);
    }
}
