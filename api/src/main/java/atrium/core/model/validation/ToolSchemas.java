package atrium.core.model.validation;

import atrium.core.model.validation.FieldRule.ArrayRule;
import atrium.core.model.validation.FieldRule.BooleanRule;
import atrium.core.model.validation.FieldRule.EnumRule;
import atrium.core.model.validation.FieldRule.NumberRule;
import atrium.core.model.validation.FieldRule.StringFormat;
import atrium.core.model.validation.FieldRule.StringRule;

/**
 * Argument schemas for the agent tools and the web API.
 */
public final class ToolSchemas {

    public static final int MAX_AGENT_PAGE_SIZE = 50;

    public static final int MAX_PAGE_SIZE = 100;

    /** Largest offset for which {@code offset + limit} still fits in an {@code int}. */
    public static final int MAX_OFFSET = Integer.MAX_VALUE - MAX_PAGE_SIZE;

    public static final RequestSchema SEARCH_PROFILES = RequestSchema.of(
            "search_profiles",
            FieldSpec.optional("query", StringRule.length(0, 200)),
            FieldSpec.optional("skills", new ArrayRule(StringRule.length(1, 100), 10)),
            FieldSpec.optional("availableFor", new ArrayRule(EnumRule.of("meetings", "quotes", "appointments"), 3)),
            FieldSpec.optional("limit", NumberRule.integer(1, MAX_AGENT_PAGE_SIZE)),
            FieldSpec.optional("offset", NumberRule.integer(0, MAX_OFFSET)));

    public static final RequestSchema GET_PROFILE = RequestSchema.of(
            "get_profile", FieldSpec.required("slug", new StringRule(1, 100, StringFormat.SLUG)));

    public static final RequestSchema REQUEST_MEETING = RequestSchema.of(
            "request_meeting",
            FieldSpec.required("profileSlug", new StringRule(1, 100, StringFormat.SLUG)),
            FieldSpec.required("requesterName", StringRule.length(2, 255)),
            FieldSpec.required("requesterEmail", new StringRule(3, 255, StringFormat.EMAIL)),
            FieldSpec.required("message", StringRule.length(10, 2000)),
            FieldSpec.required("requestType", EnumRule.of("meeting", "quote", "appointment")),
            FieldSpec.optional("preferredTime", new StringRule(1, 64, StringFormat.DATE_TIME)));

    public static final RequestSchema UPDATE_PRIVACY = RequestSchema.of(
                    "update_privacy",
                    FieldSpec.optional("isPublic", new BooleanRule()),
                    FieldSpec.optional("isActive", new BooleanRule()))
            .requireAtLeast(1);

    private ToolSchemas() {}
}
