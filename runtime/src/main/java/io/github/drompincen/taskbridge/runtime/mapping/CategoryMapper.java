package io.github.drompincen.taskbridge.runtime.mapping;

import io.github.drompincen.taskbridge.runtime.resolve.Names;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Maps a source category label to a destination activity name using a fixed table.
 * Blank and unknown labels map to {@value #FALLBACK}. Nothing else about the task
 * (assignee, section, title) is ever consulted.
 */
public final class CategoryMapper {

    public static final String FALLBACK = "Other";

    private static final Map<String, String> TABLE = new LinkedHashMap<>();
    private static final Map<String, String> NORMALIZED = new LinkedHashMap<>();

    static {
        TABLE.put("Account Management", "Project Management");
        TABLE.put("Blogs", "SEO");
        TABLE.put("Brand Package", "Branding");
        TABLE.put("Brochure", "Brochure");
        TABLE.put("Client Management", "Project Management");
        TABLE.put("Content & Creative", "Graphic Design Support");
        TABLE.put("Contractor/Homeowner Brochure", "Brochure");
        TABLE.put("Copywriter", "Website - New");
        TABLE.put("CrewRecruiter", "CrewRecruiter");
        TABLE.put("Dealer Brochure", "Brochure");
        TABLE.put("Design - New Website", "Website - New");
        TABLE.put("Email", "Email");
        TABLE.put("Facebook Ads", "Facebook Ads");
        TABLE.put("Google Ads", "Google Ads");
        TABLE.put("Halstead", "Halstead Marketing");
        TABLE.put("Internal Operations", "Administrative - Internal");
        TABLE.put("Lead Magnet", "Lead Magnet");
        TABLE.put("LinkedIn Ads", "Linkedin Ads");
        TABLE.put("Marketing Collateral Package", "Branding");
        TABLE.put("Meetings", "Project Management");
        TABLE.put("Microsoft Ads", "Microsoft Ads");
        TABLE.put("Offboarding, Pausing, & Ending Projects", "Project Management");
        TABLE.put("OKRs", "Administrative - Internal");
        TABLE.put("Onboarding", "Onboarding");
        TABLE.put("Onboarding | Access", "Onboarding");
        TABLE.put("Onboarding | After Client Kick Off Call", "Onboarding");
        TABLE.put("Onboarding | Before Client Kick Off Call", "Onboarding");
        TABLE.put("Onboarding | During Client Kick Off Call", "Onboarding");
        TABLE.put("Onboarding | Lead Tracking & Review Building", "Onboarding");
        TABLE.put("Other", "Other");
        TABLE.put("Paid Advertising", "Google Ads");
        TABLE.put("PM Status Update", "Project Management");
        TABLE.put("SEO", "SEO");
        TABLE.put("SEO Services", "SEO");
        TABLE.put("Social Media", "Social Posting");
        TABLE.put("Social Posting", "Social Posting");
        TABLE.put("Special Projects", "Other");
        TABLE.put("Videography", "Videography");
        TABLE.put("Website - One Week Before Go Live", "Website - New");
        TABLE.put("Website Core Pages", "Website - New");
        TABLE.put("Website Design", "Website - New");
        TABLE.put("Website Development", "Website - New");
        TABLE.put("Website Final Approval", "Website - New");
        TABLE.put("Website Full Build", "Website - New");
        TABLE.put("Website Go Live", "Website - New");
        TABLE.put("Website Homepage in Squarespace", "Website - New");
        TABLE.put("Website Homepage Mockup", "Website - New");
        TABLE.put("Website Strategy", "Website - New");
        TABLE.put("Website Updates", "Website - SEO");
        TABLE.forEach((source, target) -> NORMALIZED.put(Names.normalize(source), target));
    }

    private CategoryMapper() {
    }

    public static String map(String sourceCategory) {
        if (Names.isBlank(sourceCategory)) {
            return FALLBACK;
        }
        return NORMALIZED.getOrDefault(Names.normalize(sourceCategory), FALLBACK);
    }

    public static boolean isKnown(String sourceCategory) {
        return !Names.isBlank(sourceCategory) && NORMALIZED.containsKey(Names.normalize(sourceCategory));
    }

    public static Map<String, String> table() {
        return Collections.unmodifiableMap(TABLE);
    }
}
