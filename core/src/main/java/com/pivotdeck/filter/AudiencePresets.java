package com.pivotdeck.filter;

import com.pivotdeck.catalog.DimensionCatalog;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Named audience segments over the user dimensions, written in the filter language.
 *
 * <p>An audience is just filter text; {@link #filterFor} parses it against a catalog
 * like any analyst-typed filter, and {@link #and} narrows it with extra conditions.
 */
public final class AudiencePresets {

    public static final String ALL_USERS = "All Users";

    private static final Map<String, String> AUDIENCES = new LinkedHashMap<>();

    static {
        AUDIENCES.put(ALL_USERS, "");
        AUDIENCES.put("High Value Customers", "ltv > 1000");
        AUDIENCES.put("Recent Signups", "days_since_signup < 30");
        AUDIENCES.put("Churned Users", "is_churned = true");
        AUDIENCES.put("Mobile Users", "device_type = 'Mobile'");
        AUDIENCES.put("Email Subscribers", "email_subscriber = true");
        AUDIENCES.put("High AOV Customers", "average_order_value > 100");
        AUDIENCES.put("Frequent Buyers", "total_orders > 10");
        AUDIENCES.put("Gold+ Members", "loyalty_tier in ('Gold', 'Platinum')");
        AUDIENCES.put("At-Risk Customers", "churn_risk_score > 0.7");
        AUDIENCES.put("Social Followers", "social_media_follower = true");
        AUDIENCES.put("High Engagement", "website_visits_l30d > 10");
        AUDIENCES.put("Recent Purchasers", "days_since_last_purchase < 30");
        AUDIENCES.put("High NPS", "nps_score > 8");
        AUDIENCES.put("Fashion Lovers", "product_category_preference = 'Fashion'");
        AUDIENCES.put("Price Sensitive", "price_sensitivity = 'High'");
        AUDIENCES.put("Young Adults", "age >= 18 AND age <= 35");
        AUDIENCES.put("US Customers", "country = 'US'");
        AUDIENCES.put("New Customers", "total_orders <= 2");
        AUDIENCES.put("VIP Customers", "loyalty_tier = 'Platinum'");
    }

    private AudiencePresets() {}

    public static List<String> names() {
        return List.copyOf(AUDIENCES.keySet());
    }

    /**
     * Returns the filter text of an audience.
     *
     * @param name the audience name
     * @return the filter text (empty for "All Users"), or empty if no such audience
     */
    public static Optional<String> filterText(String name) {
        return Optional.ofNullable(AUDIENCES.get(name));
    }

    /**
     * Parses the audience's filter against a catalog.
     *
     * @param name the audience name
     * @param catalog the dimension catalog
     * @return the filter
     * @throws IllegalArgumentException if no such audience exists
     */
    public static Filter filterFor(String name, DimensionCatalog catalog) {
        String text = filterText(name)
            .orElseThrow(() -> new IllegalArgumentException("Unknown audience: " + name));
        return Filter.parse(text, catalog);
    }

    /**
     * Joins filter texts with AND, parenthesizing each non-blank part.
     *
     * @param texts the filter texts
     * @return the combined text; blank if every part is blank
     */
    public static String and(String... texts) {
        List<String> parts = Arrays.stream(texts)
            .filter(t -> t != null && !t.isBlank())
            .map(String::trim)
            .collect(Collectors.toList());
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return parts.stream().map(t -> "(" + t + ")").collect(Collectors.joining(" AND "));
    }
}
