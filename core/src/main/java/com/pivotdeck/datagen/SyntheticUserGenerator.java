package com.pivotdeck.datagen;

import com.pivotdeck.data.Dataset;
import com.pivotdeck.types.BooleanType;
import com.pivotdeck.types.DataType;
import com.pivotdeck.types.DateType;
import com.pivotdeck.types.NumericType;
import com.pivotdeck.types.Schema;
import com.pivotdeck.types.SchemaField;
import com.pivotdeck.types.StringType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;

/**
 * Generates synthetic e-commerce users for exploring pivots.
 *
 * <p>Features:
 * <ul>
 *   <li>Deterministic generation: the same seed, reference date and count always
 *       produce the same records</li>
 *   <li>Identity, demographic, purchase, engagement, risk and preference attributes
 *       (see {@link #USER_SCHEMA})</li>
 *   <li>Skewed distributions: normal ages, Poisson order counts, log-normal revenue,
 *       beta-distributed churn risk</li>
 * </ul>
 *
 * <p>All relative dates ({@code days_since_signup}, {@code days_since_last_purchase})
 * are measured against the reference date instead of the wall clock.
 */
public class SyntheticUserGenerator {

    private static final Logger logger = LoggerFactory.getLogger(SyntheticUserGenerator.class);

    /** Users sign up within this many days before the reference date */
    private static final int SIGNUP_WINDOW_DAYS = 1095;

    public static final Schema USER_SCHEMA = new Schema(
        field("user_id", StringType.get(), false),
        field("email", StringType.get(), false),
        field("first_name", StringType.get(), false),
        field("last_name", StringType.get(), false),
        field("age", NumericType.get(), false),
        field("gender", StringType.get(), false),
        field("country", StringType.get(), false),
        field("city", StringType.get(), false),
        field("signup_date", DateType.get(), false),
        field("days_since_signup", NumericType.get(), false),
        field("total_orders", NumericType.get(), false),
        field("total_revenue", NumericType.get(), false),
        field("average_order_value", NumericType.get(), false),
        field("ltv", NumericType.get(), false),
        field("last_purchase_date", DateType.get(), false),
        field("days_since_last_purchase", NumericType.get(), false),
        field("purchase_frequency", NumericType.get(), false),
        field("seasonal_shopper", StringType.get(), false),
        field("acquisition_channel", StringType.get(), false),
        field("device_type", StringType.get(), false),
        field("preferred_os", StringType.get(), false),
        field("email_opens_l30d", NumericType.get(), false),
        field("email_clicks_l30d", NumericType.get(), false),
        field("website_visits_l30d", NumericType.get(), false),
        field("app_sessions_l30d", NumericType.get(), false),
        field("product_category_preference", StringType.get(), false),
        field("price_sensitivity", StringType.get(), false),
        field("loyalty_tier", StringType.get(), false),
        field("churn_risk_score", NumericType.get(), false),
        field("is_churned", BooleanType.get(), false),
        field("is_retained", BooleanType.get(), false),
        field("email_subscriber", BooleanType.get(), false),
        field("sms_subscriber", BooleanType.get(), false),
        field("push_notifications", BooleanType.get(), false),
        field("support_tickets_l30d", NumericType.get(), false),
        field("nps_score", NumericType.get(), false),
        field("social_media_follower", BooleanType.get(), false),
        field("referrals_made", NumericType.get(), false),
        field("payment_method", StringType.get(), false),
        field("shipping_preference", StringType.get(), false)
    );

    // ==================== Value Pools ====================

    private static final String[] FIRST_NAMES = {
        "James", "Mary", "Robert", "Patricia", "John", "Jennifer", "Michael", "Linda", "David", "Elizabeth",
        "William", "Barbara", "Richard", "Susan", "Joseph", "Jessica", "Thomas", "Sarah", "Charles", "Karen",
        "Lukas", "Emma", "Hugo", "Chloe", "Marco", "Giulia", "Pablo", "Lucia", "Noah", "Olivia"
    };

    private static final String[] LAST_NAMES = {
        "Smith", "Johnson", "Williams", "Brown", "Jones", "Garcia", "Miller", "Davis", "Rodriguez", "Martinez",
        "Wilson", "Anderson", "Taylor", "Thomas", "Moore", "Martin", "Lee", "Thompson", "White", "Harris",
        "Muller", "Schmidt", "Dubois", "Bernard", "Rossi", "Russo", "Lopez", "Fernandez", "Clark", "Lewis"
    };

    private static final String[] EMAIL_DOMAINS = {"example.com", "example.org", "example.net", "mail.test"};

    private static final String[] GENDERS = {"Male", "Female", "Other"};
    private static final double[] GENDER_WEIGHTS = {0.45, 0.52, 0.03};

    private static final String[] COUNTRIES = {"US", "UK", "Canada", "Australia", "Germany", "France", "Spain", "Italy"};
    private static final double[] COUNTRY_WEIGHTS = {0.4, 0.15, 0.12, 0.08, 0.08, 0.07, 0.05, 0.05};

    private static final Map<String, String[]> CITIES = Map.of(
        "US", new String[]{"New York", "Los Angeles", "Chicago", "Houston", "Seattle"},
        "UK", new String[]{"London", "Manchester", "Birmingham", "Leeds"},
        "Canada", new String[]{"Toronto", "Vancouver", "Montreal", "Calgary"},
        "Australia", new String[]{"Sydney", "Melbourne", "Brisbane", "Perth"},
        "Germany", new String[]{"Berlin", "Munich", "Hamburg", "Cologne"},
        "France", new String[]{"Paris", "Lyon", "Marseille", "Toulouse"},
        "Spain", new String[]{"Madrid", "Barcelona", "Valencia", "Seville"},
        "Italy", new String[]{"Rome", "Milan", "Naples", "Turin"}
    );

    private static final String[] CHANNELS = {"Organic Search", "Paid Search", "Social Media", "Email", "Direct", "Referral"};
    private static final double[] CHANNEL_WEIGHTS = {0.25, 0.2, 0.15, 0.15, 0.15, 0.1};

    private static final String[] DEVICES = {"Desktop", "Mobile", "Tablet"};
    private static final double[] DEVICE_WEIGHTS = {0.4, 0.55, 0.05};

    private static final String[] OPERATING_SYSTEMS = {"iOS", "Android", "Windows", "Mac"};
    private static final double[] OS_WEIGHTS = {0.3, 0.35, 0.2, 0.15};

    private static final String[] CATEGORIES = {"Electronics", "Fashion", "Home & Garden", "Sports", "Books", "Beauty"};
    private static final double[] CATEGORY_WEIGHTS = {0.2, 0.25, 0.15, 0.15, 0.1, 0.15};

    private static final String[] SENSITIVITIES = {"Low", "Medium", "High"};
    private static final double[] SENSITIVITY_WEIGHTS = {0.3, 0.5, 0.2};

    private static final String[] TIERS = {"Bronze", "Silver", "Gold", "Platinum"};
    private static final double[] TIER_WEIGHTS = {0.4, 0.3, 0.2, 0.1};

    private static final double[] NPS_WEIGHTS = {0.05, 0.05, 0.05, 0.05, 0.05, 0.1, 0.1, 0.15, 0.15, 0.15, 0.1};

    private static final String[] PAYMENT_METHODS = {"Credit Card", "PayPal", "Apple Pay", "Google Pay", "Bank Transfer"};
    private static final double[] PAYMENT_WEIGHTS = {0.5, 0.2, 0.15, 0.1, 0.05};

    private static final String[] SHIPPING = {"Standard", "Express", "Overnight"};
    private static final double[] SHIPPING_WEIGHTS = {0.7, 0.25, 0.05};

    private final long seed;
    private final LocalDate referenceDate;

    public SyntheticUserGenerator(long seed, LocalDate referenceDate) {
        this.seed = seed;
        this.referenceDate = Objects.requireNonNull(referenceDate, "referenceDate must not be null");
    }

    public long seed() {
        return seed;
    }

    public LocalDate referenceDate() {
        return referenceDate;
    }

    /**
     * Generates raw user rows conforming to {@link #USER_SCHEMA}.
     *
     * @param count number of users
     * @return one map per user, in user id order
     */
    public List<Map<String, Object>> generate(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("count must not be negative: " + count);
        }
        Random random = new Random(seed);
        List<Map<String, Object>> rows = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            rows.add(generateUser(i, random));
        }
        logger.debug("Generated {} users (seed={}, referenceDate={})", count, seed, referenceDate);
        return rows;
    }

    /**
     * Generates users and loads them into a new dataset.
     *
     * @param count number of users
     * @return the dataset
     */
    public Dataset generateDataset(int count) {
        return Dataset.load(generate(count), USER_SCHEMA);
    }

    private Map<String, Object> generateUser(int index, Random random) {
        Map<String, Object> row = new LinkedHashMap<>();

        // Identity
        String firstName = pick(random, FIRST_NAMES);
        String lastName = pick(random, LAST_NAMES);
        row.put("user_id", String.format("user_%06d", index));
        row.put("email", (firstName + "." + lastName).toLowerCase(Locale.ROOT) + index + "@"
            + pick(random, EMAIL_DOMAINS));
        row.put("first_name", firstName);
        row.put("last_name", lastName);

        // Demographics
        row.put("age", (int) clip(35 + 12 * random.nextGaussian(), 18, 80));
        row.put("gender", choose(random, GENDERS, GENDER_WEIGHTS));
        String country = choose(random, COUNTRIES, COUNTRY_WEIGHTS);
        row.put("country", country);
        row.put("city", pick(random, CITIES.get(country)));

        // Signup
        LocalDate windowStart = referenceDate.minusDays(SIGNUP_WINDOW_DAYS);
        LocalDate signupDate = windowStart.plusDays(random.nextInt(SIGNUP_WINDOW_DAYS + 1));
        long daysSinceSignup = ChronoUnit.DAYS.between(signupDate, referenceDate);
        row.put("signup_date", signupDate);
        row.put("days_since_signup", daysSinceSignup);

        // Purchases
        int totalOrders = (int) clip(poisson(random, 8), 0, 50);
        double totalRevenue = clip(Math.exp(4.5 + 1.2 * random.nextGaussian()), 0, 10000);
        row.put("total_orders", totalOrders);
        row.put("total_revenue", totalRevenue);
        row.put("average_order_value", totalRevenue / Math.max(totalOrders, 1));
        row.put("ltv", totalRevenue * uniform(random, 1.2, 2.5));

        // Recency and frequency
        LocalDate lastPurchase = signupDate.plusDays(random.nextInt((int) Math.min(365, daysSinceSignup) + 1));
        long daysSinceLastPurchase = ChronoUnit.DAYS.between(lastPurchase, referenceDate);
        row.put("last_purchase_date", lastPurchase);
        row.put("days_since_last_purchase", daysSinceLastPurchase);
        row.put("purchase_frequency", clip(exponential(random, 30), 1, 365));
        row.put("seasonal_shopper", random.nextDouble() < 0.3 ? "Yes" : "No");

        // Channel and device
        row.put("acquisition_channel", choose(random, CHANNELS, CHANNEL_WEIGHTS));
        row.put("device_type", choose(random, DEVICES, DEVICE_WEIGHTS));
        row.put("preferred_os", choose(random, OPERATING_SYSTEMS, OS_WEIGHTS));

        // Engagement
        row.put("email_opens_l30d", (int) clip(poisson(random, 3), 0, 20));
        row.put("email_clicks_l30d", (int) clip(poisson(random, 1), 0, 10));
        row.put("website_visits_l30d", (int) clip(poisson(random, 5), 0, 30));
        row.put("app_sessions_l30d", (int) clip(poisson(random, 2), 0, 15));

        // Preferences
        row.put("product_category_preference", choose(random, CATEGORIES, CATEGORY_WEIGHTS));
        row.put("price_sensitivity", choose(random, SENSITIVITIES, SENSITIVITY_WEIGHTS));
        row.put("loyalty_tier", choose(random, TIERS, TIER_WEIGHTS));

        // Risk
        double churnRisk = beta25(random);
        boolean churned = daysSinceLastPurchase > 90 && churnRisk > 0.6;
        row.put("churn_risk_score", churnRisk);
        row.put("is_churned", churned);
        row.put("is_retained", !churned);

        // Communication
        row.put("email_subscriber", random.nextDouble() < 0.8);
        row.put("sms_subscriber", random.nextDouble() < 0.4);
        row.put("push_notifications", random.nextDouble() < 0.6);

        // Service and social
        row.put("support_tickets_l30d", (int) clip(poisson(random, 0.5), 0, 5));
        row.put("nps_score", chooseIndex(random, NPS_WEIGHTS));
        row.put("social_media_follower", random.nextDouble() < 0.3);
        row.put("referrals_made", (int) clip(poisson(random, 0.8), 0, 10));

        // Payment and shipping
        row.put("payment_method", choose(random, PAYMENT_METHODS, PAYMENT_WEIGHTS));
        row.put("shipping_preference", choose(random, SHIPPING, SHIPPING_WEIGHTS));
        return row;
    }

    // ==================== Distributions ====================

    private static SchemaField field(String name, DataType type, boolean nullable) {
        return new SchemaField(name, type, nullable);
    }

    private static String pick(Random random, String[] values) {
        return values[random.nextInt(values.length)];
    }

    private static String choose(Random random, String[] values, double[] weights) {
        return values[chooseIndex(random, weights)];
    }

    private static int chooseIndex(Random random, double[] weights) {
        double u = random.nextDouble();
        double cumulative = 0.0;
        for (int i = 0; i < weights.length; i++) {
            cumulative += weights[i];
            if (u < cumulative) {
                return i;
            }
        }
        return weights.length - 1;
    }

    private static double clip(double value, double min, double max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double uniform(Random random, double min, double max) {
        return min + (max - min) * random.nextDouble();
    }

    private static double exponential(Random random, double mean) {
        return -mean * Math.log(1.0 - random.nextDouble());
    }

    /**
     * Knuth's method; fine for the small means used here.
     */
    private static int poisson(Random random, double mean) {
        double limit = Math.exp(-mean);
        double product = random.nextDouble();
        int k = 0;
        while (product > limit) {
            product *= random.nextDouble();
            k++;
        }
        return k;
    }

    /**
     * Beta(2, 5) sample: the 2nd smallest of 6 uniforms.
     */
    private static double beta25(Random random) {
        double smallest = Double.MAX_VALUE;
        double second = Double.MAX_VALUE;
        for (int i = 0; i < 6; i++) {
            double u = random.nextDouble();
            if (u < smallest) {
                second = smallest;
                smallest = u;
            } else if (u < second) {
                second = u;
            }
        }
        return second;
    }
}
