package com.pivotdeck.test;

import com.pivotdeck.data.Dataset;
import com.pivotdeck.types.Schema;
import com.pivotdeck.types.SchemaParser;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Small hand-written user datasets with known aggregates.
 */
public final class UserFixtures {

    public static final Schema SCHEMA = SchemaParser.parse(
        "user_id:string not null, age:numeric, ltv:numeric, revenue:numeric, orders:numeric, "
            + "country:string, tier:string, signup_date:date, is_retained:boolean");

    private UserFixtures() {}

    /**
     * Eight users:
     * <pre>
     * id  age  ltv   revenue orders country tier     signup      retained
     * u1  18   10    100     2      US      Gold     2024-01-15  true
     * u2  24   20    50      1      US      Silver   2024-02-20  true
     * u3  25   30    300     3      DE      Gold     2024-04-02  false
     * u4  34   40    0       0      DE      Bronze   2024-05-10  true
     * u5  40   500   1000    10     US      Platinum 2024-07-01  true
     * u6  -    60    200     4      FR      Silver   2024-08-12  false
     * u7  60   70    -       -      US      -        2024-11-30  true
     * u8  29   15    120     2      FR      Gold     -           -
     * </pre>
     */
    public static List<Map<String, Object>> rows() {
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row("u1", 18, 10, 100, 2, "US", "Gold", LocalDate.of(2024, 1, 15), true));
        rows.add(row("u2", 24, 20, 50, 1, "US", "Silver", LocalDate.of(2024, 2, 20), true));
        rows.add(row("u3", 25, 30, 300, 3, "DE", "Gold", LocalDate.of(2024, 4, 2), false));
        rows.add(row("u4", 34, 40, 0, 0, "DE", "Bronze", LocalDate.of(2024, 5, 10), true));
        rows.add(row("u5", 40, 500, 1000, 10, "US", "Platinum", LocalDate.of(2024, 7, 1), true));
        rows.add(row("u6", null, 60, 200, 4, "FR", "Silver", LocalDate.of(2024, 8, 12), false));
        rows.add(row("u7", 60, 70, null, null, "US", null, LocalDate.of(2024, 11, 30), true));
        rows.add(row("u8", 29, 15, 120, 2, "FR", "Gold", null, null));
        return rows;
    }

    public static Dataset dataset() {
        return Dataset.load(rows(), SCHEMA);
    }

    private static Map<String, Object> row(String id, Integer age, Integer ltv, Integer revenue, Integer orders,
                                           String country, String tier, LocalDate signup, Boolean retained) {
        Map<String, Object> row = new HashMap<>();
        row.put("user_id", id);
        row.put("age", age);
        row.put("ltv", ltv);
        row.put("revenue", revenue);
        row.put("orders", orders);
        row.put("country", country);
        row.put("tier", tier);
        row.put("signup_date", signup);
        row.put("is_retained", retained);
        return row;
    }
}
