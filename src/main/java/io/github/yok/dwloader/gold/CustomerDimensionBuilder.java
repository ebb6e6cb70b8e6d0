package io.github.yok.dwloader.gold;

import io.github.yok.dwloader.util.JdbcValues;
import java.time.LocalDate;
import java.time.Period;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Builds {@code dim_customers} from the CRM customers joined with the ERP demographics and
 * locations on the customer key.
 *
 * @author Yasuharu.Okawauchi
 */
public class CustomerDimensionBuilder {

    static final String NOT_AVAILABLE = "n/a";

    /**
     * Builds the dimension rows. Surrogate keys are assigned from 1 in input order.
     *
     * @param customers silver {@code crm_cust_info} rows
     * @param demographics silver {@code erp_cust_az12} rows
     * @param locations silver {@code erp_loc_a101} rows
     * @param today reference day of the age calculation
     * @return dimension rows keyed by lower-case column name
     */
    public List<Map<String, Object>> build(List<Map<String, Object>> customers,
            List<Map<String, Object>> demographics, List<Map<String, Object>> locations,
            LocalDate today) {
        Map<String, Map<String, Object>> demographicsById = index(demographics);
        Map<String, Map<String, Object>> locationsById = index(locations);

        List<Map<String, Object>> rows = new ArrayList<>(customers.size());
        long key = 1;
        for (Map<String, Object> customer : customers) {
            String number = JdbcValues.asText(customer.get("cst_key"));
            Map<String, Object> demo = demographicsById.getOrDefault(number, Map.of());
            Map<String, Object> location = locationsById.getOrDefault(number, Map.of());
            String first = JdbcValues.asText(customer.get("cst_firstname"));
            String last = JdbcValues.asText(customer.get("cst_lastname"));
            LocalDate birthdate = JdbcValues.toLocalDate(demo.get("bdate"));
            Integer age = birthdate == null ? null : Period.between(birthdate, today).getYears();

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("customer_key", key++);
            row.put("customer_id", JdbcValues.toLong(customer.get("cst_id")));
            row.put("customer_number", number);
            row.put("first_name", first);
            row.put("last_name", last);
            row.put("full_name", first == null || last == null ? null : first + " " + last);
            row.put("country",
                    Objects.toString(location.get("cntry"), NOT_AVAILABLE));
            row.put("marital_status",
                    Objects.toString(customer.get("cst_marital_status"), NOT_AVAILABLE));
            row.put("gender", gender(JdbcValues.asText(customer.get("cst_gndr")),
                    JdbcValues.asText(demo.get("gen"))));
            row.put("birthdate", birthdate);
            row.put("create_date", JdbcValues.toLocalDate(customer.get("cst_create_date")));
            row.put("age", age);
            row.put("age_group", ageGroup(age));
            rows.add(row);
        }
        return rows;
    }

    /**
     * Returns the unknown member row.
     *
     * @param key surrogate key of the unknown member
     * @return dimension row
     */
    public Map<String, Object> unknownMember(long key) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("customer_key", key);
        row.put("customer_number", NOT_AVAILABLE);
        row.put("full_name", NOT_AVAILABLE);
        row.put("country", NOT_AVAILABLE);
        row.put("marital_status", NOT_AVAILABLE);
        row.put("gender", NOT_AVAILABLE);
        row.put("age_group", "Unknown");
        return row;
    }

    /**
     * CRM gender wins unless it is unknown; the ERP gender is the fallback.
     */
    static String gender(String crm, String erp) {
        if (crm != null && !"UNKNOWN".equals(crm.trim().toUpperCase(Locale.ROOT))) {
            return crm;
        }
        return erp == null ? NOT_AVAILABLE : erp;
    }

    static String ageGroup(Integer age) {
        if (age == null) {
            return "Unknown";
        }
        if (age < 20) {
            return "Under 20";
        }
        if (age < 30) {
            return "20-29";
        }
        if (age < 40) {
            return "30-39";
        }
        if (age < 50) {
            return "40-49";
        }
        return "50+";
    }

    private static Map<String, Map<String, Object>> index(List<Map<String, Object>> rows) {
        Map<String, Map<String, Object>> byId = new HashMap<>();
        for (Map<String, Object> row : rows) {
            byId.putIfAbsent(JdbcValues.asText(row.get("cid")), row);
        }
        return byId;
    }
}
