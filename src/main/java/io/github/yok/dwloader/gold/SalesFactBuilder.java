package io.github.yok.dwloader.gold;

import io.github.yok.dwloader.core.IntegrityException;
import io.github.yok.dwloader.temporal.DimensionVersion;
import io.github.yok.dwloader.temporal.PointInTimeResolver;
import io.github.yok.dwloader.temporal.UnresolvedPolicy;
import io.github.yok.dwloader.util.JdbcValues;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * Builds {@code fact_sales}. The product key is the version of the product valid on the order
 * date; the customer key is looked up by customer id.
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class SalesFactBuilder {

    private final UnresolvedPolicy policy;
    private final long unknownMemberKey;

    /**
     * Creates a builder.
     *
     * @param policy handling of unresolved references
     * @param unknownMemberKey surrogate key of the unknown members
     */
    public SalesFactBuilder(UnresolvedPolicy policy, long unknownMemberKey) {
        this.policy = policy;
        this.unknownMemberKey = unknownMemberKey;
    }

    /**
     * Builds the fact rows. Surrogate keys are assigned from 1 in input order.
     *
     * @param sales silver {@code crm_sales_details} rows
     * @param products product resolver
     * @param customerKeys customer id to surrogate key
     * @return fact rows keyed by lower-case column name
     * @throws IntegrityException if a reference is ambiguous, or unresolved under
     *         {@link UnresolvedPolicy#FAIL}
     */
    public List<Map<String, Object>> build(List<Map<String, Object>> sales,
            PointInTimeResolver<Long> products, Map<Long, Long> customerKeys) {
        List<Map<String, Object>> rows = new ArrayList<>(sales.size());
        long key = 1;
        int unresolvedProducts = 0;
        int unresolvedCustomers = 0;
        for (Map<String, Object> sale : sales) {
            String order = JdbcValues.asText(sale.get("sls_ord_num"));
            String productNumber = JdbcValues.asText(sale.get("sls_prd_key"));
            LocalDate orderDate = JdbcValues.toLocalDate(sale.get("sls_order_dt"));
            Long customerId = JdbcValues.toLong(sale.get("sls_cust_id"));

            Long productKey = products.resolve(productNumber, orderDate)
                    .map(DimensionVersion::getPayload).orElse(null);
            if (productKey == null) {
                productKey = unresolved("product " + productNumber + " on " + orderDate, order);
                unresolvedProducts++;
            }
            Long customerKey = customerId == null ? null : customerKeys.get(customerId);
            if (customerKey == null) {
                customerKey = unresolved("customer " + customerId, order);
                unresolvedCustomers++;
            }

            Map<String, Object> row = new LinkedHashMap<>();
            row.put("sales_key", key++);
            row.put("customer_key", customerKey);
            row.put("product_key", productKey);
            row.put("order_number", order);
            row.put("order_date", orderDate);
            row.put("shipping_date", JdbcValues.toLocalDate(sale.get("sls_ship_dt")));
            row.put("due_date", JdbcValues.toLocalDate(sale.get("sls_due_dt")));
            row.put("sales_amount", JdbcValues.toDecimal(sale.get("sls_sales")));
            row.put("quantity", JdbcValues.toLong(sale.get("sls_quantity")));
            row.put("price", JdbcValues.toDecimal(sale.get("sls_price")));
            rows.add(row);
        }
        if (unresolvedProducts > 0 || unresolvedCustomers > 0) {
            log.warn("fact_sales: {} product and {} customer reference(s) resolved to the unknown"
                    + " member", unresolvedProducts, unresolvedCustomers);
        }
        return rows;
    }

    private Long unresolved(String what, String order) {
        if (policy == UnresolvedPolicy.FAIL) {
            throw new IntegrityException("Order " + order + ": no dimension row for " + what);
        }
        return unknownMemberKey;
    }
}
