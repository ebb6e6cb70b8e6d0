package io.github.yok.dwloader.core;

import io.github.yok.dwloader.db.DbUnitConnectionFactory;
import io.github.yok.dwloader.gold.CustomerDimensionBuilder;
import io.github.yok.dwloader.gold.ProductDimension;
import io.github.yok.dwloader.gold.ProductDimensionBuilder;
import io.github.yok.dwloader.gold.SalesFactBuilder;
import io.github.yok.dwloader.temporal.UnresolvedPolicy;
import io.github.yok.dwloader.util.JdbcValues;
import java.sql.Connection;
import java.sql.Timestamp;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.IDatabaseConnection;
import org.dbunit.dataset.DefaultDataSet;
import org.dbunit.dataset.IDataSet;
import org.dbunit.dataset.ITable;

/**
 * Gold unit: rebuilds {@code dim_customers}, {@code dim_products} and {@code fact_sales} from the
 * silver layer as one all-or-nothing DBUnit CLEAN_INSERT.
 *
 * <p>
 * Under {@link UnresolvedPolicy#UNKNOWN_MEMBER} each dimension also receives an unknown member row
 * that unresolved facts point to.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class GoldModelUnit implements LoadUnit {

    static final String NAME = "gold_model";

    private final String silverSchema;
    private final String goldSchema;
    private final DbUnitConnectionFactory connectionFactory;
    private final UnresolvedPolicy policy;
    private final long unknownMemberKey;
    private final String createdAtColumn;
    private final Clock clock;
    private final OperationExecutor operationExecutor;

    /**
     * Creates a unit.
     *
     * @param silverSchema schema read from
     * @param goldSchema schema written to
     * @param connectionFactory DBUnit connection factory
     * @param policy handling of unresolved fact references
     * @param unknownMemberKey surrogate key of the unknown members
     * @param createdAtColumn audit column set on every written row
     */
    public GoldModelUnit(String silverSchema, String goldSchema,
            DbUnitConnectionFactory connectionFactory, UnresolvedPolicy policy,
            long unknownMemberKey, String createdAtColumn) {
        this(silverSchema, goldSchema, connectionFactory, policy, unknownMemberKey,
                createdAtColumn, Clock.systemDefaultZone(), OperationExecutor.dbUnit());
    }

    GoldModelUnit(String silverSchema, String goldSchema,
            DbUnitConnectionFactory connectionFactory, UnresolvedPolicy policy,
            long unknownMemberKey, String createdAtColumn, Clock clock,
            OperationExecutor operationExecutor) {
        this.silverSchema = silverSchema;
        this.goldSchema = goldSchema;
        this.connectionFactory = connectionFactory;
        this.policy = policy;
        this.unknownMemberKey = unknownMemberKey;
        this.createdAtColumn = createdAtColumn;
        this.clock = clock;
        this.operationExecutor = operationExecutor;
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public UnitResult execute(Connection jdbc) throws Exception {
        IDatabaseConnection conn = connectionFactory.create(jdbc, goldSchema);

        List<Map<String, Object>> customers = read(conn, "crm_cust_info", "cst_id");
        List<Map<String, Object>> demographics = read(conn, "erp_cust_az12", "cid");
        List<Map<String, Object>> locations = read(conn, "erp_loc_a101", "cid");
        List<Map<String, Object>> products = read(conn, "crm_prd_info", "prd_id");
        List<Map<String, Object>> categories = read(conn, "erp_px_cat_g1v2", "id");
        List<Map<String, Object>> sales =
                read(conn, "crm_sales_details", "sls_ord_num, sls_prd_key");
        long read = (long) customers.size() + demographics.size() + locations.size()
                + products.size() + categories.size() + sales.size();

        // Dimensions
        CustomerDimensionBuilder customerBuilder = new CustomerDimensionBuilder();
        List<Map<String, Object>> dimCustomers = new ArrayList<>(
                customerBuilder.build(customers, demographics, locations, LocalDate.now(clock)));
        ProductDimensionBuilder productBuilder = new ProductDimensionBuilder();
        ProductDimension dimProducts = productBuilder.build(products, categories);

        // Facts
        Map<Long, Long> customerKeys = new HashMap<>();
        for (Map<String, Object> row : dimCustomers) {
            customerKeys.putIfAbsent(JdbcValues.toLong(row.get("customer_id")),
                    JdbcValues.toLong(row.get("customer_key")));
        }
        List<Map<String, Object>> facts = new SalesFactBuilder(policy, unknownMemberKey)
                .build(sales, dimProducts.getResolver(), customerKeys);

        List<Map<String, Object>> productRows = new ArrayList<>(dimProducts.getRows());
        if (policy == UnresolvedPolicy.UNKNOWN_MEMBER) {
            dimCustomers.add(0, customerBuilder.unknownMember(unknownMemberKey));
            productRows.add(0, productBuilder.unknownMember(unknownMemberKey));
        }

        Timestamp now = Timestamp.from(clock.instant());
        String audit = createdAtColumn.toLowerCase(Locale.ROOT);
        dimCustomers.forEach(r -> r.put(audit, now));
        productRows.forEach(r -> r.put(audit, now));
        facts.forEach(r -> r.put(audit, now));

        IDataSet target = conn.createDataSet();
        ITable[] tables = {
                TableRows.toTable(target.getTableMetaData("dim_customers"), dimCustomers),
                TableRows.toTable(target.getTableMetaData("dim_products"), productRows),
                TableRows.toTable(target.getTableMetaData("fact_sales"), facts)};
        operationExecutor.cleanInsert(conn, new DefaultDataSet(tables));

        long written = (long) dimCustomers.size() + productRows.size() + facts.size();
        log.info("Gold model rebuilt | dim_customers={} dim_products={} fact_sales={}",
                dimCustomers.size(), productRows.size(), facts.size());
        return UnitResult.builder().rowsRead(read).inserted(written).build();
    }

    private List<Map<String, Object>> read(IDatabaseConnection conn, String table, String order)
            throws Exception {
        return TableRows.query(conn, table,
                "SELECT * FROM " + silverSchema + "." + table + " ORDER BY " + order);
    }
}
