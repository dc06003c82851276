package com.wcoptimizer.graph;

import com.wcoptimizer.config.WcOptimizerProperties;
import com.wcoptimizer.exception.GraphStoreUnavailableException;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.Driver;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.exceptions.Neo4jException;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * {@link GraphStore} over a Neo4j server reached through the Bolt driver. All
 * values are bound as Cypher parameters.
 */
@Slf4j
@Component
public class Neo4jGraphStore implements GraphStore {

    private static final List<String> INDEXES = List.of(
        "CREATE INDEX supplier_id IF NOT EXISTS FOR (s:Supplier) ON (s.supplier_id)",
        "CREATE INDEX product_id IF NOT EXISTS FOR (p:Product) ON (p.product_id)");

    private static final String SUPPLIER_FIELDS = """
        s.supplier_id AS supplier_id, s.supplier_name AS supplier_name, s.lead_time AS lead_time,
        s.rating AS rating, s.otd_rate AS otd_rate, s.country AS country""";

    private final Driver driver;
    private final SessionConfig sessionConfig;

    public Neo4jGraphStore(Driver driver, WcOptimizerProperties properties) {
        this.driver = driver;
        String database = properties.getGraph().getDatabase();
        this.sessionConfig = database == null || database.isBlank()
            ? SessionConfig.defaultConfig()
            : SessionConfig.forDatabase(database);
    }

    @Override
    public void upsertSuppliers(List<SupplierNode> suppliers) {
        List<Map<String, Object>> rows = suppliers.stream()
            .map(s -> {
                Map<String, Object> row = new HashMap<>();
                row.put("supplier_id", s.supplierId());
                row.put("supplier_name", s.supplierName());
                row.put("lead_time", s.leadTime());
                row.put("rating", s.rating());
                row.put("otd_rate", s.otdRate());
                row.put("country", s.country());
                return row;
            })
            .toList();
        ensureIndexes();
        write("upsert suppliers", """
            UNWIND $rows AS row
            MERGE (s:Supplier {supplier_id: row.supplier_id})
            SET s.supplier_name = row.supplier_name, s.lead_time = row.lead_time,
                s.rating = row.rating, s.otd_rate = row.otd_rate, s.country = row.country
            """, Map.of("rows", rows));
    }

    @Override
    public void upsertSupplyLinks(List<SupplyLink> links) {
        List<Map<String, Object>> rows = links.stream()
            .map(l -> Map.<String, Object>of("supplier_id", l.supplierId(), "product_id", l.productId()))
            .toList();
        ensureIndexes();
        write("upsert supply links", """
            UNWIND $rows AS row
            MERGE (s:Supplier {supplier_id: row.supplier_id})
            MERGE (p:Product {product_id: row.product_id})
            MERGE (s)-[:SUPPLIES]->(p)
            """, Map.of("rows", rows));
    }

    @Override
    public List<SupplyEdge> supplierNetwork() {
        return read("supplier network", """
            MATCH (s:Supplier)-[:SUPPLIES]->(p:Product)
            RETURN s.supplier_id AS supplier_id, s.supplier_name AS supplier_name,
                   s.lead_time AS lead_time, p.product_id AS product_id
            ORDER BY supplier_name, product_id
            """, Map.of(), r -> new SupplyEdge(
                string(r.get("supplier_id")),
                string(r.get("supplier_name")),
                number(r.get("lead_time")),
                string(r.get("product_id"))));
    }

    @Override
    public List<SingleSource> singleSourceProducts(int limit) {
        return read("single source products", """
            MATCH (p:Product)<-[:SUPPLIES]-(s:Supplier)
            WITH p, collect(s) AS suppliers
            WHERE size(suppliers) = 1
            WITH p, suppliers[0] AS s
            RETURN p.product_id AS product_id, s.supplier_id AS supplier_id, s.supplier_name AS supplier_name
            ORDER BY product_id
            LIMIT $limit
            """, Map.of("limit", limit), r -> new SingleSource(
                string(r.get("product_id")),
                string(r.get("supplier_id")),
                string(r.get("supplier_name"))));
    }

    @Override
    public Optional<SupplierImpact> suppliedProducts(String supplierId) {
        return read("supplied products", """
            MATCH (s:Supplier {supplier_id: $supplier_id})
            OPTIONAL MATCH (s)-[:SUPPLIES]->(p:Product)
            WITH s, p ORDER BY p.product_id
            RETURN s.supplier_id AS supplier_id, s.supplier_name AS supplier_name,
                   collect(p.product_id) AS products
            """, Map.of("supplier_id", supplierId), r -> new SupplierImpact(
                string(r.get("supplier_id")),
                string(r.get("supplier_name")),
                r.get("products").asList(Value::asString)))
            .stream()
            .findFirst();
    }

    @Override
    public List<SupplierNode> suppliersOf(String productId) {
        return read("suppliers of product", """
            MATCH (s:Supplier)-[:SUPPLIES]->(:Product {product_id: $product_id})
            RETURN %s
            ORDER BY supplier_id
            """.formatted(SUPPLIER_FIELDS), Map.of("product_id", productId), Neo4jGraphStore::supplier);
    }

    @Override
    public List<SupplierNode> alternativeSuppliers(String productId, int limit) {
        return read("alternative suppliers", """
            MATCH (s:Supplier)
            WHERE NOT (s)-[:SUPPLIES]->(:Product {product_id: $product_id})
            RETURN %s
            ORDER BY coalesce(s.rating, -1.0) DESC, coalesce(s.lead_time, 1.0e9) ASC, supplier_id
            LIMIT $limit
            """.formatted(SUPPLIER_FIELDS), Map.of("product_id", productId, "limit", limit),
            Neo4jGraphStore::supplier);
    }

    @Override
    public List<SupplierNode> suppliersByLeadTime() {
        return read("suppliers by lead time", """
            MATCH (s:Supplier)
            RETURN %s
            ORDER BY coalesce(s.lead_time, -1.0) DESC, supplier_id
            """.formatted(SUPPLIER_FIELDS), Map.of(), Neo4jGraphStore::supplier);
    }

    @Override
    public GraphStats stats() {
        return read("stats", """
            OPTIONAL MATCH (s:Supplier)
            WITH count(s) AS suppliers
            OPTIONAL MATCH (p:Product)
            WITH suppliers, count(p) AS products
            OPTIONAL MATCH (:Supplier)-[r:SUPPLIES]->(:Product)
            RETURN suppliers, products, count(r) AS relationships
            """, Map.of(), r -> new GraphStats(
                r.get("suppliers").asLong(),
                r.get("products").asLong(),
                r.get("relationships").asLong()))
            .stream()
            .findFirst()
            .orElse(new GraphStats(0, 0, 0));
    }

    @Override
    public void clear() {
        write("clear", "MATCH (n) DETACH DELETE n", Map.of());
    }

    private void write(String operation, String cypher, Map<String, Object> params) {
        try (Session session = driver.session(sessionConfig)) {
            session.executeWrite(tx -> tx.run(cypher, params).consume());
        } catch (Neo4jException e) {
            throw unavailable(operation, e);
        }
    }

    private void ensureIndexes() {
        INDEXES.forEach(index -> write("create index", index, Map.of()));
    }

    private <T> List<T> read(String operation, String cypher, Map<String, Object> params,
                             Function<Record, T> mapper) {
        try (Session session = driver.session(sessionConfig)) {
            return session.executeRead(tx -> tx.run(cypher, params).list(mapper::apply));
        } catch (Neo4jException e) {
            throw unavailable(operation, e);
        }
    }

    private static GraphStoreUnavailableException unavailable(String operation, Neo4jException e) {
        log.warn("Graph store failure | {} | {}", operation, e.getMessage());
        return new GraphStoreUnavailableException("Graph store unavailable (" + operation + "): " + e.getMessage(), e);
    }

    private static SupplierNode supplier(Record r) {
        return new SupplierNode(
            string(r.get("supplier_id")),
            string(r.get("supplier_name")),
            number(r.get("lead_time")),
            number(r.get("rating")),
            number(r.get("otd_rate")),
            string(r.get("country")));
    }

    private static String string(Value value) {
        return value == null || value.isNull() ? null : value.asString();
    }

    private static Double number(Value value) {
        return value == null || value.isNull() ? null : value.asDouble();
    }
}
