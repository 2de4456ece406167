package com.purchasingpower.brain.knowledge.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.brain.configuration.Neo4jProperties;
import com.purchasingpower.brain.core.GraphEdge;
import com.purchasingpower.brain.core.GraphEntity;
import com.purchasingpower.brain.core.TenantScope;
import com.purchasingpower.brain.exception.BrainException;
import com.purchasingpower.brain.knowledge.EdgeFilter;
import com.purchasingpower.brain.knowledge.EntityFilter;
import com.purchasingpower.brain.knowledge.GraphStore;
import com.purchasingpower.brain.util.CallContext;
import com.purchasingpower.brain.util.ExternalCallLogger;
import com.purchasingpower.brain.util.ServiceType;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.neo4j.driver.AuthTokens;
import org.neo4j.driver.Driver;
import org.neo4j.driver.GraphDatabase;
import org.neo4j.driver.Record;
import org.neo4j.driver.Session;
import org.neo4j.driver.SessionConfig;
import org.neo4j.driver.Value;
import org.neo4j.driver.types.Node;
import org.neo4j.driver.types.Relationship;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Neo4j implementation of GraphStore.
 *
 * <p>Entities are {@code :Entity} nodes; edges are {@code :RELATES}
 * relationships carrying their type in {@code edgeType}, since Cypher cannot
 * parameterize relationship types. Open property bags are stored as JSON
 * strings because Neo4j properties cannot hold nested maps.
 *
 * @since 2.0.0
 */
@Slf4j
public class Neo4jGraphStore implements GraphStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final String TENANT_CLAUSE = "(%1$s.tenantId = $tenantId OR %1$s.tenantId IS NULL)";

    private final Neo4jProperties properties;
    private final ObjectMapper objectMapper;
    private Driver driver;

    public Neo4jGraphStore(Neo4jProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        log.info("Initializing Neo4j GraphStore at: {}", properties.getUri());
        driver = GraphDatabase.driver(properties.getUri(),
                AuthTokens.basic(properties.getUsername(), properties.getPassword()));
        createIndexes();
    }

    @PreDestroy
    public void close() {
        if (driver != null) {
            driver.close();
            log.info("Neo4j GraphStore connection closed");
        }
    }

    private void createIndexes() {
        try (Session session = openSession()) {
            session.run("CREATE INDEX entity_id IF NOT EXISTS FOR (e:Entity) ON (e.id)");
            session.run("CREATE INDEX entity_tenant_type IF NOT EXISTS FOR (e:Entity) ON (e.tenantId, e.entityType)");
            session.run("CREATE INDEX relates_type IF NOT EXISTS FOR ()-[r:RELATES]-() ON (r.edgeType)");
            log.info("✅ Neo4j property indexes created");
        } catch (Exception e) {
            log.warn("⚠️  Failed to create indexes: {}", e.getMessage());
        }
    }

    @Override
    public Optional<GraphEntity> getEntity(String id, TenantScope scope) {
        String cypher = "MATCH (e:Entity {id: $id}) WHERE " + TENANT_CLAUSE.formatted("e") + " RETURN e";
        List<GraphEntity> found = read("GetEntity", cypher,
                createParams("id", id, "tenantId", scope.tenantId()),
                record -> toEntity(record.get("e").asNode()));
        return found.stream().findFirst();
    }

    @Override
    public Optional<String> findOwnerTenant(String id) {
        List<String> owners = read("FindOwnerTenant",
                "MATCH (e:Entity {id: $id}) WHERE e.tenantId IS NOT NULL RETURN e.tenantId AS tenantId",
                createParams("id", id),
                record -> record.get("tenantId").asString());
        return owners.stream().findFirst();
    }

    @Override
    public List<GraphEntity> listEntities(EntityFilter filter, TenantScope scope) {
        String cypher = """
                MATCH (e:Entity)
                WHERE %s AND (size($entityTypes) = 0 OR e.entityType IN $entityTypes)
                RETURN e
                ORDER BY e.id
                """.formatted(TENANT_CLAUSE.formatted("e"));
        return read("ListEntities", cypher,
                createParams("tenantId", scope.tenantId(), "entityTypes", filter.getEntityTypes()),
                record -> toEntity(record.get("e").asNode()));
    }

    @Override
    public List<GraphEdge> listEdges(EdgeFilter filter, TenantScope scope) {
        String cypher = """
                MATCH (s:Entity)-[r:RELATES]->(t:Entity)
                WHERE %s
                  AND (size($edgeTypes) = 0 OR r.edgeType IN $edgeTypes)
                  AND ($sourceId IS NULL OR s.id = $sourceId)
                  AND ($targetId IS NULL OR t.id = $targetId)
                RETURN r, s.id AS sourceId, t.id AS targetId
                ORDER BY r.id
                LIMIT $limit
                """.formatted(TENANT_CLAUSE.formatted("r"));
        long limit = filter.getLimit() == null ? Long.MAX_VALUE : Math.max(0, filter.getLimit());
        return read("ListEdges", cypher,
                createParams("tenantId", scope.tenantId(),
                        "edgeTypes", filter.getEdgeTypes(),
                        "sourceId", filter.getSourceEntityId(),
                        "targetId", filter.getTargetEntityId(),
                        "limit", limit),
                record -> toEdge(record.get("r").asRelationship(),
                        record.get("sourceId").asString(), record.get("targetId").asString()));
    }

    @Override
    public void upsertEntity(GraphEntity entity) {
        String cypher = """
                MERGE (e:Entity {id: $id})
                SET e.entityType = $entityType,
                    e.displayName = $displayName,
                    e.canonicalPath = $canonicalPath,
                    e.tenantId = $tenantId,
                    e.projectId = $projectId,
                    e.properties = $properties,
                    e.createdAt = $createdAt,
                    e.updatedAt = $updatedAt
                """;
        write("UpsertEntity", cypher, createParams(
                "id", entity.getId(),
                "entityType", entity.getEntityType(),
                "displayName", entity.getDisplayName(),
                "canonicalPath", entity.getCanonicalPath(),
                "tenantId", entity.getTenantId(),
                "projectId", entity.getProjectId(),
                "properties", toJson(entity.getProperties()),
                "createdAt", instantText(entity.getCreatedAt()),
                "updatedAt", instantText(entity.getUpdatedAt())));
    }

    @Override
    public void upsertEdge(GraphEdge edge) {
        String cypher = """
                MATCH (s:Entity {id: $sourceId}), (t:Entity {id: $targetId})
                MERGE (s)-[r:RELATES {edgeType: $edgeType}]->(t)
                ON CREATE SET r.id = coalesce($id, $logicalKey)
                SET r.tenantId = $tenantId,
                    r.projectId = $projectId,
                    r.metadata = $metadata
                RETURN count(r) AS written
                """;
        List<Long> written = executeWrite("UpsertEdge", cypher, createParams(
                "sourceId", edge.getSourceEntityId(),
                "targetId", edge.getTargetEntityId(),
                "edgeType", edge.getEdgeType(),
                "id", edge.getId(),
                "logicalKey", edge.logicalKey(),
                "tenantId", edge.getTenantId(),
                "projectId", edge.getProjectId(),
                "metadata", toJson(edge.getMetadata())),
                record -> record.get("written").asLong());
        if (written.isEmpty() || written.get(0) == 0) {
            log.warn("⚠️  Edge {} not written: endpoint missing", edge.logicalKey());
        }
    }

    private <T> List<T> read(String operation, String cypher, Map<String, Object> params, Function<Record, T> mapper) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, operation, log);
        ctx.logRequest("Cypher read", "Params", ExternalCallLogger.formatMap(params));
        try (Session session = openSession()) {
            List<T> rows = session.executeRead(tx -> tx.run(cypher, params).list(mapper::apply));
            ctx.logResponse("Rows returned", "Count", rows.size());
            return rows;
        } catch (RuntimeException e) {
            ctx.logError(operation + " failed", e);
            throw e;
        }
    }

    private void write(String operation, String cypher, Map<String, Object> params) {
        executeWrite(operation, cypher, params, record -> null);
    }

    private <T> List<T> executeWrite(String operation, String cypher, Map<String, Object> params,
                                     Function<Record, T> mapper) {
        CallContext ctx = ExternalCallLogger.startCall(ServiceType.NEO4J, operation, log);
        ctx.logRequest("Cypher write", "Params", ExternalCallLogger.formatMap(params));
        try (Session session = openSession()) {
            List<T> rows = session.executeWrite(tx -> tx.run(cypher, params).list(mapper::apply));
            ctx.logResponse("Write committed");
            return rows;
        } catch (RuntimeException e) {
            ctx.logError(operation + " failed", e);
            throw e;
        }
    }

    private Session openSession() {
        String database = properties.getDatabase();
        return database == null || database.isBlank()
                ? driver.session()
                : driver.session(SessionConfig.forDatabase(database));
    }

    private GraphEntity toEntity(Node node) {
        return GraphEntity.builder()
                .id(node.get("id").asString())
                .entityType(stringOrNull(node.get("entityType")))
                .displayName(stringOrNull(node.get("displayName")))
                .canonicalPath(stringOrNull(node.get("canonicalPath")))
                .tenantId(stringOrNull(node.get("tenantId")))
                .projectId(stringOrNull(node.get("projectId")))
                .properties(fromJson(stringOrNull(node.get("properties"))))
                .createdAt(parseInstant(stringOrNull(node.get("createdAt"))))
                .updatedAt(parseInstant(stringOrNull(node.get("updatedAt"))))
                .build();
    }

    private GraphEdge toEdge(Relationship relationship, String sourceId, String targetId) {
        return GraphEdge.builder()
                .id(stringOrNull(relationship.get("id")))
                .edgeType(stringOrNull(relationship.get("edgeType")))
                .sourceEntityId(sourceId)
                .targetEntityId(targetId)
                .tenantId(stringOrNull(relationship.get("tenantId")))
                .projectId(stringOrNull(relationship.get("projectId")))
                .metadata(fromJson(stringOrNull(relationship.get("metadata"))))
                .build();
    }

    private String toJson(Map<String, Object> values) {
        try {
            return objectMapper.writeValueAsString(values == null ? Map.of() : values);
        } catch (JsonProcessingException e) {
            throw new BrainException("Failed to serialize graph properties", e);
        }
    }

    private Map<String, Object> fromJson(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException e) {
            throw new BrainException("Stored graph properties are not valid JSON", e);
        }
    }

    private static String stringOrNull(Value value) {
        return value == null || value.isNull() ? null : value.asString();
    }

    private static String instantText(Instant instant) {
        return instant == null ? null : instant.toString();
    }

    private static Instant parseInstant(String text) {
        return text == null ? null : Instant.parse(text);
    }

    private static Map<String, Object> createParams(Object... keyValues) {
        Map<String, Object> params = new HashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            params.put((String) keyValues[i], keyValues[i + 1]);
        }
        return params;
    }
}
