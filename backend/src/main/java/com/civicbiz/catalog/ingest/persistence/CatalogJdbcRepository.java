package com.civicbiz.catalog.ingest.persistence;

import com.civicbiz.catalog.alignment.AlignmentAxis;
import com.civicbiz.catalog.alignment.AlignmentVector;
import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.CatalogFilter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.support.GeneratedKeyHolder;
import org.springframework.jdbc.support.KeyHolder;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Repository
public class CatalogJdbcRepository implements CatalogSink {
    private static final Logger log = LoggerFactory.getLogger(CatalogJdbcRepository.class);

    // Tables whose rows hang off a business through business_id.
    static final List<String> BUSINESS_REFERENCE_TABLES = List.of(
        "business_media",
        "business_alignments",
        "donations",
        "business_tag_relations"
    );

    private static final String BUSINESS_COLUMNS = """
        id, name, description, category, address, city, state, zip_code, phone, email, website,
        latitude, longitude, rating, review_count, image_url, data_quality, source, is_active,
        created_at, updated_at
        """;

    private final NamedParameterJdbcTemplate jdbc;

    public CatalogJdbcRepository(NamedParameterJdbcTemplate jdbc) {
        this.jdbc = jdbc;
    }

    @Override
    public long upsert(BusinessRecord record) {
        if (record.id() != null && updateBusiness(record) > 0) {
            return record.id();
        }
        return insertBusiness(record);
    }

    @Override
    public List<BusinessRecord> query(CatalogFilter filter) {
        CatalogFilter safeFilter = filter == null ? CatalogFilter.activeCatalog() : filter;
        MapSqlParameterSource params = new MapSqlParameterSource();
        List<String> conditions = new ArrayList<>();
        if (safeFilter.activeOnly()) {
            conditions.add("is_active = TRUE");
        }
        if (safeFilter.state() != null && !safeFilter.state().isBlank()) {
            conditions.add("state = :state");
            params.addValue("state", safeFilter.state().trim());
        }
        if (safeFilter.city() != null && !safeFilter.city().isBlank()) {
            conditions.add("LOWER(city) = LOWER(:city)");
            params.addValue("city", safeFilter.city().trim());
        }
        StringBuilder sql = new StringBuilder("SELECT ").append(BUSINESS_COLUMNS).append(" FROM businesses");
        if (!conditions.isEmpty()) {
            sql.append(" WHERE ").append(String.join(" AND ", conditions));
        }
        sql.append(" ORDER BY id");
        if (safeFilter.limit() != null && safeFilter.limit() > 0) {
            sql.append(" LIMIT :limit");
            params.addValue("limit", safeFilter.limit());
        }
        return jdbc.query(sql.toString(), params, businessRowMapper());
    }

    public Optional<BusinessRecord> findById(long businessId) {
        List<BusinessRecord> rows = jdbc.query(
            "SELECT " + BUSINESS_COLUMNS + " FROM businesses WHERE id = :id",
            new MapSqlParameterSource("id", businessId),
            businessRowMapper()
        );
        return rows.stream().findFirst();
    }

    public boolean existsAll(List<Long> businessIds) {
        if (businessIds.isEmpty()) {
            return true;
        }
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM businesses WHERE id IN (:ids)",
            new MapSqlParameterSource("ids", businessIds),
            Integer.class
        );
        return count != null && count == businessIds.stream().distinct().count();
    }

    public Map<String, Integer> repointReferences(long fromBusinessId, long toBusinessId) {
        MapSqlParameterSource params = new MapSqlParameterSource()
            .addValue("fromId", fromBusinessId)
            .addValue("toId", toBusinessId);
        Map<String, Integer> moved = new LinkedHashMap<>();
        for (String table : BUSINESS_REFERENCE_TABLES) {
            int rows = jdbc.update(
                "UPDATE " + table + " SET business_id = :toId WHERE business_id = :fromId",
                params
            );
            moved.put(table, rows);
        }
        return moved;
    }

    public int deleteBusiness(long businessId) {
        return jdbc.update(
            "DELETE FROM businesses WHERE id = :id",
            new MapSqlParameterSource("id", businessId)
        );
    }

    int countReferences(String table, long businessId) {
        if (!BUSINESS_REFERENCE_TABLES.contains(table)) {
            throw new IllegalArgumentException("Not a business reference table: " + table);
        }
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM " + table + " WHERE business_id = :id",
            new MapSqlParameterSource("id", businessId),
            Integer.class
        );
        return count == null ? 0 : count;
    }

    public Optional<AlignmentVector> findBusinessAlignment(long businessId) {
        List<AlignmentVector> rows = jdbc.query(
            """
                SELECT liberal, conservative, libertarian, green, centrist
                FROM business_alignments
                WHERE business_id = :id
                ORDER BY id DESC
                LIMIT 1
                """,
            new MapSqlParameterSource("id", businessId),
            (rs, rowNum) -> readAlignment(rs)
        );
        return rows.stream().findFirst();
    }

    public Optional<AlignmentVector> findUserAlignment(long userId) {
        List<AlignmentVector> rows = jdbc.query(
            """
                SELECT liberal, conservative, libertarian, green, centrist
                FROM user_alignments
                WHERE user_id = :id
                """,
            new MapSqlParameterSource("id", userId),
            (rs, rowNum) -> readAlignment(rs)
        );
        return rows.stream().findFirst();
    }

    private long insertBusiness(BusinessRecord record) {
        MapSqlParameterSource params = businessParams(record);
        KeyHolder keyHolder = new GeneratedKeyHolder();
        jdbc.update(
            """
                INSERT INTO businesses (
                    name, description, category, address, city, state, zip_code, phone, email, website,
                    latitude, longitude, rating, review_count, image_url, data_quality, source, is_active,
                    created_at, updated_at
                )
                VALUES (
                    :name, :description, :category, :address, :city, :state, :zipCode, :phone, :email, :website,
                    :latitude, :longitude, :rating, :reviewCount, :imageUrl, :dataQuality, :source, :isActive,
                    :createdAt, :updatedAt
                )
                """,
            params,
            keyHolder,
            new String[]{"id"}
        );
        Number key = keyHolder.getKey();
        if (key == null) {
            throw new IllegalStateException("Failed to insert business " + record.name());
        }
        log.debug("Inserted business {} as {}", record.name(), key.longValue());
        return key.longValue();
    }

    private int updateBusiness(BusinessRecord record) {
        MapSqlParameterSource params = businessParams(record).addValue("id", record.id());
        return jdbc.update(
            """
                UPDATE businesses
                SET name = :name,
                    description = COALESCE(:description, description),
                    category = :category,
                    address = COALESCE(:address, address),
                    city = COALESCE(:city, city),
                    state = COALESCE(:state, state),
                    zip_code = COALESCE(:zipCode, zip_code),
                    phone = COALESCE(:phone, phone),
                    email = COALESCE(:email, email),
                    website = COALESCE(:website, website),
                    latitude = COALESCE(:latitude, latitude),
                    longitude = COALESCE(:longitude, longitude),
                    rating = COALESCE(:rating, rating),
                    review_count = COALESCE(:reviewCount, review_count),
                    image_url = COALESCE(:imageUrl, image_url),
                    data_quality = :dataQuality,
                    source = :source,
                    is_active = :isActive,
                    updated_at = :updatedAt
                WHERE id = :id
                """,
            params
        );
    }

    private MapSqlParameterSource businessParams(BusinessRecord record) {
        return new MapSqlParameterSource()
            .addValue("name", record.name())
            .addValue("description", record.description())
            .addValue("category", record.category())
            .addValue("address", record.address())
            .addValue("city", record.city())
            .addValue("state", record.state())
            .addValue("zipCode", record.zipCode())
            .addValue("phone", record.phone())
            .addValue("email", record.email())
            .addValue("website", record.website())
            .addValue("latitude", record.latitude(), Types.DOUBLE)
            .addValue("longitude", record.longitude(), Types.DOUBLE)
            .addValue("rating", record.rating(), Types.DOUBLE)
            .addValue("reviewCount", record.reviewCount(), Types.INTEGER)
            .addValue("imageUrl", record.imageUrl())
            .addValue("dataQuality", record.dataQuality())
            .addValue("source", record.source())
            .addValue("isActive", record.isActive())
            .addValue("createdAt", toTimestamp(record.createdAt() == null ? Instant.now() : record.createdAt()))
            .addValue("updatedAt", toTimestamp(record.updatedAt() == null ? Instant.now() : record.updatedAt()));
    }

    private RowMapper<BusinessRecord> businessRowMapper() {
        return (rs, rowNum) -> new BusinessRecord(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("description"),
            rs.getString("category"),
            rs.getString("address"),
            rs.getString("city"),
            rs.getString("state"),
            rs.getString("zip_code"),
            rs.getString("phone"),
            rs.getString("email"),
            rs.getString("website"),
            nullableDouble(rs, "latitude"),
            nullableDouble(rs, "longitude"),
            nullableDouble(rs, "rating"),
            nullableInt(rs, "review_count"),
            rs.getString("image_url"),
            rs.getInt("data_quality"),
            rs.getString("source"),
            toInstant(rs.getTimestamp("created_at")),
            toInstant(rs.getTimestamp("updated_at")),
            rs.getBoolean("is_active")
        );
    }

    private AlignmentVector readAlignment(ResultSet rs) throws SQLException {
        Map<AlignmentAxis, Double> weights = new EnumMap<>(AlignmentAxis.class);
        for (AlignmentAxis axis : AlignmentAxis.values()) {
            weights.put(axis, rs.getDouble(axis.key()));
        }
        return AlignmentVector.percent(weights);
    }

    private Double nullableDouble(ResultSet rs, String column) throws SQLException {
        double value = rs.getDouble(column);
        return rs.wasNull() ? null : value;
    }

    private Integer nullableInt(ResultSet rs, String column) throws SQLException {
        int value = rs.getInt(column);
        return rs.wasNull() ? null : value;
    }

    private Timestamp toTimestamp(Instant value) {
        return value == null ? null : Timestamp.from(value);
    }

    private Instant toInstant(Timestamp timestamp) {
        return timestamp == null ? null : timestamp.toInstant();
    }
}
