package com.civicbiz.catalog.ingest.dedup;

import com.civicbiz.catalog.ingest.TestBusinesses;
import com.civicbiz.catalog.ingest.model.DuplicateGroup;
import com.civicbiz.catalog.ingest.persistence.CatalogJdbcRepository;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.SpyBean;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;

/** Runs outside a test transaction so the merge commits or rolls back on its own. */
@SpringBootTest
@ActiveProfiles("test")
class DuplicateMergeRollbackTest {

    @Autowired
    private DuplicateMergeService mergeService;

    @SpyBean
    private CatalogJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    private final List<Long> created = new ArrayList<>();

    @AfterEach
    void cleanUp() {
        for (long id : created) {
            MapSqlParameterSource params = new MapSqlParameterSource("id", id);
            jdbc.update("DELETE FROM business_media WHERE business_id = :id", params);
            jdbc.update("DELETE FROM businesses WHERE id = :id", params);
        }
    }

    @Test
    void failedDeleteLeavesEveryMemberAndReferenceInPlace() {
        long keep = insert("Hawkeye Hardware", "500 Grand Ave");
        long second = insert("Hawkeye Hardware Inc", "500 Grand Ave");
        long third = insert("Hawkeye Hardware Store", "500 Grand Avenue");
        jdbc.update(
            "INSERT INTO business_media (business_id, media_type, url) VALUES (:id, 'logo', 'https://img.example/h.png')",
            new MapSqlParameterSource("id", second)
        );
        DuplicateGroup group = mergeService.groupOf(keep, List.of(second, third));
        doThrow(new DataAccessResourceFailureException("connection reset")).when(repository).deleteBusiness(third);

        assertThatThrownBy(() -> mergeService.merge(group, keep))
            .isInstanceOf(DataAccessResourceFailureException.class);

        assertThat(repository.existsAll(List.of(keep, second, third))).isTrue();
        assertThat(mediaCount(second)).isEqualTo(1);
        assertThat(mediaCount(keep)).isZero();
    }

    private long insert(String name, String address) {
        long id = repository.upsert(TestBusinesses.located(null, name, address, "Rollback City", "IA"));
        created.add(id);
        return id;
    }

    private int mediaCount(long businessId) {
        Integer count = jdbc.queryForObject(
            "SELECT COUNT(*) FROM business_media WHERE business_id = :id",
            new MapSqlParameterSource("id", businessId),
            Integer.class
        );
        return count == null ? 0 : count;
    }
}
