package com.civicbiz.catalog.ingest.dedup;

import com.civicbiz.catalog.ingest.TestBusinesses;
import com.civicbiz.catalog.ingest.model.DuplicateGroup;
import com.civicbiz.catalog.ingest.persistence.CatalogJdbcRepository;
import com.civicbiz.catalog.ingest.service.BusinessNotFoundException;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class DuplicateMergeServiceTest {

    @Autowired
    private DuplicateMergeService mergeService;

    @Autowired
    private CatalogJdbcRepository repository;

    @Autowired
    private NamedParameterJdbcTemplate jdbc;

    @Test
    void groupIsRebuiltAroundTheRepresentative() {
        String city = uniqueCity();
        long first = insert("Joe's Coffee", "123 Main Street", city);
        long second = insert("Joes Coffee", "123 Main St", city);

        DuplicateGroup group = mergeService.groupOf(first, List.of(first, second));

        assertThat(group.representativeId()).isEqualTo(first);
        assertThat(group.memberIds()).containsExactly(first, second);
        assertThat(group.members().get(0).similarityScore()).isEqualTo(1.0);
        assertThat(group.confidence()).isGreaterThan(0.85);
    }

    @Test
    void mergeMovesDependentsAndDeletesTheOtherMembers() {
        String city = uniqueCity();
        long keep = insert("Joe's Coffee", "123 Main Street", city);
        long second = insert("Joes Coffee", "123 Main St", city);
        long third = insert("Joe's Coffee Shop", "123 Main St", city);
        insertMedia(second);
        insertMedia(third);
        insertMedia(third);

        DuplicateMergeService.MergeResult result =
            mergeService.merge(mergeService.groupOf(keep, List.of(second, third)), keep);

        assertThat(result.keptId()).isEqualTo(keep);
        assertThat(result.removedIds()).containsExactly(second, third);
        assertThat(result.movedRows()).isEqualTo(3);
        assertThat(repository.findById(second)).isEmpty();
        assertThat(repository.findById(third)).isEmpty();
        assertThat(mediaCount(keep)).isEqualTo(3);
    }

    @Test
    void keepIdMustBelongToTheGroup() {
        String city = uniqueCity();
        long first = insert("Joe's Coffee", "123 Main Street", city);
        long second = insert("Joes Coffee", "123 Main St", city);
        DuplicateGroup group = mergeService.groupOf(first, List.of(second));

        assertThatThrownBy(() -> mergeService.merge(group, 424242L))
            .isInstanceOf(IllegalArgumentException.class);
        assertThat(repository.existsAll(List.of(first, second))).isTrue();
    }

    @Test
    void vanishedMemberAbortsTheMerge() {
        String city = uniqueCity();
        long first = insert("Joe's Coffee", "123 Main Street", city);
        long second = insert("Joes Coffee", "123 Main St", city);
        DuplicateGroup group = mergeService.groupOf(first, List.of(second));
        repository.deleteBusiness(second);

        assertThatThrownBy(() -> mergeService.merge(group, first))
            .isInstanceOf(BusinessNotFoundException.class);
        assertThatThrownBy(() -> mergeService.groupOf(first, List.of(second)))
            .isInstanceOf(BusinessNotFoundException.class)
            .hasMessageContaining(String.valueOf(second));
    }

    private long insert(String name, String address, String city) {
        return repository.upsert(TestBusinesses.located(null, name, address, city, "IA"));
    }

    private void insertMedia(long businessId) {
        jdbc.update(
            "INSERT INTO business_media (business_id, media_type, url) VALUES (:id, 'photo', 'https://img.example/a.jpg')",
            new MapSqlParameterSource("id", businessId)
        );
    }

    private static String uniqueCity() {
        return "Mergetown " + UUID.randomUUID().toString().substring(0, 8);
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
