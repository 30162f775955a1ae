package com.civicbiz.catalog.ingest.dedup;

import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.DuplicateGroup;
import com.civicbiz.catalog.ingest.model.DuplicateMember;
import com.civicbiz.catalog.ingest.persistence.CatalogJdbcRepository;
import com.civicbiz.catalog.ingest.service.BusinessNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Folds a duplicate group into one surviving business. Every dependent row is moved to the
 * survivor before the other members are deleted, all in one transaction.
 */
@Service
public class DuplicateMergeService {
    private static final Logger log = LoggerFactory.getLogger(DuplicateMergeService.class);

    private final CatalogJdbcRepository repository;
    private final DeduplicationEngine deduplicationEngine;

    public DuplicateMergeService(CatalogJdbcRepository repository, DeduplicationEngine deduplicationEngine) {
        this.repository = repository;
        this.deduplicationEngine = deduplicationEngine;
    }

    /** Rebuilds a group from stored businesses, scoring each member against the representative. */
    public DuplicateGroup groupOf(long representativeId, List<Long> memberIds) {
        BusinessRecord representative = load(representativeId);
        List<DuplicateMember> members = new ArrayList<>();
        members.add(new DuplicateMember(
            representativeId, representative.name(), representative.address(), representative.category(), 1.0));
        double confidence = 0.0;
        LinkedHashSet<Long> others = new LinkedHashSet<>(memberIds == null ? List.of() : memberIds);
        others.remove(representativeId);
        for (long memberId : others) {
            BusinessRecord member = load(memberId);
            double score = deduplicationEngine.similarity(representative, member);
            members.add(new DuplicateMember(memberId, member.name(), member.address(), member.category(), score));
            confidence = Math.max(confidence, score);
        }
        return new DuplicateGroup(members, representativeId, confidence);
    }

    @Transactional
    public MergeResult merge(DuplicateGroup group, long keepId) {
        if (group == null || !group.contains(keepId)) {
            throw new IllegalArgumentException("Business " + keepId + " is not a member of the duplicate group");
        }
        if (!repository.existsAll(group.memberIds())) {
            throw new BusinessNotFoundException("Duplicate group references a business that no longer exists");
        }
        List<Long> removed = new ArrayList<>();
        int movedRows = 0;
        for (long memberId : group.memberIds()) {
            if (memberId == keepId) {
                continue;
            }
            Map<String, Integer> moved = repository.repointReferences(memberId, keepId);
            movedRows += moved.values().stream().mapToInt(Integer::intValue).sum();
            if (repository.deleteBusiness(memberId) != 1) {
                throw new IllegalStateException("Failed to delete merged business " + memberId);
            }
            removed.add(memberId);
        }
        log.info("Merged businesses {} into {} (moved {} dependent rows)", removed, keepId, movedRows);
        return new MergeResult(keepId, removed, movedRows);
    }

    private BusinessRecord load(long businessId) {
        return repository.findById(businessId)
            .orElseThrow(() -> new BusinessNotFoundException("Business " + businessId + " not found"));
    }

    public record MergeResult(long keptId, List<Long> removedIds, int movedRows) {
    }
}
