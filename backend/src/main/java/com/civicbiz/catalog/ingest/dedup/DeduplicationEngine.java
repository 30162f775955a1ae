package com.civicbiz.catalog.ingest.dedup;

import com.civicbiz.catalog.config.PipelineProperties;
import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.DuplicateGroup;
import com.civicbiz.catalog.ingest.model.DuplicateMember;
import com.civicbiz.catalog.ingest.util.TextNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Groups catalog records that look like the same business. Grouping is greedy: each record
 * joins the first earlier record it matches and is never reconsidered, so the result depends on
 * catalog order when matches are not transitive.
 */
@Component
public class DeduplicationEngine {
    private static final Logger log = LoggerFactory.getLogger(DeduplicationEngine.class);

    static final double NAME_WEIGHT = 0.6;
    static final double ADDRESS_WEIGHT = 0.3;
    static final double CATEGORY_WEIGHT = 0.1;

    private final double defaultThreshold;

    @Autowired
    public DeduplicationEngine(PipelineProperties properties) {
        this(properties.getDedup().getThreshold());
    }

    DeduplicationEngine(double defaultThreshold) {
        this.defaultThreshold = defaultThreshold;
    }

    public double defaultThreshold() {
        return defaultThreshold;
    }

    public List<DuplicateGroup> findDuplicateGroups(List<BusinessRecord> catalog) {
        return findDuplicateGroups(catalog, defaultThreshold);
    }

    public List<DuplicateGroup> findDuplicateGroups(List<BusinessRecord> catalog, double threshold) {
        List<BusinessRecord> records = new ArrayList<>(catalog.size());
        for (BusinessRecord record : catalog) {
            if (record.id() == null) {
                log.debug("Skipping unsaved record {} in duplicate scan", record.name());
                continue;
            }
            records.add(record);
        }

        boolean[] assigned = new boolean[records.size()];
        List<DuplicateGroup> groups = new ArrayList<>();
        for (int i = 0; i < records.size(); i++) {
            if (assigned[i]) {
                continue;
            }
            BusinessRecord representative = records.get(i);
            List<DuplicateMember> members = new ArrayList<>();
            double confidence = 0.0;
            for (int j = i + 1; j < records.size(); j++) {
                if (assigned[j]) {
                    continue;
                }
                double score = similarity(representative, records.get(j));
                if (score >= threshold) {
                    assigned[j] = true;
                    members.add(member(records.get(j), score));
                    confidence = Math.max(confidence, score);
                }
            }
            if (members.isEmpty()) {
                continue;
            }
            assigned[i] = true;
            members.add(0, member(representative, 1.0));
            groups.add(new DuplicateGroup(members, representative.id(), confidence));
        }
        log.info("Duplicate scan over {} records found {} groups at threshold {}", records.size(), groups.size(),
            threshold);
        return groups;
    }

    public double similarity(BusinessRecord first, BusinessRecord second) {
        double name = nameSimilarity(first.name(), second.name());
        double address = addressSimilarity(first.address(), second.address());
        double category = categorySimilarity(first.category(), second.category());
        return NAME_WEIGHT * name + ADDRESS_WEIGHT * address + CATEGORY_WEIGHT * category;
    }

    public static double nameSimilarity(String first, String second) {
        return JaroSimilarity.similarity(TextNormalizer.forComparison(first), TextNormalizer.forComparison(second));
    }

    static double addressSimilarity(String first, String second) {
        if (first == null || first.isBlank() || second == null || second.isBlank()) {
            return 0.0;
        }
        return JaroSimilarity.similarity(TextNormalizer.forComparison(first), TextNormalizer.forComparison(second));
    }

    static double categorySimilarity(String first, String second) {
        if (first == null || second == null) {
            return 0.0;
        }
        return first.trim().toLowerCase(Locale.ROOT).equals(second.trim().toLowerCase(Locale.ROOT)) ? 1.0 : 0.0;
    }

    private static DuplicateMember member(BusinessRecord record, double score) {
        return new DuplicateMember(record.id(), record.name(), record.address(), record.category(), score);
    }
}
