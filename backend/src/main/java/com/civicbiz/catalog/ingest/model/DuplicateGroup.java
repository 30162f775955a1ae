package com.civicbiz.catalog.ingest.model;

import java.util.List;

public record DuplicateGroup(List<DuplicateMember> members, long representativeId, double confidence) {

    public DuplicateGroup {
        members = members == null ? List.of() : List.copyOf(members);
    }

    public boolean contains(long businessId) {
        return members.stream().anyMatch(member -> member.id() == businessId);
    }

    public List<Long> memberIds() {
        return members.stream().map(DuplicateMember::id).toList();
    }
}
