package com.civicbiz.catalog.ingest.persistence;

import com.civicbiz.catalog.ingest.model.BusinessRecord;
import com.civicbiz.catalog.ingest.model.CatalogFilter;

import java.util.List;

/** Where canonical business records end up. */
public interface CatalogSink {

    /** Updates the record with the given id when it exists, inserts otherwise. Returns the id. */
    long upsert(BusinessRecord record);

    List<BusinessRecord> query(CatalogFilter filter);
}
