package com.baykanat.health.store.domain.mapper;

import com.baykanat.health.store.api.dto.HealthDataRequest;
import com.baykanat.health.store.domain.model.HealthRecord;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

/** HealthDataRequest → HealthRecord; processed_at yazım anında EventWriter'da atanır. */
@Mapper(componentModel = "spring")
public interface HealthRecordMapper {

    @Mapping(target = "processedAt", ignore = true)
    HealthRecord toRecord(HealthDataRequest request);
}
