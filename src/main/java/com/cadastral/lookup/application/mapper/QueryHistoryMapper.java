package com.cadastral.lookup.application.mapper;

import com.cadastral.lookup.api.dto.QueryHistoryResponseDto;
import com.cadastral.lookup.domain.model.QueryHistory;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Maps persisted entities to response DTOs.
 */
@Component
public class QueryHistoryMapper {

    public QueryHistoryResponseDto toDto(QueryHistory queryHistory) {
        return new QueryHistoryResponseDto(
                queryHistory.getId(),
                queryHistory.getCadastralNumber(),
                queryHistory.getLatitude(),
                queryHistory.getLongitude(),
                queryHistory.isResult(),
                queryHistory.getCreatedAt());
    }

    public List<QueryHistoryResponseDto> toDtoList(List<QueryHistory> records) {
        return records.stream()
                .map(this::toDto)
                .toList();
    }
}
