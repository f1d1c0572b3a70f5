package com.cadastral.lookup.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;
import java.time.OffsetDateTime;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class QueryHistoryResponseDto {

    @JsonProperty("id")
    private Long id;

    @JsonProperty("cadastralNumber")
    private String cadastralNumber;

    @JsonProperty("latitude")
    private BigDecimal latitude;

    @JsonProperty("longitude")
    private BigDecimal longitude;

    @JsonProperty("result")
    private Boolean result;

    @JsonProperty("createdAt")
    private OffsetDateTime createdAt;
}
