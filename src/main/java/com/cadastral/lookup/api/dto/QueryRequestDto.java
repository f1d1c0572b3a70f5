package com.cadastral.lookup.api.dto;

import com.cadastral.lookup.api.validation.ValidCadastralNumber;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.math.BigDecimal;

/**
 * Body of POST /query. Coordinates are optional and independent of each other.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequestDto {

    @JsonProperty("cadastralNumber")
    @NotNull(message = "Cadastral number is required")
    @Size(min = 15, max = 25, message = "Cadastral number must be between 15 and 25 characters")
    @ValidCadastralNumber
    private String cadastralNumber;

    @JsonProperty("latitude")
    @DecimalMin(value = "-90", inclusive = false, message = "Latitude must be between -90 and 90")
    @DecimalMax(value = "90", inclusive = false, message = "Latitude must be between -90 and 90")
    @Digits(integer = 2, fraction = 6, message = "Latitude allows at most 8 digits, 6 of them decimal")
    private BigDecimal latitude;

    @JsonProperty("longitude")
    @DecimalMin(value = "-180", inclusive = false, message = "Longitude must be between -180 and 180")
    @DecimalMax(value = "180", inclusive = false, message = "Longitude must be between -180 and 180")
    @Digits(integer = 3, fraction = 6, message = "Longitude allows at most 9 digits, 6 of them decimal")
    private BigDecimal longitude;

    public QueryRequestDto(String cadastralNumber) {
        this.cadastralNumber = cadastralNumber;
    }
}
