package com.cadastral.lookup.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Body returned by the built-in resolver endpoint.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class ResolverResultDto {

    @JsonProperty("result")
    private Boolean result;
}
