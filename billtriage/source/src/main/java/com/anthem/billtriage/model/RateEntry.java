package com.anthem.billtriage.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * One individual-mode rate line.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RateEntry {

    @JsonAlias("cpt_code")
    private String procedureCode;

    private BigDecimal rate;

    private String modifier;
}
