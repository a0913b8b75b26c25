package com.tablebooking.reservation.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * Tables to seed into an empty catalog, bound from {@code reservation.catalog.*}.
 */
@Validated
@ConfigurationProperties(prefix = "reservation.catalog")
public record CatalogProperties(@Valid List<TableSpec> tables) {

    public CatalogProperties {
        tables = tables == null ? List.of() : List.copyOf(tables);
    }

    public record TableSpec(
            @Positive int number,
            @Positive int capacity
    ) {}
}
