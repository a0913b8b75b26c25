package com.tablebooking.reservation.config;

import com.tablebooking.reservation.domain.service.TableCatalogService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Seeds the catalog from configuration on first start.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CatalogInitializer implements CommandLineRunner {

    private final CatalogProperties catalogProperties;
    private final TableCatalogService catalogService;

    @Override
    public void run(String... args) {
        int inserted = catalogService.seedIfEmpty(catalogProperties.tables());
        if (inserted == 0) {
            log.debug("Table catalog left unchanged ({} configured tables)", catalogProperties.tables().size());
        }
    }
}
