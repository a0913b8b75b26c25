package com.tablebooking.reservation.domain.service;

import com.tablebooking.reservation.config.CatalogProperties.TableSpec;
import com.tablebooking.reservation.domain.model.DiningTable;
import com.tablebooking.reservation.domain.repository.DiningTableRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Read-only view of the tables that can be booked, plus the one-time seeding of an empty catalog.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TableCatalogService {

    private final DiningTableRepository tableRepository;

    @Transactional(readOnly = true)
    public List<DiningTable> listTables() {
        return tableRepository.findAllByOrderByCapacityAscIdAsc();
    }

    /**
     * Inserts the given tables only when the catalog has none; an existing catalog is never touched.
     *
     * @return Number of tables inserted
     */
    @Transactional
    public int seedIfEmpty(List<TableSpec> tables) {
        if (tables.isEmpty() || tableRepository.count() > 0) {
            return 0;
        }
        Set<Integer> numbers = new HashSet<>();
        for (TableSpec spec : tables) {
            if (spec.capacity() < 1) {
                throw new IllegalArgumentException("Table " + spec.number() + " must seat at least one guest");
            }
            if (!numbers.add(spec.number())) {
                throw new IllegalArgumentException("Duplicate table number " + spec.number());
            }
        }
        List<DiningTable> rows = tables.stream()
                .map(spec -> DiningTable.builder()
                        .number(spec.number())
                        .capacity(spec.capacity())
                        .build())
                .toList();
        tableRepository.saveAll(rows);
        log.info("Seeded table catalog with {} tables", rows.size());
        return rows.size();
    }
}
