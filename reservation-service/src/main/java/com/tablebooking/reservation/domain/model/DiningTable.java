package com.tablebooking.reservation.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * A table that can be allocated to a reservation.
 * Number and capacity never change once the table is in the catalog, so there are no setters.
 */
@Entity
@Table(name = "dining_tables", indexes = {
        @Index(name = "idx_dining_tables_capacity", columnList = "capacity,id")
})
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DiningTable {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_number", nullable = false, unique = true)
    private Integer number;

    @Column(name = "capacity", nullable = false)
    private Integer capacity;
}
