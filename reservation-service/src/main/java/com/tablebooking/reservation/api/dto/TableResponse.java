package com.tablebooking.reservation.api.dto;

import com.tablebooking.reservation.domain.model.DiningTable;

public record TableResponse(Long id, Integer number, Integer capacity) {

    public static TableResponse from(DiningTable table) {
        return new TableResponse(table.getId(), table.getNumber(), table.getCapacity());
    }
}
