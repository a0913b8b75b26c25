package com.tablebooking.reservation.api.controller;

import com.tablebooking.common.dto.BaseResponse;
import com.tablebooking.common.util.Constants;
import com.tablebooking.reservation.api.dto.TableResponse;
import com.tablebooking.reservation.domain.service.TableCatalogService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping(Constants.TABLES_PATH)
@RequiredArgsConstructor
public class TableController {

    private final TableCatalogService catalogService;

    @GetMapping
    public ResponseEntity<BaseResponse<List<TableResponse>>> listTables() {
        List<TableResponse> tables = catalogService.listTables().stream()
                .map(TableResponse::from)
                .toList();
        return ResponseEntity.ok(BaseResponse.success(tables));
    }
}
