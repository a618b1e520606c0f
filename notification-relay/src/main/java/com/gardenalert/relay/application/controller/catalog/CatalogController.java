package com.gardenalert.relay.application.controller.catalog;

import com.gardenalert.relay.application.controller.catalog.mapper.CatalogResponseMapper;
import com.gardenalert.relay.application.service.RelayQueryHandler;
import java.util.List;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class CatalogController {

    private final RelayQueryHandler queryHandler;
    private final CatalogResponseMapper mapper;

    @GetMapping("/catalog")
    public List<CatalogItemResponse> catalog() {
        return queryHandler.catalog().entrySet().stream()
                .map(entry -> mapper.toResponse(entry.getKey(), entry.getValue()))
                .toList();
    }

    @GetMapping("/weather")
    public List<WeatherResponse> weather() {
        return queryHandler.weather().stream()
                .map(mapper::toResponse)
                .toList();
    }
}
