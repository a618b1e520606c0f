package com.gardenalert.relay.application.controller.status;

import com.gardenalert.relay.application.controller.status.mapper.StatusResponseMapper;
import com.gardenalert.relay.application.service.RelayQueryHandler;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/status")
@RequiredArgsConstructor
public class StatusController {

    private final RelayQueryHandler queryHandler;
    private final StatusResponseMapper mapper;

    @GetMapping
    public StatusResponse status() {
        return mapper.toResponse(queryHandler.status());
    }
}
