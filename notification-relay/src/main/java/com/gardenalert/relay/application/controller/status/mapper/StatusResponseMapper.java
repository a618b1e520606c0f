package com.gardenalert.relay.application.controller.status.mapper;

import com.gardenalert.relay.application.controller.admin.mapper.CycleReportResponseMapper;
import com.gardenalert.relay.application.controller.status.StatusResponse;
import com.gardenalert.relay.application.service.RelayStatus;
import org.mapstruct.Mapper;

@Mapper(componentModel = "spring", uses = CycleReportResponseMapper.class)
public interface StatusResponseMapper {

    StatusResponse toResponse(RelayStatus status);
}
