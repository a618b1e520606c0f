package com.gardenalert.relay.application.controller.admin.mapper;

import com.gardenalert.relay.application.controller.admin.CycleReportResponse;
import com.gardenalert.relay.domain.relay.CycleReport;
import org.mapstruct.Mapper;
import org.mapstruct.Mapping;

@Mapper(componentModel = "spring")
public interface CycleReportResponseMapper {

    @Mapping(target = "sent", source = "dispatch.sent")
    @Mapping(target = "failed", source = "dispatch.failed")
    @Mapping(target = "suppressed", source = "dispatch.suppressed")
    @Mapping(target = "aborted", source = "dispatch.aborted")
    CycleReportResponse toResponse(CycleReport report);
}
