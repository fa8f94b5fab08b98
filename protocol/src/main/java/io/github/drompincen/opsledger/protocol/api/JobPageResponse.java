package io.github.drompincen.opsledger.protocol.api;

import java.util.List;

public record JobPageResponse(
        List<JobExecutionDto> jobs,
        long total,
        int page,
        int pageSize,
        int totalPages
) {}
