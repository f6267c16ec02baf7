package net.unishelf.controller.dto;

import java.util.List;

public record ResourceImportRequest(
    CandidatePayload resourceData,
    String accessLevel,
    List<String> departmentIds,
    List<String> courseIds
) {
}
