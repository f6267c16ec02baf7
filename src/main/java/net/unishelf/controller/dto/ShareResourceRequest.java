package net.unishelf.controller.dto;

import java.util.List;

public record ShareResourceRequest(String groupId, List<String> userIds, String message) {
}
