package net.unishelf.testutil;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import net.unishelf.domain.caller.CallerIdentity;
import net.unishelf.domain.caller.CallerRole;
import net.unishelf.domain.resource.AccessLevel;
import net.unishelf.domain.resource.CandidateRecord;
import net.unishelf.domain.resource.Resource;
import net.unishelf.domain.resource.ResourceDraft;
import net.unishelf.domain.resource.ResourceType;

/**
 * Fluent builder utilities for resource, candidate and caller test instances.
 */
public final class ResourceTestData {

    private ResourceTestData() {}

    public static ResourceBuilder aResource() {
        return new ResourceBuilder();
    }

    /** What the store would return for an inserted draft, with a fresh id and zeroed counters. */
    public static Resource fromDraft(ResourceDraft draft) {
        Instant now = Instant.now();
        return new Resource(UUID.randomUUID(), draft.title(), draft.description(), draft.resourceType(), draft.format(),
            draft.author(), draft.publisher(), draft.publicationYear(), draft.isbn(), draft.tags(),
            draft.departmentIds(), draft.courseIds(), draft.level(), draft.fileUrl(), draft.externalLink(),
            draft.thumbnail(), draft.uploaderId(), draft.accessLevel(), draft.approved(), false,
            0, 0, 0, 0.0, 0, draft.sourceName(), draft.sourceExternalId(), now, now);
    }

    public static CallerIdentity student(String userId) {
        return new CallerIdentity(userId, CallerRole.STUDENT, List.of(), List.of());
    }

    public static CallerIdentity lecturer(String userId) {
        return new CallerIdentity(userId, CallerRole.LECTURER, List.of(), List.of());
    }

    public static CallerIdentity admin(String userId) {
        return new CallerIdentity(userId, CallerRole.ADMIN, List.of(), List.of());
    }

    public static CandidateRecord candidate(String sourceName, String id, String title) {
        return new CandidateRecord(id, title, "", List.of("Author " + id), "2021-05-01",
            null, "https://example.com/preview/" + id, "https://example.com/info/" + id, sourceName, id);
    }

    public static List<CandidateRecord> candidates(String sourceName, int count) {
        List<CandidateRecord> result = new ArrayList<>();
        for (int i = 1; i <= count; i++) {
            result.add(candidate(sourceName, sourceName + "-" + i, "Title " + i));
        }
        return result;
    }

    public static class ResourceBuilder {
        private UUID id = UUID.randomUUID();
        private String title = "Computer Networks";
        private ResourceType type = ResourceType.DOCUMENT;
        private String format = "pdf";
        private List<String> tags = new ArrayList<>(List.of("networking"));
        private List<String> departmentIds = new ArrayList<>();
        private List<String> courseIds = new ArrayList<>();
        private String fileUrl = "https://files.example.com/networks.pdf";
        private String externalLink = null;
        private String uploaderId = "uploader-1";
        private AccessLevel accessLevel = AccessLevel.PUBLIC;
        private boolean approved = true;

        public ResourceBuilder id(UUID id) { this.id = id; return this; }
        public ResourceBuilder title(String title) { this.title = title; return this; }
        public ResourceBuilder type(ResourceType type) { this.type = type; return this; }
        public ResourceBuilder format(String format) { this.format = format; return this; }
        public ResourceBuilder tags(List<String> tags) { this.tags = new ArrayList<>(tags); return this; }
        public ResourceBuilder departmentIds(List<String> ids) { this.departmentIds = new ArrayList<>(ids); return this; }
        public ResourceBuilder courseIds(List<String> ids) { this.courseIds = new ArrayList<>(ids); return this; }
        public ResourceBuilder fileUrl(String fileUrl) { this.fileUrl = fileUrl; return this; }
        public ResourceBuilder externalLink(String externalLink) { this.externalLink = externalLink; return this; }
        public ResourceBuilder uploaderId(String uploaderId) { this.uploaderId = uploaderId; return this; }
        public ResourceBuilder accessLevel(AccessLevel accessLevel) { this.accessLevel = accessLevel; return this; }
        public ResourceBuilder approved(boolean approved) { this.approved = approved; return this; }

        public Resource build() {
            Instant now = Instant.parse("2024-03-01T10:00:00Z");
            return new Resource(id, title, "", type, format, "A. Author", null, 2020, null,
                tags, departmentIds, courseIds, 200, fileUrl, externalLink, null, uploaderId, accessLevel,
                approved, false, 0, 0, 0, 0.0, 0, null, null, now, now);
        }
    }
}
