package net.unishelf.adapters.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import net.unishelf.adapters.persistence.ResourceRepository.Counter;
import net.unishelf.adapters.persistence.ResourceRepository.RatingUpdate;
import net.unishelf.domain.resource.AccessLevel;
import net.unishelf.domain.resource.Resource;
import net.unishelf.domain.resource.ResourceDraft;
import net.unishelf.domain.resource.ResourceFilter;
import net.unishelf.domain.resource.ResourcePage;
import net.unishelf.domain.resource.ResourceRating;
import net.unishelf.domain.resource.ResourceType;
import net.unishelf.exception.LocalStoreFailureException;
import net.unishelf.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DriverManagerDataSource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Container;
import org.testcontainers.junit.jupiter.Testcontainers;

@Testcontainers(disabledWithoutDocker = true)
class ResourceRepositoryTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine");

    private static DriverManagerDataSource dataSource;

    private JdbcTemplate jdbcTemplate;
    private ResourceRepository repository;

    @BeforeAll
    static void createSchema() {
        dataSource = new DriverManagerDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("db/schema.sql")).execute(dataSource);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("DELETE FROM resource_ratings");
        jdbcTemplate.update("DELETE FROM resources");
        repository = new ResourceRepository(jdbcTemplate);
    }

    @Test
    void find_WithQuery_MatchesOnlyApprovedAndCountsIndependently() {
        insert("Computer Networks", ResourceType.DOCUMENT, true, List.of("c1"));
        insert("Networks and Protocols", ResourceType.DOCUMENT, true, List.of("c2"));
        insert("Networks draft", ResourceType.DOCUMENT, false, List.of("c1"));
        insert("Organic Chemistry", ResourceType.DOCUMENT, true, List.of("c1"));

        ResourcePage page = repository.find(new ResourceFilter("networks", null, null, null, null), 1, 1);

        assertThat(page.items()).hasSize(1);
        assertThat(page.totalCount()).isEqualTo(2);
        assertThat(page.pages()).isEqualTo(2);
    }

    @Test
    void find_PageBeyondLastPage_ReturnsEmptyItemsWithTotal() {
        insert("Computer Networks", ResourceType.DOCUMENT, true, List.of());
        insert("Networks and Protocols", ResourceType.DOCUMENT, true, List.of());

        ResourcePage page = repository.find(new ResourceFilter("networks", null, null, null, null), 5, 20);

        assertThat(page.items()).isEmpty();
        assertThat(page.totalCount()).isEqualTo(2);
        assertThat(page.pages()).isEqualTo(1);
    }

    @Test
    void find_FilterOnly_MatchesTypeAndCourseMostRecentFirst() {
        insert("Lecture 1", ResourceType.VIDEO, true, List.of("net101"));
        Resource newer = insert("Lecture 2", ResourceType.VIDEO, true, List.of("net101"));
        insert("Slides", ResourceType.DOCUMENT, true, List.of("net101"));
        jdbcTemplate.update("UPDATE resources SET created_at = now() + interval '1 minute' WHERE id = ?", newer.id());

        ResourcePage page = repository.find(new ResourceFilter(null, ResourceType.VIDEO, null, null, "net101"), 1, 10);

        assertThat(page.items()).extracting(Resource::title).containsExactly("Lecture 2", "Lecture 1");
    }

    @Test
    void insert_RoundTripsArraysAndFlags() {
        Resource created = insert("Algorithms", ResourceType.LINK, true, List.of("cs201"));

        Resource loaded = repository.findById(created.id()).orElseThrow();

        assertThat(loaded.courseIds()).containsExactly("cs201");
        assertThat(loaded.tags()).containsExactly("cs", "theory");
        assertThat(loaded.resourceType()).isEqualTo(ResourceType.LINK);
        assertThat(loaded.accessLevel()).isEqualTo(AccessLevel.PUBLIC);
        assertThat(loaded.approved()).isTrue();
    }

    @Test
    void upsertRating_SameRaterReplaces_DistinctRatersAverage() {
        Resource resource = insert("Algorithms", ResourceType.DOCUMENT, true, List.of());

        repository.upsertRating(resource.id(), new ResourceRating("u1", 5, null, Instant.now()));
        RatingUpdate sameRater = repository.upsertRating(resource.id(), new ResourceRating("u1", 4, "ok", Instant.now()));
        assertThat(sameRater.ratingsCount()).isEqualTo(1);
        assertThat(sameRater.averageRating()).isEqualTo(4.0);

        RatingUpdate secondRater = repository.upsertRating(resource.id(), new ResourceRating("u2", 2, null, Instant.now()));
        assertThat(secondRater.ratingsCount()).isEqualTo(2);
        assertThat(secondRater.averageRating()).isEqualTo(3.0);

        Resource reloaded = repository.findById(resource.id()).orElseThrow();
        assertThat(reloaded.averageRating()).isEqualTo(3.0);
        assertThat(reloaded.ratingsCount()).isEqualTo(2);
    }

    @Test
    void upsertRating_UnknownResource_Throws() {
        UUID missing = UUID.randomUUID();
        assertThatThrownBy(() -> repository.upsertRating(missing, new ResourceRating("u1", 3, null, Instant.now())))
            .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void incrementCounter_ReturnsUpdatedRow() {
        Resource resource = insert("Algorithms", ResourceType.DOCUMENT, true, List.of());

        repository.incrementCounter(resource.id(), Counter.VIEWS);
        Resource viewed = repository.incrementCounter(resource.id(), Counter.VIEWS).orElseThrow();

        assertThat(viewed.views()).isEqualTo(2);
        assertThat(repository.incrementCounter(UUID.randomUUID(), Counter.SHARES)).isEmpty();
    }

    @Test
    void findBySource_ReturnsEarlierImport() {
        ResourceDraft draft = draft("Imported", ResourceType.DOCUMENT, true, List.of(), "Google Books", "vol-1");
        Resource first = repository.insert(draft);
        repository.insert(draft);

        assertThat(repository.findBySource("Google Books", "vol-1")).get().extracting(Resource::id).isEqualTo(first.id());
        assertThat(repository.findBySource("Google Books", "vol-2")).isEmpty();
    }

    @Test
    void findRelated_SharesCourseTypeOrTag_ExcludesSelfAndUnapproved() {
        Resource anchor = insert("Anchor", ResourceType.DOCUMENT, true, List.of("c1"));
        insert("Same course", ResourceType.VIDEO, true, List.of("c1"));
        insert("Unapproved", ResourceType.DOCUMENT, false, List.of("c1"));

        List<Resource> related = repository.findRelated(anchor, 5);

        assertThat(related).extracting(Resource::title).contains("Same course").doesNotContain("Anchor", "Unapproved");
    }

    @Test
    void find_BrokenQuery_SurfacesLocalStoreFailure() {
        jdbcTemplate.execute("ALTER TABLE resources RENAME TO resources_tmp");
        try {
            assertThatThrownBy(() -> repository.find(new ResourceFilter("x", null, null, null, null), 1, 10))
                .isInstanceOf(LocalStoreFailureException.class);
        } finally {
            jdbcTemplate.execute("ALTER TABLE resources_tmp RENAME TO resources");
        }
    }

    private Resource insert(String title, ResourceType type, boolean approved, List<String> courseIds) {
        return repository.insert(draft(title, type, approved, courseIds, null, null));
    }

    private static ResourceDraft draft(String title, ResourceType type, boolean approved, List<String> courseIds,
                                       String sourceName, String sourceExternalId) {
        return new ResourceDraft(title, "About " + title, type, "pdf", "A. Author", null, 2020, null,
            List.of("cs", "theory"), List.of("dept-cs"), courseIds, 200, "https://files.example.com/" + UUID.randomUUID(),
            null, null, "uploader-1", AccessLevel.PUBLIC, approved, sourceName, sourceExternalId);
    }
}
