package com.williamcallahan.game_catalog_engine.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.model.GameVideo;
import com.williamcallahan.game_catalog_engine.model.PlayerCount;
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

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the repository SQL against a real Postgres. Skipped when Docker is unavailable.
 */
@Testcontainers(disabledWithoutDocker = true)
class GameRepositoryIntegrationTest {

    @Container
    static PostgreSQLContainer<?> postgres = new PostgreSQLContainer<>("postgres:16-alpine")
        .withDatabaseName("games_test")
        .withUsername("test")
        .withPassword("test");

    private static DriverManagerDataSource dataSource;

    private JdbcTemplate jdbcTemplate;
    private GameRepository repository;
    private SettingsRepository settingsRepository;

    @BeforeAll
    static void createSchema() {
        dataSource = new DriverManagerDataSource(postgres.getJdbcUrl(), postgres.getUsername(), postgres.getPassword());
        new ResourceDatabasePopulator(new ClassPathResource("schema.sql")).execute(dataSource);
    }

    @BeforeEach
    void setUp() {
        jdbcTemplate = new JdbcTemplate(dataSource);
        jdbcTemplate.update("TRUNCATE games RESTART IDENTITY");
        jdbcTemplate.update("TRUNCATE app_settings");
        repository = new GameRepository(jdbcTemplate, new ObjectMapper());
        settingsRepository = new SettingsRepository(jdbcTemplate);
    }

    private static Game game(long igdbId, String name, double popularity, Integer... themes) {
        Game game = new Game();
        game.setIgdbId(igdbId);
        game.setName(name);
        game.setPopularity(popularity);
        game.setThemes(List.of(themes));
        return game;
    }

    @Test
    void upsertAll_duplicateIgdbIdsCollapseToLastOccurrence() {
        List<Game> stored = repository.upsertAll(List.of(game(1L, "First", 1), game(2L, "Other", 1), game(1L, "Second", 1)));

        assertThat(stored).hasSize(2);
        assertThat(repository.count()).isEqualTo(2);
        assertThat(repository.findByIgdbId(1L)).get().extracting(Game::getName).isEqualTo("Second");
    }

    @Test
    void upsertAll_roundTripsStructuredColumns() {
        Game game = game(10L, "Halo", 50, 1, 17);
        game.setGameModes(List.of(1, 2));
        game.setFirstReleaseDate(Instant.parse("2001-11-15T00:00:00Z"));
        game.setPlayerCount(new PlayerCount(1, 16));
        game.setCrossplay(true);
        game.setScreenshots(List.of("https://example.test/s1.jpg"));
        game.setVideos(List.of(new GameVideo("Trailer", "abc")));

        Game stored = repository.upsertAll(List.of(game)).get(0);

        assertThat(stored.getId()).isPositive();
        assertThat(stored.getThemes()).containsExactly(1, 17);
        assertThat(stored.getPlayerCount()).isEqualTo(new PlayerCount(1, 16));
        assertThat(stored.getVideos()).containsExactly(new GameVideo("Trailer", "abc"));
        assertThat(stored.getFirstReleaseDate()).isEqualTo(Instant.parse("2001-11-15T00:00:00Z"));
    }

    @Test
    void upsertAll_preservesModerationFlags() {
        long id = repository.upsertAll(List.of(game(3L, "Old name", 1))).get(0).getId();
        repository.updateHidden(id, true);
        repository.updateBanned(id, true);

        Game refreshed = repository.upsertAll(List.of(game(3L, "New name", 5))).get(0);

        assertThat(refreshed.getId()).isEqualTo(id);
        assertThat(refreshed.getName()).isEqualTo("New name");
        assertThat(refreshed.isHidden()).isTrue();
        assertThat(refreshed.isBanned()).isTrue();
    }

    @Test
    void searchVisibleByName_appliesVisibilityAndEscapesWildcards() {
        List<Game> stored = repository.upsertAll(List.of(
            game(1L, "Halo", 10), game(2L, "Halo 2", 20), game(3L, "Halo Adult", 30, 42), game(4L, "100% Orange", 1)));
        repository.updateHidden(stored.get(0).getId(), true);

        assertThat(repository.searchVisibleByName("halo", false, 20))
            .extracting(Game::getName).containsExactly("Halo Adult", "Halo 2");
        assertThat(repository.searchVisibleByName("HALO", true, 20))
            .extracting(Game::getName).containsExactly("Halo 2");
        assertThat(repository.searchVisibleByName("0%", false, 20))
            .extracting(Game::getName).containsExactly("100% Orange");
        assertThat(repository.searchVisibleByName("_", false, 20)).isEmpty();
    }

    @Test
    void findVisibleByIds_keepsRequestedOrderAndDropsBanned() {
        List<Game> stored = repository.upsertAll(List.of(game(1L, "A", 1), game(2L, "B", 1), game(3L, "C", 1)));
        long a = stored.get(0).getId();
        long b = stored.get(1).getId();
        long c = stored.get(2).getId();
        repository.updateBanned(b, true);

        assertThat(repository.findVisibleByIds(List.of(c, b, a), false)).extracting(Game::getId).containsExactly(c, a);
    }

    @Test
    void findIgdbIdsAfter_pagesInAscendingOrder() {
        repository.upsertAll(List.of(game(30L, "C", 1), game(10L, "A", 1), game(20L, "B", 1)));

        assertThat(repository.findIgdbIdsAfter(0L, 2)).containsExactly(10L, 20L);
        assertThat(repository.findIgdbIdsAfter(20L, 2)).containsExactly(30L);
    }

    @Test
    void hideAdultThemed_hidesOnlyAdultGames() {
        repository.upsertAll(List.of(game(1L, "Adult", 1, 42), game(2L, "Family", 1, 1)));

        assertThat(repository.hideAdultThemed()).isEqualTo(1);
        assertThat(repository.findByIgdbId(1L)).get().extracting(Game::isHidden).isEqualTo(true);
        assertThat(repository.hideAdultThemed()).isZero();
    }

    @Test
    void settingsRepository_upsertsAndDeletes() {
        settingsRepository.upsert("igdb.filter_adult", "false");
        settingsRepository.upsert("igdb.filter_adult", "true");

        assertThat(settingsRepository.findAll()).containsEntry("igdb.filter_adult", "true");
        assertThat(settingsRepository.delete("igdb.filter_adult")).isEqualTo(1);
        assertThat(settingsRepository.findAll()).isEmpty();
    }
}
