package com.williamcallahan.game_catalog_engine.service.igdb;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.williamcallahan.game_catalog_engine.config.IgdbConfigurationProperties;
import com.williamcallahan.game_catalog_engine.model.Game;
import com.williamcallahan.game_catalog_engine.model.GameVideo;
import com.williamcallahan.game_catalog_engine.model.PlayerCount;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IgdbGameMapperTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final IgdbGameMapper mapper = new IgdbGameMapper(new IgdbConfigurationProperties());

    private JsonNode json(String raw) throws Exception {
        return objectMapper.readTree(raw.replace('\'', '"'));
    }

    @Test
    void toGame_mapsFullRecord() throws Exception {
        JsonNode node = json("""
            {'id': 740, 'name': 'Halo: Combat Evolved', 'slug': 'halo-combat-evolved',
             'cover': {'id': 1, 'image_id': 'co2r2r'},
             'genres': [5, 31], 'themes': [1, 17], 'platforms': [6, 11], 'game_modes': [1, 2, 3],
             'summary': 'Master Chief.', 'rating': 84.5, 'aggregated_rating': 95.0,
             'total_rating_count': 1200, 'first_release_date': 1005091200,
             'screenshots': [{'image_id': 'sc1'}, {'image_id': 'sc2'}],
             'videos': [{'name': 'Trailer', 'video_id': 'abc123'}],
             'multiplayer_modes': [
                {'platform': 6, 'onlinemax': 16, 'offlinemax': 4, 'onlinecoop': true},
                {'platform': 11, 'onlinemax': 8, 'offlinemax': 2}
             ],
             'external_games': [{'category': 1, 'uid': 'steam-1'}, {'category': 14, 'uid': '12345'}]}
            """);

        Game game = mapper.toGame(node);

        assertThat(game.getIgdbId()).isEqualTo(740L);
        assertThat(game.getName()).isEqualTo("Halo: Combat Evolved");
        assertThat(game.getCoverUrl()).isEqualTo("https://images.igdb.com/igdb/image/upload/t_cover_big/co2r2r.jpg");
        assertThat(game.getGenres()).containsExactly(5, 31);
        assertThat(game.getGameModes()).containsExactly(1, 2, 3);
        assertThat(game.getAggregatedRating()).isEqualTo(95.0);
        assertThat(game.getPopularity()).isEqualTo(1200.0);
        assertThat(game.getFirstReleaseDate()).isEqualTo(Instant.ofEpochSecond(1005091200L));
        assertThat(game.getPlayerCount()).isEqualTo(new PlayerCount(1, 16));
        assertThat(game.getCrossplay()).isTrue();
        assertThat(game.getTwitchGameId()).isEqualTo("12345");
        assertThat(game.getScreenshots()).containsExactly(
            "https://images.igdb.com/igdb/image/upload/t_screenshot_big/sc1.jpg",
            "https://images.igdb.com/igdb/image/upload/t_screenshot_big/sc2.jpg");
        assertThat(game.getVideos()).containsExactly(new GameVideo("Trailer", "abc123"));
        assertThat(game.isHidden()).isFalse();
        assertThat(game.isBanned()).isFalse();
    }

    @Test
    void toGame_missingOptionalFieldsBecomeNullOrEmpty() throws Exception {
        Game game = mapper.toGame(json("{'id': 1, 'name': 'Pong'}"));

        assertThat(game.getCoverUrl()).isNull();
        assertThat(game.getGenres()).isEmpty();
        assertThat(game.getRating()).isNull();
        assertThat(game.getFirstReleaseDate()).isNull();
        assertThat(game.getPlayerCount()).isNull();
        assertThat(game.getCrossplay()).isNull();
        assertThat(game.getTwitchGameId()).isNull();
        assertThat(game.getScreenshots()).isEmpty();
        assertThat(game.getVideos()).isEmpty();
    }

    @Test
    void crossplay_falseWhenOnlinePlayOnSinglePlatform() throws Exception {
        Game game = mapper.toGame(json("""
            {'id': 2, 'name': 'Split', 'multiplayer_modes': [
                {'platform': 6, 'onlinemax': 4},
                {'platform': 48, 'offlinemax': 2}
            ]}
            """));

        assertThat(game.getCrossplay()).isFalse();
        assertThat(game.getPlayerCount()).isEqualTo(new PlayerCount(1, 4));
    }

    @Test
    void toGames_dropsRecordsWithoutIdOrName() throws Exception {
        List<JsonNode> nodes = List.of(json("{'name': 'No id'}"), json("{'id': 3}"), json("{'id': 4, 'name': 'Ok'}"));

        assertThat(mapper.toGames(nodes)).extracting(Game::getIgdbId).containsExactly(4L);
    }
}
