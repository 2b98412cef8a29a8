package com.williamcallahan.game_catalog_engine.service.igdb;

import com.williamcallahan.game_catalog_engine.config.IgdbConfigurationProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IgdbQueryBuilderTest {

    private final IgdbQueryBuilder builder = new IgdbQueryBuilder(new IgdbConfigurationProperties());

    @Test
    void search_escapesTermAndAppliesLimit() {
        String body = builder.search("  Halo \"Reach\" ", false);

        assertThat(body).startsWith("search \"Halo \\\"Reach\\\"\"; fields ");
        assertThat(body).contains("multiplayer_modes.onlinemax", "external_games.category", "cover.image_id");
        assertThat(body).doesNotContain("where");
        assertThat(body).endsWith("limit 20;");
    }

    @Test
    void search_excludesAdultThemeWhenFilterEnabled() {
        assertThat(builder.search("halo", true)).contains("where themes != (42);");
    }

    @Test
    void byIds_listsIdsAndLimitsToBatchSize() {
        String body = builder.byIds(List.of(1L, 2L, 3L));

        assertThat(body).contains("where id = (1,2,3);").endsWith("limit 3;");
    }

    @Test
    void byIds_rejectsEmptyInput() {
        assertThatThrownBy(() -> builder.byIds(List.of())).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void discovery_filtersMultiplayerModesAndSortsByRating() {
        String body = builder.discovery(false);

        assertThat(body).contains("where game_modes = (2,3,5) & total_rating_count > 10;")
            .contains("sort total_rating desc;")
            .endsWith("limit 100;");
        assertThat(builder.discovery(true)).contains("total_rating_count > 10 & themes != (42);");
    }
}
