package com.williamcallahan.game_catalog_engine.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SearchQueryUtilsTest {

    @Test
    void searchCacheKey_trimsAndLowercases() {
        assertThat(SearchQueryUtils.searchCacheKey("  Halo Infinite ")).isEqualTo("igdb:search:halo infinite");
        assertThat(SearchQueryUtils.searchCacheKey("HALO")).isEqualTo(SearchQueryUtils.searchCacheKey("halo"));
    }

    @Test
    void likeContainsPattern_escapesWildcardsAndBackslash() {
        assertThat(SearchQueryUtils.likeContainsPattern("100%")).isEqualTo("%100\\%%");
        assertThat(SearchQueryUtils.likeContainsPattern("a_b")).isEqualTo("%a\\_b%");
        assertThat(SearchQueryUtils.likeContainsPattern("c:\\x")).isEqualTo("%c:\\\\x%");
        assertThat(SearchQueryUtils.likeContainsPattern(" halo ")).isEqualTo("%halo%");
    }

    @Test
    void escapeIgdbString_escapesQuotesAndBackslashes() {
        assertThat(SearchQueryUtils.escapeIgdbString("say \"hi\"")).isEqualTo("say \\\"hi\\\"");
        assertThat(SearchQueryUtils.escapeIgdbString("a\\b")).isEqualTo("a\\\\b");
        assertThat(SearchQueryUtils.escapeIgdbString(null)).isEmpty();
    }
}
