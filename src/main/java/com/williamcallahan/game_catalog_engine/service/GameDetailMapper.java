package com.williamcallahan.game_catalog_engine.service;

import com.williamcallahan.game_catalog_engine.dto.GameDetail;
import com.williamcallahan.game_catalog_engine.model.Game;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class GameDetailMapper {

    public GameDetail toDetail(Game game) {
        return new GameDetail(
            game.getId() == null ? 0L : game.getId(),
            game.getIgdbId(),
            game.getName(),
            game.getSlug(),
            game.getCoverUrl(),
            game.getGenres(),
            game.getThemes(),
            game.getPlatforms(),
            game.getGameModes(),
            game.getSummary(),
            game.getRating(),
            game.getAggregatedRating(),
            game.getPopularity(),
            game.getFirstReleaseDate(),
            game.getPlayerCount(),
            game.getTwitchGameId(),
            game.getCrossplay(),
            game.getScreenshots(),
            game.getVideos()
        );
    }

    public List<GameDetail> toDetails(List<Game> games) {
        return games.stream().map(this::toDetail).toList();
    }
}
