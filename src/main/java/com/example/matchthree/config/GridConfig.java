package com.example.matchthree.config;

import com.example.matchthree.logic.RandomTileKindSource;
import com.example.matchthree.logic.TileKindSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Random;

@Configuration
public class GridConfig {

    @Value("${match3.grid.kinds:5}")
    private int kindCount;

    // Empty means "seed from the clock"; set it to replay the same boards.
    @Value("${match3.grid.seed:}")
    private String seed;

    @Bean
    public TileKindSource tileKindSource() {
        Random random = (seed == null || seed.isBlank()) ? new Random() : new Random(Long.parseLong(seed.trim()));
        return new RandomTileKindSource(random, kindCount);
    }
}
