package com.dndforge.api;

import com.dndforge.game_rules.ContentCatalog;
import com.dndforge.game_rules.JsonContentCatalog;
import com.dndforge.game_rules.ScalingResolver;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Paths;

/**
 * Конфигурация каталога правил
 */
@Configuration
public class CatalogConfig {

    @Value("${catalog.data-dir:data}")
    private String dataDir;

    @Value("${catalog.base-language:Common}")
    private String baseLanguage;

    @Bean
    public ContentCatalog contentCatalog() {
        return new JsonContentCatalog(Paths.get(dataDir));
    }

    @Bean
    public ScalingResolver scalingResolver() {
        return new ScalingResolver();
    }

    public String getBaseLanguage() {
        return baseLanguage;
    }
}
