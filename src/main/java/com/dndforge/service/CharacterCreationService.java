package com.dndforge.service;

import com.dndforge.api.CatalogConfig;
import com.dndforge.creation.AssemblyEngine;
import com.dndforge.creation.CharacterRecordCodec;
import com.dndforge.game_rules.ContentCatalog;
import com.dndforge.game_rules.ScalingResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.*;

/**
 * Сервис для создания персонажей: открытие, восстановление и выгрузка сессий
 */
@Service
public class CharacterCreationService {
    private static final Logger log = LoggerFactory.getLogger(CharacterCreationService.class);

    @Autowired
    private ContentCatalog catalog;

    @Autowired
    private ScalingResolver resolver;

    @Autowired
    private CatalogConfig catalogConfig;

    private final CharacterRecordCodec codec = new CharacterRecordCodec();

    /**
     * Новая сессия с заполненными именем, уровнем и мировоззрением (любое может быть null)
     */
    public AssemblyEngine openSession(String name, Integer level, String alignment) {
        AssemblyEngine engine = new AssemblyEngine(catalog, resolver, catalogConfig.getBaseLanguage());
        if (name != null) {
            engine.setName(name);
        }
        if (alignment != null) {
            engine.setAlignment(alignment);
        }
        if (level != null) {
            engine.setLevel(level);
        }
        log.info("Сессия создания персонажа открыта: {}", engine.getRecord());
        return engine;
    }

    /**
     * Сессия из сохраненной записи персонажа
     */
    public AssemblyEngine restore(String json) {
        AssemblyEngine engine = AssemblyEngine.deserialize(catalog, resolver, json);
        log.info("Сессия восстановлена на шаге {}", engine.currentStep());
        return engine;
    }

    /**
     * Сессия, заново собранная из журнала выборов
     */
    public AssemblyEngine rebuild(String choicesJson) {
        AssemblyEngine engine = AssemblyEngine.replay(catalog, resolver, catalogConfig.getBaseLanguage(),
            codec.choicesFromJson(choicesJson));
        log.info("Сессия собрана из журнала, шаг {}", engine.currentStep());
        return engine;
    }

    public String export(AssemblyEngine engine) {
        return codec.toJsonString(engine.getRecord(), false);
    }

    public String exportChoices(AssemblyEngine engine) {
        return codec.choicesToJson(engine.getRecord().getChoicesMade());
    }

    public void reset(AssemblyEngine engine) {
        engine.reset();
    }

    // Справочные списки каталога
    public Map<String, List<String>> listCatalog() {
        Map<String, List<String>> result = new LinkedHashMap<>();
        result.put("classes", catalog.getClassNames());
        result.put("backgrounds", catalog.getBackgroundNames());
        result.put("species", catalog.getSpeciesNames());
        result.put("languages", catalog.getLanguages());
        return result;
    }
}
