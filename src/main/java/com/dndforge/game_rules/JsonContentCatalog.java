package com.dndforge.game_rules;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Каталог правил из каталога JSON-файлов.
 * <p>
 * Раскладка: classes/, backgrounds/, species/, species_variants/, feats/,
 * subclasses/&lt;класс&gt;/ и необязательный languages.json. Каждый документ
 * индексируется по полю name; файлы без name или с ошибками разбора пропускаются.
 */
public class JsonContentCatalog implements ContentCatalog {
    private static final Logger log = LoggerFactory.getLogger(JsonContentCatalog.class);
    private static final Gson gson = new GsonBuilder().setLenient().create();

    public static final List<String> STANDARD_LANGUAGES = List.of(
        "Abyssal", "Celestial", "Common", "Deep Speech", "Draconic", "Dwarvish",
        "Elvish", "Giant", "Gnomish", "Goblin", "Halfling", "Infernal",
        "Orc", "Primordial", "Sylvan", "Undercommon"
    );

    private final Map<String, RuleDocument> classes;
    private final Map<String, RuleDocument> backgrounds;
    private final Map<String, RuleDocument> species;
    private final Map<String, RuleDocument> lineages;
    private final Map<String, RuleDocument> feats;
    private final Map<String, Map<String, RuleDocument>> subclasses;
    private final List<String> languages;

    public JsonContentCatalog(Path dataDir) {
        if (!Files.isDirectory(dataDir)) {
            log.warn("Каталог данных не найден: {}", dataDir.toAbsolutePath());
        }
        this.classes = loadDirectory(dataDir.resolve("classes"), RuleDocument.Kind.CLASS);
        this.backgrounds = loadDirectory(dataDir.resolve("backgrounds"), RuleDocument.Kind.BACKGROUND);
        this.species = loadDirectory(dataDir.resolve("species"), RuleDocument.Kind.SPECIES);
        this.lineages = loadDirectory(dataDir.resolve("species_variants"), RuleDocument.Kind.LINEAGE);
        this.feats = loadDirectory(dataDir.resolve("feats"), RuleDocument.Kind.FEAT);
        this.subclasses = loadSubclasses(dataDir.resolve("subclasses"));
        this.languages = loadLanguages(dataDir.resolve("languages.json"));

        log.info("Каталог правил загружен из {}: классов {}, предысторий {}, видов {}, линий {}, черт {}, подклассов {}",
            dataDir, classes.size(), backgrounds.size(), species.size(), lineages.size(), feats.size(),
            subclasses.values().stream().mapToInt(Map::size).sum());
    }

    @Override
    public Optional<RuleDocument> findClass(String name) {
        return lookup(classes, name);
    }

    @Override
    public Optional<RuleDocument> findBackground(String name) {
        return lookup(backgrounds, name);
    }

    @Override
    public Optional<RuleDocument> findSpecies(String name) {
        return lookup(species, name);
    }

    @Override
    public Optional<RuleDocument> findLineage(String name) {
        return lookup(lineages, name);
    }

    @Override
    public Optional<RuleDocument> findFeat(String name) {
        return lookup(feats, name);
    }

    @Override
    public Optional<RuleDocument> findSubclass(String className, String subclassName) {
        if (className == null) {
            return Optional.empty();
        }
        return lookup(subclasses.getOrDefault(folderName(className), Map.of()), subclassName);
    }

    @Override
    public List<RuleDocument> getSubclassesForClass(String className) {
        if (className == null) {
            return List.of();
        }
        return new ArrayList<>(subclasses.getOrDefault(folderName(className), Map.of()).values());
    }

    @Override
    public List<String> getClassNames() {
        return new ArrayList<>(classes.keySet());
    }

    @Override
    public List<String> getBackgroundNames() {
        return new ArrayList<>(backgrounds.keySet());
    }

    @Override
    public List<String> getSpeciesNames() {
        return new ArrayList<>(species.keySet());
    }

    @Override
    public List<String> getLanguages() {
        return languages;
    }

    private static Optional<RuleDocument> lookup(Map<String, RuleDocument> documents, String name) {
        if (name == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(documents.get(name));
    }

    private static String folderName(String className) {
        return className.toLowerCase(Locale.ROOT).replace(" ", "_");
    }

    private Map<String, RuleDocument> loadDirectory(Path directory, RuleDocument.Kind kind) {
        Map<String, RuleDocument> documents = new TreeMap<>();
        if (!Files.isDirectory(directory)) {
            return documents;
        }
        try (DirectoryStream<Path> files = Files.newDirectoryStream(directory, "*.json")) {
            for (Path file : files) {
                Map<String, Object> data = readDocument(file);
                if (data == null) {
                    continue;
                }
                Object name = data.get("name");
                if (name == null) {
                    log.warn("Документ без поля name пропущен: {}", file);
                    continue;
                }
                documents.put(String.valueOf(name), new RuleDocument(kind, data));
            }
        } catch (IOException e) {
            log.warn("Не удалось прочитать каталог {}: {}", directory, e.getMessage());
        }
        return documents;
    }

    private Map<String, Map<String, RuleDocument>> loadSubclasses(Path directory) {
        Map<String, Map<String, RuleDocument>> result = new TreeMap<>();
        if (!Files.isDirectory(directory)) {
            return result;
        }
        try (DirectoryStream<Path> classDirs = Files.newDirectoryStream(directory, Files::isDirectory)) {
            for (Path classDir : classDirs) {
                String className = folderName(classDir.getFileName().toString());
                result.put(className, loadDirectory(classDir, RuleDocument.Kind.SUBCLASS));
            }
        } catch (IOException e) {
            log.warn("Не удалось прочитать подклассы из {}: {}", directory, e.getMessage());
        }
        return result;
    }

    private List<String> loadLanguages(Path file) {
        if (!Files.isRegularFile(file)) {
            return STANDARD_LANGUAGES;
        }
        Map<String, Object> data = readDocument(file);
        List<String> list = data != null ? RuleDocument.toStringList(data.get("languages")) : List.of();
        if (list.isEmpty()) {
            return STANDARD_LANGUAGES;
        }
        List<String> sorted = new ArrayList<>(list);
        Collections.sort(sorted);
        return Collections.unmodifiableList(sorted);
    }

    private Map<String, Object> readDocument(Path file) {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            JsonElement element = gson.fromJson(reader, JsonElement.class);
            if (element == null || !element.isJsonObject()) {
                log.warn("Ожидался JSON-объект: {}", file);
                return null;
            }
            return parseJsonObject(element.getAsJsonObject());
        } catch (IOException | JsonParseException e) {
            log.warn("Ошибка загрузки {}: {}", file, e.getMessage());
            return null;
        }
    }

    private Map<String, Object> parseJsonObject(JsonObject obj) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (Map.Entry<String, JsonElement> entry : obj.entrySet()) {
            map.put(entry.getKey(), parseJsonElement(entry.getValue()));
        }
        return map;
    }

    private List<Object> parseJsonArray(JsonArray array) {
        List<Object> list = new ArrayList<>();
        for (JsonElement e : array) {
            list.add(parseJsonElement(e));
        }
        return list;
    }

    private Object parseJsonElement(JsonElement element) {
        if (element.isJsonPrimitive()) {
            var prim = element.getAsJsonPrimitive();
            if (prim.isString()) return prim.getAsString();
            // getAsNumber сохраняет исходную запись числа ("2" остается "2")
            if (prim.isNumber()) return prim.getAsNumber();
            if (prim.isBoolean()) return prim.getAsBoolean();
        } else if (element.isJsonArray()) {
            return parseJsonArray(element.getAsJsonArray());
        } else if (element.isJsonObject()) {
            return parseJsonObject(element.getAsJsonObject());
        }
        return null;
    }
}
