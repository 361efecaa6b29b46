package com.dndforge.creation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.Map;

import com.dndforge.game_rules.CatalogFixtures;
import com.dndforge.game_state.CharacterRecord;
import com.dndforge.game_state.CreationStep;
import com.google.gson.JsonObject;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class CharacterRecordCodecTest {

    private final CharacterRecordCodec codec = new CharacterRecordCodec();

    @Test
    void writesEnumsByTheirDisplayNames() {
        AssemblyEngine engine = new AssemblyEngine(CatalogFixtures.catalog());
        engine.setAlignment("Chaotic Neutral");
        engine.selectClass("Fighter");

        JsonObject json = codec.toJson(engine.getRecord());

        assertThat(json.get("alignment").getAsString()).isEqualTo("Chaotic Neutral");
        assertThat(json.get("step").getAsString()).isEqualTo("class_choices");
        assertThat(json.getAsJsonObject("features").keySet()).contains("class", "species", "feat");
        assertThat(json.getAsJsonObject("choicesMade").get("class").getAsString()).isEqualTo("Fighter");
    }

    @Test
    void roundTripsAPartialRecord() {
        AssemblyEngine engine = new AssemblyEngine(CatalogFixtures.catalog());
        engine.setName("Mirel");
        engine.selectClass("Cleric");
        engine.applyClassChoices(List.of("History"), Map.of("Divine Order", "Protector"));

        CharacterRecord restored = codec.fromJson(codec.toJsonString(engine.getRecord(), true));

        assertThat(restored).isEqualTo(engine.getRecord());
        assertThat(restored.getStep()).isEqualTo(CreationStep.BACKGROUND);
    }

    @Test
    void choiceLogRoundTripsThroughText() {
        AssemblyEngine engine = new AssemblyEngine(CatalogFixtures.catalog());
        engine.setLevel(3);
        engine.selectClass("Fighter");

        String text = codec.choicesToJson(engine.getRecord().getChoicesMade());

        assertThat(codec.choicesFromJson(text)).isEqualTo(engine.getRecord().getChoicesMade());
    }

    @Test
    void rejectsMalformedInput() {
        assertThatThrownBy(() -> codec.fromJson("{not json")).isInstanceOf(RuleConstraintException.class);
        assertThatThrownBy(() -> codec.fromJson("[1, 2]")).isInstanceOf(RuleConstraintException.class);
        assertThatThrownBy(() -> codec.choicesFromJson("\"class\"")).isInstanceOf(RuleConstraintException.class);
    }
}
