package com.solo.content;

import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CampaignLoaderTest {
    private final CampaignLoader loader = new CampaignLoader();

    @Test
    void loadsBundledCampaigns() {
        ContentRegistry registry = loader.loadRegistry(List.of("ruined_watchtower", " lost_crypt "));

        assertThat(registry.listCampaigns()).extracting(Campaign::getId)
            .containsExactlyInAnyOrder("ruined_watchtower", "lost_crypt");

        Campaign watchtower = registry.getCampaign("ruined_watchtower");
        assertThat(watchtower.getStartRoomId()).isEqualTo("courtyard");
        assertThat(watchtower.getCompletionXp()).isEqualTo(100);
        assertThat(registry.getRoom("ruined_watchtower", "spire").getKind()).isEqualTo(RoomKind.LOOT);
        assertThat(registry.nextRoomId("ruined_watchtower", "cellar")).contains("barracks");
        assertThat(registry.nextRoomId("ruined_watchtower", "spire")).isEmpty();

        MobProfile rats = registry.getMobProfile("ruined_watchtower", "Big Rats");
        assertThat(rats.getCount()).isEqualTo(2);
        assertThat(rats.hasHpExpression()).isTrue();
        assertThat(rats.getAi()).isEqualTo(AiPolicy.FOCUS_WEAKEST);
    }

    @Test
    void itemLookupsReturnFreshCopies() {
        ContentRegistry registry = loader.loadRegistry(List.of("ruined_watchtower"));

        ItemDefinition first = registry.itemFromId("ruined_watchtower", "leather_cap");
        ItemDefinition second = registry.itemFromId("ruined_watchtower", "leather_cap");

        assertThat(first).isNotSameAs(second);
        assertThat(first.getSlot()).isEqualTo(EquipmentSlot.HEAD);
        assertThat(first.getArmorBonus()).isEqualTo(1);
        assertThat(registry.itemFromName("ruined_watchtower", "worn boots").getId()).isEqualTo("worn_boots");
        assertThat(registry.itemFromId("ruined_watchtower", "dragon_egg").getId()).isEqualTo("unknown");
        assertThat(registry.questItemIds("ruined_watchtower")).containsExactly("silver_locket");
    }

    @Test
    void unknownLookupsFail() {
        ContentRegistry registry = loader.loadRegistry(List.of("ruined_watchtower"));

        assertThatThrownBy(() -> registry.getCampaign("moon_base")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> registry.getRoom("ruined_watchtower", "attic"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> loader.loadResource("missing_campaign"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("not found");
    }

    @Test
    void validationReportsDanglingReferences() {
        String json = "{"
            + "\"id\": \"broken\", \"name\": \"Broken\", \"room_order\": [\"hall\"],"
            + "\"rooms\": {\"hall\": {\"id\": \"hall\", \"name\": \"Hall\", \"kind\": \"combat\", \"enemy_name\": \"Ghost\"}},"
            + "\"exits\": {\"hall\": {\"up\": \"roof\"}}"
            + "}";

        assertThatThrownBy(() -> loader.parse(new StringReader(json)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("unknown mob 'Ghost'")
            .hasMessageContaining("unknown room 'roof'");
    }

    @Test
    void malformedOrEmptyDataIsFatal() {
        assertThatThrownBy(() -> loader.parse(new StringReader("{\"rooms\": [")))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> loader.parse(new StringReader("")))
            .isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> loader.loadRegistry(List.of(" ")))
            .hasMessage("No campaigns configured");
    }
}
