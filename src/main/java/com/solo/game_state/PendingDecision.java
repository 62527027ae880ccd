package com.solo.game_state;

import com.solo.content.Spell;

import java.util.ArrayList;
import java.util.List;

/**
 * Отложенный выбор после повышения уровня. Разрешается только после того, как отдых его предложил.
 */
public class PendingDecision {
    private DecisionType type = DecisionType.SPELL;
    private int level;
    private List<Spell> options = new ArrayList<>();
    private boolean offered;

    private PendingDecision() {
    }

    public PendingDecision(DecisionType type, int level, List<Spell> options) {
        this.type = type;
        this.level = level;
        this.options = new ArrayList<>(options);
    }

    public Spell findOption(String choice) {
        Spell spell = Spell.fromName(choice);
        return spell != null && getOptions().contains(spell) ? spell : null;
    }

    public DecisionType getType() { return type; }
    public int getLevel() { return level; }
    public List<Spell> getOptions() { return options != null ? options : List.of(); }

    public boolean isOffered() { return offered; }
    public void setOffered(boolean offered) { this.offered = offered; }
}
