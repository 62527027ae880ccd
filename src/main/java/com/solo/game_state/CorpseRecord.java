package com.solo.game_state;

/**
 * Запись о поверженном противнике для обыска
 */
public class CorpseRecord {
    private int id;
    private String name;
    private boolean looted;

    private CorpseRecord() {
    }

    public CorpseRecord(int id, String name, boolean looted) {
        this.id = id;
        this.name = name;
        this.looted = looted;
    }

    public int getId() { return id; }
    public String getName() { return name != null ? name : ""; }
    public boolean isLooted() { return looted; }
    public void setLooted(boolean looted) { this.looted = looted; }
}
