package com.solo.game_state;

/**
 * Запись журнала рассказчика
 */
public class NarrationEntry {
    private int turn;
    private String playerInput;
    private String rulesResult;
    private String gmResponse;
    private String gmSource;

    private NarrationEntry() {
    }

    public NarrationEntry(int turn, String playerInput, String rulesResult, String gmResponse, String gmSource) {
        this.turn = turn;
        this.playerInput = playerInput;
        this.rulesResult = rulesResult;
        this.gmResponse = gmResponse;
        this.gmSource = gmSource;
    }

    public int getTurn() { return turn; }
    public String getPlayerInput() { return playerInput; }
    public String getRulesResult() { return rulesResult; }
    public String getGmResponse() { return gmResponse; }
    public String getGmSource() { return gmSource; }
}
