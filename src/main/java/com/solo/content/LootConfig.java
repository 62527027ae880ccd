package com.solo.content;

/**
 * Настройки сундука: проверка, награда и признак финала кампании
 */
public class LootConfig {
    private String stat = "DEX";
    private int dc = 13;
    private String winItemId;
    private boolean gameOver = true;
    private String successMsg;
    private String failMsg;

    private LootConfig() {
    }

    public LootConfig(String stat, int dc, String winItemId, boolean gameOver,
                      String successMsg, String failMsg) {
        this.stat = stat;
        this.dc = dc;
        this.winItemId = winItemId;
        this.gameOver = gameOver;
        this.successMsg = successMsg;
        this.failMsg = failMsg;
    }

    public Ability getStat() { return Ability.fromString(stat); }
    public int getDc() { return dc; }
    public String getWinItemId() { return winItemId; }
    public boolean isGameOver() { return gameOver; }
    public String getSuccessMsg() { return successMsg; }
    public String getFailMsg() { return failMsg; }
}
