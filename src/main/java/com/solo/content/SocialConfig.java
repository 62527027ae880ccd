package com.solo.content;

/**
 * Настройки социальной проверки комнаты
 */
public class SocialConfig {
    private String stat = "INT";
    private int dc = 13;
    private String successFlag;
    private String successMsg;
    private String failMsg;
    private String doneFlag = "social_done";

    private SocialConfig() {
    }

    public SocialConfig(String stat, int dc, String successFlag, String successMsg,
                        String failMsg, String doneFlag) {
        this.stat = stat;
        this.dc = dc;
        this.successFlag = successFlag;
        this.successMsg = successMsg;
        this.failMsg = failMsg;
        this.doneFlag = doneFlag;
    }

    public Ability getStat() { return Ability.fromString(stat); }
    public int getDc() { return dc; }
    public String getSuccessFlag() { return successFlag; }
    public String getSuccessMsg() { return successMsg; }
    public String getFailMsg() { return failMsg; }
    public String getDoneFlag() { return doneFlag != null ? doneFlag : "social_done"; }
}
