package com.phillippitts.insightbot.exception;

/**
 * Thrown when a guild setting update is outside the accepted values
 * (unknown analysis mode, interval out of range).
 */
public class InvalidSettingException extends InsightBotException {

    private final String setting;
    private final String value;

    public InvalidSettingException(String setting, String value, String reason) {
        super("Invalid value for " + setting + " (" + value + "): " + reason);
        this.setting = setting;
        this.value = value;
    }

    public String getSetting() {
        return setting;
    }

    public String getValue() {
        return value;
    }
}
