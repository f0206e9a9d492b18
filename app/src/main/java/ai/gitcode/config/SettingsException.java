package ai.gitcode.config;

/** The settings file is missing, unreadable or invalid. */
public class SettingsException extends Exception {
    public SettingsException(String message) {
        super(message);
    }

    public SettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
