package ai.chatbridge.translator.store;

import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.TemplateTable;
import ai.chatbridge.translator.settings.UserProfile;
import java.util.Map;

/**
 * Load/save access to the bot's persisted records. Every record is read and written whole.
 */
public interface BotStore {

    /**
     * @throws StoreException when the settings are missing or unreadable
     */
    BotSettings loadSettings();

    void saveSettings(BotSettings settings);

    /**
     * @throws StoreException when the templates are missing or unreadable
     */
    TemplateTable loadTemplates();

    /**
     * Profiles keyed by platform user id; empty when none were saved yet.
     */
    Map<String, UserProfile> loadProfiles();

    void saveProfiles(Map<String, UserProfile> profiles);
}
