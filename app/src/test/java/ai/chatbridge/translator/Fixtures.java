package ai.chatbridge.translator;

import ai.chatbridge.translator.keyword.PronounNormalizer;
import ai.chatbridge.translator.settings.BotSettings;
import ai.chatbridge.translator.settings.TemplateTable;
import ai.chatbridge.translator.store.JsonFileBotStore;
import ai.chatbridge.translator.template.MessageLocalizer;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Loads the shared settings and template fixtures.
 */
public final class Fixtures {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private Fixtures() {
    }

    public static BotSettings settings() {
        return read("settings.json", BotSettings.class);
    }

    public static TemplateTable templates() {
        return read("templates.json", TemplateTable.class);
    }

    public static MessageLocalizer localizer() {
        return localizer(settings());
    }

    public static MessageLocalizer localizer(BotSettings settings) {
        return new MessageLocalizer(templates(), settings, new PronounNormalizer(settings.pronounNormalizationMap()));
    }

    /**
     * Copies the fixtures into {@code dataDirectory} under the file names the JSON store expects.
     */
    public static Path installInto(Path dataDirectory) {
        copy("settings.json", dataDirectory.resolve(JsonFileBotStore.SETTINGS_FILE));
        copy("templates.json", dataDirectory.resolve(JsonFileBotStore.TEMPLATES_FILE));
        return dataDirectory;
    }

    private static <T> T read(String name, Class<T> type) {
        try (InputStream in = open(name)) {
            return MAPPER.readValue(in, type);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static void copy(String name, Path target) {
        try (InputStream in = open(name)) {
            Files.createDirectories(target.getParent());
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException ex) {
            throw new UncheckedIOException(ex);
        }
    }

    private static InputStream open(String name) {
        InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name);
        if (in == null) {
            throw new IllegalStateException("Missing fixture " + name);
        }
        return in;
    }
}
