package ai.chatbridge.translator.command;

import static org.assertj.core.api.Assertions.assertThat;

import java.nio.file.Path;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BlockWordCommandTest {

    @TempDir
    Path dataDir;

    private CommandHarness harness;

    @BeforeEach
    void setUp() {
        harness = CommandHarness.installed(dataDir);
    }

    @Test
    void addsWordOnceIgnoringCase() {
        harness.moderator("!blockword", "spoiler");
        harness.moderator("!blockword", "SPOILER");

        assertThat(harness.messages()).containsExactly(
                "@mod, 'spoiler' was added to the blocklist.",
                "@mod, 'SPOILER' is already on the blocklist.");
        assertThat(harness.settings().wordBlocklist()).containsExactly("badword", "spoiler");
    }

    @Test
    void blockedWordStopsTranslation() {
        harness.moderator("!blockword", "spoiler");
        harness.messages().clear();

        harness.user("7", "ana", "!tr", "big Spoiler ahead");

        assertThat(harness.messages()).containsExactly("@ana, that message contains a blocked word.");
    }

    @Test
    void removesWordIgnoringCase() {
        harness.moderator("!unblockword", "BadWord");
        harness.moderator("!unblockword", "BadWord");

        assertThat(harness.messages()).containsExactly(
                "@mod, 'BadWord' was removed from the blocklist.",
                "@mod, 'BadWord' is not on the blocklist.");
        assertThat(harness.settings().wordBlocklist()).isEmpty();
    }

    @Test
    void missingWord() {
        harness.moderator("!blockword", " ");
        harness.moderator("!unblockword", "");

        assertThat(harness.messages()).containsExactly("@mod, name a word.", "@mod, name a word.");
    }

    @Test
    void nonModeratorCannotChangeBlocklist() {
        CommandDispatcher.DispatchResult result = harness.user("7", "ana", "!blockword", "hello");

        assertThat(result).isEqualTo(CommandDispatcher.DispatchResult.NOT_PERMITTED);
        assertThat(harness.settings().wordBlocklist()).containsExactly("badword");
    }
}
