package ai.chatbridge.translator.cli;

import ai.chatbridge.translator.translate.TranslationMode;
import picocli.CommandLine;

public class TranslationModeConverter implements CommandLine.ITypeConverter<TranslationMode> {

    @Override
    public TranslationMode convert(String value) {
        return TranslationMode.from(value);
    }
}
