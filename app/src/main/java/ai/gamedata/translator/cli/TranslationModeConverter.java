package ai.gamedata.translator.cli;

import ai.gamedata.translator.translate.TranslationMode;
import picocli.CommandLine;

public class TranslationModeConverter implements CommandLine.ITypeConverter<TranslationMode> {

    @Override
    public TranslationMode convert(String value) {
        try {
            return TranslationMode.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException(
                    "expected production, dry-run or mock but was '" + value + "'");
        }
    }
}
