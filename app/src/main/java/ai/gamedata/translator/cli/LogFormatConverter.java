package ai.gamedata.translator.cli;

import ai.gamedata.translator.config.LogFormat;
import picocli.CommandLine;

/**
 * Parses {@code --log-format text|json}.
 */
public class LogFormatConverter implements CommandLine.ITypeConverter<LogFormat> {
    @Override
    public LogFormat convert(String value) {
        try {
            return LogFormat.from(value);
        } catch (IllegalArgumentException ex) {
            throw new CommandLine.TypeConversionException("expected text or json but was '" + value + "'");
        }
    }
}
