package ai.gamedata.translator.cli;

import ai.gamedata.translator.translate.PassMode;
import picocli.CommandLine;

public class PassModeConverter implements CommandLine.ITypeConverter<PassMode> {

    @Override
    public PassMode convert(String value) {
        return PassMode.from(value);
    }
}
