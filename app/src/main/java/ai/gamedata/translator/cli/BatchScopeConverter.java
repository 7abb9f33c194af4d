package ai.gamedata.translator.cli;

import ai.gamedata.translator.batch.BatchScope;
import picocli.CommandLine;

public class BatchScopeConverter implements CommandLine.ITypeConverter<BatchScope> {

    @Override
    public BatchScope convert(String value) {
        return BatchScope.from(value);
    }
}
