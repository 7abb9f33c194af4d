package ai.gamedata.translator.cli;

import ai.gamedata.translator.batch.BatchOrdering;
import picocli.CommandLine;

public class BatchOrderingConverter implements CommandLine.ITypeConverter<BatchOrdering> {

    @Override
    public BatchOrdering convert(String value) {
        return BatchOrdering.from(value);
    }
}
