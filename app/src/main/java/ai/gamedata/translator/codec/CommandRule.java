package ai.gamedata.translator.codec;

import ai.gamedata.translator.project.ContentCategory;

/**
 * How text is taken out of one event command code.
 */
public record CommandRule(int code, int parameterIndex, ContentCategory category, Shape shape) {

    public enum Shape {
        /** Consecutive commands of the same code form one multi-line unit. */
        LINE_BLOCK,
        /** The parameter is a list of strings, one unit each. */
        STRING_LIST,
        /** The parameter is a single string. */
        STRING,
        /** The parameter holds plugin arguments, filtered by the plugin whitelist. */
        PLUGIN_ARGUMENTS
    }
}
