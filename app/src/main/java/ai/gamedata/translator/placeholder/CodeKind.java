package ai.gamedata.translator.placeholder;

/**
 * Families of control sequences recognised inside game text.
 */
public enum CodeKind {
    NAMEBOX_OPEN,
    COLOR,
    PARAMETERIZED,
    ANGLE_PARAMETERIZED,
    SYMBOL,
    BARE_LETTER,
    INLINE_TAG,
    FORMAT_SPECIFIER
}
