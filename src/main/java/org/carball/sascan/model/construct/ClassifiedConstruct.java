package org.carball.sascan.model.construct;

/**
 * One construct found on a physical source line.
 *
 * @param kind        what the line was classified as
 * @param lineNumber  1-based line number in the source unit
 * @param name        step, procedure or macro name where the construct carries one, otherwise null
 * @param macro       the parsed definition for {@link ConstructKind#MACRO_DEFINITION}, otherwise null
 */
public record ClassifiedConstruct(ConstructKind kind, int lineNumber, String name, MacroDefinition macro) {

    public static ClassifiedConstruct of(ConstructKind kind, int lineNumber) {
        return new ClassifiedConstruct(kind, lineNumber, null, null);
    }

    public static ClassifiedConstruct named(ConstructKind kind, int lineNumber, String name) {
        return new ClassifiedConstruct(kind, lineNumber, name, null);
    }

    public static ClassifiedConstruct macroDefinition(int lineNumber, MacroDefinition macro) {
        return new ClassifiedConstruct(ConstructKind.MACRO_DEFINITION, lineNumber, macro.name(), macro);
    }
}
