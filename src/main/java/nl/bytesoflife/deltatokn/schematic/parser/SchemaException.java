package nl.bytesoflife.deltatokn.schematic.parser;

/**
 * Raised when a syntactically valid tree is not a usable KiCad schematic: the root tag is wrong or
 * an element lacks a field it cannot do without.
 */
public class SchemaException extends RuntimeException {

    public SchemaException(String message) {
        super(message);
    }
}
