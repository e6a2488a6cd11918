package io.github.cyfko.eligian.core.parsing;

/**
 * Lexical categories of the Eligian language. Keywords are {@link #IDENT} tokens.
 */
public enum TokenType {
    IDENT("identifier"),
    NUMBER("number"),
    STRING("string"),
    ID_NAME("'#name'"),
    CLASS_NAME("'.name'"),
    LBRACE("'{'"),
    RBRACE("'}'"),
    LPAREN("'('"),
    RPAREN("')'"),
    LBRACKET("'['"),
    RBRACKET("']'"),
    COMMA("','"),
    COLON("':'"),
    EQUALS("'='"),
    RANGE("'..'"),
    PLUS("'+'"),
    MINUS("'-'"),
    STAR("'*'"),
    SLASH("'/'"),
    EOF("end of input");

    private final String description;

    TokenType(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
