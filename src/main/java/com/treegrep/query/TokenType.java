package com.treegrep.query;

public enum TokenType {
    LABEL,
    QUOTED,
    REGEX,
    WILDCARD,
    POSITION,
    RELATION,
    LPAREN,
    RPAREN,
    LBRACKET,
    RBRACKET,
    NOT,
    AND,
    OR,
    EOF
}
