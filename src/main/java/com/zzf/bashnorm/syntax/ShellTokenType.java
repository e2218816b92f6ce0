package com.zzf.bashnorm.syntax;

enum ShellTokenType {
    WORD,
    PIPE,       // |
    PIPE_AMP,   // |&
    AND_IF,     // &&
    OR_IF,      // ||
    SEMI,       // ;
    DSEMI,      // ;;
    AMP,        // &
    LPAREN,     // (
    RPAREN,     // )
    REDIRECT,   // < > >> << <<- <<< <& >& <> >| &> &>>, with an optional fd prefix
    NEWLINE,
    EOF
}
