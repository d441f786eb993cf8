package daddy.lexer;

public enum PygmyTokenType {
	IDENT,
	NUMBER,
	STRING,
	BUILTIN,
	// layout tokens, derived from line breaks and indentation
	NEWLINE,
	INDENT,
	DEDENT,
	EOF,
}
