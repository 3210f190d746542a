package io.vtascan.types;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Parses type expressions written in Go syntax, e.g. {@code map[string]*pkg.T},
 * {@code func(int, ...string) (pkg.I, error)} or {@code interface{f(); g() int}}.
 * <p>
 * Bare names resolve to predeclared types first ({@code int}, {@code error}, {@code any}) and then
 * to named types of the default package; qualified names {@code pkg.Name} resolve against all
 * known named types. Instantiated generic types are looked up by their full rendering, e.g.
 * {@code P.Box[P.A]}. Embedded interfaces are flattened at parse time, so they must be defined first.
 */
public class TypeParser {

    private final String defaultPackage;
    private final Map<String, NamedType> namedTypes;

    private String text;
    private int pos;

    /**
     * @param defaultPackage Package used to resolve unqualified names
     * @param namedTypes     Named types keyed by their {@link NamedType#toString()} rendering
     */
    public TypeParser(String defaultPackage, Map<String, NamedType> namedTypes) {
        this.defaultPackage = defaultPackage == null ? "" : defaultPackage;
        this.namedTypes = namedTypes;
    }

    /**
     * Parses a type expression that only uses predeclared and literal types.
     */
    public static Type parseBuiltin(String text) {
        return new TypeParser("", Map.of()).parse(text);
    }

    /**
     * Parses a complete type expression.
     *
     * @throws IllegalArgumentException if the text is not a valid type or names an unknown type
     */
    public synchronized Type parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Type expression cannot be null or blank");
        }
        this.text = text;
        this.pos = 0;
        Type type = parseType();
        skipSpace();
        if (pos < text.length()) {
            throw error("unexpected trailing input");
        }
        return type;
    }

    /**
     * Parses a function type expression.
     *
     * @throws IllegalArgumentException if the text is not a function type
     */
    public Signature parseSignature(String text) {
        Type type = parse(text);
        if (!(type.underlying() instanceof Signature sig)) {
            throw new IllegalArgumentException("Not a function type: " + text);
        }
        return sig;
    }

    private Type parseType() {
        skipSpace();
        if (accept("*")) {
            return new PointerType(parseType());
        }
        if (accept("<-")) {
            expectKeyword("chan");
            return new ChanType(parseType(), ChanDir.RECV_ONLY);
        }
        if (accept("[")) {
            if (accept("]")) {
                return new SliceType(parseType());
            }
            long length = parseLength();
            expect("]");
            return new ArrayType(parseType(), length);
        }
        if (accept("(")) {
            Type inner = parseType();
            expect(")");
            return inner;
        }
        String ident = parseIdent();
        switch (ident) {
            case "map": {
                expect("[");
                Type key = parseType();
                expect("]");
                return new MapType(key, parseType());
            }
            case "chan":
                if (accept("<-")) {
                    return new ChanType(parseType(), ChanDir.SEND_ONLY);
                }
                return new ChanType(parseType(), ChanDir.SEND_RECV);
            case "func":
                return parseSignatureRest();
            case "interface":
                return parseInterface();
            case "struct":
                return parseStruct();
            default:
                return resolveName(ident);
        }
    }

    private Signature parseSignatureRest() {
        expect("(");
        List<Type> params = new ArrayList<>();
        boolean variadic = false;
        if (!accept(")")) {
            do {
                skipParamName();
                if (accept("...")) {
                    params.add(new SliceType(parseType()));
                    variadic = true;
                } else {
                    params.add(parseType());
                }
            } while (accept(","));
            expect(")");
        }
        List<Type> results = new ArrayList<>();
        skipSpace();
        if (accept("(")) {
            if (!accept(")")) {
                do {
                    skipParamName();
                    results.add(parseType());
                } while (accept(","));
                expect(")");
            }
        } else if (startsType()) {
            results.add(parseType());
        }
        return new Signature(params, results, variadic);
    }

    private InterfaceType parseInterface() {
        expect("{");
        List<InterfaceType.Method> methods = new ArrayList<>();
        while (!accept("}")) {
            String name = parseIdent();
            skipSpace();
            if (peek("(")) {
                methods.add(new InterfaceType.Method(name, parseSignatureRest()));
            } else {
                Type embedded = name.equals("error") ? Types.ERROR : resolveQualified(name);
                if (!(embedded.underlying() instanceof InterfaceType inner)) {
                    throw error("embedded type " + embedded + " is not an interface");
                }
                for (InterfaceType.Method m : inner.methods()) {
                    if (methods.stream().noneMatch(existing -> existing.name().equals(m.name()))) {
                        methods.add(m);
                    }
                }
            }
            if (!accept(";")) {
                expect("}");
                break;
            }
        }
        return new InterfaceType(methods);
    }

    private StructType parseStruct() {
        expect("{");
        List<StructType.Field> fields = new ArrayList<>();
        while (!accept("}")) {
            if (peek("*")) {
                Type type = parseType();
                Type elem = ((PointerType) type).elem();
                String name = elem instanceof NamedType named ? named.name() : elem.toString();
                fields.add(new StructType.Field(name, type, true));
                if (!accept(";")) {
                    expect("}");
                    break;
                }
                continue;
            }
            int start = pos;
            String first = parseIdent();
            skipSpace();
            if (peek(";") || peek("}") || peek(".")) {
                // embedded field: T or pkg.T
                pos = start;
                Type type = parseType();
                String name = type instanceof NamedType named ? named.name() : first;
                fields.add(new StructType.Field(name, type, true));
            } else {
                List<String> names = new ArrayList<>();
                names.add(first);
                while (accept(",")) {
                    names.add(parseIdent());
                }
                Type type = parseType();
                for (String n : names) {
                    fields.add(new StructType.Field(n, type));
                }
            }
            if (!accept(";")) {
                expect("}");
                break;
            }
        }
        return new StructType(fields);
    }

    private Type resolveName(String ident) {
        switch (ident) {
            case "error":
                return Types.ERROR;
            case "any":
                return InterfaceType.EMPTY;
            default:
                break;
        }
        return BasicType.predeclared(ident)
                .map(Type.class::cast)
                .orElseGet(() -> resolveQualified(ident));
    }

    private Type resolveQualified(String ident) {
        String qualified;
        if (accept(".")) {
            qualified = ident + "." + parseIdent();
        } else {
            qualified = defaultPackage.isEmpty() ? ident : defaultPackage + "." + ident;
        }
        String key = qualified;
        if (accept("[")) {
            List<String> args = new ArrayList<>();
            do {
                args.add(parseType().toString());
            } while (accept(","));
            expect("]");
            key = qualified + "[" + String.join(",", args) + "]";
        }
        NamedType named = namedTypes.get(key);
        if (named == null) {
            throw error("unknown type " + key);
        }
        return named;
    }

    // A parameter name is an identifier directly followed by the start of a type.
    private void skipParamName() {
        skipSpace();
        int start = pos;
        if (!Character.isJavaIdentifierStart(current())) {
            return;
        }
        String ident = parseIdent();
        skipSpace();
        boolean keyword = ident.equals("map") || ident.equals("chan") || ident.equals("func")
                || ident.equals("interface") || ident.equals("struct");
        if (keyword || !(startsType() || peek("..."))) {
            pos = start;
        }
    }

    private boolean startsType() {
        skipSpace();
        if (pos >= text.length()) {
            return false;
        }
        char c = text.charAt(pos);
        return c == '*' || c == '[' || c == '(' || peek("<-") || Character.isJavaIdentifierStart(c);
    }

    private long parseLength() {
        skipSpace();
        int start = pos;
        while (pos < text.length() && Character.isDigit(text.charAt(pos))) {
            pos++;
        }
        if (start == pos) {
            throw error("expected array length");
        }
        return Long.parseLong(text.substring(start, pos));
    }

    private String parseIdent() {
        skipSpace();
        int start = pos;
        if (pos < text.length() && Character.isJavaIdentifierStart(text.charAt(pos))) {
            pos++;
            while (pos < text.length() && Character.isJavaIdentifierPart(text.charAt(pos))) {
                pos++;
            }
        }
        if (start == pos) {
            throw error("expected identifier");
        }
        return text.substring(start, pos);
    }

    private void expectKeyword(String keyword) {
        int start = pos;
        if (!parseIdent().equals(keyword)) {
            pos = start;
            throw error("expected '" + keyword + "'");
        }
    }

    private void expect(String token) {
        if (!accept(token)) {
            throw error("expected '" + token + "'");
        }
    }

    private boolean accept(String token) {
        if (peek(token)) {
            pos += token.length();
            return true;
        }
        return false;
    }

    private boolean peek(String token) {
        skipSpace();
        return text.startsWith(token, pos);
    }

    private char current() {
        return pos < text.length() ? text.charAt(pos) : '\0';
    }

    private void skipSpace() {
        while (pos < text.length() && Character.isWhitespace(text.charAt(pos))) {
            pos++;
        }
    }

    private IllegalArgumentException error(String message) {
        return new IllegalArgumentException(
                "Invalid type '" + text + "' at offset " + pos + ": " + message);
    }
}
