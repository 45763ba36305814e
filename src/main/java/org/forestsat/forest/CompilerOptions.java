package org.forestsat.forest;

/**
 * Configurazione del compilatore.
 *
 * @param encoding codifica delle distanze (predefinita: UNARY)
 */
public record CompilerOptions(DistanceEncodingKind encoding) {

    public CompilerOptions {
        if (encoding == null) {
            throw new IllegalArgumentException("La codifica delle distanze non può essere null");
        }
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(DistanceEncodingKind.UNARY);
    }

    public CompilerOptions withEncoding(DistanceEncodingKind kind) {
        return new CompilerOptions(kind);
    }
}
