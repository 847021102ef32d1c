package json.tiny;

/// The variant tag of a [Value].
///
/// Declaration order is significant: [ValueComparator] orders values of
/// different tags by ordinal, after collapsing [#INTEGER] and [#NUMBER]
/// into a single numeric class.
public enum Type {
    NULL,
    INTEGER,
    NUMBER,
    BOOL,
    STRING,
    ARRAY,
    OBJECT;

    /// {@return true for [#INTEGER] and [#NUMBER]}
    public boolean isNumeric() {
        return this == INTEGER || this == NUMBER;
    }
}
