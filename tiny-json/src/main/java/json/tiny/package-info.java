/// A small JSON library: an owned, mutable [json.tiny.Value] tree, a
/// recursive-descent parser, a canonical compact serializer, a total order
/// over values and a one-level shape check.
///
/// Entry points:
///
/// - [json.tiny.Json] parses text into values and serializes them;
/// - [json.tiny.Value] builds, reads, mutates and compares values;
/// - [json.tiny.ShapeValidator] checks the direct fields of an object.
///
/// The package has no dependencies beyond `java.base`. Logging goes through
/// `java.util.logging` at `FINE` and below.
package json.tiny;
