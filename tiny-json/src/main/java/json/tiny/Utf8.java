package json.tiny;

import java.io.ByteArrayOutputStream;
import java.util.Objects;

/// UTF-8 conversion that round-trips lone surrogates.
///
/// The parser keeps an unpaired surrogate escape such as `uD800` as a lone
/// surrogate char. [java.nio.charset.StandardCharsets#UTF_8] would replace it
/// with `?`; [#encode(CharSequence)] instead writes it as its own three-byte
/// sequence (`ED A0 80`), and [#decode(byte[])] reads such a sequence back.
/// Properly paired surrogates are always written as one four-byte sequence.
public final class Utf8 {

    private static final char REPLACEMENT = '\uFFFD';

    private Utf8() {
    }

    /// {@return the UTF-8 bytes of `text`, lone surrogates encoded as three bytes}
    public static byte[] encode(CharSequence text) {
        Objects.requireNonNull(text, "text must not be null");
        final var out = new ByteArrayOutputStream(text.length() + 16);
        final int n = text.length();
        for (int i = 0; i < n; i++) {
            final char ch = text.charAt(i);
            if (ch < 0x80) {
                out.write(ch);
            } else if (ch < 0x800) {
                out.write(0xC0 | (ch >> 6));
                out.write(0x80 | (ch & 0x3F));
            } else if (Character.isHighSurrogate(ch) && i + 1 < n && Character.isLowSurrogate(text.charAt(i + 1))) {
                final int cp = Character.toCodePoint(ch, text.charAt(++i));
                out.write(0xF0 | (cp >> 18));
                out.write(0x80 | ((cp >> 12) & 0x3F));
                out.write(0x80 | ((cp >> 6) & 0x3F));
                out.write(0x80 | (cp & 0x3F));
            } else {
                out.write(0xE0 | (ch >> 12));
                out.write(0x80 | ((ch >> 6) & 0x3F));
                out.write(0x80 | (ch & 0x3F));
            }
        }
        return out.toByteArray();
    }

    /// Decodes UTF-8 leniently.
    ///
    /// Three-byte encodings of surrogates become surrogate chars. Any other
    /// malformed, overlong or truncated sequence becomes one U+FFFD per
    /// offending lead byte.
    public static String decode(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        final var out = new StringBuilder(bytes.length);
        int i = 0;
        while (i < bytes.length) {
            final int b = bytes[i] & 0xFF;
            if (b < 0x80) {
                out.append((char) b);
                i++;
            } else if (b >= 0xC2 && b <= 0xDF && continuation(bytes, i + 1, 1)) {
                out.append((char) (((b & 0x1F) << 6) | (bytes[i + 1] & 0x3F)));
                i += 2;
            } else if (b >= 0xE0 && b <= 0xEF && continuation(bytes, i + 1, 2)) {
                final int cp = ((b & 0x0F) << 12) | ((bytes[i + 1] & 0x3F) << 6) | (bytes[i + 2] & 0x3F);
                if (cp < 0x800) {
                    out.append(REPLACEMENT);
                    i++;
                } else {
                    out.append((char) cp);
                    i += 3;
                }
            } else if (b >= 0xF0 && b <= 0xF4 && continuation(bytes, i + 1, 3)) {
                final int cp = ((b & 0x07) << 18) | ((bytes[i + 1] & 0x3F) << 12)
                        | ((bytes[i + 2] & 0x3F) << 6) | (bytes[i + 3] & 0x3F);
                if (cp < 0x10000 || cp > Character.MAX_CODE_POINT) {
                    out.append(REPLACEMENT);
                    i++;
                } else {
                    out.appendCodePoint(cp);
                    i += 4;
                }
            } else {
                out.append(REPLACEMENT);
                i++;
            }
        }
        return out.toString();
    }

    private static boolean continuation(byte[] bytes, int from, int count) {
        if (from + count > bytes.length) {
            return false;
        }
        for (int k = from; k < from + count; k++) {
            if ((bytes[k] & 0xC0) != 0x80) {
                return false;
            }
        }
        return true;
    }
}
