package json.tiny;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInfo;

import java.lang.reflect.Method;
import java.util.logging.Logger;

/// Base class for all tiny-json tests.
/// - Emits an INFO banner per test, naming the parameterized invocation when there is one.
/// - Shares fixture builders for deep documents.
public class TinyJsonTestBase extends TinyJsonLoggingConfig {

    static final Logger LOG = Logger.getLogger("json.tiny");

    @BeforeEach
    void announce(TestInfo testInfo) {
        final String banner = banner(testInfo);
        LOG.info(() -> banner);
    }

    /// `TEST: Class#method`, followed by the display name when JUnit renamed the invocation.
    static String banner(TestInfo testInfo) {
        final String label = testInfo.getTestMethod()
                .map(m -> m.getDeclaringClass().getSimpleName() + "#" + m.getName())
                .orElseGet(testInfo::getDisplayName);
        final String display = testInfo.getDisplayName();
        final boolean renamed = testInfo.getTestMethod()
                .map(Method::getName)
                .map(name -> !display.startsWith(name + "("))
                .orElse(false);
        return renamed ? "TEST: " + label + " " + display : "TEST: " + label;
    }

    /// `depth` arrays nested inside each other.
    static String nestedArrays(int depth) {
        return "[".repeat(depth) + "]".repeat(depth);
    }
}
