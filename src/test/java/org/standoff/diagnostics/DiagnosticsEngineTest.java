package org.standoff.diagnostics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.standoff.junit.extensions.logging.ExpectLog;
import org.standoff.junit.extensions.logging.LogLevel;
import org.standoff.junit.extensions.logging.LogWatchExtension;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class DiagnosticsEngineTest {

    @Test
    @ExpectLog(level = LogLevel.ERROR, loggerPattern = ".*DiagnosticsEngine", messagePattern = "\\{3:4\\} broken")
    @ExpectLog(level = LogLevel.WARN, loggerPattern = ".*DiagnosticsEngine", messagePattern = "\\{1:0\\} odd")
    void collectsAndLogsDiagnostics() {
        // Arrange
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        // Act
        diagnostics.reportWarning(Diagnostic.Kind.OVERLAP, "odd", "a.xml", 1, 0);
        diagnostics.reportError(Diagnostic.Kind.UNMATCHED_END_TAG, "broken", "a.xml", 3, 4);

        // Assert
        assertThat(diagnostics.hasErrors()).isTrue();
        assertThat(diagnostics.count(Diagnostic.Type.WARNING)).isEqualTo(1);
        assertThat(diagnostics.ofKind(Diagnostic.Kind.UNMATCHED_END_TAG))
                .extracting(Diagnostic::message).containsExactly("broken");
        assertThat(diagnostics.summary()).isEqualTo("[WARNING] a.xml {1:0} odd\n[ERROR] a.xml {3:4} broken");
    }

    @Test
    void emptyEngineHasNoErrors() {
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();

        assertThat(diagnostics.hasErrors()).isFalse();
        assertThat(diagnostics.getDiagnostics()).isEmpty();
        assertThat(diagnostics.summary()).isEmpty();
    }
}
