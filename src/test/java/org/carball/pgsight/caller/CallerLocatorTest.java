package org.carball.pgsight.caller;

import org.carball.pgsight.model.monitor.SourceLocation;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CallerLocatorTest {

    @Test
    void shouldReturnFirstApplicationFrameAfterSkippedFrames() {
        // Given
        List<CallerFrame> stack = List.of(
                new CallerFrame("com.example.shop.Instrumentation", "Instrumentation.java", 10, "record"),
                new CallerFrame("org.postgresql.jdbc.PgStatement", "PgStatement.java", 300, "execute"),
                new CallerFrame("com.example.shop.InvoiceService", "InvoiceService.java", 88, "totals"));
        CallerLocator locator = new CallerLocator(() -> stack, 1,
                StackFrameFilter.applicationFrames(List.of("org.postgresql.")));

        // When
        SourceLocation location = locator.locate();

        // Then
        assertThat(location).isEqualTo(new SourceLocation("com/example/shop/InvoiceService.java", 88, "totals"));
    }

    @Test
    void shouldReturnNullWhenNoFrameQualifies() {
        List<CallerFrame> stack = List.of(
                new CallerFrame("java.lang.Thread", "Thread.java", 833, "run"));
        CallerLocator locator = new CallerLocator(() -> stack, 0,
                StackFrameFilter.applicationFrames(List.of("java.")));

        assertThat(locator.locate()).isNull();
    }

    @Test
    void shouldReturnNullWhenStackInspectionFails() {
        CallerLocator locator = new CallerLocator(() -> {
            throw new IllegalStateException("stack unavailable");
        }, 0, frame -> true);

        assertThat(locator.locate()).isNull();
    }

    @Test
    void shouldFindTheCallingMethodOnTheRealStack() {
        CallerLocator locator = new CallerLocator(0, 20,
                frame -> !frame.className().equals(CallerLocator.class.getName()));

        SourceLocation location = locator.locate();

        assertThat(location).isNotNull();
        assertThat(location.file()).isEqualTo("org/carball/pgsight/caller/CallerLocatorTest.java");
        assertThat(location.method()).isEqualTo("shouldFindTheCallingMethodOnTheRealStack");
        assertThat(location.line()).isPositive();
    }

    @Test
    void shouldDerivePathFromClassNameWhenFileNameMissing() {
        CallerFrame frame = new CallerFrame("com.example.shop.Cart$Item", null, -1, "price");

        assertThat(frame.path()).isEqualTo("com/example/shop/Cart.java");
    }
}
