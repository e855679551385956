package com.pagewright.core.event;

import com.pagewright.core.filter.TestFilters;
import com.pagewright.core.model.Item;
import com.pagewright.core.model.Layout;
import com.pagewright.core.model.SnapshotName;
import com.pagewright.core.rep.CompilationContext;
import com.pagewright.core.rep.Representation;
import com.pagewright.core.util.TempFilenameFactory;
import com.pagewright.core.writer.RepresentationWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link CompilationEventBus}.
 */
class CompilationEventBusTest {

    @TempDir
    Path tempDir;

    private CompilationEventBus bus;
    private Representation rep;

    @BeforeEach
    void setUp() {
        bus = new CompilationEventBus();
        CompilationContext context = new CompilationContext(TestFilters.registry(), bus,
            new RepresentationWriter(bus), new TempFilenameFactory(tempDir));
        rep = new Representation(Item.textual("/about/", "hello"), "default", context);
    }

    @Test
    void publish_deliversToEveryListenerInRegistrationOrder() {
        // Given
        RecordingListener first = bus.addListener(new RecordingListener());
        RecordingListener second = bus.addListener(new RecordingListener());

        // When
        bus.filteringStarted(rep, "upcase");
        bus.processingStarted(Layout.of("/default/", "x"));
        bus.willWriteRep(rep, SnapshotName.LAST);

        // Then
        assertThat(first.events()).containsExactly(
            "filteringStarted /about/ (default) upcase",
            "processingStarted /default/",
            "willWriteRep /about/ (default) :last"
        );
        assertThat(second.events()).isEqualTo(first.events());
    }

    @Test
    void removeListener_stopsDelivery() {
        RecordingListener listener = bus.addListener(new RecordingListener());

        assertThat(bus.removeListener(listener)).isTrue();
        bus.compilationStarted(rep);

        assertThat(listener.events()).isEmpty();
        assertThat(bus.getListeners()).isEmpty();
        assertThat(bus.removeListener(listener)).isFalse();
    }

    @Test
    void listenerFailure_propagatesToCaller() {
        bus.addListener(new CompilationListener() {
            @Override
            public void compilationStarted(Representation r) {
                throw new IllegalStateException("listener broke");
            }
        });

        assertThatThrownBy(() -> bus.compilationStarted(rep))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("listener broke");
    }

    @Test
    void listener_canUnregisterWhileEventIsDelivered() {
        RecordingListener recorder = new RecordingListener();
        bus.addListener(new CompilationListener() {
            @Override
            public void compilationEnded(Representation r) {
                bus.removeListener(this);
            }
        });
        bus.addListener(recorder);

        bus.compilationEnded(rep);
        bus.compilationEnded(rep);

        assertThat(recorder.events()).hasSize(2);
        assertThat(bus.getListeners()).containsExactly(recorder);
    }

    @Test
    void defaultListener_ignoresEvents() {
        CompilationListener noop = new CompilationListener() { };

        assertThatCode(() -> {
            noop.visitStarted(rep.getItem());
            noop.repWritten(rep, tempDir.resolve("x"), true, true);
        }).doesNotThrowAnyException();
    }
}
