package com.ebayseller.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

public class DashboardAppTest {

    private final List<Long> frames = new ArrayList<>();
    private EventBus bus;
    private AppState state;
    private DashboardApp app;

    @BeforeEach
    void setUp() {
        bus = new EventBus();
        state = new AppState();
        ScraperSettings settings = ScraperSettings.load(key -> null);
        StageOrchestrator orchestrator = new StageOrchestrator(state, bus, (name, task) -> { },
            new ProcessSupervisorInterface() {
                public String start() { return "http://localhost:9222"; }
                public boolean isRunning() { return false; }
                public void stop() { }
            },
            new FakeBrowserSession(), null, new CsvService(), settings);
        app = new DashboardApp(bus, orchestrator, s -> frames.add(s.getRevision()));
    }

    @AfterEach
    void tearDown() {
        bus.close();
    }

    @Test
    void testTickRendersOnlyChangedState() {
        app.dispatch(new BusEvent.Tick(), state);
        app.dispatch(new BusEvent.Tick(), state);
        assertEquals(1, frames.size());

        app.dispatch(new BusEvent.App(new AppEvent.SwitchSection()), state);
        app.dispatch(new BusEvent.Tick(), state);
        assertEquals(2, frames.size());
        assertEquals(AppState.Section.TABLE, state.getSection());
    }

    @Test
    void testInputIsMappedThroughKeyBindings() {
        app.dispatch(new BusEvent.Input("tab"), state);
        assertEquals(AppState.Section.TABLE, state.getSection());

        long revision = state.getRevision();
        app.dispatch(new BusEvent.Input("x"), state);
        assertEquals(revision, state.getRevision());

        app.dispatch(new BusEvent.Input("q"), state);
        assertFalse(state.isRunning());
    }
}
