package com.sqlrecorder.control;

import com.sqlrecorder.agent.*;
import com.sqlrecorder.fixture.FakeQueryExecutor;
import com.sqlrecorder.fixture.OrderRepository;
import com.sqlrecorder.store.InMemoryTraceStore;
import com.sqlrecorder.store.StoreUnavailableException;
import com.sqlrecorder.store.TraceKeys;
import com.sqlrecorder.store.TraceStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.SQLException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RecorderControlTest {

    private InMemoryTraceStore store;
    private FakeQueryExecutor executor;
    private QueryDispatch dispatch;
    private ActivationController controller;
    private RecorderControl control;
    private OrderRepository orders;

    @BeforeEach
    void setUp() {
        store = new InMemoryTraceStore();
        executor = new FakeQueryExecutor();
        dispatch = new QueryDispatch(executor, RecorderConfig.defaults());
        controller = new ActivationController(store, dispatch, RecorderConfig.defaults());
        control = new RecorderControl(controller);
        orders = new OrderRepository(dispatch);
    }

    @AfterEach
    void tearDown() {
        RecorderContext.detach();
    }

    private static RequestContext request(String path) {
        return RequestContext.of(path, "GET", "", Map.of(), Map.of());
    }

    private RequestTrace recordRequest(String path, int queries) throws SQLException {
        try (RequestScope scope = controller.begin(request(path))) {
            for (int i = 0; i < queries; i++) {
                orders.countOpen();
            }
            scope.close();
            return scope.trace();
        }
    }

    // --- Status ---

    @Test
    void statusReflectsFlag() {
        assertEquals(RecorderStatus.INACTIVE, control.getStatus());
        controller.activate();
        assertEquals(RecorderStatus.ACTIVE, control.getStatus());
        assertEquals("Active", control.getStatus().status());
        assertEquals("green", control.getStatus().color());
    }

    @Test
    void setStateEnablesOnlyOnLiteralTrue() {
        assertEquals(RecorderStatus.ACTIVE, control.setState("true"));
        assertTrue(controller.isActive());
        assertEquals(RecorderStatus.INACTIVE, control.setState("TRUE"));
        assertFalse(controller.isActive());
        control.setState("true");
        assertEquals(RecorderStatus.INACTIVE, control.setState(null));
        assertFalse(control.getStatus().isActive());
        assertEquals("red", control.setState("false").color());
    }

    // --- Get ---

    @Test
    void getByIdReturnsFullRecord() throws SQLException {
        control.setState("true");
        RequestTrace dumped = recordRequest("/orders", 4);

        RequestTrace detail = control.get(dumped.id);
        assertEquals(dumped.id, detail.id);
        assertEquals("/orders", detail.path);
        assertEquals(4, detail.callCount);
        assertEquals(4, detail.calls.size());
        assertNotNull(detail.http);
    }

    @Test
    void getUnknownIdThrowsNotFound() {
        TraceNotFoundException e = assertThrows(TraceNotFoundException.class, () -> control.get("0123456789"));
        assertEquals("0123456789", e.getTraceId());
    }

    @Test
    void getBlankIdIsRejected() {
        assertThrows(IllegalArgumentException.class, () -> control.get(" "));
    }

    @Test
    void getExpiredIdThrowsNotFound() {
        store.set(TraceKeys.request("abc"), "{\"id\":\"abc\"}", Duration.ofMillis(1));
        assertThrows(TraceNotFoundException.class, () -> {
            Thread.sleep(5);
            control.get("abc");
        });
    }

    @Test
    void listReturnsSummariesNewestFirst() throws SQLException {
        control.setState("true");
        RequestTrace first = recordRequest("/first", 1);
        RequestTrace second = recordRequest("/second", 2);

        List<RequestTrace> list = control.get();
        assertEquals(2, list.size());
        assertEquals(second.id, list.get(0).id);
        assertEquals(first.id, list.get(1).id);
        assertNull(list.get(0).calls);
    }

    @Test
    void twoQueriesOfFiveAndTenMilliseconds() {
        control.setState("true");
        Recorder recorder = controller.record(request("/orders"));
        recorder.register(new CallRecord("SELECT 1", "", 1.0, 5.0));
        recorder.register(new CallRecord("SELECT 2", "", 1.0, 10.0));
        controller.dump();

        RequestTrace summary = control.get().get(0);
        assertEquals(2, summary.callCount);
        assertEquals(15.0, summary.totalQueryTimeMs);
    }

    // --- Delete ---

    @Test
    void deleteEmptiesListButKeepsDetails() throws SQLException {
        control.setState("true");
        RequestTrace dumped = recordRequest("/orders", 1);

        control.delete();

        assertTrue(control.get().isEmpty());
        assertEquals(dumped.id, control.get(dumped.id).id);
    }

    // --- Never recorded ---

    @Test
    void controlCallsDetachTheRecorder() throws SQLException {
        control.setState("true");
        Recorder recorder = controller.record(request("/api/method/recorder.get_status"));
        orders.countOpen();
        assertEquals(1, recorder.calls().size());

        control.getStatus();

        assertNull(RecorderContext.current());
        assertSame(executor, dispatch.target(), "thread is back on the unwrapped executor");
        orders.countOpen();
        assertEquals(1, recorder.calls().size());
        assertTrue(controller.isActive(), "flag untouched");
        assertNull(controller.dump());
    }

    @Test
    void doNotRecordRunsQueriesUnrecorded() throws SQLException {
        control.setState("true");
        Recorder recorder = controller.record(request("/report"));

        List<Map<String, Object>> rows = RecorderControl.doNotRecord(() -> {
            try {
                return orders.countOpen();
            } catch (SQLException e) {
                throw new IllegalStateException(e);
            }
        });

        assertEquals(1, rows.size());
        assertTrue(recorder.calls().isEmpty());
        assertEquals(1, executor.executions());
        assertTrue(controller.isActive());
    }

    @Test
    void everyOperationDetachesFirst() throws SQLException {
        control.setState("true");
        RequestTrace dumped = recordRequest("/orders", 1);

        controller.record(request("/a"));
        control.setState("true");
        assertNull(RecorderContext.current());

        controller.record(request("/b"));
        control.get();
        assertNull(RecorderContext.current());

        controller.record(request("/c"));
        control.get(dumped.id);
        assertNull(RecorderContext.current());

        controller.record(request("/d"));
        control.delete();
        assertNull(RecorderContext.current());

        controller.record(request("/e"));
        assertThrows(TraceNotFoundException.class, () -> control.get("missing"));
        assertNull(RecorderContext.current());
    }

    // --- Store failures ---

    @Test
    void storeFailurePropagatesAfterDetaching() {
        TraceStore down = new InMemoryTraceStore() {
            @Override
            public String get(String key) {
                throw new StoreUnavailableException("cache unreachable");
            }
        };
        ActivationController downController = new ActivationController(down, dispatch, RecorderConfig.defaults());
        RecorderControl downControl = new RecorderControl(downController);

        controller.activate();
        controller.record(request("/orders"));

        assertThrows(StoreUnavailableException.class, downControl::getStatus);
        assertNull(RecorderContext.current());
        assertSame(executor, dispatch.target());
    }
}
