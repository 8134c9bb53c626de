package me.golemcore.sessions.client;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;

/**
 * In-memory connector whose connections are opened, fed and dropped by the
 * test.
 */
class FakeRealtimeConnector implements RealtimeConnector {

    private final List<FakeConnection> connections = new ArrayList<>();

    @Override
    public RealtimeConnection connect(URI uri, RealtimeListener listener) {
        FakeConnection connection = new FakeConnection(uri, listener);
        connections.add(connection);
        return connection;
    }

    List<FakeConnection> connections() {
        return connections;
    }

    FakeConnection last() {
        return connections.get(connections.size() - 1);
    }

    static final class FakeConnection implements RealtimeConnection {

        private final URI uri;
        private final RealtimeListener listener;
        private final List<String> sent = new ArrayList<>();
        private boolean closed;

        private FakeConnection(URI uri, RealtimeListener listener) {
            this.uri = uri;
            this.listener = listener;
        }

        @Override
        public boolean send(String payload) {
            if (closed) {
                return false;
            }
            sent.add(payload);
            return true;
        }

        @Override
        public void close() {
            closed = true;
        }

        void open() {
            listener.onOpen(this);
        }

        void receive(String payload) {
            listener.onMessage(payload);
        }

        void drop(Throwable error) {
            closed = true;
            listener.onClose(error);
        }

        URI uri() {
            return uri;
        }

        List<String> sent() {
            return sent;
        }

        boolean isClosed() {
            return closed;
        }
    }
}
