package com.headspace.trigger.event;

import lombok.extern.slf4j.Slf4j;
import org.postgresql.PGConnection;
import org.postgresql.PGNotification;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.function.Consumer;

/**
 * PostgreSQL LISTEN/NOTIFY 通道。
 * <p>
 * 监听占用一条独立连接；断线后指数退避重连，重连成功时回调 onReconnect 以便调用方补齐断线期间漏掉的通知。
 * </p>
 */
@Slf4j
class PgNotifyRelay {

    private static final int POLL_TIMEOUT_MILLIS = 3000;
    private static final long MIN_BACKOFF_MILLIS = 500L;
    private static final long MAX_BACKOFF_MILLIS = 15_000L;

    private final DataSource dataSource;
    private final String channel;
    private final Consumer<String> onNotification;
    private final Runnable onReconnect;
    private volatile Thread listenerThread;

    PgNotifyRelay(DataSource dataSource, String channel, Consumer<String> onNotification, Runnable onReconnect) {
        this.dataSource = dataSource;
        this.channel = channel;
        this.onNotification = onNotification;
        this.onReconnect = onReconnect;
    }

    synchronized void start() {
        if (listenerThread != null) {
            return;
        }
        Thread thread = new Thread(this::listen, "monitor-event-relay");
        thread.setDaemon(true);
        listenerThread = thread;
        thread.start();
    }

    synchronized void stop() {
        Thread thread = listenerThread;
        listenerThread = null;
        if (thread != null) {
            thread.interrupt();
        }
    }

    void send(String payload) throws SQLException {
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement("SELECT pg_notify(?, ?)")) {
            statement.setString(1, channel);
            statement.setString(2, payload);
            statement.execute();
        }
    }

    private void listen() {
        long backoffMillis = MIN_BACKOFF_MILLIS;
        boolean reconnect = false;
        while (isActive()) {
            try (Connection connection = dataSource.getConnection()) {
                try (Statement statement = connection.createStatement()) {
                    // quoted so the name matches pg_notify exactly
                    statement.execute("LISTEN \"" + channel.replace("\"", "\"\"") + "\"");
                }
                log.info("EVENT_RELAY_LISTENING channel={}, reconnect={}", channel, reconnect);
                if (reconnect) {
                    runCallback(onReconnect);
                }
                backoffMillis = MIN_BACKOFF_MILLIS;
                poll(connection);
            } catch (SQLException ex) {
                if (!isActive()) {
                    break;
                }
                log.warn("EVENT_RELAY_LOST channel={}, retryInMs={}, error={}", channel, backoffMillis, ex.getMessage());
            }
            reconnect = true;
            if (!pause(backoffMillis)) {
                break;
            }
            backoffMillis = Math.min(backoffMillis * 2, MAX_BACKOFF_MILLIS);
        }
        log.info("EVENT_RELAY_STOPPED channel={}", channel);
    }

    private void poll(Connection connection) throws SQLException {
        PGConnection pgConnection = connection.unwrap(PGConnection.class);
        while (isActive() && !connection.isClosed()) {
            PGNotification[] notifications = pgConnection.getNotifications(POLL_TIMEOUT_MILLIS);
            if (notifications == null) {
                continue;
            }
            for (PGNotification notification : notifications) {
                String payload = notification.getParameter();
                runCallback(() -> onNotification.accept(payload));
            }
        }
    }

    private void runCallback(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException ex) {
            log.warn("EVENT_RELAY_CALLBACK_FAILED channel={}, error={}", channel, ex.getMessage(), ex);
        }
    }

    private boolean isActive() {
        return listenerThread == Thread.currentThread() && !Thread.currentThread().isInterrupted();
    }

    private boolean pause(long millis) {
        try {
            Thread.sleep(millis);
            return true;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
