package com.controlplane.core.config;

import com.controlplane.core.session.InMemorySessionBackingStore;
import com.controlplane.core.session.JdbcSessionBackingStore;
import com.controlplane.core.session.SessionBackingStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;

/**
 * Chooses the session backing store and provides the scheduler that drives heartbeat and retry timers.
 * <p>
 * A JDBC store is used when a {@link DataSource} is available and eval mode is off; otherwise
 * sessions live in memory only. The DataSource is not looked up at all in eval mode, and
 * {@link InMemorySessionEnvironment} keeps Boot from creating one there.
 */
@Configuration
public class SessionStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionStoreConfig.class);

    @Bean
    public SessionBackingStore sessionBackingStore(ObjectProvider<DataSource> dataSources,
                                                   ControlPlaneProperties properties) throws SQLException {
        if (properties.isEvalMode()) {
            log.info("Eval mode enabled; using in-memory session store");
            return new InMemorySessionBackingStore();
        }
        DataSource dataSource = dataSources.getIfAvailable();
        if (dataSource == null) {
            log.info("No DataSource available; using in-memory session store (state will not persist across restarts)");
            return new InMemorySessionBackingStore();
        }
        log.info("Configuring JDBC session store (table '{}')", properties.getSessionTableName());
        var store = new JdbcSessionBackingStore(dataSource, properties.getSessionTableName());
        store.createTables();
        return store;
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService sessionScheduler() {
        // Non-daemon and prestarted: with no web server these threads keep the process alive.
        var scheduler = new ScheduledThreadPoolExecutor(2, r -> new Thread(r, "session-timer"));
        scheduler.prestartAllCoreThreads();
        return scheduler;
    }
}
